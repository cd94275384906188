/*-
 * #%L
 * This file is part of ImageComplexity.
 * %%
 * Copyright (C) 2024 ImageComplexity developers
 * %%
 * ImageComplexity is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * ImageComplexity is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with ImageComplexity.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package imcomp.lib.regions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import imcomp.lib.images.ImageBuffer;

/**
 * An ordered collection of {@link Patch} objects tiling an {@link ImageBuffer}.
 * <p>
 * Patches are generated in row-major order of their top-left corners. 
 * They are non-overlapping when the stride equals the patch size, and overlapping when it is smaller.
 * Patches never extend past the image bounds: boundary patches are either dropped or clipped, 
 * according to the {@link BoundaryPolicy}.
 */
public class PatchGrid implements Iterable<Patch> {

	private static final Logger logger = LoggerFactory.getLogger(PatchGrid.class);

	/**
	 * Policy for handling patches that would extend beyond the image boundary.
	 */
	public enum BoundaryPolicy {
		/**
		 * Discard incomplete patches.
		 */
		DROP,
		/**
		 * Keep incomplete patches, clipped to the image bounds.
		 */
		CLIP
	}

	private final ImageBuffer image;
	private final int patchSize;
	private final int stride;
	private final BoundaryPolicy policy;
	private final List<Patch> patches;
	private final List<Patch> validPatches;

	private PatchGrid(ImageBuffer image, int patchSize, int stride, BoundaryPolicy policy, List<Patch> patches) {
		this.image = image;
		this.patchSize = patchSize;
		this.stride = stride;
		this.policy = policy;
		this.patches = Collections.unmodifiableList(patches);
		this.validPatches = Collections.unmodifiableList(
				patches.stream().filter(Patch::isValid).collect(Collectors.toList()));
	}

	/**
	 * Decompose an image into non-overlapping square patches, dropping incomplete patches at the boundary.
	 * @param image
	 * @param patchSize
	 * @return
	 */
	public static PatchGrid decompose(ImageBuffer image, int patchSize) {
		return decompose(image, patchSize, patchSize, BoundaryPolicy.DROP);
	}

	/**
	 * Decompose an image into square patches.
	 * 
	 * @param image the image
	 * @param patchSize width and height of each patch
	 * @param stride spacing between the top-left corners of neighbouring patches; if &le; 0, the patch size is used
	 * @param policy how to handle patches that overlap the image boundary
	 * @return
	 */
	public static PatchGrid decompose(ImageBuffer image, int patchSize, int stride, BoundaryPolicy policy) {
		if (patchSize < 1)
			throw new IllegalArgumentException("Patch size must be >= 1, but was " + patchSize);
		if (stride <= 0)
			stride = patchSize;
		if (policy == null)
			policy = BoundaryPolicy.DROP;

		int w = image.getWidth();
		int h = image.getHeight();
		List<Patch> patches = new ArrayList<>();
		for (int y = 0; y < h; y += stride) {
			int ph = Math.min(patchSize, h - y);
			if (ph < patchSize && policy == BoundaryPolicy.DROP)
				break;
			for (int x = 0; x < w; x += stride) {
				int pw = Math.min(patchSize, w - x);
				if (pw < patchSize && policy == BoundaryPolicy.DROP)
					break;
				patches.add(new Patch(x, y, pw, ph, allValid(image, x, y, pw, ph)));
			}
		}
		var grid = new PatchGrid(image, patchSize, stride, policy, patches);
		if (grid.nValid() < patches.size())
			logger.debug("{} of {} patches excluded by mask", patches.size() - grid.nValid(), patches.size());
		return grid;
	}

	private static boolean allValid(ImageBuffer image, int x, int y, int w, int h) {
		if (!image.hasMask())
			return true;
		for (int yy = y; yy < y + h; yy++) {
			for (int xx = x; xx < x + w; xx++) {
				if (!image.isValid(xx, yy))
					return false;
			}
		}
		return true;
	}

	/**
	 * Get a grid containing only the full-size patches of this grid, as if it had been created with 
	 * {@link BoundaryPolicy#DROP}.
	 * <p>
	 * Measures that compare unfolded patch vectors require this, since clipped patches unfold to shorter vectors.
	 * @return this grid if it already uses {@link BoundaryPolicy#DROP}, otherwise a new grid
	 */
	public PatchGrid dropIncomplete() {
		if (policy == BoundaryPolicy.DROP)
			return this;
		List<Patch> complete = patches.stream()
				.filter(p -> p.getWidth() == patchSize && p.getHeight() == patchSize)
				.collect(Collectors.toList());
		logger.trace("Dropping {} clipped patches", patches.size() - complete.size());
		return new PatchGrid(image, patchSize, stride, BoundaryPolicy.DROP, complete);
	}

	/**
	 * The image that was decomposed.
	 * @return
	 */
	public ImageBuffer getImage() {
		return image;
	}

	/**
	 * Requested patch size.
	 * @return
	 */
	public int getPatchSize() {
		return patchSize;
	}

	/**
	 * Spacing between neighbouring patches.
	 * @return
	 */
	public int getStride() {
		return stride;
	}

	/**
	 * Boundary policy used when the grid was created.
	 * @return
	 */
	public BoundaryPolicy getBoundaryPolicy() {
		return policy;
	}

	/**
	 * All patches, including invalid ones.
	 * @return an unmodifiable list
	 */
	public List<Patch> getPatches() {
		return patches;
	}

	/**
	 * Patches that contain no masked pixels.
	 * @return an unmodifiable list
	 */
	public List<Patch> getValidPatches() {
		return validPatches;
	}

	/**
	 * Number of valid patches.
	 * @return
	 */
	public int nValid() {
		return validPatches.size();
	}

	/**
	 * Returns true if there are no valid patches, in which case patch-based measurements are undefined.
	 * @return
	 */
	public boolean isEmpty() {
		return validPatches.isEmpty();
	}

	/**
	 * Iterate over the valid patches.
	 */
	@Override
	public Iterator<Patch> iterator() {
		return validPatches.iterator();
	}

	/**
	 * Flatten all pixel values of a patch into one vector, in channel-major then row-major order.
	 * @param patch
	 * @return a vector of length {@code nChannels * patch.nPixels()}
	 */
	public double[] unfold(Patch patch) {
		int nChannels = image.nChannels();
		int n = patch.nPixels();
		double[] vector = new double[nChannels * n];
		int w = image.getWidth();
		int ind = 0;
		for (int c = 0; c < nChannels; c++) {
			float[] channel = image.getChannel(c, true);
			for (int y = patch.getY(); y < patch.getY() + patch.getHeight(); y++) {
				int offset = y * w;
				for (int x = patch.getX(); x < patch.getX() + patch.getWidth(); x++)
					vector[ind++] = channel[offset + x];
			}
		}
		return vector;
	}

	/**
	 * Unfold all valid patches.
	 * @return
	 * @see #unfold(Patch)
	 */
	public List<double[]> unfoldValid() {
		List<double[]> vectors = new ArrayList<>(validPatches.size());
		for (Patch patch : validPatches)
			vectors.add(unfold(patch));
		return vectors;
	}

	/**
	 * Get the pixel values of a patch as one vector per pixel, with one entry per channel.
	 * @param patch
	 * @return pixel vectors in row-major order
	 */
	public List<double[]> getPixelVectors(Patch patch) {
		int nChannels = image.nChannels();
		int w = image.getWidth();
		List<double[]> vectors = new ArrayList<>(patch.nPixels());
		for (int y = patch.getY(); y < patch.getY() + patch.getHeight(); y++) {
			for (int x = patch.getX(); x < patch.getX() + patch.getWidth(); x++) {
				double[] v = new double[nChannels];
				int ind = y * w + x;
				for (int c = 0; c < nChannels; c++)
					v[c] = image.getChannel(c, true)[ind];
				vectors.add(v);
			}
		}
		return vectors;
	}

	/**
	 * Get a patch as a coordinate-augmented point cloud, with one point per pixel.
	 * <p>
	 * Each point is {@code [row * scale, col * scale, v_1 / max, ..., v_C / max]}, where 
	 * row and column are normalized to [0, 1] within the patch's local frame 
	 * and values are divided by the image's nominal maximum.
	 * 
	 * @param patch
	 * @param coordinateScale weight applied to the normalized coordinates
	 * @return an array of {@code patch.nPixels()} points, each of length {@code nChannels + 2}
	 */
	public double[][] getPointCloud(Patch patch, double coordinateScale) {
		int nChannels = image.nChannels();
		int w = image.getWidth();
		double maxValue = image.getMaxValue();
		double rowScale = patch.getHeight() > 1 ? coordinateScale / (patch.getHeight() - 1) : 0;
		double colScale = patch.getWidth() > 1 ? coordinateScale / (patch.getWidth() - 1) : 0;
		double[][] points = new double[patch.nPixels()][nChannels + 2];
		int i = 0;
		for (int r = 0; r < patch.getHeight(); r++) {
			for (int col = 0; col < patch.getWidth(); col++) {
				double[] p = points[i++];
				p[0] = r * rowScale;
				p[1] = col * colScale;
				int ind = (patch.getY() + r) * w + patch.getX() + col;
				for (int c = 0; c < nChannels; c++)
					p[c + 2] = image.getChannel(c, true)[ind] / maxValue;
			}
		}
		return points;
	}

	@Override
	public String toString() {
		return "PatchGrid [size=" + patchSize + ", stride=" + stride + ", policy=" + policy
				+ ", patches=" + patches.size() + ", valid=" + validPatches.size() + "]";
	}

}
