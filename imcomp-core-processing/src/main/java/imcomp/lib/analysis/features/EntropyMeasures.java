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

package imcomp.lib.analysis.features;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import imcomp.lib.analysis.algorithms.KnnEntropyEstimator;
import imcomp.lib.analysis.stats.RunningStatistics;
import imcomp.lib.common.GeneralTools;
import imcomp.lib.images.ImageBuffer;
import imcomp.lib.regions.Patch;
import imcomp.lib.regions.PatchGrid;

/**
 * Discrete (Shannon) and differential (k-NN) entropy of pixel and patch distributions.
 * <p>
 * All entropies are in nats.
 * Discrete entropies use pixel values rounded to integer levels at the image's native bit depth, 
 * clipped to {@code [0, maxValue]}. For floating point images (nominal maximum of 1) values are 
 * scaled to 256 levels, and for images deeper than 16 bits they are scaled to 65536 levels.
 */
public class EntropyMeasures {

	private static final Logger logger = LoggerFactory.getLogger(EntropyMeasures.class);

	/**
	 * Number of levels used to discretize images with a nominal maximum of 1 or less.
	 */
	public static final int FLOAT_LEVELS = 256;

	/**
	 * Maximum number of levels used to discretize integer images.
	 */
	public static final int MAX_LEVELS = 65536;

	private EntropyMeasures() {
		throw new AssertionError();
	}

	/**
	 * Get the number of discrete levels available for an image.
	 * @param image
	 * @return
	 */
	public static int nLevels(ImageBuffer image) {
		double max = image.getMaxValue();
		if (max <= 1)
			return FLOAT_LEVELS;
		if (max >= MAX_LEVELS)
			return MAX_LEVELS;
		return (int)max + 1;
	}

	/**
	 * Values are used directly when there is one level per integer value, otherwise they are scaled to the levels.
	 */
	static int toLevel(double value, double maxValue, int nLevels) {
		double v = nLevels == maxValue + 1 ? value : value / maxValue * (nLevels - 1);
		return (int)GeneralTools.clipValue(Math.round(v), 0, nLevels - 1);
	}

	/**
	 * Shannon entropy of a histogram.
	 * @param counts
	 * @param total sum of all counts
	 * @return
	 */
	public static double entropy(int[] counts, long total) {
		if (total <= 0)
			return Double.NaN;
		double h = 0;
		for (int c : counts) {
			if (c == 0)
				continue;
			double p = (double)c / total;
			h -= p * Math.log(p);
		}
		// Avoid returning -0.0 for a single level
		return Math.max(h, 0);
	}

	/**
	 * Discrete entropy of the valid pixels in one channel.
	 * @param image
	 * @param channel
	 * @return the entropy, or NaN if there are no valid pixels
	 */
	public static double channelEntropy(ImageBuffer image, int channel) {
		int nLevels = nLevels(image);
		double max = image.getMaxValue();
		int[] counts = new int[nLevels];
		float[] pixels = image.getChannel(channel, true);
		long n = 0;
		for (int i = 0; i < pixels.length; i++) {
			if (!image.isValid(i))
				continue;
			counts[toLevel(pixels[i], max, nLevels)]++;
			n++;
		}
		return entropy(counts, n);
	}

	/**
	 * Discrete pixel entropy: per-channel entropy of all valid pixels, averaged across channels.
	 * @param image
	 * @return the mean entropy, or NaN if there are no valid pixels
	 */
	public static double discretePixelEntropy(ImageBuffer image) {
		if (image.countValid() == 0) {
			logger.debug("No valid pixels for discrete pixel entropy");
			return Double.NaN;
		}
		RunningStatistics stats = new RunningStatistics();
		for (int c = 0; c < image.nChannels(); c++)
			stats.addValue(channelEntropy(image, c));
		return stats.getMean();
	}

	/**
	 * Discrete entropy of the pixels of one channel within a patch.
	 * @param image
	 * @param patch
	 * @param channel
	 * @param counts histogram buffer of length {@link #nLevels(ImageBuffer)}; it is cleared before use
	 * @return
	 */
	static double patchEntropy(ImageBuffer image, Patch patch, int channel, int[] counts) {
		Arrays.fill(counts, 0);
		double max = image.getMaxValue();
		float[] pixels = image.getChannel(channel, true);
		int w = image.getWidth();
		for (int y = patch.getY(); y < patch.getY() + patch.getHeight(); y++) {
			for (int x = patch.getX(); x < patch.getX() + patch.getWidth(); x++)
				counts[toLevel(pixels[y * w + x], max, counts.length)]++;
		}
		return entropy(counts, patch.nPixels());
	}

	/**
	 * Discrete patch entropy: the entropy of each valid patch's pixels, averaged over patches 
	 * and then across channels.
	 * @param grid
	 * @return the mean entropy, or NaN if there are no valid patches
	 */
	public static double discretePatchEntropy(PatchGrid grid) {
		if (grid.isEmpty()) {
			logger.debug("No valid patches for discrete patch entropy");
			return Double.NaN;
		}
		ImageBuffer image = grid.getImage();
		int[] counts = new int[nLevels(image)];
		RunningStatistics channelStats = new RunningStatistics();
		for (int c = 0; c < image.nChannels(); c++) {
			RunningStatistics patchStats = new RunningStatistics();
			for (Patch patch : grid)
				patchStats.addValue(patchEntropy(image, patch, c, counts));
			channelStats.addValue(patchStats.getMean());
		}
		return channelStats.getMean();
	}

	/**
	 * Compute the discrete entropy of every patch in a grid, averaged across channels.
	 * <p>
	 * This is intended for visualization: overlapping grids (stride smaller than the patch size) give 
	 * a dense local entropy map.
	 * 
	 * @param grid
	 * @return one value per patch, in the order of {@link PatchGrid#getPatches()}; invalid patches give NaN
	 */
	public static double[] localEntropyMap(PatchGrid grid) {
		ImageBuffer image = grid.getImage();
		List<Patch> patches = grid.getPatches();
		int[] counts = new int[nLevels(image)];
		double[] values = new double[patches.size()];
		for (int i = 0; i < values.length; i++) {
			Patch patch = patches.get(i);
			if (!patch.isValid()) {
				values[i] = Double.NaN;
				continue;
			}
			double sum = 0;
			for (int c = 0; c < image.nChannels(); c++)
				sum += patchEntropy(image, patch, c, counts);
			values[i] = sum / image.nChannels();
		}
		return values;
	}

	/**
	 * Differential entropy of the joint distribution of valid pixel values, 
	 * treating each pixel as a point with one coordinate per channel.
	 * @param image
	 * @param estimator
	 * @return the entropy, or NaN if there are too few valid pixels
	 */
	public static double differentialPixelEntropy(ImageBuffer image, KnnEntropyEstimator estimator) {
		int nChannels = image.nChannels();
		float[][] channels = new float[nChannels][];
		for (int c = 0; c < nChannels; c++)
			channels[c] = image.getChannel(c, true);
		List<double[]> samples = new ArrayList<>(image.countValid());
		for (int i = 0; i < image.nPixels(); i++) {
			if (!image.isValid(i))
				continue;
			double[] v = new double[nChannels];
			for (int c = 0; c < nChannels; c++)
				v[c] = channels[c][i];
			samples.add(v);
		}
		return estimator.estimate(samples);
	}

	/**
	 * Differential entropy of the distribution of unfolded patch vectors.
	 * @param grid
	 * @param estimator
	 * @return the entropy, or NaN if there are too few valid patches
	 */
	public static double differentialPatchEntropy(PatchGrid grid, KnnEntropyEstimator estimator) {
		return estimator.estimate(grid.unfoldValid());
	}

}
