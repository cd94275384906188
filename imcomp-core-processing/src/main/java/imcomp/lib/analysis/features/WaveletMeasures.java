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
import java.util.List;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import imcomp.imagej.tools.IJTools;
import imcomp.lib.analysis.algorithms.HaarWavelet;
import imcomp.lib.images.ImageBuffer;

/**
 * Energy of the largest Haar wavelet detail coefficients.
 * <p>
 * Each channel is scaled to [0, 1] and decomposed over several levels. 
 * Where the image has a validity mask, the mask is resized to the shape of each level and eroded 
 * with a 5x5 square, and detail coefficients outside it are set to zero. 
 * For every channel and orientation (horizontal, vertical, diagonal) only coefficients whose magnitude 
 * reaches the {@code 1 - fraction} quantile of that orientation's magnitudes (pooled across levels) are kept.
 * The score is the sum of the kept magnitudes divided by the number of image pixels.
 */
public class WaveletMeasures {

	private static final Logger logger = LoggerFactory.getLogger(WaveletMeasures.class);

	/**
	 * Half-width of the square structuring element used to erode the mask at each level.
	 */
	static final int EROSION_RADIUS = 2;

	private WaveletMeasures() {
		throw new AssertionError();
	}

	/**
	 * Compute the DWT energy of an image.
	 * 
	 * @param image
	 * @param nLevels number of decomposition levels
	 * @param fraction fraction of coefficients to keep per channel and orientation, in (0, 1]
	 * @return
	 */
	public static double dwtEnergy(ImageBuffer image, int nLevels, double fraction) {
		if (nLevels < 1)
			throw new IllegalArgumentException("Number of levels must be >= 1, but was " + nLevels);
		if (!(fraction > 0 && fraction <= 1))
			throw new IllegalArgumentException("Coefficient fraction must be in (0, 1], but was " + fraction);
		int w = image.getWidth();
		int h = image.getHeight();
		double scale = image.getMaxValue();
		boolean[] mask = image.getMask(true);

		double total = 0;
		for (int c = 0; c < image.nChannels(); c++) {
			float[] channel = image.getChannel(c, true);
			double[] pixels = new double[channel.length];
			for (int i = 0; i < pixels.length; i++)
				pixels[i] = channel[i] / scale;

			HaarWavelet dwt = HaarWavelet.decompose(pixels, w, h, nLevels);
			List<double[]> horizontal = new ArrayList<>();
			List<double[]> vertical = new ArrayList<>();
			List<double[]> diagonal = new ArrayList<>();
			for (HaarWavelet.Level level : dwt.getLevels()) {
				double[] cH = level.getHorizontal().clone();
				double[] cV = level.getVertical().clone();
				double[] cD = level.getDiagonal().clone();
				if (mask != null) {
					boolean[] levelMask = erode(
							IJTools.resizeMask(mask, w, h, level.getWidth(), level.getHeight()),
							level.getWidth(), level.getHeight(), EROSION_RADIUS);
					applyMask(cH, levelMask);
					applyMask(cV, levelMask);
					applyMask(cD, levelMask);
				}
				horizontal.add(cH);
				vertical.add(cV);
				diagonal.add(cD);
			}
			total += sumLargest(horizontal, fraction);
			total += sumLargest(vertical, fraction);
			total += sumLargest(diagonal, fraction);
		}
		double score = total / ((double)w * h);
		logger.trace("DWT energy for {}: {}", image, score);
		return score;
	}

	/**
	 * Sum the magnitudes of coefficients at or above the {@code 1 - fraction} quantile of all magnitudes.
	 */
	static double sumLargest(List<double[]> coefficients, double fraction) {
		int n = 0;
		for (double[] arr : coefficients)
			n += arr.length;
		double[] magnitudes = new double[n];
		int ind = 0;
		for (double[] arr : coefficients) {
			for (double v : arr)
				magnitudes[ind++] = Math.abs(v);
		}
		double threshold = 0;
		if (fraction < 1) {
			// Linear interpolation between order statistics
			Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
			threshold = percentile.evaluate(magnitudes, 100.0 * (1.0 - fraction));
		}
		double sum = 0;
		for (double m : magnitudes) {
			if (m >= threshold)
				sum += m;
		}
		return sum;
	}

	private static void applyMask(double[] coefficients, boolean[] mask) {
		for (int i = 0; i < coefficients.length; i++) {
			if (!mask[i])
				coefficients[i] = 0;
		}
	}

	/**
	 * Binary erosion with a square structuring element of size {@code 2 * radius + 1}.
	 * Pixels outside the image are treated as invalid, so the border is always eroded.
	 * 
	 * @param mask
	 * @param width
	 * @param height
	 * @param radius
	 * @return
	 */
	static boolean[] erode(boolean[] mask, int width, int height, int radius) {
		// Separable: erode rows, then columns
		boolean[] rows = new boolean[mask.length];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++)
				rows[y * width + x] = allValid(mask, y * width, x, width, 1, radius);
		}
		boolean[] output = new boolean[mask.length];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++)
				output[y * width + x] = allValid(rows, x, y, height, width, radius);
		}
		return output;
	}

	private static boolean allValid(boolean[] mask, int offset, int i, int n, int step, int radius) {
		if (i - radius < 0 || i + radius >= n)
			return false;
		for (int j = i - radius; j <= i + radius; j++) {
			if (!mask[offset + j * step])
				return false;
		}
		return true;
	}

}
