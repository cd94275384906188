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

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import imcomp.lib.analysis.algorithms.FourierTransforms;
import imcomp.lib.analysis.stats.RunningStatistics;
import imcomp.lib.images.ImageBuffer;

/**
 * Frequency-weighted Fourier energy.
 * <p>
 * The log-magnitude spectrum {@code log(1 + |F(u, v)|)} is averaged across channels and then 
 * summarized as a weighted mean, where each frequency is weighted by its distance from the origin. 
 * Images dominated by fine detail therefore score higher than smooth images.
 * 
 * @see WaveletMeasures
 */
public class SpectralMeasures {

	private static final Logger logger = LoggerFactory.getLogger(SpectralMeasures.class);

	private static final AtomicBoolean weightingWarningLogged = new AtomicBoolean(false);

	private SpectralMeasures() {
		throw new AssertionError();
	}

	/**
	 * Compute the frequency-weighted Fourier energy of an image.
	 * <p>
	 * Masked pixels are replaced by the mean of the valid pixels in the same channel before transforming.
	 * 
	 * @param image
	 * @param weighting distance function applied to the signed frequency indices
	 * @return the weighted mean log-magnitude, or NaN if there are no valid pixels or all weights are zero
	 */
	public static double fourierWeightedEnergy(ImageBuffer image, FrequencyWeighting weighting) {
		if (weightingWarningLogged.compareAndSet(false, true))
			logger.warn("Fourier energy uses {} frequency weighting; the weighting function is configurable (MANHATTAN, EUCLIDEAN, CHEBYSHEV) "
					+ "because its published definition differs between revisions", weighting);

		if (image.countValid() == 0) {
			logger.debug("No valid pixels for Fourier energy");
			return Double.NaN;
		}
		int w = image.getWidth();
		int h = image.getHeight();
		int nChannels = image.nChannels();
		double[] spectrum = new double[w * h];
		for (int c = 0; c < nChannels; c++) {
			double[] pixels = fillMasked(image, c);
			double[] magnitude = FourierTransforms.magnitude2D(pixels, w, h);
			for (int i = 0; i < spectrum.length; i++)
				spectrum[i] += Math.log1p(magnitude[i]) / nChannels;
		}

		double sum = 0;
		double sumWeights = 0;
		for (int y = 0; y < h; y++) {
			int v = FourierTransforms.signedFrequency(y, h);
			for (int x = 0; x < w; x++) {
				int u = FourierTransforms.signedFrequency(x, w);
				double weight = weighting.weight(u, v);
				sum += weight * spectrum[y * w + x];
				sumWeights += weight;
			}
		}
		if (sumWeights == 0) {
			logger.debug("Fourier weights sum to zero for {}x{} image", w, h);
			return Double.NaN;
		}
		return sum / sumWeights;
	}

	/**
	 * Get the pixels of one channel, with masked pixels replaced by the mean valid value.
	 */
	static double[] fillMasked(ImageBuffer image, int channel) {
		float[] pixels = image.getChannel(channel, true);
		double[] output = new double[pixels.length];
		if (!image.hasMask()) {
			for (int i = 0; i < pixels.length; i++)
				output[i] = pixels[i];
			return output;
		}
		RunningStatistics stats = new RunningStatistics();
		for (int i = 0; i < pixels.length; i++) {
			if (image.isValid(i))
				stats.addValue(pixels[i]);
		}
		double fill = stats.getMean();
		for (int i = 0; i < pixels.length; i++)
			output[i] = image.isValid(i) ? pixels[i] : fill;
		return output;
	}

}
