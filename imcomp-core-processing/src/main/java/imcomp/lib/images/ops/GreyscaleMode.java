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

package imcomp.lib.images.ops;

import java.util.Arrays;

/**
 * Weighting used when reducing several channels to a single greyscale channel.
 */
public enum GreyscaleMode {

	/**
	 * Perceptual luminance weights for RGB images (0.2125 R + 0.7154 G + 0.0721 B).
	 * Only valid for 3-channel images.
	 */
	HUMAN(new double[] {0.2125, 0.7154, 0.0721}),

	/**
	 * Uniform average of all channels.
	 */
	AVG(null);

	private final double[] weights;

	GreyscaleMode(double[] weights) {
		this.weights = weights;
	}

	/**
	 * Get the channel weights for an image with the specified number of channels.
	 * @param nChannels
	 * @return
	 * @throws IllegalArgumentException if the mode does not support the number of channels
	 */
	public double[] getWeights(int nChannels) {
		if (weights == null) {
			double[] avg = new double[nChannels];
			Arrays.fill(avg, 1.0 / nChannels);
			return avg;
		}
		if (weights.length != nChannels)
			throw new IllegalArgumentException(this + " greyscale requires " + weights.length + " channels, but image has " + nChannels);
		return weights.clone();
	}

}
