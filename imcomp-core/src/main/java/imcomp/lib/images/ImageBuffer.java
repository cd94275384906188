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

package imcomp.lib.images;

import java.util.Arrays;
import java.util.Objects;

/**
 * Normalized in-memory representation of a decoded image: one or more float channels, 
 * an optional per-pixel validity mask and (before masking) an optional raw alpha plane.
 * <p>
 * All planes are stored in row-major order and share the same width and height.
 * An {@code ImageBuffer} is immutable: transforms always create a new instance. 
 * Arrays returned with {@code direct = true} must therefore never be modified by the caller.
 * <p>
 * The nominal maximum value describes the range implied by the original bit depth 
 * (e.g. 255 for 8-bit images). It is used whenever values need to be discretized or normalized.
 */
public final class ImageBuffer {

	private final int width;
	private final int height;
	private final float[][] channels;
	private final boolean[] mask;
	private final float[] alpha;
	private final double maxValue;

	private ImageBuffer(int width, int height, float[][] channels, boolean[] mask, float[] alpha, double maxValue) {
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Image dimensions must be > 0, but were " + width + "x" + height);
		Objects.requireNonNull(channels, "Channels must not be null");
		if (channels.length == 0)
			throw new IllegalArgumentException("An image requires at least one channel");
		int n = width * height;
		for (int c = 0; c < channels.length; c++) {
			if (channels[c] == null || channels[c].length != n)
				throw new IllegalArgumentException("Channel " + c + " does not match image size " + width + "x" + height);
		}
		if (mask != null && mask.length != n)
			throw new IllegalArgumentException("Mask length " + mask.length + " does not match image size " + width + "x" + height);
		if (alpha != null && alpha.length != n)
			throw new IllegalArgumentException("Alpha length " + alpha.length + " does not match image size " + width + "x" + height);
		if (!(maxValue > 0))
			throw new IllegalArgumentException("Maximum value must be > 0, but was " + maxValue);
		this.width = width;
		this.height = height;
		this.channels = channels;
		this.mask = mask;
		this.alpha = alpha;
		this.maxValue = maxValue;
	}

	/**
	 * Create an image from channel arrays, without mask or alpha.
	 * The arrays are used directly and should not be modified afterwards.
	 * 
	 * @param channels channel planes, each of length {@code width * height}
	 * @param width
	 * @param height
	 * @param maxValue nominal maximum value (e.g. 255 for 8-bit data)
	 * @return
	 */
	public static ImageBuffer create(float[][] channels, int width, int height, double maxValue) {
		return new ImageBuffer(width, height, channels, null, null, maxValue);
	}

	/**
	 * Create an image from channel arrays, with an optional validity mask and alpha plane.
	 * 
	 * @param channels channel planes, each of length {@code width * height}
	 * @param mask validity mask (true = valid), or null if all pixels are valid
	 * @param alpha raw alpha plane, or null
	 * @param width
	 * @param height
	 * @param maxValue nominal maximum value (e.g. 255 for 8-bit data)
	 * @return
	 */
	public static ImageBuffer create(float[][] channels, boolean[] mask, float[] alpha, int width, int height, double maxValue) {
		return new ImageBuffer(width, height, channels, mask, alpha, maxValue);
	}

	/**
	 * Image width, in pixels.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Image height, in pixels.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Number of channels (excluding any alpha plane).
	 * @return
	 */
	public int nChannels() {
		return channels.length;
	}

	/**
	 * Total number of pixels per channel.
	 * @return
	 */
	public int nPixels() {
		return width * height;
	}

	/**
	 * Nominal maximum value for the image data.
	 * @return
	 */
	public double getMaxValue() {
		return maxValue;
	}

	/**
	 * Get the value of a single pixel.
	 * @param channel
	 * @param x
	 * @param y
	 * @return
	 */
	public float getValue(int channel, int x, int y) {
		return channels[channel][y * width + x];
	}

	/**
	 * Get the pixels for one channel.
	 * @param channel
	 * @param direct if true, return the backing array; this must not be modified
	 * @return
	 */
	public float[] getChannel(int channel, boolean direct) {
		return direct ? channels[channel] : channels[channel].clone();
	}

	/**
	 * Returns true if a validity mask is available.
	 * If not, all pixels are considered valid.
	 * @return
	 */
	public boolean hasMask() {
		return mask != null;
	}

	/**
	 * Query whether a pixel is valid according to the mask.
	 * @param x
	 * @param y
	 * @return
	 */
	public boolean isValid(int x, int y) {
		return mask == null || mask[y * width + x];
	}

	/**
	 * Query whether a pixel is valid according to the mask, using its row-major index.
	 * @param ind
	 * @return
	 */
	public boolean isValid(int ind) {
		return mask == null || mask[ind];
	}

	/**
	 * Get the validity mask.
	 * @param direct if true, return the backing array; this must not be modified
	 * @return the mask, or null if there is no mask
	 */
	public boolean[] getMask(boolean direct) {
		if (mask == null)
			return null;
		return direct ? mask : mask.clone();
	}

	/**
	 * Count the number of valid pixels.
	 * @return
	 */
	public int countValid() {
		if (mask == null)
			return nPixels();
		int n = 0;
		for (boolean b : mask) {
			if (b)
				n++;
		}
		return n;
	}

	/**
	 * Returns true if the image still carries a raw alpha plane.
	 * @return
	 */
	public boolean hasAlpha() {
		return alpha != null;
	}

	/**
	 * Get the raw alpha plane.
	 * @param direct if true, return the backing array; this must not be modified
	 * @return the alpha values, or null if there is no alpha plane
	 */
	public float[] getAlpha(boolean direct) {
		if (alpha == null)
			return null;
		return direct ? alpha : alpha.clone();
	}

	/**
	 * Create a new image with different channels, retaining the mask and alpha.
	 * @param channels
	 * @return
	 */
	public ImageBuffer withChannels(float[][] channels) {
		return new ImageBuffer(width, height, channels, mask, alpha, maxValue);
	}

	/**
	 * Create a new image with the same channels but a different mask, and no alpha plane.
	 * @param mask the new mask, or null to treat all pixels as valid
	 * @return
	 */
	public ImageBuffer withMask(boolean[] mask) {
		return new ImageBuffer(width, height, channels, mask, null, maxValue);
	}

	/**
	 * Create a new image with the same channels and mask, but no alpha plane.
	 * @return
	 */
	public ImageBuffer withoutAlpha() {
		if (alpha == null)
			return this;
		return new ImageBuffer(width, height, channels, mask, null, maxValue);
	}

	@Override
	public String toString() {
		return "ImageBuffer [" + width + "x" + height + ", channels=" + channels.length
				+ ", mask=" + (mask != null) + ", alpha=" + (alpha != null) + ", max=" + maxValue + "]";
	}

	@Override
	public int hashCode() {
		int result = Objects.hash(width, height, maxValue);
		result = 31 * result + Arrays.deepHashCode(channels);
		result = 31 * result + Arrays.hashCode(mask);
		return 31 * result + Arrays.hashCode(alpha);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ImageBuffer))
			return false;
		ImageBuffer other = (ImageBuffer)obj;
		return width == other.width && height == other.height && maxValue == other.maxValue
				&& Arrays.deepEquals(channels, other.channels)
				&& Arrays.equals(mask, other.mask)
				&& Arrays.equals(alpha, other.alpha);
	}

}
