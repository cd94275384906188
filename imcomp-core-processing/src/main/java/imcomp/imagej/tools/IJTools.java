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

package imcomp.imagej.tools;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import imcomp.lib.images.ImageBuffer;

/**
 * Collection of static methods to help convert between {@link ImageBuffer} planes and ImageJ processors.
 */
public class IJTools {

	private IJTools() {
		throw new AssertionError();
	}

	/**
	 * Create a {@link FloatProcessor} for one channel of an image.
	 * The pixels are always duplicated, so the processor may be modified freely.
	 * 
	 * @param img
	 * @param channel
	 * @return
	 */
	public static FloatProcessor convertToFloatProcessor(ImageBuffer img, int channel) {
		return new FloatProcessor(img.getWidth(), img.getHeight(), img.getChannel(channel, false));
	}

	/**
	 * Extract the pixels of a processor as a float array.
	 * @param ip
	 * @return the pixel array (not duplicated if the processor is already a {@link FloatProcessor})
	 */
	public static float[] getFloatPixels(ImageProcessor ip) {
		if (ip instanceof FloatProcessor)
			return (float[])ip.getPixels();
		return (float[])ip.convertToFloatProcessor().getPixels();
	}

	/**
	 * Create a binary {@link ByteProcessor} from a validity mask, with 255 for valid pixels and 0 otherwise.
	 * @param mask
	 * @param width
	 * @param height
	 * @return
	 */
	public static ByteProcessor convertToByteProcessor(boolean[] mask, int width, int height) {
		byte[] pixels = new byte[width * height];
		for (int i = 0; i < pixels.length; i++) {
			if (mask[i])
				pixels[i] = (byte)255;
		}
		return new ByteProcessor(width, height, pixels);
	}

	/**
	 * Create a validity mask from a processor, treating all non-zero pixels as valid.
	 * @param ip
	 * @return
	 */
	public static boolean[] convertToMask(ImageProcessor ip) {
		int n = ip.getWidth() * ip.getHeight();
		boolean[] mask = new boolean[n];
		for (int i = 0; i < n; i++)
			mask[i] = ip.getf(i) != 0;
		return mask;
	}

	/**
	 * Resize a validity mask using nearest-neighbour interpolation.
	 * @param mask the mask, or null
	 * @param width current width
	 * @param height current height
	 * @param newWidth
	 * @param newHeight
	 * @return the resized mask, or null if the input mask is null
	 */
	public static boolean[] resizeMask(boolean[] mask, int width, int height, int newWidth, int newHeight) {
		if (mask == null)
			return null;
		if (width == newWidth && height == newHeight)
			return mask.clone();
		ByteProcessor bp = convertToByteProcessor(mask, width, height);
		bp.setInterpolationMethod(ImageProcessor.NONE);
		return convertToMask(bp.resize(newWidth, newHeight));
	}

}
