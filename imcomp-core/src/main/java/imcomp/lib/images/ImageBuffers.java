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

import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;
import java.awt.image.IndexColorModel;
import java.awt.image.WritableRaster;
import java.util.Arrays;

/**
 * Static methods for creating {@link ImageBuffer ImageBuffers}.
 */
public class ImageBuffers {

	private ImageBuffers() {
		throw new AssertionError();
	}

	/**
	 * Create a single-channel image from a 2D array, indexed as {@code values[row][column]}.
	 * 
	 * @param values
	 * @param maxValue nominal maximum value
	 * @return
	 */
	public static ImageBuffer fromArray(double[][] values, double maxValue) {
		return fromArrays(new double[][][] {values}, maxValue);
	}

	/**
	 * Create a multichannel image from 2D arrays, indexed as {@code values[channel][row][column]}.
	 * 
	 * @param values
	 * @param maxValue nominal maximum value
	 * @return
	 */
	public static ImageBuffer fromArrays(double[][][] values, double maxValue) {
		int height = values[0].length;
		int width = values[0][0].length;
		float[][] channels = new float[values.length][width * height];
		for (int c = 0; c < values.length; c++) {
			if (values[c].length != height)
				throw new IllegalArgumentException("Channel " + c + " has " + values[c].length + " rows, expected " + height);
			for (int y = 0; y < height; y++) {
				if (values[c][y].length != width)
					throw new IllegalArgumentException("Row " + y + " of channel " + c + " has " + values[c][y].length + " columns, expected " + width);
				for (int x = 0; x < width; x++)
					channels[c][y * width + x] = (float)values[c][y][x];
			}
		}
		return ImageBuffer.create(channels, width, height, maxValue);
	}

	/**
	 * Create an image with every pixel set to the same value.
	 * @param width
	 * @param height
	 * @param nChannels
	 * @param value
	 * @param maxValue
	 * @return
	 */
	public static ImageBuffer createConstant(int width, int height, int nChannels, float value, double maxValue) {
		float[][] channels = new float[nChannels][width * height];
		for (float[] channel : channels)
			Arrays.fill(channel, value);
		return ImageBuffer.create(channels, width, height, maxValue);
	}

	/**
	 * Convert a decoded {@link BufferedImage} to an {@link ImageBuffer}.
	 * <p>
	 * Colour bands become channels; if the color model has an alpha band, its values are 
	 * retained as the alpha plane so that a validity mask can be derived later.
	 * The nominal maximum value is derived from the bit depth of the first band (or 1 for floating point data).
	 * <p>
	 * Images with an indexed color model are expanded to 8-bit RGB (or ARGB, if the palette has transparency) 
	 * so that channels hold colour values rather than palette indices.
	 * 
	 * @param img
	 * @return
	 */
	public static ImageBuffer fromBufferedImage(BufferedImage img) {
		if (img.getColorModel() instanceof IndexColorModel) {
			var icm = (IndexColorModel)img.getColorModel();
			img = icm.convertToIntDiscrete(img.getRaster(), icm.hasAlpha());
		}
		WritableRaster raster = img.getRaster();
		int w = img.getWidth();
		int h = img.getHeight();
		int nBands = raster.getNumBands();
		boolean hasAlpha = img.getColorModel() != null && img.getColorModel().hasAlpha();
		int nChannels = hasAlpha ? nBands - 1 : nBands;
		if (nChannels < 1)
			throw new IllegalArgumentException("Image has no colour channels");

		float[][] channels = new float[nChannels][];
		for (int b = 0; b < nChannels; b++)
			channels[b] = raster.getSamples(0, 0, w, h, b, (float[])null);
		float[] alpha = hasAlpha ? raster.getSamples(0, 0, w, h, nBands - 1, (float[])null) : null;

		return ImageBuffer.create(channels, null, alpha, w, h, getMaxValue(raster));
	}

	static double getMaxValue(WritableRaster raster) {
		int dataType = raster.getDataBuffer().getDataType();
		switch (dataType) {
		case DataBuffer.TYPE_FLOAT:
		case DataBuffer.TYPE_DOUBLE:
			return 1.0;
		default:
			int bits = raster.getSampleModel().getSampleSize(0);
			return Math.pow(2, bits) - 1;
		}
	}

}
