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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import imcomp.imagej.tools.IJTools;
import imcomp.lib.images.ImageBuffer;

/**
 * Create and use {@link ImageBufferOp} objects.
 * <p>
 * Operations are grouped by purpose: {@link Channels}, {@link Core} and {@link Filters}.
 */
public class ImageBufferOps {

	private static final Logger logger = LoggerFactory.getLogger(ImageBufferOps.class);

	private ImageBufferOps() {
		throw new AssertionError();
	}

	/**
	 * Operations that change the number or meaning of channels, or the validity mask.
	 */
	public static class Channels {

		/**
		 * Alpha value (on an 8-bit scale) that must be exceeded for a pixel to be valid.
		 * This is rescaled for images with a different nominal maximum.
		 */
		public static final double ALPHA_THRESHOLD = 128.0;

		/**
		 * Derive a validity mask from the alpha plane, then discard the alpha plane.
		 * Images without alpha are returned unchanged.
		 * @return
		 */
		public static ImageBufferOp maskFromAlpha() {
			return new MaskFromAlphaOp();
		}

		/**
		 * Discard any alpha plane without creating a mask.
		 * @return
		 */
		public static ImageBufferOp ignoreAlpha() {
			return ImageBuffer::withoutAlpha;
		}

		/**
		 * Reduce all channels to a single greyscale channel. The mask is unaffected.
		 * @param mode channel weighting
		 * @return
		 */
		public static ImageBufferOp greyscale(GreyscaleMode mode) {
			return new GreyscaleOp(mode);
		}

		static class MaskFromAlphaOp implements ImageBufferOp {

			@Override
			public ImageBuffer apply(ImageBuffer input) {
				if (!input.hasAlpha())
					return input;
				float[] alpha = input.getAlpha(true);
				double threshold = input.getMaxValue() * ALPHA_THRESHOLD / 255.0;
				boolean[] existing = input.getMask(true);
				boolean[] mask = new boolean[alpha.length];
				int nMasked = 0;
				for (int i = 0; i < alpha.length; i++) {
					mask[i] = alpha[i] > threshold && (existing == null || existing[i]);
					if (!mask[i])
						nMasked++;
				}
				logger.debug("Alpha mask excludes {} of {} pixels", nMasked, mask.length);
				return input.withMask(mask);
			}

		}

		static class GreyscaleOp implements ImageBufferOp {

			private final GreyscaleMode mode;

			GreyscaleOp(GreyscaleMode mode) {
				this.mode = Objects.requireNonNull(mode);
			}

			@Override
			public ImageBuffer apply(ImageBuffer input) {
				int nChannels = input.nChannels();
				if (nChannels == 1)
					return input;
				double[] weights = mode.getWeights(nChannels);
				int n = input.nPixels();
				float[] grey = new float[n];
				for (int c = 0; c < nChannels; c++) {
					float[] channel = input.getChannel(c, true);
					double w = weights[c];
					for (int i = 0; i < n; i++)
						grey[i] += (float)(channel[i] * w);
				}
				return input.withChannels(new float[][] {grey});
			}

			@Override
			public String toString() {
				return "Greyscale (" + mode + ")";
			}

		}

	}

	/**
	 * Core operations that change the image size or combine other operations.
	 */
	public static class Core {

		/**
		 * Resize an image by a scale factor, using bilinear interpolation (with averaging when downsizing).
		 * The mask is resized with nearest-neighbour interpolation.
		 * @param scale scale factor; 1 leaves the image unchanged
		 * @return
		 */
		public static ImageBufferOp resize(double scale) {
			return new ResizeOp(scale);
		}

		/**
		 * Apply several operations in sequence.
		 * @param ops
		 * @return
		 */
		public static ImageBufferOp sequential(ImageBufferOp... ops) {
			return sequential(Arrays.asList(ops));
		}

		/**
		 * Apply several operations in sequence.
		 * @param ops
		 * @return
		 */
		public static ImageBufferOp sequential(List<? extends ImageBufferOp> ops) {
			return new SequentialOp(ops);
		}

		/**
		 * Get the size of an image dimension after scaling, always at least 1.
		 * @param size
		 * @param scale
		 * @return
		 */
		public static int scaledSize(int size, double scale) {
			return Math.max(1, (int)Math.round(size * scale));
		}

		static class ResizeOp implements ImageBufferOp {

			private final double scale;

			ResizeOp(double scale) {
				if (!(scale > 0) || Double.isInfinite(scale))
					throw new IllegalArgumentException("Scale factor must be > 0, but was " + scale);
				this.scale = scale;
			}

			@Override
			public ImageBuffer apply(ImageBuffer input) {
				int w = scaledSize(input.getWidth(), scale);
				int h = scaledSize(input.getHeight(), scale);
				if (w == input.getWidth() && h == input.getHeight())
					return input;
				float[][] channels = new float[input.nChannels()][];
				for (int c = 0; c < channels.length; c++) {
					FloatProcessor fp = IJTools.convertToFloatProcessor(input, c);
					fp.setInterpolationMethod(ImageProcessor.BILINEAR);
					channels[c] = IJTools.getFloatPixels(fp.resize(w, h, true));
				}
				boolean[] mask = IJTools.resizeMask(input.getMask(true), input.getWidth(), input.getHeight(), w, h);
				float[] alpha = null;
				if (input.hasAlpha()) {
					FloatProcessor fpAlpha = new FloatProcessor(input.getWidth(), input.getHeight(), input.getAlpha(false));
					fpAlpha.setInterpolationMethod(ImageProcessor.NONE);
					alpha = IJTools.getFloatPixels(fpAlpha.resize(w, h));
				}
				logger.debug("Resized image from {}x{} to {}x{}", input.getWidth(), input.getHeight(), w, h);
				return ImageBuffer.create(channels, mask, alpha, w, h, input.getMaxValue());
			}

			@Override
			public String toString() {
				return "Resize (" + scale + ")";
			}

		}

		static class SequentialOp implements ImageBufferOp {

			private final List<ImageBufferOp> ops;

			SequentialOp(List<? extends ImageBufferOp> ops) {
				this.ops = Collections.unmodifiableList(new ArrayList<>(ops));
			}

			@Override
			public ImageBuffer apply(ImageBuffer input) {
				for (var op : ops)
					input = op.apply(input);
				return input;
			}

			@Override
			public String toString() {
				return "Sequential " + ops;
			}

		}

	}

	/**
	 * Filtering operations that retain the image size and number of channels.
	 */
	public static class Filters {

		/**
		 * Apply a Gaussian blur to each channel.
		 * @param sigma Gaussian standard deviation, in pixels; 0 leaves the image unchanged
		 * @return
		 */
		public static ImageBufferOp gaussianBlur(double sigma) {
			return new GaussianFilterOp(sigma);
		}

		/**
		 * Replace each channel by the Euclidean norm of its 2D spatial gradient.
		 * <p>
		 * Derivatives use central differences in the interior and one-sided differences at the borders.
		 * @return
		 */
		public static ImageBufferOp gradientMagnitude() {
			return new GradientMagnitudeOp();
		}

		static class GaussianFilterOp implements ImageBufferOp {

			private final double sigma;

			GaussianFilterOp(double sigma) {
				if (!(sigma >= 0) || Double.isInfinite(sigma))
					throw new IllegalArgumentException("Gaussian sigma must be >= 0, but was " + sigma);
				this.sigma = sigma;
			}

			@Override
			public ImageBuffer apply(ImageBuffer input) {
				if (sigma == 0)
					return input;
				float[][] channels = new float[input.nChannels()][];
				for (int c = 0; c < channels.length; c++) {
					FloatProcessor fp = IJTools.convertToFloatProcessor(input, c);
					fp.blurGaussian(sigma);
					channels[c] = IJTools.getFloatPixels(fp);
				}
				return input.withChannels(channels);
			}

			@Override
			public String toString() {
				return "Gaussian blur (sigma=" + sigma + ")";
			}

		}

		static class GradientMagnitudeOp implements ImageBufferOp {

			@Override
			public ImageBuffer apply(ImageBuffer input) {
				int w = input.getWidth();
				int h = input.getHeight();
				float[][] channels = new float[input.nChannels()][];
				for (int c = 0; c < channels.length; c++)
					channels[c] = gradientMagnitude(input.getChannel(c, true), w, h);
				return input.withChannels(channels);
			}

			static float[] gradientMagnitude(float[] pixels, int w, int h) {
				float[] output = new float[pixels.length];
				for (int y = 0; y < h; y++) {
					for (int x = 0; x < w; x++) {
						double gx = derivative(pixels, y * w, x, w, 1);
						double gy = derivative(pixels, x, y, h, w);
						output[y * w + x] = (float)Math.sqrt(gx * gx + gy * gy);
					}
				}
				return output;
			}

			/**
			 * Derivative along one axis, where {@code offset + i * step} gives the array index of the i-th sample.
			 */
			private static double derivative(float[] pixels, int offset, int i, int n, int step) {
				if (n < 2)
					return 0;
				if (i == 0)
					return pixels[offset + step] - pixels[offset];
				if (i == n - 1)
					return pixels[offset + i * step] - pixels[offset + (i - 1) * step];
				return (pixels[offset + (i + 1) * step] - pixels[offset + (i - 1) * step]) / 2.0;
			}

			@Override
			public String toString() {
				return "Gradient magnitude";
			}

		}

	}

}
