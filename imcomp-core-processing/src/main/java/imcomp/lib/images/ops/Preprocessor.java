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
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import imcomp.lib.images.ImageBuffer;

/**
 * Deterministic preprocessing pipeline applied to every image before measurement.
 * <p>
 * Steps are always applied in a fixed order, skipping any that are not requested:
 * <ol>
 *   <li>derive a validity mask from the alpha plane (or discard the alpha plane if alpha is ignored)</li>
 *   <li>greyscale reduction</li>
 *   <li>resize</li>
 *   <li>Gaussian blur</li>
 * </ol>
 * Resizing always happens before blurring, so that the blur sigma refers to pixels of the output image.
 * The gradient magnitude image is derived separately from the output, see {@link #gradient(ImageBuffer)}.
 */
public class Preprocessor {

	private static final Logger logger = LoggerFactory.getLogger(Preprocessor.class);

	private final boolean ignoreAlpha;
	private final GreyscaleMode greyscale;
	private final double resize;
	private final double blur;

	private final List<ImageBufferOp> ops;

	private Preprocessor(boolean ignoreAlpha, GreyscaleMode greyscale, double resize, double blur) {
		this.ignoreAlpha = ignoreAlpha;
		this.greyscale = greyscale;
		this.resize = resize;
		this.blur = blur;

		List<ImageBufferOp> list = new ArrayList<>();
		list.add(ignoreAlpha ? ImageBufferOps.Channels.ignoreAlpha() : ImageBufferOps.Channels.maskFromAlpha());
		if (greyscale != null)
			list.add(ImageBufferOps.Channels.greyscale(greyscale));
		if (isResizeRequested())
			list.add(ImageBufferOps.Core.resize(resize));
		if (blur > 0)
			list.add(ImageBufferOps.Filters.gaussianBlur(blur));
		this.ops = Collections.unmodifiableList(list);
	}

	/**
	 * Create a preprocessor.
	 *
	 * @param ignoreAlpha if true, discard any alpha plane rather than deriving a mask from it
	 * @param greyscale greyscale mode, or null to retain all channels
	 * @param resize scale factor, or NaN (or 1) to retain the original size
	 * @param blur Gaussian sigma applied after resizing, or 0 for no blur
	 * @return
	 */
	public static Preprocessor create(boolean ignoreAlpha, GreyscaleMode greyscale, double resize, double blur) {
		if (!Double.isNaN(resize) && !(resize > 0))
			throw new IllegalArgumentException("Resize factor must be > 0, but was " + resize);
		if (!(blur >= 0))
			throw new IllegalArgumentException("Blur sigma must be >= 0, but was " + blur);
		return new Preprocessor(ignoreAlpha, greyscale, resize, blur);
	}

	/**
	 * Returns true if a resize step is part of the pipeline.
	 * @return
	 */
	public boolean isResizeRequested() {
		return !Double.isNaN(resize) && resize != 1.0;
	}

	/**
	 * Apply all preprocessing steps.
	 * @param image
	 * @return the preprocessed image; this has no alpha plane
	 */
	public ImageBuffer apply(ImageBuffer image) {
		ImageBuffer output = image;
		for (var op : ops)
			output = op.apply(output);
		logger.debug("Preprocessed {} -> {}", image, output);
		return output;
	}

	/**
	 * Derive the gradient magnitude image from a (preprocessed) image.
	 * @param image
	 * @return
	 */
	public ImageBuffer gradient(ImageBuffer image) {
		return ImageBufferOps.Filters.gradientMagnitude().apply(image);
	}

	/**
	 * Get the operations applied by this preprocessor, in order.
	 * @return
	 */
	public List<ImageBufferOp> getOps() {
		return ops;
	}

	@Override
	public String toString() {
		return "Preprocessor [ignoreAlpha=" + ignoreAlpha + ", greyscale=" + greyscale + ", resize=" + resize + ", blur=" + blur + "]";
	}

}
