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

import imcomp.lib.images.ImageBuffer;

/**
 * An operation that may be applied to an {@link ImageBuffer}.
 * <p>
 * This is intended to apply simple transforms to an image (e.g. masking, channel reduction, resizing, filtering), 
 * which may impact the number of channels and the image size.
 * Because an {@link ImageBuffer} is immutable, the input is never modified: a new image is returned 
 * unless the operation has no effect, in which case the input may be returned unchanged.
 * <p>
 * Operations may be chained with {@link ImageBufferOps.Core#sequential(ImageBufferOp...)}.
 */
@FunctionalInterface
public interface ImageBufferOp {

	/**
	 * Apply the operation to an image.
	 * @param input input image
	 * @return output image, which may be the same as the input image if the operation has no effect
	 */
	ImageBuffer apply(ImageBuffer input);

}
