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

package imcomp.lib.measurements;

import imcomp.lib.images.ImageBuffer;
import imcomp.lib.regions.PatchGrid;

/**
 * A named complexity measure, computed as a pure function of a preprocessed image.
 * <p>
 * Implementations must not modify the image and must be safe to call concurrently.
 * Degenerate inputs (e.g. no valid patches) should give NaN rather than an exception.
 */
@FunctionalInterface
public interface ComplexityMeasure {

	/**
	 * Compute the measure.
	 * 
	 * @param image the preprocessed image (or its gradient magnitude)
	 * @param grid patches of {@code image}, using the configured patch size, stride and boundary policy
	 * @param params measurement options
	 * @return the value, or NaN if undefined
	 */
	double compute(ImageBuffer image, PatchGrid grid, ComplexityParameters params);

}
