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

package imcomp.lib.regions;

import java.util.Objects;

/**
 * A rectangular tile of an image, used as the unit for local statistics.
 * <p>
 * A patch is valid only if no masked pixel falls inside it.
 * Invalid patches are retained by a {@link PatchGrid} (so that maps can be drawn), 
 * but are excluded from every measurement.
 */
public class Patch {

	private final int x;
	private final int y;
	private final int width;
	private final int height;
	private final boolean valid;

	Patch(final int x, final int y, final int width, final int height, final boolean valid) {
		this.x = x;
		this.y = y;
		this.width = width;
		this.height = height;
		this.valid = valid;
	}

	/**
	 * Create a patch from its bounding box and validity flag.
	 * @param x column offset
	 * @param y row offset
	 * @param width
	 * @param height
	 * @param valid
	 * @return
	 */
	public static Patch createInstance(final int x, final int y, final int width, final int height, final boolean valid) {
		if (width <= 0)
			throw new IllegalArgumentException("Width must be > 0! Requested width = " + width);
		if (height <= 0)
			throw new IllegalArgumentException("Height must be > 0! Requested height = " + height);
		return new Patch(x, y, width, height, valid);
	}

	/**
	 * Column offset of the patch.
	 * @return
	 */
	public int getX() {
		return x;
	}

	/**
	 * Row offset of the patch.
	 * @return
	 */
	public int getY() {
		return y;
	}

	/**
	 * Patch width.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Patch height.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Number of pixels inside the patch.
	 * @return
	 */
	public int nPixels() {
		return width * height;
	}

	/**
	 * Returns false if any pixel inside the patch is masked.
	 * @return
	 */
	public boolean isValid() {
		return valid;
	}

	@Override
	public String toString() {
		return "Patch: x=" + x + ", y=" + y + ", w=" + width + ", h=" + height + (valid ? "" : " (invalid)");
	}

	@Override
	public int hashCode() {
		return Objects.hash(x, y, width, height, valid);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Patch))
			return false;
		Patch other = (Patch)obj;
		return x == other.x && y == other.y && width == other.width && height == other.height && valid == other.valid;
	}

}
