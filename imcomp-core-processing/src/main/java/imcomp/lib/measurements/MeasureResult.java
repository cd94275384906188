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

import java.util.Objects;

/**
 * The value of a single named measurement. The value may be NaN.
 */
public class MeasureResult {

	private final String name;
	private final double value;

	private MeasureResult(String name, double value) {
		this.name = Objects.requireNonNull(name);
		this.value = value;
	}

	/**
	 * Create a result.
	 * @param name column name
	 * @param value
	 * @return
	 */
	public static MeasureResult create(String name, double value) {
		return new MeasureResult(name, value);
	}

	public String getName() {
		return name;
	}

	public double getValue() {
		return value;
	}

	@Override
	public String toString() {
		return name + "=" + value;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, Double.doubleToLongBits(value));
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof MeasureResult))
			return false;
		MeasureResult other = (MeasureResult)obj;
		return name.equals(other.name) && Double.doubleToLongBits(value) == Double.doubleToLongBits(other.value);
	}

}
