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

package imcomp.lib.common;

import java.util.Locale;

/**
 * A collection of generally-useful static methods.
 */
public class GeneralTools {

	// Suppressed default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}

	/**
	 * Get the name without the final extension (if present).
	 * @param name
	 * @return
	 */
	public static String getNameWithoutExtension(String name) {
		int ind = name.lastIndexOf('.');
		if (ind <= 0)
			return name;
		return name.substring(0, ind);
	}

	/**
	 * Clip a value to be within a specific range.
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static double clipValue(final double value, final double min, final double max) {
		return value < min ? min : (value > max ? max : value);
	}

	/**
	 * Format a value for delimited text output, using {@link Locale#US} so that '.' is always the decimal separator.
	 * NaN and infinite values are written as {@code NaN}, {@code Infinity} and {@code -Infinity}.
	 * 
	 * @param value
	 * @param nDecimalPlaces maximum number of decimal places, or negative to use the full precision of {@link Double#toString(double)}
	 * @return
	 */
	public static String formatNumber(double value, int nDecimalPlaces) {
		if (Double.isNaN(value) || Double.isInfinite(value) || nDecimalPlaces < 0)
			return Double.toString(value);
		String s = String.format(Locale.US, "%." + nDecimalPlaces + "f", value);
		if (s.indexOf('.') >= 0) {
			int end = s.length();
			while (end > 0 && s.charAt(end - 1) == '0')
				end--;
			if (end > 0 && s.charAt(end - 1) == '.')
				end--;
			s = s.substring(0, end);
		}
		return s;
	}

}
