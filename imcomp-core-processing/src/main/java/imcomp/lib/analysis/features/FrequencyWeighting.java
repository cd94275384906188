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

package imcomp.lib.analysis.features;

/**
 * Weighting functions applied to 2D frequency coordinates, 
 * each giving the distance of a frequency from the zero-frequency origin.
 */
public enum FrequencyWeighting {

	/**
	 * {@code |u| + |v|}
	 */
	MANHATTAN {
		@Override
		public double weight(int u, int v) {
			return Math.abs(u) + Math.abs(v);
		}
	},

	/**
	 * {@code sqrt(u^2 + v^2)}
	 */
	EUCLIDEAN {
		@Override
		public double weight(int u, int v) {
			return Math.sqrt((double)u * u + (double)v * v);
		}
	},

	/**
	 * {@code max(|u|, |v|)}
	 */
	CHEBYSHEV {
		@Override
		public double weight(int u, int v) {
			return Math.max(Math.abs(u), Math.abs(v));
		}
	};

	/**
	 * Get the weight for a frequency.
	 * @param u signed horizontal frequency index
	 * @param v signed vertical frequency index
	 * @return
	 */
	public abstract double weight(int u, int v);

}
