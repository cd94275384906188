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

package imcomp.lib.analysis.stats;

/**
 * Helper class for accumulating a mean from values as they are added.
 * <p>
 * This is useful when iterating through valid pixels or patches, where the values are 
 * not available as a single array.
 * NaN values are ignored. The mean is updated incrementally, 
 * see http://www.johndcook.com/standard_deviation.html
 */
public class RunningStatistics {

	private long size = 0;
	private double sum = 0;

	private double m1 = 0;

	/**
	 * Default constructor.
	 */
	public RunningStatistics() {}

	/**
	 * Add another value; NaN values are ignored.
	 * @param val
	 */
	public void addValue(double val) {
		if (Double.isNaN(val))
			return;
		size++;
		sum += val;
		if (size == 1)
			m1 = val;
		else if (Double.isFinite(val) && Double.isFinite(m1))
			m1 += (val - m1) / size;
		else
			m1 = sum / size;
	}

	/**
	 * Count of non-NaN values added.
	 * @return
	 */
	public long size() {
		return size;
	}

	/**
	 * Mean of all non-NaN values, or NaN if there are none.
	 * @return
	 */
	public double getMean() {
		return size == 0 ? Double.NaN : m1;
	}

	@Override
	public String toString() {
		return String.format("%s Mean: %.2f (n=%d)", RunningStatistics.class.getSimpleName(), getMean(), size);
	}

}
