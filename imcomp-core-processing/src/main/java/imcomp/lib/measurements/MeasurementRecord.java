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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * All measurement results for one image, in column order.
 */
public class MeasurementRecord {

	private final String imageId;
	private final List<MeasureResult> results;

	MeasurementRecord(String imageId, List<MeasureResult> results) {
		this.imageId = Objects.requireNonNull(imageId);
		this.results = Collections.unmodifiableList(new ArrayList<>(results));
	}

	/**
	 * Identifier of the image that was measured.
	 * @return
	 */
	public String getImageId() {
		return imageId;
	}

	/**
	 * Get the column names, in order.
	 * @return
	 */
	public List<String> getColumnNames() {
		List<String> names = new ArrayList<>(results.size());
		for (MeasureResult result : results)
			names.add(result.getName());
		return names;
	}

	/**
	 * Get the value of a named column.
	 * @param name
	 * @return the value, or NaN if there is no column with the name
	 */
	public double getValue(String name) {
		for (MeasureResult result : results) {
			if (result.getName().equals(name))
				return result.getValue();
		}
		return Double.NaN;
	}

	/**
	 * Returns true if the record contains a column with the given name.
	 * @param name
	 * @return
	 */
	public boolean containsColumn(String name) {
		for (MeasureResult result : results) {
			if (result.getName().equals(name))
				return true;
		}
		return false;
	}

	@Override
	public String toString() {
		return "MeasurementRecord [" + imageId + ", " + results + "]";
	}

}
