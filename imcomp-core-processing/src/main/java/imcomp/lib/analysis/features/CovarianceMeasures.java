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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import imcomp.lib.analysis.stats.CovarianceEstimator;
import imcomp.lib.analysis.stats.MomentSummary;
import imcomp.lib.analysis.stats.RunningStatistics;
import imcomp.lib.regions.Patch;
import imcomp.lib.regions.PatchGrid;

/**
 * Log generalized variance of patches, either across patches (global) or within patches (local).
 * <p>
 * The choice between trace and determinant is delegated to {@link MomentSummary#logSpread(double)}.
 */
public class CovarianceMeasures {

	private static final Logger logger = LoggerFactory.getLogger(CovarianceMeasures.class);

	private CovarianceMeasures() {
		throw new AssertionError();
	}

	/**
	 * Log spread of the unfolded vectors of all valid patches, without any offset.
	 * This may be {@code -Infinity} for a uniform image.
	 * 
	 * @param grid
	 * @return the log spread, or NaN if there are no valid patches
	 */
	public static double globalPatchCovariance(PatchGrid grid) {
		MomentSummary summary = CovarianceEstimator.estimateUnfolded(grid);
		if (summary == null) {
			logger.debug("No valid patches for global patch covariance");
			return Double.NaN;
		}
		return summary.logSpread(0);
	}

	/**
	 * Mean over valid patches of {@code log(spread + epsilon)}, where spread is computed from the 
	 * patch's pixel vectors.
	 * 
	 * @param grid
	 * @param epsilon offset added before taking the logarithm
	 * @return the mean, or NaN if there are no valid patches
	 */
	public static double localPatchCovariance(PatchGrid grid, double epsilon) {
		if (grid.isEmpty()) {
			logger.debug("No valid patches for local patch covariance");
			return Double.NaN;
		}
		RunningStatistics stats = new RunningStatistics();
		for (Patch patch : grid)
			stats.addValue(CovarianceEstimator.estimatePixels(grid, patch).logSpread(epsilon));
		return stats.getMean();
	}

}
