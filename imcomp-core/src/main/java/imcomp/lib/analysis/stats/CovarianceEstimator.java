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

import java.util.Collection;
import java.util.List;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;

import imcomp.lib.regions.Patch;
import imcomp.lib.regions.PatchGrid;

/**
 * Static methods for estimating the empirical mean and covariance of a set of vectors.
 * <p>
 * The standard biased estimator is used, i.e. the covariance is normalized by N rather than N-1. 
 * This ensures that a single vector gives a zero (rather than undefined) covariance, 
 * and that the result is always symmetric positive semi-definite.
 */
public class CovarianceEstimator {

	private CovarianceEstimator() {
		throw new AssertionError();
	}

	/**
	 * Estimate the mean and covariance of a collection of vectors.
	 * 
	 * @param vectors the vectors, which must all have the same length
	 * @param nChannels number of image channels that generated the vectors
	 * @return
	 * @throws IllegalArgumentException if the collection is empty or the vector lengths differ
	 */
	public static MomentSummary estimate(Collection<double[]> vectors, int nChannels) {
		if (vectors.isEmpty())
			throw new IllegalArgumentException("Cannot estimate moments from an empty collection");
		int d = vectors.iterator().next().length;
		int n = vectors.size();

		double[] mean = new double[d];
		for (double[] v : vectors) {
			if (v.length != d)
				throw new IllegalArgumentException("Vector length " + v.length + " does not match " + d);
			for (int i = 0; i < d; i++)
				mean[i] += v[i];
		}
		for (int i = 0; i < d; i++)
			mean[i] /= n;

		double[][] cov = new double[d][d];
		double[] diff = new double[d];
		for (double[] v : vectors) {
			for (int i = 0; i < d; i++)
				diff[i] = v[i] - mean[i];
			for (int i = 0; i < d; i++) {
				double di = diff[i];
				if (di == 0)
					continue;
				double[] row = cov[i];
				for (int j = i; j < d; j++)
					row[j] += di * diff[j];
			}
		}
		for (int i = 0; i < d; i++) {
			for (int j = i; j < d; j++) {
				double val = cov[i][j] / n;
				cov[i][j] = val;
				cov[j][i] = val;
			}
		}
		return new MomentSummary(mean, new Array2DRowRealMatrix(cov, false), nChannels, n);
	}

	/**
	 * Estimate the moments of the pixel values within a single patch, treating each pixel as a 
	 * vector with one entry per channel.
	 * 
	 * @param grid
	 * @param patch
	 * @return
	 */
	public static MomentSummary estimatePixels(PatchGrid grid, Patch patch) {
		return estimate(grid.getPixelVectors(patch), grid.getImage().nChannels());
	}

	/**
	 * Estimate the moments of the unfolded vectors of all valid patches in a grid.
	 * 
	 * @param grid
	 * @return the summary, or null if the grid contains no valid patches
	 */
	public static MomentSummary estimateUnfolded(PatchGrid grid) {
		List<double[]> vectors = grid.unfoldValid();
		if (vectors.isEmpty())
			return null;
		return estimate(vectors, grid.getImage().nChannels());
	}

}
