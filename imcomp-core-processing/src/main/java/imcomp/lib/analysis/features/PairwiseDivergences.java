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

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import imcomp.lib.analysis.algorithms.OptimalTransport;
import imcomp.lib.analysis.stats.CovarianceEstimator;
import imcomp.lib.analysis.stats.MomentSummary;
import imcomp.lib.regions.Patch;
import imcomp.lib.regions.PatchGrid;

/**
 * Mean pairwise distances and divergences between the valid patches of a grid.
 * <p>
 * Every measure averages over the full cross product of patches, including each patch paired with itself, 
 * i.e. {@code (1 / n^2) * sum_i sum_j d(p_i, p_j)}.
 * Rows of the pair matrix are computed in parallel; the final sum is accumulated in a fixed order 
 * so that results do not depend on thread scheduling.
 */
public class PairwiseDivergences {

	private static final Logger logger = LoggerFactory.getLogger(PairwiseDivergences.class);

	private PairwiseDivergences() {
		throw new AssertionError();
	}

	/**
	 * A distance or divergence between two items, identified by index.
	 */
	@FunctionalInterface
	public interface PairFunction {

		/**
		 * Compute the value for the pair (i, j).
		 * @param i
		 * @param j
		 * @return
		 */
		double apply(int i, int j);

	}

	/**
	 * Average a pair function over the full {@code n x n} cross product.
	 * 
	 * @param n number of items
	 * @param fun the pair function
	 * @param symmetric if true, only pairs with {@code j >= i} are evaluated and off-diagonal values counted twice
	 * @return the mean, or NaN if {@code n == 0}
	 */
	public static double meanOverPairs(int n, PairFunction fun, boolean symmetric) {
		if (n == 0)
			return Double.NaN;
		double[] rowSums = new double[n];
		IntStream.range(0, n).parallel().forEach(i -> {
			double sum = 0;
			if (symmetric) {
				sum += fun.apply(i, i);
				for (int j = i + 1; j < n; j++)
					sum += 2 * fun.apply(i, j);
			} else {
				for (int j = 0; j < n; j++)
					sum += fun.apply(i, j);
			}
			rowSums[i] = sum;
		});
		double total = 0;
		for (double s : rowSums)
			total += s;
		return total / ((double)n * n);
	}

	/**
	 * Compute pixel moment summaries for all valid patches.
	 * @param grid
	 * @return
	 */
	public static List<MomentSummary> summarizePatches(PatchGrid grid) {
		List<MomentSummary> summaries = new ArrayList<>(grid.nValid());
		for (Patch patch : grid)
			summaries.add(CovarianceEstimator.estimatePixels(grid, patch));
		return summaries;
	}

	/**
	 * Mean Euclidean distance between patch mean vectors.
	 * @param grid
	 * @return the mean distance, or NaN if there are no valid patches
	 */
	public static double meanDistance(PatchGrid grid) {
		List<MomentSummary> summaries = summarizePatches(grid);
		if (summaries.isEmpty())
			return noPatches("mean distance");
		return meanOverPairs(summaries.size(), (i, j) -> summaries.get(i).meanDistance(summaries.get(j)), true);
	}

	/**
	 * Mean moment distance {@code gammaMean * |mu_i - mu_j| + gammaCovariance * d_C(C_i, C_j)}, 
	 * where {@code d_C} is {@link MomentSummary#covarianceDistance(MomentSummary)}.
	 * 
	 * @param grid
	 * @param gammaMean weight of the mean term
	 * @param gammaCovariance weight of the covariance term
	 * @return the mean distance, or NaN if there are no valid patches
	 */
	public static double momentDistance(PatchGrid grid, double gammaMean, double gammaCovariance) {
		List<MomentSummary> summaries = summarizePatches(grid);
		if (summaries.isEmpty())
			return noPatches("moment distance");
		return meanOverPairs(summaries.size(), (i, j) -> {
			MomentSummary a = summaries.get(i);
			MomentSummary b = summaries.get(j);
			return gammaMean * a.meanDistance(b) + gammaCovariance * a.covarianceDistance(b);
		}, true);
	}

	/**
	 * Mean Gaussian-assumption divergence between patches.
	 * 
	 * @param grid
	 * @param divergence the divergence
	 * @param ridge initial ridge for regularizing singular covariance matrices
	 * @return the mean divergence, or NaN if there are no valid patches
	 */
	public static double gaussianDivergence(PatchGrid grid, GaussianDivergence divergence, double ridge) {
		List<MomentSummary> summaries = summarizePatches(grid);
		if (summaries.isEmpty())
			return noPatches("Gaussian divergence");
		List<GaussianDivergence.Gaussian> gaussians = new ArrayList<>(summaries.size());
		for (MomentSummary summary : summaries)
			gaussians.add(GaussianDivergence.prepare(summary, ridge));
		return meanOverPairs(gaussians.size(), (i, j) -> divergence.compute(gaussians.get(i), gaussians.get(j)), divergence.isSymmetric());
	}

	/**
	 * Mean Wasserstein distance between coordinate-augmented patches.
	 * 
	 * @param grid
	 * @param transport the solver
	 * @param coordinateScale weight applied to normalized pixel coordinates
	 * @return the mean distance, or NaN if there are no valid patches
	 * @see PatchGrid#getPointCloud(Patch, double)
	 */
	public static double wasserstein(PatchGrid grid, OptimalTransport transport, double coordinateScale) {
		List<Patch> patches = grid.getValidPatches();
		if (patches.isEmpty())
			return noPatches("Wasserstein distance");
		List<double[][]> clouds = new ArrayList<>(patches.size());
		for (Patch patch : patches)
			clouds.add(grid.getPointCloud(patch, coordinateScale));
		logger.debug("Computing {} pairwise transport distances with {}", patches.size() * patches.size(), transport);
		return meanOverPairs(clouds.size(), (i, j) -> transport.distance(clouds.get(i), clouds.get(j)), true);
	}

	private static double noPatches(String name) {
		logger.debug("No valid patches for {}", name);
		return Double.NaN;
	}

}
