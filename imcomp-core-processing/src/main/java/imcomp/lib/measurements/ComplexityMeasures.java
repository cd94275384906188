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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import imcomp.lib.analysis.algorithms.KnnEntropyEstimator;
import imcomp.lib.analysis.algorithms.OptimalTransport;
import imcomp.lib.analysis.features.CovarianceMeasures;
import imcomp.lib.analysis.features.EntropyMeasures;
import imcomp.lib.analysis.features.PairwiseDivergences;
import imcomp.lib.analysis.features.SpectralMeasures;
import imcomp.lib.analysis.features.WaveletMeasures;
import imcomp.lib.images.ImageBuffer;
import imcomp.lib.images.ops.ImageBufferOps;
import imcomp.lib.regions.PatchGrid;

/**
 * Registry of the available complexity measures, keyed by the column name used in the output.
 */
public class ComplexityMeasures {

	private static final Logger logger = LoggerFactory.getLogger(ComplexityMeasures.class);

	public static final String DISCRETE_PIXEL_ENTROPY = "discrete_pixel_entropy";
	public static final String DISCRETE_PATCH_ENTROPY = "discrete_patch_entropy";
	public static final String DIFFERENTIAL_PIXEL_ENTROPY = "differential_pixel_entropy";
	public static final String DIFFERENTIAL_PATCH_ENTROPY = "differential_patch_entropy";
	public static final String GLOBAL_PATCH_COVARIANCE = "global_patch_covariance";
	public static final String LOCAL_PATCH_COVARIANCE = "local_patch_covariance";
	public static final String FOURIER_WEIGHTED_ENERGY = "fourier_weighted_energy";
	public static final String DWT_ENERGY = "dwt_energy";
	public static final String PAIRWISE_MEAN_DISTANCE = "pairwise_mean_distance";
	public static final String PAIRWISE_MOMENT_DISTANCE = "pairwise_moment_distance";
	public static final String PAIRWISE_GAUSSIAN_DIVERGENCE = "pairwise_gaussian_divergence";
	public static final String PATCH_WASSERSTEIN = "patch_wasserstein";

	/**
	 * Suffix appended to a measure name for the value computed on the gradient magnitude image.
	 */
	public static final String GRADIENT_SUFFIX = "_grad";

	private static final Map<String, ComplexityMeasure> DEFAULT_MEASURES;

	static {
		// Measures on unfolded patch vectors always drop clipped boundary patches
		Map<String, ComplexityMeasure> map = new LinkedHashMap<>();
		map.put(DISCRETE_PIXEL_ENTROPY, (image, grid, params) -> EntropyMeasures.discretePixelEntropy(image));
		map.put(DISCRETE_PATCH_ENTROPY, (image, grid, params) -> EntropyMeasures.discretePatchEntropy(grid));
		map.put(DIFFERENTIAL_PIXEL_ENTROPY, (image, grid, params) -> EntropyMeasures.differentialPixelEntropy(image, createEntropyEstimator(params)));
		map.put(DIFFERENTIAL_PATCH_ENTROPY, (image, grid, params) -> EntropyMeasures.differentialPatchEntropy(grid.dropIncomplete(), createEntropyEstimator(params)));
		map.put(GLOBAL_PATCH_COVARIANCE, (image, grid, params) -> CovarianceMeasures.globalPatchCovariance(grid.dropIncomplete()));
		map.put(LOCAL_PATCH_COVARIANCE, (image, grid, params) -> CovarianceMeasures.localPatchCovariance(grid, params.getLocalCovarianceEpsilon()));
		map.put(FOURIER_WEIGHTED_ENERGY, (image, grid, params) -> SpectralMeasures.fourierWeightedEnergy(image, params.getFrequencyWeighting()));
		map.put(DWT_ENERGY, (image, grid, params) -> WaveletMeasures.dwtEnergy(image, params.getDwtLevels(), params.getDwtFraction()));
		map.put(PAIRWISE_MEAN_DISTANCE, (image, grid, params) -> PairwiseDivergences.meanDistance(grid));
		map.put(PAIRWISE_MOMENT_DISTANCE, (image, grid, params) -> PairwiseDivergences.momentDistance(grid, params.getGammaMean(), params.getGammaCovariance()));
		map.put(PAIRWISE_GAUSSIAN_DIVERGENCE, (image, grid, params) -> PairwiseDivergences.gaussianDivergence(grid, params.getGaussianDivergence(), params.getRidge()));
		map.put(PATCH_WASSERSTEIN, ComplexityMeasures::patchWasserstein);
		DEFAULT_MEASURES = Collections.unmodifiableMap(map);
	}

	private ComplexityMeasures() {
		throw new AssertionError();
	}

	/**
	 * Get all default measures, in their standard column order.
	 * @return
	 */
	public static Map<String, ComplexityMeasure> getDefaultMeasures() {
		return DEFAULT_MEASURES;
	}

	/**
	 * Get the names of all default measures.
	 * @return
	 */
	public static List<String> getNames() {
		return new ArrayList<>(DEFAULT_MEASURES.keySet());
	}

	/**
	 * Create the k-NN entropy estimator for the given parameters.
	 * @param params
	 * @return
	 */
	public static KnnEntropyEstimator createEntropyEstimator(ComplexityParameters params) {
		return new KnnEntropyEstimator(params.getKnnK(), params.getEntropyMaxSamples(), params.getEntropyNoise(), params.getSeed());
	}

	/**
	 * Create the optimal transport solver for the given parameters.
	 * @param params
	 * @return
	 */
	public static OptimalTransport createTransport(ComplexityParameters params) {
		if (params.isUseSinkhorn())
			return OptimalTransport.createSinkhorn(params.getWassersteinOrder(), params.getSinkhornRegularization(),
					params.getSinkhornMaxIterations(), params.getSinkhornTolerance());
		return OptimalTransport.createExact(params.getWassersteinOrder());
	}

	/**
	 * Wasserstein measure, applying the transport-specific downscaling unless a global resize is set.
	 */
	static double patchWasserstein(ImageBuffer image, PatchGrid grid, ComplexityParameters params) {
		double downscale = params.getWassersteinDownscale();
		if (downscale != 1.0 && !params.isResizeSet()) {
			ImageBuffer scaled = ImageBufferOps.Core.resize(downscale).apply(image);
			grid = PatchGrid.decompose(scaled, params.getPatchSize(), params.getStride(), params.getBoundaryPolicy());
			logger.debug("Wasserstein measure using {} after downscaling by {}", grid, downscale);
		}
		return PairwiseDivergences.wasserstein(grid, createTransport(params), params.getCoordinateScale());
	}

}
