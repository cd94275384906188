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
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import imcomp.lib.analysis.features.FrequencyWeighting;
import imcomp.lib.analysis.features.GaussianDivergence;
import imcomp.lib.common.ThreadTools;
import imcomp.lib.images.ops.GreyscaleMode;
import imcomp.lib.io.GsonTools;
import imcomp.lib.regions.PatchGrid.BoundaryPolicy;

/**
 * Immutable set of options controlling preprocessing and measurement.
 * <p>
 * Instances are created with a {@link Builder} or read from JSON using {@link #fromJson(String)}. 
 * JSON keys use the field names below; the snake_case command line option names 
 * (e.g. {@code patch_size}, {@code use_grad_too}) are accepted as alternatives.
 * Any option not given takes its default value.
 */
public class ComplexityParameters {

	private boolean mspec = false;

	private GreyscaleMode greyscale = null;

	private double resize = Double.NaN;

	private double blur = 0;

	@SerializedName(value = "ignoreAlpha", alternate = {"ignore_alpha"})
	private boolean ignoreAlpha = false;

	@SerializedName(value = "useGradOnly", alternate = {"use_grad_only"})
	private boolean useGradOnly = false;

	@SerializedName(value = "useGradToo", alternate = {"use_grad_too"})
	private boolean useGradToo = false;

	private List<String> measures = null;

	@SerializedName(value = "patchSize", alternate = {"patch_size"})
	private int patchSize = 8;

	private int stride = 0;

	private BoundaryPolicy boundaryPolicy = BoundaryPolicy.DROP;

	@SerializedName(value = "gammaMean", alternate = {"gamma_mu"})
	private double gammaMean = 1.0;

	@SerializedName(value = "gammaCovariance", alternate = {"gamma_cov"})
	private double gammaCovariance = 1.0;

	private GaussianDivergence gaussianDivergence = GaussianDivergence.JEFFREYS;

	@SerializedName(value = "useSinkhorn", alternate = {"sinkhorn"})
	private boolean useSinkhorn = false;

	@SerializedName(value = "sinkhornRegularization", alternate = {"sinkhorn_reg"})
	private double sinkhornRegularization = 0.05;

	private int sinkhornMaxIterations = 1000;

	private double sinkhornTolerance = 1e-9;

	@SerializedName(value = "wassersteinOrder", alternate = {"wasserstein_p"})
	private double wassersteinOrder = 2.0;

	@SerializedName(value = "wassersteinDownscale", alternate = {"wasserstein_downscale"})
	private double wassersteinDownscale = 1.0;

	private double coordinateScale = 1.0;

	@SerializedName(value = "dwtLevels", alternate = {"dwt_levels"})
	private int dwtLevels = 4;

	@SerializedName(value = "dwtFraction", alternate = {"dwt_fraction"})
	private double dwtFraction = 0.01;

	private FrequencyWeighting frequencyWeighting = FrequencyWeighting.MANHATTAN;

	private int knnK = 3;

	private int entropyMaxSamples = 10_000;

	private double entropyNoise = 1e-10;

	private long seed = 42L;

	private double localCovarianceEpsilon = 1.0;

	private double ridge = 1e-6;

	private int nThreads = 0;

	private ComplexityParameters() {}

	private ComplexityParameters(ComplexityParameters params) {
		this.mspec = params.mspec;
		this.greyscale = params.greyscale;
		this.resize = params.resize;
		this.blur = params.blur;
		this.ignoreAlpha = params.ignoreAlpha;
		this.useGradOnly = params.useGradOnly;
		this.useGradToo = params.useGradToo;
		this.measures = params.measures == null ? null : Collections.unmodifiableList(new ArrayList<>(params.measures));
		this.patchSize = params.patchSize;
		this.stride = params.stride;
		this.boundaryPolicy = params.boundaryPolicy;
		this.gammaMean = params.gammaMean;
		this.gammaCovariance = params.gammaCovariance;
		this.gaussianDivergence = params.gaussianDivergence;
		this.useSinkhorn = params.useSinkhorn;
		this.sinkhornRegularization = params.sinkhornRegularization;
		this.sinkhornMaxIterations = params.sinkhornMaxIterations;
		this.sinkhornTolerance = params.sinkhornTolerance;
		this.wassersteinOrder = params.wassersteinOrder;
		this.wassersteinDownscale = params.wassersteinDownscale;
		this.coordinateScale = params.coordinateScale;
		this.dwtLevels = params.dwtLevels;
		this.dwtFraction = params.dwtFraction;
		this.frequencyWeighting = params.frequencyWeighting;
		this.knnK = params.knnK;
		this.entropyMaxSamples = params.entropyMaxSamples;
		this.entropyNoise = params.entropyNoise;
		this.seed = params.seed;
		this.localCovarianceEpsilon = params.localCovarianceEpsilon;
		this.ridge = params.ridge;
		this.nThreads = params.nThreads;
	}

	/**
	 * Get the default parameters.
	 * @return
	 */
	public static ComplexityParameters getDefault() {
		return new ComplexityParameters();
	}

	/**
	 * Create a new builder, initialized with default values.
	 * @return
	 */
	public static Builder builder() {
		return new Builder(new ComplexityParameters());
	}

	/**
	 * Create a new builder initialized with the values of these parameters.
	 * @return
	 */
	public Builder toBuilder() {
		return new Builder(new ComplexityParameters(this));
	}

	/**
	 * Read parameters from JSON and validate them.
	 * @param json
	 * @return
	 * @throws ConfigurationException if the JSON cannot be parsed or the values are invalid
	 */
	public static ComplexityParameters fromJson(String json) throws ConfigurationException {
		ComplexityParameters params;
		try {
			params = GsonTools.getInstance().fromJson(json, ComplexityParameters.class);
		} catch (JsonParseException e) {
			throw new ConfigurationException("Unable to parse parameters: " + e.getLocalizedMessage(), e);
		}
		if (params == null)
			params = new ComplexityParameters();
		// Ensure the measure list is immutable
		params = new ComplexityParameters(params);
		params.validate();
		return params;
	}

	/**
	 * Write these parameters as JSON.
	 * @return
	 */
	public String toJson() {
		return GsonTools.getInstance(true).toJson(this);
	}

	/**
	 * Check that all values are in range and consistent.
	 * @throws ConfigurationException if any value is invalid
	 */
	public void validate() throws ConfigurationException {
		if (!(blur >= 0) || Double.isInfinite(blur))
			throw new ConfigurationException("Blur sigma must be >= 0, but was " + blur);
		if (!Double.isNaN(resize) && (!(resize > 0) || Double.isInfinite(resize)))
			throw new ConfigurationException("Resize factor must be > 0, but was " + resize);
		if (patchSize < 1)
			throw new ConfigurationException("Patch size must be >= 1, but was " + patchSize);
		if (stride < 0)
			throw new ConfigurationException("Stride must be >= 0, but was " + stride);
		if (boundaryPolicy == null)
			throw new ConfigurationException("Boundary policy must not be null");
		if (!(gammaMean >= 0) || !(gammaCovariance >= 0))
			throw new ConfigurationException("Moment distance weights must be >= 0, but were " + gammaMean + " and " + gammaCovariance);
		if (gaussianDivergence == null)
			throw new ConfigurationException("Gaussian divergence must not be null");
		if (!(sinkhornRegularization > 0))
			throw new ConfigurationException("Sinkhorn regularization must be > 0, but was " + sinkhornRegularization);
		if (sinkhornMaxIterations < 1)
			throw new ConfigurationException("Sinkhorn iterations must be >= 1, but was " + sinkhornMaxIterations);
		if (!(sinkhornTolerance > 0))
			throw new ConfigurationException("Sinkhorn tolerance must be > 0, but was " + sinkhornTolerance);
		if (!(wassersteinOrder >= 1) || Double.isInfinite(wassersteinOrder))
			throw new ConfigurationException("Wasserstein order must be >= 1, but was " + wassersteinOrder);
		if (!(wassersteinDownscale > 0) || Double.isInfinite(wassersteinDownscale))
			throw new ConfigurationException("Wasserstein downscale must be > 0, but was " + wassersteinDownscale);
		if (!(coordinateScale >= 0))
			throw new ConfigurationException("Coordinate scale must be >= 0, but was " + coordinateScale);
		if (dwtLevels < 1)
			throw new ConfigurationException("DWT levels must be >= 1, but was " + dwtLevels);
		if (!(dwtFraction > 0 && dwtFraction <= 1))
			throw new ConfigurationException("DWT coefficient fraction must be in (0, 1], but was " + dwtFraction);
		if (frequencyWeighting == null)
			throw new ConfigurationException("Frequency weighting must not be null");
		if (knnK < 1)
			throw new ConfigurationException("k for nearest neighbours must be >= 1, but was " + knnK);
		if (!(entropyNoise >= 0))
			throw new ConfigurationException("Entropy noise must be >= 0, but was " + entropyNoise);
		if (!(localCovarianceEpsilon >= 0))
			throw new ConfigurationException("Local covariance epsilon must be >= 0, but was " + localCovarianceEpsilon);
		if (!(ridge > 0))
			throw new ConfigurationException("Ridge must be > 0, but was " + ridge);
		if (nThreads < 0)
			throw new ConfigurationException("Number of threads must be >= 0, but was " + nThreads);
		if (mspec && greyscale == GreyscaleMode.HUMAN)
			throw new ConfigurationException("HUMAN greyscale weighting requires RGB images and cannot be combined with mspec");
	}

	/**
	 * Returns true if images may have any number of channels, rather than 1 or 3.
	 * @return
	 */
	public boolean isMultispectral() {
		return mspec;
	}

	/**
	 * Get the greyscale mode, or null if channels should be retained.
	 * @return
	 */
	public GreyscaleMode getGreyscale() {
		return greyscale;
	}

	/**
	 * Get the resize factor, or NaN if images should not be resized.
	 * @return
	 */
	public double getResize() {
		return resize;
	}

	/**
	 * Returns true if a resize factor has been set.
	 * @return
	 */
	public boolean isResizeSet() {
		return !Double.isNaN(resize);
	}

	/**
	 * Gaussian blur sigma, applied after resizing.
	 * @return
	 */
	public double getBlur() {
		return blur;
	}

	/**
	 * Returns true if the alpha channel should be ignored rather than used as a mask.
	 * @return
	 */
	public boolean isIgnoreAlpha() {
		return ignoreAlpha;
	}

	/**
	 * Returns true if measures should be computed on the gradient image only.
	 * @return
	 */
	public boolean isUseGradOnly() {
		return useGradOnly;
	}

	/**
	 * Returns true if measures should be computed on both the original and gradient images.
	 * @return
	 */
	public boolean isUseGradToo() {
		return useGradToo;
	}

	/**
	 * Get the names of the requested measures, or null if all available measures are requested.
	 * @return
	 */
	public List<String> getMeasures() {
		return measures;
	}

	/**
	 * Patch width and height, in pixels.
	 * @return
	 */
	public int getPatchSize() {
		return patchSize;
	}

	/**
	 * Patch stride, or 0 to use the patch size (non-overlapping patches).
	 * @return
	 */
	public int getStride() {
		return stride;
	}

	public BoundaryPolicy getBoundaryPolicy() {
		return boundaryPolicy;
	}

	public double getGammaMean() {
		return gammaMean;
	}

	public double getGammaCovariance() {
		return gammaCovariance;
	}

	public GaussianDivergence getGaussianDivergence() {
		return gaussianDivergence;
	}

	public boolean isUseSinkhorn() {
		return useSinkhorn;
	}

	public double getSinkhornRegularization() {
		return sinkhornRegularization;
	}

	public int getSinkhornMaxIterations() {
		return sinkhornMaxIterations;
	}

	public double getSinkhornTolerance() {
		return sinkhornTolerance;
	}

	public double getWassersteinOrder() {
		return wassersteinOrder;
	}

	/**
	 * Scale factor applied to images before computing the Wasserstein measure only.
	 * This is ignored whenever a resize factor is set.
	 * @return
	 */
	public double getWassersteinDownscale() {
		return wassersteinDownscale;
	}

	public double getCoordinateScale() {
		return coordinateScale;
	}

	public int getDwtLevels() {
		return dwtLevels;
	}

	public double getDwtFraction() {
		return dwtFraction;
	}

	public FrequencyWeighting getFrequencyWeighting() {
		return frequencyWeighting;
	}

	public int getKnnK() {
		return knnK;
	}

	public int getEntropyMaxSamples() {
		return entropyMaxSamples;
	}

	public double getEntropyNoise() {
		return entropyNoise;
	}

	public long getSeed() {
		return seed;
	}

	public double getLocalCovarianceEpsilon() {
		return localCovarianceEpsilon;
	}

	public double getRidge() {
		return ridge;
	}

	/**
	 * Number of threads for batch processing; 0 means use the default parallelism.
	 * @return
	 */
	public int getNumThreads() {
		return nThreads;
	}

	/**
	 * Get the number of threads to use, resolving 0 to the default parallelism.
	 * @return
	 */
	public int resolveNumThreads() {
		return nThreads > 0 ? nThreads : ThreadTools.getParallelism();
	}

	@Override
	public String toString() {
		return "ComplexityParameters " + GsonTools.getInstance().toJson(this);
	}

	/**
	 * Builder for {@link ComplexityParameters}.
	 */
	public static class Builder {

		private final ComplexityParameters params;

		private Builder(ComplexityParameters params) {
			this.params = params;
		}

		/**
		 * Allow any number of channels.
		 * @param mspec
		 * @return this builder
		 */
		public Builder multispectral(boolean mspec) {
			params.mspec = mspec;
			return this;
		}

		/**
		 * Reduce images to a single channel.
		 * @param mode the weighting, or null to retain all channels
		 * @return this builder
		 */
		public Builder greyscale(GreyscaleMode mode) {
			params.greyscale = mode;
			return this;
		}

		/**
		 * Resize images by a scale factor before blurring.
		 * @param resize the scale factor, or NaN to leave images unchanged
		 * @return this builder
		 */
		public Builder resize(double resize) {
			params.resize = resize;
			return this;
		}

		public Builder blur(double sigma) {
			params.blur = sigma;
			return this;
		}

		public Builder ignoreAlpha(boolean ignoreAlpha) {
			params.ignoreAlpha = ignoreAlpha;
			return this;
		}

		public Builder useGradOnly(boolean useGradOnly) {
			params.useGradOnly = useGradOnly;
			return this;
		}

		public Builder useGradToo(boolean useGradToo) {
			params.useGradToo = useGradToo;
			return this;
		}

		/**
		 * Set the names of the measures to compute.
		 * @param names measure names, or null to compute all available measures
		 * @return this builder
		 */
		public Builder measures(Collection<String> names) {
			params.measures = names == null ? null : Collections.unmodifiableList(new ArrayList<>(names));
			return this;
		}

		/**
		 * Set the names of the measures to compute.
		 * @param names
		 * @return this builder
		 */
		public Builder measures(String... names) {
			return measures(List.of(names));
		}

		public Builder patchSize(int patchSize) {
			params.patchSize = patchSize;
			return this;
		}

		public Builder stride(int stride) {
			params.stride = stride;
			return this;
		}

		public Builder boundaryPolicy(BoundaryPolicy policy) {
			params.boundaryPolicy = policy;
			return this;
		}

		/**
		 * Set the weights of the mean and covariance terms of the moment distance.
		 * @param gammaMean
		 * @param gammaCovariance
		 * @return this builder
		 */
		public Builder momentWeights(double gammaMean, double gammaCovariance) {
			params.gammaMean = gammaMean;
			params.gammaCovariance = gammaCovariance;
			return this;
		}

		public Builder gaussianDivergence(GaussianDivergence divergence) {
			params.gaussianDivergence = divergence;
			return this;
		}

		/**
		 * Use the Sinkhorn approximation rather than exact optimal transport.
		 * @param useSinkhorn
		 * @return this builder
		 */
		public Builder useSinkhorn(boolean useSinkhorn) {
			params.useSinkhorn = useSinkhorn;
			return this;
		}

		public Builder sinkhornRegularization(double regularization) {
			params.sinkhornRegularization = regularization;
			return this;
		}

		public Builder sinkhornMaxIterations(int maxIterations) {
			params.sinkhornMaxIterations = maxIterations;
			return this;
		}

		public Builder sinkhornTolerance(double tolerance) {
			params.sinkhornTolerance = tolerance;
			return this;
		}

		public Builder wassersteinOrder(double order) {
			params.wassersteinOrder = order;
			return this;
		}

		public Builder wassersteinDownscale(double downscale) {
			params.wassersteinDownscale = downscale;
			return this;
		}

		public Builder coordinateScale(double scale) {
			params.coordinateScale = scale;
			return this;
		}

		public Builder dwtLevels(int levels) {
			params.dwtLevels = levels;
			return this;
		}

		public Builder dwtFraction(double fraction) {
			params.dwtFraction = fraction;
			return this;
		}

		public Builder frequencyWeighting(FrequencyWeighting weighting) {
			params.frequencyWeighting = weighting;
			return this;
		}

		public Builder knnK(int k) {
			params.knnK = k;
			return this;
		}

		public Builder entropyMaxSamples(int maxSamples) {
			params.entropyMaxSamples = maxSamples;
			return this;
		}

		public Builder entropyNoise(double noise) {
			params.entropyNoise = noise;
			return this;
		}

		public Builder seed(long seed) {
			params.seed = seed;
			return this;
		}

		public Builder localCovarianceEpsilon(double epsilon) {
			params.localCovarianceEpsilon = epsilon;
			return this;
		}

		public Builder ridge(double ridge) {
			params.ridge = ridge;
			return this;
		}

		public Builder nThreads(int nThreads) {
			params.nThreads = nThreads;
			return this;
		}

		/**
		 * Build and validate the parameters.
		 * @return
		 * @throws ConfigurationException if any value is invalid
		 */
		public ComplexityParameters build() throws ConfigurationException {
			ComplexityParameters output = new ComplexityParameters(params);
			output.validate();
			return output;
		}

	}

}
