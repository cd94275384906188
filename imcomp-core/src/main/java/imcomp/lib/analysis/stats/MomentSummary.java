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

import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Empirical first and second moments (mean and covariance) of a set of vectors.
 * <p>
 * The summary also records the number of image channels that produced the vectors. 
 * When this is 1 (e.g. after greyscale reduction) any measure that would take a determinant 
 * uses the trace instead, and covariance differences reduce to absolute differences of variances. 
 * Encapsulating the rule here means that callers cannot get the degenerate case wrong.
 * 
 * @see CovarianceEstimator
 */
public class MomentSummary {

	private final double[] mean;
	private final RealMatrix covariance;
	private final int nChannels;
	private final int size;

	MomentSummary(double[] mean, RealMatrix covariance, int nChannels, int size) {
		this.mean = mean;
		this.covariance = covariance;
		this.nChannels = nChannels;
		this.size = size;
	}

	/**
	 * Dimensionality of the summarized vectors.
	 * @return
	 */
	public int getDimension() {
		return mean.length;
	}

	/**
	 * Number of vectors summarized.
	 * @return
	 */
	public int size() {
		return size;
	}

	/**
	 * Returns true if the vectors were derived from a single-channel image, 
	 * in which case the trace substitutes for the determinant.
	 * @return
	 */
	public boolean isScalarChannel() {
		return nChannels == 1;
	}

	/**
	 * Get the mean vector.
	 * @return a copy of the mean
	 */
	public double[] getMean() {
		return mean.clone();
	}

	/**
	 * Get a single element of the mean vector.
	 * @param i
	 * @return
	 */
	public double getMean(int i) {
		return mean[i];
	}

	/**
	 * Get the covariance matrix (biased, N-denominator estimate).
	 * @return a copy of the covariance matrix
	 */
	public RealMatrix getCovariance() {
		return covariance.copy();
	}

	/**
	 * Sum of the diagonal of the covariance matrix.
	 * For a 1x1 covariance this is simply the variance.
	 * @return
	 */
	public double getTrace() {
		return covariance.getTrace();
	}

	/**
	 * Determinant of the covariance matrix.
	 * @return
	 */
	public double getDeterminant() {
		if (getDimension() == 1)
			return covariance.getEntry(0, 0);
		return new LUDecomposition(covariance).getDeterminant();
	}

	/**
	 * Get the generalized variance: the trace for single-channel data, otherwise the determinant.
	 * @return
	 */
	public double getSpread() {
		return isScalarChannel() ? getTrace() : getDeterminant();
	}

	/**
	 * Get {@code log(spread + epsilon)}, where spread is the trace for single-channel data and the determinant otherwise.
	 * <p>
	 * With {@code epsilon == 0} this may legitimately return {@code -Infinity}, e.g. for a perfectly uniform image.
	 * For multichannel data with {@code epsilon == 0} the log-determinant is computed from the LU factors 
	 * to avoid overflow; a non-positive determinant (singular covariance) then gives {@code -Infinity}.
	 * 
	 * @param epsilon non-negative offset added before taking the logarithm
	 * @return
	 */
	public double logSpread(double epsilon) {
		if (isScalarChannel())
			return Math.log(getTrace() + epsilon);
		if (epsilon == 0)
			return logDeterminant();
		return Math.log(Math.max(getDeterminant(), 0) + epsilon);
	}

	private double logDeterminant() {
		RealMatrix upper = new LUDecomposition(covariance, 0).getU();
		double logDet = 0;
		int sign = 1;
		for (int i = 0; i < upper.getRowDimension(); i++) {
			double d = upper.getEntry(i, i);
			if (d == 0)
				return Double.NEGATIVE_INFINITY;
			if (d < 0)
				sign = -sign;
			logDet += Math.log(Math.abs(d));
		}
		// Negative determinants can only arise from rounding errors of a singular matrix
		return sign > 0 ? logDet : Double.NEGATIVE_INFINITY;
	}

	/**
	 * Euclidean distance between the means of two summaries.
	 * @param other
	 * @return
	 */
	public double meanDistance(MomentSummary other) {
		checkDimensions(other);
		double sum = 0;
		for (int i = 0; i < mean.length; i++) {
			double d = mean[i] - other.mean[i];
			sum += d * d;
		}
		return Math.sqrt(sum);
	}

	/**
	 * Distance between the covariance matrices of two summaries, {@code sqrt(sum(|C1 - C2|))}.
	 * <p>
	 * Note that this is not the Frobenius norm: absolute entries are summed before the square root.
	 * For 1x1 covariances the absolute difference of the variances is returned instead.
	 * 
	 * @param other
	 * @return
	 */
	public double covarianceDistance(MomentSummary other) {
		checkDimensions(other);
		int d = getDimension();
		if (d == 1)
			return Math.abs(covariance.getEntry(0, 0) - other.covariance.getEntry(0, 0));
		double sum = 0;
		for (int i = 0; i < d; i++) {
			for (int j = 0; j < d; j++)
				sum += Math.abs(covariance.getEntry(i, j) - other.covariance.getEntry(i, j));
		}
		return Math.sqrt(sum);
	}

	private void checkDimensions(MomentSummary other) {
		if (other.getDimension() != getDimension())
			throw new IllegalArgumentException("Dimension mismatch: " + getDimension() + " vs " + other.getDimension());
	}

	@Override
	public String toString() {
		return "MomentSummary [dimension=" + getDimension() + ", channels=" + nChannels + ", size=" + size + "]";
	}

}
