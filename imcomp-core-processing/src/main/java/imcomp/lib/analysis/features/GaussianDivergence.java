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

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import imcomp.lib.analysis.stats.MomentSummary;

/**
 * Closed-form divergences between two multivariate Gaussian distributions.
 * <p>
 * Covariance matrices that are singular or close to it (e.g. from constant patches) are regularized 
 * by adding a ridge {@code lambda * max(1, trace/d) * I}, increasing lambda until a Cholesky 
 * decomposition succeeds.
 */
public enum GaussianDivergence {

	/**
	 * Symmetric Kullback-Leibler divergence, {@code KL(a||b) + KL(b||a)}.
	 */
	JEFFREYS {
		@Override
		public double compute(Gaussian a, Gaussian b) {
			return kl(a, b) + kl(b, a);
		}
	},

	/**
	 * Wasserstein-2 distance, 
	 * {@code sqrt(|mu_a - mu_b|^2 + tr(S_a + S_b - 2 (S_b^1/2 S_a S_b^1/2)^1/2))}.
	 */
	WASSERSTEIN {
		@Override
		public double compute(Gaussian a, Gaussian b) {
			RealVector diff = a.mean.subtract(b.mean);
			RealMatrix cross = symmetrize(b.sqrt.multiply(a.covariance).multiply(b.sqrt));
			double w2 = diff.dotProduct(diff) + a.covariance.getTrace() + b.covariance.getTrace()
					- 2 * sqrt(cross).getTrace();
			return Math.sqrt(Math.max(w2, 0));
		}
	},

	/**
	 * Squared Hellinger distance, {@code 1 - exp(-D_B)} where {@code D_B} is the Bhattacharyya distance.
	 */
	HELLINGER {
		@Override
		public double compute(Gaussian a, Gaussian b) {
			return -Math.expm1(-bhattacharyya(a, b));
		}
	},

	/**
	 * Bhattacharyya distance.
	 */
	BHATTACHARYYA {
		@Override
		public double compute(Gaussian a, Gaussian b) {
			return bhattacharyya(a, b);
		}
	},

	/**
	 * Forstner-Moonen (affine-invariant) distance between the covariance matrices, 
	 * {@code sqrt(sum_i ln^2 lambda_i)} over the generalized eigenvalues. Means are ignored.
	 */
	FORSTNER_MOONEN {
		@Override
		public double compute(Gaussian a, Gaussian b) {
			RealMatrix m = symmetrize(b.inverseSqrt.multiply(a.covariance).multiply(b.inverseSqrt));
			double sum = 0;
			for (double lambda : new EigenDecomposition(m).getRealEigenvalues()) {
				double log = Math.log(lambda);
				sum += log * log;
			}
			return Math.sqrt(sum);
		}
	},

	/**
	 * Kullback-Leibler divergence {@code KL(a||b)}. This is not symmetric.
	 */
	KL {
		@Override
		public double compute(Gaussian a, Gaussian b) {
			return kl(a, b);
		}

		@Override
		public boolean isSymmetric() {
			return false;
		}
	};

	private static final Logger logger = LoggerFactory.getLogger(GaussianDivergence.class);

	private static final int MAX_RIDGE_ATTEMPTS = 12;

	/**
	 * Compute the divergence between two prepared Gaussians.
	 * @param a
	 * @param b
	 * @return
	 */
	public abstract double compute(Gaussian a, Gaussian b);

	/**
	 * Compute the divergence between two moment summaries.
	 * @param a
	 * @param b
	 * @param ridge initial ridge used to regularize singular covariance matrices
	 * @return
	 */
	public double compute(MomentSummary a, MomentSummary b, double ridge) {
		return compute(prepare(a, ridge), prepare(b, ridge));
	}

	/**
	 * Returns true if {@code compute(a, b) == compute(b, a)} mathematically.
	 * @return
	 */
	public boolean isSymmetric() {
		return true;
	}

	/**
	 * Prepare a Gaussian from a moment summary, regularizing its covariance if needed.
	 * @param summary
	 * @param ridge initial ridge; increased by a factor of 10 until the covariance is positive definite
	 * @return
	 */
	public static Gaussian prepare(MomentSummary summary, double ridge) {
		return new Gaussian(summary.getMean(), summary.getCovariance(), ridge);
	}

	/**
	 * A Gaussian distribution with a positive definite covariance matrix and cached factorizations.
	 */
	public static class Gaussian {

		private final int dimension;
		private final RealVector mean;
		private final RealMatrix covariance;
		private final RealMatrix inverse;
		private final RealMatrix sqrt;
		private final RealMatrix inverseSqrt;
		private final double logDet;

		Gaussian(double[] mean, RealMatrix covariance, double ridge) {
			this.dimension = mean.length;
			this.mean = new ArrayRealVector(mean, false);
			CholeskyDecomposition cholesky = null;
			RealMatrix cov = covariance;
			double lambda = ridge;
			double scale = Math.max(1.0, covariance.getTrace() / dimension);
			for (int attempt = 0; attempt <= MAX_RIDGE_ATTEMPTS; attempt++) {
				try {
					cholesky = new CholeskyDecomposition(cov);
					break;
				} catch (NonPositiveDefiniteMatrixException | NonSymmetricMatrixException e) {
					if (attempt == MAX_RIDGE_ATTEMPTS)
						throw new IllegalArgumentException("Unable to regularize covariance matrix", e);
					cov = covariance.add(MatrixUtils.createRealIdentityMatrix(dimension).scalarMultiply(lambda * scale));
					logger.trace("Regularizing covariance with ridge {}", lambda * scale);
					lambda *= 10;
				}
			}
			this.covariance = cov;
			this.inverse = cholesky.getSolver().getInverse();
			double sumLog = 0;
			RealMatrix lower = cholesky.getL();
			for (int i = 0; i < dimension; i++)
				sumLog += Math.log(lower.getEntry(i, i));
			this.logDet = 2 * sumLog;

			EigenDecomposition eigen = new EigenDecomposition(symmetrize(cov));
			double[] values = eigen.getRealEigenvalues();
			double[] sqrtValues = new double[dimension];
			double[] invSqrtValues = new double[dimension];
			for (int i = 0; i < dimension; i++) {
				double v = Math.sqrt(Math.max(values[i], 0));
				sqrtValues[i] = v;
				invSqrtValues[i] = 1.0 / v;
			}
			RealMatrix vectors = eigen.getV();
			this.sqrt = vectors.multiply(MatrixUtils.createRealDiagonalMatrix(sqrtValues)).multiply(vectors.transpose());
			this.inverseSqrt = vectors.multiply(MatrixUtils.createRealDiagonalMatrix(invSqrtValues)).multiply(vectors.transpose());
		}

		/**
		 * Get the dimension.
		 * @return
		 */
		public int getDimension() {
			return dimension;
		}

		/**
		 * Get the (possibly regularized) covariance matrix.
		 * @return
		 */
		public RealMatrix getCovariance() {
			return covariance.copy();
		}

		/**
		 * Log determinant of the (possibly regularized) covariance matrix.
		 * @return
		 */
		public double getLogDeterminant() {
			return logDet;
		}

	}

	private static double kl(Gaussian a, Gaussian b) {
		checkDimensions(a, b);
		RealVector diff = b.mean.subtract(a.mean);
		double trace = b.inverse.multiply(a.covariance).getTrace();
		double mahalanobis = diff.dotProduct(b.inverse.operate(diff));
		return 0.5 * (trace + mahalanobis - a.dimension + b.logDet - a.logDet);
	}

	private static double bhattacharyya(Gaussian a, Gaussian b) {
		checkDimensions(a, b);
		RealMatrix avg = a.covariance.add(b.covariance).scalarMultiply(0.5);
		CholeskyDecomposition cholesky = new CholeskyDecomposition(symmetrize(avg));
		RealVector diff = a.mean.subtract(b.mean);
		double mahalanobis = diff.dotProduct(cholesky.getSolver().solve(diff));
		double logDetAvg = 2 * logDiagonalSum(cholesky.getL());
		return mahalanobis / 8.0 + 0.5 * (logDetAvg - 0.5 * (a.logDet + b.logDet));
	}

	private static double logDiagonalSum(RealMatrix m) {
		double sum = 0;
		for (int i = 0; i < m.getRowDimension(); i++)
			sum += Math.log(m.getEntry(i, i));
		return sum;
	}

	private static RealMatrix symmetrize(RealMatrix m) {
		return m.add(m.transpose()).scalarMultiply(0.5);
	}

	private static RealMatrix sqrt(RealMatrix symmetric) {
		EigenDecomposition eigen = new EigenDecomposition(symmetric);
		double[] values = eigen.getRealEigenvalues();
		double[] sqrtValues = new double[values.length];
		for (int i = 0; i < values.length; i++)
			sqrtValues[i] = Math.sqrt(Math.max(values[i], 0));
		RealMatrix vectors = eigen.getV();
		return vectors.multiply(MatrixUtils.createRealDiagonalMatrix(sqrtValues)).multiply(vectors.transpose());
	}

	private static void checkDimensions(Gaussian a, Gaussian b) {
		if (a.dimension != b.dimension)
			throw new IllegalArgumentException("Dimension mismatch: " + a.dimension + " vs " + b.dimension);
	}

}
