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

package imcomp.lib.analysis.algorithms;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.LinearConstraintSet;
import org.apache.commons.math3.optim.linear.LinearObjectiveFunction;
import org.apache.commons.math3.optim.linear.NonNegativeConstraint;
import org.apache.commons.math3.optim.linear.Relationship;
import org.apache.commons.math3.optim.linear.SimplexSolver;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wasserstein distances between uniformly-weighted empirical point clouds.
 * <p>
 * The ground cost between two points is {@code ||x - y||^rho} and the reported distance is 
 * {@code (min transport cost)^(1/rho)}.
 * Two solvers are available:
 * <ul>
 *   <li><b>exact</b>: a linear assignment (Hungarian algorithm) when both clouds have the same size, 
 *   otherwise the transportation linear program solved with the simplex method</li>
 *   <li><b>Sinkhorn</b>: entropy-regularized transport computed in the log domain, reporting 
 *   the transport cost of the regularized plan</li>
 * </ul>
 * Instances are immutable and may be shared between threads.
 */
public class OptimalTransport {

	private static final Logger logger = LoggerFactory.getLogger(OptimalTransport.class);

	private static final int SIMPLEX_MAX_ITERATIONS = 100_000;

	private final double order;
	private final boolean sinkhorn;
	private final double regularization;
	private final int maxIterations;
	private final double tolerance;

	private OptimalTransport(double order, boolean sinkhorn, double regularization, int maxIterations, double tolerance) {
		if (!(order >= 1) || Double.isInfinite(order))
			throw new IllegalArgumentException("Wasserstein order must be >= 1, but was " + order);
		this.order = order;
		this.sinkhorn = sinkhorn;
		this.regularization = regularization;
		this.maxIterations = maxIterations;
		this.tolerance = tolerance;
	}

	/**
	 * Create a solver for the exact Wasserstein distance.
	 * @param order the order rho
	 * @return
	 */
	public static OptimalTransport createExact(double order) {
		return new OptimalTransport(order, false, Double.NaN, 0, Double.NaN);
	}

	/**
	 * Create a solver for the Sinkhorn approximation of the Wasserstein distance.
	 * 
	 * @param order the order rho
	 * @param regularization entropic regularization strength, relative to the largest ground cost
	 * @param maxIterations maximum number of Sinkhorn iterations
	 * @param tolerance stopping threshold for the L1 error of the row marginals
	 * @return
	 */
	public static OptimalTransport createSinkhorn(double order, double regularization, int maxIterations, double tolerance) {
		if (!(regularization > 0))
			throw new IllegalArgumentException("Sinkhorn regularization must be > 0, but was " + regularization);
		if (maxIterations < 1)
			throw new IllegalArgumentException("Sinkhorn iterations must be >= 1, but was " + maxIterations);
		return new OptimalTransport(order, true, regularization, maxIterations, tolerance);
	}

	/**
	 * Compute the distance between two point clouds.
	 * @param a first cloud, one point per row
	 * @param b second cloud, with points of the same dimension as {@code a}
	 * @return the distance, or NaN if either cloud is empty
	 */
	public double distance(double[][] a, double[][] b) {
		if (a.length == 0 || b.length == 0)
			return Double.NaN;
		double[][] cost = costMatrix(a, b, order);
		double transportCost = sinkhorn ? sinkhornCost(cost, regularization, maxIterations, tolerance) : exactCost(cost);
		return Math.pow(Math.max(transportCost, 0), 1.0 / order);
	}

	/**
	 * Returns true if this uses the Sinkhorn approximation.
	 * @return
	 */
	public boolean isSinkhorn() {
		return sinkhorn;
	}

	/**
	 * Get the Wasserstein order.
	 * @return
	 */
	public double getOrder() {
		return order;
	}

	/**
	 * Compute the ground cost matrix {@code C[i][j] = ||a_i - b_j||^order}.
	 * @param a
	 * @param b
	 * @param order
	 * @return
	 */
	public static double[][] costMatrix(double[][] a, double[][] b, double order) {
		double[][] cost = new double[a.length][b.length];
		for (int i = 0; i < a.length; i++) {
			double[] p = a[i];
			for (int j = 0; j < b.length; j++) {
				double[] q = b[j];
				if (q.length != p.length)
					throw new IllegalArgumentException("Point dimensions differ: " + p.length + " and " + q.length);
				double sum = 0;
				for (int d = 0; d < p.length; d++) {
					double diff = p[d] - q[d];
					sum += diff * diff;
				}
				cost[i][j] = order == 2 ? sum : Math.pow(Math.sqrt(sum), order);
			}
		}
		return cost;
	}

	/**
	 * Minimum transport cost between uniform marginals.
	 * @param cost an n x m cost matrix
	 * @return
	 */
	public static double exactCost(double[][] cost) {
		int n = cost.length;
		int m = cost[0].length;
		if (n == m) {
			int[] assignment = HungarianAlgorithm.solve(cost);
			return HungarianAlgorithm.totalCost(cost, assignment) / n;
		}
		return simplexCost(cost);
	}

	/**
	 * Solve the transportation problem as a linear program.
	 * Marginals are scaled to integers (rows sum to m, columns to n) and the cost rescaled afterwards.
	 */
	static double simplexCost(double[][] cost) {
		int n = cost.length;
		int m = cost[0].length;
		int nVars = n * m;
		double[] coefficients = new double[nVars];
		for (int i = 0; i < n; i++)
			System.arraycopy(cost[i], 0, coefficients, i * m, m);
		LinearObjectiveFunction objective = new LinearObjectiveFunction(coefficients, 0);

		List<LinearConstraint> constraints = new ArrayList<>(n + m - 1);
		for (int i = 0; i < n; i++) {
			double[] row = new double[nVars];
			for (int j = 0; j < m; j++)
				row[i * m + j] = 1;
			constraints.add(new LinearConstraint(row, Relationship.EQ, m));
		}
		// The last column constraint is implied by the others
		for (int j = 0; j < m - 1; j++) {
			double[] col = new double[nVars];
			for (int i = 0; i < n; i++)
				col[i * m + j] = 1;
			constraints.add(new LinearConstraint(col, Relationship.EQ, n));
		}
		PointValuePair solution = new SimplexSolver().optimize(
				new MaxIter(SIMPLEX_MAX_ITERATIONS),
				objective,
				new LinearConstraintSet(constraints),
				GoalType.MINIMIZE,
				new NonNegativeConstraint(true));
		return solution.getValue() / ((double)n * m);
	}

	/**
	 * Transport cost of the entropy-regularized optimal plan between uniform marginals.
	 * <p>
	 * The cost matrix is divided by its maximum before iterating, so {@code regularization} is relative 
	 * to the largest ground cost. Updates are performed on the dual potentials in the log domain 
	 * so that small regularization values do not underflow.
	 * 
	 * @param cost an n x m cost matrix
	 * @param regularization
	 * @param maxIterations
	 * @param tolerance
	 * @return {@code <P, C>} for the regularized plan P
	 */
	public static double sinkhornCost(double[][] cost, double regularization, int maxIterations, double tolerance) {
		int n = cost.length;
		int m = cost[0].length;
		double maxCost = 0;
		for (double[] row : cost) {
			for (double c : row)
				maxCost = Math.max(maxCost, c);
		}
		if (maxCost == 0)
			return 0;

		double[][] scaled = new double[n][m];
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < m; j++)
				scaled[i][j] = cost[i][j] / maxCost / regularization;
		}
		double logA = -Math.log(n);
		double logB = -Math.log(m);
		// Potentials divided by the regularization
		double[] f = new double[n];
		double[] g = new double[m];
		double[] buffer = new double[Math.max(n, m)];

		int iter = 0;
		double error = Double.POSITIVE_INFINITY;
		while (iter < maxIterations) {
			for (int i = 0; i < n; i++) {
				for (int j = 0; j < m; j++)
					buffer[j] = g[j] - scaled[i][j];
				f[i] = logA - logSumExp(buffer, m);
			}
			for (int j = 0; j < m; j++) {
				for (int i = 0; i < n; i++)
					buffer[i] = f[i] - scaled[i][j];
				g[j] = logB - logSumExp(buffer, n);
			}
			iter++;
			// Columns match exactly after the g update, so check the rows
			error = 0;
			double a = Math.exp(logA);
			for (int i = 0; i < n; i++) {
				double sum = 0;
				for (int j = 0; j < m; j++)
					sum += Math.exp(f[i] + g[j] - scaled[i][j]);
				error += Math.abs(sum - a);
			}
			if (error < tolerance)
				break;
		}
		if (error >= tolerance)
			logger.debug("Sinkhorn stopped after {} iterations with marginal error {}", iter, error);
		else
			logger.trace("Sinkhorn converged after {} iterations", iter);

		double total = 0;
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < m; j++)
				total += Math.exp(f[i] + g[j] - scaled[i][j]) * cost[i][j];
		}
		return total;
	}

	private static double logSumExp(double[] values, int n) {
		double max = Double.NEGATIVE_INFINITY;
		for (int i = 0; i < n; i++)
			max = Math.max(max, values[i]);
		if (Double.isInfinite(max))
			return max;
		double sum = 0;
		for (int i = 0; i < n; i++)
			sum += Math.exp(values[i] - max);
		return max + Math.log(sum);
	}

	@Override
	public String toString() {
		if (sinkhorn)
			return "OptimalTransport [order=" + order + ", sinkhorn, reg=" + regularization + "]";
		return "OptimalTransport [order=" + order + ", exact]";
	}

}
