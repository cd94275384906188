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

import java.util.Arrays;

/**
 * Solve the square linear assignment problem with the Hungarian (Kuhn-Munkres) algorithm, 
 * using row and column potentials for O(n^3) running time.
 */
public class HungarianAlgorithm {

	private HungarianAlgorithm() {
		throw new AssertionError();
	}

	/**
	 * Find the assignment of rows to columns that minimizes the total cost.
	 * 
	 * @param cost square cost matrix; entries must be finite
	 * @return an array where element {@code i} gives the column assigned to row {@code i}
	 */
	public static int[] solve(double[][] cost) {
		int n = cost.length;
		for (double[] row : cost) {
			if (row.length != n)
				throw new IllegalArgumentException("Cost matrix must be square");
		}
		if (n == 0)
			return new int[0];

		// 1-based indexing; index 0 is a virtual column used to start each augmentation
		double[] u = new double[n + 1];
		double[] v = new double[n + 1];
		int[] p = new int[n + 1];
		int[] way = new int[n + 1];
		double[] minv = new double[n + 1];
		boolean[] used = new boolean[n + 1];

		for (int i = 1; i <= n; i++) {
			p[0] = i;
			int j0 = 0;
			Arrays.fill(minv, Double.POSITIVE_INFINITY);
			Arrays.fill(used, false);
			do {
				used[j0] = true;
				int i0 = p[j0];
				double delta = Double.POSITIVE_INFINITY;
				int j1 = 0;
				for (int j = 1; j <= n; j++) {
					if (used[j])
						continue;
					double cur = cost[i0 - 1][j - 1] - u[i0] - v[j];
					if (cur < minv[j]) {
						minv[j] = cur;
						way[j] = j0;
					}
					if (minv[j] < delta) {
						delta = minv[j];
						j1 = j;
					}
				}
				for (int j = 0; j <= n; j++) {
					if (used[j]) {
						u[p[j]] += delta;
						v[j] -= delta;
					} else
						minv[j] -= delta;
				}
				j0 = j1;
			} while (p[j0] != 0);
			do {
				int j1 = way[j0];
				p[j0] = p[j1];
				j0 = j1;
			} while (j0 != 0);
		}

		int[] assignment = new int[n];
		for (int j = 1; j <= n; j++)
			assignment[p[j] - 1] = j - 1;
		return assignment;
	}

	/**
	 * Total cost of an assignment.
	 * @param cost
	 * @param assignment
	 * @return
	 */
	public static double totalCost(double[][] cost, int[] assignment) {
		double sum = 0;
		for (int i = 0; i < assignment.length; i++)
			sum += cost[i][assignment[i]];
		return sum;
	}

}
