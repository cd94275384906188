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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestHungarianAlgorithm {

	private static double bruteForce(double[][] cost, int[] perm, int k) {
		int n = perm.length;
		if (k == n) {
			double sum = 0;
			for (int i = 0; i < n; i++)
				sum += cost[i][perm[i]];
			return sum;
		}
		double best = Double.POSITIVE_INFINITY;
		for (int i = k; i < n; i++) {
			swap(perm, k, i);
			best = Math.min(best, bruteForce(cost, perm, k + 1));
			swap(perm, k, i);
		}
		return best;
	}

	private static void swap(int[] arr, int i, int j) {
		int temp = arr[i];
		arr[i] = arr[j];
		arr[j] = temp;
	}

	@Test
	public void test_matchesBruteForce() {
		var random = new Random(10L);
		for (int trial = 0; trial < 20; trial++) {
			int n = 1 + random.nextInt(7);
			double[][] cost = new double[n][n];
			for (double[] row : cost) {
				for (int j = 0; j < n; j++)
					row[j] = random.nextInt(20);
			}
			int[] assignment = HungarianAlgorithm.solve(cost);
			// Must be a permutation
			int[] sorted = assignment.clone();
			Arrays.sort(sorted);
			for (int i = 0; i < n; i++)
				assertEquals(i, sorted[i]);
			int[] perm = new int[n];
			for (int i = 0; i < n; i++)
				perm[i] = i;
			assertEquals(bruteForce(cost, perm, 0), HungarianAlgorithm.totalCost(cost, assignment), 1e-12);
		}
	}

	@Test
	public void test_simple() {
		double[][] cost = {
				{4, 1, 3},
				{2, 0, 5},
				{3, 2, 2}
		};
		int[] assignment = HungarianAlgorithm.solve(cost);
		assertEquals(5.0, HungarianAlgorithm.totalCost(cost, assignment), 1e-12);
		assertEquals(0, HungarianAlgorithm.solve(new double[0][0]).length);
		assertThrows(IllegalArgumentException.class, () -> HungarianAlgorithm.solve(new double[][] {{1, 2}}));
	}

}
