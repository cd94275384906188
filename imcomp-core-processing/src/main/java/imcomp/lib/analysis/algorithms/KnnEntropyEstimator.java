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
import java.util.Random;

import org.apache.commons.math3.special.Gamma;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.KDTree;
import net.imglib2.RealPoint;
import net.imglib2.neighborsearch.KNearestNeighborSearchOnKDTree;

/**
 * Kozachenko-Leonenko k-nearest-neighbour estimator of differential entropy.
 * <p>
 * For N samples in d dimensions the estimate (in nats) is
 * <pre>
 *   H = psi(N) - psi(k) + log(V_d) + (d / N) * sum_i log(r_i)
 * </pre>
 * where {@code r_i} is the Euclidean distance from sample i to its k-th nearest neighbour 
 * and {@code V_d} is the volume of the d-dimensional unit ball.
 * <p>
 * Neighbours are found with an imglib2 {@link KDTree}. 
 * A small amount of seeded uniform noise is added to every coordinate so that exact duplicates 
 * (common for integer pixel values) do not produce zero distances.
 */
public class KnnEntropyEstimator {

	private static final Logger logger = LoggerFactory.getLogger(KnnEntropyEstimator.class);

	private final int k;
	private final int maxSamples;
	private final double noise;
	private final long seed;

	/**
	 * Create an estimator.
	 * 
	 * @param k neighbour rank, must be at least 1
	 * @param maxSamples maximum number of samples used; larger inputs are randomly subsampled. Values &le; 0 disable subsampling.
	 * @param noise amplitude of the uniform jitter added to each coordinate
	 * @param seed seed for subsampling and jitter
	 */
	public KnnEntropyEstimator(int k, int maxSamples, double noise, long seed) {
		if (k < 1)
			throw new IllegalArgumentException("k must be >= 1, but was " + k);
		if (!(noise >= 0))
			throw new IllegalArgumentException("Noise must be >= 0, but was " + noise);
		this.k = k;
		this.maxSamples = maxSamples;
		this.noise = noise;
		this.seed = seed;
	}

	/**
	 * Estimate the differential entropy of a set of samples.
	 * 
	 * @param samples samples of equal dimension
	 * @return the entropy estimate in nats, or NaN if there are fewer than {@code k + 1} samples
	 */
	public double estimate(List<double[]> samples) {
		int nInput = samples.size();
		if (nInput < k + 1) {
			logger.debug("Cannot estimate entropy from {} samples with k={}", nInput, k);
			return Double.NaN;
		}
		int d = samples.get(0).length;
		if (d == 0)
			return Double.NaN;

		Random random = new Random(seed);
		List<double[]> selected = subsample(samples, random);
		int n = selected.size();

		List<RealPoint> points = new ArrayList<>(n);
		List<Integer> values = new ArrayList<>(n);
		for (int i = 0; i < n; i++) {
			double[] s = selected.get(i);
			if (s.length != d)
				throw new IllegalArgumentException("Sample " + i + " has dimension " + s.length + ", expected " + d);
			double[] p = new double[d];
			for (int j = 0; j < d; j++)
				p[j] = s[j] + noise * (random.nextDouble() - 0.5);
			points.add(new RealPoint(p));
			values.add(i);
		}

		KDTree<Integer> tree = new KDTree<>(values, points);
		// Every query point finds itself first
		KNearestNeighborSearchOnKDTree<Integer> search = new KNearestNeighborSearchOnKDTree<>(tree, k + 1);
		double sumLog = 0;
		for (RealPoint p : points) {
			search.search(p);
			double r = search.getDistance(k);
			if (r <= 0) {
				logger.debug("Zero nearest-neighbour distance in entropy estimate, returning -Infinity");
				return Double.NEGATIVE_INFINITY;
			}
			sumLog += Math.log(r);
		}
		return Gamma.digamma(n) - Gamma.digamma(k) + logUnitBallVolume(d) + d * sumLog / n;
	}

	private List<double[]> subsample(List<double[]> samples, Random random) {
		int n = samples.size();
		if (maxSamples <= 0 || n <= maxSamples)
			return samples;
		// Partial Fisher-Yates shuffle of the indices
		int[] inds = new int[n];
		for (int i = 0; i < n; i++)
			inds[i] = i;
		List<double[]> selected = new ArrayList<>(maxSamples);
		for (int i = 0; i < maxSamples; i++) {
			int j = i + random.nextInt(n - i);
			int temp = inds[i];
			inds[i] = inds[j];
			inds[j] = temp;
			selected.add(samples.get(inds[i]));
		}
		logger.debug("Subsampled {} of {} samples for entropy estimate", maxSamples, n);
		return selected;
	}

	/**
	 * Natural logarithm of the volume of the d-dimensional Euclidean unit ball.
	 * @param d
	 * @return
	 */
	public static double logUnitBallVolume(int d) {
		return d / 2.0 * Math.log(Math.PI) - Gamma.logGamma(d / 2.0 + 1);
	}

	/**
	 * Neighbour rank.
	 * @return
	 */
	public int getK() {
		return k;
	}

}
