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
import java.util.Collections;
import java.util.List;

/**
 * Multi-level 2D discrete wavelet transform using the Haar wavelet.
 * <p>
 * Each level splits the current approximation into a half-size approximation and 
 * horizontal, vertical and diagonal detail coefficients. 
 * Odd dimensions are handled by symmetric extension (repeating the last row or column), 
 * so a level of size {@code n} produces {@code ceil(n/2)} coefficients along that axis.
 */
public class HaarWavelet {

	/**
	 * Detail coefficients for a single decomposition level.
	 */
	public static class Level {

		private final int width;
		private final int height;
		private final double[] horizontal;
		private final double[] vertical;
		private final double[] diagonal;

		Level(int width, int height, double[] horizontal, double[] vertical, double[] diagonal) {
			this.width = width;
			this.height = height;
			this.horizontal = horizontal;
			this.vertical = vertical;
			this.diagonal = diagonal;
		}

		/**
		 * Width of the coefficient arrays.
		 * @return
		 */
		public int getWidth() {
			return width;
		}

		/**
		 * Height of the coefficient arrays.
		 * @return
		 */
		public int getHeight() {
			return height;
		}

		/**
		 * Horizontal detail coefficients (row-major).
		 * @return
		 */
		public double[] getHorizontal() {
			return horizontal;
		}

		/**
		 * Vertical detail coefficients (row-major).
		 * @return
		 */
		public double[] getVertical() {
			return vertical;
		}

		/**
		 * Diagonal detail coefficients (row-major).
		 * @return
		 */
		public double[] getDiagonal() {
			return diagonal;
		}

	}

	private final List<Level> levels;
	private final double[] approximation;
	private final int approxWidth;
	private final int approxHeight;

	private HaarWavelet(List<Level> levels, double[] approximation, int approxWidth, int approxHeight) {
		this.levels = Collections.unmodifiableList(levels);
		this.approximation = approximation;
		this.approxWidth = approxWidth;
		this.approxHeight = approxHeight;
	}

	/**
	 * Decompose a single-channel image.
	 * 
	 * @param pixels row-major pixel values
	 * @param width
	 * @param height
	 * @param nLevels number of decomposition levels
	 * @return
	 */
	public static HaarWavelet decompose(double[] pixels, int width, int height, int nLevels) {
		if (nLevels < 1)
			throw new IllegalArgumentException("Number of levels must be >= 1, but was " + nLevels);
		List<Level> levels = new ArrayList<>();
		double[] current = pixels;
		int w = width;
		int h = height;
		for (int l = 0; l < nLevels; l++) {
			int w2 = (w + 1) / 2;
			int h2 = (h + 1) / 2;
			double[] approx = new double[w2 * h2];
			double[] cH = new double[w2 * h2];
			double[] cV = new double[w2 * h2];
			double[] cD = new double[w2 * h2];
			for (int y = 0; y < h2; y++) {
				int y0 = 2 * y;
				int y1 = Math.min(y0 + 1, h - 1);
				for (int x = 0; x < w2; x++) {
					int x0 = 2 * x;
					int x1 = Math.min(x0 + 1, w - 1);
					double a = current[y0 * w + x0];
					double b = current[y0 * w + x1];
					double c = current[y1 * w + x0];
					double d = current[y1 * w + x1];
					int ind = y * w2 + x;
					approx[ind] = (a + b + c + d) / 2.0;
					cH[ind] = (a + b - c - d) / 2.0;
					cV[ind] = (a - b + c - d) / 2.0;
					cD[ind] = (a - b - c + d) / 2.0;
				}
			}
			levels.add(new Level(w2, h2, cH, cV, cD));
			current = approx;
			w = w2;
			h = h2;
		}
		return new HaarWavelet(levels, current, w, h);
	}

	/**
	 * Detail coefficients, ordered from the finest to the coarsest level.
	 * @return
	 */
	public List<Level> getLevels() {
		return levels;
	}

	/**
	 * Final approximation coefficients.
	 * @return
	 */
	public double[] getApproximation() {
		return approximation.clone();
	}

	/**
	 * Width of the final approximation.
	 * @return
	 */
	public int getApproximationWidth() {
		return approxWidth;
	}

	/**
	 * Height of the final approximation.
	 * @return
	 */
	public int getApproximationHeight() {
		return approxHeight;
	}

}
