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

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;

/**
 * Static methods for computing discrete Fourier transforms of arbitrary length.
 * <p>
 * Power-of-two lengths are transformed directly with commons-math; other lengths use 
 * Bluestein's chirp-z algorithm, which re-expresses the transform as a power-of-two convolution.
 */
public class FourierTransforms {

	private static final FastFourierTransformer fft = new FastFourierTransformer(DftNormalization.STANDARD);

	private FourierTransforms() {
		throw new AssertionError();
	}

	/**
	 * Compute the forward DFT of a complex sequence of any length.
	 * @param data
	 * @return a new array containing the transform
	 */
	public static Complex[] transform(Complex[] data) {
		int n = data.length;
		if (n == 0)
			return new Complex[0];
		if (n == 1)
			return new Complex[] {data[0]};
		if (ArithmeticUtils.isPowerOfTwo(n))
			return fft.transform(data, TransformType.FORWARD);
		return bluestein(data);
	}

	private static Complex[] bluestein(Complex[] data) {
		int n = data.length;
		int m = Integer.highestOneBit(2 * n - 1);
		if (m < 2 * n - 1)
			m <<= 1;

		// Chirp w_k = exp(-i pi k^2 / n), using k^2 mod 2n to retain precision
		Complex[] chirp = new Complex[n];
		long mod = 2L * n;
		for (int k = 0; k < n; k++) {
			long k2 = ((long)k * k) % mod;
			double angle = Math.PI * k2 / n;
			chirp[k] = new Complex(Math.cos(angle), -Math.sin(angle));
		}

		Complex[] a = new Complex[m];
		Complex[] b = new Complex[m];
		for (int i = 0; i < m; i++) {
			a[i] = Complex.ZERO;
			b[i] = Complex.ZERO;
		}
		for (int k = 0; k < n; k++)
			a[k] = data[k].multiply(chirp[k]);
		b[0] = chirp[0].conjugate();
		for (int k = 1; k < n; k++) {
			b[k] = chirp[k].conjugate();
			b[m - k] = b[k];
		}

		Complex[] fa = fft.transform(a, TransformType.FORWARD);
		Complex[] fb = fft.transform(b, TransformType.FORWARD);
		for (int i = 0; i < m; i++)
			fa[i] = fa[i].multiply(fb[i]);
		Complex[] conv = fft.transform(fa, TransformType.INVERSE);

		Complex[] output = new Complex[n];
		for (int k = 0; k < n; k++)
			output[k] = conv[k].multiply(chirp[k]);
		return output;
	}

	/**
	 * Compute the magnitude of the 2D DFT of a real image.
	 * 
	 * @param pixels row-major pixel values
	 * @param width
	 * @param height
	 * @return row-major magnitudes, unshifted (i.e. the zero frequency is at index 0)
	 */
	public static double[] magnitude2D(double[] pixels, int width, int height) {
		Complex[][] rows = new Complex[height][];
		Complex[] row = new Complex[width];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++)
				row[x] = new Complex(pixels[y * width + x]);
			rows[y] = transform(row);
		}
		double[] magnitude = new double[width * height];
		Complex[] column = new Complex[height];
		for (int x = 0; x < width; x++) {
			for (int y = 0; y < height; y++)
				column[y] = rows[y][x];
			Complex[] transformed = transform(column);
			for (int y = 0; y < height; y++)
				magnitude[y * width + x] = transformed[y].abs();
		}
		return magnitude;
	}

	/**
	 * Get the signed frequency index for an unshifted DFT coefficient, 
	 * i.e. {@code k} for {@code k <= n/2} and {@code k - n} otherwise.
	 * @param k coefficient index
	 * @param n transform length
	 * @return
	 */
	public static int signedFrequency(int k, int n) {
		return k <= n / 2 ? k : k - n;
	}

}
