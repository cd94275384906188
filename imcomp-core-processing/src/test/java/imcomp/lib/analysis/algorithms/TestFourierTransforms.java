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

import java.util.Random;

import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@SuppressWarnings("javadoc")
public class TestFourierTransforms {

	private static Complex[] naiveDFT(Complex[] data) {
		int n = data.length;
		Complex[] output = new Complex[n];
		for (int k = 0; k < n; k++) {
			double re = 0;
			double im = 0;
			for (int j = 0; j < n; j++) {
				double angle = -2 * Math.PI * j * k / n;
				re += data[j].getReal() * Math.cos(angle) - data[j].getImaginary() * Math.sin(angle);
				im += data[j].getReal() * Math.sin(angle) + data[j].getImaginary() * Math.cos(angle);
			}
			output[k] = new Complex(re, im);
		}
		return output;
	}

	@ParameterizedTest
	@ValueSource(ints = {1, 2, 3, 5, 7, 8, 12, 16, 31, 100})
	public void test_transformMatchesNaive(int n) {
		var random = new Random(n);
		Complex[] data = new Complex[n];
		for (int i = 0; i < n; i++)
			data[i] = new Complex(random.nextDouble() * 10 - 5, random.nextDouble());
		Complex[] expected = naiveDFT(data);
		Complex[] actual = FourierTransforms.transform(data);
		assertEquals(n, actual.length);
		for (int k = 0; k < n; k++) {
			assertEquals(expected[k].getReal(), actual[k].getReal(), 1e-8);
			assertEquals(expected[k].getImaginary(), actual[k].getImaginary(), 1e-8);
		}
	}

	@Test
	public void test_magnitude2D() {
		int w = 6;
		int h = 5;
		var random = new Random(1L);
		double[] pixels = new double[w * h];
		for (int i = 0; i < pixels.length; i++)
			pixels[i] = random.nextInt(256);
		double[] magnitude = FourierTransforms.magnitude2D(pixels, w, h);
		for (int v = 0; v < h; v++) {
			for (int u = 0; u < w; u++) {
				double re = 0;
				double im = 0;
				for (int y = 0; y < h; y++) {
					for (int x = 0; x < w; x++) {
						double angle = -2 * Math.PI * ((double)u * x / w + (double)v * y / h);
						re += pixels[y * w + x] * Math.cos(angle);
						im += pixels[y * w + x] * Math.sin(angle);
					}
				}
				assertEquals(Math.hypot(re, im), magnitude[v * w + u], 1e-7);
			}
		}
		double sum = 0;
		for (double p : pixels)
			sum += p;
		assertEquals(sum, magnitude[0], 1e-9);
	}

	@Test
	public void test_signedFrequency() {
		assertEquals(0, FourierTransforms.signedFrequency(0, 5));
		assertEquals(2, FourierTransforms.signedFrequency(2, 5));
		assertEquals(-2, FourierTransforms.signedFrequency(3, 5));
		assertEquals(2, FourierTransforms.signedFrequency(2, 4));
		assertEquals(-1, FourierTransforms.signedFrequency(3, 4));
	}

}
