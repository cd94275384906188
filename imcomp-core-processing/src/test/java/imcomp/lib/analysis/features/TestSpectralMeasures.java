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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;

import imcomp.lib.images.ImageBuffer;
import imcomp.lib.images.ImageBuffers;

@SuppressWarnings("javadoc")
public class TestSpectralMeasures {

	private static double[][] checkerboard(int size) {
		double[][] values = new double[size][size];
		for (int y = 0; y < size; y++) {
			for (int x = 0; x < size; x++)
				values[y][x] = (x + y) % 2 == 0 ? 0 : 255;
		}
		return values;
	}

	private static double[][] ramp(int size) {
		double[][] values = new double[size][size];
		for (int y = 0; y < size; y++) {
			for (int x = 0; x < size; x++)
				values[y][x] = 255.0 * x / (size - 1);
		}
		return values;
	}

	@Test
	public void test_constant() {
		var image = ImageBuffers.createConstant(12, 8, 1, 100f, 255);
		for (var weighting : FrequencyWeighting.values())
			assertEquals(0.0, SpectralMeasures.fourierWeightedEnergy(image, weighting), 1e-6);
	}

	@Test
	public void test_checkerboardExceedsRamp() {
		double checker = SpectralMeasures.fourierWeightedEnergy(ImageBuffers.fromArray(checkerboard(16), 255), FrequencyWeighting.EUCLIDEAN);
		double smooth = SpectralMeasures.fourierWeightedEnergy(ImageBuffers.fromArray(ramp(16), 255), FrequencyWeighting.EUCLIDEAN);
		assertTrue(checker > smooth);
	}

	@Test
	public void test_singlePixel() {
		var image = ImageBuffers.createConstant(1, 1, 1, 10f, 255);
		assertTrue(Double.isNaN(SpectralMeasures.fourierWeightedEnergy(image, FrequencyWeighting.MANHATTAN)));
	}

	@Test
	public void test_masked() {
		var random = new Random(4L);
		int w = 9;
		int h = 7;
		float[] pixels = new float[w * h];
		boolean[] mask = new boolean[w * h];
		double sum = 0;
		int n = 0;
		for (int i = 0; i < pixels.length; i++) {
			mask[i] = i % 5 != 0;
			pixels[i] = mask[i] ? random.nextInt(256) : 999f;
			if (mask[i]) {
				sum += pixels[i];
				n++;
			}
		}
		var masked = ImageBuffer.create(new float[][] {pixels}, mask, null, w, h, 255);
		double[] filled = SpectralMeasures.fillMasked(masked, 0);
		float[] expected = pixels.clone();
		for (int i = 0; i < expected.length; i++) {
			if (!mask[i])
				expected[i] = (float)(sum / n);
			assertEquals(expected[i], filled[i], 1e-4);
		}
		var unmasked = ImageBuffer.create(new float[][] {expected}, w, h, 255);
		assertEquals(
				SpectralMeasures.fourierWeightedEnergy(unmasked, FrequencyWeighting.EUCLIDEAN),
				SpectralMeasures.fourierWeightedEnergy(masked, FrequencyWeighting.EUCLIDEAN),
				1e-4);

		var allMasked = ImageBuffer.create(new float[][] {pixels}, new boolean[w * h], null, w, h, 255);
		assertTrue(Double.isNaN(SpectralMeasures.fourierWeightedEnergy(allMasked, FrequencyWeighting.EUCLIDEAN)));
	}

	@Test
	public void test_unmaskedFillIsCopy() {
		var image = ImageBuffers.fromArray(new double[][] {{1, 2}, {3, 4}}, 255);
		assertArrayEquals(new double[] {1, 2, 3, 4}, SpectralMeasures.fillMasked(image, 0), 0.0);
	}

	@Test
	public void test_weightingsDiffer() {
		var random = new Random(5L);
		double[][] values = new double[10][10];
		for (double[] row : values) {
			for (int x = 0; x < row.length; x++)
				row[x] = random.nextInt(256);
		}
		var image = ImageBuffers.fromArray(values, 255);
		double manhattan = SpectralMeasures.fourierWeightedEnergy(image, FrequencyWeighting.MANHATTAN);
		double chebyshev = SpectralMeasures.fourierWeightedEnergy(image, FrequencyWeighting.CHEBYSHEV);
		assertNotEquals(manhattan, chebyshev, 1e-9);
	}

	@Test
	public void test_weights() {
		assertEquals(7, FrequencyWeighting.MANHATTAN.weight(3, -4));
		assertEquals(5, FrequencyWeighting.EUCLIDEAN.weight(3, -4), 1e-12);
		assertEquals(4, FrequencyWeighting.CHEBYSHEV.weight(3, -4));
	}

}
