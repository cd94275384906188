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

package imcomp.lib.regions;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import imcomp.lib.images.ImageBuffer;
import imcomp.lib.images.ImageBuffers;
import imcomp.lib.regions.PatchGrid.BoundaryPolicy;

@SuppressWarnings("javadoc")
public class TestPatchGrid {

	private static ImageBuffer createRamp(int width, int height) {
		double[][] values = new double[height][width];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++)
				values[y][x] = y * width + x;
		}
		return ImageBuffers.fromArray(values, 255);
	}

	@Test
	public void test_dropAndClip() {
		var img = createRamp(5, 5);
		var drop = PatchGrid.decompose(img, 2);
		assertEquals(4, drop.getPatches().size());
		assertEquals(BoundaryPolicy.DROP, drop.getBoundaryPolicy());
		for (Patch p : drop.getPatches()) {
			assertEquals(2, p.getWidth());
			assertEquals(2, p.getHeight());
			assertTrue(p.getX() + p.getWidth() <= img.getWidth());
			assertTrue(p.getY() + p.getHeight() <= img.getHeight());
		}

		var clip = PatchGrid.decompose(img, 2, 0, BoundaryPolicy.CLIP);
		assertEquals(9, clip.getPatches().size());
		Patch last = clip.getPatches().get(8);
		assertEquals(4, last.getX());
		assertEquals(4, last.getY());
		assertEquals(1, last.nPixels());
	}

	@Test
	public void test_dropIncomplete() {
		var img = createRamp(5, 5);
		var drop = PatchGrid.decompose(img, 2);
		assertTrue(drop == drop.dropIncomplete());

		var clip = PatchGrid.decompose(img, 2, 0, BoundaryPolicy.CLIP);
		var dropped = clip.dropIncomplete();
		assertEquals(BoundaryPolicy.DROP, dropped.getBoundaryPolicy());
		assertEquals(drop.getPatches(), dropped.getPatches());
		for (double[] v : dropped.unfoldValid())
			assertEquals(4, v.length);

		var overlapping = PatchGrid.decompose(img, 2, 1, BoundaryPolicy.CLIP).dropIncomplete();
		assertEquals(PatchGrid.decompose(img, 2, 1, BoundaryPolicy.DROP).getPatches(), overlapping.getPatches());
	}

	@Test
	public void test_overlappingStride() {
		var img = createRamp(4, 4);
		var grid = PatchGrid.decompose(img, 2, 1, BoundaryPolicy.DROP);
		assertEquals(1, grid.getStride());
		assertEquals(9, grid.nValid());
	}

	@Test
	public void test_maskExcludesPatches() {
		var img = createRamp(4, 4);
		boolean[] mask = new boolean[16];
		Arrays.fill(mask, true);
		mask[0] = false;
		var masked = img.withMask(mask);
		var grid = PatchGrid.decompose(masked, 2);
		assertEquals(4, grid.getPatches().size());
		assertEquals(3, grid.nValid());
		assertFalse(grid.getPatches().get(0).isValid());
		for (Patch p : grid)
			assertTrue(p.isValid());

		var empty = PatchGrid.decompose(img.withMask(new boolean[16]), 2);
		assertTrue(empty.isEmpty());
		assertTrue(empty.unfoldValid().isEmpty());
	}

	@Test
	public void test_unfoldOrder() {
		float[][] channels = {
				{0, 1, 2, 3},
				{10, 11, 12, 13}
		};
		var img = ImageBuffer.create(channels, 2, 2, 255);
		var grid = PatchGrid.decompose(img, 2);
		Patch patch = grid.getValidPatches().get(0);
		// Channel-major, then row-major
		assertArrayEquals(new double[] {0, 1, 2, 3, 10, 11, 12, 13}, grid.unfold(patch));
		var pixels = grid.getPixelVectors(patch);
		assertEquals(4, pixels.size());
		assertArrayEquals(new double[] {2, 12}, pixels.get(2));
	}

	@Test
	public void test_pointCloud() {
		var img = ImageBuffers.fromArray(new double[][] {{0, 255}, {51, 102}}, 255);
		var grid = PatchGrid.decompose(img, 2);
		double[][] cloud = grid.getPointCloud(grid.getValidPatches().get(0), 2.0);
		assertEquals(4, cloud.length);
		assertArrayEquals(new double[] {0, 0, 0}, cloud[0], 1e-12);
		assertArrayEquals(new double[] {0, 2, 1}, cloud[1], 1e-12);
		assertArrayEquals(new double[] {2, 0, 0.2}, cloud[2], 1e-6);
		assertArrayEquals(new double[] {2, 2, 0.4}, cloud[3], 1e-6);
	}

	@Test
	public void test_invalidArguments() {
		var img = createRamp(4, 4);
		assertThrows(IllegalArgumentException.class, () -> PatchGrid.decompose(img, 0));
		assertThrows(IllegalArgumentException.class, () -> Patch.createInstance(0, 0, 0, 2, true));
	}

}
