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

package imcomp.lib.images;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestImageBuffer {

	@Test
	public void test_validation() {
		assertThrows(IllegalArgumentException.class, () -> ImageBuffer.create(new float[][] {new float[5]}, 2, 2, 255));
		assertThrows(IllegalArgumentException.class, () -> ImageBuffer.create(new float[0][], 2, 2, 255));
		assertThrows(IllegalArgumentException.class, () -> ImageBuffer.create(new float[][] {new float[4]}, 2, 2, 0));
		assertThrows(IllegalArgumentException.class,
				() -> ImageBuffer.create(new float[][] {new float[4]}, new boolean[3], null, 2, 2, 255));
		assertThrows(IllegalArgumentException.class,
				() -> ImageBuffer.create(new float[][] {new float[4], new float[6]}, 2, 2, 255));
	}

	@Test
	public void test_fromArray() {
		var img = ImageBuffers.fromArray(new double[][] {{1, 2, 3}, {4, 5, 6}}, 255);
		assertEquals(3, img.getWidth());
		assertEquals(2, img.getHeight());
		assertEquals(1, img.nChannels());
		assertEquals(6, img.getValue(0, 2, 1));
		assertEquals(2, img.getValue(0, 1, 0));
		assertFalse(img.hasMask());
		assertEquals(6, img.countValid());
		assertTrue(img.isValid(2, 1));
	}

	@Test
	public void test_transformsReturnNewInstances() {
		float[][] channels = {{1, 2, 3, 4}};
		float[] alpha = {255, 0, 255, 0};
		var img = ImageBuffer.create(channels, null, alpha, 2, 2, 255);
		var masked = img.withMask(new boolean[] {true, false, true, false});
		assertNotSame(img, masked);
		assertTrue(img.hasAlpha());
		assertFalse(img.hasMask());
		assertFalse(masked.hasAlpha());
		assertEquals(2, masked.countValid());
		assertFalse(masked.isValid(1, 0));

		var noAlpha = img.withoutAlpha();
		assertFalse(noAlpha.hasAlpha());
		assertSame(noAlpha, noAlpha.withoutAlpha());

		// Non-direct access returns copies
		float[] copy = img.getChannel(0, false);
		copy[0] = 100;
		assertEquals(1, img.getValue(0, 0, 0));
	}

	@Test
	public void test_fromBufferedImageWithAlpha() {
		var bi = new BufferedImage(3, 2, BufferedImage.TYPE_INT_ARGB);
		bi.setRGB(0, 0, 0xFF102030);
		bi.setRGB(1, 0, 0x00405060);
		var img = ImageBuffers.fromBufferedImage(bi);
		assertEquals(3, img.nChannels());
		assertEquals(255, img.getMaxValue());
		assertTrue(img.hasAlpha());
		assertEquals(0x10, img.getValue(0, 0, 0));
		assertEquals(0x20, img.getValue(1, 0, 0));
		assertEquals(0x30, img.getValue(2, 0, 0));
		float[] alpha = img.getAlpha(false);
		assertEquals(255, alpha[0]);
		assertEquals(0, alpha[1]);
	}

	@Test
	public void test_fromBufferedImageGray() {
		var bi = new BufferedImage(4, 4, BufferedImage.TYPE_USHORT_GRAY);
		bi.getRaster().setSample(1, 1, 0, 1000);
		var img = ImageBuffers.fromBufferedImage(bi);
		assertEquals(1, img.nChannels());
		assertEquals(65535, img.getMaxValue());
		assertNull(img.getAlpha(false));
		assertEquals(1000, img.getValue(0, 1, 1));
	}

	@Test
	public void test_fromBufferedImageIndexed() {
		// Inverted grey palette, so that index and colour differ
		byte[] levels = new byte[256];
		for (int i = 0; i < 256; i++)
			levels[i] = (byte)(255 - i);
		var bi = new BufferedImage(2, 2, BufferedImage.TYPE_BYTE_INDEXED, new IndexColorModel(8, 256, levels, levels, levels));
		bi.getRaster().setSample(1, 0, 0, 55);
		var img = ImageBuffers.fromBufferedImage(bi);
		assertEquals(3, img.nChannels());
		assertFalse(img.hasAlpha());
		assertEquals(255.0, img.getMaxValue());
		for (int c = 0; c < 3; c++) {
			assertEquals(255, img.getValue(c, 0, 0));
			assertEquals(200, img.getValue(c, 1, 0));
		}

		// Palette with a transparent entry
		byte[] r = {(byte)255, 0};
		byte[] g = {0, (byte)128};
		byte[] b = {0, 0};
		var transparent = new BufferedImage(2, 1, BufferedImage.TYPE_BYTE_BINARY, new IndexColorModel(1, 2, r, g, b, 1));
		transparent.getRaster().setSample(1, 0, 0, 1);
		var img2 = ImageBuffers.fromBufferedImage(transparent);
		assertEquals(3, img2.nChannels());
		assertTrue(img2.hasAlpha());
		assertEquals(255, img2.getValue(0, 0, 0));
		assertEquals(128, img2.getValue(1, 1, 0));
		assertArrayEquals(new float[] {255, 0}, img2.getAlpha(false));
	}

	@Test
	public void test_createConstant() {
		var img = ImageBuffers.createConstant(5, 4, 3, 7f, 255);
		assertEquals(3, img.nChannels());
		float[] expected = new float[20];
		Arrays.fill(expected, 7f);
		for (int c = 0; c < 3; c++)
			assertArrayEquals(expected, img.getChannel(c, false));
		assertEquals(img, ImageBuffers.createConstant(5, 4, 3, 7f, 255));
	}

}
