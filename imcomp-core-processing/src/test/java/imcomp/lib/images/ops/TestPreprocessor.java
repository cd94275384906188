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

package imcomp.lib.images.ops;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import imcomp.lib.images.ImageBuffer;

@SuppressWarnings("javadoc")
public class TestPreprocessor {

	private static ImageBuffer createTestImage() {
		int w = 24;
		int h = 16;
		float[] pixels = new float[w * h];
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++)
				pixels[y * w + x] = (float)(127 + 100 * Math.sin(x * 1.3) * Math.cos(y * 0.7) + ((x / 3 + y / 2) % 2) * 20);
		}
		return ImageBuffer.create(new float[][] {pixels}, w, h, 255);
	}

	@Test
	public void test_resizeBeforeBlur() {
		var img = createTestImage();
		var resize = ImageBufferOps.Core.resize(0.5);
		var blur = ImageBufferOps.Filters.gaussianBlur(1.5);

		var resizeThenBlur = blur.apply(resize.apply(img));
		var blurThenResize = resize.apply(blur.apply(img));
		assertNotEquals(resizeThenBlur, blurThenResize);

		var preprocessor = Preprocessor.create(false, null, 0.5, 1.5);
		assertEquals(resizeThenBlur, preprocessor.apply(img));
		assertNotEquals(blurThenResize, preprocessor.apply(img));
	}

	@Test
	public void test_opOrder() {
		var preprocessor = Preprocessor.create(false, GreyscaleMode.HUMAN, 0.5, 2.0);
		var ops = preprocessor.getOps();
		assertEquals(4, ops.size());
		assertTrue(ops.get(0) instanceof ImageBufferOps.Channels.MaskFromAlphaOp);
		assertTrue(ops.get(1) instanceof ImageBufferOps.Channels.GreyscaleOp);
		assertTrue(ops.get(2) instanceof ImageBufferOps.Core.ResizeOp);
		assertTrue(ops.get(3) instanceof ImageBufferOps.Filters.GaussianFilterOp);
		assertTrue(preprocessor.isResizeRequested());

		var minimal = Preprocessor.create(true, null, Double.NaN, 0);
		assertEquals(1, minimal.getOps().size());
		assertFalse(minimal.isResizeRequested());
		assertFalse(Preprocessor.create(true, null, 1.0, 0).isResizeRequested());
	}

	@Test
	public void test_alphaHandling() {
		float[][] channels = {{10, 20, 30, 40}, {10, 20, 30, 40}, {10, 20, 30, 40}};
		float[] alpha = {255, 0, 255, 255};
		var img = ImageBuffer.create(channels, null, alpha, 2, 2, 255);

		var masked = Preprocessor.create(false, GreyscaleMode.AVG, Double.NaN, 0).apply(img);
		assertEquals(1, masked.nChannels());
		assertEquals(3, masked.countValid());
		assertFalse(masked.hasAlpha());

		var ignored = Preprocessor.create(true, null, Double.NaN, 0).apply(img);
		assertFalse(ignored.hasMask());
		assertFalse(ignored.hasAlpha());
		assertEquals(3, ignored.nChannels());
	}

	@Test
	public void test_originalUnchanged() {
		var img = createTestImage();
		float[] before = img.getChannel(0, false);
		var preprocessor = Preprocessor.create(false, null, 2.0, 1.0);
		var output = preprocessor.apply(img);
		preprocessor.gradient(output);
		assertEquals(48, output.getWidth());
		assertEquals(ImageBuffer.create(new float[][] {before}, img.getWidth(), img.getHeight(), 255), img);
	}

	@Test
	public void test_invalidArguments() {
		assertThrows(IllegalArgumentException.class, () -> Preprocessor.create(false, null, 0, 0));
		assertThrows(IllegalArgumentException.class, () -> Preprocessor.create(false, null, Double.NaN, -1));
	}

}
