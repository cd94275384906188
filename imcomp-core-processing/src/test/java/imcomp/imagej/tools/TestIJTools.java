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

package imcomp.imagej.tools;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import imcomp.lib.images.ImageBuffer;

@SuppressWarnings("javadoc")
public class TestIJTools {

	@Test
	public void test_floatProcessorIsCopy() {
		float[][] channels = {{1, 2, 3, 4, 5, 6}};
		var img = ImageBuffer.create(channels, 3, 2, 255);
		var fp = IJTools.convertToFloatProcessor(img, 0);
		assertEquals(3, fp.getWidth());
		assertEquals(2, fp.getHeight());
		assertEquals(6f, fp.getf(2, 1));
		fp.setf(0, 0, 100f);
		assertEquals(1f, img.getValue(0, 0, 0));
		assertArrayEquals(new float[] {100, 2, 3, 4, 5, 6}, IJTools.getFloatPixels(fp));
	}

	@Test
	public void test_maskConversion() {
		boolean[] mask = {true, false, false, true};
		var bp = IJTools.convertToByteProcessor(mask, 2, 2);
		assertEquals(255, bp.get(0, 0));
		assertEquals(0, bp.get(1, 0));
		assertArrayEquals(mask, IJTools.convertToMask(bp));
	}

	@Test
	public void test_resizeMask() {
		assertNull(IJTools.resizeMask(null, 2, 2, 4, 4));
		boolean[] mask = {true, false, false, true};
		boolean[] larger = IJTools.resizeMask(mask, 2, 2, 4, 4);
		assertEquals(16, larger.length);
		// Nearest-neighbour keeps each quadrant constant
		assertTrue(larger[0] && larger[1] && larger[4] && larger[5]);
		assertTrue(!larger[2] && !larger[3] && !larger[6] && !larger[7]);
		assertTrue(larger[15]);
		assertArrayEquals(mask, IJTools.resizeMask(mask, 2, 2, 2, 2));
	}

}
