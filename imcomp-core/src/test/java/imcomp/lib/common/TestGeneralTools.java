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

package imcomp.lib.common;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestGeneralTools {

	@Test
	public void test_nameWithoutExtension() {
		assertEquals("specimen 01", GeneralTools.getNameWithoutExtension("specimen 01.png"));
		assertEquals("specimen", GeneralTools.getNameWithoutExtension("specimen"));
		assertEquals("a.b", GeneralTools.getNameWithoutExtension("a.b.tif"));
	}

	@Test
	public void test_formatNumber() {
		assertEquals("1.25", GeneralTools.formatNumber(1.25, 4));
		assertEquals("2", GeneralTools.formatNumber(2.0, 3));
		assertEquals("NaN", GeneralTools.formatNumber(Double.NaN, 3));
		assertEquals("-Infinity", GeneralTools.formatNumber(Double.NEGATIVE_INFINITY, 3));
		assertEquals(Double.toString(Math.PI), GeneralTools.formatNumber(Math.PI, -1));
	}

	@Test
	public void test_clipValue() {
		assertEquals(5.0, GeneralTools.clipValue(10, 0, 5));
		assertEquals(-1.0, GeneralTools.clipValue(-3.0, -1.0, 1.0));
		assertEquals(0.5, GeneralTools.clipValue(0.5, -1.0, 1.0));
	}

}
