/*-
 * #%L
 * This file is part of PhenoTag.
 * %%
 * Copyright (C) 2024 - 2025 PhenoTag developers
 * %%
 * PhenoTag is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * PhenoTag is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with PhenoTag.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package phenotag.lib.analysis.images;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestSimpleImages {
	
	@Test
	public void test_floatImage() {
		float[] data = {0f, 1f, 2f, 3f, 4f, 5f};
		var img = SimpleImages.createFloatImage(data, 3, 2);
		assertEquals(3, img.getWidth());
		assertEquals(2, img.getHeight());
		assertEquals(5f, img.getValue(2, 1));
		img.setValue(0, 1, 10f);
		assertEquals(10f, data[3]);
		assertSame(data, img.getArray(true));
		assertNotSame(data, img.getArray(false));
		assertEquals(4, SimpleImages.getBytesPerPixel(img));
	}
	
	@Test
	public void test_byteImageIsUnsigned() {
		byte[] data = {(byte)255, 0, (byte)128, 1};
		var img = SimpleImages.createByteImage(data, 2, 2);
		assertEquals(255f, img.getValue(0, 0));
		assertEquals(128, img.getInt(0, 1));
		assertEquals(1, SimpleImages.getBytesPerPixel(img));
		assertArrayEquals(new float[] {255f, 0f, 128f, 1f}, SimpleImages.getPixels(img, false));
	}
	
	@Test
	public void test_invalidLength() {
		assertThrows(IllegalArgumentException.class, () -> SimpleImages.createFloatImage(new float[5], 2, 2));
		assertThrows(IllegalArgumentException.class, () -> SimpleImages.createByteImage(new byte[3], 2, 2));
	}

}
