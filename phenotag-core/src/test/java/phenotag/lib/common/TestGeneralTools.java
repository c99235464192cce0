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

package phenotag.lib.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestGeneralTools {
	
	@Test
	public void test_extensions() {
		assertEquals("IMG_0001", GeneralTools.getNameWithoutExtension("/data/images/IMG_0001.JPG"));
		assertEquals("archive.tar", GeneralTools.getNameWithoutExtension("archive.tar.gz"));
		assertEquals(".hidden", GeneralTools.getNameWithoutExtension(".hidden"));
		assertEquals(Optional.of(".jpg"), GeneralTools.getExtension("IMG_0001.JPG"));
		assertEquals(Optional.empty(), GeneralTools.getExtension("README"));
		assertEquals(Optional.empty(), GeneralTools.getExtension("name."));
	}
	
	@Test
	public void test_clipValue() {
		assertEquals(0, GeneralTools.clipValue(-5, 0, 255));
		assertEquals(255, GeneralTools.clipValue(300, 0, 255));
		assertEquals(0.5, GeneralTools.clipValue(0.5, 0.1, 1.0));
		assertTrue(Double.isNaN(GeneralTools.clipValue(Double.NaN, 0.1, 1.0)));
	}
	
	@Test
	public void test_memory() {
		assertEquals(1.0, GeneralTools.bytesToMB(1024L * 1024L));
		assertEquals("1.5 MB", GeneralTools.formatMB(1.5));
	}

}
