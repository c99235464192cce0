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

package phenotag.lib.roi;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.Point;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import phenotag.lib.common.ColorTools;

@SuppressWarnings("javadoc")
public class TestRegion {
	
	private static Region square(String name, int size) {
		return Region.builder(name)
				.addPoints(new int[] {0, size, size, 0}, new int[] {0, 0, size, size})
				.build();
	}
	
	@Test
	public void test_defaults() {
		var region = square("ROI_01", 10);
		assertEquals("ROI_01", region.getName());
		assertEquals(4, region.getNumPoints());
		assertEquals(Region.DEFAULT_COLOR, region.getColor());
		assertEquals(Region.DEFAULT_THICKNESS, region.getThickness());
		assertEquals(Region.DEFAULT_ALPHA, region.getAlpha());
		assertTrue(region.isClosed());
		assertEquals(List.of(new Point(0, 0), new Point(10, 0), new Point(10, 10), new Point(0, 10)), region.getPoints());
	}
	
	@Test
	public void test_immutable() {
		var region = square("ROI_01", 10);
		region.getXPoints()[0] = 100;
		assertEquals(0, region.getX(0));
	}
	
	@Test
	public void test_toBuilder() {
		var region = square("ROI_01", 10);
		var changed = region.toBuilder()
				.color(ColorTools.packRGB(255, 0, 0))
				.thickness(5)
				.alpha(0.5)
				.closed(false)
				.build();
		assertTrue(region.sameShape(changed));
		assertEquals(region.getShapeKey(), changed.getShapeKey());
		assertNotEquals(region, changed);
		assertEquals(255, ColorTools.red(changed.getColor()));
		assertEquals(0, ColorTools.green(changed.getColor()));
		assertEquals(5, changed.getThickness());
		assertFalse(changed.isClosed());
		
		assertEquals(region, square("ROI_01", 10));
		assertEquals(region.hashCode(), square("ROI_01", 10).hashCode());
	}
	
	@Test
	public void test_shapeKey() {
		var small = square("ROI_01", 10);
		var large = square("ROI_01", 20);
		assertFalse(small.sameShape(large));
		assertNotEquals(small.getShapeKey(), large.getShapeKey());
		assertTrue(small.getShapeKey().startsWith("4-"));
		
		// Different polygons whose coordinate arrays share a hash code
		var rect = Region.builder("ROI_01").addPoints(new int[] {0, 0, 19, 19}, new int[] {0, 29, 29, 0}).build();
		var skewed = Region.builder("ROI_01").addPoints(new int[] {0, 0, 20, -12}, new int[] {0, 29, 29, 0}).build();
		assertEquals(Arrays.hashCode(rect.getXPoints()), Arrays.hashCode(skewed.getXPoints()));
		assertFalse(rect.sameShape(skewed));
		assertNotEquals(rect.getShapeKey(), skewed.getShapeKey());
		assertEquals(rect.getShapeKey(), rect.toBuilder().build().getShapeKey());
	}
	
	@Test
	public void test_withName() {
		var region = square("ROI_01", 10);
		assertSame(region, region.withName("ROI_01"));
		var renamed = region.withName("ROI_02");
		assertEquals("ROI_02", renamed.getName());
		assertTrue(region.sameShape(renamed));
		assertEquals(region.getColor(), renamed.getColor());
		assertEquals(region.getAlpha(), renamed.getAlpha());
		assertThrows(IllegalArgumentException.class, () -> region.withName(""));
	}
	
	@Test
	public void test_invalid() {
		assertThrows(IllegalArgumentException.class, () -> Region.builder("ROI_01").build());
		assertThrows(IllegalArgumentException.class, () -> Region.builder(" ").addPoint(0, 0).build());
		assertThrows(IllegalArgumentException.class, () -> Region.builder("ROI_01").addPoint(0, 0).thickness(0).build());
		assertThrows(IllegalArgumentException.class, () -> Region.builder("ROI_01").addPoint(0, 0).alpha(1.5).build());
		assertThrows(IllegalArgumentException.class, () -> Region.builder("ROI_01").addPoint(0, 0).alpha(Double.NaN).build());
		assertThrows(IllegalArgumentException.class, () -> Region.builder("ROI_01").addPoints(new int[2], new int[3]));
		assertThrows(NullPointerException.class, () -> Region.builder(null));
	}

}
