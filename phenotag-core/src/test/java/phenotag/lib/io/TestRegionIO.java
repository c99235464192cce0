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

package phenotag.lib.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonObject;

import phenotag.lib.common.ColorTools;
import phenotag.lib.roi.Region;

@SuppressWarnings("javadoc")
public class TestRegionIO {
	
	private static final String JSON_TOP_LEVEL = "{\n"
			+ "  \"ROI_01\": {\"points\": [[10, 20], [110, 20], [110.6, 120.4], [10, 120]], \"color\": [255, 0, 0], \"thickness\": 4, \"alpha\": 0.5},\n"
			+ "  \"ROI_02\": {\"points\": [[0, 0], [5, 5]], \"closed\": false}\n"
			+ "}";
	
	@Test
	public void test_readTopLevel() throws IOException {
		var regions = RegionIO.readRegions(new StringReader(JSON_TOP_LEVEL));
		assertEquals(List.of("ROI_01", "ROI_02"), List.copyOf(regions.keySet()));
		
		var roi1 = regions.get("ROI_01");
		assertEquals(4, roi1.getNumPoints());
		assertEquals(111, roi1.getX(2));
		assertEquals(120, roi1.getY(2));
		// Colors are stored as blue, green, red
		assertEquals(0, ColorTools.red(roi1.getColor()));
		assertEquals(255, ColorTools.blue(roi1.getColor()));
		assertEquals(4, roi1.getThickness());
		assertEquals(0.5, roi1.getAlpha());
		assertTrue(roi1.isClosed());
		
		var roi2 = regions.get("ROI_02");
		assertEquals(Region.DEFAULT_COLOR, roi2.getColor());
		assertEquals(Region.DEFAULT_THICKNESS, roi2.getThickness());
		assertEquals(Region.DEFAULT_ALPHA, roi2.getAlpha());
		assertFalse(roi2.isClosed());
	}
	
	@Test
	public void test_readNested() throws IOException {
		var json = "{\"rois\": {\"plot\": {\"points\": [[1, 2], [3, 4], [5, 6]]}}}";
		var regions = RegionIO.readRegions(new StringReader(json));
		assertEquals(1, regions.size());
		assertEquals(6, regions.get("plot").getY(2));
	}
	
	@Test
	public void test_skipInvalidEntries() throws IOException {
		var json = "{"
				+ "\"noPoints\": {\"color\": [0, 0, 0]},"
				+ "\"notObject\": 5,"
				+ "\"badPoint\": {\"points\": [[1]]},"
				+ "\"emptyPoints\": {\"points\": []},"
				+ "\"badAlpha\": {\"points\": [[1, 1]], \"alpha\": 2.0},"
				+ "\"good\": {\"points\": [[1, 1]]}"
				+ "}";
		var regions = RegionIO.readRegions(new StringReader(json));
		assertEquals(List.of("good"), List.copyOf(regions.keySet()));
	}
	
	@Test
	public void test_invalidJson() {
		assertThrows(IOException.class, () -> RegionIO.readRegions(new StringReader("{\"ROI_01\": ")));
		assertThrows(IOException.class, () -> RegionIO.readRegions(new StringReader("[1, 2, 3]")));
	}
	
	@Test
	public void test_emptyInput() throws IOException {
		assertTrue(RegionIO.readRegions(new StringReader("")).isEmpty());
		assertTrue(RegionIO.readRegions(new StringReader("{}")).isEmpty());
	}
	
	@Test
	public void test_writeAndRead(@TempDir Path dir) throws IOException {
		var region = Region.builder("ROI_01")
				.addPoints(new int[] {1, 50, 25}, new int[] {2, 2, 40})
				.color(ColorTools.packRGB(10, 20, 30))
				.thickness(3)
				.alpha(0.25)
				.build();
		var path = dir.resolve("nested").resolve("rois.json");
		RegionIO.writeRegions(Map.of(region.getName(), region), path);
		
		var json = Files.readString(path, StandardCharsets.UTF_8);
		// Blue, green, red
		assertTrue(json.replaceAll("\\s", "").contains("\"color\":[30,20,10]"));
		
		var read = RegionIO.readRegions(path).get("ROI_01");
		assertEquals(region, read);
	}
	
	@Test
	public void test_writeStatistics(@TempDir Path dir) throws IOException {
		var path = dir.resolve("statistics").resolve("stats.json");
		RegionIO.writeStatistics(Map.of("ROI_01", Map.of("mean", 1.5)), path);
		assertTrue(Files.isRegularFile(path));
		var read = GsonTools.getInstance().fromJson(Files.readString(path), JsonObject.class);
		assertEquals(1.5, read.getAsJsonObject("ROI_01").get("mean").getAsDouble());
	}
	
	@Test
	public void test_missingFile(@TempDir Path dir) {
		assertThrows(IOException.class, () -> RegionIO.readRegions(dir.resolve("missing.json")));
	}

}
