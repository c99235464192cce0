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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@SuppressWarnings("javadoc")
public class TestProcessingConfig {
	
	@Test
	public void test_defaults() {
		var config = ProcessingConfig.getDefault();
		assertEquals(1000.0, config.getMemoryThresholdMB());
		assertEquals(500.0, config.getCacheMaxMB());
		assertEquals(30.0, config.getSamplingIntervalSec());
		assertEquals(1.0, config.getDownscaleFactor());
		assertTrue(config.isAutoDownscale());
	}
	
	@Test
	public void test_downscaleClamped() {
		assertEquals(0.1, new ProcessingConfig.Builder().downscaleFactor(0.01).build().getDownscaleFactor());
		assertEquals(1.0, new ProcessingConfig.Builder().downscaleFactor(4).build().getDownscaleFactor());
		assertEquals(0.5, new ProcessingConfig.Builder().downscaleFactor(0.5).build().getDownscaleFactor());
		assertThrows(IllegalArgumentException.class, () -> new ProcessingConfig.Builder().downscaleFactor(Double.NaN).build());
	}
	
	@Test
	public void test_invalidValues() {
		assertThrows(IllegalArgumentException.class, () -> new ProcessingConfig.Builder().cacheMaxMB(0).build());
		assertThrows(IllegalArgumentException.class, () -> new ProcessingConfig.Builder().memoryThresholdMB(-1).build());
		assertThrows(IllegalArgumentException.class, () -> new ProcessingConfig.Builder().samplingIntervalSec(Double.NaN).build());
	}
	
	@Test
	public void test_toBuilder() {
		var config = ProcessingConfig.getDefault().toBuilder().cacheMaxMB(64).build();
		assertEquals(64.0, config.getCacheMaxMB());
		assertEquals(500.0, ProcessingConfig.getDefault().getCacheMaxMB());
	}
	
	@Test
	public void test_fromJson() throws IOException {
		var config = ProcessingConfig.fromJson(new StringReader("{\"cacheMaxMB\": 250, \"autoDownscale\": false}"));
		assertEquals(250.0, config.getCacheMaxMB());
		assertFalse(config.isAutoDownscale());
		// Missing values use defaults
		assertEquals(1000.0, config.getMemoryThresholdMB());
		
		assertEquals(0.1, ProcessingConfig.fromJson(new StringReader("{\"downscaleFactor\": 0}")).getDownscaleFactor());
		assertEquals(500.0, ProcessingConfig.fromJson(new StringReader("")).getCacheMaxMB());
		assertThrows(IOException.class, () -> ProcessingConfig.fromJson(new StringReader("{\"cacheMaxMB\": ")));
	}
	
	@Test
	public void test_writeAndRead(@TempDir Path dir) throws IOException {
		var config = new ProcessingConfig.Builder()
				.memoryThresholdMB(2048)
				.samplingIntervalSec(5)
				.downscaleFactor(0.75)
				.build();
		var path = dir.resolve("config.json");
		config.writeJson(path);
		var read = ProcessingConfig.fromJson(path);
		assertEquals(2048.0, read.getMemoryThresholdMB());
		assertEquals(5.0, read.getSamplingIntervalSec());
		assertEquals(0.75, read.getDownscaleFactor());
	}

}
