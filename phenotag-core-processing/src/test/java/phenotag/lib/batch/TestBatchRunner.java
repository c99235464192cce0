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

package phenotag.lib.batch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonObject;

import phenotag.lib.common.ColorTools;
import phenotag.lib.common.ProcessingConfig;
import phenotag.lib.images.ImageBuffers;
import phenotag.lib.io.GsonTools;
import phenotag.lib.loader.AdaptiveLoader;
import phenotag.lib.memory.BoundedCache;
import phenotag.lib.memory.MemorySample;
import phenotag.lib.memory.MemoryTelemetry;
import phenotag.lib.processing.ImageProcessingEngine;
import phenotag.lib.processing.SkyDetector;

@SuppressWarnings("javadoc")
public class TestBatchRunner {
	
	private static final String REGIONS_JSON = "{\"rois\": {"
			+ "\"ROI_01\": {\"points\": [[0, 0], [19, 0], [19, 29], [0, 29]], \"color\": [0, 0, 255]},"
			+ "\"ROI_02\": {\"points\": [[20, 0], [39, 0], [39, 29], [20, 29]]}"
			+ "}}";
	
	private static Path writeImage(Path dir, String name) throws IOException {
		var img = ImageBuffers.createBGR(40, 30);
		for (int y = 0; y < 30; y++) {
			for (int x = 0; x < 40; x++)
				img.setRGB(x, y, x < 20 ? ColorTools.packRGB(200, 0, 0) : ColorTools.packRGB(0, 0, 200));
		}
		var path = dir.resolve(name);
		ImageBuffers.write(img, path, 100);
		return path;
	}
	
	private static AdaptiveLoader createLoader() {
		var config = ProcessingConfig.getDefault();
		var telemetry = new MemoryTelemetry(() -> new MemorySample(100, 200, 50, 4000, 1000, 16000));
		return new AdaptiveLoader(new ImageProcessingEngine(), telemetry, new BoundedCache(config.getCacheMaxMB()), config);
	}
	
	@Test
	public void test_batch(@TempDir Path dir) throws IOException {
		var images = List.of(
				writeImage(dir, "plot_01.png"),
				dir.resolve("missing.png"),
				writeImage(dir, "plot_02.png"));
		var regionsPath = dir.resolve("rois.json");
		Files.writeString(regionsPath, REGIONS_JSON, StandardCharsets.UTF_8);
		var output = dir.resolve("output");
		
		var options = BatchOptions.builder()
				.exportBands(true)
				.bandTypes(List.of("rgb-r", "chromatic-composite", "chromatic-x", "hsv-h", "bad"))
				.analyzeRegions(true)
				.skipList(List.of("ROI_02"))
				.build();
		
		try (var loader = createLoader()) {
			var runner = new BatchRunner(loader);
			var summary = runner.run(images, RegionsSource.fromJson(regionsPath), new DirectoryOutputSink(output), options);
			
			assertEquals(3, summary.getTotal());
			assertEquals(List.of(images.get(0), images.get(2)), summary.getSucceeded());
			assertEquals(Map.of(images.get(1), "Unable to load image"), summary.getFailed());
			assertTrue(summary.getElapsedMillis() >= 0);
			
			// Everything is cleaned up
			assertEquals(0, loader.getCache().stats().getCount());
			assertFalse(loader.getEngine().hasImage());
			assertFalse(loader.getTelemetry().isSampling());
		}
		
		for (var base : List.of("plot_01", "plot_02")) {
			assertTrue(Files.isRegularFile(output.resolve(base + "_processed.jpg")));
			assertTrue(Files.isRegularFile(output.resolve("bands").resolve(base + "_rgb-r.png")));
			assertTrue(Files.isRegularFile(output.resolve("bands").resolve(base + "_chromatic-composite.png")));
			assertFalse(Files.exists(output.resolve("bands").resolve(base + "_chromatic-x.png")));
			assertFalse(Files.exists(output.resolve("bands").resolve(base + "_hsv-h.png")));
			
			var statsPath = output.resolve("statistics").resolve(base + "_roi_stats.json");
			var json = GsonTools.getInstance().fromJson(Files.readString(statsPath, StandardCharsets.UTF_8), JsonObject.class);
			var stats = json.getAsJsonObject("roi_band_stats");
			assertEquals(1, stats.size());
			var roi = stats.getAsJsonObject("ROI_01");
			assertEquals(200.0, roi.getAsJsonObject("rgb").getAsJsonObject("r").get("mean").getAsDouble(), 1e-9);
			assertEquals(600, roi.getAsJsonObject("rgb").getAsJsonObject("r").get("pixels").getAsLong());
			assertEquals(1.0, roi.getAsJsonObject("chromatic").getAsJsonObject("r").get("mean").getAsDouble(), 1e-6);
		}
		
		var red = ImageIO.read(output.resolve("bands").resolve("plot_01_rgb-r.png").toFile());
		assertEquals(200, red.getRaster().getSample(5, 5, 0));
		assertEquals(0, red.getRaster().getSample(35, 5, 0));
	}
	
	@Test
	public void test_defaultRegionsAndNoExport(@TempDir Path dir) throws IOException {
		var images = List.of(writeImage(dir, "plot_01.png"));
		var results = new ArrayList<ImageResult>();
		try (var loader = createLoader()) {
			var summary = new BatchRunner(loader).run(images, RegionsSource.none(), results::add, BatchOptions.getDefault());
			assertEquals(1, summary.getSucceeded().size());
		}
		assertEquals(1, results.size());
		var result = results.get(0);
		assertEquals("plot_01", result.getBaseName());
		assertTrue(result.getBandImages().isEmpty());
		assertNull(result.getStatistics());
		assertEquals(1.0, result.getDownscale());
		assertEquals(40, result.getProcessedImage().getWidth());
	}
	
	@Test
	public void test_statisticsUseDefaultRegion(@TempDir Path dir) throws IOException {
		var images = List.of(writeImage(dir, "plot_01.png"));
		var results = new ArrayList<ImageResult>();
		var options = BatchOptions.builder().analyzeRegions(true).drawOverlays(false).build();
		try (var loader = createLoader()) {
			new BatchRunner(loader).run(images, RegionsSource.none(), results::add, options);
		}
		var stats = results.get(0).getStatistics();
		assertEquals(List.of(SkyDetector.DEFAULT_REGION_NAME), List.copyOf(stats.keySet()));
		assertEquals(100.0, stats.get(SkyDetector.DEFAULT_REGION_NAME).getRGB("r").getMean(), 1e-9);
		// Without overlays, the processed image matches the input
		assertEquals(ColorTools.packRGB(200, 0, 0), results.get(0).getProcessedImage().getRGB(5, 5));
	}
	
	@Test
	public void test_failuresAreRecorded(@TempDir Path dir) throws IOException {
		var images = List.of(writeImage(dir, "plot_01.png"), writeImage(dir, "plot_02.png"));
		OutputSink failingSink = result -> {
			if (result.getBaseName().equals("plot_01"))
				throw new IOException("Disk full");
		};
		RegionsSource failingSource = path -> {
			if (path.getFileName().toString().equals("plot_02.png"))
				throw new IOException("Bad regions");
			return Map.of();
		};
		try (var loader = createLoader()) {
			var summary = new BatchRunner(loader).run(images, failingSource, failingSink, BatchOptions.getDefault());
			assertTrue(summary.getSucceeded().isEmpty());
			assertEquals("Disk full", summary.getFailed().get(images.get(0)));
			assertEquals("Bad regions", summary.getFailed().get(images.get(1)));
		}
	}
	
	@Test
	public void test_outOfMemoryDoesNotStopBatch(@TempDir Path dir) throws IOException {
		var images = List.of(writeImage(dir, "plot_01.png"), writeImage(dir, "plot_02.png"));
		var results = new ArrayList<ImageResult>();
		RegionsSource source = path -> {
			if (path.getFileName().toString().equals("plot_01.png"))
				throw new OutOfMemoryError("Java heap space");
			return Map.of();
		};
		try (var loader = createLoader()) {
			var summary = new BatchRunner(loader).run(images, source, results::add, BatchOptions.getDefault());
			assertEquals(List.of(images.get(1)), summary.getSucceeded());
			assertEquals(Map.of(images.get(0), "Out of memory: Java heap space"), summary.getFailed());
			assertEquals(0, loader.getCache().stats().getCount());
			assertFalse(loader.getTelemetry().isSampling());
		}
		assertEquals(1, results.size());
		assertEquals("plot_02", results.get(0).getBaseName());
	}
	
	@Test
	public void test_lowMemoryCallback(@TempDir Path dir) throws IOException {
		// Threshold below the reported usage, sampled quickly
		var config = new ProcessingConfig.Builder().memoryThresholdMB(50).samplingIntervalSec(0.01).build();
		var telemetry = new MemoryTelemetry(() -> new MemorySample(100, 200, 50, 4000, 1000, 16000));
		var images = List.of(writeImage(dir, "plot_01.png"));
		try (var loader = new AdaptiveLoader(new ImageProcessingEngine(), telemetry, new BoundedCache(100), config)) {
			var runner = new BatchRunner(loader);
			var count = new AtomicInteger();
			runner.getMemoryPressureHandler().registerLowMemoryCallback(count::incrementAndGet);
			// The first sample is taken immediately
			long start = System.currentTimeMillis();
			RegionsSource slowSource = path -> {
				while (count.get() == 0 && System.currentTimeMillis() - start < 10_000)
					Thread.yield();
				return Map.of();
			};
			var summary = runner.run(images, slowSource, result -> {}, BatchOptions.getDefault());
			assertEquals(1, summary.getSucceeded().size());
			assertTrue(count.get() > 0);
		}
	}
	
	@Test
	public void test_options() {
		var options = BatchOptions.getDefault();
		assertTrue(options.isDrawOverlays());
		assertFalse(options.isExportBands());
		assertFalse(options.isAnalyzeRegions());
		assertTrue(options.isKeepOriginal());
		assertEquals(BatchOptions.ALL_BAND_TYPES, options.getBandTypes());
		assertTrue(options.getSkipList().isEmpty());
		assertEquals(BatchOptions.ALL_BAND_TYPES, BatchOptions.builder().bandTypes(List.of()).build().getBandTypes());
		assertThrows(UnsupportedOperationException.class, () -> options.getBandTypes().add("rgb-r"));
	}

}
