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

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import phenotag.lib.loader.AdaptiveLoader;
import phenotag.lib.memory.MemoryPressureHandler;
import phenotag.lib.memory.MemoryTracker;
import phenotag.lib.processing.BandType;
import phenotag.lib.processing.RegionStatistics;

/**
 * Processes a list of images one at a time, while monitoring memory.
 * <p>
 * For each image the engine is reset, the image is loaded through an {@link AdaptiveLoader}, regions are applied, 
 * bands are optionally exported and regions optionally analyzed, and the result handed to an {@link OutputSink}.
 * A failure for one image is logged and recorded, and the batch continues. This includes running out of memory, 
 * in which case the engine and cache are cleared before moving on to the next image.
 * <p>
 * While the batch runs, memory is sampled in the background; if usage exceeds the configured threshold 
 * the {@link MemoryPressureHandler} trims the cache.
 * 
 * @author PhenoTag developers
 */
public class BatchRunner {
	
	private static final Logger logger = LoggerFactory.getLogger(BatchRunner.class);
	
	private final AdaptiveLoader loader;
	private final MemoryPressureHandler pressureHandler;
	
	/**
	 * Constructor.
	 * @param loader the loader to use for all images
	 */
	public BatchRunner(AdaptiveLoader loader) {
		this.loader = Objects.requireNonNull(loader);
		this.pressureHandler = new MemoryPressureHandler(loader.getCache());
	}
	
	/**
	 * Get the handler called when memory usage is high, for example to register additional callbacks.
	 * @return
	 */
	public MemoryPressureHandler getMemoryPressureHandler() {
		return pressureHandler;
	}
	
	/**
	 * Process a batch of images.
	 * <p>
	 * The cache is cleared once the batch is complete.
	 * 
	 * @param paths images to process
	 * @param regionsSource source of regions for each image
	 * @param sink destination for the results
	 * @param options
	 * @return a summary of the images that succeeded and failed
	 */
	public BatchSummary run(List<Path> paths, RegionsSource regionsSource, OutputSink sink, BatchOptions options) {
		Objects.requireNonNull(regionsSource);
		Objects.requireNonNull(sink);
		Objects.requireNonNull(options);
		
		var config = loader.getConfig();
		var telemetry = loader.getTelemetry();
		var cache = loader.getCache();
		
		List<Path> succeeded = new ArrayList<>();
		Map<Path, String> failed = new LinkedHashMap<>();
		long startTime = System.currentTimeMillis();
		
		logger.info("Starting batch of {} images ({})", paths.size(), options);
		var tracker = MemoryTracker.start("Batch processing", telemetry, true);
		boolean sampling = telemetry.startSampling(config.getSamplingIntervalSec(), config.getMemoryThresholdMB(), pressureHandler);
		try {
			int i = 0;
			for (var path : paths) {
				i++;
				logger.info("Processing {} ({}/{})", path, i, paths.size());
				try {
					var result = processImage(path, regionsSource, options);
					if (result == null) {
						failed.put(path, "Unable to load image");
						continue;
					}
					sink.accept(result);
					succeeded.add(path);
				} catch (IOException | RuntimeException e) {
					logger.error("Error processing " + path + ": " + e.getLocalizedMessage(), e);
					failed.put(path, e.getLocalizedMessage() == null ? e.getClass().getSimpleName() : e.getLocalizedMessage());
				} catch (OutOfMemoryError e) {
					loader.getEngine().reset();
					cache.clear();
					logger.error("Out of memory processing {}: {}", path, e.getLocalizedMessage());
					failed.put(path, "Out of memory" + (e.getLocalizedMessage() == null ? "" : ": " + e.getLocalizedMessage()));
				}
			}
		} finally {
			if (sampling)
				telemetry.stopSampling();
			loader.getEngine().reset();
			logger.info("{}", cache.stats());
			cache.clear();
			tracker.close();
			telemetry.logTrackedObjects();
		}
		var summary = new BatchSummary(succeeded, failed, System.currentTimeMillis() - startTime);
		logger.info("{}", summary);
		return summary;
	}
	
	/**
	 * Process one image.
	 * @return the result, or null if the image could not be loaded
	 */
	private ImageResult processImage(Path path, RegionsSource regionsSource, BatchOptions options) throws IOException {
		var engine = loader.getEngine();
		engine.reset();
		
		if (!loader.load(path, loader.getConfig().getDownscaleFactor(), options.isKeepOriginal()))
			return null;
		
		var regions = regionsSource.getRegions(path);
		engine.overlayRegionsFromMap(regions, options.isDrawOverlays());
		
		Map<String, BufferedImage> bandImages = new LinkedHashMap<>();
		if (options.isExportBands()) {
			for (var bandType : options.getBandTypes()) {
				var parts = bandType.split("-");
				if (parts.length != 2) {
					logger.warn("Invalid band type format: {}", bandType);
					continue;
				}
				BandType type;
				try {
					type = BandType.fromKey(parts[0]);
				} catch (IllegalArgumentException e) {
					logger.warn("Invalid band type: {}", bandType);
					continue;
				}
				var img = engine.getBandImage(type, parts[1]);
				if (img != null)
					bandImages.put(bandType, img);
			}
		}
		
		Map<String, RegionStatistics> statistics = null;
		if (options.isAnalyzeRegions())
			statistics = engine.analyzeAllRegions(options.getSkipList(), false, false);
		
		return new ImageResult(path, engine.getImage(true), bandImages, statistics, loader.getEffectiveDownscale());
	}

}
