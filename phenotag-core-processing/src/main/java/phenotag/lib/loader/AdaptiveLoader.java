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

package phenotag.lib.loader;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import phenotag.lib.common.GeneralTools;
import phenotag.lib.common.LogTools;
import phenotag.lib.common.ProcessingConfig;
import phenotag.lib.images.ImageBuffers;
import phenotag.lib.images.ImageInfo;
import phenotag.lib.memory.BoundedCache;
import phenotag.lib.memory.MemoryEstimate;
import phenotag.lib.memory.MemoryTelemetry;
import phenotag.lib.memory.MemoryTracker;
import phenotag.lib.memory.TelemetryUnavailableException;
import phenotag.lib.processing.ImageProcessingEngine;

/**
 * Loads images into an {@link ImageProcessingEngine}, reducing the resolution when necessary 
 * to stay within the available memory.
 * <p>
 * Before decoding, the image size is read from the file header and the memory needed for processing 
 * is estimated. If this exceeds both the configured threshold and half of the available memory, 
 * the image is downscaled so that the estimate fits. Very large reductions decode only a subsample of pixels, 
 * so that the full resolution image is never held in memory.
 * <p>
 * Decoded images are stored in a {@link BoundedCache}, along with derived bands and statistics, 
 * so that loading the same image again can skip decoding.
 * 
 * @author PhenoTag developers
 */
public class AdaptiveLoader implements AutoCloseable {
	
	private static final Logger logger = LoggerFactory.getLogger(AdaptiveLoader.class);
	
	/**
	 * Fraction of the available memory that processing one image may use.
	 */
	static final double AVAILABLE_FRACTION = 0.5;
	
	/**
	 * Below this downscale factor, images are decoded with subsampling 4.
	 */
	static final double REDUCED_DECODE_4 = 0.25;
	
	/**
	 * Below this downscale factor, images are decoded with subsampling 8.
	 */
	static final double REDUCED_DECODE_8 = 0.125;
	
	/**
	 * Maximum difference in pixels between a subsampled image and its target size before resizing.
	 */
	static final int RESIZE_TOLERANCE = 10;
	
	private static final int CHANNELS = 3;
	private static final int BYTES_PER_SAMPLE = 1;
	
	private final ImageProcessingEngine engine;
	private final MemoryTelemetry telemetry;
	private final BoundedCache cache;
	private ProcessingConfig config;
	
	private String imageKey;
	private double effectiveDownscale = 1.0;
	private int originalWidth = 0;
	private int originalHeight = 0;
	
	/**
	 * Create a loader with a new engine, the default configuration and system memory telemetry.
	 */
	public AdaptiveLoader() {
		this(ProcessingConfig.getDefault());
	}
	
	/**
	 * Create a loader with a new engine and system memory telemetry.
	 * @param config
	 */
	public AdaptiveLoader(ProcessingConfig config) {
		this(new ImageProcessingEngine(), new MemoryTelemetry(), new BoundedCache(config.getCacheMaxMB()), config);
	}
	
	/**
	 * Create a loader.
	 * @param engine engine to load images into
	 * @param telemetry source of memory usage information
	 * @param cache cache for decoded images and derived data; this may be shared with other loaders
	 * @param config
	 */
	public AdaptiveLoader(ImageProcessingEngine engine, MemoryTelemetry telemetry, BoundedCache cache, ProcessingConfig config) {
		this.engine = Objects.requireNonNull(engine);
		this.telemetry = Objects.requireNonNull(telemetry);
		this.cache = Objects.requireNonNull(cache);
		this.config = Objects.requireNonNull(config);
		if (engine.getMemoryTelemetry() == null)
			engine.setMemoryTelemetry(telemetry);
		telemetry.trackObject("engine@" + Integer.toHexString(System.identityHashCode(engine)), engine);
	}
	
	/**
	 * Load an image using the configured downscale factor, keeping the original.
	 * @param path
	 * @return true if the image was loaded
	 */
	public boolean load(Path path) {
		return load(path, config.getDownscaleFactor(), true);
	}
	
	/**
	 * Load an image, reducing the resolution further if needed to fit in memory.
	 * 
	 * @param path
	 * @param requestedDownscale the preferred downscale factor; the effective factor will not be larger than this
	 * @param keepOriginal if true, the engine retains an untouched copy of the image
	 * @return true if the image was loaded, false if the file is missing, cannot be decoded 
	 *         or there is not enough memory to hold it
	 */
	public boolean load(Path path, double requestedDownscale, boolean keepOriginal) {
		double requested = Double.isNaN(requestedDownscale) ? ProcessingConfig.MAX_DOWNSCALE :
			GeneralTools.clipValue(requestedDownscale, ProcessingConfig.MIN_DOWNSCALE, ProcessingConfig.MAX_DOWNSCALE);
		try (var tracker = MemoryTracker.start("Load image " + path, telemetry)) {
			return loadImage(path, requested, keepOriginal);
		} catch (OutOfMemoryError e) {
			logger.error("Not enough memory to load image {}: {}", path, e.getLocalizedMessage());
			return false;
		}
	}
	
	private boolean loadImage(Path path, double requested, boolean keepOriginal) {
		ImageInfo info;
		try {
			info = ImageBuffers.readInfo(path);
		} catch (IOException e) {
			logger.error("Unable to read image {}: {}", path, e.getLocalizedMessage());
			logger.debug(e.getLocalizedMessage(), e);
			return false;
		}
		
		double effective = computeEffectiveDownscale(info.getWidth(), info.getHeight(), requested);
		String key = createImageKey(path, effective);
		
		var img = cache.get(key, BufferedImage.class);
		if (img != null) {
			logger.debug("Using cached image for {}", key);
		} else {
			try {
				img = decode(path, info, effective);
			} catch (IOException e) {
				logger.error("Unable to decode image {}: {}", path, e.getLocalizedMessage());
				logger.debug(e.getLocalizedMessage(), e);
				return false;
			}
			cache.put(key, img);
		}
		
		engine.setImage(img, keepOriginal);
		engine.setDerivedDataCache(new BoundedCacheStore(cache), key);
		
		this.imageKey = key;
		this.effectiveDownscale = effective;
		this.originalWidth = info.getWidth();
		this.originalHeight = info.getHeight();
		logger.info("Loaded {} ({}x{}, downscale {})", path, img.getWidth(), img.getHeight(), effective);
		return true;
	}
	
	static String createImageKey(Path path, double downscale) {
		return path.toAbsolutePath().normalize() + ":" + downscale;
	}
	
	/**
	 * Determine the downscale factor that should be used for an image, based upon the current memory usage.
	 * <p>
	 * If memory telemetry is unavailable, or auto-downscaling is disabled, the requested factor is returned.
	 * 
	 * @param width full resolution width
	 * @param height full resolution height
	 * @param requested the requested downscale factor
	 * @return a factor between {@link ProcessingConfig#MIN_DOWNSCALE} and the requested factor
	 */
	public double computeEffectiveDownscale(int width, int height, double requested) {
		if (!config.isAutoDownscale())
			return requested;
		try {
			var estimate = MemoryEstimate.estimate(width, height, CHANNELS, BYTES_PER_SAMPLE);
			double processingMB = estimate.getWithProcessingMB();
			double availableMB = telemetry.sample().availableMB();
			double thresholdMB = config.getMemoryThresholdMB();
			
			if (processingMB > thresholdMB && processingMB > availableMB * AVAILABLE_FRACTION) {
				double targetMB = Math.min(thresholdMB, availableMB * AVAILABLE_FRACTION);
				double effective = Math.max(ProcessingConfig.MIN_DOWNSCALE, 
						Math.min(requested, Math.sqrt(targetMB / processingMB)));
				if (effective < requested) {
					logger.warn("Image {}x{} needs ~{} for processing, available {} - downscaling to {}",
							width, height, GeneralTools.formatMB(processingMB), GeneralTools.formatMB(availableMB),
							String.format("%.3f", effective));
				}
				return effective;
			}
		} catch (TelemetryUnavailableException e) {
			LogTools.warnOnce(logger, "Memory telemetry unavailable, using requested downscale: " + e.getMessage());
		} catch (RuntimeException e) {
			logger.warn("Unable to estimate memory for {}x{} image: {}", width, height, e.getLocalizedMessage());
			logger.debug(e.getLocalizedMessage(), e);
		}
		return requested;
	}
	
	/**
	 * Decode an image at the specified scale, using subsampling for large reductions.
	 */
	static BufferedImage decode(Path path, ImageInfo info, double downscale) throws IOException {
		if (downscale >= 1.0)
			return ImageBuffers.read(path);
		
		int targetWidth = MemoryEstimate.scaledSize(info.getWidth(), downscale);
		int targetHeight = MemoryEstimate.scaledSize(info.getHeight(), downscale);
		if (downscale < REDUCED_DECODE_4) {
			int subsampling = downscale < REDUCED_DECODE_8 ? 8 : 4;
			var img = ImageBuffers.readSubsampled(path, subsampling);
			logger.debug("Reduced decode of {} with subsampling {}: {}x{}", path, subsampling, img.getWidth(), img.getHeight());
			if (Math.abs(img.getWidth() - targetWidth) > RESIZE_TOLERANCE || Math.abs(img.getHeight() - targetHeight) > RESIZE_TOLERANCE)
				img = ImageBuffers.resize(img, targetWidth, targetHeight);
			return img;
		}
		return ImageBuffers.resize(ImageBuffers.read(path), targetWidth, targetHeight);
	}
	
	/**
	 * @return the engine that images are loaded into
	 */
	public ImageProcessingEngine getEngine() {
		return engine;
	}
	
	/**
	 * @return the memory telemetry used by this loader
	 */
	public MemoryTelemetry getTelemetry() {
		return telemetry;
	}
	
	/**
	 * @return the cache of decoded images and derived data
	 */
	public BoundedCache getCache() {
		return cache;
	}
	
	/**
	 * @return the current configuration
	 */
	public ProcessingConfig getConfig() {
		return config;
	}
	
	/**
	 * Enable or disable automatic downscaling.
	 * @param doAuto
	 */
	public void setAutoDownscale(boolean doAuto) {
		if (config.isAutoDownscale() != doAuto)
			config = config.toBuilder().autoDownscale(doAuto).build();
	}
	
	/**
	 * @return the downscale factor used for the last image loaded
	 */
	public double getEffectiveDownscale() {
		return effectiveDownscale;
	}
	
	/**
	 * @return the full resolution width of the last image loaded
	 */
	public int getOriginalWidth() {
		return originalWidth;
	}
	
	/**
	 * @return the full resolution height of the last image loaded
	 */
	public int getOriginalHeight() {
		return originalHeight;
	}
	
	/**
	 * Remove the last image loaded and its derived data from the cache.
	 */
	@Override
	public void close() {
		if (imageKey == null)
			return;
		cache.remove(imageKey);
		cache.removeByPrefix(imageKey + ":");
		logger.debug("Removed cache entries for {}", imageKey);
		imageKey = null;
	}

}
