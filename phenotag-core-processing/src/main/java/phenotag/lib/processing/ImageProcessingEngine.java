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

package phenotag.lib.processing;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import phenotag.lib.analysis.images.SimpleImage;
import phenotag.lib.analysis.images.SimpleImages;
import phenotag.lib.analysis.images.SimpleImages.ByteSimpleImage;
import phenotag.lib.analysis.stats.BandStatistics;
import phenotag.lib.analysis.stats.RunningStatistics;
import phenotag.lib.common.ColorTools;
import phenotag.lib.common.GeneralTools;
import phenotag.lib.common.ProcessingConfig;
import phenotag.lib.images.ImageBuffers;
import phenotag.lib.memory.MemoryEstimate;
import phenotag.lib.memory.MemoryTelemetry;
import phenotag.lib.memory.MemoryTracker;
import phenotag.lib.processing.ExtendedRegionStatistics.BoundingRect;
import phenotag.lib.processing.ExtendedRegionStatistics.PixelSums;
import phenotag.lib.roi.Region;
import phenotag.lib.roi.RegionMask;

/**
 * Holds one color image along with its regions, and computes derived bands and region statistics.
 * <p>
 * Two buffers are maintained: an untouched original, which is the source for all analysis, and an active
 * buffer on which region overlays are drawn. The original may be released to save memory, in which case
 * the active buffer is used as the source.
 * <p>
 * Large images are processed in chunks of at most {@link #CHUNK_ROWS} rows, so that temporary buffers
 * never scale with the full image size.
 * <p>
 * Instances are not thread-safe.
 *
 * @author PhenoTag developers
 */
public class ImageProcessingEngine {

	private static final Logger logger = LoggerFactory.getLogger(ImageProcessingEngine.class);

	/**
	 * Maximum number of rows processed at a time.
	 */
	public static final int CHUNK_ROWS = 500;

	/**
	 * Minimum value of G+R for the vegetation index to be calculated.
	 */
	static final double VEGETATION_EPSILON = 1e-10;

	private static final int HISTOGRAM_BINS = 256;

	private static final String KEY_ROI_STATS = ":roi_stats:";

	private Path path;
	private double downscale = 1.0;

	private BufferedImage original;
	private BufferedImage image;

	private final Map<String, Region> regions = new LinkedHashMap<>();
	private final Map<String, RegionMask> masks = new HashMap<>();
	private final Map<String, RegionStatistics> regionStatistics = new LinkedHashMap<>();

	private BandSet rgbBands;
	private BandSet chromaticBands;

	private DerivedDataCache derivedCache;
	private String cacheKeyPrefix;

	private MemoryTelemetry telemetry;

	/**
	 * Create an engine with no image.
	 */
	public ImageProcessingEngine() {}

	/**
	 * Set telemetry used to log memory usage before and after expensive operations.
	 * @param telemetry the telemetry, or null to log durations only
	 */
	public void setMemoryTelemetry(MemoryTelemetry telemetry) {
		this.telemetry = telemetry;
	}

	/**
	 * @return the telemetry used to log memory usage, or null
	 */
	public MemoryTelemetry getMemoryTelemetry() {
		return telemetry;
	}

	/**
	 * Load an image at full resolution, keeping the original.
	 * @param path
	 * @return true if the image was loaded, false otherwise
	 */
	public boolean load(Path path) {
		return load(path, ProcessingConfig.MAX_DOWNSCALE, true);
	}

	/**
	 * Load an image.
	 * <p>
	 * Existing regions are retained, but any masks, bands and statistics are discarded.
	 *
	 * @param path
	 * @param downscale factor applied to the width and height; this is clamped to the range 0.1-1.0
	 * @param keepOriginal if true, retain an untouched copy of the image for analysis and resetting overlays
	 * @return true if the image was loaded, false if the file is missing, cannot be decoded 
	 *         or there is not enough memory to hold it
	 */
	public boolean load(Path path, double downscale, boolean keepOriginal) {
		double d = Double.isNaN(downscale) ? ProcessingConfig.MAX_DOWNSCALE :
			GeneralTools.clipValue(downscale, ProcessingConfig.MIN_DOWNSCALE, ProcessingConfig.MAX_DOWNSCALE);
		try (var tracker = MemoryTracker.start("Load image " + path, telemetry)) {
			var img = ImageBuffers.read(path);
			if (d < 1.0) {
				int w = MemoryEstimate.scaledSize(img.getWidth(), d);
				int h = MemoryEstimate.scaledSize(img.getHeight(), d);
				logger.debug("Resizing {} from {}x{} to {}x{}", path, img.getWidth(), img.getHeight(), w, h);
				img = ImageBuffers.resize(img, w, h);
			}
			setImage(img, keepOriginal);
		} catch (IOException e) {
			logger.error("Unable to load image {}: {}", path, e.getLocalizedMessage());
			logger.debug(e.getLocalizedMessage(), e);
			return false;
		} catch (OutOfMemoryError e) {
			discardImage();
			logger.error("Not enough memory to load image {}: {}", path, e.getLocalizedMessage());
			return false;
		}
		this.path = path;
		this.downscale = d;
		return true;
	}

	/**
	 * Set an image that has already been decoded.
	 * <p>
	 * The image is never modified; overlays are drawn on a copy. If {@code keepOriginal} is true, a reference
	 * to the image is retained as the original. Existing regions are retained, but any masks, bands and statistics
	 * are discarded, along with any derived data cache key.
	 *
	 * @param img the image; this will be converted to BGR if necessary
	 * @param keepOriginal if true, retain the image for analysis and resetting overlays
	 * @see #setDerivedDataCache(DerivedDataCache, String)
	 */
	public void setImage(BufferedImage img, boolean keepOriginal) {
		var imgBGR = ImageBuffers.toBGR(img);
		var active = ImageBuffers.duplicate(imgBGR);
		clearDerivedData();
		this.cacheKeyPrefix = null;
		this.path = null;
		this.downscale = 1.0;
		this.original = keepOriginal ? imgBGR : null;
		this.image = active;
		logger.debug("Set image {}x{} (keep original: {})", image.getWidth(), image.getHeight(), keepOriginal);
	}

	/**
	 * Set a cache used to share bands and statistics across engines and loads.
	 * <p>
	 * The key prefix must identify the current image and resolution uniquely.
	 * Setting or loading a new image removes the prefix, so this should be called after each load.
	 *
	 * @param cache the cache, or null to disable caching
	 * @param keyPrefix prefix for all keys related to the current image
	 */
	public void setDerivedDataCache(DerivedDataCache cache, String keyPrefix) {
		this.derivedCache = cache;
		this.cacheKeyPrefix = keyPrefix;
	}

	/**
	 * @return the path of the last image loaded from a file, or null
	 */
	public Path getPath() {
		return path;
	}

	/**
	 * @return the downscale factor applied when the image was loaded
	 */
	public double getDownscale() {
		return downscale;
	}

	/**
	 * @return true if an image is available
	 */
	public boolean hasImage() {
		return image != null;
	}

	/**
	 * @return true if the original image is retained
	 */
	public boolean hasOriginal() {
		return original != null;
	}

	/**
	 * @return the image width, or 0 if there is no image
	 */
	public int getWidth() {
		return image == null ? 0 : image.getWidth();
	}

	/**
	 * @return the image height, or 0 if there is no image
	 */
	public int getHeight() {
		return image == null ? 0 : image.getHeight();
	}

	/**
	 * Get the current image.
	 * <p>
	 * The image returned is the engine's own buffer; callers should not modify it.
	 *
	 * @param withOverlays if true, return the image with region overlays; otherwise return the original
	 * @return the image, or null if no image is available
	 */
	public BufferedImage getImage(boolean withOverlays) {
		if (image == null) {
			logger.debug("No image loaded");
			return null;
		}
		if (withOverlays)
			return image;
		if (original == null) {
			logger.warn("Original image was released - returning current image");
			return image;
		}
		return original;
	}

	/**
	 * Release the original image to save memory.
	 * After this, overlays cannot be reset and analysis uses the image with overlays.
	 */
	public void releaseOriginal() {
		if (original != null) {
			try (var tracker = MemoryTracker.start("Release original image", telemetry, true)) {
				original = null;
			}
			logger.debug("Released original image");
		}
	}

	/**
	 * Restore the image from the original, removing any overlays.
	 * Regions are retained.
	 */
	public void resetImage() {
		if (original == null) {
			logger.warn("Original image was released - cannot reset");
			return;
		}
		image = ImageBuffers.duplicate(original);
	}

	/**
	 * Discard the image and derived data after a failed load, keeping regions.
	 */
	private void discardImage() {
		image = null;
		original = null;
		path = null;
		downscale = 1.0;
		cacheKeyPrefix = null;
		clearDerivedData();
	}

	/**
	 * Discard the image, regions and all derived data.
	 */
	public void reset() {
		image = null;
		original = null;
		path = null;
		downscale = 1.0;
		cacheKeyPrefix = null;
		regions.clear();
		clearDerivedData();
	}

	/**
	 * Remove all regions, along with their masks and statistics.
	 * The image is not changed.
	 */
	public void clearRegions() {
		regions.clear();
		masks.clear();
		regionStatistics.clear();
	}

	private void clearDerivedData() {
		masks.clear();
		regionStatistics.clear();
		rgbBands = null;
		chromaticBands = null;
	}

	/**
	 * Image used as the source for analysis.
	 */
	private BufferedImage getSourceImage() {
		return original != null ? original : image;
	}

	/**
	 * Get a region by name.
	 * @param name
	 * @return the region, or null if not found
	 */
	public Region getRegion(String name) {
		return regions.get(name);
	}

	/**
	 * @return an unmodifiable set of region names, in the order they were added
	 */
	public Set<String> getRegionNames() {
		return Collections.unmodifiableSet(regions.keySet());
	}

	/**
	 * @return an unmodifiable view of all regions, keyed by name
	 */
	public Map<String, Region> getRegions() {
		return Collections.unmodifiableMap(regions);
	}

	/**
	 * Add a region without drawing it, replacing any existing region with the same name.
	 * @param region
	 */
	public void addRegion(Region region) {
		String name = region.getName();
		var previous = regions.put(name, region);
		if (previous != null) {
			logger.debug("Replacing region {}", name);
			masks.remove(name);
			regionStatistics.remove(name);
			if (isCaching())
				derivedCache.removeByPrefix(cacheKeyPrefix + KEY_ROI_STATS + name + ":");
		}
	}

	/**
	 * Add a region and draw it on the image.
	 * <p>
	 * The outline is drawn with the region's color and thickness, then if the region's alpha is greater than 0
	 * the pixels inside the region are blended with its color.
	 *
	 * @param region
	 */
	public void overlayRegion(Region region) {
		if (image == null) {
			logger.warn("Cannot overlay region {} - no image loaded", region.getName());
			return;
		}
		addRegion(region);
		drawRegion(region);
	}

	private void drawRegion(Region region) {
		Graphics2D g2d = image.createGraphics();
		try {
			g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_OFF);
			g2d.setColor(new Color(region.getColor()));
			g2d.setStroke(new BasicStroke(region.getThickness(), BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND));
			int[] x = region.getXPoints();
			int[] y = region.getYPoints();
			if (region.isClosed())
				g2d.drawPolygon(x, y, x.length);
			else
				g2d.drawPolyline(x, y, x.length);
		} finally {
			g2d.dispose();
		}

		double alpha = region.getAlpha();
		if (alpha <= 0)
			return;
		var mask = getRegionMask(region.getName());
		if (mask.isEmpty())
			return;
		int rgb = region.getColor();
		// Blend in BGR storage order
		double[] color = {ColorTools.blue(rgb), ColorTools.green(rgb), ColorTools.red(rgb)};
		byte[] pixels = ImageBuffers.getBGRPixels(image);
		byte[] maskArray = mask.getArray();
		var bounds = mask.getBounds();
		int width = image.getWidth();
		for (int yy = bounds.y; yy < bounds.y + bounds.height; yy++) {
			for (int xx = bounds.x; xx < bounds.x + bounds.width; xx++) {
				int i = yy * width + xx;
				if (maskArray[i] == 0)
					continue;
				for (int c = 0; c < 3; c++) {
					int ind = i * 3 + c;
					double val = alpha * color[c] + (1 - alpha) * (pixels[ind] & 0xFF);
					pixels[ind] = (byte)ColorTools.clip255((int)Math.round(val));
				}
			}
		}
	}

	/**
	 * Replace all regions, overlaying the new regions on a fresh copy of the original image.
	 * @param regions regions keyed by name; if null or empty, a default region is created
	 * @see #overlayRegionsFromMap(Map, boolean)
	 */
	public void overlayRegionsFromMap(Map<String, Region> regions) {
		overlayRegionsFromMap(regions, true);
	}

	/**
	 * Replace all regions.
	 * <p>
	 * The image is first reset from the original (if available) and all existing regions are removed.
	 * If no regions are provided, a default region is created that excludes any sky.
	 *
	 * Regions are registered under their map keys. If a region's own name differs from its key,
	 * a warning is logged and the region is renamed to match the key.
	 *
	 * @param regions regions keyed by name; if null or empty, a default region is created
	 * @param drawOverlays if true, draw the regions on the image; otherwise, only register them for analysis
	 */
	public void overlayRegionsFromMap(Map<String, Region> regions, boolean drawOverlays) {
		if (image == null) {
			logger.warn("Cannot overlay regions - no image loaded");
			return;
		}
		if (original != null)
			image = ImageBuffers.duplicate(original);
		clearRegions();
		if (regions == null || regions.isEmpty()) {
			createDefaultRegion(drawOverlays);
			return;
		}
		for (var entry : regions.entrySet()) {
			var name = entry.getKey();
			var region = entry.getValue();
			if (name == null || region == null) {
				logger.warn("Skipping null region entry {}", name);
				continue;
			}
			if (!name.equals(region.getName())) {
				logger.warn("Region '{}' stored under key '{}' - using the key as the name", region.getName(), name);
				region = region.withName(name);
			}
			if (drawOverlays)
				overlayRegion(region);
			else
				addRegion(region);
		}
		logger.debug("Applied {} regions (draw overlays: {})", regions.size(), drawOverlays);
	}

	/**
	 * Create and draw the default region {@value SkyDetector#DEFAULT_REGION_NAME}, covering the image
	 * below any detected sky.
	 * @see SkyDetector
	 */
	public void createDefaultRegion() {
		createDefaultRegion(true);
	}

	private void createDefaultRegion(boolean draw) {
		if (image == null) {
			logger.warn("Cannot create default region - no image loaded");
			return;
		}
		var region = SkyDetector.createDefaultRegion(getSourceImage(), CHUNK_ROWS);
		if (draw)
			overlayRegion(region);
		else
			addRegion(region);
	}

	/**
	 * Get the mask for a region, creating it if necessary.
	 * @param name
	 * @return the mask, or null if the region or image is not available
	 */
	public RegionMask getRegionMask(String name) {
		var region = regions.get(name);
		if (region == null || image == null)
			return null;
		var mask = masks.get(name);
		if (mask == null || mask.getWidth() != image.getWidth() || mask.getHeight() != image.getHeight()) {
			mask = RegionMask.build(region, image.getWidth(), image.getHeight());
			masks.put(name, mask);
		}
		return mask;
	}

	/**
	 * Get the red, green and blue channels of the image.
	 * @return the bands, or null if no image is available
	 * @see #computeRGBBands(boolean)
	 */
	public BandSet computeRGBBands() {
		return computeRGBBands(false);
	}

	/**
	 * Get the red, green and blue channels of the image.
	 * <p>
	 * Results are cached, so the same instance is returned until the image changes or a recompute is forced.
	 *
	 * @param forceRecompute if true, ignore any cached bands
	 * @return the bands, or null if no image is available
	 */
	public BandSet computeRGBBands(boolean forceRecompute) {
		var source = getSourceImage();
		if (source == null) {
			logger.warn("Cannot compute RGB bands - no image loaded");
			return null;
		}
		if (!forceRecompute) {
			if (rgbBands != null && rgbBands.hasSize(source.getWidth(), source.getHeight()))
				return rgbBands;
			var cached = getCachedBands(BandType.RGB, source);
			if (cached != null) {
				rgbBands = cached;
				return rgbBands;
			}
		}
		try (var tracker = MemoryTracker.start("Compute RGB bands", telemetry)) {
			rgbBands = createRGBBands(source);
		}
		putCachedBands(rgbBands);
		return rgbBands;
	}

	private static BandSet createRGBBands(BufferedImage source) {
		int width = source.getWidth();
		int height = source.getHeight();
		int n = width * height;
		byte[] pixels = ImageBuffers.getBGRPixels(source);
		byte[] r = new byte[n];
		byte[] g = new byte[n];
		byte[] b = new byte[n];
		for (int i = 0; i < n; i++) {
			b[i] = pixels[i * 3];
			g[i] = pixels[i * 3 + 1];
			r[i] = pixels[i * 3 + 2];
		}
		return new BandSet(BandType.RGB,
				SimpleImages.createByteImage(r, width, height),
				SimpleImages.createByteImage(g, width, height),
				SimpleImages.createByteImage(b, width, height),
				null);
	}

	/**
	 * Get the chromatic coordinates of the image.
	 * @return the bands, or null if no image is available
	 * @see #computeChromaticCoordinates(boolean)
	 */
	public BandSet computeChromaticCoordinates() {
		return computeChromaticCoordinates(false);
	}

	/**
	 * Compute chromatic coordinates, i.e. r = R/(R+G+B), g = G/(R+G+B) and b = B/(R+G+B).
	 * <p>
	 * Where R+G+B is 0 the denominator is taken to be 1. The result includes a color composite,
	 * in which each band is independently scaled to the range 0-255.
	 * <p>
	 * Results are cached, so the same instance is returned until the image changes or a recompute is forced.
	 *
	 * @param forceRecompute if true, ignore any cached bands
	 * @return the bands, or null if no image is available
	 */
	public BandSet computeChromaticCoordinates(boolean forceRecompute) {
		var source = getSourceImage();
		if (source == null) {
			logger.warn("Cannot compute chromatic coordinates - no image loaded");
			return null;
		}
		if (!forceRecompute) {
			if (chromaticBands != null && chromaticBands.hasSize(source.getWidth(), source.getHeight()))
				return chromaticBands;
			var cached = getCachedBands(BandType.CHROMATIC, source);
			if (cached != null) {
				chromaticBands = cached;
				return chromaticBands;
			}
		}
		try (var tracker = MemoryTracker.start("Compute chromatic coordinates", telemetry)) {
			chromaticBands = createChromaticBands(source);
		}
		putCachedBands(chromaticBands);
		return chromaticBands;
	}

	private static BandSet createChromaticBands(BufferedImage source) {
		int width = source.getWidth();
		int height = source.getHeight();
		int n = width * height;
		byte[] pixels = ImageBuffers.getBGRPixels(source);
		float[] r = new float[n];
		float[] g = new float[n];
		float[] b = new float[n];

		int chunkRows = Math.min(CHUNK_ROWS, height);
		float[] sums = new float[chunkRows * width];
		for (int yStart = 0; yStart < height; yStart += chunkRows) {
			int yEnd = Math.min(yStart + chunkRows, height);
			int offset = yStart * width;
			int count = (yEnd - yStart) * width;
			for (int k = 0; k < count; k++) {
				int ind = (offset + k) * 3;
				int sum = (pixels[ind] & 0xFF) + (pixels[ind + 1] & 0xFF) + (pixels[ind + 2] & 0xFF);
				sums[k] = sum == 0 ? 1f : sum;
			}
			for (int k = 0; k < count; k++) {
				int i = offset + k;
				int ind = i * 3;
				b[i] = (pixels[ind] & 0xFF) / sums[k];
				g[i] = (pixels[ind + 1] & 0xFF) / sums[k];
				r[i] = (pixels[ind + 2] & 0xFF) / sums[k];
			}
		}

		var composite = ImageBuffers.createBGR(width, height);
		byte[] compositePixels = ImageBuffers.getBGRPixels(composite);
		normalizeToBytes(b, compositePixels, 0, 3);
		normalizeToBytes(g, compositePixels, 1, 3);
		normalizeToBytes(r, compositePixels, 2, 3);

		return new BandSet(BandType.CHROMATIC,
				SimpleImages.createFloatImage(r, width, height),
				SimpleImages.createFloatImage(g, width, height),
				SimpleImages.createFloatImage(b, width, height),
				composite);
	}

	/**
	 * Scale values linearly so that the minimum becomes 0 and the maximum 255, writing to every
	 * {@code stride} byte of the output starting at {@code offset}.
	 * A band with a constant value becomes 0.
	 */
	static void normalizeToBytes(float[] values, byte[] output, int offset, int stride) {
		float min = Float.POSITIVE_INFINITY;
		float max = Float.NEGATIVE_INFINITY;
		for (float v : values) {
			if (v < min)
				min = v;
			if (v > max)
				max = v;
		}
		double scale = max > min ? 255.0 / (max - min) : 0;
		for (int i = 0; i < values.length; i++) {
			int val = (int)Math.round((values[i] - min) * scale);
			output[offset + i * stride] = (byte)ColorTools.clip255(val);
		}
	}

	/**
	 * Derived data is only shared when computed from the original, since the image with overlays
	 * depends upon the regions drawn.
	 */
	private boolean isCaching() {
		return derivedCache != null && cacheKeyPrefix != null && original != null;
	}

	private BandSet getCachedBands(BandType type, BufferedImage source) {
		if (!isCaching())
			return null;
		var cached = derivedCache.get(cacheKeyPrefix + ":" + type.getKey(), BandSet.class);
		if (cached == null)
			return null;
		if (cached.getType() != type || !cached.hasSize(source.getWidth(), source.getHeight())) {
			logger.warn("Ignoring cached {} bands with size {}x{}", type, cached.getWidth(), cached.getHeight());
			return null;
		}
		logger.debug("Using cached {} bands", type);
		return cached;
	}

	private void putCachedBands(BandSet bands) {
		if (isCaching())
			derivedCache.put(cacheKeyPrefix + ":" + bands.getType().getKey(), bands);
	}

	/**
	 * Get one band as an 8-bit image, suitable for display or export.
	 * <p>
	 * RGB bands are returned unchanged; chromatic bands are scaled to the range 0-255.
	 * The chromatic band {@value BandSet#COMPOSITE} returns the color composite.
	 *
	 * @param type
	 * @param bandName "r", "g", "b" or (for chromatic bands only) "composite"
	 * @return the image, or null if the band is not available
	 */
	public BufferedImage getBandImage(BandType type, String bandName) {
		var bands = type == BandType.RGB ? computeRGBBands(false) : computeChromaticCoordinates(false);
		if (bands == null)
			return null;
		if (BandSet.COMPOSITE.equals(bandName)) {
			if (bands.getComposite() == null)
				logger.warn("No composite available for {} bands", type);
			return bands.getComposite();
		}
		var band = bands.getBand(bandName);
		if (band == null) {
			logger.warn("Invalid {} band name '{}'", type, bandName);
			return null;
		}
		int width = band.getWidth();
		int height = band.getHeight();
		if (band instanceof ByteSimpleImage)
			return ImageBuffers.createGray(((ByteSimpleImage)band).getArray(true), width, height);
		byte[] bytes = new byte[width * height];
		normalizeToBytes(SimpleImages.getPixels(band, true), bytes, 0, 1);
		return ImageBuffers.createGray(bytes, width, height);
	}

	/**
	 * Compute RGB and chromatic statistics for a region.
	 * @param name
	 * @return the statistics; this is empty if the region is not found
	 * @see #analyzeRegion(String, boolean, boolean)
	 */
	public RegionStatistics analyzeRegion(String name) {
		return analyzeRegion(name, false, false);
	}

	/**
	 * Compute statistics for each band within a region.
	 * <p>
	 * For each band the mean, population standard deviation, minimum, maximum and sum are calculated.
	 * If the region contains no pixels, all values are zero.
	 *
	 * @param name region name
	 * @param skipChromatic if true, do not compute chromatic coordinate statistics
	 * @param skipRGB if true, do not compute RGB statistics
	 * @return the statistics; this is empty if the region is not found
	 */
	public RegionStatistics analyzeRegion(String name, boolean skipChromatic, boolean skipRGB) {
		var mask = getRegionMask(name);
		if (mask == null) {
			logger.warn("Region '{}' not found", name);
			return RegionStatistics.empty(name);
		}
		String cacheKey = null;
		if (isCaching()) {
			var region = regions.get(name);
			cacheKey = cacheKeyPrefix + KEY_ROI_STATS + name + ":" + mask.getWidth() + "x" + mask.getHeight() + ":"
					+ region.getShapeKey() + ":" + (skipChromatic ? "-" : "c") + (skipRGB ? "-" : "r");
			var cached = derivedCache.get(cacheKey, RegionStatistics.class);
			if (cached != null) {
				logger.debug("Using cached statistics for {}", name);
				regionStatistics.put(name, cached);
				return cached;
			}
		}

		Map<String, BandStatistics> rgbStats = null;
		if (!skipRGB)
			rgbStats = computeBandStatistics(computeRGBBands(false), mask);
		Map<String, BandStatistics> chromaticStats = null;
		if (!skipChromatic)
			chromaticStats = computeBandStatistics(computeChromaticCoordinates(false), mask);

		var stats = new RegionStatistics(name, rgbStats, chromaticStats);
		regionStatistics.put(name, stats);
		if (cacheKey != null)
			derivedCache.put(cacheKey, stats);
		return stats;
	}

	private static Map<String, BandStatistics> computeBandStatistics(BandSet bands, RegionMask mask) {
		var map = new LinkedHashMap<String, BandStatistics>();
		var bounds = mask.getBounds();
		byte[] maskArray = mask.getArray();
		int width = mask.getWidth();
		for (var entry : bands.getBands().entrySet()) {
			var stats = new RunningStatistics();
			if (bounds != null) {
				SimpleImage band = entry.getValue();
				for (int y = bounds.y; y < bounds.y + bounds.height; y++) {
					for (int x = bounds.x; x < bounds.x + bounds.width; x++) {
						if (maskArray[y * width + x] != 0)
							stats.addValue(band.getValue(x, y));
					}
				}
			}
			map.put(entry.getKey(), BandStatistics.of(stats));
		}
		return map;
	}

	/**
	 * Compute band statistics for every region.
	 * <p>
	 * Bands are computed once and shared by all regions. Results are also retained and available
	 * from {@link #getRegionStatistics()}.
	 *
	 * @param skipList names of regions to skip; may be null
	 * @param skipChromatic if true, do not compute chromatic coordinate statistics
	 * @param skipRGB if true, do not compute RGB statistics
	 * @return an unmodifiable map of statistics, in the order regions were added; empty if there are no regions
	 */
	public Map<String, RegionStatistics> analyzeAllRegions(Collection<String> skipList, boolean skipChromatic, boolean skipRGB) {
		if (regions.isEmpty()) {
			logger.warn("No regions defined");
			return Collections.emptyMap();
		}
		regionStatistics.clear();
		Set<String> skip = skipList == null ? Collections.emptySet() : new HashSet<>(skipList);

		try (var tracker = MemoryTracker.start("Analyze " + regions.size() + " regions", telemetry)) {
			if (!skipRGB)
				computeRGBBands(false);
			if (!skipChromatic)
				computeChromaticCoordinates(false);

			var results = new LinkedHashMap<String, RegionStatistics>();
			for (var name : regions.keySet()) {
				if (skip.contains(name)) {
					logger.info("Skipping region '{}' as requested", name);
					continue;
				}
				results.put(name, analyzeRegion(name, skipChromatic, skipRGB));
			}
			return Collections.unmodifiableMap(results);
		}
	}

	/**
	 * Compute band statistics for every region.
	 * @return
	 * @see #analyzeAllRegions(Collection, boolean, boolean)
	 */
	public Map<String, RegionStatistics> analyzeAllRegions() {
		return analyzeAllRegions(List.of(), false, false);
	}

	/**
	 * @return an unmodifiable map of the most recent statistics computed for each region
	 */
	public Map<String, RegionStatistics> getRegionStatistics() {
		return Collections.unmodifiableMap(regionStatistics);
	}

	/**
	 * Compute detailed measurements for a region.
	 * <p>
	 * Pixels are summed in chunks of rows. The vegetation index (G-R)/(G+R) is computed for pixels inside
	 * the region where G+R is greater than 0.
	 *
	 * @param name region name
	 * @param computeHistograms if true, compute 256-bin histograms for each channel
	 * @param computeVegetation if true, compute vegetation index statistics
	 * @return the measurements; this is empty if the region is not found
	 */
	public ExtendedRegionStatistics analyzeRegionExtended(String name, boolean computeHistograms, boolean computeVegetation) {
		var mask = getRegionMask(name);
		if (mask == null) {
			logger.warn("Region '{}' not found", name);
			return ExtendedRegionStatistics.empty(name);
		}
		var source = getSourceImage();
		byte[] pixels = ImageBuffers.getBGRPixels(source);
		byte[] maskArray = mask.getArray();
		int width = mask.getWidth();
		int height = mask.getHeight();

		double sumRed = 0, sumGreen = 0, sumBlue = 0;
		long count = 0;
		var vegetation = computeVegetation ? new RunningStatistics() : null;
		long[] histRed = null, histGreen = null, histBlue = null;
		if (computeHistograms) {
			histRed = new long[HISTOGRAM_BINS];
			histGreen = new long[HISTOGRAM_BINS];
			histBlue = new long[HISTOGRAM_BINS];
		}

		int chunkRows = Math.min(CHUNK_ROWS, height);
		for (int yStart = 0; yStart < height; yStart += chunkRows) {
			int yEnd = Math.min(yStart + chunkRows, height);
			if (mask.countInRows(yStart, yEnd) == 0)
				continue;
			var chunkVegetation = vegetation == null ? null : new RunningStatistics();
			for (int i = yStart * width; i < yEnd * width; i++) {
				if (maskArray[i] == 0)
					continue;
				int b = pixels[i * 3] & 0xFF;
				int g = pixels[i * 3 + 1] & 0xFF;
				int r = pixels[i * 3 + 2] & 0xFF;
				sumRed += r;
				sumGreen += g;
				sumBlue += b;
				count++;
				if (histRed != null) {
					histRed[r]++;
					histGreen[g]++;
					histBlue[b]++;
				}
				if (chunkVegetation != null) {
					double denominator = g + r;
					if (denominator > VEGETATION_EPSILON)
						chunkVegetation.addValue((g - r) / denominator);
				}
			}
			if (vegetation != null)
				vegetation.add(chunkVegetation);
		}

		var meanColor = new LinkedHashMap<String, Double>();
		meanColor.put("red", count == 0 ? 0 : sumRed / count);
		meanColor.put("green", count == 0 ? 0 : sumGreen / count);
		meanColor.put("blue", count == 0 ? 0 : sumBlue / count);

		var bounds = mask.getBounds();
		var boundingRect = bounds == null ? null : new BoundingRect(bounds.x, bounds.y, bounds.width, bounds.height);

		BandStatistics vegetationStats = null;
		if (vegetation != null && vegetation.size() > 0)
			vegetationStats = BandStatistics.of(vegetation);

		Map<String, long[]> histograms = null;
		if (computeHistograms) {
			histograms = new LinkedHashMap<>();
			histograms.put("red", histRed);
			histograms.put("green", histGreen);
			histograms.put("blue", histBlue);
		}

		return new ExtendedRegionStatistics(name, meanColor, new PixelSums(sumRed, sumGreen, sumBlue, count),
				mask.getCount(), boundingRect, vegetationStats, histograms);
	}

	/**
	 * Extract the pixels of a region as a separate image, cropped to the region bounds.
	 * Pixels outside the region are set to zero.
	 *
	 * @param name
	 * @return the image, or null if the region is not found or contains no pixels
	 */
	public BufferedImage extractRegion(String name) {
		var mask = getRegionMask(name);
		if (mask == null) {
			logger.warn("Region '{}' not found", name);
			return null;
		}
		var bounds = mask.getBounds();
		if (bounds == null) {
			logger.warn("Region '{}' contains no pixels", name);
			return null;
		}
		byte[] pixels = ImageBuffers.getBGRPixels(getSourceImage());
		byte[] maskArray = mask.getArray();
		int width = mask.getWidth();
		var extracted = ImageBuffers.createBGR(bounds.width, bounds.height);
		byte[] output = ImageBuffers.getBGRPixels(extracted);
		for (int y = 0; y < bounds.height; y++) {
			for (int x = 0; x < bounds.width; x++) {
				int i = (bounds.y + y) * width + bounds.x + x;
				if (maskArray[i] == 0)
					continue;
				int j = (y * bounds.width + x) * 3;
				output[j] = pixels[i * 3];
				output[j + 1] = pixels[i * 3 + 1];
				output[j + 2] = pixels[i * 3 + 2];
			}
		}
		return extracted;
	}

	/**
	 * Create a smaller copy of the image with overlays, preserving the aspect ratio.
	 * @param maxWidth
	 * @param maxHeight
	 * @return the thumbnail, or null if there is no image
	 */
	public BufferedImage createThumbnail(int maxWidth, int maxHeight) {
		if (image == null)
			return null;
		if (maxWidth < 1 || maxHeight < 1)
			throw new IllegalArgumentException("Thumbnail size must be positive, but was " + maxWidth + "x" + maxHeight);
		double scale = Math.min(1.0, Math.min(maxWidth / (double)image.getWidth(), maxHeight / (double)image.getHeight()));
		int w = Math.max(1, (int)Math.round(image.getWidth() * scale));
		int h = Math.max(1, (int)Math.round(image.getHeight() * scale));
		return ImageBuffers.duplicate(ImageBuffers.resize(image, w, h));
	}

	/**
	 * Save the image with overlays at the default JPEG quality.
	 * @param path
	 * @return true if the image was saved
	 */
	public boolean save(Path path) {
		return save(path, ImageBuffers.DEFAULT_JPEG_QUALITY);
	}

	/**
	 * Save the image with overlays, choosing the format from the file extension.
	 * @param path
	 * @param quality JPEG quality, 0-100
	 * @return true if the image was saved
	 */
	public boolean save(Path path, int quality) {
		if (image == null) {
			logger.error("Cannot save {} - no image loaded", path);
			return false;
		}
		try {
			ImageBuffers.write(image, path, quality);
			return true;
		} catch (IOException e) {
			logger.error("Error saving image to {}: {}", path, e.getLocalizedMessage());
			logger.debug(e.getLocalizedMessage(), e);
			return false;
		}
	}

}
