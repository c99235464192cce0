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
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import phenotag.lib.common.GeneralTools;
import phenotag.lib.processing.RegionStatistics;

/**
 * Output of processing one image in a batch.
 * 
 * @author PhenoTag developers
 */
public class ImageResult {
	
	private final Path path;
	private final BufferedImage processedImage;
	private final Map<String, BufferedImage> bandImages;
	private final Map<String, RegionStatistics> statistics;
	private final double downscale;
	
	ImageResult(Path path, BufferedImage processedImage, Map<String, BufferedImage> bandImages, 
			Map<String, RegionStatistics> statistics, double downscale) {
		this.path = path;
		this.processedImage = processedImage;
		this.bandImages = bandImages == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(bandImages));
		this.statistics = statistics;
		this.downscale = downscale;
	}
	
	/**
	 * @return the input image path
	 */
	public Path getPath() {
		return path;
	}
	
	/**
	 * @return the input file name without its extension, used to name outputs
	 */
	public String getBaseName() {
		return GeneralTools.getNameWithoutExtension(path.getFileName().toString());
	}
	
	/**
	 * @return the image with any region overlays
	 */
	public BufferedImage getProcessedImage() {
		return processedImage;
	}
	
	/**
	 * @return exported band images, keyed by band type (e.g. "chromatic-r")
	 */
	public Map<String, BufferedImage> getBandImages() {
		return bandImages;
	}
	
	/**
	 * @return region statistics, or null if regions were not analyzed
	 */
	public Map<String, RegionStatistics> getStatistics() {
		return statistics;
	}
	
	/**
	 * @return the downscale factor used when loading the image
	 */
	public double getDownscale() {
		return downscale;
	}
	
	@Override
	public String toString() {
		return "ImageResult[" + path + ", bands=" + bandImages.keySet() + ", regions=" 
				+ (statistics == null ? "not analyzed" : statistics.keySet()) + "]";
	}

}
