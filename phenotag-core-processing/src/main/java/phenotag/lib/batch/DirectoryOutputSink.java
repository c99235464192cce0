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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import phenotag.lib.images.ImageBuffers;
import phenotag.lib.io.RegionIO;

/**
 * Writes batch results to a directory.
 * <p>
 * For an input {@code name.jpg} this writes
 * <ul>
 *   <li>{@code name_processed.jpg}: the image with overlays</li>
 *   <li>{@code bands/name_<band>.png}: each exported band</li>
 *   <li>{@code statistics/name_roi_stats.json}: region statistics, if computed</li>
 * </ul>
 * 
 * @author PhenoTag developers
 */
public class DirectoryOutputSink implements OutputSink {
	
	private static final Logger logger = LoggerFactory.getLogger(DirectoryOutputSink.class);
	
	static final String DIR_BANDS = "bands";
	static final String DIR_STATISTICS = "statistics";
	
	private final Path directory;
	private final int jpegQuality;
	
	/**
	 * Create a sink writing JPEGs with the default quality.
	 * @param directory
	 */
	public DirectoryOutputSink(Path directory) {
		this(directory, ImageBuffers.DEFAULT_JPEG_QUALITY);
	}
	
	/**
	 * Create a sink.
	 * @param directory output directory; this is created if necessary
	 * @param jpegQuality quality for the processed image, 0-100
	 */
	public DirectoryOutputSink(Path directory, int jpegQuality) {
		this.directory = Objects.requireNonNull(directory);
		this.jpegQuality = jpegQuality;
	}
	
	/**
	 * @return the output directory
	 */
	public Path getDirectory() {
		return directory;
	}

	@Override
	public void accept(ImageResult result) throws IOException {
		String base = result.getBaseName();
		Files.createDirectories(directory);
		
		if (!result.getBandImages().isEmpty()) {
			var bandDir = Files.createDirectories(directory.resolve(DIR_BANDS));
			for (var entry : result.getBandImages().entrySet()) {
				var bandPath = bandDir.resolve(base + "_" + entry.getKey() + ".png");
				ImageBuffers.write(entry.getValue(), bandPath, jpegQuality);
				logger.debug("Saved band image {}", bandPath);
			}
		}
		
		if (result.getStatistics() != null) {
			var statsPath = directory.resolve(DIR_STATISTICS).resolve(base + "_roi_stats.json");
			var output = new LinkedHashMap<String, Object>();
			output.put("roi_band_stats", result.getStatistics());
			RegionIO.writeStatistics(output, statsPath);
			logger.debug("Saved region statistics {}", statsPath);
		}
		
		if (result.getProcessedImage() != null) {
			var imagePath = directory.resolve(base + "_processed.jpg");
			ImageBuffers.write(result.getProcessedImage(), imagePath, jpegQuality);
			logger.info("Saved processed image {}", imagePath);
		}
	}

}
