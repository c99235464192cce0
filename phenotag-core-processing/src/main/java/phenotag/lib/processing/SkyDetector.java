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

import java.awt.image.BufferedImage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import phenotag.lib.common.ColorTools;
import phenotag.lib.images.ImageBuffers;
import phenotag.lib.roi.Region;

/**
 * Heuristic to find the lower edge of the sky in an outdoor image, used to create a default region 
 * that excludes it.
 * <p>
 * Only the top third of the image is examined. Rows are tested in chunks, every fifth row, 
 * and a row is considered to be sky if more than 30% of its pixels have a blue sky or a white/overcast 
 * sky color in 8-bit HSV (H 0-180, S and V 0-255). The sky line is the lowest such row, plus 10%.
 * <p>
 * This is an approximation only.
 * 
 * @author PhenoTag developers
 */
public class SkyDetector {
	
	private static final Logger logger = LoggerFactory.getLogger(SkyDetector.class);
	
	/**
	 * Name of the default region.
	 */
	public static final String DEFAULT_REGION_NAME = "ROI_00";
	
	static final int ROW_STEP = 5;
	static final double SKY_ROW_FRACTION = 0.3;
	static final double MARGIN = 1.1;
	
	// Lower and upper HSV bounds, inclusive
	private static final int[] BLUE_SKY_MIN = {90, 50, 150};
	private static final int[] BLUE_SKY_MAX = {140, 255, 255};
	private static final int[] WHITE_SKY_MIN = {0, 0, 180};
	private static final int[] WHITE_SKY_MAX = {180, 50, 255};
	
	private static final int DEFAULT_THICKNESS = 3;
	private static final double DEFAULT_ALPHA = 0.2;
	
	private SkyDetector() {
		throw new AssertionError();
	}
	
	/**
	 * Find the row below which the image is not expected to contain sky.
	 * @param img packed BGR image
	 * @param chunkRows maximum number of rows to process at a time
	 * @return the sky line, or 0 if no sky was found
	 */
	public static int detectSkyLine(BufferedImage img, int chunkRows) {
		int width = img.getWidth();
		int height = img.getHeight();
		byte[] pixels = ImageBuffers.getBGRPixels(img);
		
		int topThird = height / 3;
		int chunk = Math.max(1, Math.min(chunkRows, height));
		int[] hsv = new int[3];
		int skyRow = -1;
		
		for (int yStart = 0; yStart < topThird; yStart += chunk) {
			int yEnd = Math.min(yStart + chunk, topThird);
			for (int y = yStart; y < yEnd; y += ROW_STEP) {
				int count = 0;
				int offset = y * width * 3;
				for (int x = 0; x < width; x++) {
					int ind = offset + x * 3;
					ColorTools.rgbToHsv8(pixels[ind + 2] & 0xFF, pixels[ind + 1] & 0xFF, pixels[ind] & 0xFF, hsv);
					if (inRange(hsv, BLUE_SKY_MIN, BLUE_SKY_MAX) || inRange(hsv, WHITE_SKY_MIN, WHITE_SKY_MAX))
						count++;
				}
				if (count > width * SKY_ROW_FRACTION)
					skyRow = y;
			}
		}
		if (skyRow < 0) {
			logger.debug("No sky found in top {} rows", topThird);
			return 0;
		}
		return (int)Math.min(skyRow * MARGIN, height);
	}
	
	private static boolean inRange(int[] hsv, int[] min, int[] max) {
		for (int i = 0; i < 3; i++) {
			if (hsv[i] < min[i] || hsv[i] > max[i])
				return false;
		}
		return true;
	}
	
	/**
	 * Create the default region for an image, excluding any sky.
	 * <p>
	 * If sky detection fails, the region covers the full image.
	 * 
	 * @param img packed BGR image
	 * @param chunkRows maximum number of rows to process at a time
	 * @return
	 */
	public static Region createDefaultRegion(BufferedImage img, int chunkRows) {
		int width = img.getWidth();
		int height = img.getHeight();
		int line;
		try {
			line = detectSkyLine(img, chunkRows);
		} catch (RuntimeException e) {
			logger.warn("Sky detection failed: {} - using full frame as default region", e.getLocalizedMessage());
			logger.debug(e.getLocalizedMessage(), e);
			line = 0;
		}
		var region = Region.builder(DEFAULT_REGION_NAME)
				.addPoint(0, line)
				.addPoint(width - 1, line)
				.addPoint(width - 1, height - 1)
				.addPoint(0, height - 1)
				.color(ColorTools.YELLOW)
				.thickness(DEFAULT_THICKNESS)
				.alpha(DEFAULT_ALPHA)
				.build();
		logger.info("Created default region {} with sky line at row {}", DEFAULT_REGION_NAME, line);
		return region;
	}

}
