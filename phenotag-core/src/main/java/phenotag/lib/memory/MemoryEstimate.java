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

package phenotag.lib.memory;

import java.util.Locale;

/**
 * Estimated memory requirements for processing an image of a given size.
 * <p>
 * The multipliers reflect the buffers held during processing: 
 * the loaded image, a pristine copy, working results and region masks.
 * All values are in MiB.
 * 
 * @author PhenoTag developers
 */
public class MemoryEstimate {
	
	private static final double MB = 1024.0 * 1024.0;
	
	static final double COPY_MULTIPLIER = 2.0;
	static final double PROCESSING_MULTIPLIER = 3.0;
	static final double MASKS_MULTIPLIER = 4.0;
	static final double SAFETY_MARGIN = 1.5;
	
	private final int width;
	private final int height;
	private final double baseMB;
	
	private MemoryEstimate(int width, int height, double baseMB) {
		this.width = width;
		this.height = height;
		this.baseMB = baseMB;
	}
	
	/**
	 * Estimate memory for an image at full resolution.
	 * 
	 * @param width image width in pixels
	 * @param height image height in pixels
	 * @param channels number of channels, e.g. 3 for RGB
	 * @param bytesPerSample bytes per channel value, e.g. 1 for 8-bit
	 * @return
	 * @throws IllegalArgumentException if any argument is negative
	 */
	public static MemoryEstimate estimate(int width, int height, int channels, int bytesPerSample) {
		if (width < 0 || height < 0 || channels < 0 || bytesPerSample < 0)
			throw new IllegalArgumentException(
					String.format("Invalid image description: %d x %d x %d, %d bytes per sample", width, height, channels, bytesPerSample));
		double bytes = (double)width * height * channels * bytesPerSample;
		return new MemoryEstimate(width, height, bytes / MB);
	}
	
	/**
	 * Estimate memory for an image after applying a linear downscale factor to both dimensions.
	 * 
	 * @param width full resolution width
	 * @param height full resolution height
	 * @param channels
	 * @param bytesPerSample
	 * @param downscale factor in (0, 1]
	 * @return
	 * @throws IllegalArgumentException if the downscale is not in (0, 1]
	 */
	public static MemoryEstimate estimate(int width, int height, int channels, int bytesPerSample, double downscale) {
		if (!(downscale > 0 && downscale <= 1.0))
			throw new IllegalArgumentException("Downscale must be in (0, 1], but was " + downscale);
		int w = scaledSize(width, downscale);
		int h = scaledSize(height, downscale);
		return estimate(w, h, channels, bytesPerSample);
	}
	
	/**
	 * Apply a downscale factor to an image dimension, truncating but never returning less than 1
	 * for a non-empty input.
	 * @param size
	 * @param downscale
	 * @return
	 */
	public static int scaledSize(int size, double downscale) {
		if (size <= 0)
			return 0;
		return Math.max(1, (int)(size * downscale));
	}
	
	/**
	 * @return width used for the estimate
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * @return height used for the estimate
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * @return size of the decoded pixels alone
	 */
	public double getBaseMB() {
		return baseMB;
	}

	/**
	 * @return memory once loaded (same as the base size)
	 */
	public double getLoadedMB() {
		return baseMB;
	}

	/**
	 * @return memory with an additional pristine copy
	 */
	public double getWithCopyMB() {
		return baseMB * COPY_MULTIPLIER;
	}

	/**
	 * @return memory with copy and working results
	 */
	public double getWithProcessingMB() {
		return baseMB * PROCESSING_MULTIPLIER;
	}

	/**
	 * @return memory with copy, working results and masks
	 */
	public double getWithMasksMB() {
		return baseMB * MASKS_MULTIPLIER;
	}

	/**
	 * @return recommended minimum free memory, including a safety margin over processing
	 */
	public double getRecommendedMinMB() {
		return getWithProcessingMB() * SAFETY_MARGIN;
	}
	
	@Override
	public String toString() {
		return String.format(Locale.ROOT, "MemoryEstimate[%dx%d, base=%.1fMB, processing=%.1fMB, recommended=%.1fMB]",
				width, height, baseMB, getWithProcessingMB(), getRecommendedMinMB());
	}

}
