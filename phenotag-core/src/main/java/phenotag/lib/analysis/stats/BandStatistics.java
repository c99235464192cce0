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

package phenotag.lib.analysis.stats;

import java.util.Locale;

/**
 * Summary statistics of one band within a region.
 * <p>
 * The standard deviation is the population standard deviation. 
 * A band with no pixels has all values set to zero, rather than NaN, so that results remain serializable 
 * and comparable across images.
 * 
 * @author PhenoTag developers
 */
public class BandStatistics {
	
	private static final BandStatistics EMPTY = new BandStatistics(0, 0, 0, 0, 0, 0);
	
	private final double mean;
	private final double std;
	private final double min;
	private final double max;
	private final double sum;
	private final long pixels;
	
	/**
	 * Constructor.
	 * @param mean
	 * @param std
	 * @param min
	 * @param max
	 * @param sum
	 * @param pixels
	 */
	public BandStatistics(double mean, double std, double min, double max, double sum, long pixels) {
		this.mean = mean;
		this.std = std;
		this.min = min;
		this.max = max;
		this.sum = sum;
		this.pixels = pixels;
	}
	
	/**
	 * Create band statistics from running statistics.
	 * @param stats
	 * @return
	 */
	public static BandStatistics of(RunningStatistics stats) {
		if (stats.size() == 0)
			return empty();
		return new BandStatistics(
				stats.getMean(),
				stats.getPopulationStdDev(),
				stats.getMin(),
				stats.getMax(),
				stats.getSum(),
				stats.size());
	}
	
	/**
	 * Get statistics representing a band with no pixels.
	 * @return
	 */
	public static BandStatistics empty() {
		return EMPTY;
	}

	/**
	 * @return the mean value
	 */
	public double getMean() {
		return mean;
	}

	/**
	 * @return the population standard deviation
	 */
	public double getStd() {
		return std;
	}

	/**
	 * @return the minimum value
	 */
	public double getMin() {
		return min;
	}

	/**
	 * @return the maximum value
	 */
	public double getMax() {
		return max;
	}

	/**
	 * @return the sum of all values
	 */
	public double getSum() {
		return sum;
	}

	/**
	 * @return the number of pixels
	 */
	public long getPixels() {
		return pixels;
	}
	
	/**
	 * @return true if no pixels contributed to the statistics
	 */
	public boolean isEmpty() {
		return pixels == 0;
	}
	
	@Override
	public String toString() {
		return String.format(Locale.ROOT, "BandStatistics[mean=%.4f, std=%.4f, min=%.4f, max=%.4f, pixels=%d]",
				mean, std, min, max, pixels);
	}

}
