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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helper class for computing basic statistics from values as they are added.
 * <p>
 * This is useful when iterating through pixels chunk by chunk, since the full set of masked values 
 * never needs to be held in memory.
 * <p>
 * Warning! This maintains a sum as a double; for very many pixels this may lead to some imprecision.
 * A warning is logged for particularly large values.
 * 
 * @author PhenoTag developers
 */
public class RunningStatistics {
	
	private static final Logger logger = LoggerFactory.getLogger(RunningStatistics.class);
	
	// See http://www.johndcook.com/standard_deviation.html
	
	private static final double LARGE_DOUBLE_THRESHOLD = Math.pow(2, 53) - 1;
	
	private long numNaNs = 0;
	
	private long size = 0;
	private double sum = 0, min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;

	private double m1 = 0, s1 = 0;
	
	/**
	 * Default constructor.
	 */
	public RunningStatistics() {}
	
	/**
	 * Get count of the number of non-NaN values added.
	 * @return
	 * 
	 * @see #getNumNaNs()
	 */
	public long size() {
		return size;
	}
	
	/**
	 * Add another value; NaN values are counted but do not contribute to the statistics.
	 * 
	 * @param val
	 * 
	 * @see #getNumNaNs()
	 */
	public void addValue(double val) {
		if (Double.isNaN(val)) {
			numNaNs++;
			return;
		}
		size++;
		sum += val;
		if (val < min)
			min = val;
		if (val > max)
			max = val;
		if (size == 1) {
			m1 = val;
		} else {
			double mNew = m1 + (val - m1) / size;
			s1 = s1 + (val - m1)*(val - mNew);
			m1 = mNew;
		}
	}
	
	/**
	 * Merge the values summarized by another instance into this one.
	 * <p>
	 * The result is the same as if all values had been added here, within rounding error.
	 * 
	 * @param other
	 */
	public void add(RunningStatistics other) {
		numNaNs += other.numNaNs;
		if (other.size == 0)
			return;
		if (size == 0) {
			size = other.size;
			sum = other.sum;
			min = other.min;
			max = other.max;
			m1 = other.m1;
			s1 = other.s1;
			return;
		}
		long n = size + other.size;
		double delta = other.m1 - m1;
		m1 = m1 + delta * other.size / n;
		s1 = s1 + other.s1 + delta * delta * ((double)size * other.size / n);
		size = n;
		sum += other.sum;
		min = Math.min(min, other.min);
		max = Math.max(max, other.max);
	}
	
	/**
	 * Get count of the number of NaN values added.
	 * @return
	 * 
	 * @see #size()
	 */
	public long getNumNaNs() {
		return numNaNs;
	}
	
	/**
	 * Get the sum of all non-NaN values that were added.
	 * @return
	 */
	public double getSum() {
		if (Math.abs(sum) > LARGE_DOUBLE_THRESHOLD)
			logger.warn("Sum in {} is particularly large ({}), beware imprecision!", getClass().getSimpleName(), sum);
		return sum;
	}
	
	/**
	 * Get the mean of all non-NaN values that were added.
	 * @return
	 */
	public double getMean() {
		return (size == 0) ? Double.NaN : m1;
	}
	
	/**
	 * Get the sample variance of all non-NaN values that were added.
	 * @return
	 */
	public double getVariance() {
		return (size <= 1) ? Double.NaN : s1 / (size - 1);
	}
	
	/**
	 * Get the population variance of all non-NaN values that were added, 
	 * i.e. dividing by the number of values rather than the number minus one.
	 * @return
	 */
	public double getPopulationVariance() {
		return (size == 0) ? Double.NaN : Math.max(0, s1) / size;
	}
	
	/**
	 * Get the sample standard deviation of all non-NaN values that were added.
	 * @return
	 */
	public double getStdDev() {
		return Math.sqrt(getVariance());
	}
	
	/**
	 * Get the population standard deviation of all non-NaN values that were added.
	 * @return
	 * @see #getPopulationVariance()
	 */
	public double getPopulationStdDev() {
		return Math.sqrt(getPopulationVariance());
	}
	
	/**
	 * Get the minimum non-NaN value added.
	 * @return the minimum value, or NaN if no values are available.
	 */
	public double getMin() {
		return (size == 0) ? Double.NaN : min;
	}
	
	/**
	 * Get the maximum non-NaN value added.
	 * @return the maximum value, or NaN if no values are available.
	 */
	public double getMax() {
		return (size == 0) ? Double.NaN : max;
	}
	
	/**
	 * Get the range, i.e. maximum - minimum values.
	 * @return
	 */
	public double getRange() {
		return (size == 0) ? Double.NaN : max - min;
	}
	
	@Override
	public String toString() {
		return String.format("%s Mean: %.2f, Std.dev: %.2f, Min: %.2f, Max: %.2f", RunningStatistics.class.getSimpleName(), getMean(), getStdDev(), getMin(), getMax());
	}
	
}
