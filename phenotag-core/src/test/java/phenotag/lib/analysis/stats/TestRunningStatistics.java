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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestRunningStatistics {
	
	private static final RunningStatistics stats = new RunningStatistics();
	private static final List<Double> list = new ArrayList<>();
	
	@BeforeAll
	public static void test_addValues() {
		Random random = new Random(100L);
		int size = 1 + random.nextInt(10_000);
		
		for (int i = 0; i < size; i++)
			list.add(random.nextDouble());
		
		list.add(Double.NaN);
		
		for (int i = 0; i < size; i++)
			list.add(random.nextDouble() * 255);
		
		list.add(Double.NaN);
		
		for (var val : list)
			stats.addValue(val);
		
		// NaNs are not counted
		assertEquals(list.size() - 2, stats.size());
	}
	
	private static double[] values() {
		return list.stream().filter(e -> !e.isNaN()).mapToDouble(e -> e).toArray();
	}
	
	@Test
	public void test_numNaNs() {
		assertEquals(2, stats.getNumNaNs());
	}
	
	@Test
	public void test_metrics() {
		double[] array = values();
		
		assertEquals(Arrays.stream(array).sum(), stats.getSum(), 0.0002);
		assertEquals(Arrays.stream(array).average().getAsDouble(), stats.getMean(), 0.0002);
		assertEquals(new Variance(true).evaluate(array), stats.getVariance(), 0.0002);
		assertEquals(new StandardDeviation(true).evaluate(array), stats.getStdDev(), 0.0002);
		
		Arrays.sort(array);
		assertEquals(array[0], stats.getMin());
		assertEquals(array[array.length-1], stats.getMax());
		assertEquals(array[array.length-1] - array[0], stats.getRange());
	}
	
	@Test
	public void test_populationMetrics() {
		double[] array = values();
		assertEquals(new Variance(false).evaluate(array), stats.getPopulationVariance(), 0.0002);
		assertEquals(new StandardDeviation(false).evaluate(array), stats.getPopulationStdDev(), 0.0002);
	}
	
	@Test
	public void test_merge() {
		double[] array = values();
		var merged = new RunningStatistics();
		int chunk = 500;
		for (int start = 0; start < array.length; start += chunk) {
			var chunkStats = new RunningStatistics();
			for (int i = start; i < Math.min(array.length, start + chunk); i++)
				chunkStats.addValue(array[i]);
			merged.add(chunkStats);
		}
		// Merging an empty instance changes nothing
		merged.add(new RunningStatistics());
		
		assertEquals(stats.size(), merged.size());
		assertEquals(stats.getMean(), merged.getMean(), 1e-9);
		assertEquals(stats.getPopulationVariance(), merged.getPopulationVariance(), 1e-6);
		assertEquals(stats.getMin(), merged.getMin());
		assertEquals(stats.getMax(), merged.getMax());
		assertEquals(stats.getSum(), merged.getSum(), 1e-6);
	}
	
	@Test
	public void test_empty() {
		var empty = new RunningStatistics();
		assertEquals(0, empty.size());
		assertTrue(Double.isNaN(empty.getMean()));
		assertTrue(Double.isNaN(empty.getMin()));
		assertTrue(Double.isNaN(empty.getPopulationStdDev()));
	}
	
	@Test
	public void test_constantValues() {
		var constant = new RunningStatistics();
		for (int i = 0; i < 1000; i++)
			constant.addValue(10);
		assertEquals(10, constant.getMean());
		assertEquals(0, constant.getPopulationStdDev());
		assertEquals(10_000, constant.getSum());
	}
	
}
