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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestBandStatistics {
	
	@Test
	public void test_fromRunningStatistics() {
		var running = new RunningStatistics();
		for (double v : new double[] {2, 4, 4, 4, 5, 5, 7, 9})
			running.addValue(v);
		var stats = BandStatistics.of(running);
		assertEquals(5.0, stats.getMean(), 1e-12);
		assertEquals(2.0, stats.getStd(), 1e-10);
		assertEquals(2.0, stats.getMin());
		assertEquals(9.0, stats.getMax());
		assertEquals(40.0, stats.getSum());
		assertEquals(8, stats.getPixels());
		assertFalse(stats.isEmpty());
	}
	
	@Test
	public void test_emptyIsZeroed() {
		var stats = BandStatistics.of(new RunningStatistics());
		assertTrue(stats.isEmpty());
		assertEquals(0, stats.getMean());
		assertEquals(0, stats.getStd());
		assertEquals(0, stats.getMin());
		assertEquals(0, stats.getMax());
		assertEquals(0, stats.getSum());
		assertEquals(0, stats.getPixels());
	}

}
