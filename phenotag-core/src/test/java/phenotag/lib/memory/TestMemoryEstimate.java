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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@SuppressWarnings("javadoc")
public class TestMemoryEstimate {
	
	@Test
	public void test_multipliers() {
		// 1024 x 1024 x 3 bytes = 3 MiB
		var estimate = MemoryEstimate.estimate(1024, 1024, 3, 1);
		assertEquals(3.0, estimate.getBaseMB(), 1e-9);
		assertEquals(3.0, estimate.getLoadedMB(), 1e-9);
		assertEquals(6.0, estimate.getWithCopyMB(), 1e-9);
		assertEquals(9.0, estimate.getWithProcessingMB(), 1e-9);
		assertEquals(12.0, estimate.getWithMasksMB(), 1e-9);
		assertEquals(13.5, estimate.getRecommendedMinMB(), 1e-9);
	}
	
	@Test
	public void test_monotonicInDownscale() {
		double last = Double.POSITIVE_INFINITY;
		for (double d = 1.0; d >= 0.1; d -= 0.05) {
			var estimate = MemoryEstimate.estimate(6000, 4000, 3, 1, d);
			assertTrue(estimate.getWithProcessingMB() <= last);
			last = estimate.getWithProcessingMB();
		}
	}
	
	@ParameterizedTest
	@CsvSource({
		"6000, 0.5, 3000",
		"6000, 0.1, 600",
		"5, 0.1, 1",
		"0, 0.5, 0",
		"999, 1.0, 999"
	})
	public void test_scaledSize(int size, double downscale, int expected) {
		assertEquals(expected, MemoryEstimate.scaledSize(size, downscale));
	}
	
	@Test
	public void test_invalidArguments() {
		assertThrows(IllegalArgumentException.class, () -> MemoryEstimate.estimate(-1, 100, 3, 1));
		assertThrows(IllegalArgumentException.class, () -> MemoryEstimate.estimate(100, 100, 3, 1, 0));
		assertThrows(IllegalArgumentException.class, () -> MemoryEstimate.estimate(100, 100, 3, 1, 1.5));
	}

}
