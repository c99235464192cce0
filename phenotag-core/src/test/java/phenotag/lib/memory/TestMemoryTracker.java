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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestMemoryTracker {
	
	@Test
	public void test_logsStartAndEnd() {
		var reads = new AtomicInteger();
		var telemetry = new MemoryTelemetry(() -> {
			int n = reads.incrementAndGet();
			return new MemorySample(100 * n, 200, 50, 4096, 8000, 16000);
		});
		var tracker = MemoryTracker.start("Loading", telemetry);
		try (tracker) {
			assertEquals(1, reads.get());
			assertFalse(tracker.isClosed());
			assertNull(tracker.getEndSample());
		}
		assertTrue(tracker.isClosed());
		assertEquals(2, reads.get());
		assertEquals("Loading", tracker.getLabel());
		assertEquals(100, tracker.getStartSample().getProcessUsedMB());
		assertEquals(200, tracker.getEndSample().getProcessUsedMB());
		assertTrue(tracker.getElapsedMillis() >= 0);
		
		// Closing again does not sample
		var end = tracker.getEndSample();
		double elapsed = tracker.getElapsedMillis();
		tracker.close();
		assertEquals(2, reads.get());
		assertSame(end, tracker.getEndSample());
		assertEquals(elapsed, tracker.getElapsedMillis());
	}
	
	@Test
	public void test_withoutTelemetry() {
		var tracker = MemoryTracker.start(null, null, true);
		assertEquals("Unnamed", tracker.getLabel());
		tracker.close();
		assertTrue(tracker.isClosed());
		assertNull(tracker.getStartSample());
		assertNull(tracker.getEndSample());
	}
	
	@Test
	public void test_telemetryFailure() {
		var telemetry = new MemoryTelemetry(() -> {
			throw new TelemetryUnavailableException("Not supported");
		});
		try (var tracker = MemoryTracker.start("Analysis", telemetry)) {
			assertNull(tracker.getStartSample());
		}
		var failing = new MemoryTelemetry(() -> {
			throw new IllegalStateException("Probe failed");
		});
		try (var tracker = MemoryTracker.start("Analysis", failing)) {
			assertNull(tracker.getStartSample());
			assertNotNull(tracker.getLabel());
		}
	}

}
