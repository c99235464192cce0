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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs memory usage at the start and end of a block of code, along with how long it took.
 * <p>
 * Intended for use with try-with-resources:
 * <pre>
 * try (var tracker = MemoryTracker.start("Loading image", telemetry)) {
 *     ...
 * }
 * </pre>
 * If no telemetry is available, only the duration is logged (at DEBUG level).
 * 
 * @author PhenoTag developers
 */
public class MemoryTracker implements AutoCloseable {
	
	private static final Logger logger = LoggerFactory.getLogger(MemoryTracker.class);
	
	private final String label;
	private final MemoryTelemetry telemetry;
	private final boolean requestGC;
	private final long startNanos;
	
	private MemorySample startSample;
	private MemorySample endSample;
	private long elapsedNanos = -1;
	
	private MemoryTracker(String label, MemoryTelemetry telemetry, boolean requestGC) {
		this.label = label;
		this.telemetry = telemetry;
		this.requestGC = requestGC;
		if (telemetry != null)
			startSample = telemetry.logMemoryUsage(label + " (start)");
		this.startNanos = System.nanoTime();
	}
	
	/**
	 * Start tracking a block of code.
	 * @param label label used in log messages
	 * @param telemetry source of memory usage; may be null
	 * @return
	 */
	public static MemoryTracker start(String label, MemoryTelemetry telemetry) {
		return start(label, telemetry, false);
	}
	
	/**
	 * Start tracking a block of code, optionally requesting garbage collection when it completes.
	 * @param label label used in log messages
	 * @param telemetry source of memory usage; may be null
	 * @param requestGC if true, call {@link System#gc()} when the tracker is closed
	 * @return
	 */
	public static MemoryTracker start(String label, MemoryTelemetry telemetry, boolean requestGC) {
		return new MemoryTracker(label == null ? "Unnamed" : label, telemetry, requestGC);
	}
	
	/**
	 * @return the label used in log messages
	 */
	public String getLabel() {
		return label;
	}
	
	/**
	 * @return memory usage when tracking started, or null if unavailable
	 */
	public MemorySample getStartSample() {
		return startSample;
	}
	
	/**
	 * @return memory usage when tracking ended, or null if unavailable or the tracker is still open
	 */
	public MemorySample getEndSample() {
		return endSample;
	}
	
	/**
	 * @return true if {@link #close()} has been called
	 */
	public boolean isClosed() {
		return elapsedNanos >= 0;
	}
	
	/**
	 * Get the time elapsed since tracking started, or the total duration if the tracker is closed.
	 * @return elapsed time in milliseconds
	 */
	public double getElapsedMillis() {
		long nanos = isClosed() ? elapsedNanos : System.nanoTime() - startNanos;
		return nanos / 1e6;
	}
	
	/**
	 * Stop tracking and log the memory usage and duration. Subsequent calls do nothing.
	 */
	@Override
	public void close() {
		if (isClosed())
			return;
		elapsedNanos = System.nanoTime() - startNanos;
		String endLabel = String.format(Locale.ROOT, "%s (end after %.2fs)", label, elapsedNanos / 1e9);
		if (telemetry != null)
			endSample = telemetry.logMemoryUsage(endLabel);
		else
			logger.debug(endLabel);
		if (requestGC)
			System.gc();
	}

}
