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

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import phenotag.lib.common.LogTools;
import phenotag.lib.common.ThreadTools;

/**
 * Reads process and system memory usage, optionally sampling in the background.
 * <p>
 * Sampling runs on a single dedicated daemon thread. It only reads memory and invokes a callback; 
 * {@link #stopSampling()} waits for that thread to finish before returning.
 * 
 * @author PhenoTag developers
 */
public class MemoryTelemetry {
	
	private static final Logger logger = LoggerFactory.getLogger(MemoryTelemetry.class);
	
	private final MemoryProbe probe;
	
	private ScheduledExecutorService sampler;
	private long intervalMillis;
	
	private final Map<String, WeakReference<Object>> trackedObjects = new LinkedHashMap<>();
	
	/**
	 * Create telemetry reading from the JVM and host operating system.
	 */
	public MemoryTelemetry() {
		this(MemoryProbe.system());
	}
	
	/**
	 * Create telemetry using a specific probe.
	 * @param probe
	 */
	public MemoryTelemetry(MemoryProbe probe) {
		this.probe = Objects.requireNonNull(probe);
	}
	
	/**
	 * Read the current memory usage.
	 * @return
	 * @throws TelemetryUnavailableException if the host does not provide memory information
	 */
	public MemorySample sample() throws TelemetryUnavailableException {
		return probe.read();
	}
	
	/**
	 * Log the current memory usage at INFO level, with an optional label.
	 * @param label
	 * @return the sample that was logged, or null if memory usage is unavailable
	 */
	public MemorySample logMemoryUsage(String label) {
		try {
			var sample = sample();
			if (label == null || label.isBlank())
				logger.info("{}", sample);
			else
				logger.info("{} - {}", label, sample);
			return sample;
		} catch (TelemetryUnavailableException e) {
			LogTools.warnOnce(logger, "Memory telemetry unavailable: " + e.getMessage());
			return null;
		} catch (RuntimeException e) {
			logger.warn("Unable to read memory usage: {}", e.getLocalizedMessage());
			logger.debug(e.getLocalizedMessage(), e);
			return null;
		}
	}
	
	/**
	 * Track an object, so that it can later be reported if it is still reachable.
	 * Only a weak reference is kept. An object tracked under an existing name replaces the previous one.
	 * @param name name used in logs
	 * @param obj the object; ignored if null
	 */
	public void trackObject(String name, Object obj) {
		if (obj == null)
			return;
		synchronized (trackedObjects) {
			trackedObjects.put(Objects.requireNonNull(name), new WeakReference<>(obj));
		}
		logger.debug("Now tracking object: {}", name);
	}
	
	/**
	 * Get the names of tracked objects that have not yet been garbage collected.
	 * @return
	 */
	public List<String> getTrackedObjectNames() {
		synchronized (trackedObjects) {
			trackedObjects.values().removeIf(ref -> ref.get() == null);
			return new ArrayList<>(trackedObjects.keySet());
		}
	}
	
	/**
	 * Get the number of tracked objects that have not yet been garbage collected.
	 * @return
	 */
	public int getTrackedObjectCount() {
		return getTrackedObjectNames().size();
	}
	
	/**
	 * Log the number of tracked objects still alive at INFO level, and their names at DEBUG level.
	 */
	public void logTrackedObjects() {
		var names = getTrackedObjectNames();
		logger.info("Currently tracking {} objects", names.size());
		for (var name : names)
			logger.debug("Tracked object still alive: {}", name);
	}
	
	/**
	 * Start sampling memory in the background.
	 * <p>
	 * The callback is called at most once per interval, whenever the process memory exceeds the threshold.
	 * Exceptions thrown by the callback are logged.
	 * 
	 * @param intervalSec sampling interval in seconds
	 * @param thresholdMB process memory threshold
	 * @param onThresholdExceeded callback; may be null if only logging is required
	 * @return true if sampling was started, false if it was already running
	 * @throws IllegalArgumentException if the interval is not positive
	 */
	public synchronized boolean startSampling(double intervalSec, double thresholdMB, Consumer<MemorySample> onThresholdExceeded) {
		if (!(intervalSec > 0))
			throw new IllegalArgumentException("Sampling interval must be > 0, but was " + intervalSec);
		if (sampler != null) {
			logger.warn("Memory sampling is already active");
			return false;
		}
		intervalMillis = Math.max(1L, Math.round(intervalSec * 1000.0));
		var executor = new ScheduledThreadPoolExecutor(1, ThreadTools.createThreadFactory("memory-telemetry-", true));
		executor.scheduleAtFixedRate(
				() -> sampleOnce(thresholdMB, onThresholdExceeded),
				0L, intervalMillis, TimeUnit.MILLISECONDS);
		sampler = executor;
		logger.info("Memory sampling started (interval: {}s, threshold: {}MB)", intervalSec, thresholdMB);
		return true;
	}
	
	/**
	 * Stop background sampling, waiting for the sampling thread to terminate.
	 */
	public synchronized void stopSampling() {
		if (sampler == null)
			return;
		var executor = sampler;
		sampler = null;
		ThreadTools.shutdownAndAwait(executor, Math.max(1000L, 2 * intervalMillis), TimeUnit.MILLISECONDS);
		logger.info("Memory sampling stopped");
	}
	
	/**
	 * Query whether background sampling is currently active.
	 * @return
	 */
	public synchronized boolean isSampling() {
		return sampler != null;
	}
	
	private void sampleOnce(double thresholdMB, Consumer<MemorySample> callback) {
		MemorySample sample;
		try {
			sample = probe.read();
		} catch (TelemetryUnavailableException e) {
			LogTools.warnOnce(logger, "Memory telemetry unavailable: " + e.getMessage());
			return;
		} catch (RuntimeException e) {
			// An exception escaping here would cancel all future samples
			logger.error("Error reading memory usage: " + e.getLocalizedMessage(), e);
			return;
		}
		logger.trace("Memory sample: {}", sample);
		if (sample.getProcessUsedMB() <= thresholdMB)
			return;
		logger.warn("Memory usage exceeded threshold: {}MB > {}MB",
				String.format("%.1f", sample.getProcessUsedMB()), String.format("%.1f", thresholdMB));
		if (callback == null)
			return;
		try {
			callback.accept(sample);
		} catch (RuntimeException e) {
			logger.error("Error in memory callback: " + e.getLocalizedMessage(), e);
		}
	}

}
