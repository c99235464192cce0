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

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import phenotag.lib.common.GeneralTools;

/**
 * Response to memory usage exceeding a threshold, for use as a {@link MemoryTelemetry} callback.
 * <p>
 * This requests garbage collection, removes expired cache entries, clears the cache entirely if the process 
 * is using far more memory than the cache is permitted, then notifies any registered listeners.
 * 
 * @author PhenoTag developers
 */
public class MemoryPressureHandler implements Consumer<MemorySample> {
	
	private static final Logger logger = LoggerFactory.getLogger(MemoryPressureHandler.class);
	
	/**
	 * Process memory, relative to the maximum cache size, above which the cache is cleared.
	 */
	public static final double CLEAR_CACHE_FACTOR = 1.5;
	
	private final BoundedCache cache;
	private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
	
	/**
	 * Constructor.
	 * @param cache the cache to trim under memory pressure
	 */
	public MemoryPressureHandler(BoundedCache cache) {
		this.cache = Objects.requireNonNull(cache);
	}
	
	/**
	 * Register a callback to run whenever memory is low.
	 * @param callback
	 */
	public void registerLowMemoryCallback(Runnable callback) {
		callbacks.add(Objects.requireNonNull(callback));
	}
	
	/**
	 * Remove a previously-registered callback.
	 * @param callback
	 * @return true if the callback was removed
	 */
	public boolean removeLowMemoryCallback(Runnable callback) {
		return callbacks.remove(callback);
	}

	@Override
	public void accept(MemorySample sample) {
		logger.warn("Low memory detected: {}", sample);
		// Weak references are only cleared after collection
		System.gc();
		int purged = cache.purgeExpired();
		logger.debug("Purged {} expired entries, {}", purged, cache.stats());
		
		if (sample.getProcessUsedMB() > cache.getMaxMB() * CLEAR_CACHE_FACTOR) {
			logger.warn("Process memory {} exceeds {}x cache limit - clearing cache",
					GeneralTools.formatMB(sample.getProcessUsedMB()), CLEAR_CACHE_FACTOR);
			cache.clear();
		}
		
		for (var callback : callbacks) {
			try {
				callback.run();
			} catch (RuntimeException e) {
				logger.error("Error in low memory callback: " + e.getLocalizedMessage(), e);
			}
		}
	}

}
