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
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cache for decoded images and derived data, bounded by an approximate memory size.
 * <p>
 * Values are held through weak references, so the cache never keeps an otherwise unused image alive;
 * an entry whose value has been garbage collected behaves as a cache miss and is removed.
 * <p>
 * Whenever adding an entry takes the accounted size above the maximum, least-recently accessed entries 
 * are evicted until the size drops to 80% of the maximum.
 * <p>
 * All methods are synchronized, so that one cache can be shared between threads.
 * 
 * @author PhenoTag developers
 */
public class BoundedCache {
	
	private static final Logger logger = LoggerFactory.getLogger(BoundedCache.class);
	
	/**
	 * Fraction of the maximum size that eviction reduces the cache to.
	 */
	public static final double EVICTION_TARGET = 0.8;
	
	private static final long LOG_INTERVAL_NANOS = TimeUnit.MINUTES.toNanos(5);
	
	private final double maxMB;
	private final SizeEstimator sizeEstimator;
	
	// Access order, so iteration starts with the least-recently accessed entry
	private final Map<String, CacheEntry> map = new LinkedHashMap<>(16, 0.75f, true);
	private double usedMB = 0;
	
	private long lastLogTime = System.nanoTime();
	
	/**
	 * Create a cache using the default {@link SizeEstimator}.
	 * @param maxMB maximum accounted size in MB
	 */
	public BoundedCache(double maxMB) {
		this(maxMB, SizeEstimator.getDefault());
	}
	
	/**
	 * Create a cache with a custom size estimator.
	 * @param maxMB maximum accounted size in MB
	 * @param sizeEstimator
	 * @throws IllegalArgumentException if the maximum size is not positive
	 */
	public BoundedCache(double maxMB, SizeEstimator sizeEstimator) {
		if (!(maxMB > 0))
			throw new IllegalArgumentException("Maximum cache size must be > 0, but was " + maxMB);
		this.maxMB = maxMB;
		this.sizeEstimator = Objects.requireNonNull(sizeEstimator);
	}
	
	/**
	 * Add a value, estimating its size.
	 * @param key
	 * @param value the value; if null, the call is ignored
	 */
	public synchronized void put(String key, Object value) {
		if (value == null)
			return;
		put(key, value, sizeEstimator.getApproxSizeMB(value));
	}
	
	/**
	 * Add a value with a known size.
	 * @param key
	 * @param value the value; if null, the call is ignored
	 * @param sizeMB
	 */
	public synchronized void put(String key, Object value, double sizeMB) {
		Objects.requireNonNull(key, "Cache key must not be null");
		if (value == null)
			return;
		if (!(sizeMB >= 0))
			sizeMB = SizeEstimator.DEFAULT_SIZE_MB;
		var previous = map.put(key, new CacheEntry(value, sizeMB));
		if (previous != null)
			usedMB -= previous.sizeMB;
		usedMB += sizeMB;
		logger.trace("Cached {} ({} MB)", key, sizeMB);
		if (usedMB > maxMB)
			evict();
		logStatusIfDue();
	}
	
	/**
	 * Get a value from the cache.
	 * @param key
	 * @return the value, or null if it is not in the cache or has expired
	 */
	public synchronized Object get(String key) {
		var entry = map.get(key);
		if (entry == null)
			return null;
		var value = entry.ref.get();
		if (value == null) {
			logger.trace("Cache entry expired: {}", key);
			removeEntry(key);
			return null;
		}
		entry.lastAccess = System.nanoTime();
		return value;
	}
	
	/**
	 * Get a value from the cache, if it is present and of the required type.
	 * @param <T>
	 * @param key
	 * @param cls
	 * @return the value, or null if it is missing, expired or of a different type
	 */
	public synchronized <T> T get(String key, Class<T> cls) {
		var value = get(key);
		if (cls.isInstance(value))
			return cls.cast(value);
		if (value != null)
			logger.debug("Cached value for {} is {}, not {}", key, value.getClass().getSimpleName(), cls.getSimpleName());
		return null;
	}
	
	/**
	 * Query whether the cache contains a live value for the key.
	 * This does not count as an access for eviction.
	 * @param key
	 * @return
	 */
	public synchronized boolean containsKey(String key) {
		if (!map.containsKey(key))
			return false;
		// Iterate to avoid altering the access order
		for (var entry : map.entrySet()) {
			if (entry.getKey().equals(key))
				return entry.getValue().ref.get() != null;
		}
		return false;
	}
	
	/**
	 * Remove an entry.
	 * @param key
	 * @return true if an entry was removed
	 */
	public synchronized boolean remove(String key) {
		return removeEntry(key);
	}
	
	/**
	 * Remove all entries with keys starting with the given prefix.
	 * @param prefix
	 * @return the number of entries removed
	 */
	public synchronized int removeByPrefix(String prefix) {
		int count = 0;
		var iter = map.entrySet().iterator();
		while (iter.hasNext()) {
			var entry = iter.next();
			if (entry.getKey().startsWith(prefix)) {
				usedMB -= entry.getValue().sizeMB;
				iter.remove();
				count++;
			}
		}
		normalizeUsed();
		if (count > 0)
			logger.debug("Removed {} cache entries with prefix {}", count, prefix);
		return count;
	}
	
	/**
	 * Remove all entries whose values have been garbage collected.
	 * @return the number of entries removed
	 */
	public synchronized int purgeExpired() {
		int count = 0;
		var iter = map.values().iterator();
		while (iter.hasNext()) {
			var entry = iter.next();
			if (entry.ref.get() == null) {
				usedMB -= entry.sizeMB;
				iter.remove();
				count++;
			}
		}
		normalizeUsed();
		if (count > 0)
			logger.debug("Purged {} expired cache entries", count);
		return count;
	}
	
	/**
	 * Remove all entries.
	 */
	public synchronized void clear() {
		int n = map.size();
		map.clear();
		usedMB = 0;
		logger.debug("Cache cleared ({} entries)", n);
	}
	
	/**
	 * Get a snapshot of the cache status.
	 * @return
	 */
	public synchronized CacheStats stats() {
		return new CacheStats(map.size(), usedMB, maxMB);
	}
	
	/**
	 * @return the maximum accounted size in MB
	 */
	public double getMaxMB() {
		return maxMB;
	}
	
	private void evict() {
		purgeExpired();
		double target = maxMB * EVICTION_TARGET;
		int evicted = 0;
		Iterator<Map.Entry<String, CacheEntry>> iter = map.entrySet().iterator();
		while (usedMB > target && iter.hasNext()) {
			var entry = iter.next();
			usedMB -= entry.getValue().sizeMB;
			iter.remove();
			evicted++;
		}
		normalizeUsed();
		if (evicted > 0)
			logger.debug("Evicted {} cache entries, now {}", evicted, stats());
	}
	
	private boolean removeEntry(String key) {
		var entry = map.remove(key);
		if (entry == null)
			return false;
		usedMB -= entry.sizeMB;
		normalizeUsed();
		return true;
	}
	
	private void normalizeUsed() {
		// Rounding errors may accumulate
		if (map.isEmpty() || usedMB < 0)
			usedMB = 0;
	}
	
	private void logStatusIfDue() {
		long now = System.nanoTime();
		if (now - lastLogTime >= LOG_INTERVAL_NANOS) {
			lastLogTime = now;
			logger.debug("{}", stats());
		}
	}
	
	@Override
	public synchronized String toString() {
		return stats().toString();
	}
	
	
	private static class CacheEntry {
		
		private final WeakReference<Object> ref;
		private final double sizeMB;
		private long lastAccess;
		
		private CacheEntry(Object value, double sizeMB) {
			this.ref = new WeakReference<>(value);
			this.sizeMB = sizeMB;
			this.lastAccess = System.nanoTime();
		}
		
		@Override
		public String toString() {
			return String.format("CacheEntry[%.2fMB, accessed %d ms ago]", sizeMB,
					TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - lastAccess));
		}
		
	}

}
