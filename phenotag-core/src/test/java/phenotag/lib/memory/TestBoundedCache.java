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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import phenotag.lib.analysis.images.SimpleImages;

@SuppressWarnings("javadoc")
public class TestBoundedCache {
	
	@Test
	public void test_evictionRestoresHeadroom() {
		var cache = new BoundedCache(2.0);
		// Hold strong references so that nothing expires
		List<Object> values = new ArrayList<>();
		for (int i = 0; i < 5; i++) {
			var value = new byte[10];
			values.add(value);
			cache.put("key" + i, value, 1.0);
			var stats = cache.stats();
			assertTrue(stats.getUsedMB() <= 2.0, "Cache exceeded maximum after put: " + stats);
		}
		var stats = cache.stats();
		assertTrue(stats.getCount() <= 2);
		assertTrue(stats.getUsedMB() <= 1.6);
		// The most recent entry survives
		assertSame(values.get(4), cache.get("key4"));
		assertNull(cache.get("key0"));
	}
	
	@Test
	public void test_leastRecentlyAccessedEvictedFirst() {
		var cache = new BoundedCache(3.0);
		var a = new int[1];
		var b = new int[1];
		var c = new int[1];
		var d = new int[1];
		cache.put("a", a, 1.0);
		cache.put("b", b, 1.0);
		cache.put("c", c, 1.0);
		// Access 'a' so that 'b' becomes the least recently used
		assertSame(a, cache.get("a"));
		cache.put("d", d, 1.0);
		// 4 MB > 3 MB, so evict down to 2.4 MB: 'b' then 'c'
		assertNull(cache.get("b"));
		assertNull(cache.get("c"));
		assertSame(a, cache.get("a"));
		assertSame(d, cache.get("d"));
		assertEquals(2.0, cache.stats().getUsedMB(), 1e-9);
	}
	
	@Test
	public void test_replaceSubtractsOldSize() {
		var cache = new BoundedCache(100);
		var first = new byte[1];
		var second = new byte[1];
		cache.put("key", first, 10);
		cache.put("key", second, 5);
		assertEquals(1, cache.stats().getCount());
		assertEquals(5, cache.stats().getUsedMB(), 1e-9);
		assertSame(second, cache.get("key"));
	}
	
	@Test
	public void test_nullIgnored() {
		var cache = new BoundedCache(10);
		cache.put("key", null);
		cache.put("key", null, 5.0);
		assertEquals(0, cache.stats().getCount());
		assertFalse(cache.containsKey("key"));
	}
	
	@Test
	public void test_getWithClass() {
		var cache = new BoundedCache(10);
		var value = "Some text";
		cache.put("key", value, 0.1);
		assertSame(value, cache.get("key", String.class));
		assertNull(cache.get("key", BufferedImage.class));
		assertNull(cache.get("missing", String.class));
	}
	
	@Test
	public void test_removeByPrefix() {
		var cache = new BoundedCache(100);
		List<Object> values = new ArrayList<>();
		for (var key : List.of("image:a.jpg:1.0", "image:a.jpg:1.0:rgb", "image:a.jpg:1.0:chromatic", "image:b.jpg:1.0")) {
			var value = new byte[1];
			values.add(value);
			cache.put(key, value, 1.0);
		}
		assertEquals(3, cache.removeByPrefix("image:a.jpg:1.0"));
		assertEquals(1, cache.stats().getCount());
		assertEquals(1.0, cache.stats().getUsedMB(), 1e-9);
		assertTrue(cache.containsKey("image:b.jpg:1.0"));
		assertTrue(cache.remove("image:b.jpg:1.0"));
		assertFalse(cache.remove("image:b.jpg:1.0"));
		assertEquals(0, cache.stats().getUsedMB());
		assertEquals(4, values.size());
	}
	
	@Test
	public void test_weakReferencesExpire() throws InterruptedException {
		var cache = new BoundedCache(100);
		cache.put("garbage", new byte[1024 * 1024], 1.0);
		// Collection is requested repeatedly, since a single call is only a hint
		for (int i = 0; i < 50 && cache.containsKey("garbage"); i++) {
			System.gc();
			Thread.sleep(20);
		}
		assertNull(cache.get("garbage"));
		assertEquals(0, cache.stats().getCount());
		assertEquals(0, cache.stats().getUsedMB());
	}
	
	@Test
	public void test_clear() {
		var cache = new BoundedCache(10);
		var value = new byte[1];
		cache.put("key", value, 1.0);
		cache.clear();
		assertEquals(0, cache.stats().getCount());
		assertEquals(0, cache.stats().getUsedMB());
		assertNotNull(value);
	}
	
	@Test
	public void test_sizeEstimates() {
		var estimator = SizeEstimator.getDefault();
		var img = new BufferedImage(1000, 500, BufferedImage.TYPE_3BYTE_BGR);
		assertEquals(1.5, estimator.getApproxSizeMB(img), 1e-9);
		assertEquals(4.0, estimator.getApproxSizeMB(SimpleImages.createFloatImage(new float[1000 * 1000], 1000, 1000)), 1e-9);
		assertEquals(0.008, estimator.getApproxSizeMB(new double[1000]), 1e-9);
		assertEquals(SizeEstimator.DEFAULT_SIZE_MB, estimator.getApproxSizeMB("unknown"));
		
		var cache = new BoundedCache(10);
		cache.put("img", img);
		assertEquals(1.5, cache.stats().getUsedMB(), 1e-9);
	}
	
	@Test
	public void test_invalidMaximum() {
		assertThrows(IllegalArgumentException.class, () -> new BoundedCache(0));
		assertThrows(IllegalArgumentException.class, () -> new BoundedCache(Double.NaN));
	}
	
	@Test
	public void test_concurrentPuts() throws InterruptedException {
		var cache = new BoundedCache(5.0);
		List<Object> values = new ArrayList<>();
		for (int i = 0; i < 400; i++)
			values.add(new byte[1]);
		List<Thread> threads = new ArrayList<>();
		for (int t = 0; t < 4; t++) {
			int offset = t * 100;
			var thread = new Thread(() -> {
				for (int i = 0; i < 100; i++) {
					cache.put("key" + (offset + i), values.get(offset + i), 0.5);
					cache.get("key" + (offset + i / 2));
				}
			});
			threads.add(thread);
			thread.start();
		}
		for (var thread : threads)
			thread.join();
		var stats = cache.stats();
		assertTrue(stats.getUsedMB() <= 5.0);
		assertEquals(stats.getCount() * 0.5, stats.getUsedMB(), 1e-6);
	}

}
