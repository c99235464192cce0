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

package phenotag.lib.loader;

import java.util.Objects;

import phenotag.lib.memory.BoundedCache;
import phenotag.lib.processing.DerivedDataCache;

/**
 * {@link DerivedDataCache} backed by a {@link BoundedCache}, so that bands and statistics share the 
 * same memory budget as decoded images.
 * 
 * @author PhenoTag developers
 */
public class BoundedCacheStore implements DerivedDataCache {
	
	private final BoundedCache cache;
	
	/**
	 * Constructor.
	 * @param cache
	 */
	public BoundedCacheStore(BoundedCache cache) {
		this.cache = Objects.requireNonNull(cache);
	}

	@Override
	public <T> T get(String key, Class<T> cls) {
		return cache.get(key, cls);
	}

	@Override
	public void put(String key, Object value) {
		cache.put(key, value);
	}

	@Override
	public void removeByPrefix(String prefix) {
		cache.removeByPrefix(prefix);
	}

}
