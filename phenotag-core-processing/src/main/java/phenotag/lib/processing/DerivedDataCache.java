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

package phenotag.lib.processing;

/**
 * Store for derived data (bands and statistics) shared between {@link ImageProcessingEngine} instances 
 * and repeated loads of the same image.
 * <p>
 * Implementations may drop entries at any time; a missing entry is recomputed.
 * 
 * @author PhenoTag developers
 */
public interface DerivedDataCache {
	
	/**
	 * Get a cached value.
	 * @param <T>
	 * @param key
	 * @param cls required type
	 * @return the value, or null if it is not available
	 */
	<T> T get(String key, Class<T> cls);
	
	/**
	 * Store a value.
	 * @param key
	 * @param value
	 */
	void put(String key, Object value);
	
	/**
	 * Remove all values whose keys begin with the prefix.
	 * @param prefix
	 */
	void removeByPrefix(String prefix);

}
