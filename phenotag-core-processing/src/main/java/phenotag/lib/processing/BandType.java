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

import java.util.Locale;

/**
 * Kinds of derived band that can be computed from a color image.
 * 
 * @author PhenoTag developers
 */
public enum BandType {
	
	/**
	 * Red, green and blue channels, unchanged.
	 */
	RGB("rgb"),
	
	/**
	 * Chromatic coordinates, i.e. each channel divided by the sum of all three.
	 */
	CHROMATIC("chromatic");
	
	private final String key;
	
	BandType(String key) {
		this.key = key;
	}
	
	/**
	 * @return the lower-case key used in band names and cache keys
	 */
	public String getKey() {
		return key;
	}
	
	/**
	 * Get the band type corresponding to a key.
	 * @param key e.g. "rgb" or "chromatic"
	 * @return
	 * @throws IllegalArgumentException if the key is not recognized
	 */
	public static BandType fromKey(String key) throws IllegalArgumentException {
		String k = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
		for (var type : values()) {
			if (type.key.equals(k))
				return type;
		}
		throw new IllegalArgumentException("Unknown band type: " + key);
	}
	
	@Override
	public String toString() {
		return key;
	}

}
