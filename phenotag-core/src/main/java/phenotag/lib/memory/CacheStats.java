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

/**
 * Snapshot of the state of a {@link BoundedCache}.
 * 
 * @author PhenoTag developers
 */
public class CacheStats {
	
	private final int count;
	private final double usedMB;
	private final double maxMB;
	
	CacheStats(int count, double usedMB, double maxMB) {
		this.count = count;
		this.usedMB = usedMB;
		this.maxMB = maxMB;
	}

	/**
	 * @return number of entries, including any whose values have not yet been found to be expired
	 */
	public int getCount() {
		return count;
	}

	/**
	 * @return accounted size of all entries
	 */
	public double getUsedMB() {
		return usedMB;
	}

	/**
	 * @return maximum cache size
	 */
	public double getMaxMB() {
		return maxMB;
	}

	/**
	 * @return used size as a percentage of the maximum
	 */
	public double getUsagePercent() {
		return maxMB <= 0 ? 0 : usedMB / maxMB * 100.0;
	}
	
	@Override
	public String toString() {
		return String.format(Locale.ROOT, "Cache: %d items, %.1f/%.1fMB (%.1f%%)", count, usedMB, maxMB, getUsagePercent());
	}

}
