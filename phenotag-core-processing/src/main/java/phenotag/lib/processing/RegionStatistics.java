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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import phenotag.lib.analysis.stats.BandStatistics;
import phenotag.lib.memory.SizeEstimator;

/**
 * Per-band statistics for one region.
 * <p>
 * RGB and chromatic statistics are each optional, and are null if their computation was skipped.
 * 
 * @author PhenoTag developers
 */
public class RegionStatistics implements SizeEstimator.Sized {
	
	private final String name;
	private final Map<String, BandStatistics> rgb;
	private final Map<String, BandStatistics> chromatic;
	
	private final transient boolean empty;
	
	RegionStatistics(String name, Map<String, BandStatistics> rgb, Map<String, BandStatistics> chromatic) {
		this(name, rgb, chromatic, false);
	}
	
	private RegionStatistics(String name, Map<String, BandStatistics> rgb, Map<String, BandStatistics> chromatic, boolean empty) {
		this.name = name;
		this.rgb = rgb == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(rgb));
		this.chromatic = chromatic == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(chromatic));
		this.empty = empty;
	}
	
	/**
	 * Create an empty result, used when a region cannot be found.
	 * @param name
	 * @return
	 */
	public static RegionStatistics empty(String name) {
		return new RegionStatistics(name, null, null, true);
	}
	
	/**
	 * @return the region name
	 */
	public String getName() {
		return name;
	}
	
	/**
	 * @return true if no statistics could be computed because the region was not found
	 */
	public boolean isEmpty() {
		return empty;
	}
	
	/**
	 * @return RGB statistics keyed by band name ("r", "g", "b"), or null if skipped
	 */
	public Map<String, BandStatistics> getRGB() {
		return rgb;
	}
	
	/**
	 * @return chromatic coordinate statistics keyed by band name ("r", "g", "b"), or null if skipped
	 */
	public Map<String, BandStatistics> getChromatic() {
		return chromatic;
	}
	
	/**
	 * Get RGB statistics for one band.
	 * @param band
	 * @return the statistics, or null if unavailable
	 */
	public BandStatistics getRGB(String band) {
		return rgb == null ? null : rgb.get(band);
	}
	
	/**
	 * Get chromatic coordinate statistics for one band.
	 * @param band
	 * @return the statistics, or null if unavailable
	 */
	public BandStatistics getChromatic(String band) {
		return chromatic == null ? null : chromatic.get(band);
	}

	@Override
	public long getApproxSizeBytes() {
		int n = (rgb == null ? 0 : rgb.size()) + (chromatic == null ? 0 : chromatic.size());
		return 128 + n * 64L;
	}
	
	@Override
	public String toString() {
		if (empty)
			return "RegionStatistics[" + name + ", empty]";
		return "RegionStatistics[" + name + ", rgb=" + rgb + ", chromatic=" + chromatic + "]";
	}

}
