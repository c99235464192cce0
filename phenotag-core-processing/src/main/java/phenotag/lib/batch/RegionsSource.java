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

package phenotag.lib.batch;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import phenotag.lib.io.RegionIO;
import phenotag.lib.roi.Region;

/**
 * Supplies the regions to apply to each image in a batch.
 * <p>
 * If no regions are returned, a default region is created for the image.
 * 
 * @author PhenoTag developers
 */
@FunctionalInterface
public interface RegionsSource {
	
	/**
	 * Get the regions for an image.
	 * @param imagePath
	 * @return regions keyed by name; may be empty
	 * @throws IOException if the regions cannot be read
	 */
	Map<String, Region> getRegions(Path imagePath) throws IOException;
	
	/**
	 * A source that always returns no regions, so that the default region is used.
	 * @return
	 */
	static RegionsSource none() {
		return p -> Collections.emptyMap();
	}
	
	/**
	 * A source that returns the same regions for every image.
	 * @param regions
	 * @return
	 */
	static RegionsSource fixed(Map<String, Region> regions) {
		var map = Collections.unmodifiableMap(new LinkedHashMap<>(regions));
		return p -> map;
	}
	
	/**
	 * A source that returns the regions read from a JSON file, for every image.
	 * The file is read once, when this method is called.
	 * @param path
	 * @return
	 * @throws IOException if the file cannot be read
	 * @see RegionIO#readRegions(Path)
	 */
	static RegionsSource fromJson(Path path) throws IOException {
		return fixed(RegionIO.readRegions(path));
	}

}
