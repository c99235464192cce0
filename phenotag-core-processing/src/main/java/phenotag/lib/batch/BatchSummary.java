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

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of a completed batch.
 * 
 * @author PhenoTag developers
 */
public class BatchSummary {
	
	private final List<Path> succeeded;
	private final Map<Path, String> failed;
	private final long elapsedMillis;
	
	BatchSummary(List<Path> succeeded, Map<Path, String> failed, long elapsedMillis) {
		this.succeeded = List.copyOf(succeeded);
		this.failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
		this.elapsedMillis = elapsedMillis;
	}
	
	/**
	 * @return total number of images in the batch
	 */
	public int getTotal() {
		return succeeded.size() + failed.size();
	}
	
	/**
	 * @return images that were processed successfully, in order
	 */
	public List<Path> getSucceeded() {
		return succeeded;
	}
	
	/**
	 * @return images that could not be processed, with the reason
	 */
	public Map<Path, String> getFailed() {
		return failed;
	}
	
	/**
	 * @return time taken for the batch, in milliseconds
	 */
	public long getElapsedMillis() {
		return elapsedMillis;
	}
	
	@Override
	public String toString() {
		return String.format("Batch: %d/%d images processed in %.1f s", succeeded.size(), getTotal(), elapsedMillis / 1000.0);
	}

}
