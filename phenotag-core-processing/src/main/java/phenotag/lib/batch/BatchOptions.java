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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Options controlling what {@link BatchRunner} does with each image.
 * <p>
 * Use {@link #builder()} to create an instance.
 * 
 * @author PhenoTag developers
 */
public class BatchOptions {
	
	/**
	 * All band types that can be exported, in the form {@code <type>-<band>}.
	 */
	public static final List<String> ALL_BAND_TYPES = List.of(
			"rgb-r", "rgb-g", "rgb-b",
			"chromatic-r", "chromatic-g", "chromatic-b", "chromatic-composite");
	
	private boolean drawOverlays = true;
	private boolean exportBands = false;
	private List<String> bandTypes = ALL_BAND_TYPES;
	private boolean analyzeRegions = false;
	private Set<String> skipList = Collections.emptySet();
	private boolean keepOriginal = true;
	
	private BatchOptions() {}
	
	/**
	 * Get options with default values.
	 * @return
	 */
	public static BatchOptions getDefault() {
		return builder().build();
	}
	
	/**
	 * Create a builder initialized with default values.
	 * @return
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return true if regions should be drawn on the processed image
	 */
	public boolean isDrawOverlays() {
		return drawOverlays;
	}

	/**
	 * @return true if band images should be exported
	 */
	public boolean isExportBands() {
		return exportBands;
	}

	/**
	 * @return the bands to export, e.g. "rgb-r" or "chromatic-composite"
	 */
	public List<String> getBandTypes() {
		return bandTypes;
	}

	/**
	 * @return true if statistics should be computed for every region
	 */
	public boolean isAnalyzeRegions() {
		return analyzeRegions;
	}

	/**
	 * @return names of regions that should not be analyzed
	 */
	public Set<String> getSkipList() {
		return skipList;
	}

	/**
	 * @return true if the engine should retain the original image
	 */
	public boolean isKeepOriginal() {
		return keepOriginal;
	}
	
	@Override
	public String toString() {
		return "BatchOptions[drawOverlays=" + drawOverlays + ", exportBands=" + exportBands + ", bandTypes=" + bandTypes
				+ ", analyzeRegions=" + analyzeRegions + ", skipList=" + skipList + ", keepOriginal=" + keepOriginal + "]";
	}
	
	
	/**
	 * Builder for {@link BatchOptions}.
	 */
	public static class Builder {
		
		private final BatchOptions options = new BatchOptions();
		
		private Builder() {}
		
		/**
		 * Draw regions on the processed image (default true).
		 * @param doDraw
		 * @return this builder
		 */
		public Builder drawOverlays(boolean doDraw) {
			options.drawOverlays = doDraw;
			return this;
		}
		
		/**
		 * Export band images (default false).
		 * @param doExport
		 * @return this builder
		 */
		public Builder exportBands(boolean doExport) {
			options.exportBands = doExport;
			return this;
		}
		
		/**
		 * Set the bands to export (default all).
		 * @param bandTypes band types in the form {@code <type>-<band>}; if null or empty, all bands are used
		 * @return this builder
		 */
		public Builder bandTypes(Collection<String> bandTypes) {
			if (bandTypes == null || bandTypes.isEmpty())
				options.bandTypes = ALL_BAND_TYPES;
			else
				options.bandTypes = Collections.unmodifiableList(new ArrayList<>(bandTypes));
			return this;
		}
		
		/**
		 * Compute statistics for every region (default false).
		 * @param doAnalyze
		 * @return this builder
		 */
		public Builder analyzeRegions(boolean doAnalyze) {
			options.analyzeRegions = doAnalyze;
			return this;
		}
		
		/**
		 * Set regions that should not be analyzed.
		 * @param names
		 * @return this builder
		 */
		public Builder skipList(Collection<String> names) {
			options.skipList = names == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(names));
			return this;
		}
		
		/**
		 * Retain the original image in the engine (default true).
		 * @param doKeep
		 * @return this builder
		 */
		public Builder keepOriginal(boolean doKeep) {
			options.keepOriginal = doKeep;
			return this;
		}
		
		/**
		 * Build the options.
		 * @return
		 */
		public BatchOptions build() {
			var built = new BatchOptions();
			built.drawOverlays = options.drawOverlays;
			built.exportBands = options.exportBands;
			built.bandTypes = Objects.requireNonNull(options.bandTypes);
			built.analyzeRegions = options.analyzeRegions;
			built.skipList = options.skipList;
			built.keepOriginal = options.keepOriginal;
			return built;
		}
		
	}

}
