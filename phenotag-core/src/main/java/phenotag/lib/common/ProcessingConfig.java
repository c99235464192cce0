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

package phenotag.lib.common;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonParseException;

import phenotag.lib.io.GsonTools;

/**
 * Configuration values consumed by the processing core.
 * <p>
 * Instances are immutable; use {@link Builder} to create a modified copy.
 * Values are validated and clamped when the configuration is built, so downstream code can rely on them.
 * 
 * @author PhenoTag developers
 */
public class ProcessingConfig {
	
	private static final Logger logger = LoggerFactory.getLogger(ProcessingConfig.class);
	
	/**
	 * Smallest supported downscale factor.
	 */
	public static final double MIN_DOWNSCALE = 0.1;

	/**
	 * Largest supported downscale factor (i.e. full resolution).
	 */
	public static final double MAX_DOWNSCALE = 1.0;
	
	private static final ProcessingConfig DEFAULT = new Builder().build();
	
	private double memoryThresholdMB = 1000.0;
	private double cacheMaxMB = 500.0;
	private double samplingIntervalSec = 30.0;
	private double downscaleFactor = 1.0;
	private boolean autoDownscale = true;
	
	private ProcessingConfig() {}
	
	/**
	 * Get the default configuration.
	 * @return
	 */
	public static ProcessingConfig getDefault() {
		return DEFAULT;
	}
	
	/**
	 * Process memory (in MB) above which adaptive downscaling and memory pressure handling apply.
	 * @return
	 */
	public double getMemoryThresholdMB() {
		return memoryThresholdMB;
	}

	/**
	 * Maximum accounted size of the shared cache, in MB.
	 * @return
	 */
	public double getCacheMaxMB() {
		return cacheMaxMB;
	}

	/**
	 * Interval between background memory samples, in seconds.
	 * @return
	 */
	public double getSamplingIntervalSec() {
		return samplingIntervalSec;
	}

	/**
	 * Default linear downscale factor, within [0.1, 1.0].
	 * @return
	 */
	public double getDownscaleFactor() {
		return downscaleFactor;
	}
	
	/**
	 * Whether loaders may reduce the downscale factor further to fit memory.
	 * @return
	 */
	public boolean isAutoDownscale() {
		return autoDownscale;
	}
	
	/**
	 * Create a builder initialized with the values of this configuration.
	 * @return
	 */
	public Builder toBuilder() {
		return new Builder(this);
	}
	
	/**
	 * Read a configuration from a JSON file.
	 * <p>
	 * Missing properties take their default values.
	 * 
	 * @param path
	 * @return
	 * @throws IOException if the file cannot be read or is not valid JSON
	 */
	public static ProcessingConfig fromJson(Path path) throws IOException {
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return fromJson(reader);
		}
	}
	
	/**
	 * Read a configuration from JSON.
	 * @param reader
	 * @return
	 * @throws IOException if the JSON cannot be parsed
	 */
	public static ProcessingConfig fromJson(Reader reader) throws IOException {
		try {
			ProcessingConfig config = GsonTools.getInstance().fromJson(reader, ProcessingConfig.class);
			if (config == null) {
				logger.warn("Empty configuration, using defaults");
				return getDefault();
			}
			// Pass through the builder so that values are validated
			return new Builder(config).build();
		} catch (JsonParseException e) {
			throw new IOException("Unable to parse processing configuration", e);
		}
	}
	
	/**
	 * Write this configuration as JSON.
	 * @param path
	 * @throws IOException
	 */
	public void writeJson(Path path) throws IOException {
		try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			GsonTools.getInstance(true).toJson(this, writer);
		}
	}
	
	@Override
	public String toString() {
		return String.format("ProcessingConfig[threshold=%.1f MB, cache=%.1f MB, interval=%.1f s, downscale=%.2f, auto=%b]",
				memoryThresholdMB, cacheMaxMB, samplingIntervalSec, downscaleFactor, autoDownscale);
	}
	
	
	/**
	 * Builder for {@link ProcessingConfig}.
	 */
	public static class Builder {
		
		private ProcessingConfig config;
		
		/**
		 * Builder initialized with default values.
		 */
		public Builder() {
			this.config = new ProcessingConfig();
		}
		
		private Builder(ProcessingConfig config) {
			this();
			this.config.memoryThresholdMB = config.memoryThresholdMB;
			this.config.cacheMaxMB = config.cacheMaxMB;
			this.config.samplingIntervalSec = config.samplingIntervalSec;
			this.config.downscaleFactor = config.downscaleFactor;
			this.config.autoDownscale = config.autoDownscale;
		}
		
		/**
		 * @param mb memory threshold in MB; must be &gt; 0
		 * @return this builder
		 */
		public Builder memoryThresholdMB(double mb) {
			config.memoryThresholdMB = mb;
			return this;
		}
		
		/**
		 * @param mb maximum cache size in MB; must be &gt; 0
		 * @return this builder
		 */
		public Builder cacheMaxMB(double mb) {
			config.cacheMaxMB = mb;
			return this;
		}

		/**
		 * @param seconds sampling interval; must be &gt; 0
		 * @return this builder
		 */
		public Builder samplingIntervalSec(double seconds) {
			config.samplingIntervalSec = seconds;
			return this;
		}

		/**
		 * @param downscale linear downscale factor, clamped to [0.1, 1.0] on build
		 * @return this builder
		 */
		public Builder downscaleFactor(double downscale) {
			config.downscaleFactor = downscale;
			return this;
		}
		
		/**
		 * @param doAuto
		 * @return this builder
		 */
		public Builder autoDownscale(boolean doAuto) {
			config.autoDownscale = doAuto;
			return this;
		}
		
		/**
		 * Build the configuration.
		 * @return
		 * @throws IllegalArgumentException if a size or interval is not strictly positive
		 */
		public ProcessingConfig build() throws IllegalArgumentException {
			requirePositive("memoryThresholdMB", config.memoryThresholdMB);
			requirePositive("cacheMaxMB", config.cacheMaxMB);
			requirePositive("samplingIntervalSec", config.samplingIntervalSec);
			if (Double.isNaN(config.downscaleFactor))
				throw new IllegalArgumentException("downscaleFactor must be a number");
			var built = new Builder(config).config;
			built.downscaleFactor = GeneralTools.clipValue(config.downscaleFactor, MIN_DOWNSCALE, MAX_DOWNSCALE);
			return built;
		}
		
		private static void requirePositive(String name, double value) {
			if (!(value > 0))
				throw new IllegalArgumentException(name + " must be > 0, but was " + value);
		}
		
	}

}
