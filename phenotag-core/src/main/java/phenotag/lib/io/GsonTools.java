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

package phenotag.lib.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Helper class providing consistently configured Gson instances.
 * <p>
 * Special floating point values are serialized, because statistics for empty regions 
 * or degenerate bands may legitimately contain NaN.
 * 
 * @author PhenoTag developers
 *
 */
public class GsonTools {
	
	private static final Logger logger = LoggerFactory.getLogger(GsonTools.class);
	
	private static GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient();
	
	private static Gson gson;
	private static Gson gsonPretty;
	
	/**
	 * Access the builder used with {@link #getInstance()}.
	 * <p>
	 * <b>Use this with caution!</b> Changes made here impact JSON serialization throughout the software.
	 * To create a derived builder that does not change the default, use {@code getDefaultBuilder().create().newBuilder()}.
	 * 
	 * @return
	 */
	public static synchronized GsonBuilder getDefaultBuilder() {
		logger.trace("Requesting GsonBuilder from {}", Thread.currentThread().getStackTrace()[0]);
		gson = null;
		gsonPretty = null;
		return builder;
	}
	
	/**
	 * Get a default Gson instance.
	 * @return
	 */
	public static Gson getInstance() {
		return getInstance(false);
	}
	
	/**
	 * Get a default Gson instance, optionally with pretty printing.
	 * @param pretty
	 * @return
	 */
	public static synchronized Gson getInstance(boolean pretty) {
		if (pretty) {
			if (gsonPretty == null)
				gsonPretty = builder.create().newBuilder().setPrettyPrinting().create();
			return gsonPretty;
		}
		if (gson == null)
			gson = builder.create();
		return gson;
	}

}
