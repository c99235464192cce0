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

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonIOException;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;

import phenotag.lib.common.ColorTools;
import phenotag.lib.roi.Region;

/**
 * Read and write region maps and analysis results as JSON.
 * <p>
 * A region map is a JSON object mapping region names to definitions of the form
 * <pre>
 * { "points": [[x, y], ...], "color": [b, g, r], "thickness": 2, "alpha": 0.3, "closed": true }
 * </pre>
 * either at the top level or inside a {@code "rois"} object.
 * Only {@code points} is required. Colors are given in blue, green, red order for compatibility 
 * with existing region files, and converted to packed RGB on reading.
 * 
 * @author PhenoTag developers
 */
public class RegionIO {
	
	private static final Logger logger = LoggerFactory.getLogger(RegionIO.class);
	
	private static final String KEY_ROIS = "rois";
	private static final String KEY_POINTS = "points";
	private static final String KEY_COLOR = "color";
	private static final String KEY_THICKNESS = "thickness";
	private static final String KEY_ALPHA = "alpha";
	private static final String KEY_CLOSED = "closed";
	
	private RegionIO() {
		throw new AssertionError();
	}
	
	/**
	 * Read regions from a JSON file.
	 * @param path
	 * @return an ordered map of regions, keyed by name
	 * @throws IOException if the file cannot be read or is not valid JSON
	 * @see #parseRegions(JsonObject)
	 */
	public static Map<String, Region> readRegions(Path path) throws IOException {
		try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return readRegions(reader);
		}
	}
	
	/**
	 * Read regions from JSON.
	 * @param reader
	 * @return an ordered map of regions, keyed by name
	 * @throws IOException if the JSON cannot be read or parsed
	 */
	public static Map<String, Region> readRegions(Reader reader) throws IOException {
		JsonElement element;
		try {
			element = GsonTools.getInstance().fromJson(reader, JsonElement.class);
		} catch (JsonIOException e) {
			throw new IOException(e.getLocalizedMessage(), e);
		} catch (JsonParseException e) {
			throw new IOException("Invalid region JSON: " + e.getLocalizedMessage(), e);
		}
		if (element == null || element.isJsonNull())
			return Collections.emptyMap();
		if (!element.isJsonObject())
			throw new IOException("Region JSON must be an object, but was " + element);
		return parseRegions(element.getAsJsonObject());
	}
	
	/**
	 * Parse regions from a JSON object.
	 * <p>
	 * Entries that cannot be parsed are logged and skipped, so that one bad region does not prevent 
	 * the others from being used.
	 * 
	 * @param json
	 * @return an ordered map of regions, keyed by name
	 */
	public static Map<String, Region> parseRegions(JsonObject json) {
		var obj = json;
		if (json.has(KEY_ROIS) && json.get(KEY_ROIS).isJsonObject())
			obj = json.getAsJsonObject(KEY_ROIS);
		
		var map = new LinkedHashMap<String, Region>();
		for (var entry : obj.entrySet()) {
			var name = entry.getKey();
			if (!entry.getValue().isJsonObject()) {
				logger.warn("Skipping region {} - definition is not an object", name);
				continue;
			}
			try {
				map.put(name, parseRegion(name, entry.getValue().getAsJsonObject()));
			} catch (RuntimeException e) {
				logger.warn("Skipping region {}: {}", name, e.getLocalizedMessage());
				logger.debug(e.getLocalizedMessage(), e);
			}
		}
		return map;
	}
	
	/**
	 * Parse a single region definition.
	 * @param name
	 * @param obj
	 * @return
	 * @throws IllegalArgumentException if the definition is invalid
	 */
	public static Region parseRegion(String name, JsonObject obj) throws IllegalArgumentException {
		if (!obj.has(KEY_POINTS) || !obj.get(KEY_POINTS).isJsonArray())
			throw new IllegalArgumentException("No points array");
		var builder = Region.builder(name);
		for (var p : obj.getAsJsonArray(KEY_POINTS)) {
			var xy = p.getAsJsonArray();
			if (xy.size() < 2)
				throw new IllegalArgumentException("Invalid point " + xy);
			builder.addPoint(
					(int)Math.round(xy.get(0).getAsDouble()),
					(int)Math.round(xy.get(1).getAsDouble()));
		}
		if (obj.has(KEY_COLOR)) {
			var arr = obj.getAsJsonArray(KEY_COLOR);
			int[] bgr = new int[arr.size()];
			for (int i = 0; i < bgr.length; i++)
				bgr[i] = arr.get(i).getAsInt();
			builder.color(ColorTools.packBGRTriplet(bgr));
		}
		if (obj.has(KEY_THICKNESS))
			builder.thickness(obj.get(KEY_THICKNESS).getAsInt());
		if (obj.has(KEY_ALPHA))
			builder.alpha(obj.get(KEY_ALPHA).getAsDouble());
		if (obj.has(KEY_CLOSED))
			builder.closed(obj.get(KEY_CLOSED).getAsBoolean());
		return builder.build();
	}
	
	/**
	 * Convert regions to JSON, in the same form accepted by {@link #parseRegions(JsonObject)}.
	 * @param regions
	 * @return
	 */
	public static JsonObject toJson(Map<String, Region> regions) {
		var obj = new JsonObject();
		for (var region : regions.values()) {
			var json = new JsonObject();
			var points = new JsonArray();
			for (int i = 0; i < region.getNumPoints(); i++) {
				var xy = new JsonArray();
				xy.add(region.getX(i));
				xy.add(region.getY(i));
				points.add(xy);
			}
			json.add(KEY_POINTS, points);
			var color = new JsonArray();
			for (int v : ColorTools.unpackBGRTriplet(region.getColor()))
				color.add(v);
			json.add(KEY_COLOR, color);
			json.add(KEY_THICKNESS, new JsonPrimitive(region.getThickness()));
			json.add(KEY_ALPHA, new JsonPrimitive(region.getAlpha()));
			json.add(KEY_CLOSED, new JsonPrimitive(region.isClosed()));
			obj.add(region.getName(), json);
		}
		return obj;
	}
	
	/**
	 * Write regions to a JSON file.
	 * @param regions
	 * @param path
	 * @throws IOException
	 */
	public static void writeRegions(Map<String, Region> regions, Path path) throws IOException {
		writeJson(toJson(regions), path);
	}
	
	/**
	 * Write analysis results (or any other object Gson can serialize) as pretty-printed JSON.
	 * @param results
	 * @param path
	 * @throws IOException
	 */
	public static void writeStatistics(Object results, Path path) throws IOException {
		writeJson(results, path);
	}
	
	private static void writeJson(Object obj, Path path) throws IOException {
		var parent = path.toAbsolutePath().getParent();
		if (parent != null)
			Files.createDirectories(parent);
		try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			var gson = GsonTools.getInstance(true);
			if (obj instanceof JsonElement)
				gson.toJson((JsonElement)obj, writer);
			else
				gson.toJson(obj, writer);
		} catch (JsonIOException e) {
			throw new IOException(e.getLocalizedMessage(), e);
		}
	}

}
