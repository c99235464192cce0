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

import java.awt.image.BufferedImage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import phenotag.lib.analysis.images.SimpleImage;
import phenotag.lib.analysis.images.SimpleImages;
import phenotag.lib.memory.SizeEstimator;
import phenotag.lib.memory.SizeEstimator.DefaultSizeEstimator;

/**
 * The red, green and blue bands derived from one image, optionally with a color composite.
 * 
 * @author PhenoTag developers
 */
public class BandSet implements SizeEstimator.Sized {
	
	/**
	 * Name of the red band.
	 */
	public static final String RED = "r";
	
	/**
	 * Name of the green band.
	 */
	public static final String GREEN = "g";
	
	/**
	 * Name of the blue band.
	 */
	public static final String BLUE = "b";
	
	/**
	 * Name used to request the color composite.
	 */
	public static final String COMPOSITE = "composite";
	
	private final BandType type;
	private final int width;
	private final int height;
	private final Map<String, SimpleImage> bands;
	private final BufferedImage composite;
	
	BandSet(BandType type, SimpleImage red, SimpleImage green, SimpleImage blue, BufferedImage composite) {
		this.type = type;
		this.width = red.getWidth();
		this.height = red.getHeight();
		var map = new LinkedHashMap<String, SimpleImage>();
		map.put(RED, red);
		map.put(GREEN, green);
		map.put(BLUE, blue);
		this.bands = Collections.unmodifiableMap(map);
		this.composite = composite;
	}
	
	/**
	 * @return the kind of bands
	 */
	public BandType getType() {
		return type;
	}
	
	/**
	 * @return band width, the same as the source image
	 */
	public int getWidth() {
		return width;
	}
	
	/**
	 * @return band height, the same as the source image
	 */
	public int getHeight() {
		return height;
	}
	
	/**
	 * Get a band by name.
	 * @param name one of {@link #RED}, {@link #GREEN} or {@link #BLUE}
	 * @return the band, or null if the name is not recognized
	 */
	public SimpleImage getBand(String name) {
		return bands.get(name);
	}
	
	/**
	 * @return the band names, in the order red, green, blue
	 */
	public Set<String> getBandNames() {
		return bands.keySet();
	}
	
	/**
	 * @return an unmodifiable map of band names to bands
	 */
	public Map<String, SimpleImage> getBands() {
		return bands;
	}
	
	/**
	 * Get the color composite, if there is one.
	 * The caller should <i>not</i> modify the image.
	 * @return
	 */
	public BufferedImage getComposite() {
		return composite;
	}
	
	/**
	 * Query whether the bands have the specified dimensions.
	 * @param width
	 * @param height
	 * @return
	 */
	public boolean hasSize(int width, int height) {
		return this.width == width && this.height == height;
	}

	@Override
	public long getApproxSizeBytes() {
		long bytes = 0;
		for (var band : bands.values())
			bytes += (long)band.getWidth() * band.getHeight() * SimpleImages.getBytesPerPixel(band);
		if (composite != null)
			bytes += DefaultSizeEstimator.getApproxImageSizeBytes(composite);
		return bytes;
	}
	
	@Override
	public String toString() {
		return "BandSet[" + type + ", " + width + "x" + height + (composite == null ? "" : ", with composite") + "]";
	}

}
