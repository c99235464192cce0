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

/**
 * Detailed measurements for one region: color, area, shape and optionally a vegetation index and histograms.
 * <p>
 * Channel values are always keyed as "red", "green" and "blue".
 * 
 * @author PhenoTag developers
 */
public class ExtendedRegionStatistics {
	
	private final String name;
	private final Map<String, Double> meanColor;
	private final PixelSums pixelSum;
	private final long areaPixels;
	private final BoundingRect boundingRect;
	private final BandStatistics vegetationIndex;
	private final Map<String, long[]> histograms;
	
	private final transient boolean empty;
	
	ExtendedRegionStatistics(String name, Map<String, Double> meanColor, PixelSums pixelSum, long areaPixels,
			BoundingRect boundingRect, BandStatistics vegetationIndex, Map<String, long[]> histograms) {
		this(name, meanColor, pixelSum, areaPixels, boundingRect, vegetationIndex, histograms, false);
	}
	
	private ExtendedRegionStatistics(String name, Map<String, Double> meanColor, PixelSums pixelSum, long areaPixels,
			BoundingRect boundingRect, BandStatistics vegetationIndex, Map<String, long[]> histograms, boolean empty) {
		this.name = name;
		this.meanColor = meanColor == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(meanColor));
		this.pixelSum = pixelSum;
		this.areaPixels = areaPixels;
		this.boundingRect = boundingRect;
		this.vegetationIndex = vegetationIndex;
		this.histograms = histograms == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(histograms));
		this.empty = empty;
	}
	
	/**
	 * Create an empty result, used when a region cannot be found.
	 * @param name
	 * @return
	 */
	public static ExtendedRegionStatistics empty(String name) {
		return new ExtendedRegionStatistics(name, null, new PixelSums(0, 0, 0, 0), 0, null, null, null, true);
	}

	/**
	 * @return the region name
	 */
	public String getName() {
		return name;
	}
	
	/**
	 * @return true if the region was not found
	 */
	public boolean isEmpty() {
		return empty;
	}

	/**
	 * @return mean value of each channel inside the region
	 */
	public Map<String, Double> getMeanColor() {
		return meanColor;
	}

	/**
	 * @return sums of the channel values inside the region
	 */
	public PixelSums getPixelSum() {
		return pixelSum;
	}

	/**
	 * @return number of pixels inside the region
	 */
	public long getAreaPixels() {
		return areaPixels;
	}

	/**
	 * @return bounding rectangle of the region pixels, or null if the region contains no pixels
	 */
	public BoundingRect getBoundingRect() {
		return boundingRect;
	}

	/**
	 * @return statistics of (G-R)/(G+R), or null if not computed or there were no valid pixels
	 */
	public BandStatistics getVegetationIndex() {
		return vegetationIndex;
	}

	/**
	 * @return 256-bin histograms of each channel, or null if not computed
	 */
	public Map<String, long[]> getHistograms() {
		return histograms;
	}
	
	@Override
	public String toString() {
		if (empty)
			return "ExtendedRegionStatistics[" + name + ", empty]";
		return "ExtendedRegionStatistics[" + name + ", area=" + areaPixels + ", mean=" + meanColor + "]";
	}
	
	
	/**
	 * Channel sums inside a region.
	 */
	public static class PixelSums {
		
		private final double red;
		private final double green;
		private final double blue;
		private final double total;
		private final long pixelCount;
		
		PixelSums(double red, double green, double blue, long pixelCount) {
			this.red = red;
			this.green = green;
			this.blue = blue;
			this.total = red + green + blue;
			this.pixelCount = pixelCount;
		}

		/**
		 * @return sum of red values
		 */
		public double getRed() {
			return red;
		}

		/**
		 * @return sum of green values
		 */
		public double getGreen() {
			return green;
		}

		/**
		 * @return sum of blue values
		 */
		public double getBlue() {
			return blue;
		}

		/**
		 * @return sum over all three channels
		 */
		public double getTotal() {
			return total;
		}

		/**
		 * @return number of pixels summed
		 */
		public long getPixelCount() {
			return pixelCount;
		}
		
	}
	
	
	/**
	 * Axis-aligned bounding rectangle of a region.
	 */
	public static class BoundingRect {
		
		private final int x;
		private final int y;
		private final int width;
		private final int height;
		private final double aspectRatio;
		
		BoundingRect(int x, int y, int width, int height) {
			this.x = x;
			this.y = y;
			this.width = width;
			this.height = height;
			this.aspectRatio = height > 0 ? (double)width / height : 0;
		}

		/**
		 * @return left edge
		 */
		public int getX() {
			return x;
		}

		/**
		 * @return top edge
		 */
		public int getY() {
			return y;
		}

		/**
		 * @return width in pixels
		 */
		public int getWidth() {
			return width;
		}

		/**
		 * @return height in pixels
		 */
		public int getHeight() {
			return height;
		}

		/**
		 * @return width divided by height, or 0 if the height is 0
		 */
		public double getAspectRatio() {
			return aspectRatio;
		}
		
	}

}
