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

import java.awt.Color;

/**
 * Static functions to help work with RGB colors using packed ints.
 * <p>
 * Packed values follow {@link Color}, i.e. ARGB with the alpha channel in the highest byte.
 * 
 * @author PhenoTag developers
 *
 */
public final class ColorTools {

	// Suppressed default constructor for non-instantiability
	private ColorTools() {
		throw new AssertionError();
	}
	
	/**
	 * Packed int representing green, the default region color.
	 */
	public static final int GREEN = packRGB(0, 255, 0);

	/**
	 * Packed int representing yellow, used for the default region.
	 */
	public static final int YELLOW = packRGB(255, 255, 0);
	
	/**
	 * Make a packed RGB value from specified input values.
	 * <p>
	 * Input r, g, and b should be in the range 0-255; only the lower 8 bits are used.
	 * 
	 * @param r
	 * @param g
	 * @param b
	 * @return packed ARGB value with alpha 255
	 */
	public static int packRGB(int r, int g, int b) {
		return (0xff << 24) | ((r & 0xff) << 16) | ((g & 0xff) << 8) | (b & 0xff);
	}
	
	/**
	 * Make a packed RGB value from a triplet stored in blue, green, red order, clipping each value to 0-255.
	 * <p>
	 * This is the order used by region definition files.
	 * 
	 * @param bgr array of length 3
	 * @return packed ARGB value
	 * @throws IllegalArgumentException if the array does not have length 3
	 */
	public static int packBGRTriplet(int[] bgr) {
		if (bgr == null || bgr.length != 3)
			throw new IllegalArgumentException("Color triplet must have exactly 3 values");
		return packRGB(clip255(bgr[2]), clip255(bgr[1]), clip255(bgr[0]));
	}
	
	/**
	 * Unpack a color into a blue, green, red triplet.
	 * @param rgb packed value
	 * @return
	 */
	public static int[] unpackBGRTriplet(int rgb) {
		return new int[] {blue(rgb), green(rgb), red(rgb)};
	}

	/**
	 * Extract the 8-bit red value from a packed RGB value.
	 * @param rgb
	 * @return
	 */
	public static int red(int rgb) {
		return (rgb >> 16) & 0xff;
	}

	/**
	 * Extract the 8-bit green value from a packed RGB value.
	 * @param rgb
	 * @return
	 */
	public static int green(int rgb) {
		return (rgb >> 8) & 0xff;
	}

	/**
	 * Extract the 8-bit blue value from a packed RGB value.
	 * @param rgb
	 * @return
	 */
	public static int blue(int rgb) {
		return rgb & 0xff;
	}
	
	/**
	 * Clip an int to the range 0-255.
	 * @param val
	 * @return
	 */
	public static int clip255(int val) {
		return GeneralTools.clipValue(val, 0, 255);
	}
	
	/**
	 * Convert an 8-bit RGB pixel to HSV using the ranges of 8-bit OpenCV images,
	 * i.e. hue in 0-180 and saturation and value in 0-255.
	 * 
	 * @param r
	 * @param g
	 * @param b
	 * @param hsv array of length 3 to fill, or null to create a new one
	 * @return the HSV values
	 */
	public static int[] rgbToHsv8(int r, int g, int b, int[] hsv) {
		if (hsv == null)
			hsv = new int[3];
		int max = Math.max(r, Math.max(g, b));
		int min = Math.min(r, Math.min(g, b));
		int delta = max - min;
		double h = 0;
		if (delta != 0) {
			if (max == r)
				h = 60.0 * (g - b) / delta;
			else if (max == g)
				h = 120.0 + 60.0 * (b - r) / delta;
			else
				h = 240.0 + 60.0 * (r - g) / delta;
			if (h < 0)
				h += 360.0;
		}
		hsv[0] = clipValue((int)Math.round(h / 2.0), 0, 180);
		hsv[1] = max == 0 ? 0 : clip255((int)Math.round(255.0 * delta / max));
		hsv[2] = max;
		return hsv;
	}
	
	private static int clipValue(int val, int min, int max) {
		return GeneralTools.clipValue(val, min, max);
	}

}
