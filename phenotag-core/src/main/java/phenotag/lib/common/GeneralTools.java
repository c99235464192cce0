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

import java.io.File;
import java.util.Locale;
import java.util.Optional;

/**
 * A collection of generally useful static methods.
 * 
 * @author PhenoTag developers
 *
 */
public final class GeneralTools {
	
	private static final double MB = 1024.0 * 1024.0;
	
	// Suppressed default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}
	
	/**
	 * Clip an input value to be within a specified range.
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static int clipValue(final int value, final int min, final int max) {
		return Math.min(max, Math.max(value, min));
	}

	/**
	 * Clip an input value to be within a specified range.
	 * <p>
	 * NaN is returned unchanged.
	 * 
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static double clipValue(final double value, final double min, final double max) {
		if (Double.isNaN(value))
			return value;
		return Math.min(max, Math.max(value, min));
	}
	
	/**
	 * Get the file name without its extension.
	 * @param name a file name or path
	 * @return the final path component with its (last) extension removed
	 */
	public static String getNameWithoutExtension(String name) {
		String base = new File(name).getName();
		int ind = base.lastIndexOf('.');
		if (ind <= 0)
			return base;
		return base.substring(0, ind);
	}
	
	/**
	 * Get the lower-case extension of a file name, including the dot.
	 * @param name
	 * @return the extension, or empty if the name has none
	 */
	public static Optional<String> getExtension(String name) {
		String base = new File(name).getName();
		int ind = base.lastIndexOf('.');
		if (ind <= 0 || ind == base.length() - 1)
			return Optional.empty();
		return Optional.of(base.substring(ind).toLowerCase(Locale.ROOT));
	}
	
	/**
	 * Convert a number of bytes to MiB.
	 * @param bytes
	 * @return
	 */
	public static double bytesToMB(long bytes) {
		return bytes / MB;
	}
	
	/**
	 * Format a value in MB for logging, with one decimal place.
	 * @param mb
	 * @return
	 */
	public static String formatMB(double mb) {
		return String.format(Locale.ROOT, "%.1f MB", mb);
	}

}
