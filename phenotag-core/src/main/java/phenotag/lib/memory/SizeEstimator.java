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

package phenotag.lib.memory;

import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;

import phenotag.lib.analysis.images.SimpleImage;
import phenotag.lib.analysis.images.SimpleImages;

/**
 * Estimate the memory used by an object stored in a {@link BoundedCache}.
 * <p>
 * Sizes are given in MB (10<sup>6</sup> bytes). Only the pixel or element payload is counted;
 * object overhead is ignored.
 * 
 * @author PhenoTag developers
 */
@FunctionalInterface
public interface SizeEstimator {
	
	/**
	 * Size assumed for values of an unknown type.
	 */
	double DEFAULT_SIZE_MB = 1.0;
	
	/**
	 * Get the approximate size of a value.
	 * @param value
	 * @return size in MB
	 */
	double getApproxSizeMB(Object value);
	
	/**
	 * Get the default estimator.
	 * <p>
	 * This handles {@link BufferedImage}, {@link SimpleImage}, primitive arrays and {@link Sized} values,
	 * and returns {@link #DEFAULT_SIZE_MB} for anything else.
	 * @return
	 */
	static SizeEstimator getDefault() {
		return DefaultSizeEstimator.INSTANCE;
	}
	
	
	/**
	 * Interface for values that can report their own approximate size.
	 */
	interface Sized {
		
		/**
		 * @return approximate size of the value in bytes
		 */
		long getApproxSizeBytes();
		
	}
	
	
	/**
	 * Default estimator.
	 */
	class DefaultSizeEstimator implements SizeEstimator {
		
		private static final DefaultSizeEstimator INSTANCE = new DefaultSizeEstimator();
		
		private static final double BYTES_PER_MB = 1e6;
		
		private DefaultSizeEstimator() {}

		@Override
		public double getApproxSizeMB(Object value) {
			long bytes = getApproxSizeBytes(value);
			if (bytes < 0)
				return DEFAULT_SIZE_MB;
			return bytes / BYTES_PER_MB;
		}
		
		/**
		 * Get the size in bytes, or -1 if unknown.
		 */
		static long getApproxSizeBytes(Object value) {
			if (value instanceof Sized)
				return ((Sized)value).getApproxSizeBytes();
			if (value instanceof BufferedImage)
				return getApproxImageSizeBytes((BufferedImage)value);
			if (value instanceof SimpleImage) {
				var img = (SimpleImage)value;
				return (long)img.getWidth() * img.getHeight() * SimpleImages.getBytesPerPixel(img);
			}
			if (value instanceof byte[])
				return ((byte[])value).length;
			if (value instanceof short[])
				return ((short[])value).length * (long)Short.BYTES;
			if (value instanceof int[])
				return ((int[])value).length * (long)Integer.BYTES;
			if (value instanceof float[])
				return ((float[])value).length * (long)Float.BYTES;
			if (value instanceof long[])
				return ((long[])value).length * (long)Long.BYTES;
			if (value instanceof double[])
				return ((double[])value).length * (long)Double.BYTES;
			return -1;
		}
		
		/**
		 * Pixel payload of an image, based upon its raster.
		 * @param img
		 * @return
		 */
		public static long getApproxImageSizeBytes(BufferedImage img) {
			var raster = img.getRaster();
			int bytesPerSample = Math.max(1, DataBuffer.getDataTypeSize(raster.getDataBuffer().getDataType()) / 8);
			return (long)img.getWidth() * img.getHeight() * raster.getNumBands() * bytesPerSample;
		}
		
	}

}
