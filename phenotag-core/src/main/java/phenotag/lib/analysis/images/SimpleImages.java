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

package phenotag.lib.analysis.images;

import java.util.Objects;

/**
 * Create {@link SimpleImage SimpleImage} instances for basic pixel processing.
 * 
 * @author PhenoTag developers
 */
public class SimpleImages {
	
	private SimpleImages() {
		throw new AssertionError();
	}
	
	/**
	 * Get the pixel values for the image.
	 * @param image
	 * @param direct if true, return the direct pixel buffer if possible. The caller should <i>not</i> modify this.
	 * @return
	 */
	public static float[] getPixels(SimpleImage image, boolean direct) {
		if (image instanceof SimpleModifiableImage)
			return ((SimpleModifiableImage)image).getArray(direct);
		int n = image.getWidth() * image.getHeight();
		int w = image.getWidth();
		float[] pixels = new float[n];
		for (int i = 0; i < n; i++)
			pixels[i] = image.getValue(i % w, i / w);
		return pixels;
	}
	
	/**
	 * Create a {@link SimpleImage} backed by an existing float array of pixels.
	 * <p>
	 * Pixels are stored in row-major order.
	 * 
	 * @param data
	 * @param width
	 * @param height
	 * @return
	 * @throws IllegalArgumentException if the array length does not match the dimensions
	 */
	public static SimpleModifiableImage createFloatImage(float[] data, int width, int height) {
		checkLength(data.length, width, height);
		return new FloatArraySimpleImage(data, width, height);
	}
	
	/**
	 * Create a {@link SimpleImage} backed by an existing array of unsigned 8-bit values.
	 * <p>
	 * Pixels are stored in row-major order.
	 * 
	 * @param data
	 * @param width
	 * @param height
	 * @return
	 * @throws IllegalArgumentException if the array length does not match the dimensions
	 */
	public static ByteSimpleImage createByteImage(byte[] data, int width, int height) {
		checkLength(data.length, width, height);
		return new ByteSimpleImage(data, width, height);
	}
	
	/**
	 * Get the number of bytes used to store each pixel of an image.
	 * @param image
	 * @return 1 for unsigned byte images, 4 otherwise
	 */
	public static int getBytesPerPixel(SimpleImage image) {
		return image instanceof ByteSimpleImage ? 1 : Float.BYTES;
	}
	
	private static void checkLength(int length, int width, int height) {
		if (width < 0 || height < 0 || length != width * height)
			throw new IllegalArgumentException(
					String.format("Array length %d does not match image size %d x %d", length, width, height));
	}
	
	
	/**
	 * Implementation of a SimpleImage backed by an array of floats.
	 */
	static class FloatArraySimpleImage implements SimpleModifiableImage {
		
		private final float[] data;
		private final int width;
		private final int height;
		
		FloatArraySimpleImage(float[] data, int width, int height) {
			this.data = data;
			this.width = width;
			this.height = height;
		}

		@Override
		public float getValue(int x, int y) {
			return data[y * width + x];
		}

		@Override
		public void setValue(int x, int y, float val) {
			data[y * width + x] = val;
		}

		@Override
		public int getWidth() {
			return width;
		}

		@Override
		public int getHeight() {
			return height;
		}

		@Override
		public float[] getArray(boolean direct) {
			if (direct)
				return data;
			return data.clone();
		}
		
	}
	
	
	/**
	 * Read-only {@link SimpleImage} backed by unsigned 8-bit values.
	 */
	public static class ByteSimpleImage implements SimpleImage {
		
		private final byte[] data;
		private final int width;
		private final int height;
		
		private ByteSimpleImage(byte[] data, int width, int height) {
			this.data = Objects.requireNonNull(data);
			this.width = width;
			this.height = height;
		}
		
		/**
		 * Get an unsigned pixel value, in the range 0-255.
		 * @param x
		 * @param y
		 * @return
		 */
		public int getInt(int x, int y) {
			return data[y * width + x] & 0xFF;
		}

		@Override
		public float getValue(int x, int y) {
			return getInt(x, y);
		}

		@Override
		public int getWidth() {
			return width;
		}

		@Override
		public int getHeight() {
			return height;
		}
		
		/**
		 * Get the pixels in row-major order.
		 * @param direct if true, return the backing array; the caller should <i>not</i> modify it
		 * @return
		 */
		public byte[] getArray(boolean direct) {
			if (direct)
				return data;
			return data.clone();
		}
		
	}

}
