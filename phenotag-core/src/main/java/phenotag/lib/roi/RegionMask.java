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

package phenotag.lib.roi;

import java.awt.Rectangle;
import java.util.Arrays;
import java.util.Objects;

/**
 * Binary pixel mask for a {@link Region}.
 * <p>
 * The polygon interior is filled row by row using the even-odd rule, sampling at integer coordinates, 
 * and the polygon edges are then rasterized so that boundary pixels are always included. 
 * A polygon passing through the four corner pixels of an image therefore covers every pixel.
 * Anything outside the image is clipped.
 * 
 * @author PhenoTag developers
 */
public class RegionMask {
	
	private final int width;
	private final int height;
	private final byte[] mask;
	private final long count;
	private final Rectangle bounds;
	
	private RegionMask(int width, int height, byte[] mask) {
		this.width = width;
		this.height = height;
		this.mask = mask;
		
		int minX = Integer.MAX_VALUE, minY = Integer.MAX_VALUE, maxX = -1, maxY = -1;
		long n = 0;
		for (int y = 0; y < height; y++) {
			int offset = y * width;
			for (int x = 0; x < width; x++) {
				if (mask[offset + x] != 0) {
					n++;
					if (x < minX)
						minX = x;
					if (x > maxX)
						maxX = x;
					if (y < minY)
						minY = y;
					maxY = y;
				}
			}
		}
		this.count = n;
		this.bounds = n == 0 ? null : new Rectangle(minX, minY, maxX - minX + 1, maxY - minY + 1);
	}
	
	/**
	 * Create a mask for a region within an image of the specified size.
	 * @param region
	 * @param width image width
	 * @param height image height
	 * @return
	 * @throws IllegalArgumentException if the width or height is not positive
	 */
	public static RegionMask build(Region region, int width, int height) {
		Objects.requireNonNull(region);
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Mask size must be positive, but was " + width + " x " + height);
		
		int[] xp = region.getXPoints();
		int[] yp = region.getYPoints();
		int n = xp.length;
		byte[] mask = new byte[width * height];
		
		if (n >= 3)
			fillPolygon(xp, yp, mask, width, height);
		
		for (int i = 0; i < n; i++) {
			int j = (i + 1) % n;
			drawLine(xp[i], yp[i], xp[j], yp[j], mask, width, height);
		}
		return new RegionMask(width, height, mask);
	}
	
	private static void fillPolygon(int[] xp, int[] yp, byte[] mask, int width, int height) {
		int n = xp.length;
		int yMin = Integer.MAX_VALUE, yMax = Integer.MIN_VALUE;
		for (int y : yp) {
			yMin = Math.min(yMin, y);
			yMax = Math.max(yMax, y);
		}
		yMin = Math.max(0, yMin);
		yMax = Math.min(height - 1, yMax);
		
		double[] crossings = new double[n];
		for (int y = yMin; y <= yMax; y++) {
			int nCrossings = 0;
			for (int i = 0; i < n; i++) {
				int j = (i + 1) % n;
				int y0 = yp[i], y1 = yp[j];
				// Half-open, so that shared vertices are only counted once
				if ((y0 <= y && y < y1) || (y1 <= y && y < y0)) {
					crossings[nCrossings++] = xp[i] + (double)(y - y0) * (xp[j] - xp[i]) / (y1 - y0);
				}
			}
			Arrays.sort(crossings, 0, nCrossings);
			int offset = y * width;
			for (int k = 0; k + 1 < nCrossings; k += 2) {
				double xStart = Math.ceil(crossings[k]);
				double xEnd = Math.floor(crossings[k + 1]);
				int x0 = (int)Math.max(0, xStart);
				int x1 = (int)Math.min(width - 1, xEnd);
				for (int x = x0; x <= x1; x++)
					mask[offset + x] = 1;
			}
		}
	}
	
	/**
	 * Rasterize a line segment after clipping it to the image.
	 */
	private static void drawLine(int xa, int ya, int xb, int yb, byte[] mask, int width, int height) {
		// Liang-Barsky clipping
		double t0 = 0, t1 = 1;
		double dx = xb - xa, dy = yb - ya;
		double[] p = {-dx, dx, -dy, dy};
		double[] q = {xa, width - 1 - xa, ya, height - 1 - ya};
		for (int i = 0; i < 4; i++) {
			if (p[i] == 0) {
				if (q[i] < 0)
					return;
				continue;
			}
			double t = q[i] / p[i];
			if (p[i] < 0) {
				if (t > t1)
					return;
				if (t > t0)
					t0 = t;
			} else {
				if (t < t0)
					return;
				if (t < t1)
					t1 = t;
			}
		}
		int x0 = (int)Math.round(xa + t0 * dx);
		int y0 = (int)Math.round(ya + t0 * dy);
		int x1 = (int)Math.round(xa + t1 * dx);
		int y1 = (int)Math.round(ya + t1 * dy);
		
		// Bresenham
		int sx = x0 < x1 ? 1 : -1;
		int sy = y0 < y1 ? 1 : -1;
		int ex = Math.abs(x1 - x0);
		int ey = -Math.abs(y1 - y0);
		int err = ex + ey;
		while (true) {
			if (x0 >= 0 && x0 < width && y0 >= 0 && y0 < height)
				mask[y0 * width + x0] = 1;
			if (x0 == x1 && y0 == y1)
				break;
			int e2 = 2 * err;
			if (e2 >= ey) {
				err += ey;
				x0 += sx;
			}
			if (e2 <= ex) {
				err += ex;
				y0 += sy;
			}
		}
	}
	
	/**
	 * @return mask width
	 */
	public int getWidth() {
		return width;
	}
	
	/**
	 * @return mask height
	 */
	public int getHeight() {
		return height;
	}
	
	/**
	 * Query whether a pixel is inside the mask.
	 * @param x
	 * @param y
	 * @return true if the pixel is within the image and inside the region
	 */
	public boolean contains(int x, int y) {
		if (x < 0 || y < 0 || x >= width || y >= height)
			return false;
		return mask[y * width + x] != 0;
	}
	
	/**
	 * @return the number of pixels inside the mask
	 */
	public long getCount() {
		return count;
	}
	
	/**
	 * @return true if the mask contains no pixels
	 */
	public boolean isEmpty() {
		return count == 0;
	}
	
	/**
	 * Get the bounding box of all pixels inside the mask.
	 * @return the bounds, or null if the mask is empty
	 */
	public Rectangle getBounds() {
		return bounds == null ? null : new Rectangle(bounds);
	}
	
	/**
	 * Get the mask values in row-major order, 1 inside the region and 0 outside.
	 * The caller should <i>not</i> modify the array.
	 * @return
	 */
	public byte[] getArray() {
		return mask;
	}
	
	/**
	 * Count the pixels inside the mask for a range of rows.
	 * @param yStart first row (inclusive)
	 * @param yEnd last row (exclusive)
	 * @return
	 */
	public long countInRows(int yStart, int yEnd) {
		yStart = Math.max(0, yStart);
		yEnd = Math.min(height, yEnd);
		long n = 0;
		for (int i = yStart * width; i < yEnd * width; i++) {
			if (mask[i] != 0)
				n++;
		}
		return n;
	}
	
	@Override
	public String toString() {
		return "RegionMask[" + width + "x" + height + ", count=" + count + ", bounds=" + bounds + "]";
	}

}
