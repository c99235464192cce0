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

import java.awt.Point;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import phenotag.lib.common.ColorTools;

/**
 * A named polygonal region of interest, with the display properties used to draw it.
 * <p>
 * Vertices are integer pixel coordinates. The polygon is always treated as closed when used as a mask; 
 * the closed flag only affects how the outline is drawn.
 * <p>
 * Instances are immutable; use {@link #builder(String)} to create one.
 * 
 * @author PhenoTag developers
 */
public class Region {
	
	/**
	 * Default outline color (green).
	 */
	public static final int DEFAULT_COLOR = ColorTools.GREEN;
	
	/**
	 * Default outline thickness, in pixels.
	 */
	public static final int DEFAULT_THICKNESS = 2;
	
	/**
	 * Default fill opacity.
	 */
	public static final double DEFAULT_ALPHA = 0.3;
	
	private final String name;
	private final int[] xPoints;
	private final int[] yPoints;
	private final int color;
	private final int thickness;
	private final double alpha;
	private final boolean closed;
	
	private Region(Builder builder) {
		this.name = builder.name;
		int n = builder.points.size();
		this.xPoints = new int[n];
		this.yPoints = new int[n];
		for (int i = 0; i < n; i++) {
			xPoints[i] = builder.points.get(i)[0];
			yPoints[i] = builder.points.get(i)[1];
		}
		this.color = builder.color;
		this.thickness = builder.thickness;
		this.alpha = builder.alpha;
		this.closed = builder.closed;
	}
	
	/**
	 * Create a builder for a region with the given name.
	 * @param name
	 * @return
	 */
	public static Builder builder(String name) {
		return new Builder(name);
	}
	
	/**
	 * Create a builder initialized with all the properties of this region.
	 * @return
	 */
	public Builder toBuilder() {
		return toBuilder(name);
	}
	
	/**
	 * Get a region with the same vertices and display properties, but a different name.
	 * @param name
	 * @return this region if the name is unchanged, otherwise a new region
	 */
	public Region withName(String name) {
		if (this.name.equals(name))
			return this;
		return toBuilder(name).build();
	}
	
	private Builder toBuilder(String name) {
		var builder = new Builder(name)
				.color(color)
				.thickness(thickness)
				.alpha(alpha)
				.closed(closed);
		for (int i = 0; i < xPoints.length; i++)
			builder.addPoint(xPoints[i], yPoints[i]);
		return builder;
	}

	/**
	 * @return the region name
	 */
	public String getName() {
		return name;
	}
	
	/**
	 * @return the number of vertices
	 */
	public int getNumPoints() {
		return xPoints.length;
	}
	
	/**
	 * Get the x coordinate of a vertex.
	 * @param ind
	 * @return
	 */
	public int getX(int ind) {
		return xPoints[ind];
	}
	
	/**
	 * Get the y coordinate of a vertex.
	 * @param ind
	 * @return
	 */
	public int getY(int ind) {
		return yPoints[ind];
	}
	
	/**
	 * @return a copy of the x coordinates of all vertices
	 */
	public int[] getXPoints() {
		return xPoints.clone();
	}

	/**
	 * @return a copy of the y coordinates of all vertices
	 */
	public int[] getYPoints() {
		return yPoints.clone();
	}
	
	/**
	 * @return an unmodifiable list of the vertices
	 */
	public List<Point> getPoints() {
		var list = new ArrayList<Point>(xPoints.length);
		for (int i = 0; i < xPoints.length; i++)
			list.add(new Point(xPoints[i], yPoints[i]));
		return Collections.unmodifiableList(list);
	}

	/**
	 * @return packed RGB outline color
	 * @see ColorTools#packRGB(int, int, int)
	 */
	public int getColor() {
		return color;
	}

	/**
	 * @return outline thickness in pixels
	 */
	public int getThickness() {
		return thickness;
	}

	/**
	 * @return fill opacity, between 0 (no fill) and 1
	 */
	public double getAlpha() {
		return alpha;
	}

	/**
	 * @return true if the outline should connect the last vertex back to the first
	 */
	public boolean isClosed() {
		return closed;
	}
	
	/**
	 * Get a string that identifies the polygon, for use in cache keys.
	 * This contains every vertex, so two regions have the same key only if {@link #sameShape(Region)} is true.
	 * Display properties are not included.
	 * @return
	 */
	public String getShapeKey() {
		var sb = new StringBuilder(xPoints.length * 8 + 4);
		sb.append(xPoints.length).append('-');
		for (int i = 0; i < xPoints.length; i++) {
			if (i > 0)
				sb.append(';');
			sb.append(xPoints[i]).append(',').append(yPoints[i]);
		}
		return sb.toString();
	}
	
	/**
	 * Query whether another region has exactly the same vertices.
	 * @param other
	 * @return
	 */
	public boolean sameShape(Region other) {
		return other != null && Arrays.equals(xPoints, other.xPoints) && Arrays.equals(yPoints, other.yPoints);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, Arrays.hashCode(xPoints), Arrays.hashCode(yPoints), color, thickness, alpha, closed);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Region))
			return false;
		var other = (Region)obj;
		return name.equals(other.name) && sameShape(other) && color == other.color && thickness == other.thickness
				&& Double.compare(alpha, other.alpha) == 0 && closed == other.closed;
	}
	
	@Override
	public String toString() {
		return String.format(Locale.ROOT, "Region[%s, %d points, color=#%06x, thickness=%d, alpha=%.2f, closed=%s]",
				name, xPoints.length, color & 0xFFFFFF, thickness, alpha, closed);
	}
	
	
	/**
	 * Builder for {@link Region} instances.
	 */
	public static class Builder {
		
		private final String name;
		private final List<int[]> points = new ArrayList<>();
		private int color = DEFAULT_COLOR;
		private int thickness = DEFAULT_THICKNESS;
		private double alpha = DEFAULT_ALPHA;
		private boolean closed = true;
		
		private Builder(String name) {
			this.name = Objects.requireNonNull(name, "Region name must not be null");
		}
		
		/**
		 * Append a vertex.
		 * @param x
		 * @param y
		 * @return this builder
		 */
		public Builder addPoint(int x, int y) {
			points.add(new int[] {x, y});
			return this;
		}
		
		/**
		 * Append vertices from parallel coordinate arrays.
		 * @param x
		 * @param y
		 * @return this builder
		 */
		public Builder addPoints(int[] x, int[] y) {
			if (x.length != y.length)
				throw new IllegalArgumentException("Coordinate arrays differ in length: " + x.length + " and " + y.length);
			for (int i = 0; i < x.length; i++)
				addPoint(x[i], y[i]);
			return this;
		}
		
		/**
		 * Set the outline color.
		 * @param rgb packed RGB value
		 * @return this builder
		 */
		public Builder color(int rgb) {
			this.color = rgb | 0xff000000;
			return this;
		}
		
		/**
		 * Set the outline thickness.
		 * @param thickness
		 * @return this builder
		 */
		public Builder thickness(int thickness) {
			this.thickness = thickness;
			return this;
		}
		
		/**
		 * Set the fill opacity.
		 * @param alpha
		 * @return this builder
		 */
		public Builder alpha(double alpha) {
			this.alpha = alpha;
			return this;
		}
		
		/**
		 * Set whether the outline is closed.
		 * @param closed
		 * @return this builder
		 */
		public Builder closed(boolean closed) {
			this.closed = closed;
			return this;
		}
		
		/**
		 * Build the region.
		 * @return
		 * @throws IllegalArgumentException if the name is empty, there are no vertices, 
		 *         the thickness is less than 1 or alpha is outside [0, 1]
		 */
		public Region build() throws IllegalArgumentException {
			if (name.isBlank())
				throw new IllegalArgumentException("Region name must not be empty");
			if (points.isEmpty())
				throw new IllegalArgumentException("Region " + name + " has no points");
			if (thickness < 1)
				throw new IllegalArgumentException("Thickness must be >= 1, but was " + thickness);
			if (!(alpha >= 0 && alpha <= 1))
				throw new IllegalArgumentException("Alpha must be between 0 and 1, but was " + alpha);
			return new Region(this);
		}
		
	}

}
