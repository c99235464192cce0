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

/**
 * A {@link SimpleImage} backed by a float array that may be modified.
 * 
 * @author PhenoTag developers
 */
public interface SimpleModifiableImage extends SimpleImage {
	
	/**
	 * Set a pixel value.
	 * @param x column
	 * @param y row
	 * @param val
	 */
	void setValue(int x, int y, float val);
	
	/**
	 * Get the pixels in row-major order.
	 * @param direct if true, return the backing array; otherwise return a copy
	 * @return
	 */
	float[] getArray(boolean direct);

}
