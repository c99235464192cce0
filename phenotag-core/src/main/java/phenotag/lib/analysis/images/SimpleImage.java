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
 * Minimal interface for a single-channel image, used for derived bands.
 * <p>
 * Pixels are addressed by column and row, starting at the top left.
 * 
 * @author PhenoTag developers
 */
public interface SimpleImage {
	
	/**
	 * Get a pixel value.
	 * @param x column
	 * @param y row
	 * @return
	 */
	float getValue(int x, int y);
	
	/**
	 * @return the image width
	 */
	int getWidth();
	
	/**
	 * @return the image height
	 */
	int getHeight();

}
