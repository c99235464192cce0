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

package phenotag.lib.images;

/**
 * Basic image properties, read from a file header without decoding pixels.
 * 
 * @author PhenoTag developers
 */
public class ImageInfo {
	
	private final int width;
	private final int height;
	private final int channels;
	private final int bytesPerSample;
	private final String formatName;
	
	ImageInfo(int width, int height, int channels, int bytesPerSample, String formatName) {
		this.width = width;
		this.height = height;
		this.channels = channels;
		this.bytesPerSample = bytesPerSample;
		this.formatName = formatName;
	}

	/**
	 * @return full resolution width
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * @return full resolution height
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * @return number of channels once decoded
	 */
	public int getChannels() {
		return channels;
	}

	/**
	 * @return bytes used to store each channel value once decoded
	 */
	public int getBytesPerSample() {
		return bytesPerSample;
	}

	/**
	 * @return the ImageIO format name, e.g. "JPEG"
	 */
	public String getFormatName() {
		return formatName;
	}
	
	@Override
	public String toString() {
		return "ImageInfo[" + formatName + ", " + width + "x" + height + "x" + channels + "]";
	}

}
