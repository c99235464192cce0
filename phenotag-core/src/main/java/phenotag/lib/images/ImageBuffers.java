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

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.ComponentSampleModel;
import java.awt.image.DataBufferByte;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import phenotag.lib.common.GeneralTools;

/**
 * Static methods for reading, writing and resampling 8-bit color image buffers.
 * <p>
 * All images returned from here use {@link BufferedImage#TYPE_3BYTE_BGR}, backed by a single 
 * interleaved byte array, so that pixels can be processed directly through {@link #getBGRPixels(BufferedImage)}.
 * 
 * @author PhenoTag developers
 */
public class ImageBuffers {
	
	private static final Logger logger = LoggerFactory.getLogger(ImageBuffers.class);
	
	/**
	 * Default JPEG quality, from 0-100.
	 */
	public static final int DEFAULT_JPEG_QUALITY = 95;
	
	private ImageBuffers() {
		throw new AssertionError();
	}
	
	/**
	 * Decode an image at full resolution.
	 * @param path
	 * @return a BGR image
	 * @throws IOException if the file does not exist or cannot be decoded
	 */
	public static BufferedImage read(Path path) throws IOException {
		return readSubsampled(path, 1);
	}
	
	/**
	 * Decode an image, reading only every n-th pixel in each dimension.
	 * <p>
	 * This avoids ever holding the full resolution pixels in memory.
	 * 
	 * @param path
	 * @param subsampling sampling step; 1 decodes every pixel
	 * @return a BGR image
	 * @throws IOException if the file does not exist or cannot be decoded
	 * @throws IllegalArgumentException if the subsampling is less than 1
	 */
	public static BufferedImage readSubsampled(Path path, int subsampling) throws IOException {
		if (subsampling < 1)
			throw new IllegalArgumentException("Subsampling must be >= 1, but was " + subsampling);
		checkExists(path);
		try (var stream = ImageIO.createImageInputStream(path.toFile())) {
			var reader = getReader(stream, path);
			try {
				reader.setInput(stream, true, true);
				var param = reader.getDefaultReadParam();
				if (subsampling > 1)
					param.setSourceSubsampling(subsampling, subsampling, 0, 0);
				var img = reader.read(0, param);
				logger.debug("Read {} ({}x{}, subsampling {})", path, img.getWidth(), img.getHeight(), subsampling);
				return toBGR(img);
			} finally {
				reader.dispose();
			}
		} catch (RuntimeException e) {
			// Some readers throw unchecked exceptions for corrupt files
			throw new IOException("Unable to decode " + path + ": " + e.getLocalizedMessage(), e);
		}
	}
	
	/**
	 * Read the dimensions of an image from its header, without decoding pixels.
	 * @param path
	 * @return
	 * @throws IOException if the file does not exist or no reader supports it
	 */
	public static ImageInfo readInfo(Path path) throws IOException {
		checkExists(path);
		try (var stream = ImageIO.createImageInputStream(path.toFile())) {
			var reader = getReader(stream, path);
			try {
				reader.setInput(stream, true, true);
				int width = reader.getWidth(0);
				int height = reader.getHeight(0);
				// Everything is decoded to 8-bit BGR
				return new ImageInfo(width, height, 3, 1, reader.getFormatName());
			} finally {
				reader.dispose();
			}
		}
	}
	
	private static void checkExists(Path path) throws FileNotFoundException {
		if (!Files.isRegularFile(path))
			throw new FileNotFoundException("Image not found: " + path);
	}
	
	private static ImageReader getReader(Object stream, Path path) throws IOException {
		if (stream == null)
			throw new IOException("Unable to open " + path);
		var readers = ImageIO.getImageReaders(stream);
		if (!readers.hasNext())
			throw new IOException("No ImageIO reader found for " + path);
		return readers.next();
	}
	
	/**
	 * Create an empty BGR image.
	 * @param width
	 * @param height
	 * @return
	 */
	public static BufferedImage createBGR(int width, int height) {
		return new BufferedImage(width, height, BufferedImage.TYPE_3BYTE_BGR);
	}
	
	/**
	 * Create an 8-bit grayscale image from row-major pixels.
	 * @param pixels unsigned byte values; these are copied
	 * @param width
	 * @param height
	 * @return
	 */
	public static BufferedImage createGray(byte[] pixels, int width, int height) {
		if (pixels.length != width * height)
			throw new IllegalArgumentException("Pixel array length " + pixels.length + " does not match " + width + "x" + height);
		var img = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
		img.getRaster().setDataElements(0, 0, width, height, pixels);
		return img;
	}
	
	/**
	 * Query whether an image can be accessed through {@link #getBGRPixels(BufferedImage)}.
	 * @param img
	 * @return
	 */
	public static boolean isPackedBGR(BufferedImage img) {
		if (img.getType() != BufferedImage.TYPE_3BYTE_BGR)
			return false;
		var raster = img.getRaster();
		if (raster.getSampleModelTranslateX() != 0 || raster.getSampleModelTranslateY() != 0)
			return false;
		var sampleModel = raster.getSampleModel();
		return sampleModel instanceof ComponentSampleModel && 
				((ComponentSampleModel)sampleModel).getScanlineStride() == img.getWidth() * 3;
	}
	
	/**
	 * Ensure an image is a packed BGR image.
	 * @param img
	 * @return the same image if it is already suitable, otherwise a converted copy
	 */
	public static BufferedImage toBGR(BufferedImage img) {
		if (isPackedBGR(img))
			return img;
		var imgBGR = createBGR(img.getWidth(), img.getHeight());
		Graphics2D g2d = imgBGR.createGraphics();
		g2d.drawImage(img, 0, 0, null);
		g2d.dispose();
		return imgBGR;
	}
	
	/**
	 * Get the interleaved pixel array of a packed BGR image.
	 * <p>
	 * For pixel (x, y) the blue, green and red values are at index {@code (y*width + x)*3} and the two following.
	 * Changes to the array are reflected in the image.
	 * 
	 * @param img
	 * @return
	 * @throws IllegalArgumentException if the image is not a packed BGR image
	 * @see #toBGR(BufferedImage)
	 */
	public static byte[] getBGRPixels(BufferedImage img) {
		if (!isPackedBGR(img))
			throw new IllegalArgumentException("Image is not a packed BGR image (type " + img.getType() + ")");
		return ((DataBufferByte)img.getRaster().getDataBuffer()).getData();
	}
	
	/**
	 * Create a copy of a BGR image.
	 * @param img
	 * @return
	 */
	public static BufferedImage duplicate(BufferedImage img) {
		var copy = createBGR(img.getWidth(), img.getHeight());
		if (isPackedBGR(img)) {
			var src = getBGRPixels(img);
			System.arraycopy(src, 0, getBGRPixels(copy), 0, src.length);
		} else {
			Graphics2D g2d = copy.createGraphics();
			g2d.drawImage(img, 0, 0, null);
			g2d.dispose();
		}
		return copy;
	}
	
	/**
	 * Resize an image using bilinear interpolation.
	 * @param img
	 * @param width target width
	 * @param height target height
	 * @return the resized image, or the input if it already has the target size
	 */
	public static BufferedImage resize(BufferedImage img, int width, int height) {
		if (width < 1 || height < 1)
			throw new IllegalArgumentException("Cannot resize to " + width + "x" + height);
		if (img.getWidth() == width && img.getHeight() == height)
			return img;
		var resized = createBGR(width, height);
		Graphics2D g2d = resized.createGraphics();
		g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
		g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
		g2d.drawImage(img, 0, 0, width, height, null);
		g2d.dispose();
		return resized;
	}
	
	/**
	 * Write an image, choosing the format from the file extension.
	 * <p>
	 * JPEG images are written with the specified quality; other formats ignore it.
	 * 
	 * @param img
	 * @param path
	 * @param quality JPEG quality, 0-100
	 * @throws IOException if the image cannot be written, or the format is not supported
	 */
	public static void write(BufferedImage img, Path path, int quality) throws IOException {
		String ext = GeneralTools.getExtension(path.getFileName().toString()).orElse(".png").substring(1);
		String format = ext.toLowerCase(Locale.ROOT);
		if (format.equals("jpg") || format.equals("jpeg")) {
			writeJpeg(img, path, quality);
			return;
		}
		if (!ImageIO.write(img, format, path.toFile()))
			throw new IOException("No ImageIO writer for format " + format);
	}
	
	private static void writeJpeg(BufferedImage img, Path path, int quality) throws IOException {
		var writers = ImageIO.getImageWritersByFormatName("jpeg");
		if (!writers.hasNext())
			throw new IOException("No JPEG writer available");
		ImageWriter writer = writers.next();
		var param = writer.getDefaultWriteParam();
		param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
		param.setCompressionQuality(GeneralTools.clipValue(quality, 0, 100) / 100f);
		// Image output streams do not truncate existing files
		Files.deleteIfExists(path);
		try (var stream = ImageIO.createImageOutputStream(path.toFile())) {
			writer.setOutput(stream);
			writer.write(null, new IIOImage(img, null, null), param);
		} finally {
			writer.dispose();
		}
	}

}
