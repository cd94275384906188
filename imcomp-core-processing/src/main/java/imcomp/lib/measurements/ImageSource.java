/*-
 * #%L
 * This file is part of ImageComplexity.
 * %%
 * Copyright (C) 2024 ImageComplexity developers
 * %%
 * ImageComplexity is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * ImageComplexity is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with ImageComplexity.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package imcomp.lib.measurements;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

import javax.imageio.ImageIO;

import imcomp.lib.common.GeneralTools;
import imcomp.lib.images.ImageBuffer;
import imcomp.lib.images.ImageBuffers;

/**
 * An identified image that is decoded on demand.
 * <p>
 * Decoding happens on a worker thread during batch processing, so a failure affects only this image.
 */
public interface ImageSource {

	/**
	 * Identifier used for the first column of the output.
	 * @return
	 */
	String getId();

	/**
	 * Decode the image.
	 * @return
	 * @throws IOException if the image cannot be read
	 */
	ImageBuffer read() throws IOException;

	/**
	 * Create a source for an image that has already been decoded.
	 * @param id
	 * @param image
	 * @return
	 */
	static ImageSource create(String id, ImageBuffer image) {
		Objects.requireNonNull(image);
		return create(id, () -> image);
	}

	/**
	 * Create a source from an identifier and decoding function.
	 * @param id
	 * @param reader
	 * @return
	 */
	static ImageSource create(String id, ImageReader reader) {
		Objects.requireNonNull(id);
		Objects.requireNonNull(reader);
		return new ImageSource() {

			@Override
			public String getId() {
				return id;
			}

			@Override
			public ImageBuffer read() throws IOException {
				return reader.read();
			}

			@Override
			public String toString() {
				return "ImageSource [" + id + "]";
			}

		};
	}

	/**
	 * Create a source that reads a file with {@link ImageIO}.
	 * The identifier is the file name without extension.
	 * @param path
	 * @return
	 */
	static ImageSource fromPath(Path path) {
		String id = GeneralTools.getNameWithoutExtension(path.getFileName().toString());
		return create(id, () -> {
			BufferedImage img = ImageIO.read(path.toFile());
			if (img == null)
				throw new IOException("No image reader found for " + path);
			return ImageBuffers.fromBufferedImage(img);
		});
	}

	/**
	 * Function that decodes an image.
	 */
	@FunctionalInterface
	interface ImageReader {

		/**
		 * Decode the image.
		 * @return
		 * @throws IOException
		 */
		ImageBuffer read() throws IOException;

	}

}
