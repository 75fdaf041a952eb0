/*
 * Copyright (c) 2024 Moataz Abdelnasser
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.mizosoft.imagine.internal.decoder;

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.imagine.DecodedImage;
import com.github.mizosoft.imagine.ImageDecoder;
import com.github.mizosoft.imagine.ImageFormat;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Optional;
import javax.imageio.ImageIO;

/** An {@link ImageDecoder} that reads & writes images with {@link ImageIO}. */
public final class ImageIODecoder implements ImageDecoder {
  private static final ImageIODecoder INSTANCE = new ImageIODecoder();

  private static final String FALLBACK_FORMAT_NAME = "png";

  private ImageIODecoder() {
    ImageIO.setUseCache(false);
  }

  @Override
  public DecodedImage decode(byte[] data) throws IOException {
    var image = ImageIO.read(new ByteArrayInputStream(data));
    if (image == null) {
      throw new IOException("no registered reader for " + ImageFormat.sniff(data) + " image");
    }
    return new BufferedDecodedImage(image);
  }

  @Override
  public Optional<DecodedImage> decodeIncrementally(byte[] dataSoFar, boolean finished) {
    try {
      return Optional.of(decode(dataSoFar));
    } catch (IOException | RuntimeException e) {
      // Readers usually fail on truncated input, which only means there's not enough data yet.
      return Optional.empty();
    }
  }

  @Override
  public long measureCost(byte[] data) throws IOException {
    try (var input = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
      if (input == null) {
        throw new IOException("couldn't open an image input stream");
      }
      var readers = ImageIO.getImageReaders(input);
      if (!readers.hasNext()) {
        throw new IOException("no registered reader for " + ImageFormat.sniff(data) + " image");
      }
      var reader = readers.next();
      try {
        reader.setInput(input, true, true);
        long width = reader.getWidth(0);
        long height = reader.getHeight(0);
        return width > 0 && height > 0 ? width * height : 0;
      } finally {
        reader.dispose();
      }
    }
  }

  @Override
  public byte[] encode(DecodedImage image, ImageFormat format) throws IOException {
    if (!(image instanceof BufferedDecodedImage)) {
      throw new IOException("unsupported image: " + image);
    }

    var bufferedImage = ((BufferedDecodedImage) image).image();
    var formatName = format.formatName();
    var output = new ByteArrayOutputStream();
    if (formatName.isEmpty() || !ImageIO.write(bufferedImage, formatName, output)) {
      output.reset();
      if (!ImageIO.write(bufferedImage, FALLBACK_FORMAT_NAME, output)) {
        throw new IOException("no registered writer for " + format);
      }
    }
    return output.toByteArray();
  }

  public static ImageIODecoder instance() {
    return INSTANCE;
  }

  /** A {@link DecodedImage} backed by a {@link BufferedImage}. */
  public static final class BufferedDecodedImage implements DecodedImage {
    private final BufferedImage image;

    public BufferedDecodedImage(BufferedImage image) {
      this.image = requireNonNull(image);
    }

    public BufferedImage image() {
      return image;
    }

    @Override
    public int width() {
      return image.getWidth();
    }

    @Override
    public int height() {
      return image.getHeight();
    }

    @Override
    public String toString() {
      return "BufferedDecodedImage{" + width() + "x" + height() + "}";
    }
  }
}
