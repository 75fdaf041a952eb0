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

package com.github.mizosoft.imagine;

import com.github.mizosoft.imagine.internal.decoder.ImageIODecoder;
import java.io.IOException;
import java.util.Optional;

/**
 * Decodes image bytes into {@link DecodedImage images} & encodes them back. Implementations must be
 * safe for concurrent use.
 */
public interface ImageDecoder {

  /**
   * Decodes the given bytes.
   *
   * @throws IOException if the bytes can't be decoded
   */
  DecodedImage decode(byte[] data) throws IOException;

  /**
   * Attempts to decode an image from a prefix of its bytes while they're still being received.
   * Returns an empty optional if nothing can be decoded yet. The default implementation never
   * decodes partial data.
   */
  default Optional<DecodedImage> decodeIncrementally(byte[] dataSoFar, boolean finished) {
    return Optional.empty();
  }

  /**
   * Returns the {@link DecodedImage#cost() cost} of the image the given bytes decode to. The
   * default implementation decodes the whole image; implementations should read no further than the
   * image's header where they can.
   *
   * @throws IOException if the bytes aren't a recognized image
   */
  default long measureCost(byte[] data) throws IOException {
    return decode(data).cost();
  }

  /**
   * Encodes the given image in the given format.
   *
   * @throws IOException if the image can't be encoded, e.g. if it wasn't created by this decoder
   */
  byte[] encode(DecodedImage image, ImageFormat format) throws IOException;

  /** Returns a decoder that's backed by {@code javax.imageio}. */
  static ImageDecoder imageIO() {
    return ImageIODecoder.instance();
  }
}
