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

/**
 * An image decoded by an {@link ImageDecoder}. The core never inspects pixels; it only needs an
 * image's extent to reject empty images & to approximate its in-memory footprint.
 */
public interface DecodedImage {

  /** Returns the image's width in points. */
  int width();

  /** Returns the image's height in points. */
  int height();

  /** Returns the number of pixels per point along each dimension. */
  default double scale() {
    return 1.0;
  }

  /** Returns {@code true} if the image has no pixels. */
  default boolean isEmpty() {
    return width() <= 0 || height() <= 0;
  }

  /** Returns the approximate memory cost of the image, that is its pixel count. */
  default long cost() {
    if (isEmpty()) {
      return 0;
    }
    double scale = scale();
    return (long) ((double) width() * height() * scale * scale);
  }
}
