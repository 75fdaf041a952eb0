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

/** Image formats recognizable from their leading bytes. */
public enum ImageFormat {
  JPEG("jpeg"),
  PNG("png"),
  GIF("gif"),
  TIFF("tiff"),
  WEBP("webp"),
  UNDEFINED("");

  private final String formatName;

  ImageFormat(String formatName) {
    this.formatName = formatName;
  }

  /** Returns the format's informal name (e.g. {@code "png"}), or an empty string if undefined. */
  public String formatName() {
    return formatName;
  }

  /** Sniffs the format of the given image bytes from their magic number. */
  public static ImageFormat sniff(byte[] data) {
    if (data.length == 0) {
      return UNDEFINED;
    }
    switch (data[0] & 0xff) {
      case 0xff:
        return JPEG;
      case 0x89:
        return PNG;
      case 0x47:
        return GIF;
      case 0x49:
      case 0x4d:
        return TIFF;
      case 0x52:
        // RIFF....WEBP
        if (data.length >= 12
            && data[8] == 'W'
            && data[9] == 'E'
            && data[10] == 'B'
            && data[11] == 'P') {
          return WEBP;
        }
        return UNDEFINED;
      default:
        return UNDEFINED;
    }
  }
}
