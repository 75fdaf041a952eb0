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

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.util.OptionalInt;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Signals that an image couldn't be loaded. The {@link Kind} tells why. */
public final class ImageLoadException extends IOException {
  private static final long serialVersionUID = 5267437563027961532L;

  private static final int NO_STATUS_CODE = -1;

  /** The reason an image couldn't be loaded. */
  public enum Kind {
    /** The server responded with an error status, or the connection failed. */
    TRANSPORT_FAILURE,

    /** The received bytes couldn't be decoded, or decoded to an image with zero extent. */
    DECODE_FAILURE,

    /** The load was canceled before it completed. */
    CANCELED,

    /**
     * The image's key failed to load before and failed keys aren't being retried. See {@link
     * LoadOption#RETRY_FAILED}.
     */
    BLACKLISTED
  }

  private final Kind kind;
  private final int statusCode;

  private ImageLoadException(
      Kind kind, String message, int statusCode, @Nullable Throwable cause) {
    super(message, cause);
    this.kind = requireNonNull(kind);
    this.statusCode = statusCode;
  }

  public Kind kind() {
    return kind;
  }

  /** Returns the HTTP status code that caused this failure, if any. */
  public OptionalInt statusCode() {
    return statusCode != NO_STATUS_CODE ? OptionalInt.of(statusCode) : OptionalInt.empty();
  }

  public static ImageLoadException badStatus(int statusCode) {
    return new ImageLoadException(
        Kind.TRANSPORT_FAILURE, "unexpected status code: " + statusCode, statusCode, null);
  }

  public static ImageLoadException transportFailure(Throwable cause) {
    return new ImageLoadException(
        Kind.TRANSPORT_FAILURE, String.valueOf(cause.getMessage()), NO_STATUS_CODE, cause);
  }

  public static ImageLoadException decodeFailure(String message, @Nullable Throwable cause) {
    return new ImageLoadException(Kind.DECODE_FAILURE, message, NO_STATUS_CODE, cause);
  }

  public static ImageLoadException canceled() {
    return new ImageLoadException(Kind.CANCELED, "canceled", NO_STATUS_CODE, null);
  }

  public static ImageLoadException blacklisted(String key) {
    return new ImageLoadException(
        Kind.BLACKLISTED, "previous load failed for <" + key + ">", NO_STATUS_CODE, null);
  }
}
