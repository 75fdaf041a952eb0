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

import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/** The outcome of a download. */
public final class DownloadResult {
  private static final byte[] EMPTY = new byte[0];
  private static final DownloadResult NOT_MODIFIED = new DownloadResult(EMPTY, null, true, true);

  private final byte[] data;
  private final @Nullable DecodedImage image;
  private final boolean finished;
  private final boolean notModified;

  private DownloadResult(
      byte[] data, @Nullable DecodedImage image, boolean finished, boolean notModified) {
    this.data = requireNonNull(data);
    this.image = image;
    this.finished = finished;
    this.notModified = notModified;
  }

  /**
   * Returns a copy of the received bytes, which are empty for a {@link #notModified()} result. A
   * result is shared by all listeners of a coalesced download.
   */
  public byte[] data() {
    return data.clone();
  }

  /** Returns the decoded image if the downloader has a decoder. */
  public Optional<DecodedImage> image() {
    return Optional.ofNullable(image);
  }

  /** Returns {@code false} if this is a partial result of a progressive download. */
  public boolean finished() {
    return finished;
  }

  /** Returns {@code true} if the server reported the image to be unchanged. */
  public boolean notModified() {
    return notModified;
  }

  @Override
  public String toString() {
    return "DownloadResult{size="
        + data.length
        + ", image="
        + image
        + ", finished="
        + finished
        + ", notModified="
        + notModified
        + "}";
  }

  static DownloadResult of(byte[] data, @Nullable DecodedImage image) {
    return new DownloadResult(data, image, true, false);
  }

  static DownloadResult partial(byte[] data, DecodedImage image) {
    return new DownloadResult(data, requireNonNull(image), false, false);
  }

  static DownloadResult notModifiedResult() {
    return NOT_MODIFIED;
  }
}
