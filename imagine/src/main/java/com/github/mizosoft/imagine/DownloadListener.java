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
 * A listener to a download's events. Each listener receives exactly one terminal event: either a
 * {@link DownloadResult#finished() finished} result or an error. Progressive downloads may deliver
 * unfinished results before that.
 */
public interface DownloadListener {

  /**
   * Called as bytes are received. {@code expectedBytes} is negative if the response doesn't
   * announce its length.
   */
  default void onProgress(long receivedBytes, long expectedBytes) {}

  /** Called with a partial result of a progressive download, or with the final result. */
  void onResult(DownloadResult result);

  /** Called if the download fails or is canceled. */
  void onError(ImageLoadException exception);
}
