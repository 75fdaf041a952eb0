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

/** Options that control how an {@link ImageDownloader} carries out a download. */
public enum DownloadOption {
  /** Queue the download behind downloads of normal priority. */
  LOW_PRIORITY,

  /** Queue the download ahead of downloads of normal priority. */
  HIGH_PRIORITY,

  /** Deliver partially decoded images while the download progresses. */
  PROGRESSIVE,

  /**
   * Ask for the image to be revalidated with the origin server. A "not modified" response completes
   * the download with an empty {@link DownloadResult#notModified()} result.
   */
  IGNORE_CACHED_RESPONSE,

  /** Keep downloading when the process is suspended, till the background time budget expires. */
  CONTINUE_IN_BACKGROUND,

  /** Send & store cookies. */
  HANDLE_COOKIES,

  /** Accept the server's certificate without validating it. Meant for testing. */
  ALLOW_INVALID_CERTIFICATES
}
