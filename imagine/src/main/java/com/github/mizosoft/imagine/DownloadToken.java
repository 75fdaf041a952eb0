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

import java.net.URI;

/**
 * Identifies a single subscription to a download. Passing the token to {@link
 * ImageDownloader#cancel(DownloadToken)} unsubscribes exactly that subscription; the transfer is
 * only aborted when its last subscription is canceled.
 */
public final class DownloadToken {
  private final String key;
  private final URI uri;

  DownloadToken(String key, URI uri) {
    this.key = requireNonNull(key);
    this.uri = requireNonNull(uri);
  }

  public String key() {
    return key;
  }

  public URI uri() {
    return uri;
  }

  @Override
  public String toString() {
    return "DownloadToken@" + Integer.toHexString(hashCode()) + "{key=" + key + "}";
  }
}
