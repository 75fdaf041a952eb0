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
 * A listener to the progress & outcome of {@link ImageLoader#resolve(java.net.URI, java.util.Set,
 * LoadListener) resolving} an image. Methods are called on the loader's callback executor.
 *
 * <p>{@code onResult} may be called more than once: with partial images of a {@link
 * LoadOption#PROGRESSIVE progressive} download, and with the cached image before the revalidated
 * one when {@link LoadOption#REFRESH_CACHED} is set. A load ends with either a result that's
 * delivered through the handle's future, or an error.
 */
public interface LoadListener {
  default void onProgress(long receivedBytes, long expectedBytes) {}

  default void onResult(LoadResult result) {}

  default void onError(ImageLoadException exception) {}

  /** Returns a listener that ignores all events. */
  static LoadListener noop() {
    return new LoadListener() {};
  }
}
