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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.net.URI;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A handle to an ongoing {@link ImageLoader#resolve(URI, Set, LoadListener) load}. The handle's
 * {@link #result() future} completes with the load's final result, or exceptionally with an {@link
 * ImageLoadException}.
 */
public final class LoadHandle {
  private final ImageLoader loader;
  private final String key;
  private final URI uri;
  private final Set<LoadOption> options;
  private final LoadListener listener;
  private final CompletableFuture<LoadResult> result = new CompletableFuture<>();

  @GuardedBy("this")
  private boolean done;

  @GuardedBy("this")
  private boolean canceled;

  @GuardedBy("this")
  private ImageCache.@Nullable Query query;

  @GuardedBy("this")
  private @Nullable DownloadToken token;

  @GuardedBy("this")
  private @Nullable LoadResult cachedResult;

  LoadHandle(
      ImageLoader loader, String key, URI uri, Set<LoadOption> options, LoadListener listener) {
    this.loader = requireNonNull(loader);
    this.key = requireNonNull(key);
    this.uri = requireNonNull(uri);
    this.options = requireNonNull(options);
    this.listener = requireNonNull(listener);
  }

  public String key() {
    return key;
  }

  public URI uri() {
    return uri;
  }

  public CompletableFuture<LoadResult> result() {
    return result;
  }

  /** Cancels the load. Returns {@code false} if it already completed or was canceled. */
  @CanIgnoreReturnValue
  public boolean cancel() {
    return loader.cancel(this);
  }

  public synchronized boolean isCanceled() {
    return canceled;
  }

  public synchronized boolean isDone() {
    return done;
  }

  @Override
  public String toString() {
    return "LoadHandle{key=" + key + ", uri=" + uri + ", done=" + isDone() + "}";
  }

  Set<LoadOption> options() {
    return options;
  }

  boolean hasOption(LoadOption option) {
    return options.contains(option);
  }

  LoadListener listener() {
    return listener;
  }

  /** Attaches the cache query. Returns false if the handle is already done. */
  synchronized boolean setQuery(ImageCache.Query query) {
    if (done) {
      return false;
    }
    this.query = query;
    return true;
  }

  /** Attaches the download's token. Returns false if the handle is already done. */
  synchronized boolean setToken(DownloadToken token) {
    if (done) {
      return false;
    }
    this.token = token;
    return true;
  }

  synchronized void setCachedResult(LoadResult cachedResult) {
    this.cachedResult = cachedResult;
  }

  synchronized @Nullable LoadResult cachedResult() {
    return cachedResult;
  }

  /** Marks the handle as done, returning {@code false} if it already was. */
  synchronized boolean markDone() {
    if (done) {
      return false;
    }
    done = true;
    return true;
  }

  /** Marks the handle as canceled if it isn't done, returning the pieces to cancel. */
  synchronized @Nullable Attachments markCanceled() {
    if (done) {
      return null;
    }
    done = true;
    canceled = true;
    return new Attachments(query, token);
  }

  /** The cancelable pieces a handle is attached to. */
  static final class Attachments {
    final ImageCache.@Nullable Query query;
    final @Nullable DownloadToken token;

    Attachments(ImageCache.@Nullable Query query, @Nullable DownloadToken token) {
      this.query = query;
      this.token = token;
    }
  }
}
