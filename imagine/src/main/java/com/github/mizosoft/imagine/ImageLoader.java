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
import static java.util.Objects.requireNonNullElse;

import com.github.mizosoft.imagine.internal.Utils;
import com.github.mizosoft.imagine.internal.concurrent.SerialExecutor;
import com.github.mizosoft.imagine.internal.concurrent.SharedExecutors;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Predicate;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Resolves images from an {@link ImageCache}, fetching them with an {@link ImageDownloader} when
 * they're not cached. Fetched images are optionally transformed, then cached for later loads.
 *
 * <pre>{@code
 * var loader = ImageLoader.newBuilder().build();
 * loader.resolve(URI.create("https://example.com/cat.png"))
 *     .result()
 *     .thenAccept(result -> display(result.image().orElseThrow()));
 * }</pre>
 *
 * <p>Keys whose fetch failed are remembered, and later loads of them fail right away with a {@link
 * ImageLoadException.Kind#BLACKLISTED} error unless {@link LoadOption#RETRY_FAILED} is passed.
 */
public final class ImageLoader {
  private static final Logger logger = System.getLogger(ImageLoader.class.getName());

  private final ImageCache cache;
  private final ImageDownloader downloader;
  private final ImageDecoder decoder;
  private final Executor callbackExecutor;
  private final Function<URI, String> keyFilter;
  private final Predicate<URI> shouldFetch;
  private final @Nullable ImageTransformer transformer;
  private final boolean blacklistFailures;

  private final Set<String> blacklist = ConcurrentHashMap.newKeySet();
  private final Set<LoadHandle> runningHandles = ConcurrentHashMap.newKeySet();

  private ImageLoader(Builder builder) {
    decoder = builder.decoder();
    cache = builder.cache(decoder);
    downloader = builder.downloader(decoder);
    callbackExecutor = builder.callbackExecutor();
    keyFilter = builder.keyFilter();
    shouldFetch = builder.shouldFetch();
    transformer = builder.transformer;
    blacklistFailures = builder.blacklistFailures;
  }

  public ImageCache cache() {
    return cache;
  }

  public ImageDownloader downloader() {
    return downloader;
  }

  /** Returns the cache key the given URI is stored under. */
  public String cacheKeyFor(URI uri) {
    return requireNonNull(keyFilter.apply(requireNonNull(uri)), "keyFilter returned null");
  }

  public LoadHandle resolve(URI uri) {
    return resolve(uri, Set.of(), LoadListener.noop());
  }

  public LoadHandle resolve(URI uri, Set<LoadOption> options) {
    return resolve(uri, options, LoadListener.noop());
  }

  /**
   * Resolves the image at the given URI, from cache if possible, reporting progress & results to
   * the given listener.
   */
  public LoadHandle resolve(URI uri, Set<LoadOption> options, LoadListener listener) {
    requireNonNull(uri);
    requireNonNull(listener);
    var optionsCopy =
        options.isEmpty()
            ? Collections.<LoadOption>emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(options));
    var key = cacheKeyFor(uri);
    var handle = new LoadHandle(this, key, uri, optionsCopy, listener);
    if (handle.hasOption(LoadOption.RETRY_FAILED)) {
      blacklist.remove(key);
    } else if (blacklistFailures && blacklist.contains(key)) {
      logger.log(Level.DEBUG, () -> "Not loading blacklisted <" + key + ">");
      fail(handle, ImageLoadException.blacklisted(key));
      return handle;
    }

    runningHandles.add(handle);
    var query = cache.query(key);
    if (!handle.setQuery(query)) {
      query.cancel();
      return handle;
    }
    query
        .result()
        .whenComplete(
            (entry, error) -> {
              if (error == null) {
                onQueryCompletion(handle, entry);
              } else if (!(Utils.getDeepCompletionCause(error) instanceof CancellationException)) {
                logger.log(Level.WARNING, "Cache query failed for <" + key + ">", error);
                onQueryCompletion(handle, Optional.empty());
              }
            });
    return handle;
  }

  /** Cancels the given load. Returns {@code false} if it already completed or was canceled. */
  @CanIgnoreReturnValue
  public boolean cancel(LoadHandle handle) {
    var attachments = handle.markCanceled();
    if (attachments == null) {
      return false;
    }
    runningHandles.remove(handle);
    if (attachments.query != null) {
      attachments.query.cancel();
    }
    if (attachments.token != null) {
      downloader.cancel(attachments.token);
    }
    var exception = ImageLoadException.canceled();
    deliverError(handle, exception);
    return true;
  }

  /** Cancels all loads that haven't completed. */
  public void cancelAll() {
    for (var handle : new ArrayList<>(runningHandles)) {
      cancel(handle);
    }
  }

  /** Returns {@code true} if there are loads that haven't completed. */
  public boolean isBusy() {
    return !runningHandles.isEmpty();
  }

  private void onQueryCompletion(LoadHandle handle, Optional<CacheEntry> cachedEntry) {
    if (handle.isDone()) {
      return;
    }

    if (cachedEntry.isPresent()) {
      var cachedResult = LoadResult.cached(cachedEntry.get(), decodeQuietly(cachedEntry.get()));
      if (!handle.hasOption(LoadOption.REFRESH_CACHED)) {
        complete(handle, cachedResult, true);
        return;
      }
      handle.setCachedResult(cachedResult);
      deliverIntermediate(handle, cachedResult);
    }

    if (!shouldFetch.test(handle.uri())) {
      var cachedResult = handle.cachedResult();
      if (cachedResult != null) {
        complete(handle, cachedResult, false);
      } else {
        logger.log(Level.DEBUG, () -> "Declined fetching <" + handle.uri() + ">");
        complete(handle, LoadResult.declined(handle.key()), true);
      }
      return;
    }

    var request =
        DownloadRequest.newBuilder(handle.uri())
            .key(handle.key())
            .options(toDownloadOptions(handle.options()))
            .build();
    var token = downloader.fetch(request, new HandleDownloadListener(handle));
    if (!handle.setToken(token)) {
      downloader.cancel(token);
    }
  }

  private @Nullable DecodedImage decodeQuietly(CacheEntry entry) {
    try {
      return decoder.decode(entry.blob());
    } catch (IOException | RuntimeException e) {
      logger.log(Level.DEBUG, () -> "Couldn't decode cached <" + entry.key() + ">", e);
      return null;
    }
  }

  private void onDownloadResult(LoadHandle handle, DownloadResult result) {
    if (handle.isDone()) {
      return;
    }

    if (result.notModified()) {
      var cachedResult = handle.cachedResult();
      if (cachedResult != null) {
        complete(handle, cachedResult, false);
      } else {
        onDownloadFailure(handle, ImageLoadException.badStatus(304));
      }
      return;
    }

    if (!result.finished()) {
      deliverIntermediate(
          handle, LoadResult.partial(handle.key(), result.data(), result.image().orElse(null)));
      return;
    }

    byte[] data = result.data();
    var image = result.image().orElse(null);
    var transformer = this.transformer;
    if (transformer != null && image != null) {
      try {
        var transformedImage = transformer.transform(image, handle.uri());
        if (transformedImage != image) {
          var format = ImageFormat.sniff(data);
          data =
              decoder.encode(
                  transformedImage, format != ImageFormat.UNDEFINED ? format : ImageFormat.PNG);
          image = transformedImage;
        }
      } catch (IOException | RuntimeException e) {
        onDownloadFailure(
            handle,
            ImageLoadException.decodeFailure("couldn't transform <" + handle.key() + ">", e));
        return;
      }
    }

    long cost = image != null ? image.cost() : data.length;
    cache.store(handle.key(), data, cost, !handle.hasOption(LoadOption.CACHE_MEMORY_ONLY));
    complete(handle, LoadResult.fetched(handle.key(), data, image), true);
  }

  private void onDownloadFailure(LoadHandle handle, ImageLoadException exception) {
    if (handle.isDone()) {
      return;
    }
    if (blacklistFailures && isPermanent(exception)) {
      logger.log(Level.DEBUG, () -> "Blacklisting <" + handle.key() + ">");
      blacklist.add(handle.key());
    }
    fail(handle, exception);
  }

  /** Returns whether the failure is likely to happen again if retried. */
  private static boolean isPermanent(ImageLoadException exception) {
    switch (exception.kind()) {
      case DECODE_FAILURE:
        return true;
      case TRANSPORT_FAILURE:
        var cause = exception.getCause();
        return !(cause instanceof HttpTimeoutException
            || cause instanceof ConnectException
            || cause instanceof UnknownHostException);
      default:
        return false;
    }
  }

  private static Set<DownloadOption> toDownloadOptions(Set<LoadOption> options) {
    var downloadOptions = EnumSet.noneOf(DownloadOption.class);
    for (var option : options) {
      switch (option) {
        case LOW_PRIORITY:
          downloadOptions.add(DownloadOption.LOW_PRIORITY);
          break;
        case HIGH_PRIORITY:
          downloadOptions.add(DownloadOption.HIGH_PRIORITY);
          break;
        case PROGRESSIVE:
          downloadOptions.add(DownloadOption.PROGRESSIVE);
          break;
        case REFRESH_CACHED:
          downloadOptions.add(DownloadOption.IGNORE_CACHED_RESPONSE);
          break;
        case CONTINUE_IN_BACKGROUND:
          downloadOptions.add(DownloadOption.CONTINUE_IN_BACKGROUND);
          break;
        case HANDLE_COOKIES:
          downloadOptions.add(DownloadOption.HANDLE_COOKIES);
          break;
        case ALLOW_INVALID_CERTIFICATES:
          downloadOptions.add(DownloadOption.ALLOW_INVALID_CERTIFICATES);
          break;
        default:
          break;
      }
    }
    return downloadOptions;
  }

  private void complete(LoadHandle handle, LoadResult result, boolean notifyListener) {
    if (!handle.markDone()) {
      return;
    }
    runningHandles.remove(handle);
    var listener = handle.listener();
    deliver(
        () -> {
          if (notifyListener) {
            Utils.runSafely(() -> listener.onResult(result), logger, () -> listener + "::onResult");
          }
          handle.result().complete(result);
        });
  }

  private void fail(LoadHandle handle, ImageLoadException exception) {
    if (!handle.markDone()) {
      return;
    }
    runningHandles.remove(handle);
    deliverError(handle, exception);
  }

  private void deliverError(LoadHandle handle, ImageLoadException exception) {
    var listener = handle.listener();
    deliver(
        () -> {
          Utils.runSafely(() -> listener.onError(exception), logger, () -> listener + "::onError");
          handle.result().completeExceptionally(exception);
        });
  }

  private void deliverIntermediate(LoadHandle handle, LoadResult result) {
    var listener = handle.listener();
    deliver(
        () -> {
          if (!handle.isCanceled()) {
            Utils.runSafely(() -> listener.onResult(result), logger, () -> listener + "::onResult");
          }
        });
  }

  private void deliverProgress(LoadHandle handle, long receivedBytes, long expectedBytes) {
    var listener = handle.listener();
    deliver(
        () -> {
          if (!handle.isDone()) {
            Utils.runSafely(
                () -> listener.onProgress(receivedBytes, expectedBytes),
                logger,
                () -> listener + "::onProgress");
          }
        });
  }

  private void deliver(Runnable delivery) {
    callbackExecutor.execute(delivery);
  }

  @Override
  public String toString() {
    return "ImageLoader{cache=" + cache + ", downloader=" + downloader + "}";
  }

  /** Returns a lazily created loader with default settings. */
  public static ImageLoader shared() {
    return SharedLoaderHolder.INSTANCE;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  private static final class SharedLoaderHolder {
    static final ImageLoader INSTANCE = newBuilder().build();
  }

  private final class HandleDownloadListener implements DownloadListener {
    private final LoadHandle handle;

    HandleDownloadListener(LoadHandle handle) {
      this.handle = handle;
    }

    @Override
    public void onProgress(long receivedBytes, long expectedBytes) {
      deliverProgress(handle, receivedBytes, expectedBytes);
    }

    @Override
    public void onResult(DownloadResult result) {
      onDownloadResult(handle, result);
    }

    @Override
    public void onError(ImageLoadException exception) {
      onDownloadFailure(handle, exception);
    }
  }

  public static final class Builder {
    private @MonotonicNonNull ImageCache cache;
    private @MonotonicNonNull ImageDownloader downloader;
    private @MonotonicNonNull ImageDecoder decoder;
    private @MonotonicNonNull Executor callbackExecutor;
    private @MonotonicNonNull Function<URI, String> keyFilter;
    private @MonotonicNonNull Predicate<URI> shouldFetch;
    private @Nullable ImageTransformer transformer;
    private @Nullable Lifecycle lifecycle;
    private boolean blacklistFailures = true;

    Builder() {}

    @CanIgnoreReturnValue
    public Builder cache(ImageCache cache) {
      this.cache = requireNonNull(cache);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder downloader(ImageDownloader downloader) {
      this.downloader = requireNonNull(downloader);
      return this;
    }

    /**
     * Sets the decoder used to decode cached images & to encode transformed ones. It's also used to
     * weigh images & decode downloads when the cache or the downloader aren't set explicitly.
     */
    @CanIgnoreReturnValue
    public Builder decoder(ImageDecoder decoder) {
      this.decoder = requireNonNull(decoder);
      return this;
    }

    /** Sets the executor listeners are called on & handle futures are completed on. */
    @CanIgnoreReturnValue
    public Builder callbackExecutor(Executor callbackExecutor) {
      this.callbackExecutor = requireNonNull(callbackExecutor);
      return this;
    }

    /** Sets the function computing the cache key of a URI. The default is the URI's string. */
    @CanIgnoreReturnValue
    public Builder keyFilter(Function<URI, String> keyFilter) {
      this.keyFilter = requireNonNull(keyFilter);
      return this;
    }

    /** Sets a predicate that decides whether an uncached image is fetched. */
    @CanIgnoreReturnValue
    public Builder shouldFetch(Predicate<URI> shouldFetch) {
      this.shouldFetch = requireNonNull(shouldFetch);
      return this;
    }

    /** Sets a transformer that's applied to fetched images before they're cached. */
    @CanIgnoreReturnValue
    public Builder transformer(ImageTransformer transformer) {
      this.transformer = requireNonNull(transformer);
      return this;
    }

    /** Sets whether keys that fail to load are remembered & not fetched again. Defaults to true. */
    @CanIgnoreReturnValue
    public Builder blacklistFailures(boolean on) {
      this.blacklistFailures = on;
      return this;
    }

    /** Sets the lifecycle that default caches & downloaders subscribe to. */
    @CanIgnoreReturnValue
    public Builder lifecycle(Lifecycle lifecycle) {
      this.lifecycle = requireNonNull(lifecycle);
      return this;
    }

    public ImageLoader build() {
      return new ImageLoader(this);
    }

    ImageDecoder decoder() {
      return requireNonNullElse(decoder, ImageDecoder.imageIO());
    }

    ImageCache cache(ImageDecoder decoder) {
      var cache = this.cache;
      if (cache != null) {
        return cache;
      }
      var builder = ImageCache.newBuilder().weigher(decodingWeigher(decoder));
      var lifecycle = this.lifecycle;
      if (lifecycle != null) {
        builder.lifecycle(lifecycle);
      }
      return builder.build();
    }

    ImageDownloader downloader(ImageDecoder decoder) {
      var downloader = this.downloader;
      if (downloader != null) {
        return downloader;
      }
      var builder = ImageDownloader.newBuilder().decoder(decoder);
      var lifecycle = this.lifecycle;
      if (lifecycle != null) {
        builder.lifecycle(lifecycle);
      }
      return builder.build();
    }

    Executor callbackExecutor() {
      var callbackExecutor = this.callbackExecutor;
      return callbackExecutor != null
          ? callbackExecutor
          : new SerialExecutor(SharedExecutors.workerExecutor());
    }

    Function<URI, String> keyFilter() {
      return requireNonNullElse(keyFilter, URI::toString);
    }

    Predicate<URI> shouldFetch() {
      return requireNonNullElse(shouldFetch, uri -> true);
    }

    /** Returns a weigher that measures images with the given decoder. */
    static ImageCache.Weigher decodingWeigher(ImageDecoder decoder) {
      return (key, blob) -> {
        try {
          return decoder.measureCost(blob);
        } catch (IOException | RuntimeException e) {
          return blob.length;
        }
      };
    }
  }
}
