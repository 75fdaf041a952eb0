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

import static com.github.mizosoft.imagine.internal.Utils.requirePositiveDuration;
import static com.github.mizosoft.imagine.internal.Validate.requirePositive;
import static java.util.Objects.requireNonNull;
import static java.util.Objects.requireNonNullElse;

import com.github.mizosoft.imagine.internal.Utils;
import com.github.mizosoft.imagine.internal.concurrent.SharedExecutors;
import com.github.mizosoft.imagine.internal.download.DownloadQueue;
import com.github.mizosoft.imagine.internal.download.InFlightFetch;
import com.github.mizosoft.imagine.internal.download.InFlightFetch.Subscriber;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.PasswordAuthentication;
import java.net.URI;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Downloads images, making sure at most one transfer is in progress for each key. A {@link
 * #fetch(DownloadRequest, DownloadListener) fetch} for a key that's already being downloaded joins
 * the ongoing transfer instead of starting a new one. Each fetch returns a {@link DownloadToken}
 * that cancels only that fetch's subscription; the transfer itself is aborted when its last
 * subscriber cancels.
 *
 * <p>At most {@link #maxConcurrentDownloads()} transfers run at a time. Others wait in a queue
 * ordered by priority, then by the downloader's {@link ExecutionOrder}.
 *
 * <p>Listeners are called on the thread that observed the event. That is usually a thread of the
 * transport, or the canceling thread for cancellation errors. Listeners must not block.
 */
public final class ImageDownloader implements AutoCloseable {
  private static final Logger logger = System.getLogger(ImageDownloader.class.getName());

  private static final String MAX_CONCURRENT_DOWNLOADS_PROP =
      "com.github.mizosoft.imagine.ImageDownloader.maxConcurrentDownloads";
  private static final String TIMEOUT_MILLIS_PROP =
      "com.github.mizosoft.imagine.ImageDownloader.timeoutMillis";

  static final int DEFAULT_MAX_CONCURRENT_DOWNLOADS =
      (int) Utils.getLongProperty(MAX_CONCURRENT_DOWNLOADS_PROP, 6, 1);
  static final Duration DEFAULT_TIMEOUT =
      Duration.ofMillis(Utils.getLongProperty(TIMEOUT_MILLIS_PROP, 15_000, 1));
  static final String DEFAULT_ACCEPT = "image/webp,image/*;q=0.8";

  private final Transport transport;
  private final @Nullable ImageDecoder decoder;
  private final DownloadQueue queue;
  private final Duration timeout;
  private final BiFunction<URI, Map<String, String>, Map<String, String>> headersFilter;
  private final @Nullable PasswordAuthentication credentials;
  private final Lifecycle.@Nullable Subscription lifecycleSubscription;

  private final ReentrantLock lock = new ReentrantLock();

  @GuardedBy("lock")
  private final Map<String, InFlightFetch> fetches = new HashMap<>();

  @GuardedBy("lock")
  private final Map<String, String> headers = new LinkedHashMap<>();

  @GuardedBy("lock")
  private boolean inBackground;

  private ImageDownloader(Builder builder) {
    transport = builder.transport();
    decoder = builder.decodeImages ? builder.decoder() : null;
    queue =
        new DownloadQueue(
            builder.executor(), builder.maxConcurrentDownloads(), builder.executionOrder());
    timeout = builder.timeout();
    headersFilter = builder.headersFilter();
    credentials = builder.credentials;
    headers.put("Accept", DEFAULT_ACCEPT);
    headers.putAll(builder.headers);
    var lifecycle = builder.lifecycle;
    lifecycleSubscription = lifecycle != null ? lifecycle.subscribe(new BackgroundPolicy()) : null;
  }

  /**
   * Downloads the image described by the given request, reporting progress & outcome to the given
   * listener. Returns a token that cancels this fetch.
   */
  public DownloadToken fetch(DownloadRequest request, DownloadListener listener) {
    requireNonNull(request);
    requireNonNull(listener);
    var token = new DownloadToken(request.key(), request.uri());
    var subscriber =
        new Subscriber(
            token,
            listener,
            request.hasOption(DownloadOption.PROGRESSIVE),
            request.hasOption(DownloadOption.CONTINUE_IN_BACKGROUND));
    var transportRequest = toTransportRequest(request);
    InFlightFetch newFetch = null;
    lock.lock();
    try {
      var fetch = fetches.get(request.key());
      if (fetch == null) {
        var createdFetch = new InFlightFetch(request.key(), transportRequest);
        createdFetch.setTicket(
            queue.newTicket(
                () -> start(createdFetch),
                error -> terminate(createdFetch, null, ImageLoadException.transportFailure(error)),
                priorityOf(request)));
        fetches.put(request.key(), createdFetch);
        fetch = createdFetch;
        newFetch = createdFetch;
      }
      fetch.addSubscriber(subscriber);
    } finally {
      lock.unlock();
    }

    if (newFetch != null) {
      queue.submit(newFetch.ticket());
    } else {
      logger.log(Level.DEBUG, () -> "Joined ongoing download of <" + request.key() + ">");
    }
    return token;
  }

  /** Downloads the image at the given URI with default options. */
  public DownloadToken fetch(URI uri, DownloadListener listener) {
    return fetch(DownloadRequest.of(uri), listener);
  }

  /**
   * Cancels the fetch represented by the given token. The token's listener receives a {@link
   * ImageLoadException.Kind#CANCELED} error unless the fetch already completed. Returns {@code
   * true} if this was the last subscriber of the transfer, which is therefore aborted.
   */
  @CanIgnoreReturnValue
  public boolean cancel(DownloadToken token) {
    requireNonNull(token);
    Subscriber subscriber;
    InFlightFetch abandonedFetch = null;
    lock.lock();
    try {
      var fetch = fetches.get(token.key());
      if (fetch == null || (subscriber = fetch.removeSubscriber(token)) == null) {
        return false;
      }
      if (!fetch.hasSubscribers() && fetch.markDone()) {
        fetches.remove(fetch.key());
        abandonedFetch = fetch;
      }
    } finally {
      lock.unlock();
    }

    if (abandonedFetch != null) {
      logger.log(
          Level.DEBUG,
          () -> "Last subscriber canceled, aborting download of <" + token.key() + ">");
      release(abandonedFetch);
    }
    var listener = subscriber.listener();
    var exception = ImageLoadException.canceled();
    Utils.runSafely(() -> listener.onError(exception), logger, () -> listener + "::onError");
    return abandonedFetch != null;
  }

  /** Aborts all transfers. Every subscriber receives a {@code CANCELED} error. */
  public void cancelAll() {
    for (var fetch : currentFetches()) {
      terminate(fetch, null, ImageLoadException.canceled());
    }
  }

  public void setMaxConcurrentDownloads(int maxConcurrentDownloads) {
    queue.setMaxRunning(maxConcurrentDownloads);
  }

  public int maxConcurrentDownloads() {
    return queue.maxRunning();
  }

  public void setExecutionOrder(ExecutionOrder order) {
    queue.setExecutionOrder(order);
  }

  public ExecutionOrder executionOrder() {
    return queue.executionOrder();
  }

  /** Stops starting queued downloads while suspended. Running downloads carry on. */
  public void setSuspended(boolean suspended) {
    queue.setSuspended(suspended);
  }

  public boolean isSuspended() {
    return queue.isSuspended();
  }

  /** Returns the number of transfers that are either running or queued. */
  public int currentDownloadCount() {
    lock.lock();
    try {
      return fetches.size();
    } finally {
      lock.unlock();
    }
  }

  /** Returns the number of transfers currently occupying a download slot. */
  public int runningDownloadCount() {
    return queue.runningCount();
  }

  /** Sets a header sent with every download, or removes it if {@code value} is null. */
  public void setHeader(String name, @Nullable String value) {
    requireNonNull(name);
    lock.lock();
    try {
      if (value != null) {
        headers.put(name, value);
      } else {
        headers.remove(name);
      }
    } finally {
      lock.unlock();
    }
  }

  public Map<String, String> headers() {
    lock.lock();
    try {
      return Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    } finally {
      lock.unlock();
    }
  }

  private List<InFlightFetch> currentFetches() {
    lock.lock();
    try {
      return new ArrayList<>(fetches.values());
    } finally {
      lock.unlock();
    }
  }

  private TransportRequest toTransportRequest(DownloadRequest request) {
    var requestHeaders = new LinkedHashMap<>(headers());
    requestHeaders.putAll(request.headers());
    var filteredHeaders =
        headersFilter.apply(request.uri(), Collections.unmodifiableMap(requestHeaders));
    return TransportRequest.newBuilder(request.uri())
        .headers(filteredHeaders)
        .timeout(request.timeout().orElse(timeout))
        .cachePolicy(
            request.hasOption(DownloadOption.IGNORE_CACHED_RESPONSE)
                ? TransportRequest.CachePolicy.RELOAD_IGNORING_CACHE
                : TransportRequest.CachePolicy.USE_PROTOCOL_CACHE)
        .handleCookies(request.hasOption(DownloadOption.HANDLE_COOKIES))
        .trustAllCertificates(request.hasOption(DownloadOption.ALLOW_INVALID_CERTIFICATES))
        .credentials(credentials)
        .build();
  }

  private static DownloadQueue.Priority priorityOf(DownloadRequest request) {
    if (request.hasOption(DownloadOption.HIGH_PRIORITY)) {
      return DownloadQueue.Priority.HIGH;
    } else if (request.hasOption(DownloadOption.LOW_PRIORITY)) {
      return DownloadQueue.Priority.LOW;
    } else {
      return DownloadQueue.Priority.NORMAL;
    }
  }

  private void start(InFlightFetch fetch) {
    if (fetch.isDone()) {
      return;
    }

    Transport.Call call;
    try {
      call = transport.start(fetch.request(), new FetchListener(fetch));
    } catch (RuntimeException e) {
      terminate(fetch, null, ImageLoadException.transportFailure(e));
      return;
    }

    boolean callIsStale;
    lock.lock();
    try {
      callIsStale = !fetch.setCall(call);
    } finally {
      lock.unlock();
    }
    if (callIsStale) {
      call.cancel();
    }
  }

  /** Completes the given fetch with either a result or an error, notifying all its subscribers. */
  private void terminate(
      InFlightFetch fetch, @Nullable DownloadResult result, @Nullable ImageLoadException error) {
    List<Subscriber> subscribers;
    lock.lock();
    try {
      if (!fetch.markDone()) {
        return;
      }
      fetches.remove(fetch.key(), fetch);
      subscribers = fetch.drainSubscribers();
    } finally {
      lock.unlock();
    }

    release(fetch);
    for (var subscriber : subscribers) {
      var listener = subscriber.listener();
      if (result != null) {
        Utils.runSafely(() -> listener.onResult(result), logger, () -> listener + "::onResult");
      } else {
        var exception = requireNonNull(error);
        Utils.runSafely(() -> listener.onError(exception), logger, () -> listener + "::onError");
      }
    }
  }

  /** Frees the slot of a done fetch & cancels its transport call, if any. */
  private void release(InFlightFetch fetch) {
    queue.finish(fetch.ticket());
    Transport.Call call;
    lock.lock();
    try {
      call = fetch.call();
    } finally {
      lock.unlock();
    }
    if (call != null) {
      call.cancel();
    }
  }

  private List<Subscriber> subscribersOf(InFlightFetch fetch) {
    lock.lock();
    try {
      return fetch.subscribers();
    } finally {
      lock.unlock();
    }
  }

  private void publishProgress(InFlightFetch fetch) {
    long received = fetch.receivedBytes();
    long expected = fetch.expectedBytes();
    for (var subscriber : subscribersOf(fetch)) {
      var listener = subscriber.listener();
      Utils.runSafely(
          () -> listener.onProgress(received, expected), logger, () -> listener + "::onProgress");
    }
  }

  private void publishPartialImage(InFlightFetch fetch, ImageDecoder decoder) {
    boolean progressive;
    lock.lock();
    try {
      progressive = fetch.isProgressive();
    } finally {
      lock.unlock();
    }
    if (!progressive) {
      return;
    }

    var data = fetch.data();
    var partialImage = decoder.decodeIncrementally(data, false);
    if (partialImage.isEmpty() || partialImage.get().isEmpty()) {
      return;
    }

    var result = DownloadResult.partial(data, partialImage.get());
    for (var subscriber : subscribersOf(fetch)) {
      if (subscriber.progressive()) {
        var listener = subscriber.listener();
        Utils.runSafely(() -> listener.onResult(result), logger, () -> listener + "::onResult");
      }
    }
  }

  private void completeBody(InFlightFetch fetch) {
    var data = fetch.data();
    if (data.length == 0) {
      terminate(fetch, null, ImageLoadException.decodeFailure("empty response body", null));
      return;
    }
    if (decoder == null) {
      terminate(fetch, DownloadResult.of(data, null), null);
      return;
    }

    DecodedImage image;
    try {
      image = decoder.decode(data);
    } catch (IOException | RuntimeException e) {
      terminate(
          fetch,
          null,
          ImageLoadException.decodeFailure("couldn't decode <" + fetch.key() + ">", e));
      return;
    }
    if (image.isEmpty()) {
      terminate(
          fetch,
          null,
          ImageLoadException.decodeFailure("image of <" + fetch.key() + "> has zero extent", null));
      return;
    }
    terminate(fetch, DownloadResult.of(data, image), null);
  }

  /**
   * Aborts all transfers and unsubscribes this downloader from the lifecycle it was built with, if
   * any.
   */
  @Override
  public void close() {
    var subscription = lifecycleSubscription;
    if (subscription != null) {
      subscription.close();
    }
    cancelAll();
  }

  @Override
  public String toString() {
    return "ImageDownloader{transport=" + transport + ", queue=" + queue + "}";
  }

  public static ImageDownloader create() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  private final class FetchListener implements Transport.Listener {
    private static final int NOT_MODIFIED = 304;

    private final InFlightFetch fetch;

    FetchListener(InFlightFetch fetch) {
      this.fetch = fetch;
    }

    @Override
    public void onResponse(int statusCode, long expectedLength) {
      if (statusCode == NOT_MODIFIED) {
        terminate(fetch, DownloadResult.notModifiedResult(), null);
      } else if (statusCode >= 400) {
        terminate(fetch, null, ImageLoadException.badStatus(statusCode));
      } else {
        fetch.setExpectedBytes(expectedLength);
      }
    }

    @Override
    public void onData(ByteBuffer chunk) {
      if (fetch.isDone()) {
        return;
      }
      fetch.append(chunk);
      publishProgress(fetch);
      var decoder = ImageDownloader.this.decoder;
      if (decoder != null) {
        publishPartialImage(fetch, decoder);
      }
    }

    @Override
    public void onComplete() {
      if (!fetch.isDone()) {
        completeBody(fetch);
      }
    }

    @Override
    public void onError(Throwable error) {
      terminate(fetch, null, ImageLoadException.transportFailure(error));
    }
  }

  /** Cancels downloads when the process goes to background, unless they opt out. */
  private final class BackgroundPolicy implements Lifecycle.Listener {
    BackgroundPolicy() {}

    @Override
    public void onSuspending() {
      var canceled = new ArrayList<InFlightFetch>();
      lock.lock();
      try {
        inBackground = true;
        for (var fetch : fetches.values()) {
          if (!fetch.continuesInBackground()) {
            canceled.add(fetch);
          }
        }
      } finally {
        lock.unlock();
      }
      logger.log(Level.DEBUG, () -> "Suspending, canceling " + canceled.size() + " download(s)");
      canceled.forEach(fetch -> terminate(fetch, null, ImageLoadException.canceled()));
    }

    @Override
    public void onBackgroundTimeExpired() {
      boolean expired;
      lock.lock();
      try {
        expired = inBackground;
      } finally {
        lock.unlock();
      }
      if (expired) {
        logger.log(Level.DEBUG, "Background time expired, canceling remaining downloads");
        cancelAll();
      }
    }

    @Override
    public void onResumed() {
      lock.lock();
      try {
        inBackground = false;
      } finally {
        lock.unlock();
      }
    }
  }

  public static final class Builder {
    private final Map<String, String> headers = new LinkedHashMap<>();
    private @MonotonicNonNull Transport transport;
    private @MonotonicNonNull ImageDecoder decoder;
    private boolean decodeImages = true;
    private @MonotonicNonNull Executor executor;
    private int maxConcurrentDownloads = DEFAULT_MAX_CONCURRENT_DOWNLOADS;
    private @MonotonicNonNull ExecutionOrder executionOrder;
    private @MonotonicNonNull Duration timeout;
    private @MonotonicNonNull BiFunction<URI, Map<String, String>, Map<String, String>>
        headersFilter;
    private @Nullable PasswordAuthentication credentials;
    private @Nullable Lifecycle lifecycle;

    Builder() {}

    @CanIgnoreReturnValue
    public Builder transport(Transport transport) {
      this.transport = requireNonNull(transport);
      return this;
    }

    /** Sets the decoder used to validate & decode downloaded images. */
    @CanIgnoreReturnValue
    public Builder decoder(ImageDecoder decoder) {
      this.decoder = requireNonNull(decoder);
      this.decodeImages = true;
      return this;
    }

    /** Delivers downloaded bytes as-is, without decoding them. */
    @CanIgnoreReturnValue
    public Builder noDecoding() {
      this.decodeImages = false;
      return this;
    }

    /** Sets the executor on which transfers are started. */
    @CanIgnoreReturnValue
    public Builder executor(Executor executor) {
      this.executor = requireNonNull(executor);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder maxConcurrentDownloads(int maxConcurrentDownloads) {
      this.maxConcurrentDownloads =
          requirePositive(maxConcurrentDownloads, "maxConcurrentDownloads");
      return this;
    }

    @CanIgnoreReturnValue
    public Builder executionOrder(ExecutionOrder executionOrder) {
      this.executionOrder = requireNonNull(executionOrder);
      return this;
    }

    /** Sets the default timeout of downloads. */
    @CanIgnoreReturnValue
    public Builder timeout(Duration timeout) {
      this.timeout = requirePositiveDuration(timeout);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder header(String name, String value) {
      headers.put(requireNonNull(name), requireNonNull(value));
      return this;
    }

    /** Sets a function that computes the headers actually sent for each request. */
    @CanIgnoreReturnValue
    public Builder headersFilter(
        BiFunction<URI, Map<String, String>, Map<String, String>> headersFilter) {
      this.headersFilter = requireNonNull(headersFilter);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder credentials(String username, char[] password) {
      this.credentials = new PasswordAuthentication(requireNonNull(username), password.clone());
      return this;
    }

    /** Subscribes the downloader to the given lifecycle's suspension signals. */
    @CanIgnoreReturnValue
    public Builder lifecycle(Lifecycle lifecycle) {
      this.lifecycle = requireNonNull(lifecycle);
      return this;
    }

    public ImageDownloader build() {
      return new ImageDownloader(this);
    }

    Transport transport() {
      var transport = this.transport;
      return transport != null ? transport : HttpClientTransport.create();
    }

    ImageDecoder decoder() {
      return requireNonNullElse(decoder, ImageDecoder.imageIO());
    }

    Executor executor() {
      return requireNonNullElse(executor, SharedExecutors.workerExecutor());
    }

    int maxConcurrentDownloads() {
      return maxConcurrentDownloads;
    }

    ExecutionOrder executionOrder() {
      return requireNonNullElse(executionOrder, ExecutionOrder.FIFO);
    }

    Duration timeout() {
      return requireNonNullElse(timeout, DEFAULT_TIMEOUT);
    }

    BiFunction<URI, Map<String, String>, Map<String, String>> headersFilter() {
      return requireNonNullElse(headersFilter, (uri, headers) -> headers);
    }
  }
}
