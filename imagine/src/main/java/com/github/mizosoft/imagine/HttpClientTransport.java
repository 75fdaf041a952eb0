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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static java.util.Objects.requireNonNullElse;

import com.github.mizosoft.imagine.internal.Utils;
import com.github.mizosoft.imagine.internal.concurrent.SharedExecutors;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.net.CookieHandler;
import java.net.CookieManager;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpClient.Redirect;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodySubscriber;
import java.net.http.HttpResponse.ResponseInfo;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow.Subscription;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link Transport} backed by {@link HttpClient}. Separate clients are created on demand for
 * requests that handle cookies or trust all certificates, as these are client-wide settings.
 */
public final class HttpClientTransport implements Transport {
  private final HttpClient.Builder clientTemplate;
  private final CookieHandler cookieHandler;
  private final Map<ClientSettings, HttpClient> clients = new ConcurrentHashMap<>();

  private HttpClientTransport(Builder builder) {
    var executor = builder.executor();
    clientTemplate =
        HttpClient.newBuilder()
            .followRedirects(builder.redirectPolicy())
            .connectTimeout(builder.connectTimeout())
            .executor(executor);
    cookieHandler = builder.cookieHandler();
  }

  private HttpClient newClient(ClientSettings settings) {
    synchronized (clientTemplate) {
      clientTemplate.cookieHandler(settings.handleCookies ? cookieHandler : NoCookies.INSTANCE);
      clientTemplate.sslContext(
          settings.trustAllCertificates ? TrustAll.SSL_CONTEXT : defaultSslContext());
      return clientTemplate.build();
    }
  }

  HttpClient clientFor(TransportRequest request) {
    return clients.computeIfAbsent(ClientSettings.of(request), this::newClient);
  }

  @Override
  public Call start(TransportRequest request, Listener listener) {
    requireNonNull(request);
    requireNonNull(listener);
    var call = new HttpCall(listener);
    var responseFuture = clientFor(request).sendAsync(toHttpRequest(request), call);
    call.onSent(responseFuture);
    return call;
  }

  static HttpRequest toHttpRequest(TransportRequest request) {
    var builder = HttpRequest.newBuilder(request.uri()).GET().timeout(request.timeout());
    request.headers().forEach(builder::setHeader);
    if (request.cachePolicy() == TransportRequest.CachePolicy.RELOAD_IGNORING_CACHE) {
      builder.setHeader("Cache-Control", "no-cache");
    }
    request
        .credentials()
        .ifPresent(
            credentials -> {
              var userPass =
                  credentials.getUserName() + ":" + new String(credentials.getPassword());
              builder.setHeader(
                  "Authorization",
                  "Basic " + Base64.getEncoder().encodeToString(userPass.getBytes(UTF_8)));
            });
    return builder.build();
  }

  private static SSLContext defaultSslContext() {
    try {
      return SSLContext.getDefault();
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException(e);
    }
  }

  public static HttpClientTransport create() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** A call that forwards response events to its listener till completed or canceled. */
  private static final class HttpCall implements Call, BodyHandler<Void> {
    private final Listener listener;
    private final AtomicBoolean done = new AtomicBoolean();
    private final AtomicReference<@Nullable Subscription> upstream = new AtomicReference<>();
    private volatile @MonotonicNonNull CompletableFuture<?> responseFuture;

    HttpCall(Listener listener) {
      this.listener = listener;
    }

    void onSent(CompletableFuture<?> responseFuture) {
      this.responseFuture = responseFuture;
      responseFuture.whenComplete(
          (__, error) -> {
            if (error != null) {
              complete(Utils.getDeepCompletionCause(error));
            }
          });
      if (done.get()) {
        responseFuture.cancel(true);
      }
    }

    @Override
    public BodySubscriber<Void> apply(ResponseInfo responseInfo) {
      if (!done.get()) {
        listener.onResponse(
            responseInfo.statusCode(),
            responseInfo.headers().firstValueAsLong("Content-Length").orElse(-1L));
      }
      return new ForwardingBodySubscriber();
    }

    @Override
    public void cancel() {
      if (done.compareAndSet(false, true)) {
        var subscription = upstream.getAndSet(null);
        if (subscription != null) {
          subscription.cancel();
        }
        var future = responseFuture;
        if (future != null) {
          future.cancel(true);
        }
      }
    }

    private void complete(@Nullable Throwable error) {
      if (done.compareAndSet(false, true)) {
        upstream.set(null);
        if (error != null) {
          listener.onError(error);
        } else {
          listener.onComplete();
        }
      }
    }

    private final class ForwardingBodySubscriber implements BodySubscriber<Void> {
      private final CompletableFuture<Void> body = new CompletableFuture<>();

      ForwardingBodySubscriber() {}

      @Override
      public CompletionStage<Void> getBody() {
        return body;
      }

      @Override
      public void onSubscribe(Subscription subscription) {
        if (done.get() || !upstream.compareAndSet(null, subscription)) {
          subscription.cancel();
          return;
        }
        subscription.request(Long.MAX_VALUE);
      }

      @Override
      public void onNext(List<ByteBuffer> item) {
        if (!done.get()) {
          for (var buffer : item) {
            listener.onData(buffer);
          }
        }
      }

      @Override
      public void onError(Throwable throwable) {
        body.completeExceptionally(throwable);
        complete(throwable);
      }

      @Override
      public void onComplete() {
        body.complete(null);
        complete(null);
      }
    }
  }

  /** A cookie handler that neither stores nor sends cookies. */
  private static final class NoCookies extends CookieHandler {
    static final NoCookies INSTANCE = new NoCookies();

    @Override
    public Map<String, List<String>> get(URI uri, Map<String, List<String>> requestHeaders) {
      return Map.of();
    }

    @Override
    public void put(URI uri, Map<String, List<String>> responseHeaders) {}
  }

  /** The client-wide settings a request may need. Each gets its own client. */
  private enum ClientSettings {
    PLAIN(false, false),
    COOKIES(true, false),
    INSECURE(false, true),
    INSECURE_COOKIES(true, true);

    final boolean handleCookies;
    final boolean trustAllCertificates;

    ClientSettings(boolean handleCookies, boolean trustAllCertificates) {
      this.handleCookies = handleCookies;
      this.trustAllCertificates = trustAllCertificates;
    }

    static ClientSettings of(TransportRequest request) {
      if (request.trustAllCertificates()) {
        return request.handleCookies() ? INSECURE_COOKIES : INSECURE;
      }
      return request.handleCookies() ? COOKIES : PLAIN;
    }
  }

  /**
   * Trusts any certificate. Only used for requests that explicitly opt in. The context is created
   * when this class is first loaded.
   */
  private static final class TrustAll implements X509TrustManager {
    static final SSLContext SSL_CONTEXT = createSslContext();

    private static SSLContext createSslContext() {
      try {
        var context = SSLContext.getInstance("TLS");
        context.init(null, new TrustManager[] {new TrustAll()}, new SecureRandom());
        return context;
      } catch (GeneralSecurityException e) {
        throw new IllegalStateException(e);
      }
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {}

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {}

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  }

  public static final class Builder {
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(15);

    private @MonotonicNonNull Executor executor;
    private @MonotonicNonNull Redirect redirectPolicy;
    private @MonotonicNonNull Duration connectTimeout;
    private @MonotonicNonNull CookieHandler cookieHandler;

    Builder() {}

    /** Sets the executor the underlying clients run their callbacks on. */
    @CanIgnoreReturnValue
    public Builder executor(Executor executor) {
      this.executor = requireNonNull(executor);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder followRedirects(Redirect redirectPolicy) {
      this.redirectPolicy = requireNonNull(redirectPolicy);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = requireNonNull(connectTimeout);
      return this;
    }

    /** Sets the cookie handler used for requests that handle cookies. */
    @CanIgnoreReturnValue
    public Builder cookieHandler(CookieHandler cookieHandler) {
      this.cookieHandler = requireNonNull(cookieHandler);
      return this;
    }

    public HttpClientTransport build() {
      return new HttpClientTransport(this);
    }

    Executor executor() {
      return requireNonNullElse(executor, SharedExecutors.workerExecutor());
    }

    Redirect redirectPolicy() {
      return requireNonNullElse(redirectPolicy, Redirect.NORMAL);
    }

    Duration connectTimeout() {
      return requireNonNullElse(connectTimeout, DEFAULT_CONNECT_TIMEOUT);
    }

    CookieHandler cookieHandler() {
      var cookieHandler = this.cookieHandler;
      return cookieHandler != null ? cookieHandler : new CookieManager();
    }
  }
}
