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
import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.net.PasswordAuthentication;
import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/** The description of a request a {@link Transport} carries out. */
public final class TransportRequest {
  private final URI uri;
  private final Map<String, String> headers;
  private final Duration timeout;
  private final CachePolicy cachePolicy;
  private final boolean handleCookies;
  private final boolean trustAllCertificates;
  private final @Nullable PasswordAuthentication credentials;

  private TransportRequest(Builder builder) {
    uri = builder.uri;
    headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
    timeout = builder.timeout;
    cachePolicy = builder.cachePolicy;
    handleCookies = builder.handleCookies;
    trustAllCertificates = builder.trustAllCertificates;
    credentials = builder.credentials;
  }

  public URI uri() {
    return uri;
  }

  public Map<String, String> headers() {
    return headers;
  }

  public Duration timeout() {
    return timeout;
  }

  public CachePolicy cachePolicy() {
    return cachePolicy;
  }

  /** Returns whether cookies are sent with the request & stored from its response. */
  public boolean handleCookies() {
    return handleCookies;
  }

  /** Returns whether the server's certificate is accepted without validation. */
  public boolean trustAllCertificates() {
    return trustAllCertificates;
  }

  public Optional<PasswordAuthentication> credentials() {
    return Optional.ofNullable(credentials);
  }

  @Override
  public String toString() {
    return "TransportRequest{uri=" + uri + ", headers=" + headers + ", timeout=" + timeout + "}";
  }

  public static Builder newBuilder(URI uri) {
    return new Builder(uri);
  }

  /** How caches between the client & the origin server are to be used. */
  public enum CachePolicy {
    /** Use whatever the protocol's caching semantics allow. */
    USE_PROTOCOL_CACHE,

    /** Ask for the response to be revalidated with the origin server. */
    RELOAD_IGNORING_CACHE
  }

  public static final class Builder {
    private final URI uri;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private Duration timeout = Duration.ofSeconds(15);
    private CachePolicy cachePolicy = CachePolicy.USE_PROTOCOL_CACHE;
    private boolean handleCookies;
    private boolean trustAllCertificates;
    private @Nullable PasswordAuthentication credentials;

    Builder(URI uri) {
      this.uri = requireNonNull(uri);
    }

    @CanIgnoreReturnValue
    public Builder header(String name, String value) {
      headers.put(requireNonNull(name), requireNonNull(value));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder headers(Map<String, String> headers) {
      headers.forEach(this::header);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder timeout(Duration timeout) {
      this.timeout = requirePositiveDuration(timeout);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder cachePolicy(CachePolicy cachePolicy) {
      this.cachePolicy = requireNonNull(cachePolicy);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder handleCookies(boolean on) {
      this.handleCookies = on;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder trustAllCertificates(boolean on) {
      this.trustAllCertificates = on;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder credentials(@Nullable PasswordAuthentication credentials) {
      this.credentials = credentials;
      return this;
    }

    public TransportRequest build() {
      return new TransportRequest(this);
    }
  }
}
