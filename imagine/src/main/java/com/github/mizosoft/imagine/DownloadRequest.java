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
import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A request to download an image. Concurrent requests with the same {@link #key()} share a single
 * network transfer.
 */
public final class DownloadRequest {
  private final URI uri;
  private final String key;
  private final Set<DownloadOption> options;
  private final Map<String, String> headers;
  private final @Nullable Duration timeout;

  private DownloadRequest(Builder builder) {
    uri = builder.uri;
    key = builder.key != null ? builder.key : uri.toString();
    options = Collections.unmodifiableSet(EnumSet.copyOf(builder.options));
    headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
    timeout = builder.timeout;
  }

  public URI uri() {
    return uri;
  }

  /** Returns the key identifying the downloaded resource, which defaults to the URI's string. */
  public String key() {
    return key;
  }

  public Set<DownloadOption> options() {
    return options;
  }

  public boolean hasOption(DownloadOption option) {
    return options.contains(option);
  }

  /** Returns headers added to the downloader's default headers for this request. */
  public Map<String, String> headers() {
    return headers;
  }

  /** Returns the request's timeout, or an empty optional if the downloader's default is used. */
  public Optional<Duration> timeout() {
    return Optional.ofNullable(timeout);
  }

  @Override
  public String toString() {
    return "DownloadRequest{uri=" + uri + ", key=" + key + ", options=" + options + "}";
  }

  public static DownloadRequest of(URI uri) {
    return newBuilder(uri).build();
  }

  public static Builder newBuilder(URI uri) {
    return new Builder(uri);
  }

  public static final class Builder {
    private final URI uri;
    private final Set<DownloadOption> options = EnumSet.noneOf(DownloadOption.class);
    private final Map<String, String> headers = new LinkedHashMap<>();
    private @Nullable String key;
    private @Nullable Duration timeout;

    Builder(URI uri) {
      this.uri = requireNonNull(uri);
    }

    @CanIgnoreReturnValue
    public Builder key(String key) {
      this.key = requireNonNull(key);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder option(DownloadOption option) {
      options.add(requireNonNull(option));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder options(Set<DownloadOption> options) {
      options.forEach(this::option);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder header(String name, String value) {
      headers.put(requireNonNull(name), requireNonNull(value));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder timeout(Duration timeout) {
      this.timeout = requirePositiveDuration(timeout);
      return this;
    }

    public DownloadRequest build() {
      return new DownloadRequest(this);
    }
  }
}
