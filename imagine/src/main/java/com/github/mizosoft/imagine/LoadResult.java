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

import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/** An image resolved by an {@link ImageLoader}. */
public final class LoadResult {
  private static final byte[] EMPTY = new byte[0];

  private final String key;
  private final byte[] data;
  private final @Nullable DecodedImage image;
  private final CacheTier tier;
  private final boolean finished;
  private final boolean declined;

  private LoadResult(
      String key,
      byte[] data,
      @Nullable DecodedImage image,
      CacheTier tier,
      boolean finished,
      boolean declined) {
    this.key = requireNonNull(key);
    this.data = requireNonNull(data);
    this.image = image;
    this.tier = requireNonNull(tier);
    this.finished = finished;
    this.declined = declined;
  }

  public String key() {
    return key;
  }

  /** Returns a copy of the image's bytes, which are empty if the load was declined. */
  public byte[] data() {
    return data.clone();
  }

  public Optional<DecodedImage> image() {
    return Optional.ofNullable(image);
  }

  /** Returns where the image came from, {@link CacheTier#NONE} meaning it was just fetched. */
  public CacheTier tier() {
    return tier;
  }

  /** Returns {@code false} if this is a partial image of a progressive download. */
  public boolean finished() {
    return finished;
  }

  /** Returns {@code true} if the image wasn't cached and the loader decided not to fetch it. */
  public boolean declined() {
    return declined;
  }

  @Override
  public String toString() {
    return "LoadResult{key="
        + key
        + ", size="
        + data.length
        + ", tier="
        + tier
        + ", finished="
        + finished
        + ", declined="
        + declined
        + "}";
  }

  static LoadResult cached(CacheEntry entry, @Nullable DecodedImage image) {
    return new LoadResult(entry.key(), entry.blob(), image, entry.tier(), true, false);
  }

  static LoadResult fetched(String key, byte[] data, @Nullable DecodedImage image) {
    return new LoadResult(key, data, image, CacheTier.NONE, true, false);
  }

  static LoadResult partial(String key, byte[] data, @Nullable DecodedImage image) {
    return new LoadResult(key, data, image, CacheTier.NONE, false, false);
  }

  static LoadResult declined(String key) {
    return new LoadResult(key, EMPTY, null, CacheTier.NONE, true, true);
  }
}
