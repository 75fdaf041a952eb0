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

import static com.github.mizosoft.imagine.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import java.util.Arrays;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A blob served by an {@link ImageCache}, along with the tier it was found in. */
public final class CacheEntry {
  private final String key;
  private final byte[] blob;
  private final long cost;
  private final CacheTier tier;

  CacheEntry(String key, byte[] blob, long cost, CacheTier tier) {
    requireArgument(tier != CacheTier.NONE, "a cache entry must come from a cache tier");
    this.key = requireNonNull(key);
    this.blob = requireNonNull(blob);
    this.cost = cost;
    this.tier = requireNonNull(tier);
  }

  public String key() {
    return key;
  }

  /** Returns a copy of the entry's bytes. */
  public byte[] blob() {
    return blob.clone();
  }

  /** Returns the approximate in-memory footprint of the entry's decoded image. */
  public long cost() {
    return cost;
  }

  /** Returns either {@link CacheTier#MEMORY} or {@link CacheTier#DISK}. */
  public CacheTier tier() {
    return tier;
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof CacheEntry)) {
      return false;
    }
    var other = (CacheEntry) obj;
    return key.equals(other.key)
        && Arrays.equals(blob, other.blob)
        && cost == other.cost
        && tier == other.tier;
  }

  @Override
  public int hashCode() {
    return 31 * key.hashCode() + tier.hashCode();
  }

  @Override
  public String toString() {
    return "CacheEntry{key="
        + key
        + ", size="
        + blob.length
        + ", cost="
        + cost
        + ", tier="
        + tier
        + "}";
  }
}
