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

package com.github.mizosoft.imagine.internal.cache;

import static com.github.mizosoft.imagine.internal.Validate.requireArgument;
import static com.github.mizosoft.imagine.internal.Validate.requireNonNegative;
import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A store that keeps blobs in memory, bounded by both the total cost of its entries and their
 * count. Entries are evicted in LRU order till both bounds are satisfied. A bound of {@code 0}
 * means the store is unbounded in that dimension.
 *
 * <p>Blobs are handed out as-is; callers must not mutate them.
 */
public final class MemoryStore {
  private static final Logger logger = System.getLogger(MemoryStore.class.getName());

  private final long maxCost;
  private final int maxCount;

  private final Map<String, Entry> entries = new LinkedHashMap<>(16, 0.75f, true);

  @GuardedBy("entries")
  private long cost;

  public MemoryStore(long maxCost, int maxCount) {
    this.maxCost = requireNonNegative(maxCost, "maxCost");
    requireArgument(maxCount >= 0, "negative maxCount: %d", maxCount);
    this.maxCount = maxCount;
  }

  public long maxCost() {
    return maxCost;
  }

  public int maxCount() {
    return maxCount;
  }

  /** Returns the blob associated with the given key, marking it as recently used. */
  public Optional<byte[]> get(String key) {
    requireNonNull(key);
    synchronized (entries) {
      var entry = entries.get(key);
      return entry != null ? Optional.of(entry.blob) : Optional.empty();
    }
  }

  /** Returns the entry associated with the given key, marking it as recently used. */
  public Optional<Entry> getEntry(String key) {
    requireNonNull(key);
    synchronized (entries) {
      return Optional.ofNullable(entries.get(key));
    }
  }

  /**
   * Associates the given blob with the given key, replacing any previous entry. Returns {@code
   * false} if the entry couldn't be retained as its cost alone exceeds the cost bound.
   */
  public boolean put(String key, byte[] blob, long cost) {
    requireNonNull(key);
    requireNonNull(blob);
    requireNonNegative(cost, "cost");
    synchronized (entries) {
      var previous = entries.remove(key);
      if (previous != null) {
        this.cost -= previous.cost;
      }
      if (maxCost > 0 && cost > maxCost) {
        logger.log(
            Level.DEBUG,
            () -> String.format("not retaining <%s> as its cost %d > %d", key, cost, maxCost));
        return false;
      }

      entries.put(key, new Entry(blob, cost));
      this.cost += cost;
      evictExcessiveEntries();
      return true;
    }
  }

  public boolean remove(String key) {
    requireNonNull(key);
    synchronized (entries) {
      var entry = entries.remove(key);
      if (entry != null) {
        cost -= entry.cost;
        return true;
      }
      return false;
    }
  }

  public void clear() {
    synchronized (entries) {
      entries.clear();
      cost = 0;
    }
  }

  /** Returns the total cost of the entries currently in this store. */
  public long cost() {
    synchronized (entries) {
      return cost;
    }
  }

  public int count() {
    synchronized (entries) {
      return entries.size();
    }
  }

  /** Keeps evicting entries in LRU order till both bounds are satisfied. */
  @GuardedBy("entries")
  private void evictExcessiveEntries() {
    assert Thread.holdsLock(entries);
    var iter = entries.entrySet().iterator();
    while (isOverBounds() && iter.hasNext()) {
      var eldest = iter.next();
      var evictedKey = eldest.getKey();
      cost -= eldest.getValue().cost;
      iter.remove();
      logger.log(Level.DEBUG, () -> "evicted <" + evictedKey + "> from memory");
    }
  }

  @GuardedBy("entries")
  private boolean isOverBounds() {
    return (maxCost > 0 && cost > maxCost) || (maxCount > 0 && entries.size() > maxCount);
  }

  @Override
  public String toString() {
    synchronized (entries) {
      return "MemoryStore{count="
          + entries.size()
          + ", cost="
          + cost
          + ", maxCount="
          + maxCount
          + ", maxCost="
          + maxCost
          + "}";
    }
  }

  /** A blob along with its cost. */
  public static final class Entry {
    final byte[] blob;
    final long cost;

    Entry(byte[] blob, long cost) {
      this.blob = blob;
      this.cost = cost;
    }

    public byte[] blob() {
      return blob;
    }

    public long cost() {
      return cost;
    }
  }
}
