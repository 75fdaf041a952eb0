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

import static com.github.mizosoft.imagine.internal.Utils.requireNonNegativeDuration;
import static com.github.mizosoft.imagine.internal.Validate.requireArgument;
import static com.github.mizosoft.imagine.internal.Validate.requireNonNegative;
import static com.github.mizosoft.imagine.internal.Validate.requireState;
import static java.util.Objects.requireNonNull;
import static java.util.Objects.requireNonNullElse;

import com.github.mizosoft.imagine.internal.Utils;
import com.github.mizosoft.imagine.internal.cache.DiskStore;
import com.github.mizosoft.imagine.internal.cache.MemoryStore;
import com.github.mizosoft.imagine.internal.concurrent.SerialExecutor;
import com.github.mizosoft.imagine.internal.concurrent.SharedExecutors;
import com.github.mizosoft.imagine.internal.function.ThrowingRunnable;
import com.github.mizosoft.imagine.internal.function.ThrowingSupplier;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A two-tier cache of image blobs. The memory tier is checked synchronously, and is repopulated
 * from the disk tier on misses. All disk operations run one at a time on a sequential context, so
 * the methods returning futures never block their caller.
 *
 * <p>Disk failures never fail a cache operation. A failed disk write is logged and the memory
 * insert stands. A failed disk read is treated as a miss.
 */
public final class ImageCache implements AutoCloseable {
  private static final Logger logger = System.getLogger(ImageCache.class.getName());

  private static final String MAX_AGE_SECONDS_PROP =
      "com.github.mizosoft.imagine.ImageCache.maxAgeSeconds";
  private static final String MAX_DISK_SIZE_PROP =
      "com.github.mizosoft.imagine.ImageCache.maxDiskSize";

  static final Duration DEFAULT_MAX_DISK_AGE =
      Duration.ofSeconds(
          Utils.getLongProperty(MAX_AGE_SECONDS_PROP, Duration.ofDays(7).toSeconds(), 0));
  static final long DEFAULT_MAX_DISK_SIZE = Utils.getLongProperty(MAX_DISK_SIZE_PROP, 0, 0);
  static final String DEFAULT_DIRECTORY_NAME = "imagine";

  private final MemoryStore memoryStore;
  private final @Nullable DiskStore diskStore;
  private final SerialExecutor diskContext;
  private final Executor callbackExecutor;
  private final Weigher weigher;
  private final boolean cacheInMemory;
  private final Duration maxDiskAge;
  private final long maxDiskSize;
  private final Lifecycle.@Nullable Subscription lifecycleSubscription;

  private ImageCache(Builder builder) {
    memoryStore = new MemoryStore(builder.maxMemoryCost, builder.maxMemoryCount);
    diskStore =
        builder.memoryOnly
            ? null
            : DiskStore.newBuilder()
                .directory(builder.directory())
                .namespace(builder.namespace())
                .clock(builder.clock())
                .build();
    diskContext = new SerialExecutor(builder.diskExecutor());
    callbackExecutor = builder.callbackExecutor();
    weigher = builder.weigher();
    cacheInMemory = builder.cacheInMemory;
    maxDiskAge = builder.maxDiskAge();
    maxDiskSize = builder.maxDiskSize;

    var lifecycle = builder.lifecycle;
    if (lifecycle == null) {
      lifecycleSubscription = null;
    } else {
      boolean evictOnSuspend = builder.evictOnSuspend;
      lifecycleSubscription =
          lifecycle.subscribe(
              new Lifecycle.Listener() {
                @Override
                public void onMemoryPressure() {
                  clearMemory();
                }

                @Override
                public void onSuspending() {
                  if (evictOnSuspend) {
                    evictExpired();
                  }
                }
              });
    }
  }

  /**
   * Stores the given blob under the given key, in memory if the memory tier is enabled, and on disk
   * if {@code toDisk} is true. The returned future completes after the disk write, or immediately
   * if nothing is written to disk.
   */
  public CompletableFuture<Void> store(String key, byte[] blob, long cost, boolean toDisk) {
    requireNonNull(key);
    requireNonNull(blob);
    requireNonNegative(cost, "cost");
    var ownedBlob = blob.clone();
    if (cacheInMemory) {
      memoryStore.put(key, ownedBlob, cost);
    }
    var diskStore = this.diskStore;
    if (!toDisk || diskStore == null) {
      return CompletableFuture.completedFuture(null);
    }
    return runOnDisk(() -> diskStore.write(key, ownedBlob), () -> "writing <" + key + ">");
  }

  /** Stores the given blob, weighing it with this cache's {@link Weigher}. */
  public CompletableFuture<Void> store(String key, byte[] blob, boolean toDisk) {
    requireNonNull(key);
    requireNonNull(blob);
    return store(key, blob, weigh(key, blob), toDisk);
  }

  /**
   * Looks up the given key. A memory hit completes the query right away. Otherwise, the disk is
   * searched on the disk context, and a hit is put back in memory before the query completes on the
   * callback executor. Misses complete with an empty optional.
   */
  public Query query(String key) {
    requireNonNull(key);
    var memoryEntry = memoryStore.getEntry(key);
    if (memoryEntry.isPresent()) {
      var entry = memoryEntry.get();
      return Query.completed(
          Optional.of(new CacheEntry(key, entry.blob(), entry.cost(), CacheTier.MEMORY)));
    }
    var diskStore = this.diskStore;
    if (diskStore == null) {
      return Query.completed(Optional.empty());
    }

    var query = new Query();
    diskContext.execute(
        () -> {
          if (query.isCanceled()) {
            return;
          }
          Optional<CacheEntry> entry;
          try {
            entry = readQuietly(diskStore, key).map(blob -> promote(key, blob));
          } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Exception thrown when promoting <" + key + ">", e);
            entry = Optional.empty();
          }
          var result = entry;
          try {
            callbackExecutor.execute(() -> query.complete(result));
          } catch (RejectedExecutionException e) {
            query.complete(result);
          }
        });
    return query;
  }

  private CacheEntry promote(String key, byte[] blob) {
    long cost = weigh(key, blob);
    if (cacheInMemory) {
      memoryStore.put(key, blob, cost);
    }
    return new CacheEntry(key, blob, cost, CacheTier.DISK);
  }

  /** Weighs the given blob, falling back to its length if the weigher fails. */
  private long weigh(String key, byte[] blob) {
    long cost;
    try {
      cost = weigher.weigh(key, blob);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Exception thrown when weighing <" + key + ">", e);
      return blob.length;
    }
    if (cost < 0) {
      logger.log(Level.WARNING, "Negative weight for <" + key + ">: " + cost);
      return blob.length;
    }
    return cost;
  }

  /** Returns a copy of the blob associated with the given key if it's in memory. */
  public Optional<byte[]> get(String key) {
    return memoryStore.get(key).map(byte[]::clone);
  }

  /**
   * Reads the blob associated with the given key from disk, blocking till the disk context gets to
   * it. A hit is also put in memory.
   */
  public Optional<byte[]> getFromDisk(String key) {
    requireNonNull(key);
    var diskStore = this.diskStore;
    if (diskStore == null) {
      return Optional.empty();
    }
    return awaitDisk(
        () -> readQuietly(diskStore, key).map(blob -> promote(key, blob).blob()),
        Optional.<byte[]>empty(),
        () -> "reading <" + key + ">");
  }

  /** Removes the given key from memory, and from disk if {@code fromDisk} is true. */
  public CompletableFuture<Void> remove(String key, boolean fromDisk) {
    requireNonNull(key);
    memoryStore.remove(key);
    var diskStore = this.diskStore;
    if (!fromDisk || diskStore == null) {
      return CompletableFuture.completedFuture(null);
    }
    return runOnDisk(() -> diskStore.remove(key), () -> "removing <" + key + ">");
  }

  /**
   * Deletes disk entries older than the configured max age, then the oldest entries if the
   * remaining ones exceed the configured max disk size.
   */
  public CompletableFuture<Void> evictExpired() {
    var diskStore = this.diskStore;
    if (diskStore == null) {
      return CompletableFuture.completedFuture(null);
    }
    return runOnDisk(() -> diskStore.evict(maxDiskAge, maxDiskSize), () -> "evicting entries");
  }

  public void clearMemory() {
    memoryStore.clear();
  }

  public CompletableFuture<Void> clearDisk() {
    var diskStore = this.diskStore;
    if (diskStore == null) {
      return CompletableFuture.completedFuture(null);
    }
    return runOnDisk(diskStore::clear, () -> "clearing disk");
  }

  /** Returns the size of the disk tier in bytes, blocking till the disk context gets to it. */
  public long diskSize() {
    var diskStore = this.diskStore;
    return diskStore != null ? awaitDisk(diskStore::size, 0L, () -> "computing disk size") : 0L;
  }

  /** Returns the number of entries on disk, blocking till the disk context gets to it. */
  public int diskCount() {
    var diskStore = this.diskStore;
    return diskStore != null ? awaitDisk(diskStore::count, 0, () -> "counting disk entries") : 0;
  }

  public long memoryCost() {
    return memoryStore.cost();
  }

  public int memoryCount() {
    return memoryStore.count();
  }

  /** Checks whether the given key has an entry in the disk tier's own directory. */
  public CompletableFuture<Boolean> contains(String key) {
    requireNonNull(key);
    var diskStore = this.diskStore;
    if (diskStore == null) {
      return CompletableFuture.completedFuture(false);
    }
    return diskContext.submit(() -> diskStore.contains(key));
  }

  /** Registers a directory of pre-populated entries that's searched on disk misses. */
  public void addReadOnlyDirectory(Path directory) {
    var diskStore = this.diskStore;
    requireState(diskStore != null, "memory-only cache");
    diskStore.addReadOnlyDirectory(directory);
  }

  /** Returns the file the given key's blob is written to, or nothing for a memory-only cache. */
  public Optional<Path> pathFor(String key) {
    requireNonNull(key);
    var diskStore = this.diskStore;
    return diskStore != null ? Optional.of(diskStore.pathFor(key)) : Optional.empty();
  }

  /** Returns whether the cache has a disk tier. */
  public boolean hasDiskTier() {
    return diskStore != null;
  }

  private static Optional<byte[]> readQuietly(DiskStore diskStore, String key) {
    try {
      return diskStore.read(key);
    } catch (IOException e) {
      logger.log(Level.WARNING, "Exception thrown when reading <" + key + ">", e);
      return Optional.empty();
    }
  }

  private CompletableFuture<Void> runOnDisk(
      ThrowingRunnable action, Supplier<String> description) {
    return diskContext
        .runAsync(action)
        .exceptionally(
            e -> {
              var cause = Utils.getDeepCompletionCause(e);
              if (!(cause instanceof IOException)) {
                throw Utils.toCompletionException(cause);
              }
              logger.log(
                  Level.WARNING, () -> "Exception thrown when " + description.get(), cause);
              return null;
            });
  }

  private <T> T awaitDisk(
      ThrowingSupplier<T> computation, T fallback, Supplier<String> description) {
    try {
      return diskContext.await(computation);
    } catch (IOException e) {
      logger.log(Level.WARNING, () -> "Exception thrown when " + description.get(), e);
      return fallback;
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw Utils.toCompletionException(e);
    }
  }

  /**
   * Unsubscribes this cache from the lifecycle it was built with, if any. The cache stays usable
   * but no longer reacts to lifecycle signals.
   */
  @Override
  public void close() {
    var subscription = lifecycleSubscription;
    if (subscription != null) {
      subscription.close();
    }
  }

  @Override
  public String toString() {
    return "ImageCache{memoryStore=" + memoryStore + ", diskStore=" + diskStore + "}";
  }

  public static ImageCache create() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Computes the in-memory cost of blobs read from disk. */
  @FunctionalInterface
  public interface Weigher {
    long weigh(String key, byte[] blob);

    /** Returns a weigher that weighs a blob by its length. */
    static Weigher ofLength() {
      return (key, blob) -> blob.length;
    }
  }

  /**
   * A pending lookup. Canceling a query suppresses its outcome; a disk read that already started
   * still runs to completion, and may still put its result in memory.
   */
  public static final class Query {
    private final CompletableFuture<Optional<CacheEntry>> result = new CompletableFuture<>();

    Query() {}

    /**
     * Returns a future for the query's outcome. A canceled query's future completes with a {@code
     * CancellationException}.
     */
    public CompletableFuture<Optional<CacheEntry>> result() {
      return result;
    }

    @CanIgnoreReturnValue
    public boolean cancel() {
      return result.cancel(false);
    }

    public boolean isCanceled() {
      return result.isCancelled();
    }

    void complete(Optional<CacheEntry> entry) {
      result.complete(entry);
    }

    static Query completed(Optional<CacheEntry> entry) {
      var query = new Query();
      query.complete(entry);
      return query;
    }
  }

  public static final class Builder {
    private long maxMemoryCost;
    private int maxMemoryCount;
    private boolean memoryOnly;
    private boolean cacheInMemory = true;
    private boolean evictOnSuspend = true;
    private long maxDiskSize = DEFAULT_MAX_DISK_SIZE;
    private @MonotonicNonNull Duration maxDiskAge;
    private @MonotonicNonNull Path directory;
    private @MonotonicNonNull String namespace;
    private @MonotonicNonNull Executor diskExecutor;
    private @MonotonicNonNull Executor callbackExecutor;
    private @MonotonicNonNull Weigher weigher;
    private @MonotonicNonNull Clock clock;
    private @Nullable Lifecycle lifecycle;

    Builder() {}

    /** Sets the max total cost of entries kept in memory. {@code 0} means unbounded. */
    @CanIgnoreReturnValue
    public Builder maxMemoryCost(long maxMemoryCost) {
      this.maxMemoryCost = requireNonNegative(maxMemoryCost, "maxMemoryCost");
      return this;
    }

    /** Sets the max number of entries kept in memory. {@code 0} means unbounded. */
    @CanIgnoreReturnValue
    public Builder maxMemoryCount(int maxMemoryCount) {
      requireArgument(maxMemoryCount >= 0, "negative maxMemoryCount: %d", maxMemoryCount);
      this.maxMemoryCount = maxMemoryCount;
      return this;
    }

    /** Disables the disk tier. */
    @CanIgnoreReturnValue
    public Builder memoryOnly() {
      this.memoryOnly = true;
      return this;
    }

    /** Enables or disables the memory tier. It's enabled by default. */
    @CanIgnoreReturnValue
    public Builder cacheInMemory(boolean on) {
      this.cacheInMemory = on;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder maxDiskAge(Duration maxDiskAge) {
      this.maxDiskAge = requireNonNegativeDuration(maxDiskAge);
      return this;
    }

    /** Sets the size the disk tier is trimmed to fit in. {@code 0} means unbounded. */
    @CanIgnoreReturnValue
    public Builder maxDiskSize(long maxDiskSize) {
      this.maxDiskSize = requireNonNegative(maxDiskSize, "maxDiskSize");
      return this;
    }

    /** Sets the directory under which the disk tier's namespaced directory is created. */
    @CanIgnoreReturnValue
    public Builder directory(Path directory) {
      this.directory = requireNonNull(directory);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder namespace(String namespace) {
      this.namespace = requireNonNull(namespace);
      return this;
    }

    /** Sets the executor backing the sequential disk context. */
    @CanIgnoreReturnValue
    public Builder diskExecutor(Executor diskExecutor) {
      this.diskExecutor = requireNonNull(diskExecutor);
      return this;
    }

    /** Sets the executor on which queries that hit the disk are completed. */
    @CanIgnoreReturnValue
    public Builder callbackExecutor(Executor callbackExecutor) {
      this.callbackExecutor = requireNonNull(callbackExecutor);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder weigher(Weigher weigher) {
      this.weigher = requireNonNull(weigher);
      return this;
    }

    /** Sets the clock that stamps disk entries. */
    @CanIgnoreReturnValue
    public Builder clock(Clock clock) {
      this.clock = requireNonNull(clock);
      return this;
    }

    /** Subscribes the cache to the given lifecycle's memory pressure & suspension signals. */
    @CanIgnoreReturnValue
    public Builder lifecycle(Lifecycle lifecycle) {
      this.lifecycle = requireNonNull(lifecycle);
      return this;
    }

    /** Sets whether expired disk entries are evicted when the process is suspending. */
    @CanIgnoreReturnValue
    public Builder evictOnSuspend(boolean on) {
      this.evictOnSuspend = on;
      return this;
    }

    public ImageCache build() {
      return new ImageCache(this);
    }

    Path directory() {
      var directory = this.directory;
      return directory != null
          ? directory
          : Path.of(System.getProperty("java.io.tmpdir"), DEFAULT_DIRECTORY_NAME);
    }

    String namespace() {
      return requireNonNullElse(namespace, "default");
    }

    Executor diskExecutor() {
      return requireNonNullElse(diskExecutor, SharedExecutors.ioExecutor());
    }

    Executor callbackExecutor() {
      return requireNonNullElse(callbackExecutor, SharedExecutors.workerExecutor());
    }

    Weigher weigher() {
      return requireNonNullElse(weigher, Weigher.ofLength());
    }

    Clock clock() {
      return requireNonNullElse(clock, Utils.systemMillisUtc());
    }

    Duration maxDiskAge() {
      return requireNonNullElse(maxDiskAge, DEFAULT_MAX_DISK_AGE);
    }
  }
}
