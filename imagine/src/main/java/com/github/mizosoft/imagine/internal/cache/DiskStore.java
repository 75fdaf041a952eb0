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
import static com.github.mizosoft.imagine.internal.Validate.requireState;
import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.util.Objects.requireNonNull;
import static java.util.Objects.requireNonNullElse;

import com.github.mizosoft.imagine.internal.Utils;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;

/**
 * Stores blobs as files under a namespaced directory, one file per key, named by a {@link
 * KeyHasher}. Auxiliary read-only directories can be registered to be searched, in registration
 * order, when an entry isn't found in the store's own directory.
 *
 * <p>A {@code DiskStore} isn't thread-safe. All operations are expected to be invoked from a
 * single sequential context (see {@code ImageCache}). Files are written to a temp file first which
 * then atomically replaces any previous version, so readers never see a partially written entry.
 */
public final class DiskStore {
  /*
   * The store's layout on disk is as follows:
   *
   *   <directory>/com.github.mizosoft.imagine.<namespace>/
   *     <md5-hex>[.<ext>]      an entry file, its content being the raw blob
   *     <md5-hex>[.<ext>].tmp  a write in progress (or one interrupted by a crash)
   *
   * An entry's last modified time is the time it was last written, which is what the age & size
   * sweeps order entries by.
   */

  private static final Logger logger = System.getLogger(DiskStore.class.getName());

  static final String NAMESPACE_PREFIX = "com.github.mizosoft.imagine.";
  static final String DEFAULT_NAMESPACE = "default";
  static final String TEMP_FILE_SUFFIX = ".tmp";

  private final Path directory;
  private final KeyHasher hasher;
  private final Clock clock;
  private final List<Path> readOnlyDirectories = new CopyOnWriteArrayList<>();

  private DiskStore(Builder builder) {
    directory = builder.directory().resolve(NAMESPACE_PREFIX + builder.namespace());
    hasher = builder.hasher();
    clock = builder.clock();
  }

  /** Returns the directory this store writes entries to. */
  public Path directory() {
    return directory;
  }

  public List<Path> readOnlyDirectories() {
    return List.copyOf(readOnlyDirectories);
  }

  /** Registers a directory that is searched for entries not found under this store's directory. */
  public void addReadOnlyDirectory(Path readOnlyDirectory) {
    requireNonNull(readOnlyDirectory);
    if (!readOnlyDirectories.contains(readOnlyDirectory)) {
      readOnlyDirectories.add(readOnlyDirectory);
    }
  }

  /** Returns the path the entry for the given key is written to. */
  public Path pathFor(String key) {
    return directory.resolve(hasher.filenameFor(key));
  }

  /**
   * Reads the entry for the given key, searching this store's directory then the read-only ones.
   * In each directory, the current file name is tried before the legacy one.
   */
  public Optional<byte[]> read(String key) throws IOException {
    requireNonNull(key);
    var filename = hasher.filenameFor(key);
    var legacyFilename = hasher.legacyFilenameFor(key);
    var blob = readFirstExisting(directory, filename, legacyFilename);
    for (int i = 0; blob.isEmpty() && i < readOnlyDirectories.size(); i++) {
      blob = readFirstExisting(readOnlyDirectories.get(i), filename, legacyFilename);
    }
    return blob;
  }

  private static Optional<byte[]> readFirstExisting(
      Path searchDirectory, String filename, String legacyFilename) throws IOException {
    var blob = readIfExists(searchDirectory.resolve(filename));
    if (blob.isEmpty() && !legacyFilename.equals(filename)) {
      blob = readIfExists(searchDirectory.resolve(legacyFilename));
    }
    return blob;
  }

  private static Optional<byte[]> readIfExists(Path file) throws IOException {
    try {
      return Optional.of(Files.readAllBytes(file));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    }
  }

  /** Returns whether an entry for the given key exists in this store's directory. */
  public boolean contains(String key) {
    requireNonNull(key);
    return Files.exists(directory.resolve(hasher.filenameFor(key)))
        || Files.exists(directory.resolve(hasher.legacyFilenameFor(key)));
  }

  /** Writes the given blob as the entry for the given key, replacing any previous entry. */
  public void write(String key, byte[] blob) throws IOException {
    requireNonNull(key);
    requireNonNull(blob);
    Files.createDirectories(directory);

    var file = pathFor(key);
    var tempFile =
        file.resolveSibling(
            file.getFileName()
                + "."
                + Long.toHexString(ThreadLocalRandom.current().nextLong())
                + TEMP_FILE_SUFFIX);
    try {
      Files.write(tempFile, blob);
      Files.setLastModifiedTime(tempFile, FileTime.from(clock.instant()));
      Files.move(tempFile, file, ATOMIC_MOVE, REPLACE_EXISTING);
    } catch (IOException e) {
      deleteIfExistsQuietly(tempFile);
      throw e;
    }
  }

  /** Removes the entry for the given key from this store's directory. */
  @CanIgnoreReturnValue
  public boolean remove(String key) throws IOException {
    requireNonNull(key);
    boolean removed = Files.deleteIfExists(directory.resolve(hasher.filenameFor(key)));
    var legacyFilename = hasher.legacyFilenameFor(key);
    if (!legacyFilename.equals(hasher.filenameFor(key))) {
      removed |= Files.deleteIfExists(directory.resolve(legacyFilename));
    }
    return removed;
  }

  /** Deletes this store's directory along with all its entries. */
  public void clear() throws IOException {
    if (!Files.exists(directory)) {
      return;
    }
    Files.walkFileTree(
        directory,
        new SimpleFileVisitor<>() {
          @Override
          public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
              throws IOException {
            Files.deleteIfExists(file);
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult postVisitDirectory(Path dir, IOException exc)
              throws IOException {
            if (exc != null) {
              throw exc;
            }
            Files.deleteIfExists(dir);
            return FileVisitResult.CONTINUE;
          }
        });
  }

  /** Returns the total size of the entry files in this store's directory. */
  public long size() throws IOException {
    long size = 0;
    for (var file : listFiles()) {
      size += file.size;
    }
    return size;
  }

  /** Returns the number of entry files in this store's directory. */
  public int count() throws IOException {
    return listFiles().size();
  }

  /**
   * Evicts entries in two phases. First, entries last written at or before {@code now - maxAge}
   * are deleted. Then, if {@code maxSize} is positive and the surviving entries exceed it, the
   * oldest survivors are deleted till their total size drops below {@code maxSize / 2}. Failing to
   * delete an individual file doesn't abort the sweep.
   */
  public EvictionReport evict(Duration maxAge, long maxSize) throws IOException {
    requireNonNull(maxAge);
    requireNonNegative(maxSize, "maxSize");

    long expirationMillis = saturatedSubtract(clock.millis(), maxAge);
    int agedOut = 0;
    long survivingSize = 0;
    var survivors = new ArrayList<FileEntry>();
    for (var file : listFiles()) {
      if (file.lastModifiedMillis <= expirationMillis) {
        if (tryDelete(file.path)) {
          agedOut++;
        }
      } else {
        survivors.add(file);
        survivingSize += file.size;
      }
    }

    int sizedOut = 0;
    if (maxSize > 0 && survivingSize > maxSize) {
      long targetSize = maxSize / 2;
      survivors.sort(FileEntry.OLDEST_FIRST);
      for (var file : survivors) {
        if (tryDelete(file.path)) {
          sizedOut++;
          survivingSize -= file.size;
          if (survivingSize < targetSize) {
            break;
          }
        }
      }
    }

    var report = new EvictionReport(agedOut, sizedOut, survivingSize);
    logger.log(Level.DEBUG, () -> "eviction done: " + report);
    return report;
  }

  private List<FileEntry> listFiles() throws IOException {
    if (!Files.isDirectory(directory)) {
      return List.of();
    }

    var files = new ArrayList<FileEntry>();
    Files.walkFileTree(
        directory,
        new SimpleFileVisitor<>() {
          @Override
          public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile()) {
              files.add(new FileEntry(file, attrs.lastModifiedTime().toMillis(), attrs.size()));
            }
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult visitFileFailed(Path file, IOException exc) {
            logger.log(Level.WARNING, "Exception thrown when visiting: " + file, exc);
            return FileVisitResult.CONTINUE;
          }
        });
    return files;
  }

  private static boolean tryDelete(Path file) {
    try {
      Files.delete(file);
      return true;
    } catch (IOException e) {
      logger.log(Level.WARNING, "Exception thrown when deleting: " + file, e);
      return false;
    }
  }

  private static void deleteIfExistsQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      logger.log(Level.WARNING, "Exception thrown when deleting: " + path, e);
    }
  }

  private static long saturatedSubtract(long nowMillis, Duration maxAge) {
    try {
      return Math.subtractExact(nowMillis, maxAge.toMillis());
    } catch (ArithmeticException e) {
      return Long.MIN_VALUE;
    }
  }

  @Override
  public String toString() {
    return "DiskStore{directory="
        + directory
        + ", readOnlyDirectories="
        + readOnlyDirectories
        + "}";
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** An entry file along with the attributes the eviction sweep needs. */
  static final class FileEntry {
    static final Comparator<FileEntry> OLDEST_FIRST =
        Comparator.comparingLong(entry -> entry.lastModifiedMillis);

    final Path path;
    final long lastModifiedMillis;
    final long size;

    FileEntry(Path path, long lastModifiedMillis, long size) {
      this.path = path;
      this.lastModifiedMillis = lastModifiedMillis;
      this.size = size;
    }
  }

  /** The outcome of an eviction sweep. */
  public static final class EvictionReport {
    private final int agedOut;
    private final int sizedOut;
    private final long remainingSize;

    EvictionReport(int agedOut, int sizedOut, long remainingSize) {
      this.agedOut = agedOut;
      this.sizedOut = sizedOut;
      this.remainingSize = remainingSize;
    }

    /** Returns the number of entries deleted by the age sweep. */
    public int agedOut() {
      return agedOut;
    }

    /** Returns the number of entries deleted by the size sweep. */
    public int sizedOut() {
      return sizedOut;
    }

    public long remainingSize() {
      return remainingSize;
    }

    @Override
    public String toString() {
      return "EvictionReport{agedOut="
          + agedOut
          + ", sizedOut="
          + sizedOut
          + ", remainingSize="
          + remainingSize
          + "}";
    }
  }

  public static final class Builder {
    private @MonotonicNonNull Path directory;
    private @MonotonicNonNull String namespace;
    private @MonotonicNonNull KeyHasher hasher;
    private @MonotonicNonNull Clock clock;

    Builder() {}

    /** Sets the directory under which the store's namespaced directory is created. */
    @CanIgnoreReturnValue
    public Builder directory(Path directory) {
      this.directory = requireNonNull(directory);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder namespace(String namespace) {
      requireArgument(
          !namespace.isEmpty() && namespace.indexOf('/') < 0 && namespace.indexOf('\\') < 0,
          "illegal namespace: '%s'",
          namespace);
      this.namespace = namespace;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder hasher(KeyHasher hasher) {
      this.hasher = requireNonNull(hasher);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder clock(Clock clock) {
      this.clock = requireNonNull(clock);
      return this;
    }

    public DiskStore build() {
      return new DiskStore(this);
    }

    Path directory() {
      var directory = this.directory;
      requireState(directory != null, "expected directory to be set");
      return directory;
    }

    String namespace() {
      return requireNonNullElse(namespace, DEFAULT_NAMESPACE);
    }

    KeyHasher hasher() {
      return requireNonNullElse(hasher, KeyHasher.md5());
    }

    Clock clock() {
      return requireNonNullElse(clock, Utils.systemMillisUtc());
    }
  }
}
