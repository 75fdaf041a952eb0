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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.net.URI;
import java.net.URISyntaxException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Maps cache keys to filesystem-safe file names. The name is the lowercase hex of the key's
 * digest, followed by the key's path extension if a recognizable one can be derived (e.g. {@code
 * https://example.com/a/b.png?w=1} maps to {@code <hex>.png}).
 */
public final class KeyHasher {
  /** Extensions longer than this aren't considered recognizable. */
  private static final int MAX_EXTENSION_LENGTH = 8;

  private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

  private static final KeyHasher MD5 = new KeyHasher("MD5");

  private final String algorithm;

  private KeyHasher(String algorithm) {
    this.algorithm = requireNonNull(algorithm);
    newDigest(); // Fail early if not available.
  }

  /** Returns the name of the file that stores the given key's entry. */
  public String filenameFor(String key) {
    var hex = digestHex(key);
    var extension = extensionOf(key);
    return extension != null ? hex + "." + extension : hex;
  }

  /** Returns the name a key's entry had before extensions were appended to file names. */
  public String legacyFilenameFor(String key) {
    return digestHex(key);
  }

  public String algorithm() {
    return algorithm;
  }

  private String digestHex(String key) {
    var digest = newDigest().digest(key.getBytes(UTF_8));
    var hex = new char[digest.length << 1];
    for (int i = 0; i < digest.length; i++) {
      hex[i << 1] = HEX_DIGITS[(digest[i] >> 4) & 0xf];
      hex[(i << 1) + 1] = HEX_DIGITS[digest[i] & 0xf];
    }
    return new String(hex);
  }

  private MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance(algorithm);
    } catch (NoSuchAlgorithmException e) {
      throw new UnsupportedOperationException(algorithm + " not available!", e);
    }
  }

  /** Returns the recognizable extension of the key, preferring the path of a URI key. */
  static @Nullable String extensionOf(String key) {
    String path;
    try {
      var uri = new URI(key);
      path = uri.getRawPath() != null ? uri.getRawPath() : key;
    } catch (URISyntaxException e) {
      path = key;
    }

    int lastSlash = path.lastIndexOf('/');
    int lastDot = path.lastIndexOf('.');
    if (lastDot <= lastSlash + 1 || lastDot == path.length() - 1) {
      return null; // No extension, or a dot file.
    }

    var extension = path.substring(lastDot + 1);
    return isRecognizable(extension) ? extension : null;
  }

  private static boolean isRecognizable(String extension) {
    if (extension.length() > MAX_EXTENSION_LENGTH) {
      return false;
    }
    for (int i = 0; i < extension.length(); i++) {
      char c = extension.charAt(i);
      if (!((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9'))) {
        return false;
      }
    }
    return true;
  }

  /** Returns a hasher using the 128-bit MD5 digest of the key's UTF-8 bytes. */
  public static KeyHasher md5() {
    return MD5;
  }

  public static KeyHasher of(String digestAlgorithm) {
    return new KeyHasher(digestAlgorithm);
  }

  @Override
  public String toString() {
    return "KeyHasher{" + algorithm + "}";
  }
}
