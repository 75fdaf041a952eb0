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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class KeyHasherTest {
  private final KeyHasher hasher = KeyHasher.md5();

  @Test
  void digestIsLowercaseHexOfMd5() {
    assertThat(hasher.filenameFor("hello")).isEqualTo("5d41402abc4b2a76b9719d911017c592");
    assertThat(hasher.filenameFor("")).isEqualTo("d41d8cd98f00b204e9800998ecf8427e");
  }

  @Test
  void filenameIsStable() {
    var key = "https://example.com/images/cat.jpg";
    assertThat(hasher.filenameFor(key))
        .isEqualTo(hasher.filenameFor(key))
        .isEqualTo(KeyHasher.of("MD5").filenameFor(key));
  }

  @Test
  void distinctKeysMapToDistinctFilenames() {
    assertThat(hasher.filenameFor("https://example.com/a.png"))
        .isNotEqualTo(hasher.filenameFor("https://example.com/b.png"));
  }

  @Test
  void extensionIsAppendedToDigest() {
    var filename = hasher.filenameFor("https://example.com/a/b.png?w=100");
    assertThat(filename)
        .endsWith(".png")
        .startsWith(hasher.legacyFilenameFor("https://example.com/a/b.png?w=100"));
    assertThat(filename).hasSize(32 + ".png".length());
  }

  @Test
  void legacyFilenameHasNoExtension() {
    assertThat(hasher.legacyFilenameFor("https://example.com/b.gif"))
        .hasSize(32)
        .doesNotContain(".");
  }

  @ParameterizedTest
  @CsvSource({
    "https://example.com/a.png, png",
    "https://example.com/a.JPEG?x=y, JPEG",
    "https://example.com/a.tar.gz, gz",
    "photo.webp, webp",
  })
  void recognizableExtensions(String key, String extension) {
    assertThat(KeyHasher.extensionOf(key)).isEqualTo(extension);
  }

  @ParameterizedTest
  @CsvSource({
    "https://example.com/image",
    "https://example.com/.hidden",
    "https://example.com/a.averyverylongextension",
    "https://example.com/dir.d/image",
    "https://example.com/a.",
    "https://example.com/a.p-g",
  })
  void unrecognizableExtensions(String key) {
    assertThat(KeyHasher.extensionOf(key)).isNull();
    assertThat(KeyHasher.md5().filenameFor(key)).hasSize(32);
  }

  @Test
  void unknownAlgorithm() {
    assertThatThrownBy(() -> KeyHasher.of("NOT-A-DIGEST"))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
