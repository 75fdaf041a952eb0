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

package com.github.mizosoft.imagine.internal.decoder;

import static com.github.mizosoft.imagine.testing.TestUtils.bytes;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIOException;

import com.github.mizosoft.imagine.ImageFormat;
import com.github.mizosoft.imagine.internal.decoder.ImageIODecoder.BufferedDecodedImage;
import com.github.mizosoft.imagine.testing.StubDecoder.StubImage;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class ImageIODecoderTest {
  private final ImageIODecoder decoder = ImageIODecoder.instance();

  private static BufferedDecodedImage image(int width, int height) {
    return new BufferedDecodedImage(new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB));
  }

  @Test
  void encodeThenDecodePng() throws IOException {
    var png = decoder.encode(image(3, 2), ImageFormat.PNG);
    assertThat(ImageFormat.sniff(png)).isEqualTo(ImageFormat.PNG);

    var decoded = decoder.decode(png);
    assertThat(decoded.width()).isEqualTo(3);
    assertThat(decoded.height()).isEqualTo(2);
    assertThat(decoded.cost()).isEqualTo(6);
  }

  @Test
  void measureCostReadsDimensions() throws IOException {
    var png = decoder.encode(image(3, 2), ImageFormat.PNG);
    assertThat(decoder.measureCost(png)).isEqualTo(6);
    assertThatIOException().isThrownBy(() -> decoder.measureCost(bytes("not an image")));
  }

  @Test
  void undefinedFormatFallsBackToPng() throws IOException {
    var encoded = decoder.encode(image(1, 1), ImageFormat.UNDEFINED);
    assertThat(ImageFormat.sniff(encoded)).isEqualTo(ImageFormat.PNG);
  }

  @Test
  void garbageIsRejected() {
    assertThatIOException().isThrownBy(() -> decoder.decode(bytes("not an image")));
    assertThat(decoder.decodeIncrementally(bytes("not an image"), false)).isEmpty();
  }

  @Test
  void truncatedImageIsNotDecodedIncrementally() throws IOException {
    var png = decoder.encode(image(4, 4), ImageFormat.PNG);
    assertThat(decoder.decodeIncrementally(Arrays.copyOf(png, 8), false)).isEmpty();
    assertThat(decoder.decodeIncrementally(png, true)).isPresent();
  }

  @Test
  void foreignImagesCannotBeEncoded() {
    assertThatIOException().isThrownBy(() -> decoder.encode(new StubImage(1, 1), ImageFormat.PNG));
  }
}
