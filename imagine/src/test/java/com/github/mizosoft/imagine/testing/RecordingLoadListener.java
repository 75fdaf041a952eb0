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

package com.github.mizosoft.imagine.testing;

import com.github.mizosoft.imagine.ImageLoadException;
import com.github.mizosoft.imagine.LoadListener;
import com.github.mizosoft.imagine.LoadResult;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** A {@link LoadListener} that records what it receives. */
public final class RecordingLoadListener implements LoadListener {
  private final List<long[]> progress = new CopyOnWriteArrayList<>();
  private final List<LoadResult> results = new CopyOnWriteArrayList<>();
  private final List<ImageLoadException> errors = new CopyOnWriteArrayList<>();

  public RecordingLoadListener() {}

  @Override
  public void onProgress(long receivedBytes, long expectedBytes) {
    progress.add(new long[] {receivedBytes, expectedBytes});
  }

  @Override
  public void onResult(LoadResult result) {
    results.add(result);
  }

  @Override
  public void onError(ImageLoadException exception) {
    errors.add(exception);
  }

  /** Returns received progress events as {@code [receivedBytes, expectedBytes]} pairs. */
  public List<long[]> progress() {
    return List.copyOf(progress);
  }

  public List<LoadResult> results() {
    return List.copyOf(results);
  }

  public List<ImageLoadException> errors() {
    return List.copyOf(errors);
  }
}
