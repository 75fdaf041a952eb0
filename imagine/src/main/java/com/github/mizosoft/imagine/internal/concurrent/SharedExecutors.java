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

package com.github.mizosoft.imagine.internal.concurrent;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Daemon executors shared by components that aren't given one explicitly. */
public class SharedExecutors {
  private static final AtomicInteger nextThreadId = new AtomicInteger();

  private SharedExecutors() {}

  /** Executor for network callbacks, decoding & other background work. */
  public static ExecutorService workerExecutor() {
    return WorkerExecutorHolder.INSTANCE;
  }

  /** Executor backing the serial disk context of caches. */
  public static ExecutorService ioExecutor() {
    return IoExecutorHolder.INSTANCE;
  }

  private static ThreadFactory newThreadFactory(String namePrefix) {
    return r -> {
      var thread = new Thread(r);
      thread.setName(namePrefix + nextThreadId.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    };
  }

  private static final class WorkerExecutorHolder {
    static final ExecutorService INSTANCE =
        Executors.newCachedThreadPool(newThreadFactory("imagine-worker-"));
  }

  private static final class IoExecutorHolder {
    static final ExecutorService INSTANCE =
        Executors.newCachedThreadPool(newThreadFactory("imagine-io-"));
  }
}
