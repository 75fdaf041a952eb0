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

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.imagine.internal.Utils;
import com.github.mizosoft.imagine.internal.function.ThrowingRunnable;
import com.github.mizosoft.imagine.internal.function.ThrowingSupplier;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An executor that runs submitted tasks one at a time, in submission order, on top of a possibly
 * concurrent delegate. This is the sequential context all disk IO is funneled through.
 */
public final class SerialExecutor implements Executor {
  /** Drain task started or about to start execution. Retained till drain exits. */
  private static final int RUNNING = 1;

  /** Drain task should keep running to recheck for incoming tasks it may have missed. */
  private static final int KEEP_ALIVE = 2;

  /** Don't accept more tasks. */
  private static final int SHUTDOWN = 4;

  private static final VarHandle SYNC;
  private static final VarHandle DRAINER;

  static {
    try {
      var lookup = MethodHandles.lookup();
      SYNC = lookup.findVarHandle(SerialExecutor.class, "sync", int.class);
      DRAINER = lookup.findVarHandle(SerialExecutor.class, "drainer", Thread.class);
    } catch (NoSuchFieldException | IllegalAccessException e) {
      throw new ExceptionInInitializerError(e);
    }
  }

  private final ConcurrentLinkedQueue<Runnable> taskQueue = new ConcurrentLinkedQueue<>();
  private final Executor delegate;

  @SuppressWarnings("unused") // VarHandle indirection.
  private volatile int sync;

  /** The thread currently draining the queue, if any. */
  @SuppressWarnings("unused") // VarHandle indirection.
  private volatile @Nullable Thread drainer;

  public SerialExecutor(Executor delegate) {
    this.delegate = requireNonNull(delegate);
  }

  @Override
  public void execute(Runnable task) {
    if (isShutdownBitSet()) {
      throw new RejectedExecutionException("shutdown");
    }

    var taskWithIdentity = new IdentifiedTask(task);
    taskQueue.add(taskWithIdentity);
    while (true) {
      int s = sync;

      // A drain that's been told to recheck will surely see the new task.
      if ((s & KEEP_ALIVE) != 0) {
        return;
      }

      if ((s & RUNNING) == 0) {
        if (SYNC.compareAndSet(this, s, s | RUNNING)) {
          startDrain(taskWithIdentity);
          return;
        }
      } else if (SYNC.compareAndSet(this, s, s | KEEP_ALIVE)) {
        return;
      }
    }
  }

  /**
   * Submits the given computation to run serially, returning a future for its result. The future
   * completes exceptionally if the computation throws.
   */
  public <T> CompletableFuture<T> submit(ThrowingSupplier<T> computation) {
    requireNonNull(computation);
    var future = new CompletableFuture<T>();
    execute(
        () -> {
          try {
            future.complete(computation.get());
          } catch (Throwable t) {
            future.completeExceptionally(t);
          }
        });
    return future;
  }

  public CompletableFuture<Void> runAsync(ThrowingRunnable action) {
    return submit(action.toSupplier());
  }

  /**
   * Runs the given computation serially and waits for its result. If called from within a task
   * that's being run by this executor, the computation is run directly as the caller already owns
   * the sequential context.
   */
  public <T> T await(ThrowingSupplier<T> computation) throws Exception {
    if (inContext()) {
      return computation.get();
    }
    try {
      return submit(computation).join();
    } catch (RuntimeException e) {
      var cause = Utils.getDeepCompletionCause(e);
      if (cause instanceof Exception) {
        throw (Exception) cause;
      } else if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw e;
    }
  }

  /** Returns {@code true} if the current thread is running a task submitted to this executor. */
  public boolean inContext() {
    return DRAINER.getVolatile(this) == Thread.currentThread();
  }

  public void shutdown() {
    SYNC.getAndBitwiseOr(this, SHUTDOWN);
  }

  private void startDrain(IdentifiedTask task) {
    try {
      delegate.execute(this::drain);
    } catch (RuntimeException | Error e) {
      SYNC.getAndBitwiseAnd(this, ~(RUNNING | KEEP_ALIVE));
      if (!(e instanceof RejectedExecutionException) || taskQueue.remove(task)) {
        throw e;
      }
    }
  }

  private void drain() {
    DRAINER.setVolatile(this, Thread.currentThread());
    try {
      drainQueue();
    } finally {
      DRAINER.setVolatile(this, null);
    }
  }

  private void drainQueue() {
    boolean interrupted = false;
    while (true) {
      Runnable task;
      while ((task = taskQueue.poll()) != null) {
        try {
          interrupted |= Thread.interrupted();
          task.run();
        } catch (Throwable t) {
          // Reschedule ourselves asynchronously if there's still work, then rethrow.
          SYNC.getAndBitwiseAnd(this, ~(RUNNING | KEEP_ALIVE));
          if (!taskQueue.isEmpty()) {
            try {
              ForkJoinPool.commonPool().execute(() -> execute(() -> {}));
            } catch (RuntimeException | Error e) {
              t.addSuppressed(e);
            }
          }
          throw t;
        }
      }

      // Exit or consume KEEP_ALIVE bit.
      int s = sync;
      int unsetBit = (s & KEEP_ALIVE) != 0 ? KEEP_ALIVE : RUNNING;
      if (SYNC.weakCompareAndSet(this, s, s & ~unsetBit) && unsetBit == RUNNING) {
        if (interrupted) {
          Thread.currentThread().interrupt();
        }
        return;
      }
    }
  }

  boolean isRunningBitSet() {
    return (sync & RUNNING) != 0;
  }

  boolean isShutdownBitSet() {
    return (sync & SHUTDOWN) != 0;
  }

  @Override
  public String toString() {
    return "SerialExecutor@"
        + Integer.toHexString(hashCode())
        + "{delegate="
        + delegate
        + ", running="
        + isRunningBitSet()
        + ", shutdown="
        + isShutdownBitSet()
        + "}";
  }

  /** Gives each task an identity so a rejected drain removes exactly the task that started it. */
  private static final class IdentifiedTask implements Runnable {
    private final Runnable delegate;

    IdentifiedTask(Runnable delegate) {
      this.delegate = requireNonNull(delegate);
    }

    @Override
    public void run() {
      delegate.run();
    }

    @Override
    public String toString() {
      return delegate.toString();
    }
  }
}
