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

package com.github.mizosoft.imagine.internal.download;

import static com.github.mizosoft.imagine.internal.Validate.requirePositive;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.imagine.ExecutionOrder;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Admits units of work into a bounded number of running slots. A unit is represented by a {@link
 * Ticket} that occupies a slot from the moment its task is dispatched till it's {@link
 * #finish(Ticket) finished}, so the bound holds for work that completes asynchronously. Pending
 * tickets are dispatched by priority first, then by the queue's {@link ExecutionOrder} within the
 * same priority.
 */
public final class DownloadQueue {
  private static final Logger logger = System.getLogger(DownloadQueue.class.getName());

  /** A ticket's position relative to other pending tickets. */
  public enum Priority {
    HIGH,
    NORMAL,
    LOW
  }

  private enum State {
    NEW,
    PENDING,
    RUNNING,
    FINISHED
  }

  private final Executor executor;
  private final ReentrantLock lock = new ReentrantLock();

  @GuardedBy("lock")
  private final Map<Priority, Deque<Ticket>> pending = new EnumMap<>(Priority.class);

  @GuardedBy("lock")
  private ExecutionOrder order;

  @GuardedBy("lock")
  private int maxRunning;

  @GuardedBy("lock")
  private int running;

  @GuardedBy("lock")
  private boolean suspended;

  public DownloadQueue(Executor executor, int maxRunning, ExecutionOrder order) {
    this.executor = requireNonNull(executor);
    this.maxRunning = requirePositive(maxRunning, "maxRunning");
    this.order = requireNonNull(order);
    for (var priority : Priority.values()) {
      pending.put(priority, new ArrayDeque<>());
    }
  }

  /**
   * Creates a ticket for the given task without queueing it. {@code onRejection} is called instead
   * of the task if the executor refuses to run it.
   */
  public Ticket newTicket(Runnable task, Consumer<Throwable> onRejection, Priority priority) {
    return new Ticket(task, onRejection, priority);
  }

  /** Queues the given ticket. Tickets finished before they're submitted are ignored. */
  public void submit(Ticket ticket) {
    lock.lock();
    try {
      if (ticket.state != State.NEW) {
        return;
      }
      ticket.state = State.PENDING;
      pending.get(ticket.priority).addLast(ticket);
    } finally {
      lock.unlock();
    }
    dispatch();
  }

  /**
   * Marks the given ticket as finished, releasing its slot if it's running or dropping it if it's
   * still pending. Finishing a ticket more than once has no effect.
   */
  public void finish(Ticket ticket) {
    lock.lock();
    try {
      switch (ticket.state) {
        case PENDING:
          pending.get(ticket.priority).remove(ticket);
          break;
        case RUNNING:
          running--;
          break;
        default:
          break;
      }
      ticket.state = State.FINISHED;
    } finally {
      lock.unlock();
    }
    dispatch();
  }

  public void setMaxRunning(int maxRunning) {
    requirePositive(maxRunning, "maxRunning");
    lock.lock();
    try {
      this.maxRunning = maxRunning;
    } finally {
      lock.unlock();
    }
    dispatch();
  }

  public int maxRunning() {
    lock.lock();
    try {
      return maxRunning;
    } finally {
      lock.unlock();
    }
  }

  public void setExecutionOrder(ExecutionOrder order) {
    requireNonNull(order);
    lock.lock();
    try {
      this.order = order;
    } finally {
      lock.unlock();
    }
  }

  public ExecutionOrder executionOrder() {
    lock.lock();
    try {
      return order;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stops or resumes dispatching pending tickets. Running tickets are not affected by suspension.
   */
  public void setSuspended(boolean suspended) {
    lock.lock();
    try {
      this.suspended = suspended;
    } finally {
      lock.unlock();
    }
    if (!suspended) {
      dispatch();
    }
  }

  public boolean isSuspended() {
    lock.lock();
    try {
      return suspended;
    } finally {
      lock.unlock();
    }
  }

  public int runningCount() {
    lock.lock();
    try {
      return running;
    } finally {
      lock.unlock();
    }
  }

  public int pendingCount() {
    lock.lock();
    try {
      return pending.values().stream().mapToInt(Deque::size).sum();
    } finally {
      lock.unlock();
    }
  }

  private void dispatch() {
    var dispatched = new ArrayList<Ticket>();
    lock.lock();
    try {
      Ticket ticket;
      while (!suspended && running < maxRunning && (ticket = pollNext()) != null) {
        ticket.state = State.RUNNING;
        running++;
        dispatched.add(ticket);
      }
    } finally {
      lock.unlock();
    }
    runAll(dispatched);
  }

  @GuardedBy("lock")
  private @Nullable Ticket pollNext() {
    for (var queue : pending.values()) { // EnumMap iterates in priority order.
      var ticket = order == ExecutionOrder.FIFO ? queue.pollFirst() : queue.pollLast();
      if (ticket != null) {
        return ticket;
      }
    }
    return null;
  }

  private void runAll(List<Ticket> tickets) {
    for (var ticket : tickets) {
      try {
        executor.execute(ticket.task);
      } catch (RejectedExecutionException e) {
        logger.log(Level.WARNING, "Executor rejected a queued download", e);
        finish(ticket);
        ticket.onRejection.accept(e);
      }
    }
  }

  @Override
  public String toString() {
    lock.lock();
    try {
      return "DownloadQueue{running="
          + running
          + ", maxRunning="
          + maxRunning
          + ", order="
          + order
          + ", suspended="
          + suspended
          + "}";
    } finally {
      lock.unlock();
    }
  }

  /** A unit of work admitted through a {@code DownloadQueue}. */
  public static final class Ticket {
    final Runnable task;
    final Consumer<Throwable> onRejection;
    final Priority priority;

    /** Guarded by the owning queue's lock. */
    State state = State.NEW;

    Ticket(Runnable task, Consumer<Throwable> onRejection, Priority priority) {
      this.task = requireNonNull(task);
      this.onRejection = requireNonNull(onRejection);
      this.priority = requireNonNull(priority);
    }

    public Priority priority() {
      return priority;
    }
  }
}
