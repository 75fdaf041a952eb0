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

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.imagine.internal.Utils;
import java.lang.System.Logger;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * A hub for process lifecycle signals. The host application, which knows where these signals come
 * from (e.g. a platform's low-memory callback), notifies a {@code Lifecycle}; caches and
 * downloaders subscribe to the ones they react to.
 *
 * <ul>
 *   <li>{@link #notifyMemoryPressure()} makes caches drop their memory tier.
 *   <li>{@link #notifySuspending()} tells downloaders the process is about to be suspended.
 *       Downloads not allowed to continue in background are canceled.
 *   <li>{@link #notifyBackgroundTimeExpired()} tells downloaders the time budget granted for
 *       background work is over. Remaining downloads are canceled.
 *   <li>{@link #notifyResumed()} tells subscribers the process is back in foreground.
 * </ul>
 */
public final class Lifecycle {
  private static final Logger logger = System.getLogger(Lifecycle.class.getName());

  private final List<Listener> listeners = new CopyOnWriteArrayList<>();

  public Lifecycle() {}

  /** Subscribes the given listener, returning a subscription that unsubscribes it when closed. */
  public Subscription subscribe(Listener listener) {
    requireNonNull(listener);
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }

  public void notifyMemoryPressure() {
    dispatch(Listener::onMemoryPressure, "onMemoryPressure");
  }

  public void notifySuspending() {
    dispatch(Listener::onSuspending, "onSuspending");
  }

  public void notifyBackgroundTimeExpired() {
    dispatch(Listener::onBackgroundTimeExpired, "onBackgroundTimeExpired");
  }

  public void notifyResumed() {
    dispatch(Listener::onResumed, "onResumed");
  }

  int listenerCount() {
    return listeners.size();
  }

  private void dispatch(Consumer<Listener> signal, String signalName) {
    for (var listener : listeners) {
      Utils.runSafely(() -> signal.accept(listener), logger, () -> listener + "::" + signalName);
    }
  }

  /** A listener to lifecycle signals. All methods do nothing by default. */
  public interface Listener {
    default void onMemoryPressure() {}

    default void onSuspending() {}

    default void onBackgroundTimeExpired() {}

    default void onResumed() {}
  }

  /** A handle to a listener's subscription. */
  @FunctionalInterface
  public interface Subscription extends AutoCloseable {
    @Override
    void close();
  }
}
