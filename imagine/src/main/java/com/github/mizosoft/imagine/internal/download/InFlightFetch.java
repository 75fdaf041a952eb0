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

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.imagine.DownloadListener;
import com.github.mizosoft.imagine.DownloadToken;
import com.github.mizosoft.imagine.Transport;
import com.github.mizosoft.imagine.TransportRequest;
import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The state of an ongoing network transfer shared by all subscribers of a key. The fetch lives as
 * long as it has subscribers and hasn't completed.
 *
 * <p>Subscriber bookkeeping & the done flag are guarded by the owning downloader's registry lock.
 * The body buffer is only touched by the transport's listener, whose events are never concurrent.
 */
public final class InFlightFetch {
  private final String key;
  private final TransportRequest request;
  private final Map<DownloadToken, Subscriber> subscribers = new LinkedHashMap<>();
  private final ByteArrayOutputStream body = new ByteArrayOutputStream();

  private DownloadQueue.@MonotonicNonNull Ticket ticket;
  private Transport.@Nullable Call call;
  private volatile boolean done;
  private volatile long expectedBytes = -1;

  public InFlightFetch(String key, TransportRequest request) {
    this.key = requireNonNull(key);
    this.request = requireNonNull(request);
  }

  public String key() {
    return key;
  }

  public TransportRequest request() {
    return request;
  }

  public void setTicket(DownloadQueue.Ticket ticket) {
    this.ticket = requireNonNull(ticket);
  }

  public DownloadQueue.Ticket ticket() {
    var ticket = this.ticket;
    if (ticket == null) {
      throw new IllegalStateException("ticket not set");
    }
    return ticket;
  }

  /**
   * Sets the transport call carrying out this fetch. Returns {@code false} if the fetch is already
   * done, in which case the caller is responsible for canceling the call.
   */
  public boolean setCall(Transport.Call call) {
    requireNonNull(call);
    if (done) {
      return false;
    }
    this.call = call;
    return true;
  }

  public Transport.@Nullable Call call() {
    return call;
  }

  public void addSubscriber(Subscriber subscriber) {
    subscribers.put(subscriber.token(), subscriber);
  }

  public @Nullable Subscriber removeSubscriber(DownloadToken token) {
    return subscribers.remove(token);
  }

  public boolean hasSubscribers() {
    return !subscribers.isEmpty();
  }

  public int subscriberCount() {
    return subscribers.size();
  }

  /** Returns a snapshot of current subscribers in subscription order. */
  public List<Subscriber> subscribers() {
    return new ArrayList<>(subscribers.values());
  }

  /** Removes & returns all subscribers. */
  public List<Subscriber> drainSubscribers() {
    var drained = new ArrayList<>(subscribers.values());
    subscribers.clear();
    return drained;
  }

  /** Returns {@code true} if any subscriber wants progressive results. */
  public boolean isProgressive() {
    return subscribers.values().stream().anyMatch(Subscriber::progressive);
  }

  /** Returns {@code true} if any subscriber allows the fetch to go on in background. */
  public boolean continuesInBackground() {
    return subscribers.values().stream().anyMatch(Subscriber::continueInBackground);
  }

  /** Marks this fetch as done, returning {@code false} if it already was. */
  public boolean markDone() {
    if (done) {
      return false;
    }
    done = true;
    return true;
  }

  public boolean isDone() {
    return done;
  }

  public void setExpectedBytes(long expectedBytes) {
    this.expectedBytes = expectedBytes;
  }

  public long expectedBytes() {
    return expectedBytes;
  }

  public void append(ByteBuffer chunk) {
    if (chunk.hasArray()) {
      body.write(chunk.array(), chunk.arrayOffset() + chunk.position(), chunk.remaining());
      chunk.position(chunk.limit());
    } else {
      var bytes = new byte[chunk.remaining()];
      chunk.get(bytes);
      body.write(bytes, 0, bytes.length);
    }
  }

  public long receivedBytes() {
    return body.size();
  }

  public byte[] data() {
    return body.toByteArray();
  }

  @Override
  public String toString() {
    return "InFlightFetch{key=" + key + ", uri=" + request.uri() + ", done=" + done + "}";
  }

  /** A party interested in a fetch's outcome. */
  public static final class Subscriber {
    private final DownloadToken token;
    private final DownloadListener listener;
    private final boolean progressive;
    private final boolean continueInBackground;

    public Subscriber(
        DownloadToken token,
        DownloadListener listener,
        boolean progressive,
        boolean continueInBackground) {
      this.token = requireNonNull(token);
      this.listener = requireNonNull(listener);
      this.progressive = progressive;
      this.continueInBackground = continueInBackground;
    }

    public DownloadToken token() {
      return token;
    }

    public DownloadListener listener() {
      return listener;
    }

    public boolean progressive() {
      return progressive;
    }

    public boolean continueInBackground() {
      return continueInBackground;
    }
  }
}
