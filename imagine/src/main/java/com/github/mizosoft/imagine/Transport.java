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

import java.nio.ByteBuffer;

/**
 * Carries out network requests for an {@link ImageDownloader}. A transport reports a request's
 * progress to a {@link Listener}: one {@link Listener#onResponse(int, long) response} event, zero
 * or more {@link Listener#onData(ByteBuffer) data} events, then exactly one of {@link
 * Listener#onComplete()} or {@link Listener#onError(Throwable)}, unless the call is canceled first.
 *
 * @see HttpClientTransport
 */
@FunctionalInterface
public interface Transport {

  /** Starts the given request, reporting its events to the given listener. */
  Call start(TransportRequest request, Listener listener);

  /** An ongoing request. */
  @FunctionalInterface
  interface Call {

    /**
     * Cancels the request. After this method returns, no more events are reported to the call's
     * listener.
     */
    void cancel();
  }

  /** A listener to the events of a call. A call never reports events concurrently. */
  interface Listener {

    /** Called when the response's status line & headers are received. */
    void onResponse(int statusCode, long expectedLength);

    /** Called with a chunk of the response body. The buffer may be reused after this returns. */
    void onData(ByteBuffer chunk);

    /** Called when the response body has been completely received. */
    void onComplete();

    /** Called when the request fails. */
    void onError(Throwable error);
  }
}
