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

import static com.github.mizosoft.imagine.testing.TestUtils.await;
import static com.github.mizosoft.imagine.testing.TestUtils.string;
import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.PasswordAuthentication;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import mockwebserver3.MockResponse;
import mockwebserver3.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpClientTransportTest {
  private MockWebServer server;
  private HttpClientTransport transport;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    transport = HttpClientTransport.create();
  }

  @AfterEach
  void tearDown() throws IOException {
    server.close();
  }

  private URI uri(String path) {
    return server.url(path).uri();
  }

  @Test
  void successfulResponse() throws Exception {
    server.enqueue(new MockResponse.Builder().body("Pikachu").build());
    var listener = new CollectingListener();
    transport.start(TransportRequest.newBuilder(uri("/a.png")).build(), listener);

    assertThat(await(listener.completion)).isEqualTo("Pikachu");
    assertThat(listener.statusCode).isEqualTo(200);
    assertThat(listener.expectedLength).isEqualTo(7);
    assertThat(listener.responseCount.get()).isOne();
  }

  @Test
  void errorStatusIsReported() {
    server.enqueue(new MockResponse.Builder().code(404).body("Not Found").build());
    var listener = new CollectingListener();
    transport.start(TransportRequest.newBuilder(uri("/a.png")).build(), listener);
    await(listener.completion);
    assertThat(listener.statusCode).isEqualTo(404);
  }

  @Test
  void headersAreSent() throws Exception {
    server.enqueue(new MockResponse.Builder().body("Pikachu").build());
    var request =
        TransportRequest.newBuilder(uri("/a.png"))
            .header("Accept", "image/png")
            .header("X-Client", "imagine")
            .build();
    var listener = new CollectingListener();
    transport.start(request, listener);
    await(listener.completion);

    var sentRequest = server.takeRequest(5, TimeUnit.SECONDS);
    assertThat(sentRequest).isNotNull();
    assertThat(sentRequest.getHeaders().get("Accept")).isEqualTo("image/png");
    assertThat(sentRequest.getHeaders().get("X-Client")).isEqualTo("imagine");
    assertThat(sentRequest.getHeaders().get("Cache-Control")).isNull();
  }

  @Test
  void reloadPolicyAsksForRevalidation() throws Exception {
    server.enqueue(new MockResponse.Builder().code(304).build());
    var request =
        TransportRequest.newBuilder(uri("/a.png"))
            .cachePolicy(TransportRequest.CachePolicy.RELOAD_IGNORING_CACHE)
            .build();
    var listener = new CollectingListener();
    transport.start(request, listener);
    await(listener.completion);
    assertThat(listener.statusCode).isEqualTo(304);

    var sentRequest = server.takeRequest(5, TimeUnit.SECONDS);
    assertThat(sentRequest).isNotNull();
    assertThat(sentRequest.getHeaders().get("Cache-Control")).isEqualTo("no-cache");
  }

  @Test
  void credentialsAreSentAsBasicAuthorization() throws Exception {
    server.enqueue(new MockResponse.Builder().body("Pikachu").build());
    var request =
        TransportRequest.newBuilder(uri("/a.png"))
            .credentials(new PasswordAuthentication("ash", "pallet".toCharArray()))
            .build();
    var listener = new CollectingListener();
    transport.start(request, listener);
    await(listener.completion);

    var sentRequest = server.takeRequest(5, TimeUnit.SECONDS);
    assertThat(sentRequest).isNotNull();
    assertThat(sentRequest.getHeaders().get("Authorization"))
        .isEqualTo("Basic " + Base64.getEncoder().encodeToString("ash:pallet".getBytes()));
  }

  @Test
  void connectionFailureIsReported() throws IOException {
    URI unreachable;
    try (var socket = new ServerSocket(0)) {
      unreachable = URI.create("http://localhost:" + socket.getLocalPort() + "/a.png");
    }
    var listener = new CollectingListener();
    transport.start(
        TransportRequest.newBuilder(unreachable).timeout(Duration.ofSeconds(2)).build(), listener);
    assertThat(listener.completion)
        .failsWithin(Duration.ofSeconds(5))
        .withThrowableOfType(Exception.class)
        .withCauseInstanceOf(IOException.class);
  }

  @Test
  void canceledCallReportsNoMoreEvents() throws Exception {
    server.enqueue(new MockResponse.Builder().body("Pikachu").build());
    var listener = new CollectingListener();
    var call = transport.start(TransportRequest.newBuilder(uri("/a.png")).build(), listener);
    call.cancel();
    call.cancel();

    // Give the exchange a chance to run.
    server.takeRequest(1, TimeUnit.SECONDS);
    Thread.sleep(100);
    assertThat(listener.completion).isNotDone();
  }

  @Test
  void separateClientsForClientWideSettings() {
    var plain = TransportRequest.newBuilder(uri("/a.png")).build();
    var cookies = TransportRequest.newBuilder(uri("/a.png")).handleCookies(true).build();
    var insecure = TransportRequest.newBuilder(uri("/a.png")).trustAllCertificates(true).build();
    assertThat(transport.clientFor(plain)).isSameAs(transport.clientFor(plain));
    assertThat(transport.clientFor(cookies)).isNotSameAs(transport.clientFor(plain));
    assertThat(transport.clientFor(insecure))
        .isNotSameAs(transport.clientFor(plain))
        .isNotSameAs(transport.clientFor(cookies));
  }

  /** Collects the body & completes a future when the call completes. */
  private static final class CollectingListener implements Transport.Listener {
    final CompletableFuture<String> completion = new CompletableFuture<>();
    final AtomicInteger responseCount = new AtomicInteger();
    final ByteArrayOutputStream body = new ByteArrayOutputStream();
    volatile int statusCode = -1;
    volatile long expectedLength = -1;

    CollectingListener() {}

    @Override
    public void onResponse(int statusCode, long expectedLength) {
      responseCount.incrementAndGet();
      this.statusCode = statusCode;
      this.expectedLength = expectedLength;
    }

    @Override
    public void onData(ByteBuffer chunk) {
      var bytes = new byte[chunk.remaining()];
      chunk.get(bytes);
      synchronized (body) {
        body.write(bytes, 0, bytes.length);
      }
    }

    @Override
    public void onComplete() {
      synchronized (body) {
        completion.complete(string(body.toByteArray()));
      }
    }

    @Override
    public void onError(Throwable error) {
      completion.completeExceptionally(error);
    }
  }
}
