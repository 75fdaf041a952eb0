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

import static com.github.mizosoft.imagine.testing.TestUtils.bytes;
import static com.github.mizosoft.imagine.testing.TestUtils.uri;
import static org.assertj.core.api.Assertions.assertThat;

import com.github.mizosoft.imagine.ImageLoadException.Kind;
import com.github.mizosoft.imagine.TransportRequest.CachePolicy;
import com.github.mizosoft.imagine.internal.download.DownloadQueue;
import com.github.mizosoft.imagine.testing.Logging;
import com.github.mizosoft.imagine.testing.MockExecutor;
import com.github.mizosoft.imagine.testing.RecordingDownloadListener;
import com.github.mizosoft.imagine.testing.RecordingTransport;
import com.github.mizosoft.imagine.testing.StubDecoder;
import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ImageDownloaderTest {
  private RecordingTransport transport;
  private StubDecoder decoder;
  private ImageDownloader downloader;

  @BeforeAll
  static void disableLogging() {
    Logging.disable(ImageDownloader.class, DownloadQueue.class);
  }

  @BeforeEach
  void setUp() {
    transport = new RecordingTransport();
    decoder = new StubDecoder();
    downloader = newDownloader().build();
  }

  private ImageDownloader.Builder newDownloader() {
    return ImageDownloader.newBuilder()
        .transport(transport)
        .decoder(decoder)
        .executor(Runnable::run);
  }

  @Test
  void successfulDownload() {
    var listener = new RecordingDownloadListener();
    var token = downloader.fetch(uri("a.png"), listener);
    assertThat(token.key()).isEqualTo(uri("a.png").toString());
    assertThat(transport.requestCount()).isOne();
    assertThat(downloader.currentDownloadCount()).isOne();
    assertThat(downloader.runningDownloadCount()).isOne();

    transport.lastCall().succeed(StubDecoder.encoded(4, 3));
    assertThat(listener.results()).singleElement()
        .satisfies(
            result -> {
              assertThat(result.finished()).isTrue();
              assertThat(result.notModified()).isFalse();
              assertThat(result.data()).isEqualTo(StubDecoder.encoded(4, 3));
              assertThat(result.image()).hasValueSatisfying(image -> {
                assertThat(image.width()).isEqualTo(4);
                assertThat(image.height()).isEqualTo(3);
              });
            });
    assertThat(listener.errors()).isEmpty();
    assertThat(downloader.currentDownloadCount()).isZero();
    assertThat(downloader.runningDownloadCount()).isZero();
  }

  @Test
  void concurrentFetchesOfSameKeyShareOneTransfer() {
    var listeners =
        IntStream.range(0, 5).mapToObj(i -> new RecordingDownloadListener()).toList();
    listeners.forEach(listener -> downloader.fetch(uri("a.png"), listener));
    assertThat(transport.requestCount()).isOne();
    assertThat(downloader.currentDownloadCount()).isOne();

    transport.lastCall().succeed(StubDecoder.encoded(1, 1));
    for (var listener : listeners) {
      assertThat(listener.results()).hasSize(1);
      assertThat(listener.terminalEventCount()).isOne();
    }
    assertThat(decoder.decodeCount()).isOne();
  }

  @Test
  void racingFetchesAndCancelsLeaveNoTransferBehind() throws InterruptedException {
    var downloadExecutor = Executors.newFixedThreadPool(4);
    var racingDownloader = newDownloader().executor(downloadExecutor).build();
    int threadCount = 16;
    int roundCount = 50;
    var listeners = new CopyOnWriteArrayList<RecordingDownloadListener>();
    var ready = new CountDownLatch(threadCount);
    var go = new CountDownLatch(1);
    var threads = Executors.newFixedThreadPool(threadCount);
    try {
      for (int i = 0; i < threadCount; i++) {
        threads.execute(
            () -> {
              ready.countDown();
              try {
                go.await();
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
              }
              for (int round = 0; round < roundCount; round++) {
                var listener = new RecordingDownloadListener();
                listeners.add(listener);
                racingDownloader.cancel(racingDownloader.fetch(uri("a.png"), listener));
              }
            });
      }
      ready.await();
      go.countDown();
    } finally {
      threads.shutdown();
      assertThat(threads.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
      downloadExecutor.shutdown();
      assertThat(downloadExecutor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
    }

    assertThat(listeners).hasSize(threadCount * roundCount);
    for (var listener : listeners) {
      assertThat(listener.results()).isEmpty();
      assertThat(listener.errors())
          .singleElement()
          .satisfies(error -> assertThat(error.kind()).isEqualTo(Kind.CANCELED));
    }
    for (var call : transport.calls()) {
      assertThat(call.cancelCount()).isOne();
    }
    assertThat(racingDownloader.currentDownloadCount()).isZero();
    assertThat(racingDownloader.runningDownloadCount()).isZero();
  }

  @Test
  void fetchAfterCompletionStartsNewTransfer() {
    downloader.fetch(uri("a.png"), new RecordingDownloadListener());
    transport.lastCall().succeed(StubDecoder.encoded(1, 1));
    downloader.fetch(uri("a.png"), new RecordingDownloadListener());
    assertThat(transport.requestCount()).isEqualTo(2);
  }

  @Test
  void requestsWithSameKeyCoalesceAcrossUris() {
    downloader.fetch(
        DownloadRequest.newBuilder(uri("a.png?v=1")).key("a").build(),
        new RecordingDownloadListener());
    downloader.fetch(
        DownloadRequest.newBuilder(uri("a.png?v=2")).key("a").build(),
        new RecordingDownloadListener());
    assertThat(transport.requestCount()).isOne();
  }

  @Test
  void cancelingOneSubscriberKeepsTransferGoing() {
    var first = new RecordingDownloadListener();
    var second = new RecordingDownloadListener();
    var firstToken = downloader.fetch(uri("a.png"), first);
    downloader.fetch(uri("a.png"), second);

    assertThat(downloader.cancel(firstToken)).isFalse();
    assertThat(first.errors()).singleElement()
        .extracting(ImageLoadException::kind)
        .isEqualTo(Kind.CANCELED);
    assertThat(transport.lastCall().isCanceled()).isFalse();

    transport.lastCall().succeed(StubDecoder.encoded(1, 1));
    assertThat(second.results()).hasSize(1);
    assertThat(first.results()).isEmpty();
    assertThat(first.terminalEventCount()).isOne();
  }

  @Test
  void cancelingAllSubscribersAbortsTransfer() {
    var tokens =
        IntStream.range(0, 3)
            .mapToObj(i -> downloader.fetch(uri("a.png"), new RecordingDownloadListener()))
            .toList();
    assertThat(downloader.cancel(tokens.get(0))).isFalse();
    assertThat(downloader.cancel(tokens.get(1))).isFalse();
    assertThat(downloader.cancel(tokens.get(2))).isTrue();
    assertThat(transport.lastCall().cancelCount()).isOne();
    assertThat(downloader.currentDownloadCount()).isZero();
    assertThat(downloader.runningDownloadCount()).isZero();
  }

  @Test
  void cancelingTwiceHasNoEffect() {
    var listener = new RecordingDownloadListener();
    var token = downloader.fetch(uri("a.png"), listener);
    assertThat(downloader.cancel(token)).isTrue();
    assertThat(downloader.cancel(token)).isFalse();
    assertThat(listener.errors()).hasSize(1);
  }

  @Test
  void cancelingAfterCompletionHasNoEffect() {
    var listener = new RecordingDownloadListener();
    var token = downloader.fetch(uri("a.png"), listener);
    transport.lastCall().succeed(StubDecoder.encoded(1, 1));
    assertThat(downloader.cancel(token)).isFalse();
    assertThat(listener.errors()).isEmpty();
    assertThat(listener.terminalEventCount()).isOne();
  }

  @Test
  void cancelAll() {
    var first = new RecordingDownloadListener();
    var second = new RecordingDownloadListener();
    downloader.fetch(uri("a.png"), first);
    downloader.fetch(uri("b.png"), second);
    downloader.cancelAll();
    assertThat(first.errors()).singleElement()
        .extracting(ImageLoadException::kind)
        .isEqualTo(Kind.CANCELED);
    assertThat(second.errors()).singleElement()
        .extracting(ImageLoadException::kind)
        .isEqualTo(Kind.CANCELED);
    assertThat(transport.calls()).allSatisfy(call -> assertThat(call.isCanceled()).isTrue());
    assertThat(downloader.currentDownloadCount()).isZero();
  }

  @Test
  void notModifiedResponse() {
    var listener = new RecordingDownloadListener();
    downloader.fetch(
        DownloadRequest.newBuilder(uri("a.png"))
            .option(DownloadOption.IGNORE_CACHED_RESPONSE)
            .build(),
        listener);
    assertThat(transport.lastCall().request().cachePolicy())
        .isEqualTo(CachePolicy.RELOAD_IGNORING_CACHE);

    transport.lastCall().respond(304, 0);
    assertThat(listener.results()).singleElement()
        .satisfies(
            result -> {
              assertThat(result.notModified()).isTrue();
              assertThat(result.finished()).isTrue();
              assertThat(result.data()).isEmpty();
              assertThat(result.image()).isEmpty();
            });
    assertThat(downloader.currentDownloadCount()).isZero();
  }

  @Test
  void defaultCachePolicy() {
    downloader.fetch(uri("a.png"), new RecordingDownloadListener());
    assertThat(transport.lastCall().request().cachePolicy())
        .isEqualTo(CachePolicy.USE_PROTOCOL_CACHE);
  }

  @Test
  void errorStatus() {
    var listener = new RecordingDownloadListener();
    downloader.fetch(uri("a.png"), listener);
    transport.lastCall().respond(404, -1);
    assertThat(listener.errors()).singleElement()
        .satisfies(
            error -> {
              assertThat(error.kind()).isEqualTo(Kind.TRANSPORT_FAILURE);
              assertThat(error.statusCode()).hasValue(404);
            });
    assertThat(transport.lastCall().isCanceled()).isTrue();
  }

  @Test
  void transportError() {
    var listener = new RecordingDownloadListener();
    downloader.fetch(uri("a.png"), listener);
    var cause = new ConnectException("refused");
    transport.lastCall().fail(cause);
    assertThat(listener.errors()).singleElement()
        .satisfies(
            error -> {
              assertThat(error.kind()).isEqualTo(Kind.TRANSPORT_FAILURE);
              assertThat(error.statusCode()).isEmpty();
              assertThat(error).hasCause(cause);
            });
  }

  @Test
  void emptyBodyIsDecodeFailure() {
    var listener = new RecordingDownloadListener();
    downloader.fetch(uri("a.png"), listener);
    transport.lastCall().respond(200, 0).complete();
    assertThat(listener.errors()).singleElement()
        .extracting(ImageLoadException::kind)
        .isEqualTo(Kind.DECODE_FAILURE);
  }

  @Test
  void undecodableBodyIsDecodeFailure() {
    var listener = new RecordingDownloadListener();
    downloader.fetch(uri("a.png"), listener);
    transport.lastCall().succeed(bytes("<html>not an image</html>"));
    assertThat(listener.errors()).singleElement()
        .satisfies(
            error -> {
              assertThat(error.kind()).isEqualTo(Kind.DECODE_FAILURE);
              assertThat(error).hasCauseInstanceOf(IOException.class);
            });
  }

  @Test
  void zeroExtentImageIsDecodeFailure() {
    var listener = new RecordingDownloadListener();
    downloader.fetch(uri("a.png"), listener);
    transport.lastCall().succeed(StubDecoder.encoded(0, 7));
    assertThat(listener.errors()).singleElement()
        .extracting(ImageLoadException::kind)
        .isEqualTo(Kind.DECODE_FAILURE);
  }

  @Test
  void noDecodingDeliversRawBytes() {
    var rawDownloader = newDownloader().noDecoding().build();
    var listener = new RecordingDownloadListener();
    rawDownloader.fetch(uri("a.bin"), listener);
    transport.lastCall().succeed(bytes("whatever"));
    assertThat(listener.results()).singleElement()
        .satisfies(
            result -> {
              assertThat(result.data()).isEqualTo(bytes("whatever"));
              assertThat(result.image()).isEmpty();
            });
    assertThat(decoder.decodeCount()).isZero();
  }

  @Test
  void progressReporting() {
    var listener = new RecordingDownloadListener();
    downloader.fetch(uri("a.png"), listener);
    transport.lastCall()
        .respond(200, 9)
        .data(bytes("img:"))
        .data(bytes("3x3"))
        .data(bytes(";xx"))
        .complete();
    assertThat(listener.receivedBytes()).containsExactly(4L, 7L, 10L);
    assertThat(listener.results()).hasSize(1);
  }

  @Test
  void progressiveDownloadDeliversPartialResults() {
    var progressive = new RecordingDownloadListener();
    var plain = new RecordingDownloadListener();
    downloader.fetch(
        DownloadRequest.newBuilder(uri("a.png")).option(DownloadOption.PROGRESSIVE).build(),
        progressive);
    downloader.fetch(uri("a.png"), plain);

    transport.lastCall().respond(200, 7).data(bytes("im")).data(bytes("g:")).data(bytes("5x5"));
    assertThat(progressive.results()).hasSize(2)
        .allSatisfy(result -> assertThat(result.finished()).isFalse());
    assertThat(plain.results()).isEmpty();

    transport.lastCall().complete();
    assertThat(progressive.results()).hasSize(3);
    assertThat(progressive.results().get(2).finished()).isTrue();
    assertThat(progressive.terminalEventCount()).isOne();
    assertThat(plain.results()).singleElement()
        .satisfies(result -> assertThat(result.finished()).isTrue());
  }

  @Test
  void downloadsAreQueuedBeyondLimit() {
    var limitedDownloader = newDownloader().maxConcurrentDownloads(2).build();
    limitedDownloader.fetch(uri("a.png"), new RecordingDownloadListener());
    limitedDownloader.fetch(uri("b.png"), new RecordingDownloadListener());
    limitedDownloader.fetch(uri("c.png"), new RecordingDownloadListener());
    assertThat(transport.requestCount()).isEqualTo(2);
    assertThat(limitedDownloader.currentDownloadCount()).isEqualTo(3);
    assertThat(limitedDownloader.runningDownloadCount()).isEqualTo(2);

    transport.call(0).succeed(StubDecoder.encoded(1, 1));
    assertThat(transport.requestCount()).isEqualTo(3);
    assertThat(transport.lastCall().request().uri()).isEqualTo(uri("c.png"));
  }

  @Test
  void queuedDownloadsFollowPriorityThenOrder() {
    var limitedDownloader =
        newDownloader().maxConcurrentDownloads(1).executionOrder(ExecutionOrder.LIFO).build();
    limitedDownloader.fetch(uri("first.png"), new RecordingDownloadListener());
    limitedDownloader.fetch(
        DownloadRequest.newBuilder(uri("low.png")).option(DownloadOption.LOW_PRIORITY).build(),
        new RecordingDownloadListener());
    limitedDownloader.fetch(uri("a.png"), new RecordingDownloadListener());
    limitedDownloader.fetch(uri("b.png"), new RecordingDownloadListener());
    limitedDownloader.fetch(
        DownloadRequest.newBuilder(uri("high.png")).option(DownloadOption.HIGH_PRIORITY).build(),
        new RecordingDownloadListener());

    for (int i = 0; i < 5; i++) {
      transport.call(i).succeed(StubDecoder.encoded(1, 1));
    }
    assertThat(transport.calls())
        .extracting(call -> call.request().uri())
        .containsExactly(
            uri("first.png"), uri("high.png"), uri("b.png"), uri("a.png"), uri("low.png"));
  }

  @Test
  void cancelingQueuedDownloadNeverStartsIt() {
    var limitedDownloader = newDownloader().maxConcurrentDownloads(1).build();
    limitedDownloader.fetch(uri("a.png"), new RecordingDownloadListener());
    var listener = new RecordingDownloadListener();
    var token = limitedDownloader.fetch(uri("b.png"), listener);
    assertThat(limitedDownloader.cancel(token)).isTrue();
    assertThat(listener.errors()).hasSize(1);

    transport.call(0).succeed(StubDecoder.encoded(1, 1));
    assertThat(transport.requestCount()).isOne();
  }

  @Test
  void raisingLimitStartsQueuedDownloads() {
    var limitedDownloader = newDownloader().maxConcurrentDownloads(1).build();
    limitedDownloader.fetch(uri("a.png"), new RecordingDownloadListener());
    limitedDownloader.fetch(uri("b.png"), new RecordingDownloadListener());
    assertThat(transport.requestCount()).isOne();

    limitedDownloader.setMaxConcurrentDownloads(2);
    assertThat(limitedDownloader.maxConcurrentDownloads()).isEqualTo(2);
    assertThat(transport.requestCount()).isEqualTo(2);
  }

  @Test
  void suspendedDownloaderQueuesNewDownloads() {
    downloader.setSuspended(true);
    downloader.fetch(uri("a.png"), new RecordingDownloadListener());
    assertThat(transport.requestCount()).isZero();
    assertThat(downloader.currentDownloadCount()).isOne();

    downloader.setSuspended(false);
    assertThat(transport.requestCount()).isOne();
  }

  @Test
  void downloadsStartOnExecutor() {
    var executor = new MockExecutor();
    var executorDownloader = newDownloader().executor(executor).build();
    executorDownloader.fetch(uri("a.png"), new RecordingDownloadListener());
    assertThat(transport.requestCount()).isZero();
    executor.runAll();
    assertThat(transport.requestCount()).isOne();
  }

  @Test
  void cancelingBeforeStartPreventsTransfer() {
    var executor = new MockExecutor();
    var executorDownloader = newDownloader().executor(executor).build();
    var token = executorDownloader.fetch(uri("a.png"), new RecordingDownloadListener());
    executorDownloader.cancel(token);
    executor.runAll();
    assertThat(transport.requestCount()).isZero();
  }

  @Test
  void rejectedDownloadFails() {
    var executor = new MockExecutor();
    executor.reject(true);
    var executorDownloader = newDownloader().executor(executor).build();
    var listener = new RecordingDownloadListener();
    executorDownloader.fetch(uri("a.png"), listener);
    assertThat(listener.errors()).singleElement()
        .extracting(ImageLoadException::kind)
        .isEqualTo(Kind.TRANSPORT_FAILURE);
    assertThat(executorDownloader.currentDownloadCount()).isZero();
  }

  @Test
  void defaultHeaders() {
    var headerDownloader = newDownloader().header("X-Client", "imagine").build();
    headerDownloader.fetch(
        DownloadRequest.newBuilder(uri("a.png")).header("X-Request", "1").build(),
        new RecordingDownloadListener());
    assertThat(transport.lastCall().request().headers())
        .containsEntry("Accept", ImageDownloader.DEFAULT_ACCEPT)
        .containsEntry("X-Client", "imagine")
        .containsEntry("X-Request", "1");
  }

  @Test
  void settingAndRemovingHeaders() {
    downloader.setHeader("Accept", "image/png");
    downloader.setHeader("X-Token", "abc");
    assertThat(downloader.headers())
        .containsEntry("Accept", "image/png")
        .containsEntry("X-Token", "abc");

    downloader.setHeader("X-Token", null);
    downloader.fetch(uri("a.png"), new RecordingDownloadListener());
    assertThat(transport.lastCall().request().headers())
        .containsEntry("Accept", "image/png")
        .doesNotContainKey("X-Token");
  }

  @Test
  void headersFilter() {
    var filteringDownloader =
        newDownloader()
            .headersFilter(
                (uri, headers) -> {
                  var filtered = new LinkedHashMap<>(headers);
                  filtered.put("X-Path", uri.getPath());
                  filtered.remove("Accept");
                  return filtered;
                })
            .build();
    filteringDownloader.fetch(uri("a.png"), new RecordingDownloadListener());
    assertThat(transport.lastCall().request().headers())
        .containsEntry("X-Path", "/a.png")
        .doesNotContainKey("Accept");
  }

  @Test
  void timeouts() {
    var timeoutDownloader = newDownloader().timeout(Duration.ofSeconds(3)).build();
    timeoutDownloader.fetch(uri("a.png"), new RecordingDownloadListener());
    assertThat(transport.lastCall().request().timeout()).isEqualTo(Duration.ofSeconds(3));

    timeoutDownloader.fetch(
        DownloadRequest.newBuilder(uri("b.png")).timeout(Duration.ofMillis(500)).build(),
        new RecordingDownloadListener());
    assertThat(transport.lastCall().request().timeout()).isEqualTo(Duration.ofMillis(500));
  }

  @Test
  void requestOptionsReachTransport() {
    var credentialDownloader =
        newDownloader().credentials("user", "secret".toCharArray()).build();
    credentialDownloader.fetch(
        DownloadRequest.newBuilder(uri("a.png"))
            .option(DownloadOption.HANDLE_COOKIES)
            .option(DownloadOption.ALLOW_INVALID_CERTIFICATES)
            .build(),
        new RecordingDownloadListener());
    var request = transport.lastCall().request();
    assertThat(request.handleCookies()).isTrue();
    assertThat(request.trustAllCertificates()).isTrue();
    assertThat(request.credentials())
        .hasValueSatisfying(
            credentials -> assertThat(credentials.getUserName()).isEqualTo("user"));
  }

  @Test
  void closingUnsubscribesAndCancelsTransfers() {
    var lifecycle = new Lifecycle();
    var lifecycleDownloader = newDownloader().lifecycle(lifecycle).build();
    var listener = new RecordingDownloadListener();
    lifecycleDownloader.fetch(uri("a.png"), listener);
    assertThat(lifecycle.listenerCount()).isOne();

    lifecycleDownloader.close();
    assertThat(lifecycle.listenerCount()).isZero();
    assertThat(listener.errors())
        .singleElement()
        .extracting(ImageLoadException::kind)
        .isEqualTo(Kind.CANCELED);
    assertThat(transport.lastCall().isCanceled()).isTrue();
    assertThat(lifecycleDownloader.currentDownloadCount()).isZero();
  }

  @Test
  void suspendingCancelsForegroundDownloads() {
    var lifecycle = new Lifecycle();
    var lifecycleDownloader = newDownloader().lifecycle(lifecycle).build();
    var foreground = new RecordingDownloadListener();
    var background = new RecordingDownloadListener();
    lifecycleDownloader.fetch(uri("a.png"), foreground);
    lifecycleDownloader.fetch(
        DownloadRequest.newBuilder(uri("b.png"))
            .option(DownloadOption.CONTINUE_IN_BACKGROUND)
            .build(),
        background);

    lifecycle.notifySuspending();
    assertThat(foreground.errors()).singleElement()
        .extracting(ImageLoadException::kind)
        .isEqualTo(Kind.CANCELED);
    assertThat(background.errors()).isEmpty();
    assertThat(lifecycleDownloader.currentDownloadCount()).isOne();

    lifecycle.notifyBackgroundTimeExpired();
    assertThat(background.errors()).singleElement()
        .extracting(ImageLoadException::kind)
        .isEqualTo(Kind.CANCELED);
    assertThat(lifecycleDownloader.currentDownloadCount()).isZero();
  }

  @Test
  void backgroundDownloadCompletesIfResumedInTime() {
    var lifecycle = new Lifecycle();
    var lifecycleDownloader = newDownloader().lifecycle(lifecycle).build();
    var listener = new RecordingDownloadListener();
    lifecycleDownloader.fetch(
        DownloadRequest.newBuilder(uri("a.png"))
            .option(DownloadOption.CONTINUE_IN_BACKGROUND)
            .build(),
        listener);

    lifecycle.notifySuspending();
    lifecycle.notifyResumed();
    lifecycle.notifyBackgroundTimeExpired();
    assertThat(listener.errors()).isEmpty();

    transport.lastCall().succeed(StubDecoder.encoded(2, 2));
    assertThat(listener.results()).hasSize(1);
  }

  @Test
  void throwingListenerDoesNotAffectOthers() {
    var listener = new RecordingDownloadListener();
    downloader.fetch(
        uri("a.png"),
        new DownloadListener() {
          @Override
          public void onResult(DownloadResult result) {
            throw new IllegalStateException("boom");
          }

          @Override
          public void onError(ImageLoadException exception) {}
        });
    downloader.fetch(uri("a.png"), listener);
    transport.lastCall().succeed(StubDecoder.encoded(1, 1));
    assertThat(listener.results()).hasSize(1);
  }
}
