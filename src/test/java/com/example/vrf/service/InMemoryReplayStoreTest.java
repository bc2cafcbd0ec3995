package com.example.vrf.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.vrf.support.MutableClock;
import com.example.vrf.support.TestProperties;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryReplayStoreTest {

  private MutableClock clock;
  private InMemoryReplayStore store;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    TestProperties properties = TestProperties.defaults();
    properties.replayTtl = Duration.ofHours(1);
    store = new InMemoryReplayStore(properties.build(), clock);
  }

  @Test
  void reserveSucceedsOnlyOnce() {
    assertThat(store.exists("hash-a")).isFalse();
    assertThat(store.reserve("hash-a")).isTrue();
    assertThat(store.reserve("hash-a")).isFalse();
    assertThat(store.exists("hash-a")).isTrue();
  }

  @Test
  void releaseMakesHashAvailableAgain() {
    store.reserve("hash-a");
    store.release("hash-a");

    assertThat(store.exists("hash-a")).isFalse();
    assertThat(store.reserve("hash-a")).isTrue();
  }

  @Test
  void entriesExpireAfterTtl() {
    store.reserve("hash-a");

    clock.advance(Duration.ofMinutes(59));
    assertThat(store.exists("hash-a")).isTrue();

    clock.advance(Duration.ofMinutes(2));
    assertThat(store.exists("hash-a")).isFalse();
    assertThat(store.reserve("hash-a")).isTrue();
  }

  @Test
  void concurrentReservationsOfSameHashAdmitExactlyOne() throws Exception {
    int threads = 32;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    AtomicInteger winners = new AtomicInteger();
    try {
      for (int i = 0; i < threads; i++) {
        pool.submit(() -> {
          start.await();
          if (store.reserve("contended")) {
            winners.incrementAndGet();
          }
          return null;
        });
      }
      start.countDown();
      pool.shutdown();
      assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
    } finally {
      pool.shutdownNow();
    }
    assertThat(winners.get()).isEqualTo(1);
  }

  @Test
  void reportsSize() {
    store.reserve("a");
    store.reserve("b");
    assertThat(store.size()).isEqualTo(2);
    assertThat(store.maxEntries()).isEqualTo(10_000);
  }
}
