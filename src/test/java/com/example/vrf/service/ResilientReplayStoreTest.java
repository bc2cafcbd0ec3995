package com.example.vrf.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.vrf.exception.ReplayStoreUnavailableException;
import com.example.vrf.support.MutableClock;
import com.example.vrf.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResilientReplayStoreTest {

  private InMemoryReplayStore memory;
  private ReplayStore durable;

  @BeforeEach
  void setUp() {
    memory = new InMemoryReplayStore(TestProperties.defaults().build(),
                                     MutableClock.startingAt("2026-01-01T00:00:00Z"));
    durable = mock(ReplayStore.class);
  }

  @Test
  void memoryOnlyWhenNoDurableStore() {
    ResilientReplayStore store = new ResilientReplayStore(memory, (ReplayStore) null);

    assertThat(store.mode()).isEqualTo(ResilientReplayStore.MODE_MEMORY);
    assertThat(store.reserve("h")).isTrue();
    assertThat(store.reserve("h")).isFalse();
    assertThat(store.exists("h")).isTrue();
  }

  @Test
  void writesBothStores() {
    when(durable.reserve("h")).thenReturn(true);
    ResilientReplayStore store = new ResilientReplayStore(memory, durable);

    assertThat(store.reserve("h")).isTrue();

    verify(durable).reserve("h");
    assertThat(memory.exists("h")).isTrue();
    assertThat(store.mode()).isEqualTo(ResilientReplayStore.MODE_DURABLE);
  }

  @Test
  void memoryHitShortCircuitsDurableLookup() {
    ResilientReplayStore store = new ResilientReplayStore(memory, durable);
    memory.reserve("h");

    assertThat(store.exists("h")).isTrue();
    verify(durable, never()).exists(anyString());
  }

  @Test
  void durableHitIsReportedWhenMemoryMisses() {
    when(durable.exists("seen-elsewhere")).thenReturn(true);
    ResilientReplayStore store = new ResilientReplayStore(memory, durable);

    assertThat(store.exists("seen-elsewhere")).isTrue();
  }

  @Test
  void reservationHeldByAnotherInstanceIsRejected() {
    when(durable.reserve("h")).thenReturn(false);
    ResilientReplayStore store = new ResilientReplayStore(memory, durable);

    assertThat(store.reserve("h")).isFalse();
    assertThat(memory.exists("h")).isFalse();
  }

  @Test
  void proofReleasedByAnotherInstanceCanBeReservedAgain() {
    when(durable.reserve("h")).thenReturn(false, true);
    ResilientReplayStore store = new ResilientReplayStore(memory, durable);

    assertThat(store.reserve("h")).isFalse();
    assertThat(store.reserve("h")).isTrue();
  }

  @Test
  void fallsBackToMemoryAndRecovers() {
    when(durable.reserve("h1")).thenThrow(new ReplayStoreUnavailableException("down"));
    when(durable.exists(anyString())).thenThrow(new ReplayStoreUnavailableException("down"));
    ResilientReplayStore store = new ResilientReplayStore(memory, durable);

    assertThat(store.reserve("h1")).isTrue();
    assertThat(store.mode()).isEqualTo(ResilientReplayStore.MODE_DEGRADED);
    // still protected in memory while degraded
    assertThat(store.reserve("h1")).isFalse();
    assertThat(store.exists("h2")).isFalse();

    when(durable.reserve("h3")).thenReturn(true);
    assertThat(store.reserve("h3")).isTrue();
    assertThat(store.mode()).isEqualTo(ResilientReplayStore.MODE_DURABLE);
  }

  @Test
  void releaseClearsBothStoresAndToleratesDurableFailure() {
    when(durable.reserve("h")).thenReturn(true);
    doThrow(new ReplayStoreUnavailableException("down")).when(durable).release("h");
    ResilientReplayStore store = new ResilientReplayStore(memory, durable);
    store.reserve("h");

    store.release("h");

    assertThat(memory.exists("h")).isFalse();
    assertThat(store.mode()).isEqualTo(ResilientReplayStore.MODE_DEGRADED);
  }
}
