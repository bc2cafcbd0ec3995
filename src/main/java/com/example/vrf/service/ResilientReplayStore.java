package com.example.vrf.service;

import com.example.vrf.exception.ReplayStoreUnavailableException;
import com.example.vrf.util.HashUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Replay store used by the access gate. Writes the in-memory set on every call
 * and the durable set when one is configured. A durable-store failure switches
 * to memory-only protection until the next durable call succeeds.
 */
@Slf4j
@Primary
@Component
public class ResilientReplayStore implements ReplayStore {

  public static final String MODE_DURABLE = "durable";
  public static final String MODE_MEMORY = "memory";
  public static final String MODE_DEGRADED = "degraded";

  private final InMemoryReplayStore memory;
  private final ReplayStore durable;
  private final AtomicBoolean degraded = new AtomicBoolean(false);

  @Autowired
  public ResilientReplayStore(InMemoryReplayStore memory,
                              ObjectProvider<RedisReplayStore> durable) {
    this(memory, (ReplayStore) durable.getIfAvailable());
  }

  ResilientReplayStore(InMemoryReplayStore memory, ReplayStore durable) {
    this.memory = memory;
    this.durable = durable;
    log.info("Replay protection mode: {}", durable != null ? MODE_DURABLE : MODE_MEMORY);
  }

  @Override
  public boolean exists(String proofHash) {
    if (memory.exists(proofHash)) {
      return true;
    }
    if (durable == null) {
      return false;
    }
    try {
      boolean found = durable.exists(proofHash);
      markHealthy();
      return found;
    } catch (ReplayStoreUnavailableException e) {
      markDegraded(e);
      return false;
    }
  }

  @Override
  public boolean reserve(String proofHash) {
    if (!memory.reserve(proofHash)) {
      return false;
    }
    if (durable == null) {
      return true;
    }
    try {
      boolean inserted = durable.reserve(proofHash);
      markHealthy();
      if (!inserted) {
        memory.release(proofHash);
        log.warn("Proof {} already reserved by another instance", HashUtils.abbreviate(proofHash));
      }
      return inserted;
    } catch (ReplayStoreUnavailableException e) {
      markDegraded(e);
      return true;
    }
  }

  @Override
  public void release(String proofHash) {
    memory.release(proofHash);
    if (durable == null) {
      return;
    }
    try {
      durable.release(proofHash);
      markHealthy();
    } catch (ReplayStoreUnavailableException e) {
      markDegraded(e);
    }
  }

  public String mode() {
    if (durable == null) {
      return MODE_MEMORY;
    }
    return degraded.get() ? MODE_DEGRADED : MODE_DURABLE;
  }

  private void markDegraded(ReplayStoreUnavailableException e) {
    if (degraded.compareAndSet(false, true)) {
      log.error("Durable replay store unavailable, falling back to in-memory protection "
                + "(replay protection resets on restart until it recovers)", e);
    } else {
      log.debug("Durable replay store still unavailable: {}", e.getMessage());
    }
  }

  private void markHealthy() {
    if (degraded.compareAndSet(true, false)) {
      log.info("Durable replay store recovered, resuming dual writes");
    }
  }
}
