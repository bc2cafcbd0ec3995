package com.example.vrf.service;

import com.example.vrf.domain.entity.ReplayRecord;
import com.example.vrf.properties.ApplicationProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Scheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Bounded in-process replay set. Always written, even when the durable store is
 * healthy, so an outage of the durable store keeps recently seen proofs blocked.
 *
 * <p>Entries are lost on restart.
 */
@Slf4j
@Component
public class InMemoryReplayStore implements ReplayStore {

  private final Cache<String, ReplayRecord> records;
  private final Clock clock;
  private final int maxEntries;

  public InMemoryReplayStore(ApplicationProperties properties, Clock clock) {
    ApplicationProperties.ReplayProperties replay = properties.replay();
    this.clock = clock;
    this.maxEntries = replay.maxEntries();
    this.records = Caffeine.newBuilder()
        .maximumSize(replay.maxEntries())
        .expireAfterWrite(replay.ttl())
        .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
        .scheduler(Scheduler.systemScheduler())
        .recordStats()
        .build();
  }

  @Override
  public boolean exists(String proofHash) {
    return records.getIfPresent(proofHash) != null;
  }

  @Override
  public boolean reserve(String proofHash) {
    ReplayRecord record = new ReplayRecord(proofHash, clock.instant());
    return records.asMap().putIfAbsent(proofHash, record) == null;
  }

  @Override
  public void release(String proofHash) {
    records.invalidate(proofHash);
  }

  public long size() {
    records.cleanUp();
    return records.estimatedSize();
  }

  public int maxEntries() {
    return maxEntries;
  }

  @Scheduled(fixedDelayString = "PT5M", initialDelayString = "PT5M")
  public void logOccupancy() {
    log.info("Replay cache occupancy: {}/{} (evictions: {})",
             size(), maxEntries, records.stats().evictionCount());
  }
}
