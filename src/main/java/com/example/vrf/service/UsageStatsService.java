package com.example.vrf.service;

import com.example.vrf.domain.entity.AccessGrant;
import com.example.vrf.domain.entity.UsageStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process usage counters. Reset on restart.
 */
@Slf4j
@Service
public class UsageStatsService {

  private final Clock clock;
  private final Instant startedAt;
  private final AtomicLong totalRequests = new AtomicLong();
  private final AtomicLong paidRequests = new AtomicLong();
  private final AtomicLong allowlistedRequests = new AtomicLong();
  private final AtomicLong apiKeyRequests = new AtomicLong();
  private final AtomicLong revenueBaseUnits = new AtomicLong();

  public UsageStatsService(Clock clock) {
    this.clock = clock;
    this.startedAt = clock.instant();
  }

  public void record(AccessGrant grant) {
    totalRequests.incrementAndGet();
    switch (grant.tier()) {
      case PAID -> {
        paidRequests.incrementAndGet();
        revenueBaseUnits.addAndGet(baseUnits(grant.payment().requirement().amount()));
      }
      case ALLOWLISTED -> allowlistedRequests.incrementAndGet();
      case API_KEY -> apiKeyRequests.incrementAndGet();
    }
  }

  public UsageStats snapshot() {
    return new UsageStats(totalRequests.get(), paidRequests.get(), allowlistedRequests.get(),
                          apiKeyRequests.get(), revenueBaseUnits.get());
  }

  public Duration uptime() {
    return Duration.between(startedAt, clock.instant());
  }

  private long baseUnits(String amount) {
    try {
      return amount != null ? Long.parseLong(amount) : 0;
    } catch (NumberFormatException e) {
      log.warn("Ignoring non-numeric payment amount in revenue: {}", amount);
      return 0;
    }
  }
}
