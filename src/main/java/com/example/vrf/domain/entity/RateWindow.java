package com.example.vrf.domain.entity;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-window counter for one limiter key.
 */
public record RateWindow(String key, int count, Instant windowStart) {

  public boolean isExpired(Instant now, Duration windowSize) {
    return !now.isBefore(windowStart.plus(windowSize));
  }

  public Instant resetAt(Duration windowSize) {
    return windowStart.plus(windowSize);
  }

  public RateWindow increment() {
    return new RateWindow(key, count + 1, windowStart);
  }
}
