package com.example.vrf.service;

import com.example.vrf.domain.entity.RateWindow;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Fixed-window request counter. A key's window restarts on the first request
 * after {@code windowSize} has elapsed since the window opened.
 */
public class FixedWindowRateLimiter {

  /**
   * Outcome of one acquire attempt, carrying what the rate-limit headers report.
   */
  public record Decision(boolean allowed, int limit, int remaining, Instant resetAt) {}

  private final String name;
  private final int limit;
  private final Duration windowSize;
  private final Clock clock;
  private final ConcurrentMap<String, RateWindow> windows = new ConcurrentHashMap<>();

  public FixedWindowRateLimiter(String name, int limit, Duration windowSize, Clock clock) {
    this.name = name;
    this.limit = limit;
    this.windowSize = windowSize;
    this.clock = clock;
  }

  public Decision tryAcquire(String key) {
    Instant now = clock.instant();
    RateWindow window = windows.compute(key, (k, current) ->
        current == null || current.isExpired(now, windowSize)
        ? new RateWindow(k, 1, now)
        : current.increment());

    return new Decision(
        window.count() <= limit,
        limit,
        Math.max(0, limit - window.count()),
        window.resetAt(windowSize));
  }

  /**
   * Drops windows that have run out, returning how many were removed.
   */
  public int purgeExpired() {
    Instant now = clock.instant();
    int before = windows.size();
    windows.values().removeIf(window -> window.isExpired(now, windowSize));
    return before - windows.size();
  }

  public String name() {
    return name;
  }

  public int trackedKeys() {
    return windows.size();
  }
}
