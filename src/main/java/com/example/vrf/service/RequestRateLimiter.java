package com.example.vrf.service;

import com.example.vrf.properties.ApplicationProperties;
import com.example.vrf.util.HashUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * The two request limiters: per client IP on every API route, and per payment
 * identity (or IP when unpaid) on the randomness routes.
 */
@Slf4j
@Component
public class RequestRateLimiter {

  private static final int PAYMENT_KEY_HEX_LENGTH = 16;

  private final FixedWindowRateLimiter global;
  private final FixedWindowRateLimiter paid;

  public RequestRateLimiter(ApplicationProperties properties, Clock clock) {
    ApplicationProperties.RateLimitProperties rateLimit = properties.rateLimit();
    this.global = new FixedWindowRateLimiter("global", rateLimit.global().limit(),
                                             rateLimit.global().window(), clock);
    this.paid = new FixedWindowRateLimiter("paid", rateLimit.paid().limit(),
                                           rateLimit.paid().window(), clock);
  }

  public FixedWindowRateLimiter.Decision checkGlobal(String clientIp) {
    return global.tryAcquire("ip:" + clientIp);
  }

  public FixedWindowRateLimiter.Decision checkPaid(String paymentHeader, String clientIp) {
    return paid.tryAcquire(paidKey(paymentHeader, clientIp));
  }

  /**
   * Truncated hash of the payment header, so the same proof counts as one identity
   * across IPs; the client IP when the request carries no payment.
   */
  static String paidKey(String paymentHeader, String clientIp) {
    if (paymentHeader == null || paymentHeader.isEmpty()) {
      return "ip:" + clientIp;
    }
    return "pay:" + HashUtils.sha256Hex(paymentHeader).substring(0, PAYMENT_KEY_HEX_LENGTH);
  }

  @Scheduled(fixedDelayString = "PT1M", initialDelayString = "PT1M")
  public void purgeExpiredWindows() {
    int removed = global.purgeExpired() + paid.purgeExpired();
    if (removed > 0) {
      log.debug("Purged {} expired rate windows (tracking global={}, paid={})",
                removed, global.trackedKeys(), paid.trackedKeys());
    }
  }
}
