package com.example.vrf.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.vrf.support.MutableClock;
import com.example.vrf.support.TestProperties;
import com.example.vrf.util.HashUtils;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class RequestRateLimiterTest {

  private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");

  private RequestRateLimiter limiter(int globalLimit, int paidLimit) {
    TestProperties properties = TestProperties.defaults();
    properties.globalLimit = globalLimit;
    properties.paidLimit = paidLimit;
    return new RequestRateLimiter(properties.build(), clock);
  }

  @Test
  void paidKeyUsesTruncatedHeaderHash() {
    String header = "eyJ4NDAyVmVyc2lvbiI6Mn0=";
    assertThat(RequestRateLimiter.paidKey(header, "10.0.0.1"))
        .isEqualTo("pay:" + HashUtils.sha256Hex(header).substring(0, 16));
    assertThat(RequestRateLimiter.paidKey(null, "10.0.0.1")).isEqualTo("ip:10.0.0.1");
  }

  @Test
  void samePaymentCountsAcrossIps() {
    RequestRateLimiter limiter = limiter(100, 2);
    assertThat(limiter.checkPaid("proof", "10.0.0.1").allowed()).isTrue();
    assertThat(limiter.checkPaid("proof", "10.0.0.2").allowed()).isTrue();
    assertThat(limiter.checkPaid("proof", "10.0.0.3").allowed()).isFalse();
    assertThat(limiter.checkPaid("other-proof", "10.0.0.3").allowed()).isTrue();
  }

  @Test
  void globalAndPaidLimitsAreSeparate() {
    RequestRateLimiter limiter = limiter(1, 5);
    assertThat(limiter.checkGlobal("10.0.0.1").allowed()).isTrue();
    assertThat(limiter.checkGlobal("10.0.0.1").allowed()).isFalse();
    assertThat(limiter.checkPaid(null, "10.0.0.1").allowed()).isTrue();
  }

  @Test
  void purgeRemovesExpiredWindows() {
    RequestRateLimiter limiter = limiter(1, 1);
    limiter.checkGlobal("10.0.0.1");
    limiter.checkPaid(null, "10.0.0.1");
    clock.advance(Duration.ofMinutes(2));

    limiter.purgeExpiredWindows();

    assertThat(limiter.checkGlobal("10.0.0.1").allowed()).isTrue();
  }
}
