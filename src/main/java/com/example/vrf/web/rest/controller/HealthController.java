package com.example.vrf.web.rest.controller;

import com.example.vrf.adapter.redis.client.RedisHealthClient;
import com.example.vrf.adapter.redis.dto.RedisHealthResponse;
import com.example.vrf.domain.entity.UsageStats;
import com.example.vrf.exception.UnauthorizedException;
import com.example.vrf.properties.ApplicationProperties;
import com.example.vrf.service.AccessGateService;
import com.example.vrf.service.CommitmentPublisher;
import com.example.vrf.service.ResilientReplayStore;
import com.example.vrf.service.TeeIdentityService;
import com.example.vrf.service.UsageStatsService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health, readiness and stats.
 *
 * Note: health and readiness don't throw to GlobalErrorHandler, monitoring tools
 * rely on the status codes returned here.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController implements HealthAPI {

  private static final long REDIS_RESPONSE_TIME_WARNING_MS = 100L;
  private static final String STATUS_OK = "ok";
  private static final String STATUS_UP = "UP";
  private static final String STATUS_DOWN = "DOWN";
  private static final String STATUS_DISABLED = "DISABLED";

  private static final List<String> ENDPOINTS = List.of(
      "POST /v1/randomness - Raw 256-bit seed",
      "POST /v1/random/number - Random number in range",
      "POST /v1/random/pick - Pick one from list",
      "POST /v1/random/shuffle - Shuffle a list",
      "POST /v1/random/winners - Pick multiple winners",
      "POST /v1/random/uuid - Generate UUIDv4",
      "POST /v1/random/dice - Roll dice (e.g., 2d6)",
      "GET /v1/attestation - Current TEE attestation",
      "POST /v1/verify - Verify an attestation"
  );

  private final ApplicationProperties properties;
  private final TeeIdentityService teeIdentityService;
  private final ResilientReplayStore replayStore;
  private final CommitmentPublisher commitmentPublisher;
  private final UsageStatsService usageStatsService;
  private final AccessGateService accessGateService;
  private final ObjectProvider<RedisHealthClient> redisHealthClient;

  @Override
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> response = new LinkedHashMap<>();
    response.put("status", STATUS_OK);
    response.put("tee_type", teeIdentityService.teeType());
    response.put("version", properties.version());
    response.put("x402_enabled", !properties.payment().options().isEmpty());
    response.put("price_per_request", properties.payment().priceDisplay());
    response.put("app_id", teeIdentityService.identity().appId());
    response.put("verification_available", teeIdentityService.hardwareDetected());
    response.put("replay_store", replayStore.mode());
    response.put("commitments_enabled", commitmentPublisher.isEnabled());
    response.put("endpoints", ENDPOINTS);
    return ResponseEntity.ok(response);
  }

  @Override
  public ResponseEntity<Map<String, Object>> readiness() {
    Map<String, Object> status = new LinkedHashMap<>();
    boolean isReady = true;

    RedisHealthClient client = redisHealthClient.getIfAvailable();
    Map<String, Object> redisStatus = new LinkedHashMap<>();
    if (client == null) {
      redisStatus.put("status", STATUS_DISABLED);
    } else {
      RedisHealthResponse redisHealth;
      try {
        redisHealth = client.checkHealth();
      } catch (Exception e) {
        log.error("Redis health check failed", e);
        redisHealth = RedisHealthResponse.unhealthy(e.getMessage());
      }

      redisStatus.put("status", redisHealth.healthy() ? STATUS_UP : STATUS_DOWN);
      redisStatus.put("responseTimeMs", redisHealth.responseTimeMs());
      if (redisHealth.error() != null) {
        redisStatus.put("error", redisHealth.error());
      }

      if (!redisHealth.healthy() || redisHealth.responseTimeMs() > REDIS_RESPONSE_TIME_WARNING_MS) {
        isReady = false;
        log.warn("Readiness check failed: Redis health={}, responseTime={}ms",
                 redisHealth.healthy(), redisHealth.responseTimeMs());
      }
    }

    status.put("redis", redisStatus);
    status.put("replay_store", replayStore.mode());
    status.put("ready", isReady);

    return ResponseEntity.status(isReady ? 200 : 503).body(status);
  }

  @Override
  public ResponseEntity<Map<String, Object>> stats(HttpServletRequest request) {
    if (!accessGateService.hasValidApiKey(request)) {
      throw new UnauthorizedException("Unauthorized");
    }

    UsageStats snapshot = usageStatsService.snapshot();
    Map<String, Object> stats = new LinkedHashMap<>();
    stats.put("total_requests", snapshot.totalRequests());
    stats.put("paid_requests", snapshot.paidRequests());
    stats.put("allowlisted_requests", snapshot.allowlistedRequests());
    stats.put("api_key_requests", snapshot.apiKeyRequests());
    stats.put("total_revenue_base_units", snapshot.totalRevenueBaseUnits());

    Map<String, Object> response = new LinkedHashMap<>();
    response.put("stats", stats);
    response.put("uptime_seconds", usageStatsService.uptime().toSeconds());
    response.put("tee_type", teeIdentityService.teeType());
    return ResponseEntity.ok(response);
  }
}
