package com.example.vrf.adapter.redis.dto;

/**
 * Result of probing the durable replay store
 */
public record RedisHealthResponse(
    boolean healthy,
    long responseTimeMs,
    String version,
    String error
) {
  public static RedisHealthResponse healthy(long responseTimeMs, String version) {
    return new RedisHealthResponse(true, responseTimeMs, version, null);
  }

  public static RedisHealthResponse unhealthy(String error) {
    return new RedisHealthResponse(false, 0, null, error);
  }
}
