package com.example.vrf.adapter.redis.client;

import com.example.vrf.adapter.redis.dto.RedisHealthResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Properties;

/**
 * Probes the durable replay store. Used by the replay store to detect recovery
 * and by the health endpoint.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.replay", name = "durable-enabled", havingValue = "true")
public class RedisHealthClient {

  private final StringRedisTemplate redisTemplate;
  private final Clock clock;

  public RedisHealthResponse checkHealth() {
    long startTime = clock.millis();

    try {
      String pingResponse = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());

      if (!"PONG".equals(pingResponse)) {
        return RedisHealthResponse.unhealthy("Invalid PING response: " + pingResponse);
      }

      long responseTime = clock.millis() - startTime;
      return RedisHealthResponse.healthy(responseTime, serverVersion());

    } catch (Exception e) {
      log.warn("Redis health check failed: {}", e.getMessage());
      return RedisHealthResponse.unhealthy(e.getMessage());
    }
  }

  private String serverVersion() {
    Properties info = redisTemplate.execute((RedisCallback<Properties>) connection ->
        connection.serverCommands().info("server"));
    return info != null ? info.getProperty("redis_version", "unknown") : "unknown";
  }
}
