package com.example.vrf.service;

import com.example.vrf.exception.ReplayStoreUnavailableException;
import com.example.vrf.properties.ApplicationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Durable replay set shared by every instance. Reservation is a single
 * {@code SET key value NX EX ttl}.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.replay", name = "durable-enabled", havingValue = "true")
public class RedisReplayStore implements ReplayStore {

  private final StringRedisTemplate redisTemplate;
  private final Clock clock;
  private final String keyPrefix;
  private final Duration ttl;

  public RedisReplayStore(StringRedisTemplate redisTemplate, ApplicationProperties properties,
                          Clock clock) {
    this.redisTemplate = redisTemplate;
    this.clock = clock;
    this.keyPrefix = properties.replay().keyPrefix();
    this.ttl = properties.replay().ttl();
  }

  @Override
  public boolean exists(String proofHash) {
    try {
      return Boolean.TRUE.equals(redisTemplate.hasKey(keyPrefix + proofHash));
    } catch (RuntimeException e) {
      throw new ReplayStoreUnavailableException("Replay lookup failed", e);
    }
  }

  @Override
  public boolean reserve(String proofHash) {
    try {
      Boolean inserted = redisTemplate.opsForValue()
          .setIfAbsent(keyPrefix + proofHash, String.valueOf(clock.millis()), ttl);
      return Boolean.TRUE.equals(inserted);
    } catch (RuntimeException e) {
      throw new ReplayStoreUnavailableException("Replay reservation failed", e);
    }
  }

  @Override
  public void release(String proofHash) {
    try {
      redisTemplate.delete(keyPrefix + proofHash);
    } catch (RuntimeException e) {
      throw new ReplayStoreUnavailableException("Replay release failed", e);
    }
  }
}
