package com.vitals.analytics.repo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vitals.analytics.model.Metric;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Duration;

/**
 * Short-lived raw metric records in Redis, keyed by submission timestamp.
 *
 * <p>Redis failures are logged and absorbed; a failed write never reaches the caller.
 */
@Repository
public class MetricCacheRepository {

  private static final Logger log = LoggerFactory.getLogger(MetricCacheRepository.class);

  private final StringRedisTemplate redis;
  private final ObjectMapper mapper;
  private final String keyPrefix;
  private final Duration ttl;

  public MetricCacheRepository(StringRedisTemplate redis,
                               ObjectMapper mapper,
                               @Value("${vitals.cache.key-prefix:metric:}") String keyPrefix,
                               @Value("${vitals.cache.ttl-seconds:600}") long ttlSeconds) {
    this.redis = redis;
    this.mapper = mapper;
    this.keyPrefix = keyPrefix;
    this.ttl = Duration.ofSeconds(ttlSeconds);
  }

  @PostConstruct
  void checkConnection() {
    if (ping()) {
      log.info("Redis reachable; caching metrics under '{}*' for {}s", keyPrefix, ttl.toSeconds());
    } else {
      log.warn("Redis not reachable at startup; metrics will not be cached until it recovers");
    }
  }

  public void save(Metric metric) {
    String key = keyFor(metric.timestamp());
    try {
      redis.opsForValue().set(key, mapper.writeValueAsString(metric), ttl);
    } catch (Exception e) {
      log.warn("Failed to cache metric {}: {}", key, e.getMessage());
    }
  }

  public boolean ping() {
    try {
      String pong = redis.execute((RedisCallback<String>) RedisConnection::ping);
      return "PONG".equalsIgnoreCase(pong);
    } catch (Exception e) {
      log.debug("Redis ping failed: {}", e.getMessage());
      return false;
    }
  }

  public String keyFor(long timestamp) {
    return keyPrefix + timestamp;
  }
}
