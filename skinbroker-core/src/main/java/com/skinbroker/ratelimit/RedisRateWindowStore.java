package com.skinbroker.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Rate windows kept in Redis. INCR and the first-hit PEXPIRE run in one Lua script so a crash
 * between the two can never leave a counter without a TTL.
 */
@Slf4j
public final class RedisRateWindowStore implements RateWindowStore {

  static final String INCREMENT_SCRIPT = """
      local count = redis.call('INCR', KEYS[1])
      if count == 1 then
        redis.call('PEXPIRE', KEYS[1], ARGV[1])
      end
      return count
      """;

  private static final long READY_CHECK_INTERVAL_MILLIS = 5_000L;

  private final StringRedisTemplate redisTemplate;
  private final DefaultRedisScript<Long> incrementScript;
  private final Clock clock;

  private volatile boolean lastReady;
  private volatile long lastReadyCheckAtMillis = Long.MIN_VALUE;

  public RedisRateWindowStore(StringRedisTemplate redisTemplate, Clock clock) {
    this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.incrementScript = new DefaultRedisScript<>(INCREMENT_SCRIPT, Long.class);
  }

  @Override
  public boolean isReady() {
    long now = clock.millis();
    if (lastReadyCheckAtMillis != Long.MIN_VALUE && now - lastReadyCheckAtMillis < READY_CHECK_INTERVAL_MILLIS) {
      return lastReady;
    }
    boolean ready = ping();
    lastReady = ready;
    lastReadyCheckAtMillis = now;
    return ready;
  }

  @Override
  public long incrementAndGet(String key, Duration ttl) {
    Long count = redisTemplate.execute(incrementScript, List.of(key), String.valueOf(ttl.toMillis()));
    if (count == null) {
      throw new IllegalStateException("Redis returned no count for " + key);
    }
    return count;
  }

  private boolean ping() {
    RedisConnectionFactory factory = redisTemplate.getConnectionFactory();
    if (factory == null) {
      return false;
    }
    try (RedisConnection connection = factory.getConnection()) {
      return "PONG".equalsIgnoreCase(connection.ping());
    } catch (Exception e) {
      log.debug("redis ping failed error={}", e.toString());
      return false;
    }
  }
}
