package com.skinbroker.ratelimit;

import com.skinbroker.config.BrokerProperties;
import com.skinbroker.error.RateLimitUnavailableException;
import com.skinbroker.support.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-window limiter over a shared {@link RateWindowStore}: at most {@code maxRequests} admissions
 * per {@code floor(now / windowMillis)} bucket across all processes.
 *
 * <p>A caller that lands over the limit sleeps until the next bucket boundary (plus a grace period)
 * and is then charged to that bucket without re-checking. Callers are expected to be serialized by
 * the dispatch queue, so a single sleeper per process is the common case.
 */
@Slf4j
public final class WindowedRateLimiter implements RateLimiter {

  private final RateWindowStore store;
  private final int maxRequests;
  private final long windowMillis;
  private final String keyPrefix;
  private final Duration keyTtl;
  private final long boundaryGraceMillis;
  private final BrokerProperties.FailMode failMode;
  private final Clock clock;
  private final Sleeper sleeper;

  private final AtomicLong throttled = new AtomicLong(0);
  private final AtomicLong failOpenPasses = new AtomicLong(0);

  public WindowedRateLimiter(RateWindowStore store, BrokerProperties.RateLimit cfg, Clock clock, Sleeper sleeper) {
    this.store = Objects.requireNonNull(store, "store");
    Objects.requireNonNull(cfg, "cfg");
    if (cfg.maxRequests() <= 0) {
      throw new IllegalArgumentException("maxRequests must be > 0");
    }
    if (cfg.windowMillis() <= 0) {
      throw new IllegalArgumentException("windowMillis must be > 0");
    }
    this.maxRequests = cfg.maxRequests();
    this.windowMillis = cfg.windowMillis();
    this.keyPrefix = cfg.keyPrefix();
    this.keyTtl = Duration.ofSeconds(Math.max(1, cfg.keyTtlSeconds()));
    this.boundaryGraceMillis = Math.max(0, cfg.boundaryGraceMillis());
    this.failMode = cfg.failMode();
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  @Override
  public void waitForSlot() {
    if (!isStoreReady()) {
      storeUnavailable("store not ready", null);
      return;
    }

    long now = clock.millis();
    long bucket = Math.floorDiv(now, windowMillis);
    String key = windowKey(bucket);

    long count;
    try {
      count = store.incrementAndGet(key, keyTtl);
    } catch (RuntimeException e) {
      storeUnavailable("increment failed", e);
      return;
    }

    if (count <= maxRequests) {
      if (count == maxRequests) {
        log.warn("rate limit window saturated key={} max={}", key, maxRequests);
      }
      return;
    }

    long untilNextWindow = windowMillis - Math.floorMod(now, windowMillis);
    long waitMillis = untilNextWindow + boundaryGraceMillis;
    throttled.incrementAndGet();
    log.info("rate limit exceeded count={} max={} waitMillis={}", count, maxRequests, waitMillis);

    if (!sleeper.sleep(waitMillis)) {
      throw new RateLimitUnavailableException("Interrupted while waiting for a rate limit slot", null);
    }
    chargeWindow(bucket + 1);
  }

  public long throttledCount() {
    return throttled.get();
  }

  public long failOpenCount() {
    return failOpenPasses.get();
  }

  String windowKey(long bucket) {
    return keyPrefix + ":" + bucket;
  }

  private boolean isStoreReady() {
    try {
      return store.isReady();
    } catch (RuntimeException e) {
      log.debug("rate limiter store readiness check failed error={}", e.toString());
      return false;
    }
  }

  private void chargeWindow(long bucket) {
    String key = windowKey(bucket);
    try {
      store.incrementAndGet(key, keyTtl);
    } catch (RuntimeException e) {
      log.warn("rate limiter could not charge deferred request key={} error={}", key, e.toString());
    }
  }

  private void storeUnavailable(String what, Exception cause) {
    if (failMode == BrokerProperties.FailMode.CLOSED) {
      log.error("rate limiter {}, rejecting request (fail-closed)", what);
      throw new RateLimitUnavailableException("Rate limiter " + what, cause);
    }
    failOpenPasses.incrementAndGet();
    log.warn("rate limiter {}, proceeding without rate limit check error={}", what, cause == null ? "-" : cause.toString());
  }
}
