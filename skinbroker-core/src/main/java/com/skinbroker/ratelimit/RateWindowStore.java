package com.skinbroker.ratelimit;

import java.time.Duration;

/**
 * Counter store shared by every process that talks to the upstream API.
 */
public interface RateWindowStore {

  boolean isReady();

  /**
   * Atomically increments the counter under {@code key} and returns the new value.
   * The key expires after {@code ttl} when it is created by this call.
   */
  long incrementAndGet(String key, Duration ttl);
}
