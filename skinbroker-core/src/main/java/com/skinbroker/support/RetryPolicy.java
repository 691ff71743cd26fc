package com.skinbroker.support;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Capped exponential backoff: {@code initialBackoffMillis * 2^(attempt-1)}, never above {@code maxBackoffMillis}.
 */
public record RetryPolicy(
    int maxAttempts,
    long initialBackoffMillis,
    long maxBackoffMillis
) {

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    initialBackoffMillis = Math.max(0, initialBackoffMillis);
    maxBackoffMillis = Math.max(initialBackoffMillis, maxBackoffMillis);
  }

  public boolean canRetry(int attempt) {
    return attempt < maxAttempts;
  }

  public long computeDelayMillis(int attempt) {
    long delay = initialBackoffMillis;
    for (int i = 1; i < attempt; i++) {
      delay = Math.min(maxBackoffMillis, delay * 2);
    }
    return delay;
  }

  public static long jitter(long delayMillis) {
    if (delayMillis <= 0) {
      return 0;
    }
    long jitter = ThreadLocalRandom.current().nextLong(0, Math.min(250, delayMillis + 1));
    return delayMillis + jitter;
  }
}
