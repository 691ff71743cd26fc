package com.skinbroker.ratelimit;

/**
 * Admission gate in front of every call that spends the upstream request quota.
 */
public interface RateLimiter {

  /**
   * Returns once the caller may issue one upstream request, suspending the caller if the current window is full.
   */
  void waitForSlot();

  static RateLimiter noop() {
    return () -> {
    };
  }
}
