package com.skinbroker.support;

import java.util.concurrent.TimeUnit;

@FunctionalInterface
public interface Sleeper {

  /**
   * Sleeps for the given time. Returns {@code false} if the thread was interrupted; the interrupt flag is restored.
   */
  boolean sleep(long millis);

  static Sleeper system() {
    return millis -> {
      if (millis <= 0) {
        return true;
      }
      try {
        TimeUnit.MILLISECONDS.sleep(millis);
        return true;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
    };
  }
}
