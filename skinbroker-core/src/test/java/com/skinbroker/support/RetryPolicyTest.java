package com.skinbroker.support;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

  @Test
  void doublesDelayUntilCapped() {
    RetryPolicy policy = new RetryPolicy(6, 1_000, 5_000);

    assertThat(policy.computeDelayMillis(1)).isEqualTo(1_000);
    assertThat(policy.computeDelayMillis(2)).isEqualTo(2_000);
    assertThat(policy.computeDelayMillis(3)).isEqualTo(4_000);
    assertThat(policy.computeDelayMillis(4)).isEqualTo(5_000);
    assertThat(policy.computeDelayMillis(10)).isEqualTo(5_000);
  }

  @Test
  void retriesOnlyBelowMaxAttempts() {
    RetryPolicy policy = new RetryPolicy(3, 10, 100);

    assertThat(policy.canRetry(1)).isTrue();
    assertThat(policy.canRetry(2)).isTrue();
    assertThat(policy.canRetry(3)).isFalse();
  }

  @Test
  void jitterAddsLessThanQuarterSecond() {
    assertThat(RetryPolicy.jitter(0)).isZero();
    for (int i = 0; i < 50; i++) {
      assertThat(RetryPolicy.jitter(1_000)).isBetween(1_000L, 1_249L);
    }
  }

  @Test
  void rejectsZeroAttempts() {
    assertThatThrownBy(() -> new RetryPolicy(0, 10, 10)).isInstanceOf(IllegalArgumentException.class);
  }
}
