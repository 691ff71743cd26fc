package com.skinbroker.broker.sim;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "broker.paper")
public record PaperSimulationProperties(
    /**
     * When true, every simulated offer is accepted by the counterparty after {@code acceptDelayMillis}.
     */
    @NotNull Boolean autoAccept,
    @NotNull @PositiveOrZero Long acceptDelayMillis,
    @NotNull @PositiveOrZero Integer initialInventory,
    /**
     * Probability in [0, 100] that a login attempt fails. Exercises the backoff and health-check paths.
     */
    @NotNull @Min(0) Integer loginFailurePercent
) {
  public PaperSimulationProperties {
    if (autoAccept == null) {
      autoAccept = true;
    }
    if (acceptDelayMillis == null) {
      acceptDelayMillis = 5_000L;
    }
    if (initialInventory == null) {
      initialInventory = 100;
    }
    if (loginFailurePercent == null) {
      loginFailurePercent = 0;
    }
    loginFailurePercent = Math.min(100, Math.max(0, loginFailurePercent));
  }
}
