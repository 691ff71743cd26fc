package com.skinbroker.events;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "broker.events")
public record BrokerEventsProperties(
    @NotNull Boolean enabled,
    String topic
) {
  public BrokerEventsProperties {
    if (enabled == null) {
      enabled = false;
    }
    if (topic == null || topic.isBlank()) {
      topic = "skinbroker.events";
    }
  }
}
