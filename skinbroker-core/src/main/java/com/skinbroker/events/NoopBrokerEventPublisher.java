package com.skinbroker.events;

import java.time.Instant;

public final class NoopBrokerEventPublisher implements BrokerEventPublisher {

  @Override
  public boolean isEnabled() {
    return false;
  }

  @Override
  public void publish(Instant ts, String type, String key, Object data) {
  }
}
