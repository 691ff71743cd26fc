package com.skinbroker.events;

import java.time.Instant;

public interface BrokerEventPublisher {

  boolean isEnabled();

  void publish(Instant ts, String type, String key, Object data);
}
