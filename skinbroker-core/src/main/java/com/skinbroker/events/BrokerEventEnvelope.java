package com.skinbroker.events;

import java.time.Instant;

/**
 * Wire form of every published event. Consumers switch on {@code type}; {@code version} changes only
 * when a field is removed or changes meaning.
 */
public record BrokerEventEnvelope(
    int version,
    String eventId,
    String type,
    Instant occurredAt,
    String source,
    String key,
    Object data
) {
  public static final int CURRENT_VERSION = 1;
}
