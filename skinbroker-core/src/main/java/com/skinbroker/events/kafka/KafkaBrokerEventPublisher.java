package com.skinbroker.events.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skinbroker.events.BrokerEventEnvelope;
import com.skinbroker.events.BrokerEventPublisher;
import com.skinbroker.events.BrokerEventTypes;
import com.skinbroker.events.BrokerEventsProperties;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.kafka.core.KafkaTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes broker events as JSON {@link BrokerEventEnvelope}s. The record key is the trade or agent
 * id; {@value #TYPE_HEADER} and {@value #ID_HEADER} headers let consumers route without parsing.
 *
 * <p>Serialization and send failures are logged and counted, never thrown to the caller.
 */
@Slf4j
public final class KafkaBrokerEventPublisher implements BrokerEventPublisher {

  public static final String TYPE_HEADER = "skinbroker-event-type";
  public static final String ID_HEADER = "skinbroker-event-id";

  private final String topic;
  private final KafkaTemplate<String, String> kafkaTemplate;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final String source;

  private final AtomicLong published = new AtomicLong(0);
  private final AtomicLong failed = new AtomicLong(0);

  public KafkaBrokerEventPublisher(
      @NonNull BrokerEventsProperties properties,
      @NonNull KafkaTemplate<String, String> kafkaTemplate,
      @NonNull ObjectMapper objectMapper,
      @NonNull Clock clock,
      @NonNull String source
  ) {
    this.topic = properties.topic();
    this.kafkaTemplate = kafkaTemplate;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.source = source;
  }

  @Override
  public boolean isEnabled() {
    return true;
  }

  /**
   * @throws IllegalArgumentException if {@code type} is not one of {@link BrokerEventTypes#ALL}
   */
  @Override
  public void publish(Instant ts, String type, String key, Object data) {
    if (!BrokerEventTypes.ALL.contains(type)) {
      throw new IllegalArgumentException("Unknown broker event type: " + type);
    }
    BrokerEventEnvelope envelope = new BrokerEventEnvelope(
        BrokerEventEnvelope.CURRENT_VERSION,
        UUID.randomUUID().toString(),
        type,
        ts != null ? ts : clock.instant(),
        source,
        key,
        data
    );

    String json;
    try {
      json = objectMapper.writeValueAsString(envelope);
    } catch (JsonProcessingException e) {
      failed.incrementAndGet();
      log.error("broker event not serializable type={} key={} error={}", type, key, e.getOriginalMessage());
      return;
    }

    ProducerRecord<String, String> record = new ProducerRecord<>(topic, key, json);
    record.headers().add(TYPE_HEADER, type.getBytes(StandardCharsets.UTF_8));
    record.headers().add(ID_HEADER, envelope.eventId().getBytes(StandardCharsets.UTF_8));
    kafkaTemplate.send(record).whenComplete((result, ex) -> {
      if (ex == null) {
        published.incrementAndGet();
        return;
      }
      long n = failed.incrementAndGet();
      log.warn("broker event publish failed topic={} type={} key={} eventId={} failures={} error={}",
          topic, type, key, envelope.eventId(), n, ex.toString());
    });
  }

  public long publishedCount() {
    return published.get();
  }

  public long failedCount() {
    return failed.get();
  }
}
