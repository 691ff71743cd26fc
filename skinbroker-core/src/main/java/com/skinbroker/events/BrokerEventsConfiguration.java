package com.skinbroker.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skinbroker.events.kafka.KafkaBrokerEventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;

/**
 * Kafka publisher when {@code broker.events.enabled=true}, otherwise a no-op publisher.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class BrokerEventsConfiguration {

  @Bean
  @ConditionalOnProperty(prefix = "broker.events", name = "enabled", havingValue = "true")
  public BrokerEventPublisher kafkaBrokerEventPublisher(
      BrokerEventsProperties properties,
      KafkaTemplate<String, String> kafkaTemplate,
      ObjectMapper objectMapper,
      Clock clock,
      @Value("${spring.application.name:broker-service}") String source
  ) {
    log.info("broker events enabled topic={} source={}", properties.topic(), source);
    return new KafkaBrokerEventPublisher(properties, kafkaTemplate, objectMapper, clock, source);
  }

  @Bean
  @ConditionalOnMissingBean(BrokerEventPublisher.class)
  public BrokerEventPublisher noopBrokerEventPublisher() {
    return new NoopBrokerEventPublisher();
  }
}
