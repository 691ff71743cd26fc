package com.skinbroker.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skinbroker.events.kafka.KafkaBrokerEventPublisher;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class BrokerEventsConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(TestConfig.class, BrokerEventsConfiguration.class);

  @Test
  void noopPublisherByDefault() {
    runner.run(context -> assertThat(context.getBean(BrokerEventPublisher.class))
        .isInstanceOf(NoopBrokerEventPublisher.class));
  }

  @Test
  void kafkaPublisherWhenEnabled() {
    runner.withPropertyValues("broker.events.enabled=true", "spring.application.name=broker-test")
        .run(context -> {
          assertThat(context).hasSingleBean(BrokerEventPublisher.class);
          BrokerEventPublisher publisher = context.getBean(BrokerEventPublisher.class);
          assertThat(publisher).isInstanceOf(KafkaBrokerEventPublisher.class);
          assertThat(publisher.isEnabled()).isTrue();
        });
  }

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(BrokerEventsProperties.class)
  static class TestConfig {

    @Bean
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, String> kafkaTemplate() {
      return mock(KafkaTemplate.class);
    }

    @Bean
    ObjectMapper objectMapper() {
      return new ObjectMapper();
    }

    @Bean
    Clock clock() {
      return Clock.systemUTC();
    }
  }
}
