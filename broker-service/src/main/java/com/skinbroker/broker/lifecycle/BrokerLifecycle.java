package com.skinbroker.broker.lifecycle;

import com.skinbroker.agent.AgentConfig;
import com.skinbroker.agent.AgentPoolManager;
import com.skinbroker.agent.StartAllReport;
import com.skinbroker.config.BrokerProperties;
import com.skinbroker.error.DuplicateAgentException;
import com.skinbroker.queue.TradeDispatchQueue;
import jakarta.annotation.PreDestroy;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Registers the configured agents, logs them in and starts the dispatch worker once the context is up.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BrokerLifecycle {

  private final @NonNull BrokerProperties properties;
  private final @NonNull AgentPoolManager pool;
  private final @NonNull TradeDispatchQueue queue;

  @EventListener(ApplicationReadyEvent.class)
  public void start() {
    log.info("broker starting mode={} agents={}", properties.mode(), properties.pool().agents().size());
    for (BrokerProperties.AgentAccount account : properties.pool().agents()) {
      try {
        pool.register(new AgentConfig(account.accountName(), account.credentialsRef(), account.steamId()));
      } catch (DuplicateAgentException e) {
        log.warn("duplicate agent in configuration skipped agent={}", e.agentId());
      }
    }
    if (properties.pool().agents().isEmpty()) {
      log.warn("no agents configured (broker.pool.agents), every dispatch will fail with NO_AGENT_AVAILABLE");
    }

    StartAllReport report = pool.startAll();
    report.outcomes().stream()
        .filter(o -> !o.success())
        .forEach(o -> log.warn("agent failed to start agent={} attempts={} error={}", o.agentId(), o.attempts(), o.error()));

    queue.start();
    log.info("broker started agentsOnline={} agentsFailed={}", report.succeeded(), report.failed());
  }

  @PreDestroy
  public void stop() {
    queue.close();
    pool.close();
  }
}
