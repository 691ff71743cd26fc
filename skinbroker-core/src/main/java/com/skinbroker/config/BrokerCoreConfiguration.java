package com.skinbroker.config;

import com.skinbroker.agent.AgentPoolManager;
import com.skinbroker.agent.AgentTransportFactory;
import com.skinbroker.escrow.EscrowDispatchOutcomeHandler;
import com.skinbroker.escrow.EscrowService;
import com.skinbroker.escrow.EscrowStateMachine;
import com.skinbroker.escrow.InMemoryTradeRepository;
import com.skinbroker.escrow.LoggingSettlementGateway;
import com.skinbroker.escrow.OfferStatusListener;
import com.skinbroker.escrow.SettlementGateway;
import com.skinbroker.escrow.TradeRepository;
import com.skinbroker.escrow.UnmatchedOfferEvents;
import com.skinbroker.events.BrokerEventPublisher;
import com.skinbroker.queue.TradeDispatchQueue;
import com.skinbroker.ratelimit.RateLimiter;
import com.skinbroker.ratelimit.RedisRateWindowStore;
import com.skinbroker.ratelimit.WindowedRateLimiter;
import com.skinbroker.scam.ScamCheck;
import com.skinbroker.support.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Slf4j
@Configuration(proxyBeanMethods = false)
public class BrokerCoreConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public Sleeper sleeper() {
    return Sleeper.system();
  }

  @Bean
  public RateLimiter steamRateLimiter(
      BrokerProperties properties,
      ObjectProvider<StringRedisTemplate> redisTemplate,
      Clock clock,
      Sleeper sleeper
  ) {
    BrokerProperties.RateLimit cfg = properties.rateLimit();
    if (!cfg.enabled()) {
      log.warn("steam rate limiter disabled (broker.rate-limit.enabled=false)");
      return RateLimiter.noop();
    }
    StringRedisTemplate template = redisTemplate.getIfAvailable();
    if (template == null) {
      throw new IllegalStateException("broker.rate-limit.enabled=true requires a Redis connection (spring.data.redis.*)");
    }
    log.info("steam rate limiter maxRequests={} windowMillis={} failMode={}", cfg.maxRequests(), cfg.windowMillis(), cfg.failMode());
    return new WindowedRateLimiter(new RedisRateWindowStore(template, clock), cfg, clock, sleeper);
  }

  @Bean
  @ConditionalOnMissingBean
  public ScamCheck scamCheck() {
    log.warn("no scam check configured, every trade passes the pre-trade check");
    return ScamCheck.allowAll();
  }

  @Bean
  @ConditionalOnMissingBean
  public SettlementGateway settlementGateway() {
    return new LoggingSettlementGateway();
  }

  @Bean
  @ConditionalOnMissingBean
  public TradeRepository tradeRepository() {
    return new InMemoryTradeRepository();
  }

  @Bean
  public AgentPoolManager agentPoolManager(
      BrokerProperties properties,
      AgentTransportFactory transportFactory,
      ScamCheck scamCheck,
      RateLimiter steamRateLimiter,
      BrokerEventPublisher events,
      Clock clock,
      Sleeper sleeper
  ) {
    return new AgentPoolManager(properties.pool(), transportFactory, scamCheck, steamRateLimiter, events, clock, sleeper);
  }

  @Bean
  public EscrowStateMachine escrowStateMachine(
      BrokerProperties properties,
      TradeRepository tradeRepository,
      BrokerEventPublisher events,
      Clock clock
  ) {
    return new EscrowStateMachine(tradeRepository, events, clock, properties.escrow());
  }

  @Bean
  public UnmatchedOfferEvents unmatchedOfferEvents(BrokerProperties properties, Clock clock) {
    return new UnmatchedOfferEvents(properties.escrow(), clock);
  }

  @Bean
  public EscrowDispatchOutcomeHandler escrowDispatchOutcomeHandler(
      EscrowStateMachine stateMachine,
      SettlementGateway settlementGateway,
      UnmatchedOfferEvents unmatchedOfferEvents
  ) {
    return new EscrowDispatchOutcomeHandler(stateMachine, settlementGateway, unmatchedOfferEvents);
  }

  @Bean
  public TradeDispatchQueue tradeDispatchQueue(
      BrokerProperties properties,
      AgentPoolManager agentPoolManager,
      EscrowDispatchOutcomeHandler outcomeHandler,
      BrokerEventPublisher events,
      Clock clock
  ) {
    return new TradeDispatchQueue(agentPoolManager, outcomeHandler, properties.queue(), events, clock);
  }

  @Bean
  public EscrowService escrowService(
      EscrowStateMachine stateMachine,
      TradeDispatchQueue tradeDispatchQueue,
      SettlementGateway settlementGateway
  ) {
    return new EscrowService(stateMachine, tradeDispatchQueue, settlementGateway);
  }

  @Bean
  public OfferStatusListener offerStatusListener(
      EscrowStateMachine stateMachine,
      EscrowService escrowService,
      SettlementGateway settlementGateway,
      UnmatchedOfferEvents unmatchedOfferEvents
  ) {
    return new OfferStatusListener(stateMachine, escrowService, settlementGateway, unmatchedOfferEvents);
  }
}
