package com.skinbroker.agent;

import com.skinbroker.config.BrokerProperties;
import com.skinbroker.error.BrokerException;
import com.skinbroker.error.DuplicateAgentException;
import com.skinbroker.error.NoAgentAvailableException;
import com.skinbroker.error.TradeBlockedException;
import com.skinbroker.error.TransportException;
import com.skinbroker.events.BrokerEventPublisher;
import com.skinbroker.events.BrokerEventTypes;
import com.skinbroker.ratelimit.RateLimiter;
import com.skinbroker.scam.ScamCheck;
import com.skinbroker.scam.ScamCheckResult;
import com.skinbroker.support.RetryPolicy;
import com.skinbroker.support.Sleeper;
import com.skinbroker.trade.DispatchResult;
import com.skinbroker.trade.TradeDispatcher;
import com.skinbroker.trade.TradeRequest;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the agent sessions: login lifecycle, periodic health checks and load-balanced selection
 * for outgoing offers.
 *
 * <p>Agents are keyed by account name. Per-agent counters are atomics, so selection and dispatch
 * never take a pool-wide lock; two concurrent dispatches may pick the same agent, which only skews
 * the balancing, never the counts.
 */
@Slf4j
public class AgentPoolManager implements TradeDispatcher, AgentEventSink, AutoCloseable {

  private static final Comparator<Agent> SELECTION_ORDER = Comparator
      .comparingInt(Agent::activeTrades)
      .thenComparingInt(Agent::inventoryCount)
      .thenComparing(Agent::id);

  private final int inventoryCapacityThreshold;
  private final long healthCheckIntervalMillis;
  private final RetryPolicy loginPolicy;
  private final AgentTransportFactory transportFactory;
  private final ScamCheck scamCheck;
  private final RateLimiter rateLimiter;
  private final BrokerEventPublisher events;
  private final Clock clock;
  private final Sleeper sleeper;

  private final Map<String, Agent> agentsById = new ConcurrentHashMap<>();
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicInteger loginThreads = new AtomicInteger(0);

  private final ExecutorService loginExecutor = Executors.newCachedThreadPool(r -> {
    Thread t = new Thread(r, "agent-login-" + loginThreads.incrementAndGet());
    t.setDaemon(true);
    return t;
  });
  private final ScheduledExecutorService healthExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
    Thread t = new Thread(r, "agent-health-check");
    t.setDaemon(true);
    return t;
  });
  private volatile ScheduledFuture<?> healthCheckTask;

  public AgentPoolManager(
      @NonNull BrokerProperties.Pool cfg,
      @NonNull AgentTransportFactory transportFactory,
      @NonNull ScamCheck scamCheck,
      @NonNull RateLimiter rateLimiter,
      @NonNull BrokerEventPublisher events,
      @NonNull Clock clock,
      @NonNull Sleeper sleeper
  ) {
    this.inventoryCapacityThreshold = cfg.inventoryCapacityThreshold();
    this.healthCheckIntervalMillis = cfg.healthCheckIntervalMillis();
    this.loginPolicy = new RetryPolicy(
        cfg.login().maxAttempts(),
        cfg.login().initialBackoffMillis(),
        cfg.login().maxBackoffMillis()
    );
    this.transportFactory = transportFactory;
    this.scamCheck = scamCheck;
    this.rateLimiter = rateLimiter;
    this.events = events;
    this.clock = clock;
    this.sleeper = sleeper;
  }

  public AgentSnapshot register(@NonNull AgentConfig config) {
    String id = config.id();
    if (agentsById.containsKey(id)) {
      throw new DuplicateAgentException(id);
    }
    AgentTransport transport = transportFactory.create(config, this);
    Agent agent = new Agent(config, transport);
    if (agentsById.putIfAbsent(id, agent) != null) {
      throw new DuplicateAgentException(id);
    }
    log.info("agent registered agent={}", id);
    return agent.snapshot();
  }

  /**
   * Removes the agent and logs its session out. Offers already in flight on it are left to fail on their own.
   */
  public boolean unregister(String agentId) {
    Agent agent = agentId == null ? null : agentsById.remove(agentId);
    if (agent == null) {
      return false;
    }
    logoutQuietly(agent);
    log.info("agent unregistered agent={} activeTrades={}", agentId, agent.activeTrades());
    return true;
  }

  /**
   * Logs every registered agent in concurrently and waits for all of them to settle.
   * A failing agent is reported in the result and left offline for the health check.
   */
  public StartAllReport startAll() {
    List<Agent> agents = List.copyOf(agentsById.values());
    log.info("starting agent pool agents={}", agents.size());

    List<CompletableFuture<AgentStartOutcome>> futures = agents.stream()
        .map(agent -> CompletableFuture
            .supplyAsync(() -> loginWithBackoff(agent), loginExecutor)
            .exceptionally(t -> {
              agent.markOffline(t.toString());
              return AgentStartOutcome.failed(agent.id(), 0, t.toString());
            }))
        .toList();
    List<AgentStartOutcome> outcomes = futures.stream().map(CompletableFuture::join).toList();
    StartAllReport report = StartAllReport.of(outcomes);

    running.set(true);
    scheduleHealthChecks();
    if (report.failed() > 0) {
      log.warn("agent pool started with failures succeeded={} failed={}", report.succeeded(), report.failed());
    } else {
      log.info("agent pool started succeeded={}", report.succeeded());
    }
    return report;
  }

  public void stopAll() {
    ScheduledFuture<?> task = healthCheckTask;
    if (task != null) {
      task.cancel(false);
      healthCheckTask = null;
    }
    for (Agent agent : agentsById.values()) {
      logoutQuietly(agent);
    }
    running.set(false);
    log.info("agent pool stopped agents={}", agentsById.size());
  }

  public boolean isRunning() {
    return running.get();
  }

  public Optional<AgentSnapshot> getAvailableAgent() {
    return selectAgent().map(Agent::snapshot);
  }

  public Optional<AgentSnapshot> getAgent(String agentId) {
    return Optional.ofNullable(agentId == null ? null : agentsById.get(agentId)).map(Agent::snapshot);
  }

  @Override
  public DispatchResult dispatchTrade(@NonNull TradeRequest request) {
    request.validate();

    ScamCheckResult check = runScamCheck(request);
    if (!check.passed()) {
      log.warn("trade blocked by scam check tradeId={} leg={} reason={}", request.tradeId(), request.leg(), check.reason());
      throw new TradeBlockedException(check.reason());
    }

    Agent agent = selectAgent().orElseThrow(NoAgentAvailableException::new);
    agent.beginTrade();
    try {
      rateLimiter.waitForSlot();
      String offerId = sendOffer(agent, request);
      log.info("offer sent tradeId={} leg={} agent={} offerId={}", request.tradeId(), request.leg(), agent.id(), offerId);
      return new DispatchResult(request.tradeId(), request.leg(), agent.id(), offerId);
    } finally {
      agent.finishTrade();
    }
  }

  /**
   * One pass over all agents: a single login attempt for every agent that is not online,
   * an inventory refresh for the rest.
   */
  public void runHealthCheck() {
    Instant now = clock.instant();
    for (Agent agent : agentsById.values()) {
      try {
        switch (agent.status()) {
          case OFFLINE -> {
            log.info("health check logging offline agent in agent={}", agent.id());
            attemptLogin(agent, 1);
          }
          case ONLINE -> refreshInventory(agent);
          case CONNECTING -> log.debug("health check skipping agent with login in progress agent={}", agent.id());
        }
      } catch (RuntimeException e) {
        agent.recordError(e.toString());
        log.warn("health check failed agent={} error={}", agent.id(), e.toString());
      }
      agent.markHealthChecked(now);
    }
  }

  @Override
  public void onAgentEvent(AgentEvent event) {
    if (event == null || event.agentId() == null) {
      return;
    }
    Agent agent = agentsById.get(event.agentId());
    if (agent == null) {
      log.debug("event for unknown agent ignored agent={} type={}", event.agentId(), event.type());
      return;
    }
    switch (event.type()) {
      case LOGIN_SUCCEEDED -> log.debug("agent session event agent={} type={}", agent.id(), event.type());
      case LOGIN_FAILED -> agent.recordError(event.detail());
      case OFFER_SENT -> log.debug("agent offer event agent={} detail={}", agent.id(), event.detail());
      case SESSION_EXPIRED -> {
        agent.markOffline("session expired");
        log.warn("agent session expired, marked offline agent={}", agent.id());
      }
    }
    publish(event);
  }

  public PoolStatistics statistics() {
    List<AgentSnapshot> snapshots = agentsById.values().stream()
        .map(Agent::snapshot)
        .sorted(Comparator.comparing(AgentSnapshot::id))
        .toList();
    int online = (int) snapshots.stream().filter(s -> s.status() == AgentStatus.ONLINE).count();
    int ready = (int) snapshots.stream().filter(AgentSnapshot::ready).count();
    int active = snapshots.stream().mapToInt(AgentSnapshot::activeTrades).sum();
    return new PoolStatistics(running.get(), snapshots.size(), online, snapshots.size() - online, ready, active, snapshots);
  }

  @Override
  public void close() {
    if (running.get()) {
      stopAll();
    }
    healthExecutor.shutdownNow();
    loginExecutor.shutdownNow();
  }

  Agent agent(String agentId) {
    return agentsById.get(agentId);
  }

  private Optional<Agent> selectAgent() {
    return agentsById.values().stream()
        .filter(a -> a.status() == AgentStatus.ONLINE)
        .filter(Agent::isReady)
        .filter(a -> a.inventoryCount() < inventoryCapacityThreshold)
        .min(SELECTION_ORDER);
  }

  private ScamCheckResult runScamCheck(TradeRequest request) {
    try {
      ScamCheckResult result = scamCheck.preTradeCheck(request);
      return result == null ? ScamCheckResult.pass() : result;
    } catch (RuntimeException e) {
      log.warn("scam check unavailable, proceeding tradeId={} error={}", request.tradeId(), e.toString());
      return ScamCheckResult.pass();
    }
  }

  private String sendOffer(Agent agent, TradeRequest request) {
    String offerId;
    try {
      offerId = agent.transport().sendOffer(request.toOfferRequest());
    } catch (BrokerException e) {
      throw e;
    } catch (RuntimeException e) {
      throw TransportException.network("sendOffer failed on agent " + agent.id(), e);
    }
    if (offerId == null || offerId.isBlank()) {
      throw TransportException.network("agent " + agent.id() + " returned no offer id");
    }
    return offerId;
  }

  private AgentStartOutcome loginWithBackoff(Agent agent) {
    for (int attempt = 1; attempt <= loginPolicy.maxAttempts(); attempt++) {
      LoginAttempt result = attemptLogin(agent, attempt);
      if (result == LoginAttempt.SUCCEEDED) {
        return AgentStartOutcome.ok(agent.id(), attempt);
      }
      if (result == LoginAttempt.SKIPPED) {
        return agent.status() == AgentStatus.ONLINE
            ? AgentStartOutcome.ok(agent.id(), attempt - 1)
            : AgentStartOutcome.failed(agent.id(), attempt - 1, "login already in progress");
      }
      if (!loginPolicy.canRetry(attempt)) {
        break;
      }
      long delay = RetryPolicy.jitter(loginPolicy.computeDelayMillis(attempt));
      if (!sleeper.sleep(delay)) {
        return AgentStartOutcome.failed(agent.id(), attempt, "interrupted");
      }
    }
    log.error("agent login attempts exhausted, left offline agent={} attempts={} error={}",
        agent.id(), loginPolicy.maxAttempts(), agent.snapshot().lastError());
    return AgentStartOutcome.failed(agent.id(), loginPolicy.maxAttempts(), agent.snapshot().lastError());
  }

  private LoginAttempt attemptLogin(Agent agent, int attempt) {
    if (!agent.tryBeginConnecting()) {
      return LoginAttempt.SKIPPED;
    }
    try {
      agent.transport().login();
    } catch (RuntimeException e) {
      agent.markOffline(e.getMessage() == null ? e.toString() : e.getMessage());
      log.warn("agent login failed agent={} attempt={} error={}", agent.id(), attempt, e.toString());
      return LoginAttempt.FAILED;
    }
    agent.markOnline(clock.instant());
    log.info("agent online agent={} attempt={}", agent.id(), attempt);
    refreshInventory(agent);
    return LoginAttempt.SUCCEEDED;
  }

  private void refreshInventory(Agent agent) {
    try {
      int inventory = agent.transport().inventoryCount();
      agent.markReady(inventory);
      if (inventory >= inventoryCapacityThreshold) {
        log.warn("agent inventory at capacity agent={} inventory={} threshold={}", agent.id(), inventory, inventoryCapacityThreshold);
      }
    } catch (RuntimeException e) {
      agent.markNotReady(e.toString());
      log.warn("agent inventory refresh failed, marked not ready agent={} error={}", agent.id(), e.toString());
    }
  }

  private void scheduleHealthChecks() {
    if (healthCheckTask != null) {
      return;
    }
    healthCheckTask = healthExecutor.scheduleWithFixedDelay(
        this::runHealthCheckSafely,
        healthCheckIntervalMillis,
        healthCheckIntervalMillis,
        TimeUnit.MILLISECONDS
    );
  }

  private void runHealthCheckSafely() {
    try {
      runHealthCheck();
    } catch (Exception e) {
      log.error("health check pass failed error={}", e.toString(), e);
    }
  }

  private void logoutQuietly(Agent agent) {
    try {
      agent.transport().logout();
    } catch (RuntimeException e) {
      log.warn("agent logout failed agent={} error={}", agent.id(), e.toString());
    }
    agent.markOffline(null);
  }

  private void publish(AgentEvent event) {
    if (!events.isEnabled()) {
      return;
    }
    Instant at = event.at() != null ? event.at() : clock.instant();
    events.publish(at, BrokerEventTypes.AGENT_EVENT, event.agentId(), event);
  }

  private enum LoginAttempt {
    SUCCEEDED,
    FAILED,
    SKIPPED,
  }
}
