package com.skinbroker.escrow;

import com.skinbroker.config.BrokerProperties;
import com.skinbroker.error.BrokerException;
import com.skinbroker.error.ErrorCode;
import com.skinbroker.error.InvalidStateTransitionException;
import com.skinbroker.error.TradeNotFoundException;
import com.skinbroker.events.BrokerEventPublisher;
import com.skinbroker.events.BrokerEventTypes;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Single entry point for every trade status change.
 *
 * <p>Moving to the current status is a successful no-op, so duplicate events are harmless.
 * A transition outside {@link TradeStatus#allowedTargets()} is a caller bug: it is rejected,
 * logged at error and the trade is left untouched. Concurrent writers are serialized by the
 * repository's compare-and-set; the loser re-reads and re-validates.
 */
@Slf4j
public class EscrowStateMachine {

  private final TradeRepository repository;
  private final BrokerEventPublisher events;
  private final Clock clock;
  private final int maxTransitionAttempts;

  public EscrowStateMachine(
      @NonNull TradeRepository repository,
      @NonNull BrokerEventPublisher events,
      @NonNull Clock clock,
      @NonNull BrokerProperties.Escrow cfg
  ) {
    this.repository = repository;
    this.events = events;
    this.clock = clock;
    this.maxTransitionAttempts = Math.max(1, cfg.maxTransitionAttempts());
  }

  public Trade initiate(@NonNull NewTrade request) {
    request.validate();
    Trade trade = Trade.create(UUID.randomUUID().toString(), request, clock.instant());
    repository.insert(trade);
    log.info("trade initiated tradeId={} kind={} items={} price={} currency={}",
        trade.tradeId(), trade.kind(), trade.items().size(), trade.price(), trade.currency());
    return trade;
  }

  public Trade get(String tradeId) {
    return repository.load(tradeId).orElseThrow(() -> new TradeNotFoundException(tradeId));
  }

  public Optional<Trade> findByOfferId(String offerId) {
    return repository.findByOfferId(offerId);
  }

  public List<TradeTransition> history(String tradeId) {
    return repository.history(tradeId);
  }

  public TransitionResult transition(String tradeId, TradeStatus target, String reason) {
    return transition(tradeId, target, reason, UnaryOperator.identity());
  }

  /**
   * Moves the trade to {@code target}, applying {@code changes} (offer ids, agent, attempts) in the
   * same write. When the trade is already in {@code target} the changes are still stored, but the
   * result reports {@code applied=false}.
   *
   * @throws InvalidStateTransitionException if {@code target} is not reachable from the current status
   * @throws TradeNotFoundException          if the trade does not exist
   */
  public TransitionResult transition(String tradeId, @NonNull TradeStatus target, String reason, @NonNull UnaryOperator<Trade> changes) {
    for (int attempt = 1; attempt <= maxTransitionAttempts; attempt++) {
      Trade current = get(tradeId);
      TradeStatus from = current.status();

      if (from == target) {
        Trade annotated = changes.apply(current);
        if (annotated.equals(current)) {
          log.debug("trade transition no-op tradeId={} status={} reason={}", tradeId, target, reason);
          return TransitionResult.unchanged(current);
        }
        Trade updated = annotated.withStatus(target, clock.instant());
        if (repository.compareAndSet(current.version(), updated, null)) {
          return TransitionResult.unchanged(updated);
        }
        continue;
      }

      if (!from.canTransitionTo(target)) {
        log.error("invalid trade status transition rejected tradeId={} from={} to={} reason={}", tradeId, from, target, reason);
        throw new InvalidStateTransitionException(tradeId, from, target);
      }

      Instant now = clock.instant();
      Trade updated = changes.apply(current).withStatus(target, now);
      TradeTransition transition = new TradeTransition(tradeId, from, target, reason, now);
      if (repository.compareAndSet(current.version(), updated, transition)) {
        log.info("trade status changed tradeId={} from={} to={} reason={}", tradeId, from, target, reason);
        publish(transition);
        return TransitionResult.applied(updated);
      }
      log.debug("trade transition lost race, retrying tradeId={} target={} attempt={}", tradeId, target, attempt);
    }
    log.error("trade transition gave up after concurrent updates tradeId={} target={} attempts={}", tradeId, target, maxTransitionAttempts);
    throw new BrokerException(ErrorCode.INTERNAL_ERROR, "Concurrent updates on trade " + tradeId, true);
  }

  private void publish(TradeTransition transition) {
    if (!events.isEnabled()) {
      return;
    }
    events.publish(transition.at(), BrokerEventTypes.TRADE_STATUS_CHANGED, transition.tradeId(), transition);
  }
}
