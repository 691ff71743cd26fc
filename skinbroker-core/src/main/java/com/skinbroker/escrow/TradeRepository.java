package com.skinbroker.escrow;

import java.util.List;
import java.util.Optional;

/**
 * Storage for trades and their transition history. Implementations must make
 * {@link #compareAndSet} atomic per trade.
 */
public interface TradeRepository {

  /**
   * @throws IllegalStateException if a trade with the same id exists
   */
  void insert(Trade trade);

  Optional<Trade> load(String tradeId);

  Optional<Trade> findByOfferId(String offerId);

  /**
   * Stores {@code updated} only if the stored trade still has {@code expectedVersion}. When
   * {@code transition} is non-null it is appended to the history in the same step.
   */
  boolean compareAndSet(long expectedVersion, Trade updated, TradeTransition transition);

  List<TradeTransition> history(String tradeId);
}
