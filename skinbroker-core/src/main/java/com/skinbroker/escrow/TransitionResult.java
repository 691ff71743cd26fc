package com.skinbroker.escrow;

/**
 * @param applied {@code true} only when this call moved the trade to a new status. Side effects such as
 *                refunds and payouts must run only then.
 */
public record TransitionResult(Trade trade, boolean applied) {

  static TransitionResult applied(Trade trade) {
    return new TransitionResult(trade, true);
  }

  static TransitionResult unchanged(Trade trade) {
    return new TransitionResult(trade, false);
  }
}
