package com.skinbroker.escrow;

/**
 * Money side of a trade. Called at most once per trade, after the terminal transition has been stored.
 */
public interface SettlementGateway {

  void refund(Trade trade, String reason);

  void payout(Trade trade);
}
