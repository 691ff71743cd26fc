package com.skinbroker.trade;

/**
 * Sends one offer leg through some agent. Blocks until the external API has answered.
 */
@FunctionalInterface
public interface TradeDispatcher {

  DispatchResult dispatchTrade(TradeRequest request);
}
