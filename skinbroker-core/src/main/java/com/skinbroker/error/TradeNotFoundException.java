package com.skinbroker.error;

public final class TradeNotFoundException extends BrokerException {

  private final String tradeId;

  public TradeNotFoundException(String tradeId) {
    super(ErrorCode.TRADE_NOT_FOUND, "Trade not found: " + tradeId, false);
    this.tradeId = tradeId;
  }

  public String tradeId() {
    return tradeId;
  }
}
