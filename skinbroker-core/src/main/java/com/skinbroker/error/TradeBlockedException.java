package com.skinbroker.error;

public final class TradeBlockedException extends BrokerException {

  private final String reason;

  public TradeBlockedException(String reason) {
    super(ErrorCode.TRADE_BLOCKED, "Trade blocked: " + reason, false);
    this.reason = reason;
  }

  public String reason() {
    return reason;
  }
}
