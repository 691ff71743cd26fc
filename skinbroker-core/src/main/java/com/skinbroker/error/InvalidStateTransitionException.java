package com.skinbroker.error;

public final class InvalidStateTransitionException extends BrokerException {

  private final String tradeId;
  private final String from;
  private final String to;

  public InvalidStateTransitionException(String tradeId, Enum<?> from, Enum<?> to) {
    super(ErrorCode.INVALID_STATE_TRANSITION, "Invalid status transition for trade " + tradeId + ": " + from + " -> " + to, false);
    this.tradeId = tradeId;
    this.from = String.valueOf(from);
    this.to = String.valueOf(to);
  }

  public String tradeId() {
    return tradeId;
  }

  public String from() {
    return from;
  }

  public String to() {
    return to;
  }
}
