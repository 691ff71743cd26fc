package com.skinbroker.error;

public final class InvalidTradeRequestException extends BrokerException {

  public InvalidTradeRequestException(String message) {
    super(ErrorCode.INVALID_REQUEST, message, false);
  }
}
