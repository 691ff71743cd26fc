package com.skinbroker.error;

public final class RateLimitUnavailableException extends BrokerException {

  public RateLimitUnavailableException(String message, Throwable cause) {
    super(ErrorCode.RATE_LIMIT_UNAVAILABLE, message, true, cause);
  }
}
