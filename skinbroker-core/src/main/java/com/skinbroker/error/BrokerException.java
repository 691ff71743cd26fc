package com.skinbroker.error;

import java.util.Objects;

public class BrokerException extends RuntimeException {

  private final ErrorCode code;
  private final boolean retryable;

  public BrokerException(ErrorCode code, String message, boolean retryable) {
    this(code, message, retryable, null);
  }

  public BrokerException(ErrorCode code, String message, boolean retryable, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.retryable = retryable;
  }

  public ErrorCode code() {
    return code;
  }

  public boolean retryable() {
    return retryable;
  }
}
