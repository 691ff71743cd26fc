package com.skinbroker.error;

/**
 * Failure reported by an agent transport. Network-class failures are retryable,
 * validation-class failures (bad trade URL, items no longer tradable) are not.
 */
public final class TransportException extends BrokerException {

  private TransportException(String message, boolean retryable, Throwable cause) {
    super(ErrorCode.TRANSPORT_ERROR, message, retryable, cause);
  }

  public static TransportException network(String message, Throwable cause) {
    return new TransportException(message, true, cause);
  }

  public static TransportException network(String message) {
    return new TransportException(message, true, null);
  }

  public static TransportException rejected(String message) {
    return new TransportException(message, false, null);
  }
}
