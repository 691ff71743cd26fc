package com.skinbroker.error;

public final class LoginException extends BrokerException {

  private final String agentId;

  public LoginException(String agentId, String message) {
    this(agentId, message, null);
  }

  public LoginException(String agentId, String message, Throwable cause) {
    super(ErrorCode.LOGIN_FAILED, "Login failed for " + agentId + ": " + message, true, cause);
    this.agentId = agentId;
  }

  public String agentId() {
    return agentId;
  }
}
