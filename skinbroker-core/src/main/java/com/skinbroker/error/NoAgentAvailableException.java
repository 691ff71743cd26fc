package com.skinbroker.error;

public final class NoAgentAvailableException extends BrokerException {

  public NoAgentAvailableException() {
    super(ErrorCode.NO_AGENT_AVAILABLE, "No available agents with capacity", true);
  }
}
