package com.skinbroker.error;

public final class DuplicateAgentException extends BrokerException {

  private final String agentId;

  public DuplicateAgentException(String agentId) {
    super(ErrorCode.DUPLICATE_AGENT, "Agent already registered: " + agentId, false);
    this.agentId = agentId;
  }

  public String agentId() {
    return agentId;
  }
}
