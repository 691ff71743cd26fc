package com.skinbroker.agent;

public record AgentStartOutcome(
    String agentId,
    boolean success,
    int attempts,
    String error
) {

  public static AgentStartOutcome ok(String agentId, int attempts) {
    return new AgentStartOutcome(agentId, true, attempts, null);
  }

  public static AgentStartOutcome failed(String agentId, int attempts, String error) {
    return new AgentStartOutcome(agentId, false, attempts, error);
  }
}
