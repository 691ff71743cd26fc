package com.skinbroker.agent;

import java.util.List;

public record StartAllReport(
    List<AgentStartOutcome> outcomes,
    int succeeded,
    int failed
) {

  public static StartAllReport of(List<AgentStartOutcome> outcomes) {
    int ok = (int) outcomes.stream().filter(AgentStartOutcome::success).count();
    return new StartAllReport(List.copyOf(outcomes), ok, outcomes.size() - ok);
  }
}
