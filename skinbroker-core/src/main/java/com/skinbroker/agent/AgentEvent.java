package com.skinbroker.agent;

import java.time.Instant;

public record AgentEvent(
    String agentId,
    AgentEventType type,
    String detail,
    Instant at
) {}
