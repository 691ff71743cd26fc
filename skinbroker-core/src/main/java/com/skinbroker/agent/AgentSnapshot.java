package com.skinbroker.agent;

import java.time.Instant;

public record AgentSnapshot(
    String id,
    String steamId,
    AgentStatus status,
    boolean ready,
    int activeTrades,
    int inventoryCount,
    Instant lastLoginAt,
    Instant lastHealthCheckAt,
    String lastError
) {}
