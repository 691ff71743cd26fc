package com.skinbroker.agent;

import java.util.List;

public record PoolStatistics(
    boolean running,
    int total,
    int online,
    int offline,
    int ready,
    int activeTrades,
    List<AgentSnapshot> agents
) {}
