package com.skinbroker.queue;

public record QueueStats(
    int waiting,
    int delayed,
    boolean active,
    boolean paused,
    long succeeded,
    long failed,
    long retried,
    long cancelled
) {}
