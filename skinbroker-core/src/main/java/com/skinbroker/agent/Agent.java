package com.skinbroker.agent;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable per-agent state. Only {@link AgentPoolManager} touches it; everything else sees {@link AgentSnapshot}.
 */
final class Agent {

  private final AgentConfig config;
  private final AgentTransport transport;

  private final AtomicReference<AgentStatus> status = new AtomicReference<>(AgentStatus.OFFLINE);
  private final AtomicInteger activeTrades = new AtomicInteger(0);
  private final AtomicInteger inventoryCount = new AtomicInteger(0);
  private volatile boolean ready;
  private volatile Instant lastLoginAt;
  private volatile Instant lastHealthCheckAt;
  private volatile String lastError;

  Agent(AgentConfig config, AgentTransport transport) {
    this.config = config;
    this.transport = transport;
  }

  String id() {
    return config.id();
  }

  AgentTransport transport() {
    return transport;
  }

  AgentStatus status() {
    return status.get();
  }

  boolean isReady() {
    return ready;
  }

  int activeTrades() {
    return activeTrades.get();
  }

  int inventoryCount() {
    return inventoryCount.get();
  }

  boolean tryBeginConnecting() {
    return status.compareAndSet(AgentStatus.OFFLINE, AgentStatus.CONNECTING);
  }

  void markOnline(Instant at) {
    status.set(AgentStatus.ONLINE);
    lastLoginAt = at;
    lastError = null;
  }

  void markOffline(String error) {
    status.set(AgentStatus.OFFLINE);
    ready = false;
    if (error != null) {
      lastError = error;
    }
  }

  void markReady(int inventory) {
    inventoryCount.set(Math.max(0, inventory));
    ready = true;
  }

  void markNotReady(String error) {
    ready = false;
    lastError = error;
  }

  void recordError(String error) {
    lastError = error;
  }

  void markHealthChecked(Instant at) {
    lastHealthCheckAt = at;
  }

  void beginTrade() {
    activeTrades.incrementAndGet();
  }

  void finishTrade() {
    activeTrades.updateAndGet(v -> Math.max(0, v - 1));
  }

  AgentSnapshot snapshot() {
    return new AgentSnapshot(
        config.id(),
        config.steamId(),
        status.get(),
        ready,
        activeTrades.get(),
        inventoryCount.get(),
        lastLoginAt,
        lastHealthCheckAt,
        lastError
    );
  }
}
