package com.skinbroker.agent;

/**
 * Receives session events from a transport. Implementations must not block.
 */
@FunctionalInterface
public interface AgentEventSink {

  void onAgentEvent(AgentEvent event);
}
