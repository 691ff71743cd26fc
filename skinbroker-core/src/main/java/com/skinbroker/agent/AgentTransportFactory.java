package com.skinbroker.agent;

@FunctionalInterface
public interface AgentTransportFactory {

  AgentTransport create(AgentConfig config, AgentEventSink events);
}
