package com.skinbroker.agent;

public enum AgentStatus {
  OFFLINE,
  CONNECTING,
  ONLINE,
}
