package com.skinbroker.agent;

public enum AgentEventType {
  LOGIN_SUCCEEDED,
  LOGIN_FAILED,
  OFFER_SENT,
  SESSION_EXPIRED,
}
