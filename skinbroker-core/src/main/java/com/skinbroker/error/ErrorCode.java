package com.skinbroker.error;

/**
 * Stable error codes returned to callers. Never rename an existing constant.
 */
public enum ErrorCode {
  DUPLICATE_AGENT,
  LOGIN_FAILED,
  NO_AGENT_AVAILABLE,
  TRADE_BLOCKED,
  INVALID_STATE_TRANSITION,
  TRANSPORT_ERROR,
  RATE_LIMIT_UNAVAILABLE,
  INVALID_REQUEST,
  TRADE_NOT_FOUND,
  INTERNAL_ERROR,
}
