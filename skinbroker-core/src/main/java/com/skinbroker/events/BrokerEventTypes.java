package com.skinbroker.events;

import java.util.Set;

/**
 * Event types published by the broker. Trade and job events are keyed by trade id, agent events by
 * agent id, so one partition sees a trade's events in order.
 */
public final class BrokerEventTypes {

  public static final String TRADE_STATUS_CHANGED = "escrow.trade.status_changed";
  public static final String DISPATCH_JOB_SUCCEEDED = "dispatch.job.succeeded";
  public static final String DISPATCH_JOB_FAILED = "dispatch.job.failed";
  public static final String DISPATCH_JOB_CANCELLED = "dispatch.job.cancelled";
  public static final String AGENT_EVENT = "agent.event";

  public static final Set<String> ALL = Set.of(
      TRADE_STATUS_CHANGED,
      DISPATCH_JOB_SUCCEEDED,
      DISPATCH_JOB_FAILED,
      DISPATCH_JOB_CANCELLED,
      AGENT_EVENT
  );

  private BrokerEventTypes() {
  }
}
