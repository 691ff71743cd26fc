package com.skinbroker.escrow;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum TradeStatus {
  PENDING_PAYMENT,
  PAYMENT_RECEIVED,
  AWAITING_SELLER,
  AWAITING_BUYER,
  COMPLETED,
  CANCELLED,
  FAILED;

  private static final Map<TradeStatus, Set<TradeStatus>> ALLOWED = new EnumMap<>(TradeStatus.class);

  static {
    ALLOWED.put(PENDING_PAYMENT, EnumSet.of(PAYMENT_RECEIVED, CANCELLED));
    ALLOWED.put(PAYMENT_RECEIVED, EnumSet.of(AWAITING_SELLER, AWAITING_BUYER, FAILED));
    ALLOWED.put(AWAITING_SELLER, EnumSet.of(AWAITING_BUYER, COMPLETED, FAILED));
    ALLOWED.put(AWAITING_BUYER, EnumSet.of(COMPLETED, FAILED));
    ALLOWED.put(COMPLETED, EnumSet.noneOf(TradeStatus.class));
    ALLOWED.put(CANCELLED, EnumSet.noneOf(TradeStatus.class));
    ALLOWED.put(FAILED, EnumSet.noneOf(TradeStatus.class));
  }

  public Set<TradeStatus> allowedTargets() {
    return Collections.unmodifiableSet(ALLOWED.get(this));
  }

  public boolean canTransitionTo(TradeStatus target) {
    return target != null && ALLOWED.get(this).contains(target);
  }

  public boolean isTerminal() {
    return ALLOWED.get(this).isEmpty();
  }
}
