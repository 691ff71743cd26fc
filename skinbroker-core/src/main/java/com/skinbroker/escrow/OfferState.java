package com.skinbroker.escrow;

import java.util.EnumSet;
import java.util.Set;

/**
 * Trade offer states as numbered by the Steam Web API.
 */
public enum OfferState {
  INVALID(1),
  ACTIVE(2),
  ACCEPTED(3),
  COUNTERED(4),
  EXPIRED(5),
  CANCELED(6),
  DECLINED(7),
  INVALID_ITEMS(8),
  CREATED_NEEDS_CONFIRMATION(9),
  CANCELED_BY_SECOND_FACTOR(10),
  IN_ESCROW(11);

  private static final Set<OfferState> FAILURES =
      EnumSet.of(EXPIRED, CANCELED, DECLINED, INVALID_ITEMS, CANCELED_BY_SECOND_FACTOR);

  private final int code;

  OfferState(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isFailure() {
    return FAILURES.contains(this);
  }

  public static OfferState fromCode(int code) {
    for (OfferState s : values()) {
      if (s.code == code) {
        return s;
      }
    }
    throw new IllegalArgumentException("Unknown offer state code: " + code);
  }
}
