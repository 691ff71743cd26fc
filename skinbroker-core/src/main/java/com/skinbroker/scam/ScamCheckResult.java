package com.skinbroker.scam;

public record ScamCheckResult(boolean passed, String reason) {

  private static final ScamCheckResult PASS = new ScamCheckResult(true, null);

  public static ScamCheckResult pass() {
    return PASS;
  }

  public static ScamCheckResult blocked(String reason) {
    return new ScamCheckResult(false, reason == null || reason.isBlank() ? "blocked" : reason);
  }
}
