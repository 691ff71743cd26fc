package com.skinbroker.queue;

public enum JobStatus {
  QUEUED,
  PROCESSING,
  SUCCEEDED,
  FAILED_RETRYABLE,
  FAILED_TERMINAL,
  CANCELLED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED_TERMINAL || this == CANCELLED;
  }
}
