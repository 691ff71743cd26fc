package com.skinbroker.queue;

import com.skinbroker.error.ErrorCode;
import com.skinbroker.trade.TradeRequest;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Live view of one queued dispatch. Stays readable after the queue has dropped the job.
 */
public final class JobHandle {

  private final String jobId;
  private final TradeRequest payload;
  private final Instant enqueuedAt;
  private final AtomicReference<JobStatus> status = new AtomicReference<>(JobStatus.QUEUED);
  private final AtomicInteger attempts = new AtomicInteger(0);
  private volatile ErrorCode lastErrorCode;
  private volatile String lastError;
  private volatile Instant updatedAt;

  JobHandle(String jobId, TradeRequest payload, Instant enqueuedAt) {
    this.jobId = Objects.requireNonNull(jobId, "jobId");
    this.payload = Objects.requireNonNull(payload, "payload");
    this.enqueuedAt = enqueuedAt;
    this.updatedAt = enqueuedAt;
  }

  public String jobId() {
    return jobId;
  }

  public String tradeId() {
    return payload.tradeId();
  }

  public TradeRequest payload() {
    return payload;
  }

  public JobStatus status() {
    return status.get();
  }

  public int attempts() {
    return attempts.get();
  }

  public ErrorCode lastErrorCode() {
    return lastErrorCode;
  }

  public String lastError() {
    return lastError;
  }

  public Instant enqueuedAt() {
    return enqueuedAt;
  }

  public Instant updatedAt() {
    return updatedAt;
  }

  boolean transition(JobStatus from, JobStatus to, Instant at) {
    if (status.compareAndSet(from, to)) {
      updatedAt = at;
      return true;
    }
    return false;
  }

  int beginAttempt() {
    return attempts.incrementAndGet();
  }

  void recordError(ErrorCode code, String message) {
    this.lastErrorCode = code;
    this.lastError = message;
  }

  @Override
  public String toString() {
    return "JobHandle{jobId=" + jobId + ", tradeId=" + payload.tradeId() + ", leg=" + payload.leg()
        + ", status=" + status.get() + ", attempts=" + attempts.get() + "}";
  }
}
