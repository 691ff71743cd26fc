package com.skinbroker.queue;

import com.skinbroker.error.ErrorCode;
import com.skinbroker.trade.DispatchResult;

/**
 * Receives the final outcome of every dispatch job. Success and failure arrive on the queue worker
 * thread, a cancellation on the thread that cancelled the job.
 * Retryable failures that will be retried are not reported.
 */
public interface DispatchOutcomeListener {

  void onDispatchSucceeded(JobHandle job, DispatchResult result);

  void onDispatchFailed(JobHandle job, ErrorCode code, String message);

  /**
   * The job was cancelled before it was dispatched. No offer was sent for it.
   */
  void onDispatchCancelled(JobHandle job);

  static DispatchOutcomeListener noop() {
    return new DispatchOutcomeListener() {
      @Override
      public void onDispatchSucceeded(JobHandle job, DispatchResult result) {
      }

      @Override
      public void onDispatchFailed(JobHandle job, ErrorCode code, String message) {
      }

      @Override
      public void onDispatchCancelled(JobHandle job) {
      }
    };
  }
}
