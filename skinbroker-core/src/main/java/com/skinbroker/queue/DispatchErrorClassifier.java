package com.skinbroker.queue;

import com.skinbroker.error.BrokerException;
import com.skinbroker.error.ErrorCode;

final class DispatchErrorClassifier {

  private DispatchErrorClassifier() {
  }

  static boolean isRetryable(Throwable t) {
    if (t instanceof BrokerException be) {
      return be.retryable();
    }
    if (t instanceof IllegalArgumentException || t instanceof IllegalStateException) {
      return false;
    }
    return true;
  }

  static ErrorCode codeOf(Throwable t) {
    if (t instanceof BrokerException be) {
      return be.code();
    }
    if (t instanceof IllegalArgumentException) {
      return ErrorCode.INVALID_REQUEST;
    }
    return ErrorCode.INTERNAL_ERROR;
  }
}
