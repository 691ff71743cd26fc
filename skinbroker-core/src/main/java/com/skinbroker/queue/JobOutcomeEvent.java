package com.skinbroker.queue;

import com.skinbroker.error.ErrorCode;
import com.skinbroker.trade.OfferLeg;

public record JobOutcomeEvent(
    String jobId,
    String tradeId,
    OfferLeg leg,
    JobStatus status,
    int attempts,
    String agentId,
    String offerId,
    ErrorCode errorCode
) {}
