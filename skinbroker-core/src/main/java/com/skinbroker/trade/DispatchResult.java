package com.skinbroker.trade;

public record DispatchResult(
    String tradeId,
    OfferLeg leg,
    String agentId,
    String offerId
) {}
