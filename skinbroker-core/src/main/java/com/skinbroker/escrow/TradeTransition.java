package com.skinbroker.escrow;

import java.time.Instant;

public record TradeTransition(
    String tradeId,
    TradeStatus from,
    TradeStatus to,
    String reason,
    Instant at
) {}
