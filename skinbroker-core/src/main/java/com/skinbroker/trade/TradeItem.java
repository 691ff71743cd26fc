package com.skinbroker.trade;

import com.skinbroker.error.InvalidTradeRequestException;

/**
 * One inventory item. {@code appId} 730 / {@code contextId} "2" is the CS2 inventory.
 */
public record TradeItem(
    String assetId,
    Integer appId,
    String contextId
) {
  public static final int DEFAULT_APP_ID = 730;
  public static final String DEFAULT_CONTEXT_ID = "2";

  public TradeItem {
    if (assetId == null || assetId.isBlank()) {
      throw new InvalidTradeRequestException("assetId is required");
    }
    assetId = assetId.trim();
    if (appId == null) {
      appId = DEFAULT_APP_ID;
    }
    if (contextId == null || contextId.isBlank()) {
      contextId = DEFAULT_CONTEXT_ID;
    }
  }

  public static TradeItem of(String assetId) {
    return new TradeItem(assetId, null, null);
  }
}
