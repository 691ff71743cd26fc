package com.skinbroker.trade;

import java.util.List;

public record OfferRequest(
    String partnerTradeUrl,
    List<TradeItem> itemsToGive,
    List<TradeItem> itemsToReceive,
    String message
) {
  public OfferRequest {
    itemsToGive = itemsToGive == null ? List.of() : List.copyOf(itemsToGive);
    itemsToReceive = itemsToReceive == null ? List.of() : List.copyOf(itemsToReceive);
  }
}
