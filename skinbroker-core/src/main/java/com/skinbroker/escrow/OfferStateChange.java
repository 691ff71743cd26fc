package com.skinbroker.escrow;

import com.skinbroker.trade.TradeItem;

import java.time.Instant;
import java.util.List;

/**
 * @param receivedItems items that landed in the agent inventory, with their new asset ids. Only set for
 *                      accepted offers that moved items to the agent.
 */
public record OfferStateChange(
    String offerId,
    OfferState state,
    List<TradeItem> receivedItems,
    Instant at
) {
  public OfferStateChange {
    receivedItems = receivedItems == null ? List.of() : List.copyOf(receivedItems);
  }
}
