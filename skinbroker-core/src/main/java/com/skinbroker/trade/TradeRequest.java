package com.skinbroker.trade;

import com.skinbroker.error.InvalidTradeRequestException;

import java.util.List;

/**
 * Payload of one dispatch: a single offer leg of an escrow trade.
 *
 * @param partnerTradeUrl trade URL of the user on the other side of this leg
 * @param partnerSteamId  steam id of that user, used by the scam check
 */
public record TradeRequest(
    String tradeId,
    OfferLeg leg,
    String partnerSteamId,
    String partnerTradeUrl,
    List<TradeItem> itemsToGive,
    List<TradeItem> itemsToReceive,
    String message
) {
  public TradeRequest {
    itemsToGive = itemsToGive == null ? List.of() : List.copyOf(itemsToGive);
    itemsToReceive = itemsToReceive == null ? List.of() : List.copyOf(itemsToReceive);
  }

  public void validate() {
    if (tradeId == null || tradeId.isBlank()) {
      throw new InvalidTradeRequestException("tradeId is required");
    }
    if (leg == null) {
      throw new InvalidTradeRequestException("leg is required for trade " + tradeId);
    }
    if (partnerTradeUrl == null || partnerTradeUrl.isBlank()) {
      throw new InvalidTradeRequestException("partner trade url is required for trade " + tradeId);
    }
    if (itemsToGive.isEmpty() && itemsToReceive.isEmpty()) {
      throw new InvalidTradeRequestException("offer for trade " + tradeId + " moves no items");
    }
  }

  public OfferRequest toOfferRequest() {
    return new OfferRequest(partnerTradeUrl, itemsToGive, itemsToReceive, message);
  }
}
