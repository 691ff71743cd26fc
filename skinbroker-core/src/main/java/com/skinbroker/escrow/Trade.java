package com.skinbroker.escrow;

import com.skinbroker.trade.OfferLeg;
import com.skinbroker.trade.TradeItem;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable trade record. {@code version} increases by one on every stored change and backs the
 * repository's compare-and-set.
 */
public record Trade(
    String tradeId,
    TradeKind kind,
    String buyerSteamId,
    String buyerTradeUrl,
    String sellerSteamId,
    String sellerTradeUrl,
    List<TradeItem> items,
    BigDecimal price,
    String currency,
    TradeStatus status,
    int attempts,
    String sellerOfferId,
    String buyerOfferId,
    String agentId,
    Instant createdAt,
    Instant updatedAt,
    long version
) {
  public Trade {
    Objects.requireNonNull(tradeId, "tradeId");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(status, "status");
    items = items == null ? List.of() : List.copyOf(items);
  }

  static Trade create(String tradeId, NewTrade t, Instant now) {
    return new Trade(
        tradeId,
        t.kind(),
        t.buyerSteamId(),
        t.buyerTradeUrl(),
        t.sellerSteamId(),
        t.sellerTradeUrl(),
        t.items(),
        t.price(),
        t.currency(),
        TradeStatus.PENDING_PAYMENT,
        0,
        null,
        null,
        null,
        now,
        now,
        0L
    );
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }

  /**
   * Which leg the offer id belongs to, or {@code null} if it is not one of this trade's offers.
   */
  public OfferLeg legOf(String offerId) {
    if (offerId == null) {
      return null;
    }
    if (offerId.equals(sellerOfferId)) {
      return OfferLeg.SELLER_REQUEST;
    }
    if (offerId.equals(buyerOfferId)) {
      return OfferLeg.BUYER_DELIVERY;
    }
    return null;
  }

  public Trade withOffer(OfferLeg leg, String offerId, String agentId) {
    String seller = leg == OfferLeg.SELLER_REQUEST ? offerId : sellerOfferId;
    String buyer = leg == OfferLeg.BUYER_DELIVERY ? offerId : buyerOfferId;
    return new Trade(tradeId, kind, buyerSteamId, buyerTradeUrl, sellerSteamId, sellerTradeUrl, items, price, currency,
        status, attempts, seller, buyer, agentId, createdAt, updatedAt, version);
  }

  public Trade withAttempts(int attempts) {
    return new Trade(tradeId, kind, buyerSteamId, buyerTradeUrl, sellerSteamId, sellerTradeUrl, items, price, currency,
        status, attempts, sellerOfferId, buyerOfferId, agentId, createdAt, updatedAt, version);
  }

  Trade withStatus(TradeStatus status, Instant at) {
    return new Trade(tradeId, kind, buyerSteamId, buyerTradeUrl, sellerSteamId, sellerTradeUrl, items, price, currency,
        status, attempts, sellerOfferId, buyerOfferId, agentId, createdAt, at, version + 1);
  }
}
