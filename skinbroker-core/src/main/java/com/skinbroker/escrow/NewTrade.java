package com.skinbroker.escrow;

import com.skinbroker.error.InvalidTradeRequestException;
import com.skinbroker.trade.TradeItem;

import java.math.BigDecimal;
import java.util.List;

public record NewTrade(
    TradeKind kind,
    String buyerSteamId,
    String buyerTradeUrl,
    String sellerSteamId,
    String sellerTradeUrl,
    List<TradeItem> items,
    BigDecimal price,
    String currency
) {
  public NewTrade {
    items = items == null ? List.of() : List.copyOf(items);
    if (currency == null || currency.isBlank()) {
      currency = "USD";
    }
  }

  public void validate() {
    if (kind == null) {
      throw new InvalidTradeRequestException("trade kind is required");
    }
    if (items.isEmpty()) {
      throw new InvalidTradeRequestException("trade must contain at least one item");
    }
    if (price == null || price.signum() < 0) {
      throw new InvalidTradeRequestException("price must be >= 0");
    }
    if (kind != TradeKind.DEPOSIT && isBlank(buyerTradeUrl)) {
      throw new InvalidTradeRequestException("buyer trade url is required for " + kind);
    }
    if (kind != TradeKind.BOT_SALE && isBlank(sellerTradeUrl)) {
      throw new InvalidTradeRequestException("seller trade url is required for " + kind);
    }
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
