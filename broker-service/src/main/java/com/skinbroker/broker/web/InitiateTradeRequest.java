package com.skinbroker.broker.web;

import com.skinbroker.escrow.NewTrade;
import com.skinbroker.escrow.TradeKind;
import com.skinbroker.trade.TradeItem;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.util.List;

public record InitiateTradeRequest(
    @NotNull TradeKind kind,
    String buyerSteamId,
    String buyerTradeUrl,
    String sellerSteamId,
    String sellerTradeUrl,
    @NotEmpty List<@Valid Item> items,
    @NotNull @DecimalMin("0") BigDecimal price,
    String currency
) {

  public record Item(
      @NotBlank String assetId,
      Integer appId,
      String contextId
  ) {
  }

  NewTrade toNewTrade() {
    List<TradeItem> tradeItems = items.stream()
        .map(i -> new TradeItem(i.assetId(), i.appId(), i.contextId()))
        .toList();
    return new NewTrade(kind, buyerSteamId, buyerTradeUrl, sellerSteamId, sellerTradeUrl, tradeItems, price, currency);
  }
}
