package com.skinbroker.escrow;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingSettlementGateway implements SettlementGateway {

  @Override
  public void refund(Trade trade, String reason) {
    log.info("refund buyer tradeId={} buyer={} amount={} currency={} reason={}",
        trade.tradeId(), trade.buyerSteamId(), trade.price(), trade.currency(), reason);
  }

  @Override
  public void payout(Trade trade) {
    if (trade.sellerSteamId() == null || trade.sellerSteamId().isBlank()) {
      log.info("no seller to pay out tradeId={} kind={}", trade.tradeId(), trade.kind());
      return;
    }
    log.info("payout seller tradeId={} seller={} amount={} currency={}",
        trade.tradeId(), trade.sellerSteamId(), trade.price(), trade.currency());
  }
}
