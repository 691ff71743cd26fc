package com.skinbroker.scam;

import com.skinbroker.trade.TradeRequest;

public interface ScamCheck {

  ScamCheckResult preTradeCheck(TradeRequest request);

  static ScamCheck allowAll() {
    return request -> ScamCheckResult.pass();
  }
}
