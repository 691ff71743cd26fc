package com.skinbroker.escrow;

public enum TradeKind {
  /** Seller hands the item to an agent, the agent forwards it to the buyer. */
  P2P,
  /** Item already sits in an agent inventory and goes straight to the buyer. */
  BOT_SALE,
  /** Seller sells the item to the platform; it stays with the agent. */
  DEPOSIT,
}
