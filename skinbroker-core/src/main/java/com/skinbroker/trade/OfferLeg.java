package com.skinbroker.trade;

public enum OfferLeg {
  /** Agent asks the seller for the item. */
  SELLER_REQUEST,
  /** Agent sends the item to the buyer. */
  BUYER_DELIVERY,
}
