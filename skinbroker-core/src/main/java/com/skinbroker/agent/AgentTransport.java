package com.skinbroker.agent;

import com.skinbroker.trade.OfferRequest;

/**
 * One authenticated session against the trade-offer API.
 *
 * <p>Failures are reported as {@link com.skinbroker.error.LoginException} from {@link #login()} and
 * {@link com.skinbroker.error.TransportException} from the other calls. Any other runtime exception
 * is treated as a retryable network failure.
 */
public interface AgentTransport {

  void login();

  void logout();

  /**
   * @return the offer id assigned by the API
   */
  String sendOffer(OfferRequest offer);

  int inventoryCount();
}
