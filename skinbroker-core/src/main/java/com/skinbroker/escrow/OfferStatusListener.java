package com.skinbroker.escrow;

import com.skinbroker.error.InvalidStateTransitionException;
import com.skinbroker.trade.OfferLeg;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Turns offer state changes reported by the agents into trade transitions.
 *
 * <p>Offer events are delivered at least once. Settlement and follow-up offers run only when the
 * transition was applied by this call, so a replayed event changes nothing. An event for an offer id
 * that no trade carries yet is parked in {@link UnmatchedOfferEvents} until the dispatch outcome
 * records the id.
 */
@Slf4j
public class OfferStatusListener {

  private final EscrowStateMachine stateMachine;
  private final EscrowService escrowService;
  private final SettlementGateway settlement;
  private final UnmatchedOfferEvents unmatched;

  public OfferStatusListener(
      @NonNull EscrowStateMachine stateMachine,
      @NonNull EscrowService escrowService,
      @NonNull SettlementGateway settlement,
      @NonNull UnmatchedOfferEvents unmatched
  ) {
    this.stateMachine = stateMachine;
    this.escrowService = escrowService;
    this.settlement = settlement;
    this.unmatched = unmatched;
    unmatched.bindReplay(this::onOfferStateChanged);
  }

  public void onOfferStateChanged(@NonNull OfferStateChange change) {
    OfferState state = change.state();
    if (state != OfferState.ACCEPTED && (state == null || !state.isFailure())) {
      log.debug("offer state ignored offerId={} state={}", change.offerId(), state);
      return;
    }

    Optional<Trade> found = stateMachine.findByOfferId(change.offerId());
    if (found.isEmpty()) {
      unmatched.park(change);
      // the worker may have recorded the id between the lookup and the park
      if (stateMachine.findByOfferId(change.offerId()).isPresent()) {
        unmatched.offerRecorded(change.offerId());
      }
      return;
    }
    Trade trade = found.get();
    OfferLeg leg = trade.legOf(change.offerId());
    TradeStatus awaiting = leg == OfferLeg.SELLER_REQUEST ? TradeStatus.AWAITING_SELLER : TradeStatus.AWAITING_BUYER;
    if (trade.status() != awaiting) {
      // replayed or late event, the trade has already moved past this offer
      log.info("offer state for settled leg ignored tradeId={} offerId={} state={} status={}",
          trade.tradeId(), change.offerId(), state, trade.status());
      return;
    }

    try {
      if (state == OfferState.ACCEPTED) {
        onAccepted(trade, leg, change);
      } else {
        onFailed(trade, leg, state);
      }
    } catch (InvalidStateTransitionException e) {
      log.error("offer state does not fit trade tradeId={} offerId={} state={} status={}",
          trade.tradeId(), change.offerId(), state, trade.status());
    }
  }

  private void onAccepted(Trade trade, OfferLeg leg, OfferStateChange change) {
    if (leg == OfferLeg.SELLER_REQUEST && trade.kind() == TradeKind.P2P) {
      TransitionResult result = stateMachine.transition(trade.tradeId(), TradeStatus.AWAITING_BUYER, "seller offer accepted");
      if (result.applied()) {
        escrowService.enqueueBuyerDelivery(result.trade(), change.receivedItems());
      }
      return;
    }
    String reason = leg == OfferLeg.SELLER_REQUEST ? "seller offer accepted" : "buyer offer accepted";
    TransitionResult result = stateMachine.transition(trade.tradeId(), TradeStatus.COMPLETED, reason);
    if (result.applied()) {
      settlement.payout(result.trade());
    }
  }

  private void onFailed(Trade trade, OfferLeg leg, OfferState state) {
    String reason = (leg == OfferLeg.SELLER_REQUEST ? "seller" : "buyer") + " offer " + state.name().toLowerCase();
    TransitionResult result = stateMachine.transition(trade.tradeId(), TradeStatus.FAILED, reason);
    if (result.applied()) {
      settlement.refund(result.trade(), reason);
    }
  }
}
