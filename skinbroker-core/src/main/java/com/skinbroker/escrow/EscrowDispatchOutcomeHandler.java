package com.skinbroker.escrow;

import com.skinbroker.error.ErrorCode;
import com.skinbroker.error.InvalidStateTransitionException;
import com.skinbroker.error.TradeNotFoundException;
import com.skinbroker.queue.DispatchOutcomeListener;
import com.skinbroker.queue.JobHandle;
import com.skinbroker.trade.DispatchResult;
import com.skinbroker.trade.OfferLeg;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies queue outcomes to trades: a sent offer moves the trade to the matching awaiting state,
 * a final dispatch failure or a cancelled job fails the trade and refunds the buyer once.
 */
@Slf4j
@RequiredArgsConstructor
public class EscrowDispatchOutcomeHandler implements DispatchOutcomeListener {

  private final @NonNull EscrowStateMachine stateMachine;
  private final @NonNull SettlementGateway settlement;
  private final @NonNull UnmatchedOfferEvents unmatched;

  @Override
  public void onDispatchSucceeded(JobHandle job, DispatchResult result) {
    TradeStatus target = result.leg() == OfferLeg.SELLER_REQUEST ? TradeStatus.AWAITING_SELLER : TradeStatus.AWAITING_BUYER;
    try {
      stateMachine.transition(
          result.tradeId(),
          target,
          "offer sent offerId=" + result.offerId(),
          t -> t.withOffer(result.leg(), result.offerId(), result.agentId()).withAttempts(job.attempts())
      );
    } catch (TradeNotFoundException | InvalidStateTransitionException e) {
      log.error("offer sent for trade that cannot take it tradeId={} leg={} offerId={} error={}",
          result.tradeId(), result.leg(), result.offerId(), e.getMessage());
      return;
    }
    unmatched.offerRecorded(result.offerId());
  }

  @Override
  public void onDispatchFailed(JobHandle job, ErrorCode code, String message) {
    failTrade(job, "dispatch failed code=" + code + " attempts=" + job.attempts());
  }

  @Override
  public void onDispatchCancelled(JobHandle job) {
    failTrade(job, "dispatch cancelled leg=" + job.payload().leg() + " attempts=" + job.attempts());
  }

  private void failTrade(JobHandle job, String reason) {
    TransitionResult result;
    try {
      result = stateMachine.transition(job.tradeId(), TradeStatus.FAILED, reason, t -> t.withAttempts(job.attempts()));
    } catch (TradeNotFoundException | InvalidStateTransitionException e) {
      log.error("dispatch outcome for trade that cannot fail tradeId={} reason={} error={}", job.tradeId(), reason, e.getMessage());
      return;
    }
    if (result.applied()) {
      settlement.refund(result.trade(), reason);
    }
  }
}
