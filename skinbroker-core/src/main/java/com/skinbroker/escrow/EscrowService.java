package com.skinbroker.escrow;

import com.skinbroker.queue.JobHandle;
import com.skinbroker.queue.TradeDispatchQueue;
import com.skinbroker.trade.OfferLeg;
import com.skinbroker.trade.TradeItem;
import com.skinbroker.trade.TradeRequest;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Trade operations exposed to callers. Every status change goes through {@link EscrowStateMachine}.
 */
@Slf4j
@RequiredArgsConstructor
public class EscrowService {

  private final @NonNull EscrowStateMachine stateMachine;
  private final @NonNull TradeDispatchQueue queue;
  private final @NonNull SettlementGateway settlement;

  public Trade initiate(NewTrade request) {
    return stateMachine.initiate(request);
  }

  public Trade get(String tradeId) {
    return stateMachine.get(tradeId);
  }

  public List<TradeTransition> history(String tradeId) {
    stateMachine.get(tradeId);
    return stateMachine.history(tradeId);
  }

  /**
   * Records the buyer's payment and queues the first offer leg. A repeated confirmation is a no-op.
   */
  public Trade confirmPayment(String tradeId) {
    TransitionResult result = stateMachine.transition(tradeId, TradeStatus.PAYMENT_RECEIVED, "payment confirmed");
    if (result.applied()) {
      Trade trade = result.trade();
      JobHandle job = queue.enqueue(firstLeg(trade));
      log.info("first offer leg queued tradeId={} kind={} jobId={}", tradeId, trade.kind(), job.jobId());
    }
    return result.trade();
  }

  public Trade cancel(String tradeId, String reason) {
    String why = reason == null || reason.isBlank() ? "cancelled by user" : reason;
    return stateMachine.transition(tradeId, TradeStatus.CANCELLED, why).trade();
  }

  /**
   * Operator override. Runs the matching settlement when the override actually moved the trade.
   */
  public Trade overrideStatus(String tradeId, TradeStatus target, String reason) {
    String why = "manual override: " + (reason == null || reason.isBlank() ? "no reason given" : reason);
    TransitionResult result = stateMachine.transition(tradeId, target, why);
    if (result.applied()) {
      if (target == TradeStatus.FAILED) {
        settlement.refund(result.trade(), why);
      } else if (target == TradeStatus.COMPLETED) {
        settlement.payout(result.trade());
      } else if (target == TradeStatus.PAYMENT_RECEIVED) {
        queue.enqueue(firstLeg(result.trade()));
      }
    }
    return result.trade();
  }

  JobHandle enqueueBuyerDelivery(Trade trade, List<TradeItem> items) {
    List<TradeItem> toGive = items == null || items.isEmpty() ? trade.items() : items;
    TradeRequest request = new TradeRequest(
        trade.tradeId(),
        OfferLeg.BUYER_DELIVERY,
        trade.buyerSteamId(),
        trade.buyerTradeUrl(),
        toGive,
        List.of(),
        "Item delivery for trade " + trade.tradeId()
    );
    return queue.enqueue(request);
  }

  private TradeRequest firstLeg(Trade trade) {
    if (trade.kind() == TradeKind.BOT_SALE) {
      return new TradeRequest(
          trade.tradeId(),
          OfferLeg.BUYER_DELIVERY,
          trade.buyerSteamId(),
          trade.buyerTradeUrl(),
          trade.items(),
          List.of(),
          "Item delivery for trade " + trade.tradeId()
      );
    }
    return new TradeRequest(
        trade.tradeId(),
        OfferLeg.SELLER_REQUEST,
        trade.sellerSteamId(),
        trade.sellerTradeUrl(),
        List.of(),
        trade.items(),
        "Item request for trade " + trade.tradeId()
    );
  }
}
