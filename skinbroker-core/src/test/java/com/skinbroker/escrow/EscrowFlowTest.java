package com.skinbroker.escrow;

import com.skinbroker.config.BrokerProperties;
import com.skinbroker.error.InvalidStateTransitionException;
import com.skinbroker.error.TradeBlockedException;
import com.skinbroker.events.NoopBrokerEventPublisher;
import com.skinbroker.queue.JobHandle;
import com.skinbroker.queue.TradeDispatchQueue;
import com.skinbroker.trade.DispatchResult;
import com.skinbroker.trade.OfferLeg;
import com.skinbroker.trade.TradeItem;
import com.skinbroker.trade.TradeRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Escrow lifecycle through the real dispatch queue, with a fake dispatcher in place of the agent pool.
 */
class EscrowFlowTest {

  private final List<TradeRequest> dispatched = new CopyOnWriteArrayList<>();
  private final Set<String> blockedTrades = ConcurrentHashMap.newKeySet();
  private final Set<String> acceptedBeforeReturn = ConcurrentHashMap.newKeySet();
  private final AtomicInteger offerSeq = new AtomicInteger();
  private final RecordingSettlementGateway settlement = new RecordingSettlementGateway();

  private EscrowStateMachine stateMachine;
  private TradeDispatchQueue queue;
  private EscrowService escrow;
  private OfferStatusListener offers;
  private UnmatchedOfferEvents unmatched;

  @BeforeEach
  void setUp() {
    stateMachine = new EscrowStateMachine(new InMemoryTradeRepository(), new NoopBrokerEventPublisher(), Clock.systemUTC(),
        new BrokerProperties.Escrow(5, null));
    unmatched = new UnmatchedOfferEvents(new BrokerProperties.Escrow(5, null), Clock.systemUTC());
    EscrowDispatchOutcomeHandler outcomes = new EscrowDispatchOutcomeHandler(stateMachine, settlement, unmatched);
    queue = new TradeDispatchQueue(this::dispatch, outcomes, new BrokerProperties.Queue(2, 10L, 20L),
        new NoopBrokerEventPublisher(), Clock.systemUTC());
    escrow = new EscrowService(stateMachine, queue, settlement);
    offers = new OfferStatusListener(stateMachine, escrow, settlement, unmatched);
    queue.start();
  }

  @AfterEach
  void tearDown() {
    queue.close();
  }

  @Test
  void p2pTradeRunsBothLegsAndPaysOutOnce() {
    Trade trade = escrow.initiate(newTrade(TradeKind.P2P));
    escrow.confirmPayment(trade.tradeId());

    Trade awaitingSeller = awaitTrade(trade.tradeId(), t -> t.sellerOfferId() != null);
    assertThat(awaitingSeller.status()).isEqualTo(TradeStatus.AWAITING_SELLER);
    assertThat(awaitingSeller.agentId()).isEqualTo("alpha");
    assertThat(dispatched).singleElement().satisfies(r -> {
      assertThat(r.leg()).isEqualTo(OfferLeg.SELLER_REQUEST);
      assertThat(r.partnerTradeUrl()).isEqualTo("https://seller/url");
      assertThat(r.itemsToReceive()).containsExactly(TradeItem.of("1001"));
    });

    accept(awaitingSeller.sellerOfferId(), List.of(TradeItem.of("2002")));
    Trade awaitingBuyer = awaitTrade(trade.tradeId(), t -> t.buyerOfferId() != null);
    assertThat(awaitingBuyer.status()).isEqualTo(TradeStatus.AWAITING_BUYER);
    assertThat(dispatched).hasSize(2);
    assertThat(dispatched.get(1).leg()).isEqualTo(OfferLeg.BUYER_DELIVERY);
    assertThat(dispatched.get(1).itemsToGive()).containsExactly(TradeItem.of("2002"));

    accept(awaitingBuyer.buyerOfferId(), List.of());
    accept(awaitingBuyer.buyerOfferId(), List.of());
    accept(awaitingSeller.sellerOfferId(), List.of());

    assertThat(stateMachine.get(trade.tradeId()).status()).isEqualTo(TradeStatus.COMPLETED);
    assertThat(settlement.payouts).containsExactly(trade.tradeId());
    assertThat(settlement.refunds).isEmpty();
    assertThat(dispatched).hasSize(2);
  }

  @Test
  void botSaleDeclinedByBuyerRefundsOnce() {
    Trade trade = escrow.initiate(newTrade(TradeKind.BOT_SALE));
    escrow.confirmPayment(trade.tradeId());

    Trade awaitingBuyer = awaitTrade(trade.tradeId(), t -> t.buyerOfferId() != null);
    assertThat(awaitingBuyer.status()).isEqualTo(TradeStatus.AWAITING_BUYER);
    assertThat(dispatched).singleElement().extracting(TradeRequest::leg).isEqualTo(OfferLeg.BUYER_DELIVERY);

    offers.onOfferStateChanged(new OfferStateChange(awaitingBuyer.buyerOfferId(), OfferState.DECLINED, List.of(), Instant.now()));
    offers.onOfferStateChanged(new OfferStateChange(awaitingBuyer.buyerOfferId(), OfferState.DECLINED, List.of(), Instant.now()));

    assertThat(stateMachine.get(trade.tradeId()).status()).isEqualTo(TradeStatus.FAILED);
    assertThat(settlement.refunds).containsExactly(trade.tradeId());
    assertThat(settlement.payouts).isEmpty();
  }

  @Test
  void depositCompletesWhenSellerAccepts() {
    Trade trade = escrow.initiate(newTrade(TradeKind.DEPOSIT));
    escrow.confirmPayment(trade.tradeId());

    Trade awaitingSeller = awaitTrade(trade.tradeId(), t -> t.sellerOfferId() != null);
    accept(awaitingSeller.sellerOfferId(), List.of(TradeItem.of("3003")));

    assertThat(stateMachine.get(trade.tradeId()).status()).isEqualTo(TradeStatus.COMPLETED);
    assertThat(settlement.payouts).containsExactly(trade.tradeId());
    assertThat(dispatched).hasSize(1);
  }

  @Test
  void blockedDispatchFailsTradeAndRefundsOnce() {
    Trade trade = escrow.initiate(newTrade(TradeKind.P2P));
    blockedTrades.add(trade.tradeId());

    escrow.confirmPayment(trade.tradeId());

    Trade failed = awaitTrade(trade.tradeId(), t -> t.status() == TradeStatus.FAILED);
    assertThat(failed.attempts()).isEqualTo(1);
    assertThat(settlement.refunds).containsExactly(trade.tradeId());
    assertThat(stateMachine.history(trade.tradeId())).last().satisfies(t -> assertThat(t.reason()).contains("TRADE_BLOCKED"));
  }

  @Test
  void repeatedPaymentConfirmationQueuesOneLeg() {
    Trade trade = escrow.initiate(newTrade(TradeKind.P2P));

    escrow.confirmPayment(trade.tradeId());
    escrow.confirmPayment(trade.tradeId());

    awaitTrade(trade.tradeId(), t -> t.sellerOfferId() != null);
    assertThat(dispatched).hasSize(1);
  }

  @Test
  void cancelOnlyBeforePayment() {
    Trade unpaid = escrow.initiate(newTrade(TradeKind.P2P));
    Trade paid = escrow.initiate(newTrade(TradeKind.P2P));
    escrow.confirmPayment(paid.tradeId());

    assertThat(escrow.cancel(unpaid.tradeId(), null).status()).isEqualTo(TradeStatus.CANCELLED);
    assertThatThrownBy(() -> escrow.cancel(paid.tradeId(), "changed my mind"))
        .isInstanceOf(InvalidStateTransitionException.class);
    assertThat(settlement.refunds).isEmpty();
  }

  @Test
  void lateSellerFailureAfterHandoverIsIgnored() {
    Trade trade = escrow.initiate(newTrade(TradeKind.P2P));
    escrow.confirmPayment(trade.tradeId());
    Trade awaitingSeller = awaitTrade(trade.tradeId(), t -> t.sellerOfferId() != null);
    accept(awaitingSeller.sellerOfferId(), List.of());
    awaitTrade(trade.tradeId(), t -> t.buyerOfferId() != null);

    offers.onOfferStateChanged(new OfferStateChange(awaitingSeller.sellerOfferId(), OfferState.EXPIRED, List.of(), Instant.now()));

    assertThat(stateMachine.get(trade.tradeId()).status()).isEqualTo(TradeStatus.AWAITING_BUYER);
    assertThat(settlement.refunds).isEmpty();
  }

  @Test
  void unrelatedOfferStatesAreIgnored() {
    Trade trade = escrow.initiate(newTrade(TradeKind.BOT_SALE));
    escrow.confirmPayment(trade.tradeId());
    Trade awaitingBuyer = awaitTrade(trade.tradeId(), t -> t.buyerOfferId() != null);

    offers.onOfferStateChanged(new OfferStateChange("no-such-offer", OfferState.ACCEPTED, List.of(), Instant.now()));
    offers.onOfferStateChanged(new OfferStateChange(awaitingBuyer.buyerOfferId(), OfferState.ACTIVE, List.of(), Instant.now()));
    offers.onOfferStateChanged(new OfferStateChange(awaitingBuyer.buyerOfferId(), OfferState.IN_ESCROW, List.of(), Instant.now()));

    assertThat(stateMachine.get(trade.tradeId()).status()).isEqualTo(TradeStatus.AWAITING_BUYER);
    assertThat(unmatched.size()).isEqualTo(1);
    assertThat(settlement.payouts).isEmpty();
  }

  @Test
  void acceptanceBeforeOfferIsRecordedStillCompletesDeposit() {
    Trade trade = escrow.initiate(newTrade(TradeKind.DEPOSIT));
    acceptedBeforeReturn.add(trade.tradeId() + ":" + OfferLeg.SELLER_REQUEST);

    escrow.confirmPayment(trade.tradeId());

    Trade completed = awaitTrade(trade.tradeId(), t -> t.status() == TradeStatus.COMPLETED);
    assertThat(completed.sellerOfferId()).isNotNull();
    assertThat(settlement.payouts).containsExactly(trade.tradeId());
    assertThat(unmatched.size()).isZero();
  }

  @Test
  void acceptanceOfBuyerDeliveryBeforeItIsRecordedCompletesP2p() {
    Trade trade = escrow.initiate(newTrade(TradeKind.P2P));
    acceptedBeforeReturn.add(trade.tradeId() + ":" + OfferLeg.BUYER_DELIVERY);
    escrow.confirmPayment(trade.tradeId());
    Trade awaitingSeller = awaitTrade(trade.tradeId(), t -> t.sellerOfferId() != null);

    accept(awaitingSeller.sellerOfferId(), List.of(TradeItem.of("2002")));

    awaitTrade(trade.tradeId(), t -> t.status() == TradeStatus.COMPLETED);
    assertThat(settlement.payouts).containsExactly(trade.tradeId());
    assertThat(dispatched).hasSize(2);
  }

  @Test
  void cancelledFirstLegFailsPaidTradeAndRefundsOnce() {
    queue.pause();
    Trade trade = escrow.initiate(newTrade(TradeKind.P2P));
    escrow.confirmPayment(trade.tradeId());
    List<JobHandle> jobs = queue.findByTrade(trade.tradeId());
    assertThat(jobs).hasSize(1);

    assertThat(queue.cancel(jobs.get(0).jobId())).isTrue();
    assertThat(queue.cancel(jobs.get(0).jobId())).isFalse();
    queue.resume();

    Trade failed = stateMachine.get(trade.tradeId());
    assertThat(failed.status()).isEqualTo(TradeStatus.FAILED);
    assertThat(settlement.refunds).containsExactly(trade.tradeId());
    assertThat(stateMachine.history(trade.tradeId())).last()
        .satisfies(t -> assertThat(t.reason()).startsWith("dispatch cancelled"));
    assertThat(queue.findByTrade(trade.tradeId())).isEmpty();
    assertThat(dispatched).isEmpty();
  }

  @Test
  void overrideToFailedRefunds() {
    Trade trade = escrow.initiate(newTrade(TradeKind.BOT_SALE));
    escrow.confirmPayment(trade.tradeId());
    awaitTrade(trade.tradeId(), t -> t.buyerOfferId() != null);

    escrow.overrideStatus(trade.tradeId(), TradeStatus.FAILED, "item lost");
    escrow.overrideStatus(trade.tradeId(), TradeStatus.FAILED, "item lost");

    assertThat(settlement.refunds).containsExactly(trade.tradeId());
  }

  private DispatchResult dispatch(TradeRequest request) {
    dispatched.add(request);
    if (blockedTrades.contains(request.tradeId())) {
      throw new TradeBlockedException("flagged");
    }
    String offerId = "offer-" + offerSeq.incrementAndGet();
    if (acceptedBeforeReturn.contains(request.tradeId() + ":" + request.leg())) {
      accept(offerId, List.of());
    }
    return new DispatchResult(request.tradeId(), request.leg(), "alpha", offerId);
  }

  private void accept(String offerId, List<TradeItem> received) {
    offers.onOfferStateChanged(new OfferStateChange(offerId, OfferState.ACCEPTED, received, Instant.now()));
  }

  private Trade awaitTrade(String tradeId, Predicate<Trade> condition) {
    long deadline = System.currentTimeMillis() + 5_000;
    Trade trade = stateMachine.get(tradeId);
    while (!condition.test(trade) && System.currentTimeMillis() < deadline) {
      try {
        Thread.sleep(10);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new AssertionError("interrupted", e);
      }
      trade = stateMachine.get(tradeId);
    }
    assertThat(condition.test(trade)).as("trade %s reached expected state, was %s", tradeId, trade.status()).isTrue();
    return trade;
  }

  private static NewTrade newTrade(TradeKind kind) {
    return new NewTrade(
        kind,
        kind == TradeKind.DEPOSIT ? null : "76561198000000001",
        kind == TradeKind.DEPOSIT ? null : "https://buyer/url",
        kind == TradeKind.BOT_SALE ? null : "76561198000000002",
        kind == TradeKind.BOT_SALE ? null : "https://seller/url",
        List.of(TradeItem.of("1001")),
        new BigDecimal("25.00"),
        "USD"
    );
  }
}
