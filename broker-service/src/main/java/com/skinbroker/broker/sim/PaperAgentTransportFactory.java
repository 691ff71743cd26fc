package com.skinbroker.broker.sim;

import com.skinbroker.agent.AgentConfig;
import com.skinbroker.agent.AgentEvent;
import com.skinbroker.agent.AgentEventSink;
import com.skinbroker.agent.AgentEventType;
import com.skinbroker.agent.AgentTransport;
import com.skinbroker.agent.AgentTransportFactory;
import com.skinbroker.error.LoginException;
import com.skinbroker.error.TransportException;
import com.skinbroker.escrow.OfferState;
import com.skinbroker.escrow.OfferStateChange;
import com.skinbroker.escrow.OfferStatusListener;
import com.skinbroker.trade.OfferRequest;
import com.skinbroker.trade.TradeItem;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Paper-mode agents: sessions that never touch Steam.
 *
 * <p>Offers get synthetic ids and, when auto-accept is on, are accepted after a delay through the
 * same {@link OfferStatusListener} a live transport feeds, so the whole escrow lifecycle runs locally.
 */
@Component
@ConditionalOnProperty(prefix = "broker", name = "mode", havingValue = "PAPER", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PaperAgentTransportFactory implements AgentTransportFactory {

  private final @NonNull PaperSimulationProperties sim;
  private final @NonNull ObjectProvider<OfferStatusListener> offerStatusListener;
  private final @NonNull Clock clock;

  private final AtomicLong offerSeq = new AtomicLong(0);
  private final AtomicLong assetSeq = new AtomicLong(9_000_000_000L);
  private final ScheduledExecutorService acceptor = Executors.newSingleThreadScheduledExecutor(r -> {
    Thread t = new Thread(r, "paper-offer-acceptor");
    t.setDaemon(true);
    return t;
  });

  @PostConstruct
  void logSimConfig() {
    log.info("paper agent transport enabled autoAccept={} acceptDelayMillis={} initialInventory={} loginFailurePercent={}",
        sim.autoAccept(), sim.acceptDelayMillis(), sim.initialInventory(), sim.loginFailurePercent());
  }

  @PreDestroy
  void shutdown() {
    acceptor.shutdownNow();
  }

  @Override
  public AgentTransport create(AgentConfig config, AgentEventSink events) {
    return new PaperAgentTransport(config, events);
  }

  private void scheduleAccept(String offerId, List<TradeItem> received) {
    if (!sim.autoAccept()) {
      return;
    }
    acceptor.schedule(() -> {
      OfferStatusListener listener = offerStatusListener.getIfAvailable();
      if (listener == null) {
        return;
      }
      try {
        listener.onOfferStateChanged(new OfferStateChange(offerId, OfferState.ACCEPTED, received, clock.instant()));
      } catch (RuntimeException e) {
        log.warn("paper offer accept failed offerId={} error={}", offerId, e.toString());
      }
    }, sim.acceptDelayMillis(), TimeUnit.MILLISECONDS);
  }

  private final class PaperAgentTransport implements AgentTransport {

    private final AgentConfig config;
    private final AgentEventSink events;
    private final AtomicInteger inventory = new AtomicInteger(sim.initialInventory());
    private volatile boolean loggedIn;

    private PaperAgentTransport(AgentConfig config, AgentEventSink events) {
      this.config = config;
      this.events = events;
    }

    @Override
    public void login() {
      if (ThreadLocalRandom.current().nextInt(100) < sim.loginFailurePercent()) {
        emit(AgentEventType.LOGIN_FAILED, "simulated login failure");
        throw new LoginException(config.id(), "simulated login failure");
      }
      loggedIn = true;
      emit(AgentEventType.LOGIN_SUCCEEDED, null);
    }

    @Override
    public void logout() {
      loggedIn = false;
    }

    @Override
    public String sendOffer(OfferRequest offer) {
      if (!loggedIn) {
        throw TransportException.network("paper agent " + config.id() + " is not logged in");
      }
      String offerId = "paper-" + offerSeq.incrementAndGet();
      List<TradeItem> received = offer.itemsToReceive().stream()
          .map(i -> new TradeItem(String.valueOf(assetSeq.incrementAndGet()), i.appId(), i.contextId()))
          .toList();
      inventory.addAndGet(received.size() - offer.itemsToGive().size());
      emit(AgentEventType.OFFER_SENT, offerId);
      log.info("paper offer sent agent={} offerId={} give={} receive={}", config.id(), offerId, offer.itemsToGive().size(), received.size());
      scheduleAccept(offerId, received);
      return offerId;
    }

    @Override
    public int inventoryCount() {
      return Math.max(0, inventory.get());
    }

    private void emit(AgentEventType type, String detail) {
      events.onAgentEvent(new AgentEvent(config.id(), type, detail, clock.instant()));
    }
  }
}
