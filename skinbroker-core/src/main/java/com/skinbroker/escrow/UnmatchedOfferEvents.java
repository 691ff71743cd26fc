package com.skinbroker.escrow;

import com.skinbroker.config.BrokerProperties;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Offer state changes that arrived before the offer id was stored on its trade.
 *
 * <p>A counterparty can accept an offer before the dispatch worker that sent it has recorded the id.
 * Such an event is parked here and replayed once when {@link #offerRecorded(String)} is called for
 * the same id. Parked events older than the TTL are dropped with a warning.
 */
@Slf4j
public class UnmatchedOfferEvents {

  private final Map<String, Parked> parked = new ConcurrentHashMap<>();
  private final long ttlMillis;
  private final Clock clock;
  private volatile Consumer<OfferStateChange> replay;

  public UnmatchedOfferEvents(@NonNull BrokerProperties.Escrow cfg, @NonNull Clock clock) {
    this.ttlMillis = cfg.unmatchedOfferTtlMillis();
    this.clock = clock;
  }

  void bindReplay(@NonNull Consumer<OfferStateChange> replay) {
    this.replay = replay;
  }

  void park(@NonNull OfferStateChange change) {
    Instant now = clock.instant();
    evictExpired(now);
    Parked previous = parked.put(change.offerId(), new Parked(change, now));
    log.info("offer state parked until offer is recorded offerId={} state={} replaced={}",
        change.offerId(), change.state(), previous != null ? previous.change().state() : null);
  }

  /**
   * Replays the event parked for {@code offerId}, if any. Safe to call from several threads: the
   * event is claimed by exactly one caller.
   */
  public void offerRecorded(String offerId) {
    if (offerId == null) {
      return;
    }
    Parked entry = parked.remove(offerId);
    if (entry == null) {
      return;
    }
    Consumer<OfferStateChange> target = replay;
    if (target == null) {
      log.warn("parked offer state dropped, no listener bound offerId={} state={}", offerId, entry.change().state());
      return;
    }
    log.info("replaying parked offer state offerId={} state={} parkedMs={}",
        offerId, entry.change().state(), clock.millis() - entry.parkedAt().toEpochMilli());
    target.accept(entry.change());
  }

  public int size() {
    return parked.size();
  }

  private void evictExpired(Instant now) {
    Instant cutoff = now.minusMillis(ttlMillis);
    parked.entrySet().removeIf(e -> {
      if (e.getValue().parkedAt().isBefore(cutoff)) {
        log.warn("parked offer state expired without a matching trade offerId={} state={}",
            e.getKey(), e.getValue().change().state());
        return true;
      }
      return false;
    });
  }

  private record Parked(OfferStateChange change, Instant parkedAt) {
  }
}
