package com.skinbroker.escrow;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

public class InMemoryTradeRepository implements TradeRepository {

  private final Map<String, Trade> tradesById = new ConcurrentHashMap<>();
  private final Map<String, List<TradeTransition>> historyById = new ConcurrentHashMap<>();
  private final Map<String, String> tradeIdByOfferId = new ConcurrentHashMap<>();

  @Override
  public void insert(Trade trade) {
    if (tradesById.putIfAbsent(trade.tradeId(), trade) != null) {
      throw new IllegalStateException("trade already exists: " + trade.tradeId());
    }
    indexOffers(trade);
  }

  @Override
  public Optional<Trade> load(String tradeId) {
    return Optional.ofNullable(tradeId == null ? null : tradesById.get(tradeId));
  }

  @Override
  public Optional<Trade> findByOfferId(String offerId) {
    if (offerId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(tradeIdByOfferId.get(offerId)).flatMap(this::load);
  }

  @Override
  public boolean compareAndSet(long expectedVersion, Trade updated, TradeTransition transition) {
    AtomicBoolean swapped = new AtomicBoolean(false);
    tradesById.computeIfPresent(updated.tradeId(), (id, current) -> {
      if (current.version() != expectedVersion) {
        return current;
      }
      if (transition != null) {
        historyById.computeIfAbsent(id, k -> new CopyOnWriteArrayList<>()).add(transition);
      }
      swapped.set(true);
      return updated;
    });
    if (swapped.get()) {
      indexOffers(updated);
    }
    return swapped.get();
  }

  @Override
  public List<TradeTransition> history(String tradeId) {
    if (tradeId == null) {
      return List.of();
    }
    return List.copyOf(historyById.getOrDefault(tradeId, List.of()));
  }

  private void indexOffers(Trade trade) {
    if (trade.sellerOfferId() != null) {
      tradeIdByOfferId.put(trade.sellerOfferId(), trade.tradeId());
    }
    if (trade.buyerOfferId() != null) {
      tradeIdByOfferId.put(trade.buyerOfferId(), trade.tradeId());
    }
  }
}
