package com.skinbroker.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Objects;

@Validated
@ConfigurationProperties(prefix = "broker")
public record BrokerProperties(
    BrokerMode mode,
    @Valid RateLimit rateLimit,
    @Valid Pool pool,
    @Valid Queue queue,
    @Valid Escrow escrow
) {

  public BrokerProperties {
    if (mode == null) {
      mode = BrokerMode.PAPER;
    }
    if (rateLimit == null) {
      rateLimit = new RateLimit(null, null, null, null, null, null, null);
    }
    if (pool == null) {
      pool = new Pool(null, null, null, null);
    }
    if (queue == null) {
      queue = new Queue(null, null, null);
    }
    if (escrow == null) {
      escrow = new Escrow(null, null);
    }
  }

  public enum BrokerMode {
    PAPER,
    LIVE,
  }

  public enum FailMode {
    OPEN,
    CLOSED,
  }

  public record RateLimit(
      @NotNull Boolean enabled,
      @NotNull @Min(1) Integer maxRequests,
      @NotNull @Min(1) Long windowMillis,
      String keyPrefix,
      @NotNull @Min(1) Long keyTtlSeconds,
      /**
       * Extra pause added after the next window boundary when the current window is saturated.
       * Absorbs clock skew between this process, Redis and the upstream quota window.
       */
      @NotNull @PositiveOrZero Long boundaryGraceMillis,
      /**
       * Behaviour when the shared counter store is unreachable. OPEN admits the request without
       * limiting, CLOSED rejects it with a retryable error.
       */
      FailMode failMode
  ) {
    public RateLimit {
      if (enabled == null) {
        enabled = true;
      }
      if (maxRequests == null) {
        maxRequests = 20;
      }
      if (windowMillis == null) {
        windowMillis = 60_000L;
      }
      if (keyPrefix == null || keyPrefix.isBlank()) {
        keyPrefix = "steam:ratelimit";
      }
      if (keyTtlSeconds == null) {
        keyTtlSeconds = 120L;
      }
      if (boundaryGraceMillis == null) {
        boundaryGraceMillis = 1_000L;
      }
      if (failMode == null) {
        failMode = FailMode.OPEN;
      }
    }
  }

  public record Pool(
      /**
       * Agents at or above this inventory size are not selected for new trades.
       * Keep it under the platform's hard inventory ceiling.
       */
      @NotNull @Min(1) Integer inventoryCapacityThreshold,
      @NotNull @Min(1) Long healthCheckIntervalMillis,
      @Valid Login login,
      @Valid List<AgentAccount> agents
  ) {
    public Pool {
      if (inventoryCapacityThreshold == null) {
        inventoryCapacityThreshold = 950;
      }
      if (healthCheckIntervalMillis == null) {
        healthCheckIntervalMillis = 300_000L;
      }
      if (login == null) {
        login = new Login(null, null, null);
      }
      agents = sanitizeAgents(agents);
    }
  }

  public record Login(
      @NotNull @Min(1) Integer maxAttempts,
      @NotNull @PositiveOrZero Long initialBackoffMillis,
      @NotNull @PositiveOrZero Long maxBackoffMillis
  ) {
    public Login {
      if (maxAttempts == null) {
        maxAttempts = 3;
      }
      if (initialBackoffMillis == null) {
        initialBackoffMillis = 2_000L;
      }
      if (maxBackoffMillis == null) {
        maxBackoffMillis = 30_000L;
      }
    }
  }

  public record AgentAccount(
      String accountName,
      /**
       * Name of the secret holding the account password and Steam Guard secrets. Never the secret itself.
       */
      String credentialsRef,
      String steamId
  ) {}

  public record Queue(
      @NotNull @Min(1) Integer maxAttempts,
      @NotNull @PositiveOrZero Long initialBackoffMillis,
      @NotNull @PositiveOrZero Long maxBackoffMillis
  ) {
    public Queue {
      if (maxAttempts == null) {
        maxAttempts = 3;
      }
      if (initialBackoffMillis == null) {
        initialBackoffMillis = 5_000L;
      }
      if (maxBackoffMillis == null) {
        maxBackoffMillis = 60_000L;
      }
    }
  }

  public record Escrow(
      @NotNull @Min(1) Integer maxTransitionAttempts,
      /**
       * How long an offer event that arrived before its offer id was recorded is held for replay.
       */
      @NotNull @Min(1) Long unmatchedOfferTtlMillis
  ) {
    public Escrow {
      if (maxTransitionAttempts == null) {
        maxTransitionAttempts = 5;
      }
      if (unmatchedOfferTtlMillis == null) {
        unmatchedOfferTtlMillis = 600_000L;
      }
    }
  }

  private static List<AgentAccount> sanitizeAgents(List<AgentAccount> agents) {
    if (agents == null || agents.isEmpty()) {
      return List.of();
    }
    return agents.stream()
        .filter(Objects::nonNull)
        .filter(a -> a.accountName() != null && !a.accountName().isBlank())
        .map(a -> new AgentAccount(a.accountName().trim(), a.credentialsRef(), a.steamId()))
        .toList();
  }
}
