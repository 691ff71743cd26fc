package com.skinbroker.agent;

import java.util.Objects;

/**
 * Static identity of an agent account. {@code credentialsRef} names a secret; the transport resolves it.
 */
public record AgentConfig(
    String accountName,
    String credentialsRef,
    String steamId
) {
  public AgentConfig {
    Objects.requireNonNull(accountName, "accountName");
    accountName = accountName.trim();
    if (accountName.isEmpty()) {
      throw new IllegalArgumentException("accountName must not be blank");
    }
  }

  public String id() {
    return accountName;
  }
}
