package io.ledgerflow.event;

import io.ledgerflow.model.EventFilter;

import java.time.Duration;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * What to subscribe to and how to recover from stream failures.
 */
public final class SubscriptionConfig {
  private final String contractId;
  private final Set<EventKind> kinds;
  private final String startCursor;
  private final boolean reconnect;
  private final Duration reconnectDelay;
  private final int maxReconnectAttempts;

  private SubscriptionConfig(Builder builder) {
    this.contractId = builder.contractId;
    this.kinds = builder.kinds.isEmpty()
        ? Set.of() : Set.copyOf(EnumSet.copyOf(builder.kinds));
    this.startCursor = builder.startCursor;
    this.reconnect = builder.reconnect;
    this.reconnectDelay = Objects.requireNonNull(builder.reconnectDelay, "reconnectDelay");
    if (reconnectDelay.isNegative()) {
      throw new IllegalArgumentException("reconnectDelay must not be negative");
    }
    if (builder.maxReconnectAttempts < 0) {
      throw new IllegalArgumentException("maxReconnectAttempts must be >= 0");
    }
    this.maxReconnectAttempts = builder.maxReconnectAttempts;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static SubscriptionConfig defaults() {
    return builder().build();
  }

  /** Contract to listen to, or {@code null} for every contract. */
  public String contractId() {
    return contractId;
  }

  /** Kinds to deliver; empty means all, including unknown topics. */
  public Set<EventKind> kinds() {
    return kinds;
  }

  public String startCursor() {
    return startCursor;
  }

  public boolean reconnect() {
    return reconnect;
  }

  public Duration reconnectDelay() {
    return reconnectDelay;
  }

  public int maxReconnectAttempts() {
    return maxReconnectAttempts;
  }

  public boolean accepts(EventKind kind) {
    return kinds.isEmpty() || kinds.contains(kind);
  }

  EventFilter toFilter() {
    Set<String> topics = new LinkedHashSet<>();
    for (EventKind kind : kinds) {
      if (kind.topic() != null) {
        topics.add(kind.topic());
      }
    }
    // UNKNOWN cannot be expressed as a topic; ask for everything and filter locally
    if (kinds.contains(EventKind.UNKNOWN)) {
      topics.clear();
    }
    return new EventFilter(contractId, topics);
  }

  public Builder toBuilder() {
    Builder b = new Builder()
        .contractId(contractId)
        .startCursor(startCursor)
        .reconnect(reconnect)
        .reconnectDelay(reconnectDelay)
        .maxReconnectAttempts(maxReconnectAttempts);
    b.kinds.addAll(kinds);
    return b;
  }

  /** Builder for {@link SubscriptionConfig}. */
  public static final class Builder {
    private String contractId;
    private final Set<EventKind> kinds = new LinkedHashSet<>();
    private String startCursor;
    private boolean reconnect = true;
    private Duration reconnectDelay = Duration.ofMillis(5000);
    private int maxReconnectAttempts = 5;

    private Builder() {}

    /**
     * Restricts the subscription to one contract.
     *
     * <p>Optional. Defaults to all contracts.
     */
    public Builder contractId(String contractId) {
      this.contractId = contractId;
      return this;
    }

    /**
     * Restricts delivery to these kinds.
     *
     * <p>Optional. Defaults to every kind.
     */
    public Builder kinds(Collection<EventKind> kinds) {
      this.kinds.clear();
      this.kinds.addAll(kinds);
      return this;
    }

    public Builder kinds(EventKind... kinds) {
      return kinds(Set.of(kinds));
    }

    /**
     * Paging token to resume after.
     *
     * <p>Optional. Defaults to the live tip.
     */
    public Builder startCursor(String startCursor) {
      this.startCursor = startCursor;
      return this;
    }

    /**
     * Whether to reopen the stream after an error.
     *
     * <p>Optional. Defaults to {@code true}.
     */
    public Builder reconnect(boolean reconnect) {
      this.reconnect = reconnect;
      return this;
    }

    /**
     * Wait before reopening a failed stream.
     *
     * <p>Optional. Defaults to 5 seconds.
     */
    public Builder reconnectDelay(Duration reconnectDelay) {
      this.reconnectDelay = reconnectDelay;
      return this;
    }

    /**
     * Consecutive reconnects allowed before the subscription gives up.
     *
     * <p>Optional. Defaults to 5.
     */
    public Builder maxReconnectAttempts(int maxReconnectAttempts) {
      this.maxReconnectAttempts = maxReconnectAttempts;
      return this;
    }

    public SubscriptionConfig build() {
      return new SubscriptionConfig(this);
    }
  }
}
