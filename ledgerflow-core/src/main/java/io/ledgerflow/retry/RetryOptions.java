package io.ledgerflow.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable retry settings. Create via {@link #builder()} or use {@link #defaults()}.
 *
 * <p>{@code maxRetries} counts total attempts, so the default of 3 means one initial
 * attempt and at most two retries.
 */
public final class RetryOptions {
  private static final RetryOptions DEFAULTS = builder().build();

  private final int maxRetries;
  private final Duration initialDelay;
  private final double multiplier;
  private final Duration maxDelay;
  private final boolean jitter;
  private final RetryListener onRetry;
  private final RetryPolicy policy;

  private RetryOptions(Builder builder) {
    if (builder.maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be >= 1, got: " + builder.maxRetries);
    }
    this.maxRetries = builder.maxRetries;
    this.initialDelay = Objects.requireNonNull(builder.initialDelay, "initialDelay");
    this.multiplier = builder.multiplier;
    this.maxDelay = Objects.requireNonNull(builder.maxDelay, "maxDelay");
    this.jitter = builder.jitter;
    this.onRetry = builder.onRetry;
    this.policy = new ExponentialBackoffRetryPolicy(
        initialDelay.toMillis(), multiplier, maxDelay.toMillis(), jitter);
  }

  public static RetryOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  public int maxRetries() {
    return maxRetries;
  }

  public Duration initialDelay() {
    return initialDelay;
  }

  public double multiplier() {
    return multiplier;
  }

  public Duration maxDelay() {
    return maxDelay;
  }

  public boolean jitter() {
    return jitter;
  }

  /** The retry observer, or {@code null}. */
  public RetryListener onRetry() {
    return onRetry;
  }

  public RetryPolicy policy() {
    return policy;
  }

  /** Returns a builder pre-filled with these options. */
  public Builder toBuilder() {
    return new Builder()
        .maxRetries(maxRetries)
        .initialDelay(initialDelay)
        .multiplier(multiplier)
        .maxDelay(maxDelay)
        .jitter(jitter)
        .onRetry(onRetry);
  }

  /** Builder for {@link RetryOptions}. */
  public static final class Builder {
    private int maxRetries = 3;
    private Duration initialDelay = Duration.ofMillis(1000);
    private double multiplier = 2.0;
    private Duration maxDelay = Duration.ofMillis(30_000);
    private boolean jitter;
    private RetryListener onRetry;

    private Builder() {}

    /**
     * Total number of attempts, including the first one.
     *
     * <p>Optional. Defaults to 3.
     *
     * @param maxRetries attempts (>= 1)
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Delay after the first failed attempt.
     *
     * <p>Optional. Defaults to 1 second.
     *
     * @param initialDelay the initial delay
     * @return this builder
     */
    public Builder initialDelay(Duration initialDelay) {
      this.initialDelay = initialDelay;
      return this;
    }

    /**
     * Growth factor applied per failed attempt.
     *
     * <p>Optional. Defaults to 2.
     *
     * @param multiplier the factor (>= 1)
     * @return this builder
     */
    public Builder multiplier(double multiplier) {
      this.multiplier = multiplier;
      return this;
    }

    /**
     * Upper bound for any single delay, including server-provided retry-after hints.
     *
     * <p>Optional. Defaults to 30 seconds.
     *
     * @param maxDelay the cap
     * @return this builder
     */
    public Builder maxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
      return this;
    }

    /**
     * Whether to randomize delays within [0.5, 1.5) of the computed value.
     *
     * <p>Optional. Defaults to {@code false}.
     *
     * @param jitter enable jitter
     * @return this builder
     */
    public Builder jitter(boolean jitter) {
      this.jitter = jitter;
      return this;
    }

    /**
     * Observer invoked before each wait.
     *
     * <p>Optional.
     *
     * @param onRetry the observer
     * @return this builder
     */
    public Builder onRetry(RetryListener onRetry) {
      this.onRetry = onRetry;
      return this;
    }

    public RetryOptions build() {
      return new RetryOptions(this);
    }
  }
}
