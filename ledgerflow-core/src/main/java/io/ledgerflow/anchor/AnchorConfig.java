package io.ledgerflow.anchor;

import java.time.Duration;
import java.util.Objects;

/**
 * Endpoints and timings for one anchor.
 */
public final class AnchorConfig {
  private final String transferServerUrl;
  private final String webAuthUrl;
  private final String defaultAssetCode;
  private final Duration tokenTtl;
  private final Duration rateCacheTtl;
  private final Duration pollInitialDelay;
  private final double pollMultiplier;
  private final Duration pollMaxDelay;
  private final int pollMaxAttempts;

  private AnchorConfig(Builder builder) {
    this.transferServerUrl = stripSlash(Objects.requireNonNull(builder.transferServerUrl, "transferServerUrl"));
    this.webAuthUrl = stripSlash(Objects.requireNonNull(builder.webAuthUrl, "webAuthUrl"));
    this.defaultAssetCode = Objects.requireNonNull(builder.defaultAssetCode, "defaultAssetCode");
    this.tokenTtl = positive(builder.tokenTtl, "tokenTtl");
    this.rateCacheTtl = positive(builder.rateCacheTtl, "rateCacheTtl");
    this.pollInitialDelay = positive(builder.pollInitialDelay, "pollInitialDelay");
    this.pollMaxDelay = positive(builder.pollMaxDelay, "pollMaxDelay");
    if (pollMaxDelay.compareTo(pollInitialDelay) < 0) {
      throw new IllegalArgumentException("pollMaxDelay must be >= pollInitialDelay");
    }
    if (builder.pollMultiplier < 1.0) {
      throw new IllegalArgumentException("pollMultiplier must be >= 1, got: " + builder.pollMultiplier);
    }
    this.pollMultiplier = builder.pollMultiplier;
    if (builder.pollMaxAttempts < 1) {
      throw new IllegalArgumentException("pollMaxAttempts must be >= 1, got: " + builder.pollMaxAttempts);
    }
    this.pollMaxAttempts = builder.pollMaxAttempts;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Conventional layout for an anchor domain: {@code https://<domain>/sep24} for the
   * transfer server and {@code https://<domain>/auth} for authentication.
   */
  public static Builder forDomain(String domain) {
    Objects.requireNonNull(domain, "domain");
    return new Builder()
        .transferServerUrl("https://" + domain + "/sep24")
        .webAuthUrl("https://" + domain + "/auth");
  }

  public String transferServerUrl() {
    return transferServerUrl;
  }

  public String webAuthUrl() {
    return webAuthUrl;
  }

  public String defaultAssetCode() {
    return defaultAssetCode;
  }

  public Duration tokenTtl() {
    return tokenTtl;
  }

  public Duration rateCacheTtl() {
    return rateCacheTtl;
  }

  public Duration pollInitialDelay() {
    return pollInitialDelay;
  }

  public double pollMultiplier() {
    return pollMultiplier;
  }

  public Duration pollMaxDelay() {
    return pollMaxDelay;
  }

  public int pollMaxAttempts() {
    return pollMaxAttempts;
  }

  private static String stripSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  private static Duration positive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
    return value;
  }

  public static final class Builder {
    private String transferServerUrl;
    private String webAuthUrl;
    private String defaultAssetCode = "USDC";
    private Duration tokenTtl = Duration.ofHours(23);
    private Duration rateCacheTtl = Duration.ofSeconds(30);
    private Duration pollInitialDelay = Duration.ofSeconds(5);
    private double pollMultiplier = 1.5;
    private Duration pollMaxDelay = Duration.ofSeconds(15);
    private int pollMaxAttempts = 40;

    private Builder() {
    }

    /** <b>Required.</b> Base URL of the interactive transfer server. */
    public Builder transferServerUrl(String transferServerUrl) {
      this.transferServerUrl = transferServerUrl;
      return this;
    }

    /** <b>Required.</b> Challenge/token endpoint. */
    public Builder webAuthUrl(String webAuthUrl) {
      this.webAuthUrl = webAuthUrl;
      return this;
    }

    /** Optional. Defaults to {@code USDC}. */
    public Builder defaultAssetCode(String defaultAssetCode) {
      this.defaultAssetCode = defaultAssetCode;
      return this;
    }

    /** Optional. Defaults to 23 hours. */
    public Builder tokenTtl(Duration tokenTtl) {
      this.tokenTtl = tokenTtl;
      return this;
    }

    /** Optional. Defaults to 30 seconds. */
    public Builder rateCacheTtl(Duration rateCacheTtl) {
      this.rateCacheTtl = rateCacheTtl;
      return this;
    }

    /** Optional. Defaults to 5 seconds. */
    public Builder pollInitialDelay(Duration pollInitialDelay) {
      this.pollInitialDelay = pollInitialDelay;
      return this;
    }

    /** Optional. Defaults to 1.5. */
    public Builder pollMultiplier(double pollMultiplier) {
      this.pollMultiplier = pollMultiplier;
      return this;
    }

    /** Optional. Defaults to 15 seconds. */
    public Builder pollMaxDelay(Duration pollMaxDelay) {
      this.pollMaxDelay = pollMaxDelay;
      return this;
    }

    /** Optional. Defaults to 40. */
    public Builder pollMaxAttempts(int pollMaxAttempts) {
      this.pollMaxAttempts = pollMaxAttempts;
      return this;
    }

    public AnchorConfig build() {
      return new AnchorConfig(this);
    }
  }
}
