package io.ledgerflow.escrow;

import io.ledgerflow.ErrorCode;
import io.ledgerflow.InvalidParamsException;
import io.ledgerflow.LedgerException;
import io.ledgerflow.event.EventKind;
import io.ledgerflow.event.EventPublisher;
import io.ledgerflow.model.ContractCall;
import io.ledgerflow.model.SubmitResult;
import io.ledgerflow.spi.LedgerClient;
import io.ledgerflow.spi.WalletSigner;
import io.ledgerflow.submit.LedgerWriter;
import io.ledgerflow.util.Amounts;
import io.ledgerflow.util.FlatJson;
import io.ledgerflow.util.StrKey;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Milestone- and time-based escrows between a client and a provider.
 *
 * <p>Writes go through the {@link LedgerWriter}; reads always go to the ledger. Parameter
 * checks happen before anything is submitted.
 *
 * <p>Ledger state keys of an escrow contract: {@code status} (0 active, 1 completed,
 * 2 disputed, 3 cancelled), {@code client}, {@code provider}, {@code total_amount},
 * {@code released_amount}, {@code release_type} (0 time, 1 milestone),
 * {@code milestone_count} and {@code milestone.<i>}, {@code release_count} and
 * {@code release.<i>} (flat JSON objects).
 */
public final class EscrowService {
  private static final Logger logger = Logger.getLogger(EscrowService.class.getName());

  private final LedgerWriter writer;
  private final LedgerClient ledger;
  private final String factoryContractId;
  private final EventPublisher events;
  private final Clock clock;
  private final Duration creationExpiry;

  public EscrowService(LedgerWriter writer, String factoryContractId, EventPublisher events,
                       Clock clock, Duration creationExpiry) {
    this.writer = Objects.requireNonNull(writer, "writer");
    this.ledger = writer.ledgerClient();
    this.factoryContractId = Objects.requireNonNull(factoryContractId, "factoryContractId");
    this.events = Objects.requireNonNull(events, "events");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.creationExpiry = Objects.requireNonNull(creationExpiry, "creationExpiry");
  }

  /**
   * Creates an escrow with the signer as client.
   *
   * @return the new escrow contract id
   * @throws InvalidParamsException if the parameters are inconsistent; nothing is submitted
   */
  public String createEscrow(CreateEscrowParams params, WalletSigner signer) {
    Objects.requireNonNull(params, "params");
    Objects.requireNonNull(signer, "signer");
    String client = signer.getPublicKey();
    validate(params, client);

    Map<String, String> args = new LinkedHashMap<>();
    args.put("client", client);
    params.provider().ifPresent(p -> args.put("provider", p));
    args.put("total_amount", Amounts.toLedger(params.totalAmount()));
    args.put("release_type", Integer.toString(params.releaseType().code()));
    if (params.releaseType() == ReleaseType.MILESTONE_BASED) {
      List<Map<String, String>> milestones = new ArrayList<>();
      for (MilestoneSpec m : params.milestones()) {
        milestones.add(Map.of("title", m.title(), "description", m.description(),
            "budget", Amounts.toLedger(m.budget())));
      }
      args.put("milestones", FlatJson.writeList(milestones));
    } else {
      List<Map<String, String>> releases = new ArrayList<>();
      for (TimeRelease r : params.schedule()) {
        releases.add(Map.of("release_at", Long.toString(r.releaseAt().getEpochSecond()),
            "amount", Amounts.toLedger(r.amount())));
      }
      args.put("schedule", FlatJson.writeList(releases));
    }

    SubmitResult result = writer.submit("create-escrow",
        signer, List.of(ContractCall.of(factoryContractId, "initialize", args)), creationExpiry);
    String contractId = result.returned().orElseThrow(() -> new LedgerException(ErrorCode.CONTRACT_ERROR,
        "Escrow initialization returned no contract id (tx " + result.hash() + ")"));
    logger.fine(() -> "Created escrow " + contractId + " for client " + client);

    Map<String, String> payload = new LinkedHashMap<>();
    payload.put("client", client);
    params.provider().ifPresent(p -> payload.put("provider", p));
    payload.put("total_amount", Amounts.toLedger(params.totalAmount()));
    events.publish(EventKind.ESCROW_CREATED, contractId, payload);
    return contractId;
  }

  void validate(CreateEscrowParams params, String client) {
    if (params.provider().isPresent()) {
      String provider = params.provider().get();
      if (!StrKey.isValidAccountId(provider)) {
        throw new InvalidParamsException("Invalid provider address: " + provider);
      }
      if (provider.equals(client)) {
        throw new InvalidParamsException("Provider must differ from client");
      }
    }
    if (!Amounts.isPositive(params.totalAmount())) {
      throw new InvalidParamsException("Total amount must be greater than 0");
    }
    BigDecimal sum = BigDecimal.ZERO;
    if (params.releaseType() == ReleaseType.MILESTONE_BASED) {
      if (params.milestones().isEmpty()) {
        throw new InvalidParamsException("At least one milestone is required");
      }
      for (MilestoneSpec m : params.milestones()) {
        if (m.title().isBlank()) {
          throw new InvalidParamsException("Milestone title must not be empty");
        }
        if (!Amounts.isPositive(m.budget())) {
          throw new InvalidParamsException("Milestone budget must be greater than 0: " + m.title());
        }
        sum = sum.add(m.budget());
      }
    } else {
      if (params.schedule().isEmpty()) {
        throw new InvalidParamsException("At least one release is required");
      }
      Instant now = clock.instant();
      for (TimeRelease r : params.schedule()) {
        if (!Amounts.isPositive(r.amount())) {
          throw new InvalidParamsException("Release amount must be greater than 0");
        }
        if (!r.releaseAt().isAfter(now)) {
          throw new InvalidParamsException("Release time must be in the future: " + r.releaseAt());
        }
        sum = sum.add(r.amount());
      }
    }
    if (!Amounts.withinTolerance(sum, params.totalAmount())) {
      throw new InvalidParamsException("Budget mismatch: entries sum to " + sum.toPlainString()
          + " but total amount is " + params.totalAmount().toPlainString());
    }
  }

  /**
   * Marks a milestone completed and publishes {@code milestone_completed}.
   */
  public SubmitResult completeMilestone(String contractId, String milestoneId, WalletSigner signer) {
    requireText(contractId, "contractId");
    requireText(milestoneId, "milestoneId");
    SubmitResult result = writer.submit("complete-milestone", signer, List.of(ContractCall.of(contractId,
        "complete_milestone", Map.of("caller", signer.getPublicKey(), "milestone_id", milestoneId))));
    events.publish(EventKind.MILESTONE_COMPLETED, contractId, Map.of("milestone_id", milestoneId));
    return result;
  }

  /**
   * Lets the provider claim released funds and publishes {@code funds_released}.
   *
   * @return the amount withdrawn, as returned by the contract
   */
  public BigDecimal withdrawReleased(String contractId, WalletSigner signer) {
    requireText(contractId, "contractId");
    String provider = signer.getPublicKey();
    SubmitResult result = writer.submit("withdraw-released", signer, List.of(ContractCall.of(contractId,
        "withdraw_released", Map.of("caller", provider))));
    BigDecimal amount = result.returned().map(Amounts::parse).orElse(BigDecimal.ZERO);
    events.publish(EventKind.FUNDS_RELEASED, contractId,
        Map.of("recipient", provider, "amount", Amounts.toLedger(amount)));
    return amount;
  }

  /**
   * Opens a dispute and publishes {@code dispute_initiated}.
   *
   * @throws InvalidParamsException if {@code reason} is blank
   */
  public SubmitResult disputeEscrow(String contractId, String reason, WalletSigner signer) {
    requireText(contractId, "contractId");
    if (reason == null || reason.isBlank()) {
      throw new InvalidParamsException("A dispute reason is required");
    }
    String initiator = signer.getPublicKey();
    SubmitResult result = writer.submit("dispute-escrow", signer, List.of(ContractCall.of(contractId,
        "dispute", Map.of("caller", initiator, "reason", reason.trim()))));
    events.publish(EventKind.DISPUTE_INITIATED, contractId,
        Map.of("initiator", initiator, "reason", reason.trim()));
    return result;
  }

  /**
   * Reads the escrow's current state from the ledger.
   *
   * @throws LedgerException {@code NOT_FOUND} if the contract has no escrow state
   */
  public EscrowStatus getEscrowStatus(String contractId) {
    requireText(contractId, "contractId");
    String statusCode = read(contractId, "status")
        .orElseThrow(() -> new LedgerException(ErrorCode.NOT_FOUND, "Escrow not found: " + contractId));
    try {
      EscrowState state = EscrowState.fromCode(Integer.parseInt(statusCode)).orElseGet(() -> {
        logger.warning("Unknown status code " + statusCode + " on escrow " + contractId + "; treating as ACTIVE");
        return EscrowState.ACTIVE;
      });
      String client = read(contractId, "client").orElseThrow(() -> malformed(contractId, "client"));
      String provider = read(contractId, "provider").filter(p -> !p.isBlank()).orElse(null);
      BigDecimal total = Amounts.parse(read(contractId, "total_amount")
          .orElseThrow(() -> malformed(contractId, "total_amount")));
      BigDecimal released = Amounts.parseOrZero(read(contractId, "released_amount").orElse(null));
      ReleaseType releaseType = ReleaseType.fromCode(Integer.parseInt(read(contractId, "release_type")
          .orElse(Integer.toString(ReleaseType.MILESTONE_BASED.code()))));

      List<Milestone> milestones = new ArrayList<>();
      List<TimeRelease> schedule = new ArrayList<>();
      if (releaseType == ReleaseType.MILESTONE_BASED) {
        int count = Integer.parseInt(read(contractId, "milestone_count").orElse("0"));
        for (int i = 0; i < count; i++) {
          Map<String, String> m = FlatJson.read(read(contractId, "milestone." + i)
              .orElseThrow(() -> malformed(contractId, "milestone")));
          String completedAt = m.get("completed_at");
          milestones.add(new Milestone(m.getOrDefault("id", Integer.toString(i)),
              m.getOrDefault("title", ""), m.getOrDefault("description", ""),
              Amounts.parse(m.get("budget")),
              MilestoneStatus.fromWire(m.getOrDefault("status", MilestoneStatus.PENDING.wire())),
              completedAt == null || completedAt.isBlank() ? null
                  : Instant.ofEpochSecond(Long.parseLong(completedAt))));
        }
      } else {
        int count = Integer.parseInt(read(contractId, "release_count").orElse("0"));
        for (int i = 0; i < count; i++) {
          Map<String, String> r = FlatJson.read(read(contractId, "release." + i)
              .orElseThrow(() -> malformed(contractId, "release")));
          schedule.add(new TimeRelease(Instant.ofEpochSecond(Long.parseLong(r.get("release_at"))),
              Amounts.parse(r.get("amount"))));
        }
      }
      return new EscrowStatus(contractId, state, client, provider, total, released, releaseType,
          milestones, schedule);
    } catch (IllegalArgumentException e) {
      throw new LedgerException(ErrorCode.CONTRACT_ERROR, "Malformed escrow state on " + contractId, e);
    }
  }

  private Optional<String> read(String contractId, String key) {
    return ledger.readContractState(contractId, key);
  }

  private static LedgerException malformed(String contractId, String key) {
    return new LedgerException(ErrorCode.CONTRACT_ERROR, "Escrow " + contractId + " has no " + key);
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new InvalidParamsException(name + " is required");
    }
  }
}
