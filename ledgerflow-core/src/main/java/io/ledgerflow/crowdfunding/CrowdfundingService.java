package io.ledgerflow.crowdfunding;

import io.ledgerflow.ErrorCode;
import io.ledgerflow.InvalidParamsException;
import io.ledgerflow.LedgerException;
import io.ledgerflow.escrow.CreateEscrowParams;
import io.ledgerflow.escrow.EscrowService;
import io.ledgerflow.escrow.MilestoneSpec;
import io.ledgerflow.event.EventKind;
import io.ledgerflow.event.EventPublisher;
import io.ledgerflow.model.ContractCall;
import io.ledgerflow.model.SubmitResult;
import io.ledgerflow.spi.LedgerClient;
import io.ledgerflow.spi.WalletSigner;
import io.ledgerflow.submit.LedgerWriter;
import io.ledgerflow.util.Amounts;
import io.ledgerflow.util.FlatJson;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Crowdfunding pools: a goal, a deadline, contributions, and a single transition to
 * funded (handing off to a linked escrow) or failed (opening refunds).
 *
 * <p>The ledger is authoritative for totals and contributor records; this service never
 * adds contributions up on the client. Ledger state keys of a pool contract:
 * {@code project_owner}, {@code description}, {@code funding_goal}, {@code deadline}
 * (epoch seconds), {@code total_raised}, {@code status} (0 funding, 1 funded, 2 failed),
 * {@code contributors} (flat JSON address to amount), {@code escrow_contract}.
 */
public final class CrowdfundingService {
  private static final Logger logger = Logger.getLogger(CrowdfundingService.class.getName());

  private final LedgerWriter writer;
  private final LedgerClient ledger;
  private final String poolFactoryContractId;
  private final EscrowService escrowService;
  private final EventPublisher events;
  private final Clock clock;
  private final Duration creationExpiry;

  public CrowdfundingService(LedgerWriter writer, String poolFactoryContractId, EscrowService escrowService,
                             EventPublisher events, Clock clock, Duration creationExpiry) {
    this.writer = Objects.requireNonNull(writer, "writer");
    this.ledger = writer.ledgerClient();
    this.poolFactoryContractId = Objects.requireNonNull(poolFactoryContractId, "poolFactoryContractId");
    this.escrowService = Objects.requireNonNull(escrowService, "escrowService");
    this.events = Objects.requireNonNull(events, "events");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.creationExpiry = Objects.requireNonNull(creationExpiry, "creationExpiry");
  }

  /**
   * Creates a pool owned by the signer.
   *
   * @return the pool contract id
   * @throws InvalidParamsException unless {@code fundingGoal > 0} and
   *     {@code now < deadline <= now + 1 year}
   */
  public String createPool(BigDecimal fundingGoal, Instant deadline, String description, WalletSigner signer) {
    Objects.requireNonNull(signer, "signer");
    if (!Amounts.isPositive(fundingGoal)) {
      throw new InvalidParamsException("Funding goal must be greater than 0");
    }
    if (deadline == null) {
      throw new InvalidParamsException("Deadline is required");
    }
    Instant now = clock.instant();
    if (!deadline.isAfter(now)) {
      throw new InvalidParamsException("Deadline must be in the future");
    }
    Instant limit = now.atOffset(ZoneOffset.UTC).plusYears(1).toInstant();
    if (deadline.isAfter(limit)) {
      throw new InvalidParamsException("Deadline cannot be more than 1 year in the future");
    }
    String owner = signer.getPublicKey();
    Map<String, String> args = new LinkedHashMap<>();
    args.put("project_owner", owner);
    args.put("funding_goal", Amounts.toLedger(fundingGoal));
    args.put("deadline", Long.toString(deadline.getEpochSecond()));
    args.put("description", description == null ? "" : description);
    SubmitResult result = writer.submit("create-pool", signer,
        List.of(ContractCall.of(poolFactoryContractId, "initialize", args)), creationExpiry);
    String poolId = result.returned().orElseThrow(() -> new LedgerException(ErrorCode.CONTRACT_ERROR,
        "Pool initialization returned no contract id (tx " + result.hash() + ")"));
    logger.fine(() -> "Created pool " + poolId + " with goal " + fundingGoal.toPlainString());
    return poolId;
  }

  /**
   * Contributes to a pool and publishes {@code contribution_received}. The new total is
   * whatever the ledger says; read it with {@link #getPoolInfo}.
   */
  public SubmitResult contribute(String poolId, BigDecimal amount, WalletSigner signer) {
    requirePoolId(poolId);
    if (!Amounts.isPositive(amount)) {
      throw new InvalidParamsException("Contribution amount must be greater than 0");
    }
    String contributor = signer.getPublicKey();
    SubmitResult result = writer.submit("contribute", signer, List.of(ContractCall.of(poolId, "contribute",
        Map.of("contributor", contributor, "amount", Amounts.toLedger(amount)))));
    events.publish(EventKind.CONTRIBUTION_RECEIVED, poolId,
        Map.of("contributor", contributor, "amount", Amounts.toLedger(amount)));
    return result;
  }

  public PoolInfo finalizePool(String poolId, WalletSigner signer) {
    return finalizePool(poolId, signer, List.of());
  }

  /**
   * Closes funding. A pool that reached its goal becomes funded and gets a linked
   * milestone escrow for the raised amount (one milestone unless {@code milestonePlan} is
   * given); otherwise it becomes failed and contributors may request refunds.
   *
   * <p>Only the project owner may finalize. If the pool ends funded but the escrow cannot be
   * created, the failure propagates; {@link #createLinkedEscrow} can be called again later.
   *
   * @throws LedgerException {@code CONFLICT} if the pool is already finalized or neither the
   *     goal nor the deadline has been reached; {@code UNAUTHORIZED} for other signers
   */
  public PoolInfo finalizePool(String poolId, WalletSigner signer, List<MilestoneSpec> milestonePlan) {
    requirePoolId(poolId);
    Objects.requireNonNull(milestonePlan, "milestonePlan");
    PoolInfo pool = getPoolInfo(poolId);
    if (!pool.projectOwner().equals(signer.getPublicKey())) {
      throw new LedgerException(ErrorCode.UNAUTHORIZED, "Only the project owner can finalize pool " + poolId);
    }
    if (pool.status() != PoolStatus.FUNDING) {
      throw new LedgerException(ErrorCode.CONFLICT, "Pool " + poolId + " is already " + pool.status());
    }
    if (!pool.canFinalize(clock.instant())) {
      throw new LedgerException(ErrorCode.CONFLICT,
          "Pool " + poolId + " cannot be finalized before the goal is reached or the deadline passes");
    }
    writer.submit("finalize-pool", signer, List.of(ContractCall.of(poolId, "finalize",
        Map.of("caller", signer.getPublicKey()))));
    PoolInfo finalized = getPoolInfo(poolId);
    logger.fine(() -> "Pool " + poolId + " finalized as " + finalized.status());
    if (finalized.status() != PoolStatus.FUNDED) {
      return finalized;
    }
    events.publish(EventKind.POOL_FUNDED, poolId, Map.of("total_raised", Amounts.toLedger(finalized.totalRaised())));
    createLinkedEscrow(poolId, signer, milestonePlan);
    return getPoolInfo(poolId);
  }

  /**
   * Creates the escrow for a funded pool and records its id on the pool.
   *
   * @return the escrow contract id
   * @throws LedgerException {@code CONFLICT} if the pool is not funded or already linked
   */
  public String createLinkedEscrow(String poolId, WalletSigner signer, List<MilestoneSpec> milestonePlan) {
    PoolInfo pool = getPoolInfo(poolId);
    if (pool.status() != PoolStatus.FUNDED) {
      throw new LedgerException(ErrorCode.CONFLICT, "Pool " + poolId + " is not funded");
    }
    if (pool.linkedEscrow().isPresent()) {
      throw new LedgerException(ErrorCode.CONFLICT,
          "Pool " + poolId + " is already linked to escrow " + pool.escrowContract());
    }
    List<MilestoneSpec> plan = milestonePlan.isEmpty()
        ? List.of(new MilestoneSpec("Project delivery", "Funded by pool " + poolId, pool.totalRaised()))
        : milestonePlan;
    String escrowId;
    try {
      escrowId = escrowService.createEscrow(CreateEscrowParams.builder()
          .totalAmount(pool.totalRaised())
          .milestones(plan)
          .build(), signer);
    } catch (LedgerException e) {
      logger.log(Level.SEVERE, "Pool " + poolId + " is funded but its escrow could not be created", e);
      throw e;
    }
    writer.submit("link-escrow", signer, List.of(ContractCall.of(poolId, "link_escrow",
        Map.of("caller", signer.getPublicKey(), "escrow_id", escrowId))));
    return escrowId;
  }

  /**
   * Refunds the signer's contribution to a failed pool. A second request for the same
   * contributor fails with {@code CONFLICT}; it never pays twice.
   *
   * @return the refunded amount
   */
  public BigDecimal requestRefund(String poolId, WalletSigner signer) {
    requirePoolId(poolId);
    String contributor = signer.getPublicKey();
    PoolInfo pool = getPoolInfo(poolId);
    if (pool.status() != PoolStatus.FAILED) {
      throw new LedgerException(ErrorCode.CONFLICT,
          "Refunds are only available for failed pools; pool " + poolId + " is " + pool.status());
    }
    BigDecimal amount = pool.contributionOf(contributor);
    if (amount.signum() <= 0) {
      throw new LedgerException(ErrorCode.CONFLICT, "No contribution to refund for " + contributor);
    }
    SubmitResult result = writer.submit("refund", signer, List.of(ContractCall.of(poolId, "refund",
        Map.of("contributor", contributor))));
    return result.returned().map(Amounts::parse).orElse(amount);
  }

  /**
   * Reads the pool from the ledger.
   *
   * @throws LedgerException {@code NOT_FOUND} if the contract has no pool state
   */
  public PoolInfo getPoolInfo(String poolId) {
    requirePoolId(poolId);
    String owner = read(poolId, "project_owner")
        .orElseThrow(() -> new LedgerException(ErrorCode.NOT_FOUND, "Pool not found: " + poolId));
    try {
      int statusCode = Integer.parseInt(read(poolId, "status").orElse("0"));
      PoolStatus status = PoolStatus.fromCode(statusCode).orElseThrow(
          () -> new LedgerException(ErrorCode.CONTRACT_ERROR, "Unknown pool status " + statusCode));
      Map<String, BigDecimal> contributors = new LinkedHashMap<>();
      FlatJson.read(read(poolId, "contributors").orElse(null))
          .forEach((address, value) -> contributors.put(address, Amounts.parse(value)));
      return new PoolInfo(poolId, owner, read(poolId, "description").orElse(""),
          Amounts.parse(read(poolId, "funding_goal").orElse(null)),
          Instant.ofEpochSecond(Long.parseLong(read(poolId, "deadline").orElse(""))),
          Amounts.parseOrZero(read(poolId, "total_raised").orElse(null)),
          status, contributors,
          read(poolId, "escrow_contract").filter(e -> !e.isBlank()).orElse(null));
    } catch (IllegalArgumentException e) {
      throw new LedgerException(ErrorCode.CONTRACT_ERROR, "Malformed pool state on " + poolId, e);
    }
  }

  public Map<String, BigDecimal> getContributors(String poolId) {
    return getPoolInfo(poolId).contributors();
  }

  private Optional<String> read(String poolId, String key) {
    return ledger.readContractState(poolId, key);
  }

  private static void requirePoolId(String poolId) {
    if (poolId == null || poolId.isBlank()) {
      throw new InvalidParamsException("poolId is required");
    }
  }
}
