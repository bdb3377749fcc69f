package io.ledgerflow.bid;

import io.ledgerflow.ErrorClassifier;
import io.ledgerflow.ErrorCode;
import io.ledgerflow.InvalidParamsException;
import io.ledgerflow.LedgerException;
import io.ledgerflow.escrow.EscrowService;
import io.ledgerflow.escrow.EscrowStatus;
import io.ledgerflow.model.BackendResponse;
import io.ledgerflow.spi.EscrowBackend;
import io.ledgerflow.spi.WalletSigner;
import io.ledgerflow.submit.LedgerWriter;
import io.ledgerflow.util.Ed25519;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Signed off-chain bids: canonicalize, hash, sign, verify, submit and accept.
 *
 * <p>Verification is strict. The digest is recomputed from the bid's current fields and must
 * equal the stored hash, and the Ed25519 signature over that hash must verify against the
 * freelancer's address. Either failure rejects the bid.
 */
public final class BidProtocol {
  private static final Logger logger = Logger.getLogger(BidProtocol.class.getName());

  private final EscrowBackend backend;
  private final EscrowService escrowService;
  private final LedgerWriter writer;
  private final Clock clock;

  public BidProtocol(EscrowBackend backend, EscrowService escrowService, LedgerWriter writer, Clock clock) {
    this.backend = Objects.requireNonNull(backend, "backend");
    this.escrowService = Objects.requireNonNull(escrowService, "escrowService");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public SignedBidProposal signBidProposal(BidProposal bid, WalletSigner signer) {
    return signBidProposal(bid, signer, null);
  }

  /**
   * Validates, hashes and signs a bid with the freelancer's wallet.
   *
   * @param projectBudget the escrow total, used to flag bids above twice the budget; may be
   *     {@code null}
   * @throws InvalidParamsException   if the bid fails validation
   * @throws LedgerException          {@code UNAUTHORIZED} if the signer is not the freelancer,
   *     {@code SIGNATURE_INVALID} if the wallet's signature does not verify
   */
  public SignedBidProposal signBidProposal(BidProposal bid, WalletSigner signer, BigDecimal projectBudget) {
    Objects.requireNonNull(bid, "bid");
    Objects.requireNonNull(signer, "signer");
    BidValidator.Result validation = BidValidator.validate(bid, projectBudget);
    if (!validation.valid()) {
      throw new InvalidParamsException(String.join(", ", validation.errors()));
    }
    if (!bid.freelancerAddress().equals(signer.getPublicKey())) {
      throw new LedgerException(ErrorCode.UNAUTHORIZED, "Bids must be signed by the freelancer's own wallet");
    }
    BidProposal stamped = bid.timestamp() != null ? bid : bid.withTimestamp(clock.instant());
    String hash = BidCanonicalizer.hash(stamped);
    String signature;
    try {
      signature = signer.signMessage(hash);
    } catch (RuntimeException e) {
      LedgerException classified = ErrorClassifier.classify(e);
      throw classified.code() == ErrorCode.USER_REJECTED ? classified
          : new LedgerException(ErrorCode.WALLET_ERROR, "Wallet failed to sign bid: " + e.getMessage(), e);
    }
    if (!signatureMatches(hash, signature, stamped.freelancerAddress())) {
      throw new LedgerException(ErrorCode.SIGNATURE_INVALID, "Signature verification failed");
    }
    return new SignedBidProposal(stamped, hash, signature, true);
  }

  /**
   * Recomputes the digest and checks the signature.
   *
   * @return {@code false} on any mismatch
   */
  public boolean verifyBidSignature(SignedBidProposal signed) {
    String expected = BidCanonicalizer.hash(signed.bid());
    if (!expected.equals(signed.hash())) {
      logger.warning("Bid hash mismatch for escrow " + signed.escrowId() + " from " + signed.freelancerAddress());
      return false;
    }
    if (!signatureMatches(signed.hash(), signed.signature(), signed.freelancerAddress())) {
      logger.warning("Bid signature does not verify for " + signed.freelancerAddress());
      return false;
    }
    return true;
  }

  private static boolean signatureMatches(String hash, String signature, String address) {
    byte[] raw;
    try {
      raw = Base64.getDecoder().decode(signature);
    } catch (IllegalArgumentException e) {
      return false;
    }
    try {
      return Ed25519.verify(address, hash.getBytes(StandardCharsets.UTF_8), raw);
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  /**
   * Registers a signed bid with the backend. When the backend returns an envelope, the
   * freelancer signs and submits it.
   *
   * @return the transaction hash, if the backend or the submission produced one
   */
  public Optional<String> submitBidToEscrow(SignedBidProposal signed, WalletSigner signer) {
    requireValid(signed);
    BackendResponse response = backend.submitBid(signed);
    if (response.envelope().isPresent()) {
      return Optional.of(writer.submitEnvelope("submit-bid", signer, response.envelope().get()).hash());
    }
    return response.hash();
  }

  public List<SignedBidProposal> fetchEscrowBids(String escrowId) {
    if (escrowId == null || escrowId.isBlank()) {
      throw new InvalidParamsException("escrowId is required");
    }
    return backend.fetchBids(escrowId);
  }

  /**
   * Binds the bid's freelancer to the escrow as provider.
   *
   * <p>The escrow is checked on the ledger first: a provider already in place is a
   * {@code CONFLICT} and nothing is sent. The backend and ledger still decide races;
   * a losing second acceptance also ends in {@code CONFLICT}.
   *
   * @return the transaction hash, if any
   */
  public Optional<String> acceptBid(String escrowId, SignedBidProposal signed, String clientAddress,
                                    WalletSigner signer) {
    requireValid(signed);
    if (!signed.escrowId().equals(escrowId)) {
      throw new InvalidParamsException("Bid is for escrow " + signed.escrowId() + ", not " + escrowId);
    }
    if (!signer.getPublicKey().equals(clientAddress)) {
      throw new LedgerException(ErrorCode.UNAUTHORIZED, "Only the escrow client can accept bids");
    }
    EscrowStatus escrow = escrowService.getEscrowStatus(escrowId);
    if (!escrow.client().equals(clientAddress)) {
      throw new LedgerException(ErrorCode.UNAUTHORIZED, clientAddress + " is not the client of " + escrowId);
    }
    if (escrow.providerAddress().isPresent()) {
      throw new LedgerException(ErrorCode.CONFLICT,
          "Escrow " + escrowId + " already has provider " + escrow.provider());
    }
    if (escrow.state().isTerminal()) {
      throw new LedgerException(ErrorCode.CONFLICT, "Escrow " + escrowId + " is " + escrow.state());
    }
    BackendResponse response = backend.acceptBid(escrowId, signed, clientAddress);
    if (response.envelope().isPresent()) {
      return Optional.of(writer.submitEnvelope("accept-bid", signer, response.envelope().get()).hash());
    }
    return response.hash();
  }

  private void requireValid(SignedBidProposal signed) {
    Objects.requireNonNull(signed, "signed");
    if (!verifyBidSignature(signed)) {
      throw new LedgerException(ErrorCode.SIGNATURE_INVALID,
          "Invalid bid signature. Bid may have been tampered with.");
    }
  }
}
