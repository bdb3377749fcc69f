package io.ledgerflow.bid;

import java.util.Objects;

/**
 * A bid with its content digest and the freelancer's signature over that digest.
 *
 * <p>{@code verified} records what the signer's side saw when the bid was created; receivers
 * must call {@link BidProtocol#verifyBidSignature} themselves.
 *
 * @param hash      lowercase hex SHA-256 of the canonical content
 * @param signature base64 Ed25519 signature over the UTF-8 bytes of {@code hash}
 */
public record SignedBidProposal(BidProposal bid, String hash, String signature, boolean verified) {
  public SignedBidProposal {
    Objects.requireNonNull(bid, "bid");
    Objects.requireNonNull(bid.timestamp(), "bid.timestamp");
    Objects.requireNonNull(hash, "hash");
    Objects.requireNonNull(signature, "signature");
  }

  public String escrowId() {
    return bid.escrowId();
  }

  public String freelancerAddress() {
    return bid.freelancerAddress();
  }
}
