package io.ledgerflow.bid;

import io.ledgerflow.util.FlatJson;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deterministic encoding and digest of a bid's content fields.
 *
 * <p>The encoding is a compact JSON object with members in this fixed order: escrowId,
 * freelancerAddress, bidAmount (number), deliveryDays (number), proposal, portfolioLink,
 * milestonesApproach, timestamp (epoch milliseconds). Absent optional fields are empty
 * strings.
 */
public final class BidCanonicalizer {

  private BidCanonicalizer() {
  }

  public static String canonicalJson(BidProposal bid) {
    if (bid.timestamp() == null) {
      throw new IllegalArgumentException("bid timestamp is required for hashing");
    }
    return "{"
        + "\"escrowId\":" + FlatJson.quote(bid.escrowId())
        + ",\"freelancerAddress\":" + FlatJson.quote(bid.freelancerAddress())
        + ",\"bidAmount\":" + bid.bidAmount().stripTrailingZeros().toPlainString()
        + ",\"deliveryDays\":" + bid.deliveryDays()
        + ",\"proposal\":" + FlatJson.quote(bid.proposal())
        + ",\"portfolioLink\":" + FlatJson.quote(bid.portfolio().orElse(""))
        + ",\"milestonesApproach\":" + FlatJson.quote(bid.approach().orElse(""))
        + ",\"timestamp\":" + bid.timestamp().toEpochMilli()
        + "}";
  }

  /** Lowercase hex SHA-256 of {@link #canonicalJson}. */
  public static String hash(BidProposal bid) {
    try {
      byte[] digest = MessageDigest.getInstance("SHA-256")
          .digest(canonicalJson(bid).getBytes(StandardCharsets.UTF_8));
      StringBuilder hex = new StringBuilder(digest.length * 2);
      for (byte b : digest) {
        hex.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
      }
      return hex.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is not available", e);
    }
  }
}
