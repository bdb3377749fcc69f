package io.ledgerflow.bid;

import io.ledgerflow.util.StrKey;

import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Content checks for a bid before it is signed.
 */
public final class BidValidator {
  public static final int MIN_PROPOSAL_LENGTH = 50;
  public static final int MAX_DELIVERY_DAYS = 365;

  private static final BigDecimal MAX_BUDGET_FACTOR = BigDecimal.valueOf(2);

  /**
   * @param valid  whether every check passed
   * @param errors human-readable problems, in check order
   */
  public record Result(boolean valid, List<String> errors) {
    public Result {
      errors = List.copyOf(errors);
    }
  }

  private BidValidator() {
  }

  /**
   * @param projectBudget the escrow's total amount, or {@code null} to skip the upper bound
   */
  public static Result validate(BidProposal bid, BigDecimal projectBudget) {
    List<String> errors = new ArrayList<>();
    if (!StrKey.isValidAccountId(bid.freelancerAddress())) {
      errors.add("Freelancer address is not a valid account id");
    }
    if (bid.escrowId().isBlank()) {
      errors.add("Escrow id is required");
    }
    if (bid.bidAmount().signum() <= 0) {
      errors.add("Bid amount must be greater than 0");
    } else if (projectBudget != null
        && bid.bidAmount().compareTo(projectBudget.multiply(MAX_BUDGET_FACTOR)) > 0) {
      errors.add("Bid amount seems unusually high (> 2x project budget). Please verify.");
    }
    if (bid.deliveryDays() <= 0) {
      errors.add("Delivery time must be a positive number of days");
    } else if (bid.deliveryDays() > MAX_DELIVERY_DAYS) {
      errors.add("Delivery time cannot exceed " + MAX_DELIVERY_DAYS + " days");
    }
    if (bid.proposal().trim().length() < MIN_PROPOSAL_LENGTH) {
      errors.add("Proposal must be at least " + MIN_PROPOSAL_LENGTH + " characters long");
    }
    if (bid.portfolio().filter(link -> !link.isBlank()).isPresent() && !isUrl(bid.portfolioLink())) {
      errors.add("Portfolio link must be a valid URL");
    }
    return new Result(errors.isEmpty(), errors);
  }

  private static boolean isUrl(String link) {
    try {
      URI uri = new URI(link.trim());
      return uri.isAbsolute() && uri.getHost() != null;
    } catch (URISyntaxException e) {
      return false;
    }
  }
}
