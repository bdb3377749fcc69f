package io.ledgerflow.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ledgerflow.bid.BidProposal;
import io.ledgerflow.bid.SignedBidProposal;
import io.ledgerflow.model.BackendResponse;
import io.ledgerflow.spi.EscrowBackend;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EscrowBackend} over the marketplace REST API.
 *
 * <ul>
 *   <li>{@code POST {base}/bids} with the bid fields, hash and signature</li>
 *   <li>{@code GET {base}/bids/{escrowId}} returning {@code {"bids":[...]}}</li>
 *   <li>{@code POST {base}/escrows/{escrowId}/accept-bid} with bid hash, freelancer and client</li>
 * </ul>
 *
 * <p>Replies carry either {@code transactionHash} or {@code unsignedTransaction}; remaining
 * scalar members are passed through as {@link BackendResponse#data()}. Fetched bids are never
 * marked verified.
 */
public final class HttpEscrowBackend implements EscrowBackend {
  private static final Logger logger = Logger.getLogger(HttpEscrowBackend.class.getName());

  private final String baseUrl;
  private final JsonHttpClient client;

  private HttpEscrowBackend(Builder builder) {
    String base = Objects.requireNonNull(builder.baseUrl, "baseUrl");
    this.baseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    this.client = new JsonHttpClient(
        builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder()
            .connectTimeout(builder.requestTimeout)
            .build(),
        builder.objectMapper != null ? builder.objectMapper : new ObjectMapper(),
        builder.requestTimeout);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public BackendResponse submitBid(SignedBidProposal bid) {
    Objects.requireNonNull(bid, "bid");
    BidProposal b = bid.bid();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("escrowId", b.escrowId());
    body.put("freelancerAddress", b.freelancerAddress());
    body.put("bidAmount", b.bidAmount());
    body.put("deliveryDays", b.deliveryDays());
    body.put("proposal", b.proposal());
    body.put("signature", bid.signature());
    body.put("hash", bid.hash());
    body.put("portfolioLink", b.portfolioLink());
    body.put("milestonesApproach", b.milestonesApproach());
    body.put("timestamp", b.timestamp().toEpochMilli());
    return toResponse(client.post(baseUrl + "/bids", body, null));
  }

  @Override
  public List<SignedBidProposal> fetchBids(String escrowId) {
    Objects.requireNonNull(escrowId, "escrowId");
    JsonNode reply = client.get(baseUrl + "/bids/" + encode(escrowId), Map.of(), null);
    List<SignedBidProposal> bids = new ArrayList<>();
    for (JsonNode node : reply.path("bids")) {
      try {
        bids.add(toBid(node));
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Skipping malformed bid for escrow " + escrowId, e);
      }
    }
    return bids;
  }

  @Override
  public BackendResponse acceptBid(String escrowId, SignedBidProposal bid, String clientAddress) {
    Objects.requireNonNull(escrowId, "escrowId");
    Objects.requireNonNull(bid, "bid");
    Objects.requireNonNull(clientAddress, "clientAddress");
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("bidHash", bid.hash());
    body.put("freelancerAddress", bid.freelancerAddress());
    body.put("clientAddress", clientAddress);
    return toResponse(client.post(baseUrl + "/escrows/" + encode(escrowId) + "/accept-bid", body, null));
  }

  private static SignedBidProposal toBid(JsonNode node) {
    BidProposal bid = BidProposal.builder()
        .escrowId(required(node, "escrowId"))
        .freelancerAddress(required(node, "freelancerAddress"))
        .bidAmount(new BigDecimal(required(node, "bidAmount")))
        .deliveryDays(node.path("deliveryDays").asInt())
        .proposal(required(node, "proposal"))
        .portfolioLink(optional(node, "portfolioLink"))
        .milestonesApproach(optional(node, "milestonesApproach"))
        .timestamp(Instant.ofEpochMilli(Long.parseLong(required(node, "timestamp"))))
        .build();
    return new SignedBidProposal(bid, required(node, "hash"), required(node, "signature"), false);
  }

  private static BackendResponse toResponse(JsonNode reply) {
    Map<String, String> data = new LinkedHashMap<>(JsonHttpClient.flatten(reply));
    String hash = data.remove("transactionHash");
    String envelope = data.remove("unsignedTransaction");
    return new BackendResponse(hash, envelope, data);
  }

  private static String required(JsonNode node, String field) {
    String value = optional(node, field);
    if (value == null) {
      throw new IllegalArgumentException("Missing bid field: " + field);
    }
    return value;
  }

  private static String optional(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || !value.isValueNode()) {
      return null;
    }
    return value.isNumber() ? value.decimalValue().toPlainString() : value.asText();
  }

  private static String encode(String segment) {
    return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
  }

  public static final class Builder {
    private String baseUrl;
    private HttpClient httpClient;
    private ObjectMapper objectMapper;
    private Duration requestTimeout = Duration.ofSeconds(30);

    private Builder() {}

    /** <b>Required.</b> API root, e.g. {@code https://api.example.com/v1}. */
    public Builder baseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    /** Optional. Defaults to a new client. */
    public Builder httpClient(HttpClient httpClient) {
      this.httpClient = httpClient;
      return this;
    }

    /** Optional. Defaults to a plain {@link ObjectMapper}. */
    public Builder objectMapper(ObjectMapper objectMapper) {
      this.objectMapper = objectMapper;
      return this;
    }

    /** Optional. Per-request timeout. Defaults to 30 seconds. */
    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
      if (requestTimeout.isZero() || requestTimeout.isNegative()) {
        throw new IllegalArgumentException("requestTimeout must be positive, got: " + requestTimeout);
      }
      return this;
    }

    public HttpEscrowBackend build() {
      return new HttpEscrowBackend(this);
    }
  }
}
