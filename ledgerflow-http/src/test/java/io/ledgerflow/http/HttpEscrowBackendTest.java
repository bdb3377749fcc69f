package io.ledgerflow.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ledgerflow.ErrorCode;
import io.ledgerflow.LedgerException;
import io.ledgerflow.bid.BidCanonicalizer;
import io.ledgerflow.bid.BidProposal;
import io.ledgerflow.bid.SignedBidProposal;
import io.ledgerflow.model.BackendResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HttpEscrowBackendTest {

    private static final String FREELANCER = "GAAACAQDAQCQMBYIBEFAWDANBYHRAEISCMKBKFQXDAMRUGY4DUPB7JZX";

    private final ObjectMapper mapper = new ObjectMapper();
    private FakeServer server;
    private HttpEscrowBackend backend;

    @BeforeEach
    void setUp() throws Exception {
        server = new FakeServer();
        backend = HttpEscrowBackend.builder().baseUrl(server.baseUrl() + "/v1/").build();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private static SignedBidProposal bid() {
        BidProposal proposal = BidProposal.builder()
                .escrowId("CESCROW1")
                .freelancerAddress(FREELANCER)
                .bidAmount("1500.50")
                .deliveryDays(14)
                .proposal("Landing page with CMS")
                .portfolioLink("https://example.org/work")
                .timestamp(Instant.ofEpochMilli(1_740_830_400_000L))
                .build();
        return new SignedBidProposal(proposal, BidCanonicalizer.hash(proposal), "c2lnbmF0dXJl", true);
    }

    @Test
    void submitBidPostsFieldsAndReadsHash() throws Exception {
        server.reply("POST /v1/bids", 201, "{\"transactionHash\":\"abc123\",\"bidId\":\"b-9\"}");

        BackendResponse response = backend.submitBid(bid());

        assertEquals("abc123", response.hash().orElseThrow());
        assertTrue(response.envelope().isEmpty());
        assertEquals("b-9", response.data().get("bidId"));
        JsonNode sent = mapper.readTree(server.lastRequest().body());
        assertEquals("CESCROW1", sent.get("escrowId").asText());
        assertEquals(0, new BigDecimal("1500.50").compareTo(sent.get("bidAmount").decimalValue()));
        assertEquals(14, sent.get("deliveryDays").asInt());
        assertEquals(1_740_830_400_000L, sent.get("timestamp").asLong());
        assertEquals(bid().hash(), sent.get("hash").asText());
        assertTrue(sent.get("milestonesApproach").isNull());
    }

    @Test
    void fetchBidsKeepsContentHashStable() throws Exception {
        SignedBidProposal original = bid();
        server.reply("POST /v1/bids", 200, "{}");
        backend.submitBid(original);
        String stored = server.lastRequest().body();
        server.reply("GET /v1/bids/CESCROW1", 200, "{\"bids\":[" + stored + ",{\"escrowId\":\"CESCROW1\"}]}");

        List<SignedBidProposal> bids = backend.fetchBids("CESCROW1");

        assertEquals(1, bids.size());
        SignedBidProposal fetched = bids.get(0);
        assertFalse(fetched.verified());
        assertEquals(original.hash(), BidCanonicalizer.hash(fetched.bid()));
        assertEquals(original.signature(), fetched.signature());
        assertEquals("https://example.org/work", fetched.bid().portfolio().orElseThrow());
    }

    @Test
    void fetchBidsWithoutListIsEmpty() {
        server.reply("GET /v1/bids/CESCROW2", 200, "{}");

        assertTrue(backend.fetchBids("CESCROW2").isEmpty());
    }

    @Test
    void acceptBidReturnsEnvelopeToSign() throws Exception {
        server.reply("POST /v1/escrows/CESCROW1/accept-bid", 200, "{\"unsignedTransaction\":\"AAAA-envelope\"}");

        BackendResponse response = backend.acceptBid("CESCROW1", bid(), "GCLIENT");

        assertEquals("AAAA-envelope", response.envelope().orElseThrow());
        assertTrue(response.hash().isEmpty());
        JsonNode sent = mapper.readTree(server.lastRequest().body());
        assertEquals(bid().hash(), sent.get("bidHash").asText());
        assertEquals(FREELANCER, sent.get("freelancerAddress").asText());
        assertEquals("GCLIENT", sent.get("clientAddress").asText());
    }

    @Test
    void acceptingTakenEscrowIsConflict() {
        server.reply("POST /v1/escrows/CESCROW1/accept-bid", 409, "{\"message\":\"Provider already set\"}");

        LedgerException ex = assertThrows(LedgerException.class,
                () -> backend.acceptBid("CESCROW1", bid(), "GCLIENT"));

        assertEquals(ErrorCode.CONFLICT, ex.code());
        assertTrue(ex.getMessage().contains("Provider already set"));
    }

    @Test
    void baseUrlIsRequired() {
        assertThrows(NullPointerException.class, () -> HttpEscrowBackend.builder().build());
    }
}
