package io.ledgerflow.anchor;

import io.ledgerflow.ErrorCode;
import io.ledgerflow.InvalidParamsException;
import io.ledgerflow.LedgerException;
import io.ledgerflow.spi.AnchorTransport;
import io.ledgerflow.testing.MutableClock;
import io.ledgerflow.testing.RecordingSigner;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnchorServiceTest {

    private static final String AUTH = "https://anchor.example/auth";
    private static final String SEP24 = "https://anchor.example/sep24";

    private final MutableClock clock = MutableClock.at("2025-03-01T12:00:00Z");
    private final FakeTransport transport = new FakeTransport();
    private final List<Duration> sleeps = new ArrayList<>();
    private final RecordingSigner signer = new RecordingSigner();
    private final AnchorService anchor = new AnchorService(transport,
            AnchorConfig.forDomain("anchor.example").pollMaxAttempts(5).build(), clock, sleeps::add);

    private void scriptAuth(String token) {
        transport.respond("GET " + AUTH, Map.of("transaction", "challenge-1"));
        transport.respond("POST " + AUTH, Map.of("token", token));
    }

    // ── Authentication ─────────────────────────────────────────────

    @Test
    void exchangesSignedChallengeForToken() {
        scriptAuth("jwt-1");

        assertEquals("jwt-1", anchor.authenticate(signer));

        assertEquals(List.of("challenge-1"), signer.signedEnvelopes());
        Call challenge = transport.calls.get(0);
        assertEquals(Map.of("account", signer.getPublicKey()), challenge.params());
        assertNull(challenge.token());
        assertEquals(Map.of("transaction", "challenge-1|" + signer.getPublicKey()), transport.calls.get(1).params());
    }

    @Test
    void tokenIsCachedUntilItExpires() {
        scriptAuth("jwt-1");
        anchor.authenticate(signer);
        clock.advance(Duration.ofHours(22));
        assertEquals("jwt-1", anchor.authenticate(signer));
        assertEquals(2, transport.calls.size());

        clock.advance(Duration.ofHours(2));
        scriptAuth("jwt-2");
        assertEquals("jwt-2", anchor.authenticate(signer));

        anchor.invalidateToken(signer.getPublicKey());
        scriptAuth("jwt-3");
        assertEquals("jwt-3", anchor.authenticate(signer));
    }

    @Test
    void missingTokenIsAnchorError() {
        transport.respond("GET " + AUTH, Map.of("transaction", "challenge-1"));
        transport.respond("POST " + AUTH, Map.of());

        LedgerException e = assertThrows(LedgerException.class, () -> anchor.authenticate(signer));

        assertEquals(ErrorCode.ANCHOR_ERROR, e.code());
        assertEquals("No token received from anchor", e.getMessage());
    }

    @Test
    void walletRefusalKeepsItsCode() {
        transport.respond("GET " + AUTH, Map.of("transaction", "challenge-1"));
        signer.rejectNext(1);

        LedgerException e = assertThrows(LedgerException.class, () -> anchor.authenticate(signer));

        assertEquals(ErrorCode.USER_REJECTED, e.code());
    }

    @Test
    void transportFailureBecomesAnchorError() {
        transport.fail("GET " + AUTH, new UncheckedIOException(new IOException("connection refused")));

        LedgerException e = assertThrows(LedgerException.class, () -> anchor.authenticate(signer));

        assertEquals(ErrorCode.ANCHOR_ERROR, e.code());
        assertTrue(e.getMessage().startsWith("Failed to get authentication token"));
    }

    // ── Interactive flows ──────────────────────────────────────────

    @Test
    void startsInteractiveDeposit() {
        scriptAuth("jwt-1");
        transport.respond("POST " + SEP24 + "/transactions/deposit/interactive",
                Map.of("id", "tx-9", "url", "https://anchor.example/flow/9"));

        InteractiveSession session = anchor.startInteractiveDeposit("USDC", "250", signer);

        assertEquals("tx-9", session.id());
        assertEquals(InteractiveSession.Type.DEPOSIT, session.type());
        assertEquals("jwt-1", session.authToken());
        assertFalse(session.toString().contains("jwt-1"));
        Call call = transport.last();
        assertEquals("jwt-1", call.token());
        assertEquals("USDC", call.params().get("asset_code"));
        assertEquals("250", call.params().get("amount"));
        assertEquals(signer.getPublicKey(), call.params().get("account"));
        assertEquals("en", call.params().get("lang"));
    }

    @Test
    void withdrawToBankSendsDestination() {
        scriptAuth("jwt-1");
        transport.respond("POST " + SEP24 + "/transactions/withdraw/interactive",
                Map.of("id", "tx-10", "url", "https://anchor.example/flow/10"));

        anchor.startWithdrawToBank("100",
                new BankAccount("000123456789", "110000000", BankAccount.AccountType.CHECKING, "First Bank"), signer);

        Map<String, String> body = transport.last().params();
        assertEquals("000123456789", body.get("dest"));
        assertEquals("{\"routing_number\":\"110000000\",\"account_type\":\"checking\"}", body.get("dest_extra"));
        assertEquals("100", body.get("amount"));
    }

    @Test
    void rejectsBadAmountsBeforeCallingAnchor() {
        assertThrows(InvalidParamsException.class, () -> anchor.startInteractiveDeposit("USDC", "0", signer));
        assertThrows(InvalidParamsException.class, () -> anchor.startInteractiveWithdraw("USDC", "ten", signer));
        assertThrows(InvalidParamsException.class, () -> anchor.startInteractiveDeposit(" ", null, signer));
        assertThrows(InvalidParamsException.class, () -> new BankAccount(" ", "1", BankAccount.AccountType.SAVINGS, null));
        assertTrue(transport.calls.isEmpty());
    }

    @Test
    void missingSessionFieldsIsAnchorError() {
        scriptAuth("jwt-1");
        transport.respond("POST " + SEP24 + "/transactions/withdraw/interactive", Map.of("id", "tx-11"));

        LedgerException e = assertThrows(LedgerException.class, () -> anchor.startInteractiveWithdraw(signer));

        assertEquals(ErrorCode.ANCHOR_ERROR, e.code());
    }

    // ── Polling ────────────────────────────────────────────────────

    @Test
    void pollsUntilTerminalReportingChanges() {
        String url = "GET " + SEP24 + "/transaction";
        transport.respond(url, Map.of("transaction.status", "pending_user_transfer_start"));
        transport.respond(url, Map.of("transaction.status", "pending_user_transfer_start"));
        transport.respond(url, Map.of("transaction.status", "pending_anchor"));
        transport.respond(url, Map.of("transaction.status", "completed"));
        List<AnchorTransactionStatus> seen = new ArrayList<>();

        AnchorTransactionStatus result = anchor.pollTransactionStatus(
                new InteractiveSession("tx-9", "https://x", InteractiveSession.Type.DEPOSIT, "jwt-1"), seen::add);

        assertEquals(AnchorTransactionStatus.COMPLETED, result);
        assertEquals(List.of(AnchorTransactionStatus.PENDING_USER_TRANSFER_START,
                AnchorTransactionStatus.PENDING_ANCHOR, AnchorTransactionStatus.COMPLETED), seen);
        assertEquals(List.of(Duration.ofMillis(5000), Duration.ofMillis(7500), Duration.ofMillis(11250)), sleeps);
        assertEquals(Map.of("id", "tx-9"), transport.last().params());
        assertEquals("jwt-1", transport.last().token());
    }

    @Test
    void failedPollCountsAsAttemptAndTimesOut() {
        String url = "GET " + SEP24 + "/transaction";
        transport.fail(url, new IllegalStateException("503"));
        for (int i = 0; i < 4; i++) {
            transport.respond(url, Map.of("transaction.status", "pending_external"));
        }

        LedgerException e = assertThrows(LedgerException.class,
                () -> anchor.pollTransactionStatus("tx-9", null, status -> {
                    throw new IllegalStateException("observer bug");
                }));

        assertEquals(ErrorCode.ANCHOR_ERROR, e.code());
        assertEquals("Transaction polling timeout", e.getMessage());
        assertEquals(4, sleeps.size());
        assertEquals(Duration.ofMillis(15000), sleeps.get(3));
    }

    @Test
    void unknownStatusIsAnchorError() {
        transport.respond("GET " + SEP24 + "/transaction", Map.of("transaction.status", "teleported"));

        LedgerException e = assertThrows(LedgerException.class, () -> anchor.getTransactionStatus("tx-1", "jwt"));

        assertEquals(ErrorCode.ANCHOR_ERROR, e.code());
    }

    // ── Rates ──────────────────────────────────────────────────────

    @Test
    void exchangeRateIsCachedPerPair() {
        transport.respond("GET " + SEP24 + "/price", Map.of("buy_price", "0.92", "fee", "1.5"));

        ExchangeRate rate = anchor.getExchangeRate("USDC", "EUR");
        ExchangeRate again = anchor.getExchangeRate("USDC", "EUR");

        assertSame(rate, again);
        assertEquals(1, transport.calls.size());
        assertEquals(Map.of("sell_asset", "USDC", "buy_asset", "EUR"), transport.last().params());
        assertEquals(0, rate.convert(new BigDecimal("100")).compareTo(new BigDecimal("90.5")));

        clock.advance(Duration.ofSeconds(31));
        transport.respond("GET " + SEP24 + "/price", Map.of());
        ExchangeRate fresh = anchor.getExchangeRate("USDC", "EUR");
        assertEquals(0, fresh.rate().compareTo(BigDecimal.ONE));
        assertEquals(0, fresh.fee().signum());
    }

    record Call(String key, Map<String, String> params, String token) {
    }

    /** Replays scripted responses per "METHOD url" and records every request. */
    private static final class FakeTransport implements AnchorTransport {
        final List<Call> calls = new ArrayList<>();
        private final Map<String, Deque<Object>> script = new HashMap<>();

        void respond(String key, Map<String, String> response) {
            script.computeIfAbsent(key, k -> new ArrayDeque<>()).add(response);
        }

        void fail(String key, RuntimeException failure) {
            script.computeIfAbsent(key, k -> new ArrayDeque<>()).add(failure);
        }

        Call last() {
            return calls.get(calls.size() - 1);
        }

        @Override
        public Map<String, String> get(String url, Map<String, String> query, String bearerToken) {
            return reply("GET " + url, query, bearerToken);
        }

        @Override
        public Map<String, String> post(String url, Map<String, String> body, String bearerToken) {
            return reply("POST " + url, body, bearerToken);
        }

        @SuppressWarnings("unchecked")
        private Map<String, String> reply(String key, Map<String, String> params, String token) {
            calls.add(new Call(key, Map.copyOf(params), token));
            Deque<Object> queue = script.get(key);
            if (queue == null || queue.isEmpty()) {
                throw new IllegalStateException("no scripted response for " + key);
            }
            Object next = queue.poll();
            if (next instanceof RuntimeException failure) {
                throw failure;
            }
            return (Map<String, String>) next;
        }
    }
}
