package io.ledgerflow.queue;

import io.ledgerflow.ErrorCode;
import io.ledgerflow.LedgerException;
import io.ledgerflow.retry.RetryEngine;
import io.ledgerflow.retry.RetryExhaustedException;
import io.ledgerflow.retry.RetryOptions;
import io.ledgerflow.spi.MetricsExporter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TransactionQueueTest {

    private final TransactionQueue queue = TransactionQueue.builder()
            .name("test")
            .retryEngine(new RetryEngine(d -> { }, MetricsExporter.NOOP))
            .drainTimeout(Duration.ofSeconds(2))
            .build();

    @AfterEach
    void tearDown() {
        queue.close();
    }

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRejectsMissingName() {
        assertThrows(NullPointerException.class, () -> TransactionQueue.builder().build());
    }

    @Test
    void builderRejectsNegativeDrainTimeout() {
        assertThrows(IllegalArgumentException.class, () ->
                TransactionQueue.builder().name("q").drainTimeout(Duration.ofSeconds(-1)).build());
    }

    // ── Ordering and exclusion ─────────────────────────────────────

    @Test
    void processesOperationsInEnqueueOrder() throws Exception {
        List<String> order = new CopyOnWriteArrayList<>();

        CompletableFuture<String> a = queue.enqueue("a", () -> { order.add("a"); return "A"; });
        CompletableFuture<String> b = queue.enqueue("b", () -> { order.add("b"); return "B"; });
        CompletableFuture<String> c = queue.enqueue("c", () -> { order.add("c"); return "C"; });

        assertEquals("C", c.get(5, TimeUnit.SECONDS));
        assertEquals("A", a.get());
        assertEquals("B", b.get());
        assertEquals(List.of("a", "b", "c"), order);
    }

    @Test
    void neverRunsTwoOperationsAtOnce() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        CompletableFuture<?>[] futures = new CompletableFuture<?>[20];
        for (int i = 0; i < futures.length; i++) {
            futures[i] = queue.enqueue("op-" + i, () -> {
                int now = running.incrementAndGet();
                maxRunning.accumulateAndGet(now, Math::max);
                Thread.sleep(2);
                running.decrementAndGet();
                return null;
            });
        }

        CompletableFuture.allOf(futures).get(10, TimeUnit.SECONDS);

        assertEquals(1, maxRunning.get());
    }

    @Test
    void rejectsDuplicateIdWhilePending() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        queue.enqueue("slow", () -> { release.await(); return 1; });

        assertThrows(IllegalArgumentException.class, () -> queue.enqueue("slow", () -> 2));
        release.countDown();
    }

    @Test
    void terminalIdCanBeReused() throws Exception {
        queue.enqueue("x", () -> 1).get(5, TimeUnit.SECONDS);

        assertEquals(2, queue.enqueue("x", () -> 2).get(5, TimeUnit.SECONDS));
    }

    // ── Failures and retry ──────────────────────────────────────────

    @Test
    void failedOperationKeepsErrorAndAttemptCount() {
        CompletableFuture<Object> future = queue.enqueue("fail", () -> {
            throw new LedgerException(ErrorCode.NETWORK_ERROR, "down");
        });

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(RetryExhaustedException.class, e.getCause());

        QueuedOperation op = queue.get("fail").orElseThrow();
        assertEquals(OperationStatus.FAILED, op.status());
        assertEquals(3, op.attempts());
        assertEquals(ErrorCode.NETWORK_ERROR, op.failure().orElseThrow().code());
        assertEquals(1, queue.getFailedTransactions().size());
    }

    @Test
    void errorInOperationFailsItsEntryAndLaterOperationsStillRun() throws Exception {
        queue.setOnline(false);
        CompletableFuture<Object> broken = queue.enqueue("broken", () -> {
            throw new StackOverflowError("deep");
        });
        CompletableFuture<String> next = queue.enqueue("next", () -> "ok");

        queue.setOnline(true);

        ExecutionException e = assertThrows(ExecutionException.class, () -> broken.get(5, TimeUnit.SECONDS));
        LedgerException failure = assertInstanceOf(LedgerException.class, e.getCause());
        assertEquals(ErrorCode.SUBMISSION_UNKNOWN, failure.code());
        assertInstanceOf(StackOverflowError.class, failure.getCause());
        assertEquals(OperationStatus.FAILED, queue.get("broken").orElseThrow().status());
        assertEquals("ok", next.get(5, TimeUnit.SECONDS));
    }

    @Test
    void failureDoesNotBlockLaterOperations() throws Exception {
        queue.enqueue("bad", () -> {
            throw new LedgerException(ErrorCode.CONFLICT, "taken");
        });
        CompletableFuture<String> good = queue.enqueue("good", () -> "ok");

        assertEquals("ok", good.get(5, TimeUnit.SECONDS));
        assertEquals(OperationStatus.FAILED, queue.get("bad").orElseThrow().status());
    }

    @Test
    void retryResetsFailedOperationAndRunsItAgain() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        RetryOptions once = RetryOptions.builder().maxRetries(1).build();
        CompletableFuture<Integer> first = queue.enqueue("flaky", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new LedgerException(ErrorCode.SERVICE_UNAVAILABLE, "busy");
            }
            return calls.get();
        }, once);
        assertThrows(ExecutionException.class, () -> first.get(5, TimeUnit.SECONDS));

        CompletableFuture<Object> second = queue.retry("flaky").orElseThrow();

        assertEquals(2, second.get(5, TimeUnit.SECONDS));
        assertEquals(OperationStatus.COMPLETED, queue.get("flaky").orElseThrow().status());
        assertEquals(2, queue.get("flaky").orElseThrow().attempts());
    }

    @Test
    void retryIgnoresUnknownOrNonFailedIds() throws Exception {
        queue.enqueue("done", () -> 1).get(5, TimeUnit.SECONDS);

        assertTrue(queue.retry("done").isEmpty());
        assertTrue(queue.retry("missing").isEmpty());
    }

    @Test
    void retryAllResetsEveryFailedOperation() throws Exception {
        RetryOptions once = RetryOptions.builder().maxRetries(1).build();
        AtomicInteger calls = new AtomicInteger();
        CompletableFuture<Object> a = queue.enqueue("a", () -> {
            if (calls.incrementAndGet() <= 2) throw new LedgerException(ErrorCode.NETWORK_ERROR, "x");
            return "a";
        }, once);
        CompletableFuture<Object> b = queue.enqueue("b", () -> {
            if (calls.incrementAndGet() <= 2) throw new LedgerException(ErrorCode.NETWORK_ERROR, "x");
            return "b";
        }, once);
        assertThrows(ExecutionException.class, () -> a.get(5, TimeUnit.SECONDS));
        assertThrows(ExecutionException.class, () -> b.get(5, TimeUnit.SECONDS));

        assertEquals(2, queue.retryAll());

        waitUntil(() -> queue.getFailedTransactions().isEmpty() && !queue.isProcessing()
                && queue.pendingCount() == 0);
        assertEquals(OperationStatus.COMPLETED, queue.get("a").orElseThrow().status());
        assertEquals(OperationStatus.COMPLETED, queue.get("b").orElseThrow().status());
    }

    // ── Offline ────────────────────────────────────────────────────

    @Test
    void offlineQueueHoldsOperationsUntilOnline() throws Exception {
        queue.setOnline(false);
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<Integer> future = queue.enqueue("held", calls::incrementAndGet);
        Thread.sleep(50);

        assertEquals(0, calls.get());
        assertEquals(1, queue.pendingCount());
        assertFalse(future.isDone());

        queue.setOnline(true);

        assertEquals(1, future.get(5, TimeUnit.SECONDS));
    }

    // ── Removal ────────────────────────────────────────────────────

    @Test
    void dequeueRemovesPendingAndCancelsFuture() {
        queue.setOnline(false);
        CompletableFuture<Integer> future = queue.enqueue("p", () -> 1);

        assertTrue(queue.dequeue("p"));

        assertTrue(future.isCancelled());
        assertTrue(queue.get("p").isEmpty());
        assertFalse(queue.dequeue("p"));
    }

    @Test
    void dequeueRefusesProcessingEntry() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        queue.enqueue("busy", () -> { started.countDown(); release.await(); return 1; });
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertFalse(queue.dequeue("busy"));
        assertTrue(queue.isProcessing());
        release.countDown();
    }

    @Test
    void cancelPendingWithdrawsOnlyPendingEntries() throws Exception {
        queue.setOnline(false);
        CompletableFuture<Integer> held = queue.enqueue("held", () -> 1);

        assertTrue(queue.cancelPending("held"));
        assertTrue(held.isCancelled());
        assertTrue(queue.get("held").isEmpty());
        assertFalse(queue.cancelPending("held"));

        queue.setOnline(true);
        queue.enqueue("done", () -> 2).get(5, TimeUnit.SECONDS);
        assertFalse(queue.cancelPending("done"));
        assertEquals(OperationStatus.COMPLETED, queue.get("done").orElseThrow().status());
    }

    @Test
    void cancelPendingLeavesProcessingEntryRunning() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<Integer> busy = queue.enqueue("busy", () -> { started.countDown(); release.await(); return 1; });
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertFalse(queue.cancelPending("busy"));

        release.countDown();
        assertEquals(1, busy.get(5, TimeUnit.SECONDS));
    }

    @Test
    void clearCompletedKeepsFailedEntries() throws Exception {
        queue.enqueue("ok", () -> 1).get(5, TimeUnit.SECONDS);
        CompletableFuture<Object> bad = queue.enqueue("bad", () -> {
            throw new LedgerException(ErrorCode.INVALID_PARAMS, "no");
        });
        assertThrows(ExecutionException.class, () -> bad.get(5, TimeUnit.SECONDS));

        assertEquals(1, queue.clearCompleted());
        assertEquals(List.of("bad"), queue.getAll().stream().map(QueuedOperation::id).toList());
    }

    @Test
    void clearAllCancelsPendingFutures() {
        queue.setOnline(false);
        CompletableFuture<Integer> a = queue.enqueue("a", () -> 1);
        CompletableFuture<Integer> b = queue.enqueue("b", () -> 2);

        queue.clearAll();

        assertTrue(a.isCancelled());
        assertTrue(b.isCancelled());
        assertTrue(queue.getAll().isEmpty());
    }

    // ── Close ──────────────────────────────────────────────────────

    @Test
    void closeRejectsNewOperationsAndCancelsUndrained() {
        queue.setOnline(false);
        CompletableFuture<Integer> held = queue.enqueue("held", () -> 1);

        queue.close();

        assertTrue(held.isCancelled());
        assertThrows(IllegalStateException.class, () -> queue.enqueue("late", () -> 2));
    }

    private static void waitUntil(java.util.function.BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(5);
        }
    }
}
