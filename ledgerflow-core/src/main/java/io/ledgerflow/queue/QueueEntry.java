package io.ledgerflow.queue;

import io.ledgerflow.LedgerException;
import io.ledgerflow.retry.RetryOptions;
import io.ledgerflow.retry.RetryableOperation;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Mutable queue bookkeeping. Only touched by {@link TransactionQueue} while holding its lock.
 */
final class QueueEntry {
  final String id;
  final RetryableOperation<?> operation;
  final RetryOptions options;
  final Instant createdAt;
  OperationStatus status = OperationStatus.PENDING;
  int attempts;
  Instant lastAttemptAt;
  LedgerException error;
  Object result;
  CompletableFuture<Object> future = new CompletableFuture<>();

  QueueEntry(String id, RetryableOperation<?> operation, RetryOptions options, Instant createdAt) {
    this.id = id;
    this.operation = operation;
    this.options = options;
    this.createdAt = createdAt;
  }

  QueuedOperation snapshot() {
    return new QueuedOperation(id, status, attempts, createdAt, lastAttemptAt, error, result);
  }
}
