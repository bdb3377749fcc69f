package io.ledgerflow.queue;

import io.ledgerflow.LedgerException;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only snapshot of an operation in a {@link TransactionQueue}.
 *
 * @param id            caller-chosen identifier, unique within the queue
 * @param status        current status
 * @param attempts      number of times the operation has been invoked
 * @param createdAt     when it was enqueued
 * @param lastAttemptAt when it was last invoked, or {@code null}
 * @param error         the failure, for {@link OperationStatus#FAILED}
 * @param result        the result, for {@link OperationStatus#COMPLETED}
 */
public record QueuedOperation(String id, OperationStatus status, int attempts, Instant createdAt,
                              Instant lastAttemptAt, LedgerException error, Object result) {
  public QueuedOperation {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  public Optional<LedgerException> failure() {
    return Optional.ofNullable(error);
  }
}
