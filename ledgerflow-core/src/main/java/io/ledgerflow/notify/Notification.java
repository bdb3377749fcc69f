package io.ledgerflow.notify;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A user-facing notification. Immutable; marking one read replaces it in the log.
 *
 * @param data extra members, e.g. the source event's contract id and payload
 */
public record Notification(String id, NotificationType type, String title, String message,
                           Map<String, String> data, Instant timestamp, boolean read) {
  public Notification {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(timestamp, "timestamp");
    data = data == null ? Map.of() : Map.copyOf(data);
  }

  Notification markedRead() {
    return read ? this : new Notification(id, type, title, message, data, timestamp, true);
  }
}
