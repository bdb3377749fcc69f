package io.ledgerflow.history;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One fiat or ledger transaction as shown in a user's history.
 *
 * @param id          anchor transaction id or ledger hash; unique per user
 * @param type        what kind of transaction this is
 * @param status      last known status (anchor wire value or {@code completed}/{@code failed})
 * @param amount      amount as entered, decimal text
 * @param currency    fiat currency or asset code
 * @param reference   optional counterpart reference (ledger hash, interactive URL)
 * @param createdAt   when the record was first saved
 * @param updatedAt   when the status last changed
 */
public record TransactionRecord(String id, RecordType type, String status, String amount, String currency,
                                String reference, Instant createdAt, Instant updatedAt) {
  private static final Set<String> FINAL_STATUSES = Set.of("completed", "error", "expired", "refunded", "failed");

  public TransactionRecord {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
    if (updatedAt == null) {
      updatedAt = createdAt;
    }
  }

  /** Whether the transaction can no longer change status. */
  public boolean isFinal() {
    return FINAL_STATUSES.contains(status);
  }

  public TransactionRecord withStatus(String newStatus, Instant at) {
    return new TransactionRecord(id, type, newStatus, amount, currency, reference, createdAt, at);
  }

  Map<String, String> toMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("id", id);
    map.put("type", type.name().toLowerCase(Locale.ROOT));
    map.put("status", status);
    map.put("amount", amount);
    map.put("currency", currency);
    map.put("reference", reference);
    map.put("created_at", Long.toString(createdAt.toEpochMilli()));
    map.put("updated_at", Long.toString(updatedAt.toEpochMilli()));
    return map;
  }

  static TransactionRecord fromMap(Map<String, String> map) {
    Instant created = Instant.ofEpochMilli(Long.parseLong(require(map, "created_at")));
    String updated = map.get("updated_at");
    return new TransactionRecord(
        require(map, "id"),
        RecordType.valueOf(require(map, "type").toUpperCase(Locale.ROOT)),
        require(map, "status"),
        map.get("amount"),
        map.get("currency"),
        map.get("reference"),
        created,
        updated == null ? created : Instant.ofEpochMilli(Long.parseLong(updated)));
  }

  private static String require(Map<String, String> map, String key) {
    String value = map.get(key);
    if (value == null) {
      throw new IllegalArgumentException("missing " + key);
    }
    return value;
  }
}
