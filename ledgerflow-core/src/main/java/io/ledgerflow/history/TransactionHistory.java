package io.ledgerflow.history;

import io.ledgerflow.spi.KeyValueStore;
import io.ledgerflow.util.FlatJson;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-user transaction history kept in a {@link KeyValueStore}, newest first.
 *
 * <p>Each user's records live under one key as a JSON array. Saving a record with a known
 * id replaces it in place. The list is capped; the oldest records fall off.
 *
 * <p>A stored value that cannot be read is logged and treated as empty, so one corrupt
 * entry never blocks new records.
 */
public final class TransactionHistory {
  private static final Logger logger = Logger.getLogger(TransactionHistory.class.getName());
  private static final String KEY_PREFIX = "ledgerflow.history.";

  public static final int DEFAULT_CAPACITY = 100;
  public static final Duration DEFAULT_RETENTION = Duration.ofDays(30);

  private final KeyValueStore store;
  private final Clock clock;
  private final int capacity;
  private final Duration retention;

  public TransactionHistory(KeyValueStore store) {
    this(store, Clock.systemUTC(), DEFAULT_CAPACITY, DEFAULT_RETENTION);
  }

  public TransactionHistory(KeyValueStore store, Clock clock, int capacity, Duration retention) {
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
    }
    this.capacity = capacity;
    this.retention = Objects.requireNonNull(retention, "retention");
  }

  /**
   * Inserts or replaces a record by id and rewrites the user's history.
   */
  public synchronized void save(String userId, TransactionRecord record) {
    Objects.requireNonNull(record, "record");
    List<TransactionRecord> records = load(userId);
    records.removeIf(r -> r.id().equals(record.id()));
    records.add(record);
    records.sort(Comparator.comparing(TransactionRecord::createdAt).reversed());
    while (records.size() > capacity) {
      records.remove(records.size() - 1);
    }
    write(userId, records);
  }

  /**
   * Updates the status of a known record.
   *
   * @return the updated record, or empty if the id is unknown
   */
  public synchronized Optional<TransactionRecord> updateStatus(String userId, String id, String status) {
    Optional<TransactionRecord> existing = findById(userId, id);
    existing.ifPresent(r -> save(userId, r.withStatus(status, clock.instant())));
    return findById(userId, id);
  }

  /** Newest first. */
  public synchronized List<TransactionRecord> list(String userId) {
    return List.copyOf(load(userId));
  }

  public synchronized List<TransactionRecord> list(String userId, RecordType type) {
    Objects.requireNonNull(type, "type");
    return load(userId).stream().filter(r -> r.type() == type).toList();
  }

  public synchronized Optional<TransactionRecord> findById(String userId, String id) {
    return load(userId).stream().filter(r -> r.id().equals(id)).findFirst();
  }

  /**
   * Removes final records older than the retention period. Records still in progress are
   * kept regardless of age.
   *
   * @return number of records removed
   */
  public synchronized int cleanup(String userId) {
    List<TransactionRecord> records = load(userId);
    Instant cutoff = clock.instant().minus(retention);
    int before = records.size();
    records.removeIf(r -> r.isFinal() && r.createdAt().isBefore(cutoff));
    int removed = before - records.size();
    if (removed > 0) {
      write(userId, records);
      logger.log(Level.FINE, "Cleaned up {0} old records for {1}", new Object[]{removed, userId});
    }
    return removed;
  }

  public synchronized void clear(String userId) {
    store.remove(key(userId));
  }

  private List<TransactionRecord> load(String userId) {
    Optional<String> raw = store.get(key(userId));
    List<TransactionRecord> records = new ArrayList<>();
    if (raw.isEmpty()) {
      return records;
    }
    try {
      for (Map<String, String> map : FlatJson.readList(raw.get())) {
        records.add(TransactionRecord.fromMap(map));
      }
    } catch (IllegalArgumentException e) {
      logger.log(Level.WARNING, "Discarding unreadable history for " + userId, e);
      records.clear();
    }
    return records;
  }

  private void write(String userId, List<TransactionRecord> records) {
    List<Map<String, String>> maps = new ArrayList<>(records.size());
    for (TransactionRecord record : records) {
      maps.add(record.toMap());
    }
    store.set(key(userId), FlatJson.writeList(maps));
  }

  private static String key(String userId) {
    Objects.requireNonNull(userId, "userId");
    return KEY_PREFIX + userId;
  }
}
