package io.ledgerflow.history;

import io.ledgerflow.spi.KeyValueStore;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link KeyValueStore}. Contents are lost on exit.
 */
public final class InMemoryKeyValueStore implements KeyValueStore {
  private final Map<String, String> values = new ConcurrentHashMap<>();

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(values.get(key));
  }

  @Override
  public void set(String key, String value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    values.put(key, value);
  }

  @Override
  public void remove(String key) {
    values.remove(key);
  }

  public int size() {
    return values.size();
  }
}
