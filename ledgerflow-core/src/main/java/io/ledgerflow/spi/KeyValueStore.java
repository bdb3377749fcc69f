package io.ledgerflow.spi;

import java.util.Optional;

/**
 * Opaque string storage for preferences and transaction history.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void set(String key, String value);

    void remove(String key);
}
