package io.ledgerflow.spi;

import io.ledgerflow.model.RawLedgerEvent;

/**
 * Receives events and failures from an {@link EventStream}. After {@link #onError}
 * the stream is considered dead.
 */
public interface LedgerEventCallback {

    void onEvent(RawLedgerEvent event);

    void onError(Throwable error);
}
