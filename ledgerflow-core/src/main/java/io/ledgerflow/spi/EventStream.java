package io.ledgerflow.spi;

/**
 * An open event feed. Closing it stops delivery; closing twice is a no-op.
 */
public interface EventStream extends AutoCloseable {

    @Override
    void close();
}
