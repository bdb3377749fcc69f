/**
 * Per-user transaction history over a key-value store.
 */
package io.ledgerflow.history;
