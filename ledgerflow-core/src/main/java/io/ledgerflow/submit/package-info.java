/**
 * Serialized ledger writes through per-account queues.
 */
package io.ledgerflow.submit;
