/**
 * {@code java.net.http} implementations of the anchor transport and the escrow/bid backend.
 * Non-2xx replies are thrown as {@link io.ledgerflow.LedgerException}s classified by status.
 */
package io.ledgerflow.http;
