/**
 * Client-side coordination for escrow, crowdfunding and bidding contracts on a public
 * ledger. {@link io.ledgerflow.LedgerFlow} is the entry point; failures are reported as
 * {@link io.ledgerflow.LedgerException}.
 */
package io.ledgerflow;
