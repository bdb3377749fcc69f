/**
 * Escrow contracts: creation with budget checks, milestone completion, withdrawals,
 * disputes and ledger-backed status reads.
 */
package io.ledgerflow.escrow;
