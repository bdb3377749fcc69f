/**
 * Immutable values exchanged with the ledger client and the remote services.
 */
package io.ledgerflow.model;
