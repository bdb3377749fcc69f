/**
 * Off-chain bid proposals: deterministic hashing, Ed25519 signatures, submission and
 * first-writer-wins acceptance.
 */
package io.ledgerflow.bid;
