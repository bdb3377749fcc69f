/**
 * Client-side balance checks before funds-moving operations.
 */
package io.ledgerflow.balance;
