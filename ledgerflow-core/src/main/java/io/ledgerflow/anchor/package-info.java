/**
 * Fiat on/off-ramp through an anchor: challenge-response authentication, interactive
 * deposit and withdrawal sessions, status polling and exchange-rate quotes.
 */
package io.ledgerflow.anchor;
