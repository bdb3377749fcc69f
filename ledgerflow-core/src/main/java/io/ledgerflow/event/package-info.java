/**
 * Ledger event subscriptions with cursor tracking and bounded reconnection, and the typed
 * event model they deliver.
 *
 * @see io.ledgerflow.event.EventMonitor
 * @see io.ledgerflow.event.ContractEvent
 */
package io.ledgerflow.event;
