/**
 * Sequential per-account operation queues.
 *
 * @see io.ledgerflow.queue.TransactionQueue
 * @see io.ledgerflow.queue.AccountQueues
 */
package io.ledgerflow.queue;
