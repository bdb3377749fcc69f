/**
 * User-facing notification log fed by contract events.
 */
package io.ledgerflow.notify;
