/**
 * Service provider interfaces for the ledger client, the wallet, remote services,
 * storage and metrics.
 *
 * @see io.ledgerflow.spi.LedgerClient
 * @see io.ledgerflow.spi.WalletSigner
 * @see io.ledgerflow.spi.EscrowBackend
 * @see io.ledgerflow.spi.AnchorTransport
 * @see io.ledgerflow.spi.KeyValueStore
 * @see io.ledgerflow.spi.MetricsExporter
 */
package io.ledgerflow.spi;
