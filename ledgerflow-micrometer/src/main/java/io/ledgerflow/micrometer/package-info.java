/**
 * Micrometer bridge for exporting queue, retry, stream and notification metrics.
 *
 * <p>{@link io.ledgerflow.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.ledgerflow.spi.MetricsExporter} SPI using Micrometer counters and a gauge.
 */
package io.ledgerflow.micrometer;
