/**
 * Spring Boot auto-configuration for ledgerflow.
 *
 * <p>Requires a {@link io.ledgerflow.spi.LedgerClient} bean. Beans annotated with
 * {@link io.ledgerflow.spring.boot.LedgerEventListener} are subscribed to contract events
 * once the context has started.
 */
package io.ledgerflow.spring.boot;
