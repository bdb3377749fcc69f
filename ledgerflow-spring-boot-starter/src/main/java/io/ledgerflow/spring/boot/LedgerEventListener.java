package io.ledgerflow.spring.boot;

import io.ledgerflow.event.EventKind;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a contract event listener.
 *
 * <p>The annotated bean must implement {@link io.ledgerflow.event.ContractEventListener}.
 *
 * <h2>Ledger subscription</h2>
 * <pre>{@code
 * @Component
 * @LedgerEventListener(contracts = "${app.escrow-id}", kinds = EventKind.FUNDS_RELEASED)
 * public class PayoutListener implements ContractEventListener {
 *   public void onEvent(ContractEvent event) { ... }
 * }
 * }</pre>
 *
 * <h2>Local events</h2>
 * <pre>{@code
 * @Component
 * @LedgerEventListener(local = true)
 * public class AuditListener implements ContractEventListener { ... }
 * }</pre>
 *
 * <p>Resolution rules:
 * <ul>
 *   <li>{@code local = true} receives events published by this process after its own
 *       writes; {@code contracts} is ignored</li>
 *   <li>Otherwise one stream subscription is opened per contract; no contracts means one
 *       subscription covering every contract</li>
 *   <li>Contract ids may use {@code ${...}} placeholders</li>
 *   <li>Empty {@code kinds} accepts every kind</li>
 * </ul>
 *
 * @see LedgerEventListenerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface LedgerEventListener {

    /**
     * Contract ids to subscribe to.
     */
    String[] contracts() default {};

    /**
     * Event kinds to deliver. Empty means all.
     */
    EventKind[] kinds() default {};

    /**
     * Listen to locally published events instead of the ledger stream.
     */
    boolean local() default false;
}
