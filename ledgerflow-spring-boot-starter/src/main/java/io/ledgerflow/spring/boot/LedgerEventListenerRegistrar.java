package io.ledgerflow.spring.boot;

import io.ledgerflow.LedgerFlow;
import io.ledgerflow.event.ContractEventListener;
import io.ledgerflow.event.EventKind;
import io.ledgerflow.event.EventSubscription;
import io.ledgerflow.event.SubscriptionConfig;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Scans for beans annotated with {@link LedgerEventListener} and subscribes them through
 * the {@link LedgerFlow} event monitor, or registers them for local events.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 * Subscriptions end when the {@link LedgerFlow} bean is closed.
 *
 * @see LedgerEventListener
 */
public class LedgerEventListenerRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(LedgerEventListenerRegistrar.class.getName());

    private final ConfigurableListableBeanFactory beanFactory;
    private final LedgerFlow ledgerFlow;
    private final SubscriptionConfig base;
    private final List<EventSubscription> subscriptions = new ArrayList<>();
    private int localListeners;

    public LedgerEventListenerRegistrar(ConfigurableListableBeanFactory beanFactory, LedgerFlow ledgerFlow,
                                        SubscriptionConfig base) {
        this.beanFactory = beanFactory;
        this.ledgerFlow = ledgerFlow;
        this.base = base;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(LedgerEventListener.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof ContractEventListener listener)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @LedgerEventListener must implement ContractEventListener, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            LedgerEventListener annotation = AnnotationUtils.findAnnotation(bean.getClass(), LedgerEventListener.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @LedgerEventListener annotation on " + bean.getClass().getName());
            }

            Set<EventKind> kinds = annotation.kinds().length == 0
                    ? Collections.emptySet() : EnumSet.copyOf(Arrays.asList(annotation.kinds()));
            if (annotation.local()) {
                ledgerFlow.addLocalEventListener(event -> {
                    if (kinds.isEmpty() || kinds.contains(event.kind())) {
                        listener.onEvent(event);
                    }
                });
                localListeners++;
                logger.fine(() -> "Registered local event listener " + beanName);
                continue;
            }

            SubscriptionConfig config = base.toBuilder().kinds(kinds).build();
            List<String> contracts = resolveContracts(beanName, annotation.contracts());
            if (contracts.isEmpty()) {
                subscriptions.add(ledgerFlow.events().subscribe(config, listener));
            } else {
                subscriptions.addAll(ledgerFlow.events().subscribeToContracts(contracts, config, listener));
            }
            logger.fine(() -> "Subscribed " + beanName + " to " + (contracts.isEmpty() ? "all contracts" : contracts));
        }
    }

    private List<String> resolveContracts(String beanName, String[] raw) {
        List<String> contracts = new ArrayList<>();
        for (String value : raw) {
            String resolved = beanFactory.resolveEmbeddedValue(value);
            if (resolved == null || resolved.isBlank()) {
                throw new BeanCreationException(beanName,
                        "@LedgerEventListener contract id resolved to an empty value: " + value);
            }
            contracts.add(resolved.trim());
        }
        return contracts;
    }

    /** Subscriptions opened for annotated beans. */
    public List<EventSubscription> subscriptions() {
        return List.copyOf(subscriptions);
    }

    public int localListenerCount() {
        return localListeners;
    }
}
