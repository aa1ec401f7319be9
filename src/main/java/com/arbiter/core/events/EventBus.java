package com.arbiter.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for claim lifecycle events.
 * <p>
 * Observers only: subscribers are notified after the ledger has the record and
 * cannot influence the pipeline. A failing subscriber is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<DecisionEvent>>> claimSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<DecisionEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(DecisionEvent event) {
        log.debug("Publishing event: {} for claim {}", event.eventType(), event.claimId());

        List<Consumer<DecisionEvent>> claimSubs = claimSubscribers.get(event.claimId());
        if (claimSubs != null) {
            for (Consumer<DecisionEvent> subscriber : claimSubs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<DecisionEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for one claim.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String claimId, Consumer<DecisionEvent> consumer) {
        claimSubscribers.computeIfAbsent(claimId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<DecisionEvent>> subs = claimSubscribers.get(claimId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    claimSubscribers.remove(claimId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<DecisionEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<DecisionEvent> subscriber, DecisionEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
