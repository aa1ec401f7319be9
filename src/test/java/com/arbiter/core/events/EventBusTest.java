package com.arbiter.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static DecisionEvent event(String type, String claimId) {
        return new DecisionEvent(type, claimId, 1, Map.of(), Instant.now());
    }

    @Nested
    @DisplayName("Per-claim subscriptions")
    class ClaimSubscriptions {

        @Test
        @DisplayName("receives only events for its claim")
        void filtersByClaim() {
            List<DecisionEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe("CLM-1", received::add);

            eventBus.publish(event("claim.received", "CLM-1"));
            eventBus.publish(event("claim.received", "CLM-2"));

            assertEquals(1, received.size());
            assertEquals("CLM-1", received.get(0).claimId());
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            List<DecisionEvent> received = new CopyOnWriteArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("CLM-1", received::add);

            subscription.unsubscribe();
            eventBus.publish(event("claim.received", "CLM-1"));

            assertTrue(received.isEmpty());
        }
    }

    @Nested
    @DisplayName("Global subscriptions")
    class GlobalSubscriptions {

        @Test
        @DisplayName("receive every claim's events")
        void receivesAll() {
            List<String> types = new CopyOnWriteArrayList<>();
            eventBus.subscribeAll(e -> types.add(e.eventType()));

            eventBus.publish(event("claim.received", "CLM-1"));
            eventBus.publish(event("claim.finalized", "CLM-2"));

            assertEquals(List.of("claim.received", "claim.finalized"), types);
        }

        @Test
        @DisplayName("failing subscriber does not block the others")
        void failingSubscriber() {
            List<DecisionEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribeAll(e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribeAll(received::add);

            assertDoesNotThrow(() -> eventBus.publish(event("claim.received", "CLM-1")));
            assertEquals(1, received.size());
        }
    }
}
