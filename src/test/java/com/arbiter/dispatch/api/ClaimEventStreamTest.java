package com.arbiter.dispatch.api;

import com.arbiter.core.events.DecisionEvent;
import com.arbiter.core.events.EventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClaimEventStreamTest {

    private EventBus eventBus;
    private ClaimEventStream stream;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        stream = new ClaimEventStream(eventBus, 5_000L);
    }

    private void publish(String type, String claimId) {
        eventBus.publish(new DecisionEvent(type, claimId, 4, Map.of("stage", "ADVISED"), Instant.now()));
    }

    @Nested
    @DisplayName("createEmitter")
    class CreateEmitter {

        @Test
        @DisplayName("each call registers its own emitter")
        void separateEmitters() {
            SseEmitter first = stream.createEmitter("CLM-S-1");
            SseEmitter second = stream.createEmitter("CLM-S-1");

            assertNotSame(first, second);
            assertEquals(2, stream.activeEmitterCount());
        }
    }

    @Nested
    @DisplayName("Event forwarding")
    class Forwarding {

        @Test
        @DisplayName("intermediate events keep the stream open")
        void intermediateEvents() {
            stream.createEmitter("CLM-S-2");

            publish("claim.advised", "CLM-S-2");
            publish("claim.pending", "CLM-S-2");

            assertEquals(1, stream.activeEmitterCount());
        }

        @Test
        @DisplayName("a terminal event closes only that claim's streams")
        void terminalEventCloses() {
            stream.createEmitter("CLM-S-3");
            stream.createEmitter("CLM-S-3");
            stream.createEmitter("CLM-S-4");

            publish("claim.finalized", "CLM-S-3");

            assertEquals(1, stream.activeEmitterCount());
        }

        @Test
        @DisplayName("rejection and abandonment are terminal too")
        void rejectionIsTerminal() {
            stream.createEmitter("CLM-S-5");
            stream.createEmitter("CLM-S-6");

            publish("claim.rejected", "CLM-S-5");
            publish("claim.abandoned", "CLM-S-6");

            assertEquals(0, stream.activeEmitterCount());
        }

        @Test
        @DisplayName("events published after the stream closed are not delivered to it")
        void closedStreamUnsubscribed() {
            stream.createEmitter("CLM-S-7");
            publish("claim.finalized", "CLM-S-7");

            assertDoesNotThrow(() -> publish("claim.finalized", "CLM-S-7"));
            assertEquals(0, stream.activeEmitterCount());
        }
    }
}
