package com.arbiter.dispatch.api;

import com.arbiter.core.events.DecisionEvent;
import com.arbiter.core.events.EventBus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Streams a claim's lifecycle events to SSE clients.
 * <p>
 * Each emitter subscribes to the {@link EventBus} for one claim and is
 * completed once the claim reaches a terminal event. Heartbeat comments keep
 * idle connections open through proxies.
 */
@Service
public class ClaimEventStream {

    private static final Logger log = LoggerFactory.getLogger(ClaimEventStream.class);

    /** Default emitter timeout: 30 minutes, the usual length of a review session. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    static final Set<String> TERMINAL_EVENTS = Set.of("claim.finalized", "claim.rejected", "claim.abandoned");

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public ClaimEventStream(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    ClaimEventStream(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdownNow();
    }

    /**
     * Creates an SSE emitter that streams events for the given claim.
     */
    public SseEmitter createEmitter(String claimId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        AtomicReference<EmitterRegistration> registered = new AtomicReference<>();

        EventBus.Subscription subscription = eventBus.subscribe(claimId,
                event -> sendEvent(emitter, registered.get(), event));
        EmitterRegistration registration = new EmitterRegistration(claimId, emitter, subscription);
        registered.set(registration);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> cleanup(registration));
        emitter.onError(ex -> {
            log.debug("SSE emitter error for claim {}: {}", claimId, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for claim {}: {}", claimId, e.getMessage());
        }

        log.info("SSE emitter created for claim {} (timeout={}ms)", claimId, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                log.debug("Heartbeat skipped for claim {}: {}", registration.claimId(), e.getMessage());
            }
        }
    }

    private void sendEvent(SseEmitter emitter, EmitterRegistration registration, DecisionEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("claim_id", event.claimId());
        if (event.sequence() >= 0) {
            data.put("sequence_number", event.sequence());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        try {
            emitter.send(SseEmitter.event().name(event.eventType()).data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for claim {}: {}",
                    event.eventType(), event.claimId(), e.getMessage());
        }
        if (TERMINAL_EVENTS.contains(event.eventType())) {
            // registration is null only for an event racing createEmitter; the timeout cleans that up
            if (registration != null) {
                cleanup(registration);
            }
            emitter.complete();
        }
    }

    private void cleanup(EmitterRegistration registration) {
        if (activeRegistrations.remove(registration)) {
            registration.subscription().unsubscribe();
            log.debug("Cleaned up SSE registration for claim {}", registration.claimId());
        }
    }

    private record EmitterRegistration(
            String claimId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
