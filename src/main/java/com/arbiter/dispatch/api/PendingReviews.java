package com.arbiter.dispatch.api;

import com.arbiter.core.engine.DecisionEngine;
import com.arbiter.core.engine.DecisionEngineException;
import com.arbiter.core.gate.ClaimNotPendingException;
import com.arbiter.core.gate.DecisionContext;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Claims submitted through the API and waiting for their reviewer.
 * <p>
 * Contexts live only here; the engine holds no per-claim state, so they do
 * not survive a restart. A context left unreviewed past the configured TTL is
 * abandoned through the engine, which records REJECTED with a system rationale.
 */
@Service
public class PendingReviews {

    private static final Logger log = LoggerFactory.getLogger(PendingReviews.class);

    private final DecisionEngine decisionEngine;
    private final ApiProperties properties;
    private final ConcurrentHashMap<String, PendingReview> pending = new ConcurrentHashMap<>();

    private final ScheduledExecutorService expiryScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "pending-review-expiry");
        t.setDaemon(true);
        return t;
    });

    public PendingReviews(DecisionEngine decisionEngine, ApiProperties properties) {
        this.decisionEngine = decisionEngine;
        this.properties = properties;
    }

    @PostConstruct
    void startExpiry() {
        long intervalMs = properties.getExpirySweepInterval().toMillis();
        expiryScheduler.scheduleAtFixedRate(() -> expire(Instant.now()), intervalMs, intervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Pending review expiry started (ttl={}, interval={})",
                properties.getPendingReviewTtl(), properties.getExpirySweepInterval());
    }

    @PreDestroy
    void stopExpiry() {
        expiryScheduler.shutdownNow();
    }

    public void add(DecisionContext context) {
        pending.put(context.claimId(), new PendingReview(context, Instant.now()));
    }

    public Optional<DecisionContext> find(String claimId) {
        return Optional.ofNullable(pending.get(claimId)).map(PendingReview::context);
    }

    /**
     * Drops the claim once its context has been consumed; a context still
     * pending (for example after a refused confirmation) stays.
     */
    public void release(DecisionContext context) {
        if (!context.isPending()) {
            pending.computeIfPresent(context.claimId(), (id, review) -> review.context() == context ? null : review);
        }
    }

    public int size() {
        return pending.size();
    }

    /**
     * Abandons every review opened before {@code now - ttl}.
     *
     * @return number of claims abandoned
     */
    int expire(Instant now) {
        Duration ttl = properties.getPendingReviewTtl();
        Instant cutoff = now.minus(ttl);
        int abandoned = 0;
        for (Map.Entry<String, PendingReview> entry : pending.entrySet()) {
            PendingReview review = entry.getValue();
            if (!review.openedAt().isBefore(cutoff)) {
                continue;
            }
            DecisionContext context = review.context();
            try {
                decisionEngine.abandon(context, "No reviewer verdict within " + ttl);
                abandoned++;
            } catch (ClaimNotPendingException e) {
                log.debug("Expired review for claim {} was already closed: {}", context.claimId(), e.getMessage());
            } catch (DecisionEngineException e) {
                // still pending; retried on the next sweep
                log.warn("Could not expire review for claim {}: {}", context.claimId(), e.getMessage());
                continue;
            }
            pending.remove(entry.getKey(), review);
        }
        if (abandoned > 0) {
            log.info("Abandoned {} claim(s) left unreviewed for more than {}", abandoned, ttl);
        }
        return abandoned;
    }

    private record PendingReview(DecisionContext context, Instant openedAt) {}
}
