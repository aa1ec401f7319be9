package com.arbiter.core.advisory;

import com.arbiter.core.model.AdvisorySuggestion;
import com.arbiter.core.model.ClaimInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Invokes an {@link AdvisoryModel} with a bounded timeout.
 * <p>
 * Every way the call can go wrong (the model throws, returns {@code null},
 * exceeds the timeout, or the caller is interrupted) surfaces as
 * {@link AdvisoryUnavailableException}. There is no retry and no fallback suggestion.
 * <p>
 * On timeout the worker running the model is interrupted, so a hung model
 * hands its thread back to the pool once it honours the interrupt.
 */
public class TimeBoundedAdvisory {

    private static final Logger log = LoggerFactory.getLogger(TimeBoundedAdvisory.class);

    private final AdvisoryModel model;
    private final ExecutorService executor;
    private final Duration timeout;

    public TimeBoundedAdvisory(AdvisoryModel model, ExecutorService executor, Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Advisory timeout must be positive: " + timeout);
        }
        this.model = model;
        this.executor = executor;
        this.timeout = timeout;
    }

    public AdvisorySuggestion suggest(String claimId, ClaimInput input) {
        Future<AdvisorySuggestion> call = executor.submit(() -> model.suggest(input));
        AdvisorySuggestion suggestion;
        try {
            suggestion = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Advisory model {} timed out after {} ms", model.modelId(), timeout.toMillis());
            throw new AdvisoryUnavailableException(claimId,
                    "Advisory model " + model.modelId() + " timed out after " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Advisory model {} failed: {}", model.modelId(), cause.getMessage());
            throw new AdvisoryUnavailableException(claimId,
                    "Advisory model " + model.modelId() + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            throw new AdvisoryUnavailableException(claimId,
                    "Interrupted while waiting for advisory model " + model.modelId(), e);
        }
        if (suggestion == null) {
            throw new AdvisoryUnavailableException(claimId,
                    "Advisory model " + model.modelId() + " returned no suggestion");
        }
        return suggestion;
    }

    public AdvisoryModel model() {
        return model;
    }

    public Duration timeout() {
        return timeout;
    }
}
