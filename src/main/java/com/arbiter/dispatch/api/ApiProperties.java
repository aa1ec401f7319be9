package com.arbiter.dispatch.api;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * REST surface settings.
 * <p>
 * A claim submitted through the API waits at most {@code pendingReviewTtl} for
 * its reviewer; after that it is abandoned with a system rationale.
 */
@Component
@ConfigurationProperties(prefix = "arbiter.api")
public class ApiProperties {

    private Duration pendingReviewTtl = Duration.ofHours(24);
    private Duration expirySweepInterval = Duration.ofMinutes(1);

    public Duration getPendingReviewTtl() {
        return pendingReviewTtl;
    }

    public void setPendingReviewTtl(Duration pendingReviewTtl) {
        this.pendingReviewTtl = pendingReviewTtl;
    }

    public Duration getExpirySweepInterval() {
        return expirySweepInterval;
    }

    public void setExpirySweepInterval(Duration expirySweepInterval) {
        this.expirySweepInterval = expirySweepInterval;
    }
}
