package com.arbiter.core.ledger;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Audit ledger settings.
 * <p>
 * {@code store} selects the backend: {@code memory} (default) or {@code jdbc},
 * which requires a configured {@code spring.datasource}.
 */
@Component
@ConfigurationProperties(prefix = "arbiter.ledger")
public class LedgerProperties {

    private String store = "memory";
    private Duration appendTimeout = Duration.ofSeconds(2);

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public Duration getAppendTimeout() {
        return appendTimeout;
    }

    public void setAppendTimeout(Duration appendTimeout) {
        this.appendTimeout = appendTimeout;
    }
}
