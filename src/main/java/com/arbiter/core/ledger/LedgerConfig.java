package com.arbiter.core.ledger;

import com.arbiter.core.metrics.ArbiterMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Provides the {@link AuditLedger} bean.
 * <p>
 * With {@code arbiter.ledger.store=jdbc} records go to the configured
 * {@link DataSource}; otherwise an in-memory ledger is used, which does not
 * survive a restart.
 */
@Configuration
public class LedgerConfig {

    private static final Logger log = LoggerFactory.getLogger(LedgerConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "arbiter.ledger", name = "store", havingValue = "jdbc")
    public AuditLedger jdbcAuditLedger(DataSource dataSource, LedgerProperties properties,
                                       ArbiterMetrics metrics) throws Exception {
        log.info("Configuring JDBC audit ledger");
        var ledger = new JdbcAuditLedger(dataSource, properties.getAppendTimeout());
        ledger.createTables();
        return new TimedAuditLedger(ledger, metrics);
    }

    @Bean
    @ConditionalOnMissingBean(AuditLedger.class)
    public AuditLedger inMemoryAuditLedger(LedgerProperties properties, ArbiterMetrics metrics) {
        log.info("Using in-memory audit ledger (records will not persist across restarts)");
        return new TimedAuditLedger(new InMemoryAuditLedger(properties.getAppendTimeout(), Clock.systemUTC()), metrics);
    }
}
