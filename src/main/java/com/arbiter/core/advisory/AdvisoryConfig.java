package com.arbiter.core.advisory;

import com.arbiter.core.logging.MdcAwareExecutor;
import com.arbiter.core.policy.DecisionBoundarySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the advisory capability. A deployment can supply its own
 * {@link AdvisoryModel} bean (for example a trained classifier); otherwise the
 * rule-based model over the frozen boundaries is used.
 */
@Configuration
public class AdvisoryConfig {

    private static final Logger log = LoggerFactory.getLogger(AdvisoryConfig.class);

    @Bean
    @ConditionalOnMissingBean(AdvisoryModel.class)
    public AdvisoryModel ruleBasedAdvisoryModel(DecisionBoundarySpec decisionBoundarySpec) {
        log.info("No AdvisoryModel bean supplied; using rule-based model over boundaries {}",
                decisionBoundarySpec.version());
        return new RuleBasedAdvisoryModel(decisionBoundarySpec);
    }

    @Bean(destroyMethod = "shutdownNow")
    public MdcAwareExecutor advisoryExecutor(AdvisoryProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "arbiter-advisory-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new MdcAwareExecutor(Executors.newFixedThreadPool(properties.getWorkerThreads(), threads));
    }

    @Bean
    public TimeBoundedAdvisory timeBoundedAdvisory(AdvisoryModel advisoryModel, MdcAwareExecutor advisoryExecutor,
                                                   AdvisoryProperties properties) {
        return new TimeBoundedAdvisory(advisoryModel, advisoryExecutor, properties.getTimeout());
    }
}
