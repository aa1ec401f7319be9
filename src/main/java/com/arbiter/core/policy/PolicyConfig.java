package com.arbiter.core.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Loads the governance policy exactly once at startup and exposes it, and its
 * two parts, as read-only singletons.
 */
@Configuration
public class PolicyConfig {

    private static final Logger log = LoggerFactory.getLogger(PolicyConfig.class);

    @Bean
    public PolicyLoader policyLoader(ResourceLoader resourceLoader) {
        return new PolicyLoader(resourceLoader);
    }

    @Bean
    public GovernancePolicy governancePolicy(PolicyLoader policyLoader, PolicyProperties properties) {
        GovernancePolicy policy = policyLoader.load(
                properties.getCapabilityDictionary(), properties.getDecisionBoundaries());
        log.info("Governance policy frozen: dictionary={} ({}), boundaries={} ({})",
                policy.dictionary().version(), policy.dictionaryFingerprint().substring(0, 12),
                policy.boundaries().version(), policy.boundariesFingerprint().substring(0, 12));
        return policy;
    }

    @Bean
    public CapabilityDictionary capabilityDictionary(GovernancePolicy governancePolicy) {
        return governancePolicy.dictionary();
    }

    @Bean
    public DecisionBoundarySpec decisionBoundarySpec(GovernancePolicy governancePolicy) {
        return governancePolicy.boundaries();
    }
}
