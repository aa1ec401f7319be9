package com.arbiter.core.policy;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "arbiter.policy")
public class PolicyProperties {

    private String capabilityDictionary = "classpath:policy/capability-dictionary.yaml";
    private String decisionBoundaries = "classpath:policy/decision-boundaries.yaml";

    public String getCapabilityDictionary() {
        return capabilityDictionary;
    }

    public void setCapabilityDictionary(String capabilityDictionary) {
        this.capabilityDictionary = capabilityDictionary;
    }

    public String getDecisionBoundaries() {
        return decisionBoundaries;
    }

    public void setDecisionBoundaries(String decisionBoundaries) {
        this.decisionBoundaries = decisionBoundaries;
    }
}
