package com.arbiter.core.policy;

import com.arbiter.core.engine.DecisionEngineException;

/**
 * Thrown at startup when a policy document cannot be read or is malformed.
 * The process must not start serving decisions without its policies.
 */
public class PolicyLoadException extends DecisionEngineException {

    public PolicyLoadException(String message) {
        super(null, message);
    }

    public PolicyLoadException(String message, Throwable cause) {
        super(null, message, cause);
    }

    @Override
    public String getErrorCode() {
        return "POLICY_LOAD";
    }
}
