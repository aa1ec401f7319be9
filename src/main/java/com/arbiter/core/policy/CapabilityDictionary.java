package com.arbiter.core.policy;

import com.arbiter.core.model.ClaimType;
import com.arbiter.core.model.Severity;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Declarative policy of which input fields and advisory actions are permitted.
 * <p>
 * Loaded once at startup and shared read-only by every pipeline invocation.
 * All views it returns are unmodifiable; attempts to mutate them throw
 * {@link UnsupportedOperationException}.
 */
public final class CapabilityDictionary {

    private final String version;
    private final Map<String, FieldCapability> fields;
    private final Map<Severity, ActionCapability> actions;

    public CapabilityDictionary(String version,
                                Map<String, FieldCapability> fields,
                                Map<Severity, ActionCapability> actions) {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Capability dictionary must declare a version");
        }
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Capability dictionary must declare at least one field");
        }
        this.version = version;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.actions = actions == null || actions.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(actions));
    }

    /**
     * Builds a dictionary from its document form, where actions are keyed by category label.
     */
    @JsonCreator
    public static CapabilityDictionary fromDocument(@JsonProperty("version") String version,
                                                    @JsonProperty("fields") Map<String, FieldCapability> fields,
                                                    @JsonProperty("actions") Map<String, ActionCapability> actions) {
        Map<Severity, ActionCapability> byCategory = new EnumMap<>(Severity.class);
        if (actions != null) {
            actions.forEach((label, capability) -> byCategory.put(Severity.fromLabel(label), capability));
        }
        return new CapabilityDictionary(version, fields, byCategory);
    }

    @JsonProperty("version")
    public String version() {
        return version;
    }

    @JsonProperty("fields")
    public Map<String, FieldCapability> fields() {
        return fields;
    }

    @JsonProperty("actions")
    public Map<Severity, ActionCapability> actions() {
        return actions;
    }

    public Optional<FieldCapability> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    /**
     * Whether the field is declared and marked allowed. Absent fields are never accepted.
     */
    public boolean isFieldAllowed(String name) {
        FieldCapability capability = fields.get(name);
        return capability != null && capability.allowed();
    }

    public boolean isActionAllowed(Severity action, ClaimType claimType) {
        ActionCapability capability = actions.get(action);
        return capability != null && capability.permits(claimType);
    }

    /**
     * Advisory actions the dictionary permits for the given claim type.
     */
    public Set<Severity> permittedActions(ClaimType claimType) {
        Set<Severity> permitted = EnumSet.noneOf(Severity.class);
        for (Severity action : Severity.values()) {
            if (isActionAllowed(action, claimType)) {
                permitted.add(action);
            }
        }
        return Collections.unmodifiableSet(permitted);
    }

    @Override
    public String toString() {
        return "CapabilityDictionary[version=" + version + ", fields=" + fields.keySet()
                + ", actions=" + actions.keySet() + "]";
    }
}
