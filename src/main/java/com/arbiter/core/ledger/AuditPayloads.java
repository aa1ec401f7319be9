package com.arbiter.core.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Serializes stage snapshots into the JSON payload stored with each record.
 */
public final class AuditPayloads {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private AuditPayloads() {}

    /**
     * @throws LedgerUnavailableException if the snapshot cannot be serialized;
     *         a transition that cannot be recorded must not happen
     */
    public static AuditEntry entry(String claimId, AuditStage stage, Object snapshot) {
        try {
            return new AuditEntry(claimId, stage, MAPPER.writeValueAsString(snapshot));
        } catch (JsonProcessingException e) {
            throw new LedgerUnavailableException(claimId,
                    "Cannot serialize " + stage + " snapshot: " + e.getOriginalMessage(), e);
        }
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
