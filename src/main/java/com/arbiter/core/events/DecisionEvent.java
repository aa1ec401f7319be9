package com.arbiter.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A stage transition published after its audit record was appended.
 *
 * @param eventType e.g. "claim.received", "claim.advised", "claim.finalized", "claim.rejected"
 * @param claimId   the claim this event belongs to
 * @param sequence  ledger sequence number of the record behind the event, or {@code -1}
 * @param payload   small summary for subscribers; the ledger payload is authoritative
 * @param timestamp when the event was published
 */
public record DecisionEvent(
    String eventType,
    String claimId,
    long sequence,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
