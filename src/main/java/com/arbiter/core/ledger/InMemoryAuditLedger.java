package com.arbiter.core.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local ledger. Records live only as long as the JVM; suitable for
 * development, the CLI and tests.
 */
public class InMemoryAuditLedger implements AuditLedger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAuditLedger.class);

    private final List<AuditRecord> records = new ArrayList<>();
    private final Map<String, List<AuditRecord>> byClaim = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final Duration appendTimeout;
    private final Clock clock;

    public InMemoryAuditLedger() {
        this(Duration.ofSeconds(2), Clock.systemUTC());
    }

    public InMemoryAuditLedger(Duration appendTimeout, Clock clock) {
        this.appendTimeout = appendTimeout;
        this.clock = clock;
    }

    @Override
    public long append(AuditEntry entry) {
        boolean locked;
        try {
            locked = lock.writeLock().tryLock(appendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerUnavailableException(entry.claimId(), "Interrupted while waiting to append", e);
        }
        if (!locked) {
            throw new LedgerUnavailableException(entry.claimId(),
                    "Ledger did not accept " + entry.stage() + " within " + appendTimeout.toMillis() + "ms");
        }
        try {
            AuditRecord previous = records.isEmpty() ? null : records.get(records.size() - 1);
            long sequence = previous == null ? 1 : previous.sequenceNumber() + 1;
            String previousHash = previous == null ? AuditHashing.GENESIS : previous.hash();
            Instant timestamp = clock.instant().truncatedTo(ChronoUnit.MICROS);
            String hash = AuditHashing.hash(previousHash, sequence, entry.claimId(), entry.stage(),
                    entry.payload(), timestamp);
            AuditRecord record = new AuditRecord(sequence, entry.claimId(), entry.stage(), entry.payload(),
                    timestamp, previousHash, hash);
            records.add(record);
            byClaim.computeIfAbsent(entry.claimId(), id -> new ArrayList<>()).add(record);
            log.debug("Appended {} #{} for claim {}", entry.stage(), sequence, entry.claimId());
            return sequence;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public AuditChain readChain(String claimId) {
        lock.readLock().lock();
        try {
            return new AuditChain(claimId, byClaim.getOrDefault(claimId, List.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<AuditRecord> readFrom(long fromSequence, int limit) {
        lock.readLock().lock();
        try {
            return records.stream()
                    .filter(r -> r.sequenceNumber() >= fromSequence)
                    .limit(limit)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<String> claimIds() {
        lock.readLock().lock();
        try {
            return List.copyOf(byClaim.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public LedgerVerification verify() {
        lock.readLock().lock();
        try {
            return AuditHashing.verify(records);
        } finally {
            lock.readLock().unlock();
        }
    }
}
