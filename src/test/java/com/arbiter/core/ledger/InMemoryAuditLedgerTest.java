package com.arbiter.core.ledger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryAuditLedgerTest {

    private InMemoryAuditLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryAuditLedger();
    }

    private static AuditEntry entry(String claimId, AuditStage stage) {
        return new AuditEntry(claimId, stage, "{\"claim_id\":\"" + claimId + "\"}");
    }

    @Nested
    @DisplayName("Appending")
    class Appending {

        @Test
        @DisplayName("assigns strictly increasing sequence numbers starting at one")
        void sequenceNumbers() {
            assertEquals(1, ledger.append(entry("CLM-1", AuditStage.RECEIVED)));
            assertEquals(2, ledger.append(entry("CLM-2", AuditStage.RECEIVED)));
            assertEquals(3, ledger.append(entry("CLM-1", AuditStage.VALIDATED)));
            assertEquals(3, ledger.size());
        }

        @Test
        @DisplayName("links each record to its predecessor")
        void hashChain() {
            ledger.append(entry("CLM-1", AuditStage.RECEIVED));
            ledger.append(entry("CLM-1", AuditStage.VALIDATED));

            List<AuditRecord> records = ledger.readFrom(1, 10);
            assertEquals(AuditHashing.GENESIS, records.get(0).previousHash());
            assertEquals(records.get(0).hash(), records.get(1).previousHash());
            assertTrue(ledger.verify().intact());
            assertEquals(2, ledger.verify().recordsChecked());
        }

        @Test
        @DisplayName("concurrent appends never share a sequence number")
        void concurrentAppends() throws Exception {
            int threads = 8;
            int perThread = 50;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<List<Long>>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                String claimId = "CLM-" + t;
                futures.add(pool.submit(() -> {
                    start.await();
                    List<Long> sequences = new ArrayList<>();
                    for (int i = 0; i < perThread; i++) {
                        sequences.add(ledger.append(entry(claimId, AuditStage.RECEIVED)));
                    }
                    return sequences;
                }));
            }
            start.countDown();

            Set<Long> seen = new HashSet<>();
            for (Future<List<Long>> future : futures) {
                for (long sequence : future.get(10, TimeUnit.SECONDS)) {
                    assertTrue(seen.add(sequence), "duplicate sequence " + sequence);
                }
            }
            pool.shutdown();

            assertEquals(threads * perThread, seen.size());
            assertEquals(threads * perThread, ledger.size());
            assertTrue(ledger.verify().intact());
        }

        @Test
        @DisplayName("append that cannot take the lock in time fails as unavailable")
        void appendTimeout() throws Exception {
            CountDownLatch inside = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Clock blocking = new Clock() {
                @Override
                public ZoneId getZone() {
                    return ZoneOffset.UTC;
                }

                @Override
                public Clock withZone(ZoneId zone) {
                    return this;
                }

                @Override
                public Instant instant() {
                    inside.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return Instant.parse("2024-01-01T00:00:00Z");
                }
            };
            InMemoryAuditLedger slow = new InMemoryAuditLedger(Duration.ofMillis(50), blocking);
            ExecutorService pool = Executors.newSingleThreadExecutor();
            Future<Long> first = pool.submit(() -> slow.append(entry("CLM-1", AuditStage.RECEIVED)));
            assertTrue(inside.await(5, TimeUnit.SECONDS));

            LedgerUnavailableException ex = assertThrows(LedgerUnavailableException.class,
                    () -> slow.append(entry("CLM-2", AuditStage.RECEIVED)));
            assertEquals("CLM-2", ex.getClaimId());
            assertEquals("LEDGER_UNAVAILABLE", ex.getErrorCode());

            release.countDown();
            assertEquals(1L, first.get(5, TimeUnit.SECONDS));
            assertEquals(1, slow.size());
            pool.shutdown();
        }
    }

    @Nested
    @DisplayName("Reading")
    class Reading {

        @Test
        @DisplayName("chain holds only the claim's records in order")
        void readChain() {
            ledger.append(entry("CLM-1", AuditStage.RECEIVED));
            ledger.append(entry("CLM-2", AuditStage.RECEIVED));
            ledger.append(entry("CLM-1", AuditStage.VALIDATED));

            AuditChain chain = ledger.readChain("CLM-1");
            assertEquals(List.of(AuditStage.RECEIVED, AuditStage.VALIDATED), chain.stages());
            assertEquals(List.of(1L, 3L), chain.records().stream().map(AuditRecord::sequenceNumber).toList());
        }

        @Test
        @DisplayName("unknown claim has an empty chain")
        void unknownClaim() {
            assertTrue(ledger.readChain("CLM-X").isEmpty());
        }

        @Test
        @DisplayName("claim ids in order of first appearance")
        void claimIds() {
            ledger.append(entry("CLM-B", AuditStage.RECEIVED));
            ledger.append(entry("CLM-A", AuditStage.RECEIVED));
            ledger.append(entry("CLM-B", AuditStage.VALIDATED));

            assertEquals(List.of("CLM-B", "CLM-A"), ledger.claimIds());
        }

        @Test
        @DisplayName("pages from a sequence number")
        void readFrom() {
            for (int i = 0; i < 5; i++) {
                ledger.append(entry("CLM-" + i, AuditStage.RECEIVED));
            }
            List<AuditRecord> page = ledger.readFrom(2, 2);
            assertEquals(List.of(2L, 3L), page.stream().map(AuditRecord::sequenceNumber).toList());
        }
    }

    @Nested
    @DisplayName("Tamper evidence")
    class TamperEvidence {

        @Test
        @DisplayName("edited payload breaks verification at that record")
        void editedPayload() {
            ledger.append(entry("CLM-1", AuditStage.RECEIVED));
            ledger.append(entry("CLM-1", AuditStage.VALIDATED));
            ledger.append(entry("CLM-1", AuditStage.GOVERNED));

            List<AuditRecord> records = new ArrayList<>(ledger.readFrom(1, 10));
            AuditRecord original = records.get(1);
            records.set(1, new AuditRecord(original.sequenceNumber(), original.claimId(), original.stage(),
                    "{\"claim_id\":\"CLM-9\"}", original.timestamp(), original.previousHash(), original.hash()));

            LedgerVerification verification = AuditHashing.verify(records);
            assertFalse(verification.intact());
            assertEquals(2L, verification.firstBrokenSequence());
            assertEquals(1, verification.recordsChecked());
        }

        @Test
        @DisplayName("deleted record breaks the link of its successor")
        void deletedRecord() {
            ledger.append(entry("CLM-1", AuditStage.RECEIVED));
            ledger.append(entry("CLM-1", AuditStage.VALIDATED));
            ledger.append(entry("CLM-1", AuditStage.GOVERNED));

            List<AuditRecord> records = new ArrayList<>(ledger.readFrom(1, 10));
            records.remove(1);

            LedgerVerification verification = AuditHashing.verify(records);
            assertFalse(verification.intact());
            assertEquals(3L, verification.firstBrokenSequence());
            assertTrue(verification.reason().contains("predecessor"));
        }

        @Test
        @DisplayName("records returned to readers are immutable")
        void immutableViews() {
            ledger.append(entry("CLM-1", AuditStage.RECEIVED));
            assertThrows(UnsupportedOperationException.class,
                    () -> ledger.readChain("CLM-1").records().clear());
            assertThrows(UnsupportedOperationException.class,
                    () -> ledger.readFrom(1, 10).clear());
        }
    }
}
