package com.arbiter.core.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * JDBC-backed {@link AuditLedger} storing one row per record in
 * {@code arbiter_audit_ledger}.
 * <p>
 * Appends are serialized in-process and run in a single transaction that reads
 * the chain head and inserts the next row. {@code sequence_number} is the
 * primary key, so a second writer racing on the same head fails its insert
 * instead of forking the chain. The table is created by {@link #createTables()}.
 */
public class JdbcAuditLedger implements AuditLedger {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditLedger.class);

    private static final String TABLE_NAME = "arbiter_audit_ledger";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                sequence_number BIGINT PRIMARY KEY,
                claim_id        VARCHAR(128) NOT NULL,
                stage           VARCHAR(32) NOT NULL,
                payload         TEXT NOT NULL,
                recorded_at     TIMESTAMP WITH TIME ZONE NOT NULL,
                previous_hash   VARCHAR(64) NOT NULL,
                hash            VARCHAR(64) NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String CREATE_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS idx_%s_claim ON %s (claim_id, sequence_number)
            """.formatted(TABLE_NAME, TABLE_NAME);

    private static final String SELECT_HEAD_SQL = """
            SELECT sequence_number, hash
            FROM %s
            ORDER BY sequence_number DESC
            LIMIT 1
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (sequence_number, claim_id, stage, payload, recorded_at, previous_hash, hash)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String COLUMNS =
            "sequence_number, claim_id, stage, payload, recorded_at, previous_hash, hash";

    private static final String SELECT_BY_CLAIM_SQL = """
            SELECT %s FROM %s WHERE claim_id = ? ORDER BY sequence_number ASC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_FROM_SQL = """
            SELECT %s FROM %s WHERE sequence_number >= ? ORDER BY sequence_number ASC LIMIT ?
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_ALL_SQL = """
            SELECT %s FROM %s ORDER BY sequence_number ASC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_CLAIM_IDS_SQL = """
            SELECT claim_id, MIN(sequence_number) AS first_sequence
            FROM %s
            GROUP BY claim_id
            ORDER BY first_sequence
            """.formatted(TABLE_NAME);

    private static final String COUNT_SQL = "SELECT COUNT(*) FROM " + TABLE_NAME;

    private final DataSource dataSource;
    private final Duration appendTimeout;
    private final Clock clock;
    private final ReentrantLock appendLock = new ReentrantLock(true);

    public JdbcAuditLedger(DataSource dataSource, Duration appendTimeout) {
        this(dataSource, appendTimeout, Clock.systemUTC());
    }

    public JdbcAuditLedger(DataSource dataSource, Duration appendTimeout, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.appendTimeout = appendTimeout;
        this.clock = clock;
    }

    /**
     * Creates the ledger table and its claim index if they do not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE_SQL);
            stmt.execute(CREATE_INDEX_SQL);
            log.info("Audit ledger table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public long append(AuditEntry entry) {
        acquire(entry);
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                long sequence = 1;
                String previousHash = AuditHashing.GENESIS;
                try (PreparedStatement head = conn.prepareStatement(SELECT_HEAD_SQL)) {
                    head.setQueryTimeout(queryTimeoutSeconds());
                    try (ResultSet rs = head.executeQuery()) {
                        if (rs.next()) {
                            sequence = rs.getLong("sequence_number") + 1;
                            previousHash = rs.getString("hash");
                        }
                    }
                }

                Instant timestamp = clock.instant().truncatedTo(ChronoUnit.MICROS);
                String hash = AuditHashing.hash(previousHash, sequence, entry.claimId(), entry.stage(),
                        entry.payload(), timestamp);
                try (PreparedStatement insert = conn.prepareStatement(INSERT_SQL)) {
                    insert.setQueryTimeout(queryTimeoutSeconds());
                    insert.setLong(1, sequence);
                    insert.setString(2, entry.claimId());
                    insert.setString(3, entry.stage().name());
                    insert.setString(4, entry.payload());
                    insert.setObject(5, OffsetDateTime.ofInstant(timestamp, ZoneOffset.UTC));
                    insert.setString(6, previousHash);
                    insert.setString(7, hash);
                    insert.executeUpdate();
                }
                conn.commit();
                log.debug("Appended {} #{} for claim {}", entry.stage(), sequence, entry.claimId());
                return sequence;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new LedgerUnavailableException(entry.claimId(),
                    "Failed to append " + entry.stage() + ": " + e.getMessage(), e);
        } finally {
            appendLock.unlock();
        }
    }

    @Override
    public AuditChain readChain(String claimId) {
        List<AuditRecord> records = query(claimId, SELECT_BY_CLAIM_SQL, stmt -> stmt.setString(1, claimId));
        return new AuditChain(claimId, records);
    }

    @Override
    public List<AuditRecord> readFrom(long fromSequence, int limit) {
        return query(null, SELECT_FROM_SQL, stmt -> {
            stmt.setLong(1, fromSequence);
            stmt.setInt(2, limit);
        });
    }

    @Override
    public List<String> claimIds() {
        List<String> ids = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_CLAIM_IDS_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getString("claim_id"));
            }
        } catch (SQLException e) {
            throw new LedgerUnavailableException(null, "Failed to list claim ids: " + e.getMessage(), e);
        }
        return ids;
    }

    @Override
    public long size() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_SQL);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0;
        } catch (SQLException e) {
            throw new LedgerUnavailableException(null, "Failed to count records: " + e.getMessage(), e);
        }
    }

    @Override
    public LedgerVerification verify() {
        return AuditHashing.verify(query(null, SELECT_ALL_SQL, stmt -> {}));
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    private List<AuditRecord> query(String claimId, String sql, Binder binder) {
        List<AuditRecord> records = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new LedgerUnavailableException(claimId, "Failed to read audit records: " + e.getMessage(), e);
        }
        return records;
    }

    private void acquire(AuditEntry entry) {
        try {
            if (!appendLock.tryLock(appendTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new LedgerUnavailableException(entry.claimId(),
                        "Ledger did not accept " + entry.stage() + " within " + appendTimeout.toMillis() + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerUnavailableException(entry.claimId(), "Interrupted while waiting to append", e);
        }
    }

    private int queryTimeoutSeconds() {
        return (int) Math.max(1, (appendTimeout.toMillis() + 999) / 1000);
    }

    private AuditRecord fromResultSet(ResultSet rs) throws SQLException {
        return new AuditRecord(
                rs.getLong("sequence_number"),
                rs.getString("claim_id"),
                AuditStage.valueOf(rs.getString("stage")),
                rs.getString("payload"),
                rs.getObject("recorded_at", OffsetDateTime.class).toInstant(),
                rs.getString("previous_hash"),
                rs.getString("hash"));
    }
}
