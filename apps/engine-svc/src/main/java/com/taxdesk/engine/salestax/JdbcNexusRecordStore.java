package com.taxdesk.engine.salestax;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Relational nexus store. The row is locked with {@code SELECT ... FOR UPDATE} for the whole
 * read-modify-write; a first insert racing another first insert is retried once, at which point
 * the row exists and the lock path applies.
 */
public class JdbcNexusRecordStore implements NexusRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcNexusRecordStore.class);

    private static final String COLUMNS = "client_id, jurisdiction, threshold_sales, threshold_transactions, "
            + "cumulative_sales, cumulative_transactions, status, last_updated";

    private static final RowMapper<NexusRecord> ROW_MAPPER = JdbcNexusRecordStore::mapRow;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcNexusRecordStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public Optional<NexusRecord> find(NexusKey key) {
        List<NexusRecord> rows = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM nexus_records WHERE client_id = ? AND jurisdiction = ?",
                ROW_MAPPER, key.clientId(), key.jurisdiction());
        return rows.stream().findFirst();
    }

    @Override
    public NexusRecord update(NexusKey key, UnaryOperator<NexusRecord> updater) {
        try {
            return updateOnce(key, updater);
        } catch (DuplicateKeyException ex) {
            log.debug("nexus_insert_conflict clientId={} jurisdiction={} retrying", key.clientId(), key.jurisdiction());
            return updateOnce(key, updater);
        }
    }

    private NexusRecord updateOnce(NexusKey key, UnaryOperator<NexusRecord> updater) {
        return transactionTemplate.execute(status -> {
            List<NexusRecord> rows = jdbcTemplate.query(
                    "SELECT " + COLUMNS + " FROM nexus_records WHERE client_id = ? AND jurisdiction = ? FOR UPDATE",
                    ROW_MAPPER, key.clientId(), key.jurisdiction());
            NexusRecord current = rows.isEmpty() ? null : rows.get(0);
            NexusRecord next = updater.apply(current);
            if (current == null) {
                jdbcTemplate.update(
                        "INSERT INTO nexus_records (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                        next.clientId(),
                        next.jurisdiction(),
                        next.thresholdSalesAmount(),
                        next.thresholdTransactionCount(),
                        next.cumulativeSales(),
                        next.cumulativeTransactionCount(),
                        next.status().name(),
                        Timestamp.from(next.lastUpdated()));
            } else {
                jdbcTemplate.update(
                        "UPDATE nexus_records SET threshold_sales = ?, threshold_transactions = ?, cumulative_sales = ?, "
                                + "cumulative_transactions = ?, status = ?, last_updated = ? WHERE client_id = ? AND jurisdiction = ?",
                        next.thresholdSalesAmount(),
                        next.thresholdTransactionCount(),
                        next.cumulativeSales(),
                        next.cumulativeTransactionCount(),
                        next.status().name(),
                        Timestamp.from(next.lastUpdated()),
                        key.clientId(),
                        key.jurisdiction());
            }
            return next;
        });
    }

    @Override
    public List<NexusRecord> findByClientId(String clientId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM nexus_records WHERE client_id = ? ORDER BY cumulative_sales DESC",
                ROW_MAPPER, clientId);
    }

    private static NexusRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        int thresholdTransactions = rs.getInt("threshold_transactions");
        Integer thresholdTransactionCount = rs.wasNull() ? null : thresholdTransactions;
        return new NexusRecord(
                rs.getString("client_id"),
                rs.getString("jurisdiction"),
                rs.getBigDecimal("threshold_sales"),
                thresholdTransactionCount,
                rs.getBigDecimal("cumulative_sales"),
                rs.getLong("cumulative_transactions"),
                NexusStatus.valueOf(rs.getString("status")),
                rs.getTimestamp("last_updated").toInstant()
        );
    }
}
