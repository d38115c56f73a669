package com.acme.autodoist.jdbc;

import com.acme.autodoist.config.TimeoutConfig;
import com.acme.autodoist.core.Jsons;
import com.acme.autodoist.core.LedgerException;
import com.acme.autodoist.spi.ActionResult;
import com.acme.autodoist.spi.ReceiptLedger;
import com.acme.autodoist.spi.ReceiptStatus;
import io.micronaut.data.connection.ConnectionOperations;
import io.micronaut.transaction.TransactionOperations;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * ReceiptLedger over JDBC. Each write is a single upsert keyed on the natural key, so
 * concurrent deliveries rely on the database's own row locking; statements wait at most
 * {@link TimeoutConfig#getLedgerQuery()} for a lock. The receipt upsert and its read-back
 * share one transaction.
 */
@Singleton
public class JdbcReceiptLedger implements ReceiptLedger {
    private static final String RECEIPT_COLUMNS =
        "delivery_id, received_at, event_name, user_id, triggered_at, entity_type, entity_id, project_id, "
            + "status, attempt_count, last_error, summary, payload_hash";

    private final ConnectionOperations<Connection> connectionOps;
    private final TransactionOperations<Connection> transactionOps;
    private final Clock clock;
    private final int queryTimeoutSeconds;

    public JdbcReceiptLedger(ConnectionOperations<Connection> connectionOps,
                             TransactionOperations<Connection> transactionOps,
                             Clock clock, TimeoutConfig timeoutConfig) {
        this.connectionOps = connectionOps;
        this.transactionOps = transactionOps;
        this.clock = clock;
        this.queryTimeoutSeconds = timeoutConfig.getLedgerQuerySeconds();
    }

    @Override
    public UpsertResult upsertReceipt(NewReceipt r) {
        return transactionOps.executeWrite(status -> {
            try {
                Connection conn = status.getConnection();
                try (var ps = prepare(conn,
                    "insert into event_receipts(delivery_id, received_at, event_name, user_id, triggered_at, "
                        + "entity_type, entity_id, project_id, status, attempt_count, payload_hash) "
                        + "values (?,?,?,?,?,?,?,?,?,1,?) "
                        + "on conflict (delivery_id) do update set "
                        + "attempt_count = event_receipts.attempt_count + 1, "
                        + "status = case when event_receipts.status = 'processed' "
                        + "then event_receipts.status else excluded.status end")) {
                    ps.setString(1, r.deliveryId());
                    ps.setTimestamp(2, Timestamp.from(clock.instant()));
                    ps.setString(3, r.eventName());
                    ps.setString(4, r.userId());
                    ps.setString(5, r.triggeredAt());
                    ps.setString(6, r.entityType());
                    ps.setString(7, r.entityId());
                    ps.setString(8, r.projectId());
                    ps.setString(9, r.status().wire());
                    ps.setString(10, r.payloadHash());
                    ps.executeUpdate();
                }
                Receipt receipt = findReceipt(conn, r.deliveryId())
                    .orElseThrow(() -> new SQLException("Upserted receipt not found: " + r.deliveryId()));
                return new UpsertResult(receipt.attemptCount() == 1, receipt);
            } catch (SQLException e) {
                throw new LedgerException("Failed to upsert receipt " + r.deliveryId(), e);
            }
        });
    }

    @Override
    public void markStatus(String deliveryId, ReceiptStatus status, Map<String, Object> summary, String error) {
        exec("update event_receipts set status=?, summary=?, last_error=? where delivery_id=?", ps -> {
            ps.setString(1, status.wire());
            ps.setString(2, Jsons.toJson(summary == null ? Map.of() : summary));
            ps.setString(3, error);
            ps.setString(4, deliveryId);
        });
    }

    @Override
    public void recordAction(String deliveryId, String ruleName, String actionType, String targetType,
                             String targetId, ActionResult result, Map<String, Object> meta) {
        exec("insert into action_outcomes(delivery_id, rule_name, action_type, target_type, target_id, result, meta) "
                + "values (?,?,?,?,?,?,?) "
                + "on conflict (delivery_id, action_type, target_id) do update set "
                + "result = excluded.result, meta = excluded.meta", ps -> {
            ps.setString(1, deliveryId);
            ps.setString(2, ruleName);
            ps.setString(3, actionType);
            ps.setString(4, targetType);
            ps.setString(5, targetId);
            ps.setString(6, result.wire());
            ps.setString(7, Jsons.toJson(meta == null ? Map.of() : meta));
        });
    }

    @Override
    public Optional<Instant> lastReminderNotification(String taskId, String mode) {
        return query("select last_sent_at from reminder_notifications where task_id=? and mode=?", ps -> {
            ps.setString(1, taskId);
            ps.setString(2, mode);
        }, rs -> rs.getTimestamp(1).toInstant()).stream().findFirst();
    }

    @Override
    public void recordReminderNotification(String taskId, String mode, Instant sentAt) {
        exec("insert into reminder_notifications(task_id, mode, last_sent_at) values (?,?,?) "
                + "on conflict (task_id, mode) do update set last_sent_at = excluded.last_sent_at", ps -> {
            ps.setString(1, taskId);
            ps.setString(2, mode);
            ps.setTimestamp(3, Timestamp.from(sentAt));
        });
    }

    @Override
    public List<Receipt> listReceipts(int limit) {
        return query("select " + RECEIPT_COLUMNS + " from event_receipts order by received_at desc limit ?",
            ps -> ps.setInt(1, limit), JdbcReceiptLedger::mapReceipt);
    }

    @Override
    public Optional<Receipt> getReceipt(String deliveryId) {
        return connectionOps.executeRead(status -> {
            try {
                return findReceipt(status.getConnection(), deliveryId);
            } catch (SQLException e) {
                throw new LedgerException("Failed to read receipt " + deliveryId, e);
            }
        });
    }

    @Override
    public List<Outcome> listActions(String deliveryId) {
        return query("select id, delivery_id, rule_name, action_type, target_type, target_id, result, meta "
                + "from action_outcomes where delivery_id=? order by id asc",
            ps -> ps.setString(1, deliveryId),
            rs -> new Outcome(
                rs.getLong("id"),
                rs.getString("delivery_id"),
                rs.getString("rule_name"),
                rs.getString("action_type"),
                rs.getString("target_type"),
                rs.getString("target_id"),
                rs.getString("result"),
                Jsons.toMap(rs.getString("meta"))
            ));
    }

    private Optional<Receipt> findReceipt(Connection conn, String deliveryId) throws SQLException {
        try (var ps = prepare(conn, "select " + RECEIPT_COLUMNS + " from event_receipts where delivery_id=?")) {
            ps.setString(1, deliveryId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapReceipt(rs)) : Optional.empty();
            }
        }
    }

    private static Receipt mapReceipt(ResultSet rs) throws SQLException {
        Timestamp receivedAt = rs.getTimestamp("received_at");
        return new Receipt(
            rs.getString("delivery_id"),
            receivedAt == null ? null : receivedAt.toInstant(),
            rs.getString("event_name"),
            rs.getString("user_id"),
            rs.getString("triggered_at"),
            rs.getString("entity_type"),
            rs.getString("entity_id"),
            rs.getString("project_id"),
            ReceiptStatus.fromWire(rs.getString("status")),
            rs.getInt("attempt_count"),
            rs.getString("last_error"),
            Jsons.toMap(rs.getString("summary")),
            rs.getString("payload_hash")
        );
    }

    private PreparedStatement prepare(Connection conn, String sql) throws SQLException {
        PreparedStatement ps = conn.prepareStatement(sql);
        ps.setQueryTimeout(queryTimeoutSeconds);
        return ps;
    }

    private void exec(String sql, SqlApplier a) {
        connectionOps.executeWrite(status -> {
            try (var ps = prepare(status.getConnection(), sql)) {
                a.apply(ps);
                return ps.executeUpdate();
            } catch (SQLException e) {
                throw new LedgerException("Ledger write failed", e);
            }
        });
    }

    private <T> List<T> query(String sql, SqlApplier a, RowMapper<T> mapper) {
        return connectionOps.executeRead(status -> {
            try (var ps = prepare(status.getConnection(), sql)) {
                a.apply(ps);
                try (var rs = ps.executeQuery()) {
                    List<T> out = new ArrayList<>();
                    while (rs.next()) {
                        out.add(mapper.map(rs));
                    }
                    return out;
                }
            } catch (SQLException e) {
                throw new LedgerException("Ledger read failed", e);
            }
        });
    }

    interface SqlApplier {
        void apply(PreparedStatement ps) throws SQLException;
    }

    interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }
}
