package com.pathway.ledger.store;

import com.pathway.config.PathwayConfig;
import com.pathway.ledger.AssignmentLedgerStore;
import com.pathway.ledger.AssignmentRecord;
import com.pathway.ledger.DecisionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * JDBC implementation of {@link AssignmentLedgerStore} on PostgreSQL, table {@code pathway_assignment}.
 * The schema ({@code CREATE TABLE IF NOT EXISTS}) is applied once from the classpath via {@link #ensureSchema()};
 * the row id doubles as the record sequence.
 */
public final class JdbcAssignmentLedgerStore implements AssignmentLedgerStore {

    static final String SCHEMA_RESOURCE = "schema/pathway-ledger.sql";
    static final String INSERT_SQL = "INSERT INTO pathway_assignment (session_id, assignment_key, level_id, assigned_child_ids, "
            + "decision_type, ordering_mode, reason, recorded_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
    static final String HISTORY_SQL = "SELECT id, session_id, assignment_key, level_id, assigned_child_ids::text AS child_ids, "
            + "decision_type, ordering_mode, reason, recorded_at FROM pathway_assignment WHERE session_id = ? ORDER BY id";

    private static final Logger log = LoggerFactory.getLogger(JdbcAssignmentLedgerStore.class);

    private final ConnectionProvider connections;
    private final String target;
    private final AtomicBoolean schemaInitialized = new AtomicBoolean(false);

    public JdbcAssignmentLedgerStore(PathwayConfig config) {
        Objects.requireNonNull(config, "config");
        this.connections = () -> DriverManager.getConnection(config.getJdbcUrl(), config.getDbUser(),
                config.getDbPassword() != null ? config.getDbPassword() : "");
        this.target = config.getDbHost() + ":" + config.getDbPort() + "/" + config.getDbName();
    }

    public JdbcAssignmentLedgerStore(ConnectionProvider connections, String target) {
        this.connections = Objects.requireNonNull(connections, "connections");
        this.target = target;
    }

    /**
     * Creates the assignment table and index if they do not exist. Idempotent; safe to call at bootstrap.
     */
    public void ensureSchema() {
        if (!schemaInitialized.compareAndSet(false, true)) {
            log.debug("Ledger schema already initialized; skipping");
            return;
        }
        List<String> statements = schemaStatements(loadSchemaScript());
        log.info("Ledger schema: connecting to DB {} and executing {} statement(s)", target, statements.size());
        try (Connection c = connections.getConnection(); Statement st = c.createStatement()) {
            int index = 0;
            for (String stmt : statements) {
                index++;
                try {
                    st.execute(stmt);
                } catch (SQLException e) {
                    log.error("Ledger schema: statement {}/{} failed | SQLState={} | error={}", index, statements.size(), e.getSQLState(), e.getMessage(), e);
                    throw new IllegalStateException("Ledger schema execution failed at statement " + index + ": " + e.getMessage(), e);
                }
            }
            log.info("Ledger schema: all {} statement(s) executed; table pathway_assignment is ready", statements.size());
        } catch (SQLException e) {
            schemaInitialized.set(false);
            log.error("Ledger schema: connection failed | DB={} | SQLState={} | error={}", target, e.getSQLState(), e.getMessage(), e);
            throw new IllegalStateException("Ledger schema execution failed: " + e.getMessage(), e);
        }
    }

    static String loadSchemaScript() {
        try (var in = JdbcAssignmentLedgerStore.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Ledger schema resource not found: " + SCHEMA_RESOURCE);
            }
            return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)).lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new IllegalStateException("Ledger schema load failed: " + e.getMessage(), e);
        }
    }

    /** Splits a script on {@code ;}, dropping comment lines and empty statements. */
    static List<String> schemaStatements(String sql) {
        List<String> out = new ArrayList<>();
        for (String raw : sql.split(";")) {
            String stmt = raw.replaceAll("(?m)^\\s*--[^\n]*\n?", "").trim();
            if (!stmt.isEmpty()) out.add(stmt);
        }
        return out;
    }

    @Override
    public void append(AssignmentRecord record) {
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(INSERT_SQL)) {
            ps.setString(1, AssignmentSqlMapper.toName(record.getSessionId()));
            ps.setString(2, AssignmentSqlMapper.toName(record.getAssignmentKey()));
            ps.setString(3, AssignmentSqlMapper.toName(record.getLevelId()));
            ps.setObject(4, AssignmentSqlMapper.toJsonb(AssignmentSqlMapper.childIdsToJson(record.getAssignedChildIds())));
            ps.setString(5, record.getDecisionType().toValue());
            ps.setString(6, record.getOrderingMode());
            ps.setString(7, record.getReason());
            ps.setTimestamp(8, new Timestamp(record.getTimestamp()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Assignment insert failed for session " + record.getSessionId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<AssignmentRecord> history(String sessionId) {
        List<AssignmentRecord> out = new ArrayList<>();
        try (Connection c = connections.getConnection(); PreparedStatement ps = c.prepareStatement(HISTORY_SQL)) {
            ps.setString(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Timestamp recordedAt = rs.getTimestamp("recorded_at");
                    out.add(new AssignmentRecord(
                            rs.getString("session_id"),
                            rs.getLong("id"),
                            rs.getString("assignment_key"),
                            rs.getString("level_id"),
                            AssignmentSqlMapper.childIdsFromJson(rs.getString("child_ids")),
                            DecisionType.fromValue(rs.getString("decision_type")),
                            rs.getString("ordering_mode"),
                            rs.getString("reason"),
                            recordedAt != null ? recordedAt.getTime() : 0L));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Assignment history query failed for session " + sessionId + ": " + e.getMessage(), e);
        }
        return out;
    }

    /** Source of JDBC connections. */
    @FunctionalInterface
    public interface ConnectionProvider {
        Connection getConnection() throws SQLException;
    }
}
