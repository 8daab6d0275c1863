package org.groupscholar.planner.infrastructure.persistence;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.stream.Collectors;
import org.groupscholar.planner.application.port.ReportOutputPort;
import org.groupscholar.planner.application.report.PlanReport;
import org.groupscholar.planner.application.report.RunMetadata;
import org.groupscholar.planner.config.DatabaseSettings;
import org.groupscholar.planner.domain.aggregate.AlertReason;
import org.groupscholar.planner.domain.aggregate.OwnerAlert;
import org.groupscholar.planner.domain.record.Action;
import org.groupscholar.planner.domain.record.NormalizedRecord;
import org.groupscholar.planner.domain.record.ScoredRecord;
import org.groupscholar.planner.infrastructure.json.JsonReportWriter;
import org.groupscholar.planner.logging.Logs;
import org.groupscholar.planner.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Persists a plan report to a relational schema.
 * <p><strong>Tables:</strong> {@code planner_runs} (one row per run with the configuration and full JSON payload),
 * {@code planner_actions}, {@code planner_owner_alerts} and {@code planner_escalations}, all keyed by
 * {@code run_id}. The schema and tables are created when missing.</p>
 * <p><strong>Atomicity:</strong> Everything for one report is written in a single transaction; on failure the
 * transaction is rolled back and the cause is rethrown as {@link RunStoreException}.</p>
 * <p><strong>Portability:</strong> Uses identity columns and text payloads so the same DDL runs on PostgreSQL and
 * on H2 in PostgreSQL mode.</p>
 *
 * @since 0.1.0
 */
public final class JdbcRunStoreAdapter implements ReportOutputPort {
  private static final Logger log = LoggerFactory.getLogger(JdbcRunStoreAdapter.class);

  /** Opens connections to the run store database. */
  @FunctionalInterface
  public interface ConnectionFactory {
    Connection open() throws SQLException;

    /**
     * Creates a factory backed by {@link DriverManager}.
     *
     * @param settings resolved database settings
     * @return connection factory
     */
    static ConnectionFactory fromSettings(DatabaseSettings settings) {
      Objects.requireNonNull(settings, "settings");
      return () -> DriverManager.getConnection(
          settings.jdbcUrl(), settings.user().orElse(null), settings.password().orElse(null));
    }
  }

  private final ConnectionFactory connections;
  private final String schema;
  private final String runLabel;
  private final JsonReportWriter json = new JsonReportWriter(false);

  /**
   * Creates a run store adapter.
   *
   * @param connections connection source
   * @param schema schema name; must be a plain SQL identifier
   * @param runLabel label stored with the run
   */
  public JdbcRunStoreAdapter(ConnectionFactory connections, String schema, String runLabel) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.schema = Strings.requireIdentifier("dbSchema", schema);
    this.runLabel = Strings.requireNonBlank("runLabel", runLabel);
  }

  @Override
  public void write(PlanReport report) throws RunStoreException {
    Objects.requireNonNull(report, "report");
    try (Connection connection = connections.open()) {
      boolean previousAutoCommit = connection.getAutoCommit();
      connection.setAutoCommit(false);
      try {
        ensureSchema(connection);
        long runId = insertRun(connection, report);
        insertActions(connection, runId, report.actions());
        insertOwnerAlerts(connection, runId, report.ownerAlerts());
        insertEscalations(connection, runId, report.escalations());
        connection.commit();
        log.info("Stored run {} ('{}') with {} actions in schema {}",
            runId, runLabel, report.actions().size(), schema);
      } catch (SQLException | RuntimeException ex) {
        try {
          connection.rollback();
        } catch (SQLException rollbackEx) {
          ex.addSuppressed(rollbackEx);
        }
        try {
          connection.setAutoCommit(previousAutoCommit);
        } catch (SQLException restoreEx) {
          ex.addSuppressed(restoreEx);
        }
        throw ex;
      }
      connection.setAutoCommit(previousAutoCommit);
    } catch (SQLException ex) {
      throw new RunStoreException("Failed to store planner run '" + runLabel + "' in schema " + schema, ex);
    }
  }

  private void ensureSchema(Connection connection) throws SQLException {
    List<String> ddl = List.of(
        "CREATE SCHEMA IF NOT EXISTS " + schema,
        "CREATE TABLE IF NOT EXISTS " + table("planner_runs") + " ("
            + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,"
            + "run_label TEXT NOT NULL,"
            + "generated_at TIMESTAMP WITH TIME ZONE NOT NULL,"
            + "run_date DATE NOT NULL,"
            + "source TEXT NOT NULL,"
            + "rows_read INT NOT NULL,"
            + "scored INT NOT NULL,"
            + "rejected INT NOT NULL,"
            + "escalations INT NOT NULL,"
            + "config TEXT NOT NULL,"
            + "payload TEXT NOT NULL"
            + ")",
        "CREATE TABLE IF NOT EXISTS " + table("planner_actions") + " ("
            + "run_id BIGINT NOT NULL REFERENCES " + table("planner_runs") + "(id) ON DELETE CASCADE,"
            + "action_rank INT NOT NULL,"
            + "record_id TEXT NOT NULL,"
            + "name TEXT NOT NULL,"
            + "cohort TEXT,"
            + "owner_name TEXT,"
            + "channel TEXT NOT NULL,"
            + "risk_score INT NOT NULL,"
            + "risk_tier TEXT NOT NULL,"
            + "status TEXT NOT NULL,"
            + "last_touch DATE,"
            + "next_due DATE,"
            + "due_in_days INT,"
            + "stale BOOLEAN NOT NULL,"
            + "priority_score NUMERIC(8,2) NOT NULL,"
            + "recommended_action TEXT NOT NULL"
            + ")",
        "CREATE TABLE IF NOT EXISTS " + table("planner_owner_alerts") + " ("
            + "run_id BIGINT NOT NULL REFERENCES " + table("planner_runs") + "(id) ON DELETE CASCADE,"
            + "owner_name TEXT NOT NULL,"
            + "reasons TEXT NOT NULL,"
            + "overdue INT NOT NULL,"
            + "no_touch INT NOT NULL,"
            + "total INT NOT NULL"
            + ")",
        "CREATE TABLE IF NOT EXISTS " + table("planner_escalations") + " ("
            + "run_id BIGINT NOT NULL REFERENCES " + table("planner_runs") + "(id) ON DELETE CASCADE,"
            + "action_rank INT NOT NULL,"
            + "record_id TEXT NOT NULL,"
            + "risk_score INT NOT NULL,"
            + "status TEXT NOT NULL,"
            + "priority_score NUMERIC(8,2) NOT NULL"
            + ")");
    try (Statement statement = connection.createStatement()) {
      for (String sql : ddl) {
        statement.execute(sql);
      }
    }
  }

  private long insertRun(Connection connection, PlanReport report) throws SQLException {
    RunMetadata metadata = report.metadata();
    String sql = "INSERT INTO " + table("planner_runs")
        + " (run_label, generated_at, run_date, source, rows_read, scored, rejected, escalations, config, payload)"
        + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
    try (PreparedStatement ps = connection.prepareStatement(sql, new String[] {"id"})) {
      ps.setString(1, runLabel);
      ps.setObject(2, OffsetDateTime.ofInstant(metadata.generatedAt(), ZoneOffset.UTC));
      ps.setObject(3, metadata.today());
      ps.setString(4, metadata.source());
      ps.setInt(5, metadata.rowsRead());
      ps.setInt(6, metadata.scoredCount());
      ps.setInt(7, metadata.rejectedCount());
      ps.setInt(8, report.escalations().size());
      ps.setString(9, json.toJson(metadata.config()));
      ps.setString(10, json.toJson(report));
      ps.executeUpdate();
      try (ResultSet keys = ps.getGeneratedKeys()) {
        if (!keys.next()) {
          throw new SQLException("planner_runs insert returned no generated id");
        }
        return keys.getLong(1);
      }
    }
  }

  private void insertActions(Connection connection, long runId, List<Action> actions) throws SQLException {
    String sql = "INSERT INTO " + table("planner_actions")
        + " (run_id, action_rank, record_id, name, cohort, owner_name, channel, risk_score, risk_tier, status,"
        + " last_touch, next_due, due_in_days, stale, priority_score, recommended_action)"
        + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
    try (PreparedStatement ps = connection.prepareStatement(sql)) {
      for (Action action : actions) {
        ScoredRecord scored = action.scored();
        NormalizedRecord record = scored.record();
        ps.setLong(1, runId);
        ps.setInt(2, action.rank());
        ps.setString(3, record.id());
        ps.setString(4, record.name());
        ps.setString(5, record.cohort());
        ps.setString(6, record.owner().orElse(null));
        ps.setString(7, record.channelPreference());
        ps.setInt(8, record.riskScore());
        ps.setString(9, scored.tier().label());
        ps.setString(10, scored.status().key());
        ps.setObject(11, record.lastTouchDate().orElse(null), Types.DATE);
        ps.setObject(12, scored.assessment().nextDueDate().orElse(null), Types.DATE);
        setOptionalInt(ps, 13, scored.dueInDays());
        ps.setBoolean(14, scored.stale());
        ps.setDouble(15, scored.priorityScore());
        ps.setString(16, scored.recommendedAction());
        ps.addBatch();
      }
      ps.executeBatch();
    }
  }

  private void insertOwnerAlerts(Connection connection, long runId, List<OwnerAlert> alerts) throws SQLException {
    String sql = "INSERT INTO " + table("planner_owner_alerts")
        + " (run_id, owner_name, reasons, overdue, no_touch, total) VALUES (?, ?, ?, ?, ?, ?)";
    try (PreparedStatement ps = connection.prepareStatement(sql)) {
      for (OwnerAlert alert : alerts) {
        ps.setLong(1, runId);
        ps.setString(2, alert.owner());
        ps.setString(3, alert.reasons().stream().map(AlertReason::key).collect(Collectors.joining(",")));
        ps.setInt(4, alert.overdue());
        ps.setInt(5, alert.noTouch());
        ps.setInt(6, alert.total());
        ps.addBatch();
      }
      ps.executeBatch();
    }
  }

  private void insertEscalations(Connection connection, long runId, List<Action> escalations) throws SQLException {
    String sql = "INSERT INTO " + table("planner_escalations")
        + " (run_id, action_rank, record_id, risk_score, status, priority_score) VALUES (?, ?, ?, ?, ?, ?)";
    try (PreparedStatement ps = connection.prepareStatement(sql)) {
      for (Action action : escalations) {
        ps.setLong(1, runId);
        ps.setInt(2, action.rank());
        ps.setString(3, action.id());
        ps.setInt(4, action.scored().record().riskScore());
        ps.setString(5, action.scored().status().key());
        ps.setDouble(6, action.priorityScore());
        ps.addBatch();
      }
      ps.executeBatch();
    }
  }

  private String table(String name) {
    return schema + "." + name;
  }

  private static void setOptionalInt(PreparedStatement ps, int index, OptionalInt value) throws SQLException {
    if (value.isPresent()) {
      ps.setInt(index, value.getAsInt());
    } else {
      ps.setNull(index, Types.INTEGER);
    }
  }

  /**
   * Returns a log-safe description of where runs are stored.
   *
   * @param settings database settings
   * @param schema schema name
   * @return URL with credentials masked plus schema
   */
  public static String describe(DatabaseSettings settings, String schema) {
    return Logs.redactCredentials(settings.jdbcUrl()) + " (schema " + schema + ")";
  }
}
