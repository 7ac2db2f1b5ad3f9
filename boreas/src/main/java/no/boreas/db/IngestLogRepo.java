package no.boreas.db;

import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Clock;
import java.util.UUID;

/**
 * Database access for pipeline run logs and upstream request events.
 */
public class IngestLogRepo {
    private final HikariDataSource ds;
    private final Clock clock;
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(IngestLogRepo.class);

    /**
     * Creates a repo backed by the provided datasource.
     */
    public IngestLogRepo(HikariDataSource ds, Clock clock) {
        this.ds = ds;
        this.clock = clock;
    }

    /**
     * Starts a new pipeline run and returns its unique ID.
     */
    public String startRun(String pipeline) throws SQLException {
        String runId = UUID.randomUUID().toString();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO \"" + WarehouseSchema.RUNS_TABLE
                                + "\" (\"run_id\", \"pipeline\", \"started_at\", \"status\") VALUES (?, ?, ?, 'RUNNING')")) {
            ps.setString(1, runId);
            ps.setString(2, pipeline);
            ps.setTimestamp(3, ColumnType.utc(clock.instant()));
            ps.executeUpdate();
        }
        log.debug("startRun: {} -> {}", pipeline, runId);
        return runId;
    }

    /**
     * Marks a run as success or failure with notes.
     */
    public void finishRun(String runId, boolean success, String notes) throws SQLException {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "UPDATE \"" + WarehouseSchema.RUNS_TABLE
                                + "\" SET \"finished_at\" = ?, \"status\" = ?, \"notes\" = ? WHERE \"run_id\" = ?")) {
            ps.setTimestamp(1, ColumnType.utc(clock.instant()));
            ps.setString(2, success ? "SUCCESS" : "FAILED");
            ps.setString(3, notes);
            ps.setString(4, runId);
            ps.executeUpdate();
        }
        log.debug("finishRun: {} success={} notes={}", runId, success, notes);
    }

    /**
     * Logs a single upstream request event for a run.
     */
    public void logEvent(String runId, String source, String endpoint, Integer httpStatus, Long responseMs,
            String error) throws SQLException {
        String sql = "INSERT INTO \"" + WarehouseSchema.EVENTS_TABLE + "\" "
                + "(\"run_id\", \"source\", \"endpoint\", \"http_status\", \"response_ms\", \"error\", \"created_at\") "
                + "VALUES (?, ?, ?, ?, ?, ?, ?)";

        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId);
            ps.setString(2, source);
            ps.setString(3, endpoint);

            if (httpStatus == null)
                ps.setNull(4, java.sql.Types.BIGINT);
            else
                ps.setLong(4, httpStatus);

            if (responseMs == null)
                ps.setNull(5, java.sql.Types.BIGINT);
            else
                ps.setLong(5, responseMs);

            ps.setString(6, error);
            ps.setTimestamp(7, ColumnType.utc(clock.instant()));
            ps.executeUpdate();
        }
        log.debug("logEvent: run={} source={} endpoint={} status={} ms={} error={}", runId, source, endpoint,
                httpStatus, responseMs, error);
    }
}
