package no.boreas.db;

import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the bookkeeping tables the engine owns. Data tables are created by
 * {@link UpsertSink} on first load.
 */
public final class WarehouseSchema {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(WarehouseSchema.class);

    static final String STATE_TABLE = "_ingest_state";
    static final String RUNS_TABLE = "_ingest_runs";
    static final String EVENTS_TABLE = "_ingest_events";

    private WarehouseSchema() {
    }

    public static void ensure(HikariDataSource ds) throws SQLException {
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            st.execute("CREATE TABLE IF NOT EXISTS \"" + STATE_TABLE + "\" ("
                    + "\"partition_id\" VARCHAR NOT NULL, "
                    + "\"resource\" VARCHAR NOT NULL, "
                    + "\"cursor_value\" VARCHAR NOT NULL, "
                    + "\"updated_at\" TIMESTAMP NOT NULL, "
                    + "PRIMARY KEY (\"partition_id\", \"resource\"))");
            st.execute("CREATE TABLE IF NOT EXISTS \"" + RUNS_TABLE + "\" ("
                    + "\"run_id\" VARCHAR PRIMARY KEY, "
                    + "\"pipeline\" VARCHAR NOT NULL, "
                    + "\"started_at\" TIMESTAMP NOT NULL, "
                    + "\"finished_at\" TIMESTAMP, "
                    + "\"status\" VARCHAR NOT NULL, "
                    + "\"notes\" VARCHAR)");
            st.execute("CREATE TABLE IF NOT EXISTS \"" + EVENTS_TABLE + "\" ("
                    + "\"run_id\" VARCHAR NOT NULL, "
                    + "\"source\" VARCHAR NOT NULL, "
                    + "\"endpoint\" VARCHAR NOT NULL, "
                    + "\"http_status\" BIGINT, "
                    + "\"response_ms\" BIGINT, "
                    + "\"error\" VARCHAR, "
                    + "\"created_at\" TIMESTAMP NOT NULL)");
        }
        log.debug("Bookkeeping tables ready");
    }
}
