package no.boreas.db;

import no.boreas.config.AppConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Creates pooled warehouse connections using HikariCP.
 */
public final class Database {
    private Database() {
    }

    /**
     * Builds the connection pool used by ingestion. The embedded DuckDB warehouse
     * runs with a single connection; server databases may use more.
     */
    public static HikariDataSource createIngestDataSource(AppConfig cfg) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(cfg.dbJdbcUrl());
        if (!cfg.dbUsername().isBlank())
            hc.setUsername(cfg.dbUsername());
        if (!cfg.dbPassword().isBlank())
            hc.setPassword(cfg.dbPassword());
        hc.setPoolName("boreas-ingest");
        hc.setMaximumPoolSize(cfg.dbPoolMax());
        hc.setMinimumIdle(1);
        hc.setConnectionTimeout(30_000);
        hc.setLeakDetectionThreshold(0);
        return new HikariDataSource(hc);
    }
}
