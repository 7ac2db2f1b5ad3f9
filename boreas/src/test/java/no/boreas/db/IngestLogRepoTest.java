package no.boreas.db;

import com.zaxxer.hikari.HikariDataSource;
import no.boreas.support.MutableClock;
import no.boreas.support.TestWarehouse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Map;
import java.util.TimeZone;

import static org.junit.jupiter.api.Assertions.*;

class IngestLogRepoTest {
    @TempDir
    Path dir;

    private HikariDataSource ds;
    private IngestLogRepo repo;

    @BeforeEach
    void setUp() throws Exception {
        ds = TestWarehouse.open(TestWarehouse.config(dir, Map.of()));
        repo = new IngestLogRepo(ds, MutableClock.at("2026-01-15T08:00", ZoneId.of("Europe/Oslo")));
    }

    @AfterEach
    void tearDown() {
        ds.close();
    }

    @Test
    void runMovesFromRunningToFinished() throws Exception {
        String runId = repo.startRun("weather_historic");
        assertEquals("RUNNING", TestWarehouse.string(ds, "SELECT status FROM _ingest_runs WHERE run_id = ?", runId));

        repo.finishRun(runId, false, "partitions failed: 3012");

        assertEquals("FAILED", TestWarehouse.string(ds, "SELECT status FROM _ingest_runs WHERE run_id = ?", runId));
        assertEquals("partitions failed: 3012",
                TestWarehouse.string(ds, "SELECT notes FROM _ingest_runs WHERE run_id = ?", runId));
        assertEquals(1, TestWarehouse.count(ds,
                "SELECT COUNT(*) FROM _ingest_runs WHERE finished_at IS NOT NULL AND run_id = ?", runId));
    }

    @Test
    void eventsKeepOptionalStatusAndLatency() throws Exception {
        String runId = repo.startRun("avalanche_warnings");
        repo.logEvent(runId, "NVE", "http://nve/3011", 200, 85L, null);
        repo.logEvent(runId, "NVE", "http://nve/3012", null, null, "connection refused");

        assertEquals(2, TestWarehouse.count(ds, "SELECT COUNT(*) FROM _ingest_events WHERE run_id = ?", runId));
        assertEquals(1, TestWarehouse.count(ds, "SELECT COUNT(*) FROM _ingest_events WHERE http_status IS NULL"));
        assertEquals("connection refused", TestWarehouse.string(ds,
                "SELECT error FROM _ingest_events WHERE endpoint = ?", "http://nve/3012"));
    }

    @Test
    void runTimesAreUtcWhateverTheDefaultZone() throws Exception {
        TimeZone previous = TimeZone.getDefault();
        String runId;
        try {
            TimeZone.setDefault(TimeZone.getTimeZone("America/New_York"));
            runId = repo.startRun("weather_forecast");
            repo.finishRun(runId, true, "rows=0");
        } finally {
            TimeZone.setDefault(previous);
        }

        // 08:00 in Oslo is 07:00 UTC
        assertEquals(1, TestWarehouse.count(ds, "SELECT COUNT(*) FROM _ingest_runs WHERE run_id = ? "
                + "AND started_at = TIMESTAMP '2026-01-15 07:00:00' AND finished_at = started_at", runId));
    }
}
