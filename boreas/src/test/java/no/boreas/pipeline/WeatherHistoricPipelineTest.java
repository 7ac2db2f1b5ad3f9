package no.boreas.pipeline;

import no.boreas.errors.NetworkException;
import no.boreas.errors.PartitionFailuresException;
import no.boreas.support.StubUpstream;
import no.boreas.support.StubUpstream.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static no.boreas.pipeline.PipelineHarness.*;
import static org.junit.jupiter.api.Assertions.*;

class WeatherHistoricPipelineTest {
    private static final String FAILING_LAT = "62.5000"; // center of R2

    @TempDir
    Path dir;

    private PipelineHarness h;

    @AfterEach
    void tearDown() {
        if (h != null)
            h.close();
    }

    private static Response archive(StubUpstream.Request req) {
        String start = req.param("start_date");
        String end = req.param("end_date");
        return Response.json(hourly(start + "T00:00", start + "T12:00", end + "T23:00"));
    }

    @Test
    void failingPartitionDoesNotBlockTheOthers() throws Exception {
        StubUpstream stub = new StubUpstream().route("/archive", req -> FAILING_LAT.equals(req.param("latitude"))
                ? new Response(500, "{\"reason\":\"internal\"}")
                : archive(req));
        h = new PipelineHarness(dir, stub, "2026-01-12T12:00", Map.of());

        PartitionFailuresException e = assertThrows(PartitionFailuresException.class, () -> h.historic().run("run-1"));

        assertEquals(List.of(R2.id()), e.failedPartitions());
        NetworkException cause = assertInstanceOf(NetworkException.class, e.getCause());
        assertEquals(500, cause.httpStatus());

        assertEquals(3, h.count("SELECT COUNT(*) FROM weather_historic WHERE partition_id = ?", R1.id()));
        assertEquals(0, h.count("SELECT COUNT(*) FROM weather_historic WHERE partition_id = ?", R2.id()));
        assertEquals(3, h.count("SELECT COUNT(*) FROM weather_historic WHERE partition_id = ?", R3.id()));

        // newest loaded hour is 2026-01-12T23:00, capped at now
        LocalDateTime now = LocalDateTime.of(2026, 1, 12, 12, 0);
        assertEquals(now, h.watermarks.current(R1.id(), WeatherHistoricPipeline.NAME));
        assertEquals(now, h.watermarks.current(R3.id(), WeatherHistoricPipeline.NAME));
        assertEquals(h.cfg.ingestStartDate(), h.watermarks.current(R2.id(), WeatherHistoricPipeline.NAME));

        assertEquals(3, h.count("SELECT COUNT(*) FROM _ingest_events WHERE run_id = 'run-1'"));
        assertEquals(1, h.count("SELECT COUNT(*) FROM _ingest_events WHERE http_status = 500"));
    }

    @Test
    void nextRunResumesEachPartitionFromItsOwnWatermark() throws Exception {
        AtomicBoolean r2Down = new AtomicBoolean(true);
        StubUpstream stub = new StubUpstream().route("/archive",
                req -> r2Down.get() && FAILING_LAT.equals(req.param("latitude"))
                        ? new Response(503, "{}")
                        : archive(req));
        h = new PipelineHarness(dir, stub, "2026-01-12T12:00", Map.of());
        assertThrows(PartitionFailuresException.class, () -> h.historic().run("run-1"));

        r2Down.set(false);
        h.clock.setLocal("2026-01-14T09:00");
        long rows = h.historic().run("run-2");

        List<StubUpstream.Request> second = stub.requests().subList(3, 6);
        assertEquals("2026-01-12", startDateFor(second, "60.5000"));
        assertEquals("2026-01-10", startDateFor(second, FAILING_LAT));
        assertEquals("2026-01-12", startDateFor(second, "64.5000"));
        second.forEach(r -> assertEquals("2026-01-14", r.param("end_date")));
        assertEquals(9, rows);

        assertEquals(h.count("SELECT COUNT(*) FROM (SELECT DISTINCT \"time\", partition_id FROM weather_historic)"),
                h.count("SELECT COUNT(*) FROM weather_historic"));
        assertEquals(LocalDateTime.of(2026, 1, 14, 9, 0), h.watermarks.current(R2.id(), WeatherHistoricPipeline.NAME));
    }

    @Test
    void laterWindowFailureKeepsEarlierWindowProgress() throws Exception {
        StubUpstream stub = new StubUpstream().route("/archive",
                req -> "60.5000".equals(req.param("latitude")) && "2026-01-12".equals(req.param("start_date"))
                        ? new Response(500, "{}")
                        : archive(req));
        h = new PipelineHarness(dir, stub, "2026-01-15T10:00", Map.of("ingest.chunkDays", "2"));

        PartitionFailuresException e = assertThrows(PartitionFailuresException.class, () -> h.historic().run("run-1"));

        assertEquals(List.of(R1.id()), e.failedPartitions());
        assertEquals(LocalDateTime.of(2026, 1, 11, 23, 0), h.watermarks.current(R1.id(), WeatherHistoricPipeline.NAME));
        assertEquals(3, h.count("SELECT COUNT(*) FROM weather_historic WHERE partition_id = ?", R1.id()));
        // windows 10-11, 12-13, 14-15 for the healthy partitions
        assertEquals(9, h.count("SELECT COUNT(*) FROM weather_historic WHERE partition_id = ?", R3.id()));
        assertEquals(LocalDateTime.of(2026, 1, 15, 10, 0), h.watermarks.current(R3.id(), WeatherHistoricPipeline.NAME));
    }

    @Test
    void malformedPayloadFailsOnlyThatPartition() throws Exception {
        StubUpstream stub = new StubUpstream().route("/archive", req -> FAILING_LAT.equals(req.param("latitude"))
                ? Response.json("{\"hourly\":{\"time\":[\"2026-01-10T00:00\"],\"temperature_2m\":[1.0,2.0]}}")
                : archive(req));
        h = new PipelineHarness(dir, stub, "2026-01-12T12:00", Map.of("ingest.parallelism", "3"));

        PartitionFailuresException e = assertThrows(PartitionFailuresException.class, () -> h.historic().run("run-1"));

        assertEquals(List.of(R2.id()), e.failedPartitions());
        assertEquals(6, h.count("SELECT COUNT(*) FROM weather_historic"));
    }

    @Test
    void tasksAreNamedPerPartitionInIdOrder() throws Exception {
        h = new PipelineHarness(dir, new StubUpstream(), "2026-01-12T12:00", Map.of());

        assertEquals(List.of("historic_3011", "historic_3012", "historic_3013"),
                List.copyOf(h.historic().tasks().keySet()));
    }

    private static String startDateFor(List<StubUpstream.Request> requests, String latitude) {
        return requests.stream()
                .filter(r -> latitude.equals(r.param("latitude")))
                .findFirst()
                .orElseThrow()
                .param("start_date");
    }
}
