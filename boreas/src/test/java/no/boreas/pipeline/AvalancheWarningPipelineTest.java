package no.boreas.pipeline;

import no.boreas.errors.PartitionFailuresException;
import no.boreas.support.FixtureUtils;
import no.boreas.support.StubUpstream;
import no.boreas.support.StubUpstream.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static no.boreas.pipeline.PipelineHarness.*;
import static org.junit.jupiter.api.Assertions.*;

class AvalancheWarningPipelineTest {
    private static final String PREFIX = "/AvalancheWarningByRegion/Simple/";

    @TempDir
    Path dir;

    private PipelineHarness h;

    @AfterEach
    void tearDown() {
        if (h != null)
            h.close();
    }

    private static Response warnings(StubUpstream.Request req) {
        String region = req.path().substring(PREFIX.length()).split("/")[0];
        return switch (region) {
            case "3011" -> Response.json(FixtureUtils.fixture("fixtures/nve-warnings.json"));
            case "3012" -> Response.json("[]");
            default -> new Response(404, "{\"Message\":\"unknown region\"}");
        };
    }

    @Test
    void fetchesThroughTheLookaheadAndCapsTheWatermark() throws Exception {
        StubUpstream stub = new StubUpstream().route(PREFIX, AvalancheWarningPipelineTest::warnings);
        h = new PipelineHarness(dir, stub, "2026-01-15T08:00", Map.of());

        PartitionFailuresException e = assertThrows(PartitionFailuresException.class,
                () -> h.avalanche().run("run-1"));
        assertEquals(List.of(R3.id()), e.failedPartitions());

        assertEquals(PREFIX + "3011/1/2026-01-10/2026-01-22", stub.requests().get(0).path());
        assertEquals(2, h.count("SELECT COUNT(*) FROM avalanche_danger_levels"));
        assertEquals(1, h.count("SELECT COUNT(*) FROM avalanche_danger_levels WHERE danger_level = 3"));
        assertEquals(2, h.count("SELECT COUNT(*) FROM avalanche_danger_levels WHERE next_warning_time IS NOT NULL"));

        // newest valid_from is 2026-01-16, one day ahead of now
        assertEquals(LocalDateTime.of(2026, 1, 15, 8, 0),
                h.watermarks.current(R1.id(), AvalancheWarningPipeline.NAME));
        assertEquals(h.cfg.ingestStartDate(), h.watermarks.current(R2.id(), AvalancheWarningPipeline.NAME));
    }

    @Test
    void lookaheadIsRefetchedAndRevisionsMergeInPlace() throws Exception {
        StubUpstream stub = new StubUpstream().route(PREFIX, AvalancheWarningPipelineTest::warnings);
        h = new PipelineHarness(dir, stub, "2026-01-15T08:00", Map.of("avalanche.lookaheadDays", "2"));
        assertThrows(PartitionFailuresException.class, () -> h.avalanche().run("run-1"));

        h.clock.setLocal("2026-01-16T08:00");
        assertThrows(PartitionFailuresException.class, () -> h.avalanche().run("run-2"));

        List<String> paths = stub.requests().stream().map(StubUpstream.Request::path)
                .filter(p -> p.startsWith(PREFIX + "3011/")).toList();
        assertEquals(List.of(PREFIX + "3011/1/2026-01-10/2026-01-17", PREFIX + "3011/1/2026-01-15/2026-01-18"),
                paths);
        assertEquals(2, h.count("SELECT COUNT(*) FROM avalanche_danger_levels"));
        assertEquals(LocalDateTime.of(2026, 1, 16, 0, 0),
                h.watermarks.current(R1.id(), AvalancheWarningPipeline.NAME));
    }

    @Test
    void tasksAreNamedPerRegion() throws Exception {
        h = new PipelineHarness(dir, new StubUpstream(), "2026-01-15T08:00", Map.of());

        assertEquals(List.of("avalanche_warning_3011", "avalanche_warning_3012", "avalanche_warning_3013"),
                List.copyOf(h.avalanche().tasks().keySet()));
    }
}
