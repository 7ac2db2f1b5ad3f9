package no.boreas.pipeline;

import no.boreas.support.StubUpstream;
import no.boreas.support.StubUpstream.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static no.boreas.pipeline.PipelineHarness.hourly;
import static org.junit.jupiter.api.Assertions.assertEquals;

class WeatherForecastPipelineTest {
    @TempDir
    Path dir;

    private PipelineHarness h;

    @AfterEach
    void tearDown() {
        if (h != null)
            h.close();
    }

    @Test
    void rerunMergesOverThePreviousForecast() throws Exception {
        StubUpstream stub = new StubUpstream().route("/forecast",
                req -> Response.json(hourly("2026-01-15T00:00", "2026-01-15T01:00", "2026-01-15T02:00")));
        h = new PipelineHarness(dir, stub, "2026-01-15T00:30", Map.of());

        assertEquals(9, h.forecast().run("run-1"));
        assertEquals(9, h.forecast().run("run-2"));

        assertEquals(9, h.count("SELECT COUNT(*) FROM weather_forecast"));
        assertEquals(0, h.count("SELECT COUNT(*) FROM _ingest_state"));
        assertEquals(6, h.count("SELECT COUNT(*) FROM _ingest_events WHERE source = 'OPEN_METEO'"));
    }
}
