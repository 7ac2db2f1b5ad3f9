package no.boreas.nve;

import com.fasterxml.jackson.databind.ObjectMapper;
import no.boreas.config.AppConfig;
import no.boreas.errors.ApiFormatException;
import no.boreas.http.FetchClient;
import no.boreas.ingest.FetchWindow;
import no.boreas.metrics.UpstreamCallMetrics;
import no.boreas.support.FixtureUtils;
import no.boreas.support.StubUpstream;
import no.boreas.support.StubUpstream.Response;
import no.boreas.support.TestWarehouse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NveAvalancheClientTest {
    @TempDir
    Path dir;

    @Test
    void warningsPathEncodesRegionLanguageAndWindow() throws Exception {
        try (StubUpstream stub = new StubUpstream()
                .route("/AvalancheWarningByRegion/Simple/", req -> Response.json(
                        FixtureUtils.fixture("fixtures/nve-warnings.json")))) {
            AppConfig cfg = TestWarehouse.config(dir, Map.of(
                    "avalanche.apiBaseUrl", stub.baseUrl() + "/",
                    "avalanche.languageKey", "2"));
            NveAvalancheClient client = new NveAvalancheClient(cfg,
                    new FetchClient(NveAvalancheClient.SERVICE, new ObjectMapper(), new UpstreamCallMetrics()));

            var warnings = client.warnings("3011",
                    new FetchWindow(LocalDate.of(2026, 1, 10), LocalDate.of(2026, 1, 22)));

            assertEquals(2, warnings.size());
            assertEquals("/AvalancheWarningByRegion/Simple/3011/2/2026-01-10/2026-01-22",
                    stub.requests().get(0).path());
        }
    }

    @Test
    void objectPayloadIsFormatError() throws Exception {
        try (StubUpstream stub = new StubUpstream()
                .route("/AvalancheWarningByRegion/Simple/", req -> Response.json("{\"Message\":\"bad region\"}"))) {
            AppConfig cfg = TestWarehouse.config(dir, stub.baseUrl());
            NveAvalancheClient client = new NveAvalancheClient(cfg,
                    new FetchClient(NveAvalancheClient.SERVICE, new ObjectMapper(), new UpstreamCallMetrics()));

            assertThrows(ApiFormatException.class, () -> client.warnings("9999",
                    new FetchWindow(LocalDate.of(2026, 1, 10), LocalDate.of(2026, 1, 10))));
        }
    }
}
