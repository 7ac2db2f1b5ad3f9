package no.boreas.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import no.boreas.config.AppConfig;
import no.boreas.db.IngestLogRepo;
import no.boreas.db.UpsertSink;
import no.boreas.db.WatermarkTracker;
import no.boreas.http.FetchClient;
import no.boreas.metrics.UpstreamCallMetrics;
import no.boreas.nve.NveAvalancheClient;
import no.boreas.openmeteo.OpenMeteoClient;
import no.boreas.partition.PartitionRegistry;

import java.time.Clock;
import java.util.List;

/**
 * Wires the standard pipelines in their fixed order.
 */
public final class Pipelines {
    private Pipelines() {
    }

    /**
     * Builds an orchestrator over reference data, historic weather, forecast and
     * avalanche warnings. The warehouse schema must already exist.
     */
    public static PipelineOrchestrator standard(AppConfig cfg, HikariDataSource ds, PartitionRegistry registry,
            ObjectMapper om, UpstreamCallMetrics metrics, Clock clock) {
        UpsertSink sink = new UpsertSink(ds);
        WatermarkTracker watermarks = new WatermarkTracker(ds, cfg.ingestStartDate(), clock);
        IngestLogRepo logRepo = new IngestLogRepo(ds, clock);
        PartitionRunner runner = new PartitionRunner(cfg.parallelism());

        OpenMeteoClient openMeteo = new OpenMeteoClient(cfg,
                new FetchClient(OpenMeteoClient.SERVICE, om, metrics));
        NveAvalancheClient nve = new NveAvalancheClient(cfg,
                new FetchClient(NveAvalancheClient.SERVICE, om, metrics));

        List<Pipeline> pipelines = List.of(
                new ReferenceDataPipeline(registry, sink),
                new WeatherHistoricPipeline(cfg, registry, openMeteo, sink, watermarks, logRepo, runner, clock),
                new WeatherForecastPipeline(cfg, registry, openMeteo, sink, logRepo, runner, clock),
                new AvalancheWarningPipeline(cfg, registry, nve, sink, watermarks, logRepo, runner, clock));
        return new PipelineOrchestrator(pipelines, logRepo, metrics);
    }
}
