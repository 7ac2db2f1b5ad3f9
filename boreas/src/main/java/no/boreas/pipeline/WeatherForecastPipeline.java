package no.boreas.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import no.boreas.config.AppConfig;
import no.boreas.db.IngestLogRepo;
import no.boreas.db.UpsertSink;
import no.boreas.db.WriteMode;
import no.boreas.ingest.RecordNormalizer;
import no.boreas.ingest.WeatherRecord;
import no.boreas.openmeteo.OpenMeteoClient;
import no.boreas.partition.GeoPartition;
import no.boreas.partition.PartitionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Hourly forecast per partition. The forecast endpoint takes no date range, so
 * every run refetches the whole horizon and merges it over the previous one.
 */
public final class WeatherForecastPipeline extends PartitionedPipeline {
    private static final Logger log = LoggerFactory.getLogger(WeatherForecastPipeline.class);
    public static final String NAME = "weather_forecast";
    static final String TABLE = "weather_forecast";

    private final AppConfig cfg;
    private final PartitionRegistry registry;
    private final OpenMeteoClient client;
    private final UpsertSink sink;
    private final Clock clock;

    public WeatherForecastPipeline(AppConfig cfg, PartitionRegistry registry, OpenMeteoClient client,
            UpsertSink sink, IngestLogRepo logRepo, PartitionRunner runner, Clock clock) {
        super(runner, logRepo);
        this.cfg = cfg;
        this.registry = registry;
        this.client = client;
        this.sink = sink;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected List<GeoPartition> partitions() {
        return registry.listPartitions(cfg.weatherPartitionKind());
    }

    @Override
    protected PartitionTask taskFor(GeoPartition partition) {
        return new PartitionTask("forecast_" + partition.id(), partition, runId -> ingest(runId, partition));
    }

    private long ingest(String runId, GeoPartition p) throws Exception {
        JsonNode hourly = fetchLogged(runId, OpenMeteoClient.SERVICE, client.forecastUrl(),
                () -> client.forecast(p.centerLat(), p.centerLon()));
        List<WeatherRecord> records = RecordNormalizer.normalizeHourly(hourly, p, clock.instant());
        int rows = sink.load(TABLE, records.stream().map(WeatherRecord::toRow).toList(),
                WeatherHistoricPipeline.KEY, WriteMode.MERGE);
        log.info("Forecast {}: rows={}", p.id(), rows);
        return rows;
    }
}
