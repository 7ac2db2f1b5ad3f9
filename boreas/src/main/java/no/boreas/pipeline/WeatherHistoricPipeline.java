package no.boreas.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import no.boreas.config.AppConfig;
import no.boreas.db.IngestLogRepo;
import no.boreas.db.UpsertSink;
import no.boreas.db.WatermarkTracker;
import no.boreas.db.WriteMode;
import no.boreas.ingest.FetchWindow;
import no.boreas.ingest.RangeChunker;
import no.boreas.ingest.RecordNormalizer;
import no.boreas.ingest.WeatherRecord;
import no.boreas.openmeteo.OpenMeteoClient;
import no.boreas.partition.GeoPartition;
import no.boreas.partition.PartitionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Incremental hourly weather history per partition from the Open-Meteo archive.
 *
 * <p>
 * Each partition resumes at its watermark and walks forward to today in
 * {@code ingest.chunkDays} windows. A window's rows and the advanced watermark
 * commit together, so a failure in a later window keeps the progress of the
 * earlier ones.
 * </p>
 */
public final class WeatherHistoricPipeline extends PartitionedPipeline {
    private static final Logger log = LoggerFactory.getLogger(WeatherHistoricPipeline.class);
    public static final String NAME = "weather_historic";
    static final String TABLE = "weather_historic";
    static final List<String> KEY = List.of("time", "partition_id");

    private final AppConfig cfg;
    private final PartitionRegistry registry;
    private final OpenMeteoClient client;
    private final UpsertSink sink;
    private final WatermarkTracker watermarks;
    private final Clock clock;

    public WeatherHistoricPipeline(AppConfig cfg, PartitionRegistry registry, OpenMeteoClient client,
            UpsertSink sink, WatermarkTracker watermarks, IngestLogRepo logRepo, PartitionRunner runner,
            Clock clock) {
        super(runner, logRepo);
        this.cfg = cfg;
        this.registry = registry;
        this.client = client;
        this.sink = sink;
        this.watermarks = watermarks;
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
        return new PartitionTask("historic_" + partition.id(), partition, runId -> ingest(runId, partition));
    }

    private long ingest(String runId, GeoPartition p) throws Exception {
        LocalDateTime cursor = watermarks.current(p.id(), NAME);
        LocalDate today = LocalDate.now(clock);
        long rows = 0;
        int windows = 0;

        for (FetchWindow w : RangeChunker.split(cursor.toLocalDate(), today, cfg.chunkDays())) {
            JsonNode hourly = fetchLogged(runId, OpenMeteoClient.SERVICE, client.archiveUrl() + " " + w,
                    () -> client.archive(p.centerLat(), p.centerLon(), w));
            List<WeatherRecord> records = RecordNormalizer.normalizeHourly(hourly, p, clock.instant());
            List<LocalDateTime> times = records.stream().map(WeatherRecord::time).toList();

            rows += sink.load(TABLE, records.stream().map(WeatherRecord::toRow).toList(), KEY, WriteMode.MERGE,
                    tx -> watermarks.advance(tx, p.id(), NAME, times));
            windows++;
            log.debug("{} window {} -> {} rows", p.id(), w, records.size());
        }

        log.info("Historic weather {}: windows={} rows={} from={}", p.id(), windows, rows,
                WatermarkTracker.format(cursor));
        return rows;
    }
}
