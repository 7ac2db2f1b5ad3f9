package no.boreas.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import no.boreas.config.AppConfig;
import no.boreas.db.IngestLogRepo;
import no.boreas.db.UpsertSink;
import no.boreas.db.WatermarkTracker;
import no.boreas.db.WriteMode;
import no.boreas.ingest.AvalancheWarningRecord;
import no.boreas.ingest.FetchWindow;
import no.boreas.ingest.RangeChunker;
import no.boreas.ingest.RecordNormalizer;
import no.boreas.nve.NveAvalancheClient;
import no.boreas.partition.GeoPartition;
import no.boreas.partition.PartitionKind;
import no.boreas.partition.PartitionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Avalanche danger levels per NVE region.
 *
 * <p>
 * Windows run from the region's watermark to {@code today + avalanche.lookaheadDays}.
 * The watermark follows the newest {@code valid_from} but is capped at now, so the
 * published look-ahead is fetched again on the next run and revisions replace it.
 * </p>
 */
public final class AvalancheWarningPipeline extends PartitionedPipeline {
    private static final Logger log = LoggerFactory.getLogger(AvalancheWarningPipeline.class);
    public static final String NAME = "avalanche_warnings";
    static final String TABLE = "avalanche_danger_levels";
    static final List<String> KEY = List.of("reg_id", "valid_from", "valid_to");

    private final AppConfig cfg;
    private final PartitionRegistry registry;
    private final NveAvalancheClient client;
    private final UpsertSink sink;
    private final WatermarkTracker watermarks;
    private final Clock clock;

    public AvalancheWarningPipeline(AppConfig cfg, PartitionRegistry registry, NveAvalancheClient client,
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
        return registry.listPartitions(PartitionKind.AVALANCHE_REGION);
    }

    @Override
    protected PartitionTask taskFor(GeoPartition region) {
        return new PartitionTask("avalanche_warning_" + region.id(), region, runId -> ingest(runId, region));
    }

    private long ingest(String runId, GeoPartition region) throws Exception {
        LocalDateTime cursor = watermarks.current(region.id(), NAME);
        LocalDate end = LocalDate.now(clock).plusDays(cfg.avalancheLookaheadDays());
        long rows = 0;

        for (FetchWindow w : RangeChunker.split(cursor.toLocalDate(), end, cfg.chunkDays())) {
            JsonNode warnings = fetchLogged(runId, NveAvalancheClient.SERVICE, client.warningsUrl(region.id(), w),
                    () -> client.warnings(region.id(), w));
            List<AvalancheWarningRecord> records = RecordNormalizer.normalizeWarnings(warnings, region,
                    clock.instant());
            List<LocalDateTime> validFrom = records.stream().map(AvalancheWarningRecord::validFrom).toList();

            rows += sink.load(TABLE, records.stream().map(AvalancheWarningRecord::toRow).toList(), KEY,
                    WriteMode.MERGE, tx -> watermarks.advance(tx, region.id(), NAME, validFrom));
        }

        log.info("Avalanche warnings {}: rows={} from={} to={}", region.id(), rows,
                WatermarkTracker.format(cursor), end);
        return rows;
    }
}
