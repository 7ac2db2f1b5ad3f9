package no.boreas.pipeline;

import no.boreas.db.UpsertSink;
import no.boreas.db.WriteMode;
import no.boreas.partition.GeoPartition;
import no.boreas.partition.PartitionKind;
import no.boreas.partition.PartitionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Replaces the avalanche region and weather grid reference tables from the
 * partition registry.
 */
public final class ReferenceDataPipeline implements Pipeline {
    private static final Logger log = LoggerFactory.getLogger(ReferenceDataPipeline.class);
    public static final String NAME = "reference_data";
    static final String REGIONS_TABLE = "avalanche_regions";
    static final String GRIDS_TABLE = "weather_grids";

    private final PartitionRegistry registry;
    private final UpsertSink sink;

    public ReferenceDataPipeline(PartitionRegistry registry, UpsertSink sink) {
        this.registry = registry;
        this.sink = sink;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public long run(String runId) throws Exception {
        int regions = replace(REGIONS_TABLE, "region_id", registry.listPartitions(PartitionKind.AVALANCHE_REGION));
        int grids = replace(GRIDS_TABLE, "grid_id", registry.listPartitions(PartitionKind.WEATHER_GRID));
        log.info("Reference data loaded: {}={} {}={}", REGIONS_TABLE, regions, GRIDS_TABLE, grids);
        return regions + grids;
    }

    private int replace(String table, String idColumn, List<GeoPartition> partitions) throws Exception {
        List<Map<String, Object>> rows = partitions.stream().map(p -> p.toReferenceRow(idColumn)).toList();
        return sink.load(table, rows, List.of(idColumn), WriteMode.REPLACE);
    }
}
