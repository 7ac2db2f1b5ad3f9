package no.boreas.ingest;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One hourly weather observation (or forecast step) for one partition.
 * Warehouse key is {@code (time, partition_id)}.
 */
public record WeatherRecord(
        String partitionId,
        String partitionName,
        LocalDateTime time,
        Map<String, Double> metrics,
        Instant ingestedAt) {

    public WeatherRecord {
        metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("time", time);
        row.put("partition_id", partitionId);
        row.put("partition_name", partitionName);
        row.putAll(metrics);
        row.put("loaded_at", ingestedAt);
        return row;
    }
}
