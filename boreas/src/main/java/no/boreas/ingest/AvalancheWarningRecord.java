package no.boreas.ingest;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One published avalanche danger assessment for a region and validity window.
 * Warehouse key is {@code (reg_id, valid_from, valid_to)}.
 *
 * <p>
 * {@code extras} holds any further scalar fields the publisher sent, already
 * snake_cased; they become additional columns.
 * </p>
 */
public record AvalancheWarningRecord(
        long regId,
        String regionId,
        String regionName,
        LocalDateTime validFrom,
        LocalDateTime validTo,
        int dangerLevel,
        String mainText,
        LocalDateTime publishTime,
        Instant ingestedAt,
        Map<String, Object> extras) {

    public AvalancheWarningRecord {
        extras = Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("reg_id", regId);
        row.put("region_id", regionId);
        row.put("region_name", regionName);
        row.put("valid_from", validFrom);
        row.put("valid_to", validTo);
        row.put("danger_level", (long) dangerLevel);
        row.put("main_text", mainText);
        row.put("publish_time", publishTime);
        extras.forEach(row::putIfAbsent);
        row.put("loaded_at", ingestedAt);
        return row;
    }
}
