package no.boreas.partition;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named region or generated grid cell: the geospatial key of one fetch/load cycle.
 *
 * <p>
 * The center point is the midpoint of the bounding box and is what upstream
 * point APIs are queried with.
 * </p>
 */
public record GeoPartition(
        String id,
        String name, // nullable for grid cells
        PartitionKind kind,
        double northLat,
        double southLat,
        double eastLon,
        double westLon) {

    public GeoPartition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
    }

    public double centerLat() {
        return (northLat + southLat) / 2.0;
    }

    public double centerLon() {
        return (eastLon + westLon) / 2.0;
    }

    /**
     * Reference-table row for this partition, keyed by the column {@code idColumn}.
     */
    public Map<String, Object> toReferenceRow(String idColumn) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(idColumn, id);
        row.put("name", name);
        row.put("north_lat", northLat);
        row.put("south_lat", southLat);
        row.put("east_lon", eastLon);
        row.put("west_lon", westLon);
        row.put("center_lat", centerLat());
        row.put("center_lon", centerLon());
        return row;
    }
}
