package no.boreas.partition;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Enumerates the fixed partitions of each kind, sorted by id.
 *
 * <p>
 * Grid cells are generated once per registry instance. Ordering is stable across
 * runs so task naming and fan-out are reproducible.
 * </p>
 */
public final class PartitionRegistry {
    private final Map<PartitionKind, List<GeoPartition>> byKind = new EnumMap<>(PartitionKind.class);

    public PartitionRegistry() {
        this(AvalancheRegions.ALL, WeatherGridGenerator.generate());
    }

    public PartitionRegistry(List<GeoPartition> regions, List<GeoPartition> grids) {
        byKind.put(PartitionKind.AVALANCHE_REGION, sorted(regions));
        byKind.put(PartitionKind.WEATHER_GRID, sorted(grids));
    }

    public List<GeoPartition> listPartitions(PartitionKind kind) {
        return byKind.getOrDefault(kind, List.of());
    }

    public Optional<GeoPartition> partition(PartitionKind kind, String id) {
        return listPartitions(kind).stream().filter(p -> p.id().equals(id)).findFirst();
    }

    private static List<GeoPartition> sorted(List<GeoPartition> in) {
        return in.stream().sorted(Comparator.comparing(GeoPartition::id)).toList();
    }
}
