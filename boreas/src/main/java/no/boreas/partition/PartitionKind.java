package no.boreas.partition;

import java.util.Arrays;
import java.util.Locale;

/**
 * The two families of geospatial partitions the engine ingests for.
 */
public enum PartitionKind {
    AVALANCHE_REGION("regions"),
    WEATHER_GRID("grids");

    private final String configName;

    PartitionKind(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    /**
     * Maps the {@code weather.partitionKind} value ("regions" or "grids").
     */
    public static PartitionKind fromConfig(String value) {
        String v = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (PartitionKind k : values()) {
            if (k.configName.equals(v))
                return k;
        }
        throw new IllegalArgumentException("unknown partition kind '" + value + "', expected one of "
                + Arrays.stream(values()).map(PartitionKind::configName).toList());
    }
}
