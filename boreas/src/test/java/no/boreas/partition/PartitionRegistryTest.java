package no.boreas.partition;

import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PartitionRegistryTest {
    @Test
    void listsAreSortedById() {
        PartitionRegistry registry = new PartitionRegistry();
        for (PartitionKind kind : PartitionKind.values()) {
            List<GeoPartition> list = registry.listPartitions(kind);
            assertFalse(list.isEmpty(), kind.name());
            assertEquals(list.stream().sorted(Comparator.comparing(GeoPartition::id)).toList(), list);
            list.forEach(p -> assertEquals(kind, p.kind()));
        }
    }

    @Test
    void avalancheRegionsCarryNamesAndValidBoxes() {
        List<GeoPartition> regions = new PartitionRegistry().listPartitions(PartitionKind.AVALANCHE_REGION);

        assertEquals(24, regions.size());
        for (GeoPartition r : regions) {
            assertNotNull(r.name(), r.id());
            assertTrue(r.northLat() > r.southLat(), r.id());
            assertTrue(r.eastLon() > r.westLon(), r.id());
        }
    }

    @Test
    void lookupById() {
        GeoPartition a = new GeoPartition("B", "b", PartitionKind.AVALANCHE_REGION, 61, 60, 11, 10);
        GeoPartition b = new GeoPartition("A", "a", PartitionKind.AVALANCHE_REGION, 62, 61, 12, 11);
        PartitionRegistry registry = new PartitionRegistry(List.of(a, b), List.of());

        assertEquals(List.of(b, a), registry.listPartitions(PartitionKind.AVALANCHE_REGION));
        assertEquals(a, registry.partition(PartitionKind.AVALANCHE_REGION, "B").orElseThrow());
        assertTrue(registry.partition(PartitionKind.WEATHER_GRID, "B").isEmpty());
        assertTrue(registry.listPartitions(PartitionKind.WEATHER_GRID).isEmpty());
    }

    @Test
    void referenceRowCarriesBoxAndCenter() {
        GeoPartition p = new GeoPartition("3011", "Tromsø", PartitionKind.AVALANCHE_REGION, 70.0, 69.0, 20.0, 18.0);

        var row = p.toReferenceRow("region_id");

        assertEquals("3011", row.get("region_id"));
        assertEquals("Tromsø", row.get("name"));
        assertEquals(69.5, (Double) row.get("center_lat"), 1e-9);
        assertEquals(19.0, (Double) row.get("center_lon"), 1e-9);
        assertEquals(70.0, row.get("north_lat"));
    }
}
