package no.boreas.partition;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WeatherGridGeneratorTest {
    @Test
    void everyCellCenterLiesInsideTheOutline() {
        List<GeoPartition> cells = WeatherGridGenerator.generate();

        assertFalse(cells.isEmpty());
        for (GeoPartition c : cells) {
            assertTrue(NorwayOutline.contains(c.centerLat(), c.centerLon()), c.id());
            assertEquals(PartitionKind.WEATHER_GRID, c.kind());
            assertNull(c.name());
        }
    }

    @Test
    void idsAreUniqueAndFormatted() {
        List<GeoPartition> cells = WeatherGridGenerator.generate();
        Set<String> ids = new HashSet<>();
        for (GeoPartition c : cells) {
            assertTrue(c.id().matches("WG_\\d{3}_\\d{3}"), c.id());
            assertTrue(ids.add(c.id()), "duplicate " + c.id());
        }
    }

    @Test
    void cellsAreAboutOneHundredKilometresTall() {
        double latStep = 100.0 / 111.0;
        for (GeoPartition c : WeatherGridGenerator.generate()) {
            assertEquals(latStep, c.northLat() - c.southLat(), 1e-9, c.id());
            assertTrue(c.eastLon() > c.westLon(), c.id());
            assertTrue(c.southLat() >= WeatherGridGenerator.MIN_LAT && c.southLat() < WeatherGridGenerator.MAX_LAT);
        }
    }

    @Test
    void longitudeStepWidensTowardsThePole() {
        List<GeoPartition> cells = WeatherGridGenerator.generate();
        GeoPartition south = cells.stream().filter(c -> c.id().startsWith("WG_001_")).findFirst().orElseThrow();
        GeoPartition north = cells.stream().max((a, b) -> Double.compare(a.southLat(), b.southLat())).orElseThrow();

        assertTrue(north.eastLon() - north.westLon() > south.eastLon() - south.westLon());
    }

    @Test
    void generationIsDeterministic() {
        assertEquals(WeatherGridGenerator.generate(), WeatherGridGenerator.generate());
    }
}
