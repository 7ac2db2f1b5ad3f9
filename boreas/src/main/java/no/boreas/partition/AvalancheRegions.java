package no.boreas.partition;

import java.util.List;

/**
 * Static list of the NVE avalanche forecast regions the engine follows.
 * Boxes are approximate (north/west corner, south/east corner).
 */
final class AvalancheRegions {
    private AvalancheRegions() {
    }

    static final List<GeoPartition> ALL = List.of(
            // Svalbard
            region("3003", "Nordenskiöld Land", 78.2, 14.5, 77.6, 17.0),
            // Finnmark
            region("3006", "Finnmarkskysten", 71.2, 23.0, 70.4, 31.0),
            region("3007", "Vest-Finnmark", 71.0, 20.0, 68.8, 24.0),
            // Troms
            region("3009", "Nord-Troms", 70.8, 18.5, 69.8, 24.0),
            region("3010", "Lyngen", 69.9, 19.5, 69.4, 21.0),
            region("3011", "Tromsø", 69.8, 17.5, 69.2, 20.5),
            region("3012", "Sør-Troms", 69.5, 17.0, 68.7, 21.0),
            region("3013", "Indre Troms", 69.2, 18.0, 68.5, 22.0),
            // Nordland
            region("3014", "Lofoten og Vesterålen", 68.9, 12.0, 67.8, 15.5),
            region("3015", "Ofoten", 68.6, 15.5, 67.8, 18.5),
            region("3016", "Salten", 67.8, 13.5, 66.8, 16.5),
            region("3017", "Svartisen", 67.0, 13.0, 66.2, 15.5),
            region("3018", "Helgeland", 66.5, 12.0, 65.2, 15.0),
            // Trøndelag / Møre og Romsdal
            region("3022", "Trollheimen", 62.97, 8.68, 62.59, 9.70),
            region("3023", "Romsdal", 62.8, 6.5, 62.0, 8.5),
            region("3024", "Sunnmøre", 62.5, 5.5, 61.7, 8.0),
            // Vestland / Innlandet / Viken
            region("3026", "Indre Fjordane", 61.8, 5.0, 60.8, 8.5),
            region("3028", "Jotunheimen", 61.8, 7.5, 61.2, 9.0),
            region("3029", "Indre Sogn", 61.4, 6.5, 60.6, 8.5),
            region("3031", "Voss", 60.8, 6.0, 60.2, 7.5),
            region("3032", "Hallingdal", 61.0, 7.5, 60.2, 10.0),
            region("3034", "Hardanger", 60.8, 6.0, 59.8, 8.0),
            // Telemark / Rogaland
            region("3035", "Vest-Telemark", 59.8, 7.0, 59.0, 9.0),
            region("3037", "Heiane", 59.9, 5.0, 59.2, 6.5));

    private static GeoPartition region(String id, String name, double northLat, double westLon,
            double southLat, double eastLon) {
        return new GeoPartition(id, name, PartitionKind.AVALANCHE_REGION, northLat, southLat, eastLon, westLon);
    }
}
