package no.boreas.partition;

import java.util.ArrayList;
import java.util.List;

/**
 * Generates roughly 100 x 100 km weather grid cells covering Norway.
 *
 * <p>
 * Latitude steps by a fixed {@code 100/111} degrees. Within each row the longitude
 * step widens with latitude to correct for meridian convergence:
 * {@code lonStep = 100 / (111 * cos(lat + latStep / 2))}. Only cells whose center
 * falls inside {@link NorwayOutline} are kept. Pure: the same bounds always yield
 * the same cells.
 * </p>
 */
public final class WeatherGridGenerator {
    static final double MIN_LAT = 58.0;
    static final double MAX_LAT = 71.0;
    static final double MIN_LON = 4.5;
    static final double MAX_LON = 31.0;
    static final double CELL_KM = 100.0;
    static final double KM_PER_DEGREE = 111.0;

    private WeatherGridGenerator() {
    }

    public static List<GeoPartition> generate() {
        List<GeoPartition> cells = new ArrayList<>();
        double latStep = CELL_KM / KM_PER_DEGREE;

        int row = 1;
        for (double south = MIN_LAT; south < MAX_LAT; south = MIN_LAT + row * latStep, row++) {
            double north = south + latStep;
            double lonStep = CELL_KM / (KM_PER_DEGREE * Math.cos(Math.toRadians(south + latStep / 2)));

            int col = 1;
            for (double west = MIN_LON; west < MAX_LON; west = MIN_LON + col * lonStep, col++) {
                double east = west + lonStep;
                GeoPartition cell = new GeoPartition(
                        String.format("WG_%03d_%03d", row, col),
                        null,
                        PartitionKind.WEATHER_GRID,
                        north, south, east, west);
                if (NorwayOutline.contains(cell.centerLat(), cell.centerLon())) {
                    cells.add(cell);
                }
            }
        }
        return cells;
    }
}
