package no.boreas.partition;

import java.util.List;

/**
 * Hand-tuned approximation of mainland Norway as longitude windows per latitude band.
 */
public final class NorwayOutline {
    private NorwayOutline() {
    }

    /**
     * One latitude band [minLat, maxLat) and its inclusive longitude window.
     */
    record Band(double minLat, double maxLat, double minLon, double maxLon) {
    }

    static final List<Band> BANDS = List.of(
            new Band(58.0, 59.0, 5.5, 10.0),
            new Band(59.0, 60.0, 5.0, 11.8),
            new Band(60.0, 61.0, 4.5, 12.5),
            new Band(61.0, 62.0, 4.5, 12.3),
            new Band(62.0, 63.0, 5.0, 12.3),
            new Band(63.0, 64.0, 7.5, 13.0),
            new Band(64.0, 65.0, 9.5, 14.5),
            new Band(65.0, 66.0, 11.5, 16.0),
            new Band(66.0, 67.0, 12.5, 16.5),
            new Band(67.0, 68.0, 13.0, 18.5),
            new Band(68.0, 69.0, 13.5, 21.0),
            new Band(69.0, 70.0, 15.5, 26.0),
            new Band(70.0, 71.5, 18.5, 31.0));

    /**
     * True when the point lies in a band and inside that band's longitude window.
     */
    public static boolean contains(double lat, double lon) {
        for (Band b : BANDS) {
            if (lat >= b.minLat() && lat < b.maxLat()) {
                return lon >= b.minLon() && lon <= b.maxLon();
            }
        }
        return false;
    }
}
