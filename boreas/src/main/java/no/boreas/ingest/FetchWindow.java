package no.boreas.ingest;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Inclusive date range requested from an upstream API in one call.
 */
public record FetchWindow(LocalDate start, LocalDate end) {
    public FetchWindow {
        if (end.isBefore(start))
            throw new IllegalArgumentException("window end " + end + " is before start " + start);
    }

    /**
     * Number of calendar days covered, both ends included.
     */
    public long days() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
