package no.boreas.ingest;

import java.time.LocalDate;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Splits an inclusive date range into contiguous windows of at most {@code chunkDays}
 * days, so a long backfill never exceeds an upstream's range limit per request.
 */
public final class RangeChunker {
    private RangeChunker() {
    }

    /**
     * Returns a lazy sequence of windows covering {@code [start, end]} in ascending
     * order. Each call to {@code iterator()} starts over. Empty when start is after end.
     */
    public static Iterable<FetchWindow> split(LocalDate start, LocalDate end, int chunkDays) {
        if (chunkDays < 1)
            throw new IllegalArgumentException("chunkDays must be >= 1, got " + chunkDays);
        return () -> new WindowIterator(start, end, chunkDays);
    }

    private static final class WindowIterator implements Iterator<FetchWindow> {
        private final LocalDate end;
        private final int chunkDays;
        private LocalDate next;

        WindowIterator(LocalDate start, LocalDate end, int chunkDays) {
            this.end = end;
            this.chunkDays = chunkDays;
            this.next = start;
        }

        @Override
        public boolean hasNext() {
            return !next.isAfter(end);
        }

        @Override
        public FetchWindow next() {
            if (!hasNext())
                throw new NoSuchElementException();
            LocalDate chunkEnd = next.plusDays(chunkDays - 1L);
            if (chunkEnd.isAfter(end))
                chunkEnd = end;
            FetchWindow w = new FetchWindow(next, chunkEnd);
            next = chunkEnd.plusDays(1);
            return w;
        }
    }
}
