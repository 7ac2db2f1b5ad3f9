package no.boreas.db;

import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Collections;

/**
 * Owns the incremental cursor of every (partition, resource) pair.
 *
 * <p>
 * A cursor starts at the configured initial value on first access and only moves
 * forward, and never past the present: {@code next = max(current, min(maxLoaded, now))}.
 * The update is written through the loading transaction's connection so data and
 * cursor commit together.
 * </p>
 */
public class WatermarkTracker {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(WatermarkTracker.class);
    static final DateTimeFormatter CURSOR_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm");

    private final HikariDataSource ds;
    private final LocalDateTime initialValue;
    private final Clock clock;

    public WatermarkTracker(HikariDataSource ds, LocalDateTime initialValue, Clock clock) {
        this.ds = ds;
        this.initialValue = initialValue.truncatedTo(ChronoUnit.MINUTES);
        this.clock = clock;
    }

    /**
     * Returns the cursor, initializing it on first access.
     */
    public LocalDateTime current(String partitionId, String resource) throws SQLException {
        try (Connection c = ds.getConnection()) {
            LocalDateTime v = read(c, partitionId, resource);
            if (v != null)
                return v;
            write(c, partitionId, resource, initialValue, false);
            log.info("Initialized watermark {}/{} at {}", partitionId, resource, format(initialValue));
            return initialValue;
        }
    }

    /**
     * Advances the cursor from the timestamps loaded in this cycle. Leaves it
     * untouched when nothing was loaded. Returns the value now in effect.
     */
    public LocalDateTime advance(Connection tx, String partitionId, String resource,
            Collection<LocalDateTime> loaded) throws SQLException {
        LocalDateTime current = read(tx, partitionId, resource);
        boolean exists = current != null;
        if (!exists)
            current = initialValue;
        if (loaded.isEmpty())
            return current;

        LocalDateTime next = nextValue(current, Collections.max(loaded), now());
        if (!next.equals(current) || !exists) {
            write(tx, partitionId, resource, next, exists);
            log.debug("Watermark {}/{} {} -> {}", partitionId, resource, format(current), format(next));
        }
        return next;
    }

    /**
     * Present time in the configured zone, minute precision.
     */
    public LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MINUTES);
    }

    /**
     * The advance rule: the newest loaded timestamp capped at {@code now}, never
     * below the current cursor.
     */
    public static LocalDateTime nextValue(LocalDateTime current, LocalDateTime candidate, LocalDateTime now) {
        LocalDateTime capped = candidate.isAfter(now) ? now : candidate;
        return capped.isAfter(current) ? capped.truncatedTo(ChronoUnit.MINUTES) : current;
    }

    public static String format(LocalDateTime v) {
        return v.format(CURSOR_FORMAT);
    }

    private static LocalDateTime read(Connection c, String partitionId, String resource) throws SQLException {
        String sql = "SELECT \"cursor_value\" FROM \"" + WarehouseSchema.STATE_TABLE
                + "\" WHERE \"partition_id\" = ? AND \"resource\" = ?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, partitionId);
            ps.setString(2, resource);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    return null;
                return LocalDateTime.parse(rs.getString(1));
            }
        }
    }

    private void write(Connection c, String partitionId, String resource, LocalDateTime value, boolean exists)
            throws SQLException {
        String sql = exists
                ? "UPDATE \"" + WarehouseSchema.STATE_TABLE + "\" SET \"cursor_value\" = ?, \"updated_at\" = ? "
                        + "WHERE \"partition_id\" = ? AND \"resource\" = ?"
                : "INSERT INTO \"" + WarehouseSchema.STATE_TABLE + "\" "
                        + "(\"cursor_value\", \"updated_at\", \"partition_id\", \"resource\") VALUES (?, ?, ?, ?)";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, format(value));
            ps.setTimestamp(2, ColumnType.utc(clock.instant()));
            ps.setString(3, partitionId);
            ps.setString(4, resource);
            ps.executeUpdate();
        }
    }
}
