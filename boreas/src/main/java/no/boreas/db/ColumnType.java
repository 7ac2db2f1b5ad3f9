package no.boreas.db;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Set;

/**
 * Warehouse column types inferred from Java values. DDL names are accepted by both
 * DuckDB and PostgreSQL; the alias sets cover how each reports them back in
 * {@code information_schema.columns.data_type}.
 */
enum ColumnType {
    DOUBLE("FLOAT8", Types.DOUBLE, Set.of("DOUBLE", "FLOAT8", "DOUBLE PRECISION", "FLOAT", "REAL", "FLOAT4")),
    BIGINT("BIGINT", Types.BIGINT, Set.of("BIGINT", "INT8", "INTEGER", "INT4", "INT", "SMALLINT", "INT2")),
    BOOLEAN("BOOLEAN", Types.BOOLEAN, Set.of("BOOLEAN", "BOOL")),
    VARCHAR("VARCHAR", Types.VARCHAR, Set.of("VARCHAR", "CHARACTER VARYING", "TEXT", "STRING")),
    TIMESTAMP("TIMESTAMP", Types.TIMESTAMP, Set.of("TIMESTAMP", "TIMESTAMP WITHOUT TIME ZONE", "DATETIME"));

    private final String ddl;
    private final int sqlType;
    private final Set<String> reportedNames;

    ColumnType(String ddl, int sqlType, Set<String> reportedNames) {
        this.ddl = ddl;
        this.sqlType = sqlType;
        this.reportedNames = reportedNames;
    }

    String ddl() {
        return ddl;
    }

    /**
     * Type of a non-null Java value, or null when the class is not storable.
     */
    static ColumnType of(Object v) {
        if (v instanceof Double || v instanceof Float || v instanceof BigDecimal)
            return DOUBLE;
        if (v instanceof Long || v instanceof Integer || v instanceof Short)
            return BIGINT;
        if (v instanceof Boolean)
            return BOOLEAN;
        if (v instanceof String)
            return VARCHAR;
        if (v instanceof LocalDateTime || v instanceof Instant)
            return TIMESTAMP;
        return null;
    }

    /**
     * True when an existing column reported as {@code dataType} can hold this type.
     */
    boolean matches(String dataType) {
        String t = dataType.trim().toUpperCase(Locale.ROOT);
        int paren = t.indexOf('(');
        if (paren > 0)
            t = t.substring(0, paren).trim();
        return reportedNames.contains(t);
    }

    /**
     * Writes a nullable value to a prepared statement.
     */
    void bind(PreparedStatement ps, int idx, Object v) throws SQLException {
        if (v == null) {
            ps.setNull(idx, sqlType);
            return;
        }
        switch (this) {
            case DOUBLE -> ps.setDouble(idx, ((Number) v).doubleValue());
            case BIGINT -> ps.setLong(idx, ((Number) v).longValue());
            case BOOLEAN -> ps.setBoolean(idx, (Boolean) v);
            case VARCHAR -> ps.setString(idx, (String) v);
            case TIMESTAMP -> ps.setTimestamp(idx, v instanceof Instant i
                    ? utc(i)
                    : Timestamp.valueOf((LocalDateTime) v));
        }
    }

    /**
     * Instants are stored as UTC wall-clock time, whatever the JVM default zone is.
     */
    static Timestamp utc(Instant i) {
        return Timestamp.valueOf(LocalDateTime.ofInstant(i, ZoneOffset.UTC));
    }
}
