package no.boreas.db;

import com.zaxxer.hikari.HikariDataSource;
import no.boreas.errors.SchemaViolationException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Loads rows into a warehouse table under merge or replace semantics.
 *
 * <p>
 * Tables are created on first load and new columns are added as they appear.
 * An existing column never changes type: a conflicting value is a
 * {@link SchemaViolationException}, raised before anything is written. Key
 * uniqueness is kept by deleting the incoming keys and inserting in one
 * transaction, so no primary-key constraint is declared on the table.
 * </p>
 */
public class UpsertSink {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(UpsertSink.class);
    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    private final HikariDataSource ds;
    // DDL is serialized so concurrent loads never race to add the same column
    private final Object schemaLock = new Object();

    /**
     * Creates a sink backed by the provided datasource.
     */
    public UpsertSink(HikariDataSource ds) {
        this.ds = ds;
    }

    public int load(String table, List<Map<String, Object>> rows, List<String> primaryKey, WriteMode mode)
            throws SchemaViolationException, SQLException {
        return load(table, rows, primaryKey, mode, TransactionHook.NONE);
    }

    /**
     * Loads {@code rows} and runs {@code hook} on the same connection before commit.
     * Returns the number of rows written. Empty input under MERGE writes nothing
     * and skips the hook.
     */
    public int load(String table, List<Map<String, Object>> rows, List<String> primaryKey, WriteMode mode,
            TransactionHook hook) throws SchemaViolationException, SQLException {
        requireIdentifier(table);
        if (primaryKey.isEmpty())
            throw new SchemaViolationException("table " + table + " needs a primary key");
        if (rows.isEmpty() && mode == WriteMode.MERGE)
            return 0;

        LinkedHashMap<String, ColumnType> columns = inferColumns(table, rows);
        for (String k : primaryKey) {
            requireIdentifier(k);
            if (!rows.isEmpty() && !columns.containsKey(k))
                throw new SchemaViolationException("primary key column " + k + " has no values for " + table);
        }
        Collection<Map<String, Object>> unique = dedupe(table, rows, primaryKey);

        try (Connection c = ds.getConnection()) {
            boolean exists;
            synchronized (schemaLock) {
                exists = ensureTable(c, table, columns);
            }
            if (!exists)
                return 0; // REPLACE of an empty batch into a table that was never created

            boolean autoCommit = c.getAutoCommit();
            c.setAutoCommit(false);
            try {
                if (mode == WriteMode.REPLACE) {
                    try (Statement st = c.createStatement()) {
                        st.executeUpdate("DELETE FROM " + q(table));
                    }
                } else {
                    deleteKeys(c, table, unique, primaryKey, columns);
                }
                insert(c, table, unique, columns);
                hook.apply(c);
                c.commit();
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(autoCommit);
            }
        }
        log.debug("load: table={} mode={} rows={} columns={}", table, mode, unique.size(), columns.size());
        return unique.size();
    }

    /**
     * Returns the columns currently present on {@code table} with their reported
     * types, in ordinal order. Empty when the table does not exist.
     */
    public LinkedHashMap<String, String> describe(String table) throws SQLException {
        try (Connection c = ds.getConnection()) {
            return existingColumns(c, table);
        }
    }

    // ----------------------------
    // schema
    // ----------------------------
    private static LinkedHashMap<String, ColumnType> inferColumns(String table, List<Map<String, Object>> rows)
            throws SchemaViolationException {
        LinkedHashMap<String, ColumnType> columns = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            for (var e : row.entrySet()) {
                Object v = e.getValue();
                if (v == null)
                    continue; // all-null columns wait until a typed value shows up
                requireIdentifier(e.getKey());
                ColumnType t = ColumnType.of(v);
                if (t == null)
                    throw new SchemaViolationException("column " + table + "." + e.getKey()
                            + " has unsupported value type " + v.getClass().getSimpleName());
                ColumnType prev = columns.putIfAbsent(e.getKey(), t);
                if (prev != null && prev != t)
                    throw new SchemaViolationException("column " + table + "." + e.getKey()
                            + " receives both " + prev + " and " + t + " values in one load");
            }
        }
        return columns;
    }

    /**
     * Creates or widens {@code table} for {@code columns}; false when there is still
     * no table (no columns to create it with).
     */
    private boolean ensureTable(Connection c, String table, LinkedHashMap<String, ColumnType> columns)
            throws SQLException, SchemaViolationException {
        LinkedHashMap<String, String> existing = existingColumns(c, table);

        if (existing.isEmpty()) {
            if (columns.isEmpty())
                return false;
            StringJoiner cols = new StringJoiner(", ");
            columns.forEach((name, type) -> cols.add(q(name) + " " + type.ddl()));
            try (Statement st = c.createStatement()) {
                st.execute("CREATE TABLE IF NOT EXISTS " + q(table) + " (" + cols + ")");
            }
            log.info("Created table {} with columns {}", table, columns.keySet());
            return true;
        }

        // check every type before altering anything
        List<String> added = new ArrayList<>();
        for (var e : columns.entrySet()) {
            String reported = existing.get(e.getKey());
            if (reported == null) {
                added.add(e.getKey());
            } else if (!e.getValue().matches(reported)) {
                throw new SchemaViolationException("column " + table + "." + e.getKey() + " is " + reported
                        + " but incoming values are " + e.getValue());
            }
        }
        for (String name : added) {
            try (Statement st = c.createStatement()) {
                st.execute("ALTER TABLE " + q(table) + " ADD COLUMN " + q(name) + " " + columns.get(name).ddl());
            }
            log.info("Added column {}.{} ({})", table, name, columns.get(name));
        }
        return true;
    }

    private static LinkedHashMap<String, String> existingColumns(Connection c, String table) throws SQLException {
        String sql = "SELECT column_name, data_type FROM information_schema.columns "
                + "WHERE table_name = ? AND table_schema = current_schema() ORDER BY ordinal_position";
        LinkedHashMap<String, String> out = new LinkedHashMap<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.put(rs.getString(1), rs.getString(2));
                }
            }
        }
        return out;
    }

    // ----------------------------
    // data
    // ----------------------------
    /**
     * Collapses rows sharing a key; the last one wins.
     */
    private static Collection<Map<String, Object>> dedupe(String table, List<Map<String, Object>> rows,
            List<String> primaryKey) throws SchemaViolationException {
        LinkedHashMap<List<Object>, Map<String, Object>> byKey = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            List<Object> key = new ArrayList<>(primaryKey.size());
            for (String k : primaryKey) {
                Object v = row.get(k);
                if (v == null)
                    throw new SchemaViolationException("row for " + table + " has no value for key column " + k);
                key.add(v);
            }
            byKey.put(key, row);
        }
        return byKey.values();
    }

    private static void deleteKeys(Connection c, String table, Collection<Map<String, Object>> rows,
            List<String> primaryKey, Map<String, ColumnType> columns) throws SQLException {
        StringJoiner where = new StringJoiner(" AND ");
        for (String k : primaryKey)
            where.add(q(k) + " = ?");
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM " + q(table) + " WHERE " + where)) {
            for (Map<String, Object> row : rows) {
                int i = 1;
                for (String k : primaryKey) {
                    columns.get(k).bind(ps, i++, row.get(k));
                }
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static void insert(Connection c, String table, Collection<Map<String, Object>> rows,
            LinkedHashMap<String, ColumnType> columns) throws SQLException {
        if (rows.isEmpty())
            return;
        StringJoiner names = new StringJoiner(", ");
        StringJoiner marks = new StringJoiner(", ");
        for (String name : columns.keySet()) {
            names.add(q(name));
            marks.add("?");
        }
        String sql = "INSERT INTO " + q(table) + " (" + names + ") VALUES (" + marks + ")";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            for (Map<String, Object> row : rows) {
                int i = 1;
                for (var col : columns.entrySet()) {
                    col.getValue().bind(ps, i++, row.get(col.getKey()));
                }
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static void requireIdentifier(String name) throws SchemaViolationException {
        if (name == null || !IDENTIFIER.matcher(name).matches())
            throw new SchemaViolationException("'" + name + "' is not a valid lowercase identifier");
    }

    /**
     * Quotes an identifier already checked against {@link #IDENTIFIER}.
     */
    static String q(String identifier) {
        return "\"" + identifier + "\"";
    }
}
