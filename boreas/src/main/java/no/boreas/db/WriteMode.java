package no.boreas.db;

/**
 * How a load treats rows already in the target table.
 */
public enum WriteMode {
    /** Rows sharing the primary key are superseded; other rows stay. */
    MERGE,
    /** The table's prior content is discarded before loading. */
    REPLACE
}
