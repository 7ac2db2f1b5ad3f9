package no.boreas.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Extra work that must commit or roll back together with a load.
 */
@FunctionalInterface
public interface TransactionHook {
    TransactionHook NONE = c -> {
    };

    void apply(Connection tx) throws SQLException;
}
