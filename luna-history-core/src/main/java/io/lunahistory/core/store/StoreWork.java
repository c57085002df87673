package io.lunahistory.core.store;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * One unit of work run against the store connection while the handle's lock is held.
 * Implementations must not keep the connection after returning.
 */
@FunctionalInterface
public interface StoreWork<T> {
    T run(Connection connection) throws SQLException;
}
