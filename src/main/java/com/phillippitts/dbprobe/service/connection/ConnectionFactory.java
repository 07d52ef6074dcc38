package com.phillippitts.dbprobe.service.connection;

import java.sql.Connection;

/**
 * Opens new physical database connections.
 *
 * <p>Every call returns a fresh connection that has passed a liveness check. Pooling, if any,
 * belongs beneath this interface in the driver.
 */
@FunctionalInterface
public interface ConnectionFactory {

    /**
     * Opens a new connection.
     *
     * @return a live connection, owned by the caller
     * @throws com.phillippitts.dbprobe.exception.ConnectionException if the connection cannot be
     *         established or fails its liveness check
     */
    Connection open();
}
