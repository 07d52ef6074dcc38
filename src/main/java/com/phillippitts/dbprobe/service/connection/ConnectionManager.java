package com.phillippitts.dbprobe.service.connection;

import com.phillippitts.dbprobe.domain.RequestContext;
import com.phillippitts.dbprobe.exception.CleanupException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns the per-request database connection lifecycle.
 *
 * <p>Lifecycle per {@link RequestContext}:
 * <ol>
 *   <li>{@link #acquire} opens a connection on first use and stores it on the context</li>
 *   <li>later {@link #acquire} calls in the same request return the same instance</li>
 *   <li>{@link #release} runs at request teardown, closes the connection and never throws</li>
 * </ol>
 *
 * <p>Stateless apart from its factory: the connection lives on the context, so a single
 * instance serves all request threads without locking.
 */
@Component
public class ConnectionManager {

    private static final Logger LOG = LogManager.getLogger(ConnectionManager.class);

    private final ConnectionFactory connectionFactory;

    public ConnectionManager(ConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
    }

    /**
     * Returns the context's connection, opening one if the context has none yet.
     *
     * @param context the current request context
     * @return the request's connection (same instance for every call within a request)
     * @throws com.phillippitts.dbprobe.exception.ConnectionException if a new connection cannot be
     *         established; the context is left without a connection
     */
    public Connection acquire(RequestContext context) {
        Objects.requireNonNull(context, "context");
        Optional<Connection> existing = context.connection();
        if (existing.isPresent()) {
            return existing.get();
        }

        LOG.info("Connecting to database");
        Connection connection = connectionFactory.open();
        context.attachConnection(connection);
        return connection;
    }

    /**
     * Removes the context's connection, if any, and closes it.
     *
     * <p>Best-effort: a close failure is logged and swallowed so teardown always completes.
     *
     * @param context the request context being torn down
     */
    public void release(RequestContext context) {
        Objects.requireNonNull(context, "context");
        LOG.debug("Connection release requested");

        Connection connection = context.detachConnection();
        if (connection == null) {
            LOG.debug("No connection held by request; nothing to close");
            return;
        }

        LOG.info("Closing database connection");
        try {
            connection.close();
        } catch (SQLException | RuntimeException e) {
            CleanupException failure = new CleanupException("Failed to close database connection", e);
            LOG.warn(failure.getMessage(), failure);
        }
    }
}
