package com.phillippitts.dbprobe.service.connection;

import com.phillippitts.dbprobe.config.properties.DatabaseProperties;
import com.phillippitts.dbprobe.exception.ConnectionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * {@link ConnectionFactory} backed by {@link DriverManager}, one physical connection per call.
 *
 * <p>Each new connection is pre-flight checked with {@link Connection#isValid(int)} before it
 * is handed out; a connection that fails the check is closed and reported as a
 * {@link ConnectionException}. No retries.
 *
 * <p>Exceptions and log lines name the target by its redacted URL; a driver message that
 * echoes the raw URL is rewritten the same way.
 */
@Component
public class JdbcConnectionFactory implements ConnectionFactory {

    private static final Logger LOG = LogManager.getLogger(JdbcConnectionFactory.class);

    private final DatabaseProperties properties;

    public JdbcConnectionFactory(DatabaseProperties properties) {
        this.properties = properties;
    }

    @Override
    public Connection open() {
        String url = properties.jdbcUrl();
        String target = properties.redactedUrl();
        Connection connection;
        try {
            connection = DriverManager.getConnection(url, properties.user(), properties.password());
        } catch (SQLException e) {
            throw new ConnectionException("Failed to connect to database", target, redactCause(e, url, target));
        }

        boolean valid;
        try {
            valid = connection.isValid(properties.validationTimeoutSeconds());
        } catch (SQLException e) {
            closeQuietly(connection);
            throw new ConnectionException("Pre-flight check failed", target, redactCause(e, url, target));
        }
        if (!valid) {
            closeQuietly(connection);
            throw new ConnectionException("Pre-flight check reported connection not valid", target);
        }
        LOG.debug("Opened database connection: url={}", target);
        return connection;
    }

    /**
     * Copy of {@code e} whose message has the raw URL replaced by the redacted one, keeping SQL
     * state, vendor code, cause and stack trace. Returns {@code e} itself when its message does
     * not contain the URL.
     */
    private static SQLException redactCause(SQLException e, String url, String target) {
        String message = e.getMessage();
        if (message == null || url.equals(target) || !message.contains(url)) {
            return e;
        }
        SQLException redacted = new SQLException(
                message.replace(url, target), e.getSQLState(), e.getErrorCode(), e.getCause());
        redacted.setStackTrace(e.getStackTrace());
        return redacted;
    }

    private static void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            LOG.warn("Failed to close rejected connection: {}", e.getMessage());
        }
    }
}
