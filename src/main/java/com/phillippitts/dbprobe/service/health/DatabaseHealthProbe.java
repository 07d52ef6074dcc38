package com.phillippitts.dbprobe.service.health;

import com.phillippitts.dbprobe.service.connection.ConnectionManager;
import com.phillippitts.dbprobe.service.metrics.HealthProbeMetrics;
import com.phillippitts.dbprobe.domain.RequestContext;
import com.phillippitts.dbprobe.exception.ConnectionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Runs a trivial query on the request's connection and reduces the result to
 * {@link ProbeStatus#OK} or {@link ProbeStatus#BAD}.
 *
 * <p>Database failures (connect errors, {@link SQLException}) and unexpected exceptions both
 * yield {@code BAD}; they are told apart only in the log line and the outcome metric.
 * Never throws.
 */
@Component
public class DatabaseHealthProbe {

    private static final Logger LOG = LogManager.getLogger(DatabaseHealthProbe.class);

    static final String LIVENESS_QUERY = "SELECT CURRENT_TIMESTAMP";

    private final ConnectionManager connectionManager;
    private final HealthProbeMetrics metrics;

    public DatabaseHealthProbe(ConnectionManager connectionManager, HealthProbeMetrics metrics) {
        this.connectionManager = connectionManager;
        this.metrics = metrics;
    }

    /**
     * Probes the database through the context's connection, opening one if needed.
     * The connection stays on the context; releasing it is the caller's teardown.
     */
    public ProbeStatus check(RequestContext context) {
        try {
            Connection connection = connectionManager.acquire(context);
            runLivenessQuery(connection);
            metrics.recordOk();
            return ProbeStatus.OK;
        } catch (SQLException | ConnectionException e) {
            LOG.error("Database health check failed: {}", e.getMessage(), e);
            metrics.recordQueryError();
            return ProbeStatus.BAD;
        } catch (Exception e) {
            LOG.error("Unexpected error during database health check", e);
            metrics.recordUnexpected();
            return ProbeStatus.BAD;
        }
    }

    private static void runLivenessQuery(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(LIVENESS_QUERY)) {
            if (!rs.next()) {
                throw new SQLException("Liveness query returned no rows");
            }
            if (rs.next()) {
                throw new SQLException("Liveness query returned more than one row");
            }
        }
    }
}
