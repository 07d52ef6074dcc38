package com.phillippitts.dbprobe.service.health;

import com.phillippitts.dbprobe.config.properties.DatabaseProperties;
import com.phillippitts.dbprobe.service.connection.ConnectionManager;
import com.phillippitts.dbprobe.domain.RequestContext;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator view of the database liveness probe.
 *
 * <p>Each call runs {@link DatabaseHealthProbe} in its own detached {@link RequestContext}
 * and releases that context's connection before returning.
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class DatabaseHealthIndicator implements HealthIndicator {

    private final DatabaseHealthProbe probe;
    private final ConnectionManager connectionManager;
    private final DatabaseProperties properties;

    public DatabaseHealthIndicator(DatabaseHealthProbe probe,
                                   ConnectionManager connectionManager,
                                   DatabaseProperties properties) {
        this.probe = probe;
        this.connectionManager = connectionManager;
        this.properties = properties;
    }

    @Override
    public Health health() {
        RequestContext context = RequestContext.detached();
        try {
            ProbeStatus status = probe.check(context);
            Health.Builder builder = status == ProbeStatus.OK ? Health.up() : Health.down();
            return builder
                    .withDetail("probe", status.body())
                    .withDetail("database", properties.redactedUrl())
                    .build();
        } finally {
            connectionManager.release(context);
        }
    }
}
