package com.phillippitts.dbprobe.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Counts database liveness checks by outcome.
 *
 * <p>Exposed as {@code dbprobe.health.checks} with tag {@code outcome}, one of
 * {@code ok}, {@code query_error}, {@code unexpected}. Available at /actuator/metrics.
 */
@Component
public class HealthProbeMetrics {

    public static final String METRIC_NAME = "dbprobe.health.checks";

    public static final String OUTCOME_OK = "ok";
    public static final String OUTCOME_QUERY_ERROR = "query_error";
    public static final String OUTCOME_UNEXPECTED = "unexpected";

    private final MeterRegistry registry;

    public HealthProbeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a check whose liveness query returned exactly one row.
     */
    public void recordOk() {
        increment(OUTCOME_OK);
    }

    /**
     * Records a check that failed on a database error: a failed connect, a failed
     * pre-flight validation, or an {@link java.sql.SQLException} from the query.
     */
    public void recordQueryError() {
        increment(OUTCOME_QUERY_ERROR);
    }

    /**
     * Records a check that failed with any other exception.
     */
    public void recordUnexpected() {
        increment(OUTCOME_UNEXPECTED);
    }

    private void increment(String outcome) {
        Counter.builder(METRIC_NAME)
                .description("Database liveness checks by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
