package com.phillippitts.dbprobe.service.health;

/**
 * Outcome of a database liveness probe, with the fixed response body for each value.
 */
public enum ProbeStatus {
    OK("OK"),
    BAD("BAD");

    private final String body;

    ProbeStatus(String body) {
        this.body = body;
    }

    public String body() {
        return body;
    }
}
