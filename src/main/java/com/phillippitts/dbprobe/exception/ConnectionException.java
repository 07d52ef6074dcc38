package com.phillippitts.dbprobe.exception;

/**
 * Thrown when a database connection cannot be established or fails its pre-flight check.
 * Credentials are never part of the message; only the target URL is recorded.
 */
public class ConnectionException extends DbProbeException {

    private final String target;

    public ConnectionException(String message) {
        super(message);
        this.target = "unknown";
    }

    public ConnectionException(String message, String target) {
        super(message + " (target: " + target + ")");
        this.target = target;
    }

    public ConnectionException(String message, String target, Throwable cause) {
        super(message + " (target: " + target + ")", cause);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
