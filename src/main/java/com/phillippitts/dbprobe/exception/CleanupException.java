package com.phillippitts.dbprobe.exception;

/**
 * Failure while closing a request's connection. Logged by the connection manager,
 * never propagated out of request teardown.
 */
public class CleanupException extends DbProbeException {

    public CleanupException(String message, Throwable cause) {
        super(message, cause);
    }
}
