package com.phillippitts.dbprobe.exception;

/**
 * Base exception for all dbprobe application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class DbProbeException extends RuntimeException {

    public DbProbeException(String message) {
        super(message);
    }

    public DbProbeException(String message, Throwable cause) {
        super(message, cause);
    }

    public DbProbeException(Throwable cause) {
        super(cause);
    }
}
