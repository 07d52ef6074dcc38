package com.phillippitts.dbprobe.presentation.exception;

import com.phillippitts.dbprobe.exception.ConnectionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts exceptions escaping controllers to HTTP responses. The health route never gets here;
 * it maps its own failures to a body.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * No database connection could be opened for the request (HTTP 503).
     *
     * <p>Applies to any handler that calls {@code ConnectionManager.acquire} and lets the
     * {@link ConnectionException} escape. {@code /health} catches its own connect failures and
     * answers {@code BAD}, and {@code /} never opens a connection, so neither current route
     * lands here.
     */
    @ExceptionHandler(ConnectionException.class)
    ResponseEntity<ApiError> handleConnectionFailure(ConnectionException ex) {
        LOG.error("Database connection failed: target={}", ex.getTarget(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Database temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     *
     * <p>Spring MVC's own request errors (unknown path, unsupported method, unacceptable
     * {@code Accept} header, ...) implement {@link ErrorResponse} and keep their status.
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            return handleFrameworkError(errorResponse);
        }
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support",
                Instant.now()
            ));
    }

    /**
     * Status and headers (e.g. {@code Allow} on a 405) come from the exception. No body, since
     * the client may not accept any type we could write.
     */
    private ResponseEntity<ApiError> handleFrameworkError(ErrorResponse errorResponse) {
        LOG.debug("Request rejected by framework: status={}, detail={}",
            errorResponse.getStatusCode().value(), errorResponse.getBody().getDetail());
        return ResponseEntity
            .status(errorResponse.getStatusCode())
            .headers(errorResponse.getHeaders())
            .build();
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
