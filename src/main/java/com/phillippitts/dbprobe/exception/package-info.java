/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend a common base so the presentation layer can map
 * them in one place.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.dbprobe.exception.DbProbeException} - Base exception</li>
 *   <li>{@link com.phillippitts.dbprobe.exception.ConnectionException} - Thrown when a
 *       connection cannot be opened or fails its liveness check; surfaces to the caller of
 *       {@code ConnectionManager.acquire}</li>
 *   <li>{@link com.phillippitts.dbprobe.exception.CleanupException} - Close failure during
 *       request teardown; logged only</li>
 * </ul>
 *
 * <p>Query failures are reported by the JDBC driver as {@link java.sql.SQLException} and are
 * not wrapped.
 *
 * @see com.phillippitts.dbprobe.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.dbprobe.exception;
