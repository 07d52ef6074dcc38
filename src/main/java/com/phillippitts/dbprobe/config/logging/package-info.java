/**
 * Request-aware logging on top of Log4j2.
 *
 * <p>Log4j2 is configured once at startup from {@code log4j2-spring.xml}: a single appender on
 * standard error, threshold from {@code logging.level.root} ({@code LOG_LEVEL}).
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.dbprobe.config.logging.RequestLogContext} - binds a request's
 *       {@code url} and {@code remoteAddr} to the ThreadContext</li>
 *   <li>{@link com.phillippitts.dbprobe.config.logging.UncaughtExceptionLogger} - logs
 *       uncaught throwables at FATAL</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * [2025-10-17 15:42:32,529] 127.0.0.1 requested http://localhost:8080/health com.phillippitts.dbprobe.service.connection.ConnectionManager INFO     Connecting to database com.phillippitts.dbprobe.service.connection.ConnectionManager.acquire(ConnectionManager.java:55)
 * </pre>
 * Outside a request both attribution fields render as {@code -}.
 *
 * @see org.apache.logging.log4j.ThreadContext
 * @since 1.0
 */
package com.phillippitts.dbprobe.config.logging;
