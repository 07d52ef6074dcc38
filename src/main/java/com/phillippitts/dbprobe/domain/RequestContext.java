package com.phillippitts.dbprobe.domain;

import java.sql.Connection;
import java.util.Optional;

/**
 * Per-request state bag, created when request handling starts and discarded when it ends.
 *
 * <p>Carries the request attribution used by logging (URL and remote address) and at most one
 * database connection. Instances are confined to the thread handling the request and are
 * passed explicitly through the call chain; they are never stored in shared state.
 *
 * <p>Not thread-safe.
 */
public final class RequestContext {

    /** Servlet request attribute under which the request filter stores the context. */
    public static final String ATTRIBUTE = RequestContext.class.getName();

    private final String url;
    private final String remoteAddr;
    private Connection connection;

    public RequestContext(String url, String remoteAddr) {
        this.url = url;
        this.remoteAddr = remoteAddr;
    }

    /**
     * Context for work that does not belong to an inbound HTTP request, such as actuator
     * probes. Has no attribution fields.
     */
    public static RequestContext detached() {
        return new RequestContext(null, null);
    }

    public Optional<String> url() {
        return Optional.ofNullable(url);
    }

    public Optional<String> remoteAddr() {
        return Optional.ofNullable(remoteAddr);
    }

    public Optional<Connection> connection() {
        return Optional.ofNullable(connection);
    }

    /**
     * Stores the request's connection.
     *
     * @throws IllegalStateException if a connection is already attached
     */
    public void attachConnection(Connection connection) {
        if (this.connection != null) {
            throw new IllegalStateException("Request context already holds a connection");
        }
        this.connection = connection;
    }

    /**
     * Removes and returns the request's connection, or {@code null} if none is attached.
     */
    public Connection detachConnection() {
        Connection c = this.connection;
        this.connection = null;
        return c;
    }

    @Override
    public String toString() {
        return "RequestContext[url=" + url + ", remoteAddr=" + remoteAddr
                + ", connected=" + (connection != null) + "]";
    }
}
