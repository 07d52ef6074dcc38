package com.phillippitts.dbprobe.config.properties;

import com.phillippitts.dbprobe.util.JdbcUrlSanitizer;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Positive;

/**
 * Connection settings for the backing database.
 * Binds to properties prefixed with "db", which application.properties maps to the
 * {@code DB_*} environment variables.
 *
 * <p>Missing variables bind to empty strings (or {@code null} for the port); they never fail
 * startup. A connection attempt with incomplete settings fails at request time instead.
 *
 * <p>Example application.properties:
 * <pre>
 * db.host=localhost
 * db.port=3306
 * db.user=app
 * db.password=secret
 * db.name=app
 * db.character-encoding=UTF-8
 * </pre>
 *
 * @param host database host name
 * @param port database port, omitted from the URL when absent
 * @param user login user
 * @param password login password
 * @param name database (schema) name
 * @param characterEncoding connection character encoding
 * @param url explicit JDBC URL; when set, the fields above except user and password are ignored
 * @param validationTimeoutSeconds timeout for the pre-flight liveness check
 */
@ConfigurationProperties(prefix = "db")
@Validated
public record DatabaseProperties(
        String host,
        Integer port,
        String user,
        String password,
        String name,
        @DefaultValue("UTF-8") String characterEncoding,
        String url,
        @DefaultValue("5")
        @Positive(message = "Validation timeout must be positive")
        int validationTimeoutSeconds
) {

    /**
     * Returns the JDBC URL to connect to: the explicit {@code db.url} when present, otherwise a
     * MySQL Connector/J URL built from host, port, database name and character encoding.
     *
     * <p>The derived URL never contains credentials, but an explicit one may
     * ({@code //user:pass@host}, {@code ?password=}, {@code ;PASSWORD=}). Pass this to the
     * driver only; use {@link #redactedUrl()} for anything a person might read.
     */
    public String jdbcUrl() {
        if (url != null && !url.isBlank()) {
            return url;
        }
        StringBuilder sb = new StringBuilder("jdbc:mysql://").append(nullToEmpty(host));
        if (port != null) {
            sb.append(':').append(port);
        }
        sb.append('/').append(nullToEmpty(name));
        if (characterEncoding != null && !characterEncoding.isBlank()) {
            sb.append("?characterEncoding=").append(characterEncoding);
        }
        return sb.toString();
    }

    /**
     * {@link #jdbcUrl()} with user info and driver parameters removed, safe for logs,
     * exception messages and health details.
     */
    public String redactedUrl() {
        return JdbcUrlSanitizer.redact(jdbcUrl());
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    @Override
    public String toString() {
        return "DatabaseProperties[url=" + redactedUrl() + ", user=" + user + "]";
    }
}
