package com.phillippitts.dbprobe.util;

import java.util.regex.Pattern;

/** Utility for credential-safe rendering of JDBC URLs in logs, exceptions and health details. */
public final class JdbcUrlSanitizer {

    /** {@code //user:password@host} authority form (MySQL, PostgreSQL, H2 tcp). */
    private static final Pattern AUTHORITY_USER_INFO = Pattern.compile("//[^/]*@");

    /** {@code thin:user/password@host} form used by Oracle. */
    private static final Pattern THIN_USER_INFO = Pattern.compile("thin:[^@]*@");

    private JdbcUrlSanitizer() {}

    /**
     * Strip user info and every driver parameter from a JDBC URL.
     *
     * <p>Parameters start at the first {@code ?} (query style) or {@code ;} (H2, SQL Server,
     * Derby style); everything from there on is dropped, since any of them may carry a user or
     * password. Returns "" for null.
     */
    public static String redact(String url) {
        if (url == null) {
            return "";
        }
        String result = AUTHORITY_USER_INFO.matcher(url).replaceFirst("//");
        result = THIN_USER_INFO.matcher(result).replaceFirst("thin:@");
        int params = indexOfParameters(result);
        return params < 0 ? result : result.substring(0, params);
    }

    private static int indexOfParameters(String url) {
        int query = url.indexOf('?');
        int semicolon = url.indexOf(';');
        if (query < 0) {
            return semicolon;
        }
        if (semicolon < 0) {
            return query;
        }
        return Math.min(query, semicolon);
    }
}
