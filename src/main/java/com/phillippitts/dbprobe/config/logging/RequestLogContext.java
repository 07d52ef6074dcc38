package com.phillippitts.dbprobe.config.logging;

import com.phillippitts.dbprobe.domain.RequestContext;
import org.apache.logging.log4j.CloseableThreadContext;

import java.util.HashMap;
import java.util.Map;

/**
 * Binds a request's attribution fields to Log4j2's ThreadContext for the duration of a scope.
 *
 * <p>The line pattern in {@code log4j2-spring.xml} reads these keys on every event, so records
 * emitted inside the scope carry the request's URL and remote address and records emitted
 * outside it render the absent marker instead.
 */
public final class RequestLogContext {

    /** ThreadContext key for the full request URL. */
    public static final String URL_KEY = "url";

    /** ThreadContext key for the client address. */
    public static final String REMOTE_ADDR_KEY = "remoteAddr";

    private RequestLogContext() {}

    /**
     * Puts the context's URL and remote address into the ThreadContext.
     * Fields the context does not have are left unset.
     *
     * @return a scope that restores the previous ThreadContext values when closed
     */
    public static CloseableThreadContext.Instance bind(RequestContext context) {
        Map<String, String> values = new HashMap<>();
        context.url().ifPresent(url -> values.put(URL_KEY, url));
        context.remoteAddr().ifPresent(addr -> values.put(REMOTE_ADDR_KEY, addr));
        return CloseableThreadContext.putAll(values);
    }
}
