package com.phillippitts.dbprobe.config.web;

import com.phillippitts.dbprobe.config.logging.RequestLogContext;
import com.phillippitts.dbprobe.service.connection.ConnectionManager;
import com.phillippitts.dbprobe.domain.RequestContext;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.CloseableThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Opens and closes the {@link RequestContext} around every HTTP request.
 *
 * <p>For each request:
 * <ul>
 *   <li>creates a context from the request URL (including query string) and remote address</li>
 *   <li>exposes it as request attribute {@link RequestContext#ATTRIBUTE} for handlers</li>
 *   <li>binds its attribution fields to the logging ThreadContext</li>
 *   <li>releases the context's connection and unbinds logging when the chain returns or throws</li>
 * </ul>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestScopeFilter implements Filter {

    private final ConnectionManager connectionManager;

    public RequestScopeFilter(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http)) {
            chain.doFilter(request, response);
            return;
        }

        RequestContext context = new RequestContext(fullUrl(http), http.getRemoteAddr());
        http.setAttribute(RequestContext.ATTRIBUTE, context);
        CloseableThreadContext.Instance logScope = RequestLogContext.bind(context);
        try {
            chain.doFilter(request, response);
        } finally {
            connectionManager.release(context);
            logScope.close();
        }
    }

    private static String fullUrl(HttpServletRequest req) {
        StringBuffer url = req.getRequestURL();
        if (url == null) {
            return null;
        }
        String query = req.getQueryString();
        return (query == null || query.isEmpty()) ? url.toString() : url.append('?').append(query).toString();
    }
}
