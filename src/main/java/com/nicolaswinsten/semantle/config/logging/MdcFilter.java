package com.nicolaswinsten.semantle.config.logging;

import java.io.IOException;
import java.util.UUID;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Puts request-scoped values into the SLF4J MDC.
 *
 * <ul>
 *   <li>requestId: from X-Request-ID, or a generated UUID</li>
 *   <li>userId: from X-User-ID, when present</li>
 *   <li>method, uri</li>
 * </ul>
 * The MDC is cleared after every request.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String USER_ID_HEADER = "X-User-ID";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                MDC.put("requestId", headerOrGenerate(http, REQUEST_ID_HEADER));
                String userId = http.getHeader(USER_ID_HEADER);
                if (userId != null && !userId.isBlank()) {
                    MDC.put("userId", userId);
                }
                MDC.put("method", http.getMethod());
                MDC.put("uri", http.getRequestURI());
            }
            chain.doFilter(request, response);
        } finally {
            MDC.clear();
        }
    }

    private static String headerOrGenerate(HttpServletRequest req, String headerName) {
        String v = req.getHeader(headerName);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v;
    }
}
