package com.statusbridge.alertbridge.infrastructure.web;

import com.statusbridge.observability.CorrelationContext;
import com.statusbridge.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates a correlation ID for every HTTP request.
 *
 * <p>The ID comes from {@code X-Correlation-ID} when the caller sends one, otherwise a new UUID.
 * It is held in {@link CorrelationContextHolder} (and so in the MDC, together with the caller
 * address and request path) while the request runs, and echoed on the response.
 *
 * <p>Runs first so the context exists for authentication and request logging.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }

        var context = new CorrelationContext(correlationId, request.getRemoteAddr(), request.getRequestURI());
        CorrelationContextHolder.set(context);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads.
            CorrelationContextHolder.clear();
        }
    }
}
