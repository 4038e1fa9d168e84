package com.statusbridge.alertbridge.infrastructure.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.statusbridge.observability.CorrelationContextHolder;
import com.statusbridge.observability.MetricFactory;
import com.statusbridge.security.CredentialVerifier;
import io.micrometer.core.instrument.Counter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Rejects requests without the configured basic credentials before they reach a controller.
 *
 * <p>Registered for the webhook and the state API only (see {@code WebConfig}); actuator
 * endpoints stay open for container probes. Rejections answer 401 with a
 * {@code WWW-Authenticate} challenge and a problem document.
 */
public class WebhookAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(WebhookAuthenticationFilter.class);

    private final CredentialVerifier verifier;
    private final String realm;
    private final ObjectMapper objectMapper;
    private final Counter rejected;

    public WebhookAuthenticationFilter(
            CredentialVerifier verifier, String realm, ObjectMapper objectMapper, MetricFactory metrics) {
        this.verifier = verifier;
        this.realm = realm;
        this.objectMapper = objectMapper;
        this.rejected = metrics.counter("statusbridge.webhook.rejected", "Requests rejected at the boundary",
                "reason", "unauthenticated");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (verifier.matchesHeader(request.getHeader(HttpHeaders.AUTHORIZATION))) {
            filterChain.doFilter(request, response);
            return;
        }

        rejected.increment();
        log.warn("Rejected unauthenticated {} {} from {}",
                request.getMethod(), request.getRequestURI(), request.getRemoteAddr());

        Map<String, Object> problem = new LinkedHashMap<>();
        problem.put("type", "https://statusbridge.io/errors/unauthorized");
        problem.put("title", "Unauthorized");
        problem.put("status", HttpStatus.UNAUTHORIZED.value());
        problem.put("detail", "Valid credentials are required");
        problem.put("instance", request.getRequestURI());
        problem.put("timestamp", Instant.now().toString());
        CorrelationContextHolder.get().ifPresent(ctx -> problem.put("correlationId", ctx.correlationId()));

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"" + realm + "\"");
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), problem);
    }
}
