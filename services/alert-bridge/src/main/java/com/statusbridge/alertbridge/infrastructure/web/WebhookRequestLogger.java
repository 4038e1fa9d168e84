package com.statusbridge.alertbridge.infrastructure.web;

import com.statusbridge.observability.SensitiveDataRedactor;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every webhook call (source, headers, body) to the {@code statusbridge.webhook.requests}
 * logger, which the logging configuration routes to its own file. Credential-bearing headers
 * are redacted.
 */
public class WebhookRequestLogger {

    public static final String LOGGER_NAME = "statusbridge.webhook.requests";

    private static final Logger requests = LoggerFactory.getLogger(LOGGER_NAME);

    private final SensitiveDataRedactor redactor;

    public WebhookRequestLogger(SensitiveDataRedactor redactor) {
        this.redactor = redactor;
    }

    public void log(HttpServletRequest request, String body) {
        if (!requests.isInfoEnabled()) {
            return;
        }
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, String.join(", ", Collections.list(request.getHeaders(name))));
        }
        requests.info("{} {} from {}\nheaders: {}\nbody: {}",
                request.getMethod(), request.getRequestURI(), request.getRemoteAddr(),
                redactor.redact(headers), body);
    }
}
