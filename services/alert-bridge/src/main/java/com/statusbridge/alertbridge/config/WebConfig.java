package com.statusbridge.alertbridge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.statusbridge.alertbridge.infrastructure.web.WebhookAuthenticationFilter;
import com.statusbridge.alertbridge.infrastructure.web.WebhookRequestLogger;
import com.statusbridge.observability.MetricFactory;
import com.statusbridge.observability.SensitiveDataRedactor;
import com.statusbridge.security.CredentialVerifier;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Web boundary: authentication on the webhook and state API, request logging.
 *
 * <p>The authentication filter is registered through a {@link FilterRegistrationBean} rather
 * than as a plain bean so that it only covers {@code /webhook} and {@code /api/*}; actuator
 * stays reachable for health probes.
 */
@Configuration
public class WebConfig {

    @Bean
    public FilterRegistrationBean<WebhookAuthenticationFilter> webhookAuthenticationFilter(
            WebhookProperties webhook, ObjectMapper objectMapper, MetricFactory metrics) {
        var filter = new WebhookAuthenticationFilter(
                new CredentialVerifier(webhook.credentials()), webhook.realm(), objectMapper, metrics);
        var registration = new FilterRegistrationBean<>(filter);
        registration.addUrlPatterns("/webhook", "/webhook/*", "/api/*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        return registration;
    }

    @Bean
    public WebhookRequestLogger webhookRequestLogger() {
        return new WebhookRequestLogger(new SensitiveDataRedactor());
    }
}
