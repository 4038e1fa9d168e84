package com.statusbridge.alertbridge;

import com.statusbridge.alertbridge.config.IncidentProperties;
import com.statusbridge.alertbridge.config.ServiceProperties;
import com.statusbridge.alertbridge.config.StatusPageProperties;
import com.statusbridge.alertbridge.config.WebhookProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Alert bridge: receives alert notifications and keeps the status page in line with them.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health and metrics endpoints, unauthenticated
 *   <li>Correlation ID propagation and webhook request logging
 *   <li>Basic authentication on {@code /webhook} and {@code /api/**}
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties({
        ServiceProperties.class,
        WebhookProperties.class,
        StatusPageProperties.class,
        IncidentProperties.class
})
public class AlertBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlertBridgeApplication.class, args);
    }
}
