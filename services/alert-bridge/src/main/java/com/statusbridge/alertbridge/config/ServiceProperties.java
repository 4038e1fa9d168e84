package com.statusbridge.alertbridge.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of this bridge instance, bound from {@code statusbridge.service.*}.
 *
 * <pre>
 * statusbridge:
 *   service:
 *     name: alert-bridge
 *     environment: production
 *     description: Alertmanager to status page bridge
 * </pre>
 *
 * @param name        service name used for logging and the metrics {@code service} tag. Required.
 * @param environment deployment environment (default {@code development})
 * @param description human-readable description for {@code /api/v1/info}
 */
@ConfigurationProperties(prefix = "statusbridge.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment, String description) {

    /**
     * Applies defaults for optional fields. Runs before Bean Validation, so defaults satisfy
     * constraints.
     */
    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (description == null) {
            description = "";
        }
    }
}
