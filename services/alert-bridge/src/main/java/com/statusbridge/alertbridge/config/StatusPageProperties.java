package com.statusbridge.alertbridge.config;

import com.statusbridge.statuspage.StatusPageClientSettings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Status page backend connection, bound from {@code statusbridge.statuspage.*}.
 *
 * <pre>
 * statusbridge:
 *   statuspage:
 *     base-url: https://status.example.com/api/v1
 *     api-token: ${STATUSPAGE_API_TOKEN}
 *     max-attempts: 3
 *     initial-backoff: 500ms
 * </pre>
 *
 * Zero or missing numeric and duration values fall back to the client defaults.
 *
 * @param rehydrateOnStartup rebuild state from the backend when the application is ready (default true)
 */
@ConfigurationProperties(prefix = "statusbridge.statuspage")
@Validated
public record StatusPageProperties(
        @NotNull URI baseUrl,
        @NotBlank String apiToken,
        Duration connectTimeout,
        Duration readTimeout,
        int maxAttempts,
        Duration initialBackoff,
        int pageSize,
        Boolean rehydrateOnStartup) {

    public StatusPageProperties {
        if (rehydrateOnStartup == null) {
            rehydrateOnStartup = Boolean.TRUE;
        }
    }

    public StatusPageClientSettings toSettings() {
        return new StatusPageClientSettings(
                baseUrl, apiToken, connectTimeout, readTimeout, maxAttempts, initialBackoff, pageSize);
    }

    @Override
    public String toString() {
        return "StatusPageProperties[baseUrl=" + baseUrl + ", apiToken=***, maxAttempts=" + maxAttempts
                + ", rehydrateOnStartup=" + rehydrateOnStartup + "]";
    }
}
