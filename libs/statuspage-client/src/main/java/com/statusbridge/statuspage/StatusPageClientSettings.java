package com.statusbridge.statuspage;

import java.net.URI;
import java.time.Duration;

/**
 * Connection settings for {@link CachetStatusPageClient}.
 *
 * @param baseUrl        API root, e.g. {@code https://status.example.com/api}
 * @param apiToken       bearer token sent with every request
 * @param connectTimeout TCP connect timeout (default 5s)
 * @param readTimeout    response read timeout (default 10s)
 * @param maxAttempts    total attempts per call including the first (default 3)
 * @param initialBackoff wait before the first retry, doubled for each further retry (default 500ms)
 * @param pageSize       {@code per_page} used when listing (default 50)
 */
public record StatusPageClientSettings(
        URI baseUrl,
        String apiToken,
        Duration connectTimeout,
        Duration readTimeout,
        int maxAttempts,
        Duration initialBackoff,
        int pageSize) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final int DEFAULT_PAGE_SIZE = 50;

    /**
     * Applies defaults for optional fields.
     */
    public StatusPageClientSettings {
        if (baseUrl == null) {
            throw new IllegalArgumentException("baseUrl must not be null");
        }
        if (apiToken == null || apiToken.isBlank()) {
            throw new IllegalArgumentException("apiToken must not be blank");
        }
        if (connectTimeout == null || connectTimeout.isZero() || connectTimeout.isNegative()) {
            connectTimeout = Duration.ofSeconds(5);
        }
        if (readTimeout == null || readTimeout.isZero() || readTimeout.isNegative()) {
            readTimeout = Duration.ofSeconds(10);
        }
        if (maxAttempts <= 0) {
            maxAttempts = DEFAULT_MAX_ATTEMPTS;
        }
        if (initialBackoff == null || initialBackoff.toMillis() < 1) {
            initialBackoff = Duration.ofMillis(500);
        }
        if (pageSize <= 0) {
            pageSize = DEFAULT_PAGE_SIZE;
        }
    }

    /** Settings with every optional value defaulted. */
    public static StatusPageClientSettings of(URI baseUrl, String apiToken) {
        return new StatusPageClientSettings(baseUrl, apiToken, null, null, 0, null, 0);
    }
}
