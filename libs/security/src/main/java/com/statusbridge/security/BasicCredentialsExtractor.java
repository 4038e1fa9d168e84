package com.statusbridge.security;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;
import java.util.Optional;

/**
 * Extracts HTTP Basic credentials from Authorization headers.
 * <p>
 * Expects {@code "Basic <base64(username:password)>"} (RFC 7617). The password may contain
 * colons; only the first colon separates the user id.
 */
public final class BasicCredentialsExtractor {

    private static final String SCHEME = "basic";

    private BasicCredentialsExtractor() {
        // utility class
    }

    /**
     * Extracts the credentials from an Authorization header value.
     *
     * @param authorizationHeader the full Authorization header value (may be null)
     * @return the decoded credentials, or empty if the header is missing/malformed
     */
    public static Optional<BasicCredentials> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() <= SCHEME.length()
                || !trimmed.substring(0, SCHEME.length()).toLowerCase(Locale.ROOT).equals(SCHEME)
                || !Character.isWhitespace(trimmed.charAt(SCHEME.length()))) {
            return Optional.empty();
        }
        String encoded = trimmed.substring(SCHEME.length()).strip();
        if (encoded.isEmpty()) {
            return Optional.empty();
        }

        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        int separator = decoded.indexOf(':');
        if (separator < 0) {
            return Optional.empty();
        }
        return Optional.of(new BasicCredentials(decoded.substring(0, separator), decoded.substring(separator + 1)));
    }

    /**
     * Builds an Authorization header value for the given credentials.
     */
    public static String encode(BasicCredentials credentials) {
        String raw = credentials.username() + ":" + credentials.password();
        return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }
}
