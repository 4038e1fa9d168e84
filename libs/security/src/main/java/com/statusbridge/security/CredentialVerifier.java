package com.statusbridge.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Verifies presented Basic credentials against a single configured account.
 * <p>
 * Comparison runs in constant time with respect to the content of the secrets, so response
 * timing does not reveal how many leading characters matched.
 */
public final class CredentialVerifier {

    private final byte[] expectedUsername;
    private final byte[] expectedPassword;

    /**
     * @param expected the only credentials that are accepted (blank values are rejected)
     */
    public CredentialVerifier(BasicCredentials expected) {
        if (expected == null || expected.username().isBlank() || expected.password().isBlank()) {
            throw new IllegalArgumentException("expected credentials must have a username and password");
        }
        this.expectedUsername = expected.username().getBytes(StandardCharsets.UTF_8);
        this.expectedPassword = expected.password().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Returns true when the presented credentials match the configured account.
     */
    public boolean matches(BasicCredentials presented) {
        if (presented == null) {
            return false;
        }
        boolean userMatches = MessageDigest.isEqual(
                expectedUsername, presented.username().getBytes(StandardCharsets.UTF_8));
        boolean passwordMatches = MessageDigest.isEqual(
                expectedPassword, presented.password().getBytes(StandardCharsets.UTF_8));
        return userMatches & passwordMatches;
    }

    /**
     * Convenience: extracts credentials from the header and verifies them.
     *
     * @param authorizationHeader raw Authorization header (may be null)
     */
    public boolean matchesHeader(String authorizationHeader) {
        return BasicCredentialsExtractor.extract(authorizationHeader)
                .map(this::matches)
                .orElse(false);
    }
}
