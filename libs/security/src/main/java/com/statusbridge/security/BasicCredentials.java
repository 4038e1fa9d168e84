package com.statusbridge.security;

/**
 * Username/password pair presented with HTTP Basic authentication.
 *
 * @param username the user id (may be empty, never null)
 * @param password the password (may be empty, never null)
 */
public record BasicCredentials(String username, String password) {

    public BasicCredentials {
        if (username == null || password == null) {
            throw new IllegalArgumentException("username and password must not be null");
        }
    }

    /** Never prints the password. */
    @Override
    public String toString() {
        return "BasicCredentials[username=" + username + ", password=****]";
    }
}
