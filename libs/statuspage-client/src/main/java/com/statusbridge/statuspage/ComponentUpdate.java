package com.statusbridge.statuspage;

/**
 * Partial component update; null fields are left untouched by the backend.
 */
public record ComponentUpdate(ComponentStatus status, String description, Boolean enabled) {

    public static ComponentUpdate status(ComponentStatus status) {
        return new ComponentUpdate(status, null, null);
    }
}
