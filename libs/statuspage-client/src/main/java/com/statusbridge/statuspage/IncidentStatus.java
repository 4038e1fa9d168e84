package com.statusbridge.statuspage;

/**
 * Incident status enumeration of the status page backend, with its numeric wire codes.
 */
public enum IncidentStatus {

    SCHEDULED(0),
    INVESTIGATING(1),
    IDENTIFIED(2),
    WATCHING(3),
    FIXED(4);

    private final int code;

    IncidentStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /** True for every status except {@link #FIXED}. */
    public boolean isOpen() {
        return this != FIXED;
    }

    public static IncidentStatus fromCode(int code) {
        for (IncidentStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown incident status code: " + code);
    }
}
