package com.statusbridge.statuspage;

/**
 * Component status enumeration of the status page backend, with its numeric wire codes.
 */
public enum ComponentStatus {

    UNKNOWN(0),
    OPERATIONAL(1),
    PERFORMANCE_ISSUES(2),
    PARTIAL_OUTAGE(3),
    MAJOR_OUTAGE(4);

    private final int code;

    ComponentStatus(int code) {
        this.code = code;
    }

    /** Numeric value sent to and received from the backend. */
    public int code() {
        return code;
    }

    /**
     * Maps a wire code to the enum; codes the backend may add later map to {@link #UNKNOWN}.
     */
    public static ComponentStatus fromCode(int code) {
        for (ComponentStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
