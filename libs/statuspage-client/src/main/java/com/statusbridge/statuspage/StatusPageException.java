package com.statusbridge.statuspage;

/**
 * Failure of a call against the status page backend.
 * <p>
 * Callers distinguish the two kinds through {@link #isTransient()}: transient failures
 * (I/O errors, timeouts, 5xx, 429) have already been retried by the client when they reach
 * the caller; permanent failures (other 4xx, unreadable responses) were not retried because
 * retrying cannot fix them.
 */
public abstract class StatusPageException extends RuntimeException {

    /** Marker for failures that carried no HTTP status. */
    public static final int NO_STATUS = -1;

    private final String operation;
    private final int statusCode;

    protected StatusPageException(String operation, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.statusCode = statusCode;
    }

    /** Logical client operation that failed (e.g. "createIncident"). */
    public String operation() {
        return operation;
    }

    /** HTTP status of the failed call, or {@link #NO_STATUS}. */
    public int statusCode() {
        return statusCode;
    }

    public abstract boolean isTransient();
}
