package com.statusbridge.alertbridge.domain.ports;

/**
 * A gateway call did not reach a confirmed result. The caller leaves its state unchanged and
 * retries on the next trigger.
 */
public class GatewayException extends RuntimeException {

    private final String operation;
    private final boolean transientFailure;

    public GatewayException(String operation, boolean transientFailure, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.transientFailure = transientFailure;
    }

    public String operation() {
        return operation;
    }

    /** False when retrying cannot help without operator action (unknown component, 4xx). */
    public boolean isTransient() {
        return transientFailure;
    }
}
