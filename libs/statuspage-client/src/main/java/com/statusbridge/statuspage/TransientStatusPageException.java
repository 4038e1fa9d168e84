package com.statusbridge.statuspage;

/**
 * Network failure, timeout or server-side error; safe to retry later.
 */
public class TransientStatusPageException extends StatusPageException {

    public TransientStatusPageException(String operation, int statusCode, Throwable cause) {
        super(operation, statusCode,
                operation + " failed" + (statusCode == NO_STATUS ? "" : " with HTTP " + statusCode)
                        + (cause != null ? ": " + cause.getMessage() : ""),
                cause);
    }

    public TransientStatusPageException(String operation, Throwable cause) {
        this(operation, NO_STATUS, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
