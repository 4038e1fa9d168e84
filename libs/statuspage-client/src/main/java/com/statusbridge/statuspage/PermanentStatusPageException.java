package com.statusbridge.statuspage;

/**
 * Request rejected by the backend (unknown id, validation error) or a response the client
 * cannot interpret. Needs operator attention; never retried.
 */
public class PermanentStatusPageException extends StatusPageException {

    public PermanentStatusPageException(String operation, int statusCode, String detail, Throwable cause) {
        super(operation, statusCode,
                operation + " rejected" + (statusCode == NO_STATUS ? "" : " with HTTP " + statusCode)
                        + (detail == null || detail.isBlank() ? "" : ": " + detail),
                cause);
    }

    public PermanentStatusPageException(String operation, String detail) {
        this(operation, NO_STATUS, detail, null);
    }

    /** True when the backend answered 404 for the referenced record. */
    public boolean isNotFound() {
        return statusCode() == 404;
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
