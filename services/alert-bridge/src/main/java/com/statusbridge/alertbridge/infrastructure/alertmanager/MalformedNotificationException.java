package com.statusbridge.alertbridge.infrastructure.alertmanager;

/**
 * The webhook body is not a notification: not JSON, or no alert list.
 */
public class MalformedNotificationException extends RuntimeException {

    public MalformedNotificationException(String message) {
        super(message);
    }

    public MalformedNotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
