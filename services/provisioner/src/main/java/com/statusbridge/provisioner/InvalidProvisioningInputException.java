package com.statusbridge.provisioner;

/**
 * A configuration document is missing, unreadable or has the wrong shape.
 */
public class InvalidProvisioningInputException extends RuntimeException {

    public InvalidProvisioningInputException(String message) {
        super(message);
    }

    public InvalidProvisioningInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
