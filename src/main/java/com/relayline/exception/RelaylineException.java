package com.relayline.exception;

/**
 * Base exception for all Relayline application-specific errors.
 */
public class RelaylineException extends RuntimeException {

    public RelaylineException(String message) {
        super(message);
    }

    public RelaylineException(String message, Throwable cause) {
        super(message, cause);
    }
}
