package com.intteq.reliable.rabbit.exception;

/**
 * The failure cannot be classified safely. The message is copied to the
 * quarantine target for offline inspection and then rejected.
 */
public class QuarantinableException extends RuntimeException {

    public QuarantinableException(String message) {
        super(message);
    }

    public QuarantinableException(String message, Throwable cause) {
        super(message, cause);
    }
}
