package com.intteq.reliable.rabbit.exception;

/**
 * A transient failure (network blip, downstream service unavailable). The message
 * itself is valid and is negatively acknowledged so the broker redelivers it.
 */
public class RetryableException extends RuntimeException {

    public RetryableException(String message) {
        super(message);
    }

    public RetryableException(String message, Throwable cause) {
        super(message, cause);
    }
}
