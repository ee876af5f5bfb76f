package com.intteq.reliable.rabbit.exception;

/**
 * The message is broken in a way that means it will never process successfully.
 * The consumer rejects it without requeueing.
 */
public class BadMessageException extends RuntimeException {

    public BadMessageException(String message) {
        super(message);
    }

    public BadMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
