package com.intteq.reliable.rabbit.exception;

/**
 * Thrown when a message could not be published on any broker endpoint, or was
 * refused by the broker after being sent.
 *
 * <p>Every failure path of a publish is folded into this single type. The
 * {@link Reason} is informational (logs, metrics); callers are expected to branch
 * on the exception type only.
 */
public class PublishMessageException extends RuntimeException {

    /**
     * Why the publish did not go through.
     */
    public enum Reason {
        /** No endpoint accepted a connection and declaration. */
        CONNECTION_FAILED,
        /** The broker negatively acknowledged the message in confirm mode. */
        NACKED,
        /** The message was returned because nothing was bound to its routing key. */
        UNROUTABLE,
        /** No confirm arrived within the configured timeout. */
        CONFIRM_TIMEOUT,
        /** Anything else. */
        UNEXPECTED
    }

    private final Reason reason;

    public PublishMessageException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public PublishMessageException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
