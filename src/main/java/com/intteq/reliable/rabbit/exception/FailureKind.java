package com.intteq.reliable.rabbit.exception;

/**
 * Closed set of failure kinds a message can end up in.
 *
 * <p>The consumer's disposition policy switches on this value rather than on
 * individual exception classes, so adding a new exception type means mapping it
 * here.
 */
public enum FailureKind {

    MALFORMED_METADATA("rejected"),
    BAD_MESSAGE("rejected"),
    QUARANTINABLE("quarantined"),
    RETRYABLE("nack"),
    UNEXPECTED("nack");

    private final String action;

    FailureKind(String action) {
        this.action = action;
    }

    /**
     * @return the action label written to logs for this kind
     */
    public String action() {
        return action;
    }

    public static FailureKind classify(Throwable error) {
        if (error instanceof MessageMetadataException) {
            return MALFORMED_METADATA;
        }
        if (error instanceof BadMessageException) {
            return BAD_MESSAGE;
        }
        if (error instanceof QuarantinableException) {
            return QUARANTINABLE;
        }
        if (error instanceof RetryableException) {
            return RETRYABLE;
        }
        return UNEXPECTED;
    }
}
