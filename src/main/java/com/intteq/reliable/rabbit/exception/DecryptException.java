package com.intteq.reliable.rabbit.exception;

/**
 * The message body could not be decrypted. It may be corrupt, or the keys may be
 * out of step. Handled like any other bad message.
 */
public class DecryptException extends BadMessageException {

    public DecryptException(String message) {
        super(message);
    }

    public DecryptException(String message, Throwable cause) {
        super(message, cause);
    }
}
