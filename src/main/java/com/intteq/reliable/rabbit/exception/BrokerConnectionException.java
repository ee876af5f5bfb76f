package com.intteq.reliable.rabbit.exception;

/**
 * Raised when every candidate broker endpoint refused a connection (or the
 * subsequent declaration) for a publisher.
 */
public class BrokerConnectionException extends RuntimeException {

    public BrokerConnectionException(String message) {
        super(message);
    }

    public BrokerConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
