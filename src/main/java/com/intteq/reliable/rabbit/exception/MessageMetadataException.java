package com.intteq.reliable.rabbit.exception;

/**
 * A header the consumer needs ({@code x-delivery-count}, {@code tx_id}) is missing
 * or unreadable.
 */
public class MessageMetadataException extends RuntimeException {

    private final String header;

    public MessageMetadataException(String header, String message) {
        super(message);
        this.header = header;
    }

    public String getHeader() {
        return header;
    }
}
