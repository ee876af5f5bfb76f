package com.intteq.reliable.rabbit;

import com.intteq.reliable.rabbit.exception.MessageMetadataException;

/**
 * Reads the metadata the consumer relies on out of message headers.
 *
 * <p>String header values arrive from the RabbitMQ client as
 * {@code com.rabbitmq.client.LongString}, so values are read through
 * {@link Object#toString()} rather than cast.
 */
public final class MessageHeaders {

    public static final String TX_ID = "tx_id";
    public static final String DELIVERY_COUNT = "x-delivery-count";

    private MessageHeaders() {
    }

    /**
     * @return the stored {@code x-delivery-count} plus one
     * @throws MessageMetadataException if the header is absent or not numeric
     */
    public static int deliveryCount(DeliveryEnvelope envelope) {
        Object value = envelope.header(DELIVERY_COUNT);
        if (value == null) {
            throw new MessageMetadataException(DELIVERY_COUNT, "No " + DELIVERY_COUNT + " in message headers");
        }
        if (value instanceof Number) {
            return ((Number) value).intValue() + 1;
        }
        try {
            return Integer.parseInt(value.toString().trim()) + 1;
        } catch (NumberFormatException e) {
            throw new MessageMetadataException(DELIVERY_COUNT,
                    "Non-numeric " + DELIVERY_COUNT + " in message headers: " + value);
        }
    }

    /**
     * @throws MessageMetadataException if the header is absent or blank
     */
    public static String txId(DeliveryEnvelope envelope) {
        Object value = envelope.header(TX_ID);
        if (value == null || value.toString().isBlank()) {
            throw new MessageMetadataException(TX_ID, "No " + TX_ID + " in message headers");
        }
        return value.toString();
    }
}
