package com.intteq.reliable.rabbit.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.reliable.rabbit.exception.BadMessageException;
import jakarta.annotation.Nullable;

import java.util.Objects;

/**
 * {@link MessageProcessor} that deserialises the body with Jackson before handing it
 * to a typed handler. A body that does not map onto the payload type is a bad
 * message.
 *
 * @param <T> payload type
 */
public class JsonMessageProcessor<T> implements MessageProcessor {

    @FunctionalInterface
    public interface PayloadHandler<T> {
        void handle(T payload, @Nullable String txId);
    }

    private final ObjectMapper objectMapper;
    private final Class<T> payloadType;
    private final PayloadHandler<T> handler;

    public JsonMessageProcessor(ObjectMapper objectMapper, Class<T> payloadType, PayloadHandler<T> handler) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.payloadType = Objects.requireNonNull(payloadType, "payloadType must not be null");
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
    }

    @Override
    public void process(String body, @Nullable String txId) {
        T payload;
        try {
            payload = objectMapper.readValue(body, payloadType);
        } catch (JsonProcessingException e) {
            throw new BadMessageException("Unable to deserialize message body to " + payloadType.getName(), e);
        }
        handler.handle(payload, txId);
    }
}
