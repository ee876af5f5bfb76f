package com.intteq.reliable.rabbit;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * One inbound message: delivery tag, header metadata and body.
 *
 * <p>Instances are immutable. Headers are copied into an unmodifiable map and the
 * body is copied on the way in and on the way out.
 */
@Getter
@Accessors(fluent = true)
@ToString(exclude = "body")
public final class DeliveryEnvelope {

    private final long deliveryTag;
    private final Map<String, Object> headers;
    private final String appId;
    private final String contentType;
    private final boolean redelivered;
    private final byte[] body;

    public DeliveryEnvelope(long deliveryTag,
                            Map<String, Object> headers,
                            String appId,
                            String contentType,
                            boolean redelivered,
                            byte[] body) {
        this.deliveryTag = deliveryTag;
        this.headers = headers == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new HashMap<>(headers));
        this.appId = appId;
        this.contentType = contentType;
        this.redelivered = redelivered;
        this.body = body == null ? new byte[0] : body.clone();
    }

    /**
     * Builds an envelope from the pieces handed to a RabbitMQ client consumer.
     */
    public static DeliveryEnvelope from(Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        AMQP.BasicProperties props = properties != null ? properties : new AMQP.BasicProperties();
        return new DeliveryEnvelope(
                envelope.getDeliveryTag(),
                props.getHeaders(),
                props.getAppId(),
                props.getContentType(),
                envelope.isRedeliver(),
                body
        );
    }

    public byte[] body() {
        return body.clone();
    }

    public Object header(String name) {
        return headers.get(name);
    }
}
