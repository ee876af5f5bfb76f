package com.intteq.reliable.rabbit.publisher;

import com.rabbitmq.client.Channel;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * Publishes straight to a named queue through the default exchange.
 */
@ToString
@EqualsAndHashCode
public final class QueueTarget implements PublishTarget {

    private final String queue;
    private final boolean durable;

    public QueueTarget(String queue, boolean durable) {
        Objects.requireNonNull(queue, "queue must not be null");
        if (queue.isBlank()) {
            throw new IllegalArgumentException("queue must not be blank");
        }
        this.queue = queue;
        this.durable = durable;
    }

    @Override
    public String name() {
        return queue;
    }

    public boolean isDurable() {
        return durable;
    }

    @Override
    public void declare(Channel channel, Map<String, Object> arguments) throws IOException {
        channel.queueDeclare(queue, durable, false, false, arguments);
    }

    @Override
    public String exchange() {
        return "";
    }

    @Override
    public String routingKey() {
        return queue;
    }
}
