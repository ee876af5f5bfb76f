package com.intteq.reliable.rabbit.publisher;

import com.rabbitmq.client.Channel;

import java.io.IOException;
import java.util.Map;

/**
 * Where a {@link FailoverPublisher} sends messages: a queue (through the default
 * exchange) or a named exchange.
 *
 * <p>{@link #declare(Channel, Map)} is called on every connect, so the target is
 * re-asserted after each failover.
 */
public interface PublishTarget {

    String DEFAULT_EXCHANGE_TYPE = "fanout";

    /**
     * Name of the queue or exchange, for logs.
     */
    String name();

    void declare(Channel channel, Map<String, Object> arguments) throws IOException;

    /**
     * Exchange passed to basic.publish.
     */
    String exchange();

    String routingKey();

    /** A durable queue. */
    static PublishTarget queue(String name) {
        return new QueueTarget(name, true);
    }

    static PublishTarget queue(String name, boolean durable) {
        return new QueueTarget(name, durable);
    }

    /** A non-durable fanout exchange. */
    static ExchangeTarget exchange(String name) {
        return new ExchangeTarget(name, DEFAULT_EXCHANGE_TYPE, false, "");
    }

    static ExchangeTarget exchange(String name, String type) {
        return new ExchangeTarget(name, type, false, "");
    }

    static ExchangeTarget durableExchange(String name, String type) {
        return new ExchangeTarget(name, type, true, "");
    }
}
