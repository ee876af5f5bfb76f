package com.intteq.reliable.rabbit.publisher;

import com.rabbitmq.client.Channel;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * Publishes to a named exchange of a given type ({@code fanout} unless told
 * otherwise).
 */
@ToString
@EqualsAndHashCode
public final class ExchangeTarget implements PublishTarget {

    private final String exchange;
    private final String type;
    private final boolean durable;
    private final String routingKey;

    public ExchangeTarget(String exchange, String type, boolean durable, String routingKey) {
        Objects.requireNonNull(exchange, "exchange must not be null");
        if (exchange.isBlank()) {
            throw new IllegalArgumentException("exchange must not be blank");
        }
        this.exchange = exchange;
        this.type = type == null || type.isBlank() ? DEFAULT_EXCHANGE_TYPE : type;
        this.durable = durable;
        this.routingKey = routingKey == null ? "" : routingKey;
    }

    /**
     * @return a copy of this target publishing with the given routing key
     */
    public ExchangeTarget withRoutingKey(String key) {
        return new ExchangeTarget(exchange, type, durable, key);
    }

    @Override
    public String name() {
        return exchange;
    }

    public String type() {
        return type;
    }

    public boolean isDurable() {
        return durable;
    }

    @Override
    public void declare(Channel channel, Map<String, Object> arguments) throws IOException {
        channel.exchangeDeclare(exchange, type, durable, false, arguments);
    }

    @Override
    public String exchange() {
        return exchange;
    }

    @Override
    public String routingKey() {
        return routingKey;
    }
}
