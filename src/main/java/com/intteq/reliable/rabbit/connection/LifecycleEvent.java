package com.intteq.reliable.rabbit.connection;

import com.intteq.reliable.rabbit.DeliveryEnvelope;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Something the broker client (or a timer, or {@code stop()}) wants the run loop to
 * handle. Carries the connection or channel it originated from so events from a
 * previous connection can be told apart from current ones.
 */
final class LifecycleEvent {

    enum Type {
        CONNECTION_CLOSED,
        CHANNEL_CLOSED,
        CONSUMER_CANCELLED,
        DELIVERY,
        RECONNECT,
        STOP
    }

    private final Type type;
    private final Connection connection;
    private final Channel channel;
    private final ShutdownSignalException cause;
    private final DeliveryEnvelope envelope;

    private LifecycleEvent(Type type,
                           Connection connection,
                           Channel channel,
                           ShutdownSignalException cause,
                           DeliveryEnvelope envelope) {
        this.type = type;
        this.connection = connection;
        this.channel = channel;
        this.cause = cause;
        this.envelope = envelope;
    }

    static LifecycleEvent connectionClosed(Connection connection, ShutdownSignalException cause) {
        return new LifecycleEvent(Type.CONNECTION_CLOSED, connection, null, cause, null);
    }

    static LifecycleEvent channelClosed(Channel channel, ShutdownSignalException cause) {
        return new LifecycleEvent(Type.CHANNEL_CLOSED, null, channel, cause, null);
    }

    static LifecycleEvent consumerCancelled(Channel channel) {
        return new LifecycleEvent(Type.CONSUMER_CANCELLED, null, channel, null, null);
    }

    static LifecycleEvent delivery(Channel channel, DeliveryEnvelope envelope) {
        return new LifecycleEvent(Type.DELIVERY, null, channel, null, envelope);
    }

    static LifecycleEvent reconnect() {
        return new LifecycleEvent(Type.RECONNECT, null, null, null, null);
    }

    static LifecycleEvent stop() {
        return new LifecycleEvent(Type.STOP, null, null, null, null);
    }

    Type type() {
        return type;
    }

    Connection connection() {
        return connection;
    }

    Channel channel() {
        return channel;
    }

    ShutdownSignalException cause() {
        return cause;
    }

    DeliveryEnvelope envelope() {
        return envelope;
    }

    @Override
    public String toString() {
        return "LifecycleEvent[" + type + "]";
    }
}
