package com.intteq.reliable.rabbit.publisher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.reliable.rabbit.QuarantineSink;
import com.intteq.reliable.rabbit.connection.BrokerConnector;
import com.intteq.reliable.rabbit.connection.EndpointSet;
import com.intteq.reliable.rabbit.exception.BrokerConnectionException;
import com.intteq.reliable.rabbit.exception.PublishMessageException;
import com.intteq.reliable.rabbit.exception.PublishMessageException.Reason;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Return;
import com.rabbitmq.client.ShutdownSignalException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.Nullable;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Publishes messages to a {@link PublishTarget} on the first broker endpoint that
 * accepts a connection.
 *
 * <p>Supports:
 * <ul>
 *     <li>Failover across endpoints, always tried in list order</li>
 *     <li>Queue and exchange targets, declared on every connect</li>
 *     <li>Publisher confirms (optional)</li>
 *     <li>Mandatory publishes, with returned messages reported as failures</li>
 *     <li>Micrometer metrics (optional)</li>
 * </ul>
 *
 * <p>A connection is opened for each publish and closed afterwards. Every failure
 * of {@link #publish} surfaces as a {@link PublishMessageException}.
 *
 * <p>Instances are safe to share; publishes are serialised.
 */
@Slf4j
public class FailoverPublisher implements QuarantineSink {

    private static final Duration DEFAULT_CONFIRM_TIMEOUT = Duration.ofSeconds(10);
    private static final int PERSISTENT = 2;

    private final List<String> urls;
    private final PublishTarget target;
    private final BrokerConnector connector;
    private final Map<String, Object> arguments;
    private final boolean confirmDelivery;
    private final Duration confirmTimeout;
    private final ObjectMapper objectMapper;

    @Nullable
    private final MeterRegistry meterRegistry;

    private Connection connection;
    private Channel channel;

    @Builder
    private FailoverPublisher(List<String> urls,
                              PublishTarget target,
                              BrokerConnector connector,
                              Map<String, Object> arguments,
                              boolean confirmDelivery,
                              Duration confirmTimeout,
                              ObjectMapper objectMapper,
                              @Nullable MeterRegistry meterRegistry) {
        this.urls = new EndpointSet(urls).urls();
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.connector = Objects.requireNonNull(connector, "connector must not be null");
        this.arguments = arguments != null ? Map.copyOf(arguments) : Map.of();
        this.confirmDelivery = confirmDelivery;
        this.confirmTimeout = confirmTimeout != null ? confirmTimeout : DEFAULT_CONFIRM_TIMEOUT;
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.meterRegistry = meterRegistry;
    }

    public PublishTarget target() {
        return target;
    }

    public boolean isConfirmDelivery() {
        return confirmDelivery;
    }

    // ========================================================================
    //   Connect
    // ========================================================================

    /**
     * Connects to the first endpoint, in list order, that accepts a connection and
     * the target declaration. Confirm mode is enabled right after the declare. A
     * connection left open by an earlier call is closed first.
     *
     * @throws BrokerConnectionException when every endpoint failed
     */
    public synchronized void connect() {
        if (connection != null) {
            disconnect();
        }
        log.info("Connecting to rabbit target={}", target.name());
        Exception lastError = null;

        for (String url : urls) {
            Connection opened = null;
            try {
                opened = connector.connect(url);
                Channel openedChannel = opened.createChannel();
                if (openedChannel == null) {
                    throw new IOException("Broker refused to open a channel");
                }

                target.declare(openedChannel, arguments);
                if (confirmDelivery) {
                    openedChannel.confirmSelect();
                    log.info("Enabled delivery confirmation");
                }

                this.connection = opened;
                this.channel = openedChannel;
                log.debug("Connected to rabbit endpoint={}", EndpointSet.redact(url));
                return;

            } catch (IOException | TimeoutException e) {
                log.error("Unable to connect to rabbit endpoint={}", EndpointSet.redact(url), e);
                lastError = e;
            } catch (RuntimeException e) {
                log.error("Unexpected exception connecting to rabbit endpoint={}", EndpointSet.redact(url), e);
                lastError = e;
            }
            close(opened);
        }

        throw new BrokerConnectionException(
                "Unable to connect to any of " + urls.size() + " rabbit endpoints for " + target.name(), lastError);
    }

    private synchronized void disconnect() {
        close(connection);
        connection = null;
        channel = null;
        log.debug("Disconnected from rabbit");
    }

    private void close(Connection target) {
        if (target == null || !target.isOpen()) {
            return;
        }
        try {
            target.close();
        } catch (IOException | ShutdownSignalException e) {
            log.warn("Unable to close connection", e);
        }
    }

    // ========================================================================
    //   Publish
    // ========================================================================

    @Override
    public void publish(byte[] message) {
        publish(message, null, null, false, false);
    }

    public void publish(String message) {
        publish(message.getBytes(StandardCharsets.UTF_8));
    }

    public void publish(String message, String contentType, Map<String, Object> headers) {
        publish(message.getBytes(StandardCharsets.UTF_8), contentType, headers, false, false);
    }

    /**
     * Serialises the payload with Jackson and publishes it as
     * {@code application/json}.
     *
     * @throws IllegalArgumentException if the payload cannot be serialised
     */
    public void publishJson(Object payload) {
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize message payload to JSON: " + payload.getClass().getName(), e);
        }
        publish(body, "application/json", null, false, false);
    }

    /**
     * Connects and publishes one persistent message to the target.
     *
     * @param message     message body
     * @param contentType content-type property, may be null
     * @param headers     message headers, may be null
     * @param mandatory   ask the broker to return the message if it cannot be routed
     * @param immediate   the AMQP immediate flag (refused by RabbitMQ 3.0 and later)
     * @throws PublishMessageException on any failure
     */
    public synchronized void publish(byte[] message,
                                     @Nullable String contentType,
                                     @Nullable Map<String, Object> headers,
                                     boolean mandatory,
                                     boolean immediate) {
        log.debug("Publishing message target={}", target.name());
        try {
            connect();
            doPublish(message, contentType, headers, mandatory, immediate);
            recordPublish("success");

        } catch (BrokerConnectionException e) {
            throw failure(Reason.CONNECTION_FAILED, "Connection error occurred. Message not published.", e);
        } catch (PublishMessageException e) {
            recordPublish(e.getReason().name().toLowerCase());
            log.error("{} target={}", e.getMessage(), target.name());
            throw e;
        } catch (TimeoutException e) {
            throw failure(Reason.CONFIRM_TIMEOUT, "Publish confirm timed out. Message not published.", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure(Reason.UNEXPECTED, "Interrupted while publishing. Message not published.", e);
        } catch (IOException | RuntimeException e) {
            throw failure(Reason.UNEXPECTED, "Unknown exception occurred. Message not published.", e);
        } finally {
            disconnect();
        }
    }

    private void doPublish(byte[] message,
                           String contentType,
                           Map<String, Object> headers,
                           boolean mandatory,
                           boolean immediate) throws IOException, InterruptedException, TimeoutException {

        AtomicReference<Return> returned = new AtomicReference<>();
        boolean awaitConfirm = confirmDelivery || mandatory;
        if (mandatory) {
            channel.addReturnListener(ret -> returned.set(ret));
            if (!confirmDelivery) {
                // a return can only be awaited through the confirm that follows it
                channel.confirmSelect();
            }
        }

        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .contentType(contentType)
                .headers(headers)
                .deliveryMode(PERSISTENT)
                .build();

        channel.basicPublish(target.exchange(), target.routingKey(), mandatory, immediate, properties, message);

        // basic.return precedes basic.ack, so once confirmed a return has been seen
        if (awaitConfirm && !channel.waitForConfirms(confirmTimeout.toMillis())) {
            throw new PublishMessageException(Reason.NACKED, "NackError occurred. Message not published.");
        }

        Return ret = returned.get();
        if (ret != null) {
            throw new PublishMessageException(Reason.UNROUTABLE,
                    "UnroutableError occurred. Message not published. reply_code="
                            + ret.getReplyCode() + " reply_text=" + ret.getReplyText());
        }

        log.info("Published message target={} exchange={} routing_key={}",
                target.name(), target.exchange(), target.routingKey());
    }

    private PublishMessageException failure(Reason reason, String message, Exception cause) {
        recordPublish(reason.name().toLowerCase());
        log.error("{} target={}", message, target.name(), cause);
        return new PublishMessageException(reason, message, cause);
    }

    // ========================================================================
    //   Metrics
    // ========================================================================

    private void recordPublish(String outcome) {
        if (meterRegistry == null) return;

        meterRegistry.counter(
                        "reliable.rabbit.publish",
                        "target", target.name(),
                        "outcome", outcome
                )
                .increment();
    }
}
