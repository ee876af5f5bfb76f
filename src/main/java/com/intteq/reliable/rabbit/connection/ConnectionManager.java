package com.intteq.reliable.rabbit.connection;

import com.intteq.reliable.rabbit.DeliveryEnvelope;
import com.intteq.reliable.rabbit.MessageAcknowledger;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Keeps one connection + channel attached to one of several broker endpoints and
 * consumes a single queue with manual acknowledgement.
 *
 * <p><b>Threading:</b></p>
 * <ul>
 *     <li>{@link #run(DeliveryHandler)} blocks the calling thread and is the only
 *     place state changes and deliveries are handled.</li>
 *     <li>Broker client callbacks (shutdown listeners, consumer callbacks) only
 *     enqueue {@link LifecycleEvent}s for the run loop.</li>
 *     <li>Reconnects after an unexpected closure are posted by a single-thread
 *     scheduler after a fixed delay.</li>
 * </ul>
 *
 * <p><b>Backoff:</b> failed attempts inside {@link #connect()} sleep
 * {@code min(attempt * backoffStep, backoffCap)}. An unexpected closure of an
 * established connection waits the fixed {@code reconnectDelay} instead.</p>
 */
@Slf4j
public class ConnectionManager implements MessageAcknowledger {

    private final ConsumerSettings settings;
    private final BrokerConnector connector;
    private final EndpointSet endpoints;

    private final BlockingQueue<LifecycleEvent> events = new LinkedBlockingQueue<>();
    private final ScheduledExecutorService scheduler;

    /** Counted down once by {@link #stop()}; doubles as the closing flag. */
    private final CountDownLatch stopRequested = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile ConnectionState state = ConnectionState.NEW;
    private volatile Connection connection;
    private volatile Channel channel;
    private volatile String consumerTag;
    private volatile Thread runThread;

    private DeliveryHandler handler;

    public ConnectionManager(ConsumerSettings settings, BrokerConnector connector) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.connector = Objects.requireNonNull(connector, "connector must not be null");
        if (settings.getQueue() == null || settings.getQueue().isBlank()) {
            throw new IllegalArgumentException("A queue name is required");
        }
        if (settings.getPrefetch() < 1) {
            throw new IllegalArgumentException("prefetch must be at least 1");
        }
        this.endpoints = new EndpointSet(settings.getUrls());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "rabbit-reconnect-" + settings.getQueue());
            thread.setDaemon(true);
            return thread;
        });
    }

    public ConnectionState state() {
        return state;
    }

    public EndpointSet endpoints() {
        return endpoints;
    }

    public boolean isClosing() {
        return stopRequested.getCount() == 0;
    }

    // =====================================================================
    // RUN LOOP
    // =====================================================================

    /**
     * Connects and processes lifecycle events until {@link #stop()} completes.
     *
     * @throws IllegalStateException if the manager was already started or stopped
     */
    public void run(DeliveryHandler deliveryHandler) {
        Objects.requireNonNull(deliveryHandler, "deliveryHandler must not be null");

        synchronized (this) {
            if (state != ConnectionState.NEW) {
                throw new IllegalStateException("ConnectionManager cannot be run from state " + state);
            }
            transition(ConnectionState.CONNECTING);
            this.handler = deliveryHandler;
            this.runThread = Thread.currentThread();
        }

        log.debug("Running rabbit consumer queue={}", settings.getQueue());

        try {
            if (connect()) {
                onConnectionOpen();
            }
            while (state != ConnectionState.CLOSED) {
                dispatch(events.take());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Run loop interrupted, shutting down queue={}", settings.getQueue());
            stopRequested.countDown();
            onStop();
        } finally {
            if (state != ConnectionState.CLOSED) {
                log.error("Run loop exited abnormally state={}, closing connection queue={}",
                        state, settings.getQueue());
                abort();
            }
            scheduler.shutdownNow();
            terminated.countDown();
            log.debug("Run loop exited queue={}", settings.getQueue());
        }
    }

    private void dispatch(LifecycleEvent event) {
        log.trace("Dispatching {} state={}", event, state);
        switch (event.type()) {
            case DELIVERY -> onDelivery(event.channel(), event.envelope());
            case CONNECTION_CLOSED -> onConnectionClosed(event.connection(), event.cause());
            case CHANNEL_CLOSED -> onChannelClosed(event.channel(), event.cause());
            case CONSUMER_CANCELLED -> onConsumerCancelled(event.channel());
            case RECONNECT -> reconnect();
            case STOP -> onStop();
        }
    }

    // =====================================================================
    // CONNECT
    // =====================================================================

    /**
     * Tries endpoints round-robin, starting at the current cursor, until one
     * accepts a connection. Blocks between attempts with an escalating, capped
     * backoff.
     *
     * @return {@code true} once connected; {@code false} only if {@link #stop()}
     * was requested first, in which case the state is {@code CLOSED}
     */
    public boolean connect() {
        if (state != ConnectionState.CONNECTING) {
            transition(ConnectionState.CONNECTING);
        }

        int attempt = 0;
        while (!isClosing()) {
            attempt++;
            String url = endpoints.next();
            try {
                log.info("Connecting attempt={} endpoint={}", attempt, EndpointSet.redact(url));
                Connection opened = connector.connect(url);
                this.connection = opened;
                transition(ConnectionState.OPEN);
                log.info("Connection opened endpoint={} attempt={}", EndpointSet.redact(url), attempt);
                return true;
            } catch (IOException | TimeoutException | RuntimeException e) {
                Duration delay = backoff(attempt);
                log.error("Connection error attempt={} endpoint={} retry_in_ms={}",
                        attempt, EndpointSet.redact(url), delay.toMillis(), e);
                if (awaitStop(delay)) {
                    break;
                }
            }
        }

        log.info("Stop requested while connecting queue={}", settings.getQueue());
        transition(ConnectionState.CLOSED);
        return false;
    }

    Duration backoff(int attempt) {
        Duration delay = settings.getBackoffStep().multipliedBy(attempt);
        return delay.compareTo(settings.getBackoffCap()) > 0 ? settings.getBackoffCap() : delay;
    }

    /**
     * @return {@code true} if a stop was requested during the wait
     */
    private boolean awaitStop(Duration delay) {
        try {
            return stopRequested.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested.countDown();
            return true;
        }
    }

    private void reconnect() {
        if (isClosing()) {
            transition(ConnectionState.CLOSED);
            return;
        }
        if (connect()) {
            onConnectionOpen();
        }
    }

    // =====================================================================
    // OPEN SEQUENCE
    // =====================================================================

    void onConnectionOpen() {
        Connection current = connection;
        log.info("Adding connection close callback");
        current.addShutdownListener(cause -> events.add(LifecycleEvent.connectionClosed(current, cause)));

        log.info("Creating a new channel");
        try {
            Channel opened = current.createChannel();
            if (opened == null) {
                throw new IOException("Broker refused to open a channel");
            }
            this.channel = opened;
            transition(ConnectionState.CHANNEL_OPEN);
            onChannelOpen(opened);
        } catch (IOException | ShutdownSignalException e) {
            log.error("Channel setup failed, closing connection queue={}", settings.getQueue(), e);
            closeConnection(current);
        }
    }

    /**
     * Declares exchange, queue and binding, then starts consuming. Each call is a
     * synchronous RPC, so a step is only issued once the previous one was
     * confirmed by the broker.
     */
    void onChannelOpen(Channel opened) throws IOException {
        log.info("Channel opened channel={}", opened.getChannelNumber());
        opened.addShutdownListener(cause -> events.add(LifecycleEvent.channelClosed(opened, cause)));

        String queue = settings.getQueue();

        if (settings.hasExchange()) {
            log.info("Declaring exchange name={} type={}", settings.getExchange(), settings.getExchangeType());
            opened.exchangeDeclare(settings.getExchange(), settings.getExchangeType(),
                    settings.isDurableExchange(), false, settings.getExchangeArguments());
            log.info("Exchange declared name={}", settings.getExchange());
        }

        log.info("Declaring queue name={} durable={}", queue, settings.isDurableQueue());
        opened.queueDeclare(queue, settings.isDurableQueue(), false, false, settings.getQueueArguments());

        if (settings.hasExchange()) {
            log.info("Binding to rabbit exchange={} queue={} routing_key={}",
                    settings.getExchange(), queue, settings.effectiveRoutingKey());
            opened.queueBind(queue, settings.getExchange(), settings.effectiveRoutingKey());
            log.info("Queue bound queue={}", queue);
        }

        startConsuming(opened);
    }

    private void startConsuming(Channel opened) throws IOException {
        log.info("Issuing consumer related RPC commands prefetch={}", settings.getPrefetch());
        opened.basicQos(settings.getPrefetch());
        this.consumerTag = opened.basicConsume(settings.getQueue(), false, new EnvelopeConsumer(opened));
        transition(ConnectionState.CONSUMING);
        log.info("Consuming queue={} consumer_tag={}", settings.getQueue(), consumerTag);
    }

    // =====================================================================
    // CLOSE EVENTS
    // =====================================================================

    void onConnectionClosed(Connection source, ShutdownSignalException cause) {
        if (source != connection) {
            log.debug("Ignoring closure of a previous connection");
            return;
        }
        this.channel = null;
        this.consumerTag = null;

        if (isClosing()) {
            transition(ConnectionState.CLOSED);
            log.info("Connection closed queue={}", settings.getQueue());
            return;
        }

        Duration delay = settings.getReconnectDelay();
        log.warn("Connection closed, reopening in {} ms reason={}", delay.toMillis(), describe(cause));
        transition(ConnectionState.CONNECTING);
        scheduler.schedule(() -> events.add(LifecycleEvent.reconnect()), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * A channel closed by the broker usually means a protocol violation (for example
     * re-declaring a queue with different parameters). The connection is closed
     * too, which leads to the reconnect path.
     */
    void onChannelClosed(Channel source, ShutdownSignalException cause) {
        if (source != channel) {
            log.debug("Ignoring closure of a previous channel");
            return;
        }
        log.warn("Channel was closed reason={}", describe(cause));
        this.channel = null;
        this.consumerTag = null;

        Connection current = connection;
        if (current != null) {
            closeConnection(current);
        }
    }

    void onConsumerCancelled(Channel source) {
        if (source != channel) {
            return;
        }
        log.info("Consumer was cancelled remotely, shutting down queue={}", settings.getQueue());
        closeChannel(source);
    }

    private void onDelivery(Channel source, DeliveryEnvelope envelope) {
        if (source != channel) {
            log.warn("Dropping delivery from a closed channel delivery_tag={}, broker will redeliver",
                    envelope.deliveryTag());
            return;
        }
        try {
            handler.onDelivery(envelope);
        } catch (RuntimeException e) {
            log.error("Delivery handler failed delivery_tag={}, closing channel so the broker redelivers",
                    envelope.deliveryTag(), e);
            closeChannel(source);
        }
    }

    // =====================================================================
    // STOP
    // =====================================================================

    /**
     * Requests shutdown: cancels the consumer, waits for the broker's cancel-ok,
     * then closes channel and connection. Blocks until the run loop exits or the
     * shutdown timeout elapses. An envelope already being processed is finished
     * first.
     */
    public void stop() {
        synchronized (this) {
            if (state == ConnectionState.NEW) {
                stopRequested.countDown();
                transition(ConnectionState.CLOSED);
                terminated.countDown();
                return;
            }
        }

        if (!isClosing()) {
            log.info("Stopping queue={}", settings.getQueue());
            stopRequested.countDown();
            events.add(LifecycleEvent.stop());
        }

        if (Thread.currentThread() == runThread) {
            return;
        }

        try {
            Duration timeout = settings.getShutdownTimeout();
            if (!terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Consumer did not stop within {} ms queue={}", timeout.toMillis(), settings.getQueue());
                return;
            }
            log.info("Stopped queue={}", settings.getQueue());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for consumer to stop queue={}", settings.getQueue());
        }
    }

    private void onStop() {
        if (state == ConnectionState.CLOSED) {
            return;
        }

        Connection currentConnection = connection;
        Channel currentChannel = channel;

        // waiting for a scheduled reconnect: nothing is open
        if (state == ConnectionState.CONNECTING || currentConnection == null) {
            this.connection = null;
            transition(ConnectionState.CLOSED);
            return;
        }

        transition(ConnectionState.CLOSING);

        String tag = consumerTag;
        if (currentChannel != null && currentChannel.isOpen() && tag != null) {
            log.info("Sending a Basic.Cancel RPC command to RabbitMQ consumer_tag={}", tag);
            try {
                currentChannel.basicCancel(tag);
                log.info("RabbitMQ acknowledged the cancellation of the consumer");
            } catch (IOException | ShutdownSignalException e) {
                log.warn("Failed to cancel consumer consumer_tag={}", tag, e);
            }
        }

        this.channel = null;
        this.consumerTag = null;
        closeChannel(currentChannel);
        closeConnection(currentConnection);
        this.connection = null;

        transition(ConnectionState.CLOSED);
    }

    /**
     * Releases the channel and connection without cancelling the consumer, so the
     * broker requeues any unacknowledged delivery.
     */
    private void abort() {
        stopRequested.countDown();
        Channel currentChannel = channel;
        Connection currentConnection = connection;
        this.channel = null;
        this.consumerTag = null;
        this.connection = null;
        closeChannel(currentChannel);
        closeConnection(currentConnection);
        transition(ConnectionState.CLOSED);
    }

    private void closeChannel(Channel target) {
        if (target == null || !target.isOpen()) {
            return;
        }
        log.info("Closing the channel");
        try {
            target.close();
        } catch (IOException | TimeoutException | ShutdownSignalException e) {
            log.warn("Failed to close channel cleanly", e);
        }
    }

    private void closeConnection(Connection target) {
        if (target == null || !target.isOpen()) {
            return;
        }
        log.info("Closing connection");
        try {
            target.close();
        } catch (IOException | ShutdownSignalException e) {
            log.warn("Failed to close connection cleanly", e);
        }
    }

    // =====================================================================
    // ACKNOWLEDGEMENT PRIMITIVES
    // =====================================================================

    @Override
    public void acknowledgeMessage(long deliveryTag, Map<String, ?> fields) {
        log.info("Acknowledging message delivery_tag={} {}", deliveryTag, fields);
        onChannel("ack", deliveryTag, target -> target.basicAck(deliveryTag, false));
    }

    @Override
    public void nackMessage(long deliveryTag, Map<String, ?> fields) {
        log.info("Nacking message delivery_tag={} {}", deliveryTag, fields);
        onChannel("nack", deliveryTag, target -> target.basicNack(deliveryTag, false, true));
    }

    @Override
    public void rejectMessage(long deliveryTag, boolean requeue, Map<String, ?> fields) {
        log.info("Rejecting message delivery_tag={} requeue={} {}", deliveryTag, requeue, fields);
        onChannel("reject", deliveryTag, target -> target.basicReject(deliveryTag, requeue));
    }

    /**
     * Runs an acknowledgement on the current channel. When the channel is gone the
     * delivery is already unacknowledged on the broker side and will be redelivered,
     * so the failure is logged rather than rethrown into the disposition policy.
     */
    private void onChannel(String action, long deliveryTag, ChannelAction call) {
        Channel current = channel;
        if (current == null || !current.isOpen()) {
            log.warn("Channel unavailable, cannot {} delivery_tag={}; broker will redeliver", action, deliveryTag);
            return;
        }
        try {
            call.apply(current);
        } catch (IOException | ShutdownSignalException e) {
            log.error("Failed to {} message delivery_tag={}; broker will redeliver", action, deliveryTag, e);
        }
    }

    @FunctionalInterface
    private interface ChannelAction {
        void apply(Channel channel) throws IOException;
    }

    // =====================================================================
    // INTERNALS
    // =====================================================================

    private synchronized void transition(ConnectionState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal connection state transition " + state + " -> " + next);
        }
        log.debug("Connection state {} -> {} queue={}", state, next, settings.getQueue());
        state = next;
    }

    private static String describe(ShutdownSignalException cause) {
        if (cause == null) {
            return "<none>";
        }
        Object reason = cause.getReason();
        if (reason instanceof AMQP.Connection.Close close) {
            return close.getReplyCode() + " " + close.getReplyText();
        }
        if (reason instanceof AMQP.Channel.Close close) {
            return close.getReplyCode() + " " + close.getReplyText();
        }
        return cause.getMessage();
    }

    /**
     * Client-side consumer that turns broker callbacks into lifecycle events.
     */
    private final class EnvelopeConsumer extends DefaultConsumer {

        private final Channel source;

        EnvelopeConsumer(Channel source) {
            super(source);
            this.source = source;
        }

        @Override
        public void handleDelivery(String tag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
            events.add(LifecycleEvent.delivery(source, DeliveryEnvelope.from(envelope, properties, body)));
        }

        @Override
        public void handleCancel(String tag) {
            events.add(LifecycleEvent.consumerCancelled(source));
        }

        @Override
        public void handleCancelOk(String tag) {
            log.debug("Cancel-ok received consumer_tag={}", tag);
        }
    }
}
