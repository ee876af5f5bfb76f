package com.intteq.reliable.rabbit.connection;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Topology and timing settings for a consuming {@link ConnectionManager}.
 */
@Getter
@Builder
@ToString
public class ConsumerSettings {

    /** Candidate broker URLs, tried round-robin. */
    private final List<String> urls;

    /** Exchange to bind the queue to. Empty means the default exchange: no declare, no bind. */
    @Builder.Default
    private final String exchange = "";

    @Builder.Default
    private final String exchangeType = "topic";

    @Builder.Default
    private final boolean durableExchange = false;

    private final String queue;

    @Builder.Default
    private final boolean durableQueue = true;

    /** Binding key. Falls back to the queue name when not set. */
    private final String routingKey;

    @Builder.Default
    private final int prefetch = 1;

    /** Backoff added per failed initial-connect attempt. */
    @Builder.Default
    private final Duration backoffStep = Duration.ofSeconds(1);

    /** Upper bound of the initial-connect backoff. */
    @Builder.Default
    private final Duration backoffCap = Duration.ofSeconds(30);

    /** Fixed delay before reconnecting after an unexpected closure. */
    @Builder.Default
    private final Duration reconnectDelay = Duration.ofSeconds(5);

    /** How long {@code stop()} waits for the run loop to exit. */
    @Builder.Default
    private final Duration shutdownTimeout = Duration.ofSeconds(30);

    @Builder.Default
    private final Map<String, Object> exchangeArguments = Map.of();

    @Builder.Default
    private final Map<String, Object> queueArguments = Map.of();

    public String effectiveRoutingKey() {
        return routingKey == null || routingKey.isBlank() ? queue : routingKey;
    }

    public boolean hasExchange() {
        return exchange != null && !exchange.isBlank();
    }
}
