package com.intteq.reliable.rabbit.consumer;

import com.intteq.reliable.rabbit.QuarantineSink;
import com.intteq.reliable.rabbit.connection.BrokerConnector;
import com.intteq.reliable.rabbit.connection.ConnectionManager;
import com.intteq.reliable.rabbit.connection.ConnectionState;
import com.intteq.reliable.rabbit.connection.ConsumerSettings;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.Nullable;
import lombok.Builder;

/**
 * A queue consumer that survives broker restarts and resolves every message to
 * exactly one disposition.
 *
 * <pre>
 *   ReliableConsumer consumer = ReliableConsumer.builder()
 *           .settings(settings)
 *           .connector(connector)
 *           .quarantine(quarantinePublisher)
 *           .processor((body, txId) -> handle(body))
 *           .build();
 *   consumer.run();   // blocks until stop()
 * </pre>
 */
public class ReliableConsumer {

    private final ConnectionManager connectionManager;
    private final DispositionPolicy policy;

    @Builder
    private ReliableConsumer(ConsumerSettings settings,
                             BrokerConnector connector,
                             QuarantineSink quarantine,
                             MessageProcessor processor,
                             @Nullable Boolean checkTxId,
                             @Nullable MeterRegistry meterRegistry) {
        this.connectionManager = new ConnectionManager(settings, connector);
        this.policy = new DispositionPolicy(
                connectionManager,
                quarantine,
                processor,
                checkTxId == null || checkTxId,
                settings.getQueue(),
                meterRegistry
        );
    }

    /**
     * Blocks the calling thread until {@link #stop()} completes.
     */
    public void run() {
        connectionManager.run(policy);
    }

    public void stop() {
        connectionManager.stop();
    }

    public ConnectionState state() {
        return connectionManager.state();
    }

    public String queue() {
        return policy.queue();
    }
}
