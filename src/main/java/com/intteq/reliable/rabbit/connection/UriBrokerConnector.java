package com.intteq.reliable.rabbit.connection;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * {@link BrokerConnector} backed by the RabbitMQ Java client.
 *
 * <p>A fresh {@link ConnectionFactory} is configured per call from the AMQP URI
 * ({@code amqp://} or {@code amqps://}). The client's automatic recovery is
 * switched off: reconnecting and re-declaring topology is owned by
 * {@link ConnectionManager}, and publisher connections are short-lived.
 */
@Slf4j
public class UriBrokerConnector implements BrokerConnector {

    private final Duration connectionTimeout;
    private final Duration requestedHeartbeat;
    private final String connectionName;

    public UriBrokerConnector(Duration connectionTimeout, Duration requestedHeartbeat, String connectionName) {
        this.connectionTimeout = connectionTimeout != null ? connectionTimeout : Duration.ofSeconds(10);
        this.requestedHeartbeat = requestedHeartbeat != null ? requestedHeartbeat : Duration.ofSeconds(60);
        this.connectionName = connectionName;
    }

    @Override
    public Connection connect(String url) throws IOException, TimeoutException {
        ConnectionFactory factory = new ConnectionFactory();
        try {
            factory.setUri(url);
        } catch (URISyntaxException | GeneralSecurityException | IllegalArgumentException | NullPointerException e) {
            throw new IOException("Invalid broker URL " + EndpointSet.redact(url), e);
        }

        factory.setConnectionTimeout((int) connectionTimeout.toMillis());
        factory.setRequestedHeartbeat((int) requestedHeartbeat.getSeconds());
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);

        log.debug("Opening connection host={} port={} vhost={}",
                factory.getHost(), factory.getPort(), factory.getVirtualHost());

        return factory.newConnection(connectionName);
    }
}
