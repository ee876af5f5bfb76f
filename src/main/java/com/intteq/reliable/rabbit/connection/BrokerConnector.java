package com.intteq.reliable.rabbit.connection;

import com.rabbitmq.client.Connection;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Opens a broker connection for a single endpoint URL.
 *
 * <p>Both checked exceptions are treated as connection-level failures by callers:
 * the consumer backs off and tries the next endpoint, the publisher fails over.
 */
@FunctionalInterface
public interface BrokerConnector {

    Connection connect(String url) throws IOException, TimeoutException;
}
