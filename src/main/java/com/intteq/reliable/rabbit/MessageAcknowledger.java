package com.intteq.reliable.rabbit;

import java.util.Map;

/**
 * Broker acknowledgement primitives. These are the only legal ways to resolve a
 * delivery.
 *
 * <p>{@code fields} are correlation values (tx_id, delivery count, ...) written to
 * the log line of each action.
 */
public interface MessageAcknowledger {

    void acknowledgeMessage(long deliveryTag, Map<String, ?> fields);

    void nackMessage(long deliveryTag, Map<String, ?> fields);

    void rejectMessage(long deliveryTag, boolean requeue, Map<String, ?> fields);
}
