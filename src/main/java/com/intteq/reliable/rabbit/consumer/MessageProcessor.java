package com.intteq.reliable.rabbit.consumer;

import com.intteq.reliable.rabbit.exception.BadMessageException;
import com.intteq.reliable.rabbit.exception.QuarantinableException;
import com.intteq.reliable.rabbit.exception.RetryableException;
import jakarta.annotation.Nullable;

/**
 * Application callback invoked once per delivery.
 *
 * <p>Returning normally acknowledges the message. Failures are signalled by
 * throwing:
 * <ul>
 *     <li>{@link QuarantinableException}: copy to quarantine, then reject</li>
 *     <li>{@link BadMessageException}: reject without requeue</li>
 *     <li>{@link RetryableException}: nack so the broker redelivers</li>
 *     <li>anything else: treated as unexpected and nacked</li>
 * </ul>
 */
@FunctionalInterface
public interface MessageProcessor {

    /**
     * @param body message body decoded as UTF-8
     * @param txId the {@code tx_id} header, or {@code null} when tx_id checking is off
     */
    void process(String body, @Nullable String txId);
}
