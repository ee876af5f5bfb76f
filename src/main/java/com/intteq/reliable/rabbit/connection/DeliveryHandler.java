package com.intteq.reliable.rabbit.connection;

import com.intteq.reliable.rabbit.DeliveryEnvelope;

/**
 * Receives deliveries on the {@link ConnectionManager} run-loop thread.
 *
 * <p>Implementations must resolve each envelope through the manager's
 * acknowledgement primitives and must not throw.
 */
@FunctionalInterface
public interface DeliveryHandler {

    void onDelivery(DeliveryEnvelope envelope);
}
