package com.intteq.reliable.rabbit;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Disposition handle for a single delivery.
 *
 * <p>Usage:
 * <pre>
 *   MessageContext ctx = MessageContext.forDelivery(acknowledger, envelope);
 *   ctx.withField("tx_id", txId);
 *   ctx.ack();             // acknowledge
 *   ctx.nack();            // redeliver
 *   ctx.reject(false);     // drop
 *   ctx.reject(true);      // back on the original queue
 * </pre>
 *
 * <p>Notes:
 * <ul>
 *     <li>Exactly one disposition is allowed. A second call raises
 *     {@link IllegalStateException} and nothing reaches the broker.</li>
 *     <li>Correlation fields added with {@link #withField(String, Object)} are passed
 *     to the acknowledger and end up on its log line.</li>
 * </ul>
 */
@Slf4j
@Getter
@Accessors(fluent = true)
public class MessageContext {

    private final MessageAcknowledger acknowledger;
    private final DeliveryEnvelope envelope;

    @Getter(AccessLevel.NONE)
    private final Map<String, Object> fields = new LinkedHashMap<>();

    @Getter(AccessLevel.NONE)
    private final AtomicReference<Disposition> disposition = new AtomicReference<>();

    /**
     * @param acknowledger broker primitives (must not be null)
     * @param envelope     the delivery being resolved (must not be null)
     * @return a new {@link MessageContext}
     */
    public static MessageContext forDelivery(MessageAcknowledger acknowledger, DeliveryEnvelope envelope) {
        Objects.requireNonNull(acknowledger, "acknowledger must not be null");
        Objects.requireNonNull(envelope, "envelope must not be null");
        return new MessageContext(acknowledger, envelope);
    }

    private MessageContext(MessageAcknowledger acknowledger, DeliveryEnvelope envelope) {
        this.acknowledger = acknowledger;
        this.envelope = envelope;
    }

    public long deliveryTag() {
        return envelope.deliveryTag();
    }

    /**
     * Adds a correlation field. Null values are skipped.
     */
    public MessageContext withField(String name, Object value) {
        if (value != null) {
            fields.put(name, value);
        }
        return this;
    }

    public Map<String, Object> fields() {
        return Collections.unmodifiableMap(fields);
    }

    public boolean isSettled() {
        return disposition.get() != null;
    }

    /**
     * @return the disposition issued so far, or {@code null}
     */
    public Disposition disposition() {
        return disposition.get();
    }

    public void ack() {
        settle(Disposition.ACK);
        acknowledger.acknowledgeMessage(deliveryTag(), fields());
    }

    public void nack() {
        settle(Disposition.NACK);
        acknowledger.nackMessage(deliveryTag(), fields());
    }

    public void reject(boolean requeue) {
        settle(requeue ? Disposition.REJECT_REQUEUE : Disposition.REJECT);
        acknowledger.rejectMessage(deliveryTag(), requeue, fields());
    }

    private void settle(Disposition next) {
        if (!disposition.compareAndSet(null, next)) {
            log.error("Second disposition refused delivery_tag={} existing={} attempted={}",
                    deliveryTag(), disposition.get(), next);
            throw new IllegalStateException(
                    "Delivery " + deliveryTag() + " already settled as " + disposition.get());
        }
    }
}
