package com.intteq.reliable.rabbit.consumer;

import com.intteq.reliable.rabbit.DeliveryEnvelope;
import com.intteq.reliable.rabbit.MessageAcknowledger;
import com.intteq.reliable.rabbit.MessageContext;
import com.intteq.reliable.rabbit.MessageHeaders;
import com.intteq.reliable.rabbit.QuarantineSink;
import com.intteq.reliable.rabbit.connection.DeliveryHandler;
import com.intteq.reliable.rabbit.exception.BadMessageException;
import com.intteq.reliable.rabbit.exception.FailureKind;
import com.intteq.reliable.rabbit.exception.MessageMetadataException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Turns one delivery into exactly one disposition.
 *
 * <p>Order of evaluation:
 * <ol>
 *     <li>no {@code x-delivery-count} header: reject</li>
 *     <li>no {@code tx_id} header (when checked): reject</li>
 *     <li>process the UTF-8 body; normal return: ack</li>
 *     <li>{@code QuarantinableException}: publish to quarantine then reject, or
 *     reject with requeue if the quarantine publish fails</li>
 *     <li>{@code BadMessageException}: reject</li>
 *     <li>{@code RetryableException} or anything unexpected, {@link Error}s included: nack</li>
 * </ol>
 *
 * <p>Nothing thrown by the processor escapes {@link #onDelivery}, except a
 * {@link VirtualMachineError} such as {@link OutOfMemoryError}, which is rethrown
 * after the nack. While an envelope is
 * handled its delivery tag, delivery count and tx_id are present in the MDC.
 */
@Slf4j
public class DispositionPolicy implements DeliveryHandler {

    static final String MDC_DELIVERY_TAG = "delivery_tag";
    static final String MDC_DELIVERY_COUNT = "delivery_count";
    static final String MDC_TX_ID = "tx_id";

    private final MessageAcknowledger acknowledger;
    private final QuarantineSink quarantine;
    private final MessageProcessor processor;
    private final boolean checkTxId;
    private final String queue;

    @Nullable
    private final MeterRegistry meterRegistry;

    public DispositionPolicy(MessageAcknowledger acknowledger,
                             QuarantineSink quarantine,
                             MessageProcessor processor,
                             boolean checkTxId,
                             String queue,
                             @Nullable MeterRegistry meterRegistry) {
        this.acknowledger = Objects.requireNonNull(acknowledger, "acknowledger must not be null");
        this.quarantine = Objects.requireNonNull(quarantine, "quarantine must not be null");
        this.processor = Objects.requireNonNull(processor, "processor must not be null");
        this.checkTxId = checkTxId;
        this.queue = queue;
        this.meterRegistry = meterRegistry;
    }

    public String queue() {
        return queue;
    }

    public boolean isCheckTxId() {
        return checkTxId;
    }

    @Override
    public void onDelivery(DeliveryEnvelope envelope) {
        MDC.put(MDC_DELIVERY_TAG, String.valueOf(envelope.deliveryTag()));
        try {
            handle(MessageContext.forDelivery(acknowledger, envelope));
        } finally {
            MDC.remove(MDC_DELIVERY_TAG);
            MDC.remove(MDC_DELIVERY_COUNT);
            MDC.remove(MDC_TX_ID);
        }
    }

    private void handle(MessageContext ctx) {
        DeliveryEnvelope envelope = ctx.envelope();
        long tag = ctx.deliveryTag();

        int deliveryCount;
        try {
            deliveryCount = MessageHeaders.deliveryCount(envelope);
        } catch (MessageMetadataException e) {
            ctx.reject(false);
            recordDisposition("rejected");
            log.error("Bad message properties - no delivery count delivery_tag={} action=rejected exception={}",
                    tag, e.getMessage());
            return;
        }
        ctx.withField("delivery_count", deliveryCount);
        MDC.put(MDC_DELIVERY_COUNT, String.valueOf(deliveryCount));

        String txId = null;
        if (checkTxId) {
            try {
                txId = MessageHeaders.txId(envelope);
            } catch (MessageMetadataException e) {
                ctx.reject(false);
                recordDisposition("rejected");
                log.error("Bad message properties - no tx_id delivery_tag={} delivery_count={} action=rejected exception={}",
                        tag, deliveryCount, e.getMessage());
                return;
            }
            ctx.withField("tx_id", txId);
            MDC.put(MDC_TX_ID, txId);
        } else {
            log.debug("check_tx_id is false. Not checking tx_id for message delivery_tag={}", tag);
        }

        log.info("Received message queue={} delivery_tag={} delivery_count={} app_id={} tx_id={}",
                queue, tag, deliveryCount, envelope.appId(), txId);

        long start = System.nanoTime();
        try {
            processor.process(decode(envelope.body()), txId);
        } catch (Exception e) {
            onFailure(ctx, e, txId, deliveryCount);
            return;
        } catch (Error e) {
            onFailure(ctx, e, txId, deliveryCount);
            if (isFatal(e)) {
                throw e;
            }
            return;
        }

        ctx.ack();
        recordDisposition("ack");
        recordLatency(System.nanoTime() - start);
    }

    private void onFailure(MessageContext ctx, Throwable error, String txId, int deliveryCount) {
        long tag = ctx.deliveryTag();
        FailureKind kind = FailureKind.classify(error);

        switch (kind) {
            case QUARANTINABLE -> quarantine(ctx, error, txId, deliveryCount);
            case MALFORMED_METADATA, BAD_MESSAGE -> {
                ctx.reject(false);
                recordDisposition(kind.action());
                log.error("Bad message delivery_tag={} tx_id={} delivery_count={} action={} exception={}",
                        tag, txId, deliveryCount, kind.action(), error.getMessage());
            }
            case RETRYABLE -> {
                ctx.nack();
                recordDisposition(kind.action());
                log.error("Failed to process delivery_tag={} tx_id={} delivery_count={} action={} exception={}",
                        tag, txId, deliveryCount, kind.action(), error.getMessage());
            }
            case UNEXPECTED -> {
                ctx.nack();
                recordDisposition(kind.action());
                log.error("Unexpected exception, failed to process delivery_tag={} tx_id={} delivery_count={} action={}",
                        tag, txId, deliveryCount, kind.action(), error);
            }
        }
    }

    /**
     * Copies the original body to quarantine. If that fails the message goes back on
     * its queue rather than being lost.
     */
    private void quarantine(MessageContext ctx, Throwable error, String txId, int deliveryCount) {
        long tag = ctx.deliveryTag();
        try {
            quarantine.publish(ctx.envelope().body());
        } catch (RuntimeException publishError) {
            ctx.reject(true);
            recordDisposition("requeued");
            log.error("Unable to publish message to quarantine queue. Rejecting message and requeuing. "
                            + "delivery_tag={} tx_id={} delivery_count={} action=requeued",
                    tag, txId, deliveryCount, publishError);
            return;
        }

        ctx.reject(false);
        recordDisposition(FailureKind.QUARANTINABLE.action());
        log.error("Quarantinable error occurred delivery_tag={} tx_id={} delivery_count={} action=quarantined exception={}",
                tag, txId, deliveryCount, error.getMessage());
    }

    /**
     * The JVM itself is failing; the delivery has been nacked but the error must
     * still reach the run loop.
     */
    private static boolean isFatal(Error error) {
        return error instanceof VirtualMachineError && !(error instanceof StackOverflowError);
    }

    private static String decode(byte[] body) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(body))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new BadMessageException("Message body is not valid UTF-8", e);
        }
    }

    // =====================================================================
    // METRICS
    // =====================================================================

    private void recordDisposition(String action) {
        if (meterRegistry == null) return;

        meterRegistry.counter(
                        "reliable.rabbit.disposition",
                        "queue", String.valueOf(queue),
                        "action", action
                )
                .increment();
    }

    private void recordLatency(long durationNs) {
        if (meterRegistry == null) return;

        meterRegistry.timer(
                        "reliable.rabbit.process.latency",
                        "queue", String.valueOf(queue)
                )
                .record(durationNs, TimeUnit.NANOSECONDS);
    }
}
