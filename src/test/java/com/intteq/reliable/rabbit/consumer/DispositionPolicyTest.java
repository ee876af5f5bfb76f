package com.intteq.reliable.rabbit.consumer;

import com.intteq.reliable.rabbit.DeliveryEnvelope;
import com.intteq.reliable.rabbit.MessageAcknowledger;
import com.intteq.reliable.rabbit.QuarantineSink;
import com.intteq.reliable.rabbit.exception.BadMessageException;
import com.intteq.reliable.rabbit.exception.DecryptException;
import com.intteq.reliable.rabbit.exception.PublishMessageException;
import com.intteq.reliable.rabbit.exception.QuarantinableException;
import com.intteq.reliable.rabbit.exception.RetryableException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;

@ExtendWith(MockitoExtension.class)
class DispositionPolicyTest {

    private static final long TAG = 42L;

    @Mock
    private MessageAcknowledger acknowledger;

    @Mock
    private QuarantineSink quarantine;

    private RecordingProcessor processor;
    private SimpleMeterRegistry meterRegistry;
    private DispositionPolicy policy;

    @BeforeEach
    void setUp() {
        processor = new RecordingProcessor();
        meterRegistry = new SimpleMeterRegistry();
        policy = new DispositionPolicy(acknowledger, quarantine, processor, true, "orders", meterRegistry);
    }

    private static DeliveryEnvelope envelope(Map<String, Object> headers, String body) {
        return new DeliveryEnvelope(TAG, headers, "orders-service", "application/json", false,
                body.getBytes(StandardCharsets.UTF_8));
    }

    private static Map<String, Object> validHeaders() {
        Map<String, Object> headers = new HashMap<>();
        headers.put("tx_id", "abc");
        headers.put("x-delivery-count", 2);
        return headers;
    }

    private double dispositions(String action) {
        return meterRegistry.counter("reliable.rabbit.disposition", "queue", "orders", "action", action).count();
    }

    @Nested
    @DisplayName("Metadata checks")
    class MetadataChecks {

        @Test
        @DisplayName("should reject without requeue when delivery count is missing")
        void shouldRejectWhenDeliveryCountMissing() {
            Map<String, Object> headers = validHeaders();
            headers.remove("x-delivery-count");

            policy.onDelivery(envelope(headers, "ok"));

            verify(acknowledger).rejectMessage(eq(TAG), eq(false), anyMap());
            verifyNoMoreInteractions(acknowledger);
            assertThat(processor.calls).isEmpty();
            assertThat(dispositions("rejected")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should reject without requeue when delivery count is not numeric")
        void shouldRejectWhenDeliveryCountNotNumeric() {
            Map<String, Object> headers = validHeaders();
            headers.put("x-delivery-count", "many");

            policy.onDelivery(envelope(headers, "ok"));

            verify(acknowledger).rejectMessage(eq(TAG), eq(false), anyMap());
            assertThat(processor.calls).isEmpty();
        }

        @Test
        @DisplayName("should reject without requeue when tx_id is missing and checked")
        void shouldRejectWhenTxIdMissing() {
            Map<String, Object> headers = validHeaders();
            headers.remove("tx_id");

            policy.onDelivery(envelope(headers, "ok"));

            verify(acknowledger).rejectMessage(eq(TAG), eq(false), anyMap());
            verifyNoMoreInteractions(acknowledger);
            assertThat(processor.calls).isEmpty();
        }

        @Test
        @DisplayName("should process without tx_id when checking is off")
        void shouldProcessWithoutTxIdWhenUnchecked() {
            DispositionPolicy unchecked =
                    new DispositionPolicy(acknowledger, quarantine, processor, false, "orders", null);
            Map<String, Object> headers = validHeaders();
            headers.remove("tx_id");

            unchecked.onDelivery(envelope(headers, "ok"));

            assertThat(processor.calls).containsExactly("ok|null");
            verify(acknowledger).acknowledgeMessage(eq(TAG), anyMap());
        }

        @Test
        @DisplayName("should pass tx_id as null even when present if checking is off")
        void shouldIgnoreTxIdWhenUnchecked() {
            DispositionPolicy unchecked =
                    new DispositionPolicy(acknowledger, quarantine, processor, false, "orders", null);

            unchecked.onDelivery(envelope(validHeaders(), "ok"));

            assertThat(processor.calls).containsExactly("ok|null");
        }
    }

    @Nested
    @DisplayName("Successful processing")
    class Success {

        @Test
        @DisplayName("should ack once with tx_id and derived delivery count")
        @SuppressWarnings("unchecked")
        void shouldAckWithCorrelationFields() {
            policy.onDelivery(envelope(validHeaders(), "ok"));

            ArgumentCaptor<Map<String, Object>> fields = ArgumentCaptor.forClass(Map.class);
            verify(acknowledger).acknowledgeMessage(eq(TAG), fields.capture());
            verifyNoMoreInteractions(acknowledger);

            assertThat(processor.calls).containsExactly("ok|abc");
            assertThat(fields.getValue())
                    .containsEntry("tx_id", "abc")
                    .containsEntry("delivery_count", 3);
            assertThat(dispositions("ack")).isEqualTo(1.0);
            assertThat(meterRegistry.timer("reliable.rabbit.process.latency", "queue", "orders").count())
                    .isEqualTo(1L);
        }

        @Test
        @DisplayName("should accept a delivery count sent as a string")
        void shouldAcceptStringDeliveryCount() {
            Map<String, Object> headers = validHeaders();
            headers.put("x-delivery-count", "0");

            policy.onDelivery(envelope(headers, "ok"));

            verify(acknowledger).acknowledgeMessage(eq(TAG), anyMap());
        }

        @Test
        @DisplayName("should expose correlation keys in the MDC only while processing")
        void shouldScopeMdc() {
            MessageProcessor capturing = (body, txId) -> {
                processor.calls.add(MDC.get("tx_id") + "|" + MDC.get("delivery_tag") + "|" + MDC.get("delivery_count"));
            };
            DispositionPolicy withMdc =
                    new DispositionPolicy(acknowledger, quarantine, capturing, true, "orders", null);

            withMdc.onDelivery(envelope(validHeaders(), "ok"));

            assertThat(processor.calls).containsExactly("abc|42|3");
            assertThat(MDC.get("tx_id")).isNull();
            assertThat(MDC.get("delivery_tag")).isNull();
            assertThat(MDC.get("delivery_count")).isNull();
        }
    }

    @Nested
    @DisplayName("Processing failures")
    class Failures {

        @Test
        @DisplayName("should quarantine the original body then reject without requeue")
        void shouldQuarantineThenReject() {
            processor.failWith = new QuarantinableException("needs a human");

            policy.onDelivery(envelope(validHeaders(), "suspicious"));

            ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
            verify(quarantine).publish(body.capture());
            assertThat(new String(body.getValue(), StandardCharsets.UTF_8)).isEqualTo("suspicious");
            verify(acknowledger).rejectMessage(eq(TAG), eq(false), anyMap());
            verifyNoMoreInteractions(acknowledger);
            assertThat(dispositions("quarantined")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should reject with requeue when the quarantine publish fails")
        void shouldRequeueWhenQuarantineFails() {
            processor.failWith = new QuarantinableException("needs a human");
            doThrow(new PublishMessageException(PublishMessageException.Reason.CONNECTION_FAILED, "down"))
                    .when(quarantine).publish(any());

            policy.onDelivery(envelope(validHeaders(), "suspicious"));

            verify(acknowledger).rejectMessage(eq(TAG), eq(true), anyMap());
            verifyNoMoreInteractions(acknowledger);
            assertThat(dispositions("requeued")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should reject without requeue on a bad message")
        void shouldRejectBadMessage() {
            processor.failWith = new BadMessageException("bad");

            policy.onDelivery(envelope(validHeaders(), "ok"));

            verify(acknowledger).rejectMessage(eq(TAG), eq(false), anyMap());
            verifyNoMoreInteractions(acknowledger);
            verifyNoInteractions(quarantine);
        }

        @Test
        @DisplayName("should reject without requeue when decryption fails")
        void shouldRejectDecryptFailure() {
            processor.failWith = new DecryptException("cannot decrypt");

            policy.onDelivery(envelope(validHeaders(), "ok"));

            verify(acknowledger).rejectMessage(eq(TAG), eq(false), anyMap());
        }

        @Test
        @DisplayName("should reject a body that is not valid UTF-8 without calling the processor")
        void shouldRejectInvalidUtf8() {
            DeliveryEnvelope invalid = new DeliveryEnvelope(TAG, validHeaders(), null, null, false,
                    new byte[]{(byte) 0xC3, (byte) 0x28});

            policy.onDelivery(invalid);

            verify(acknowledger).rejectMessage(eq(TAG), eq(false), anyMap());
            assertThat(processor.calls).isEmpty();
        }

        @Test
        @DisplayName("should nack on a retryable failure")
        void shouldNackRetryable() {
            processor.failWith = new RetryableException("try later");

            policy.onDelivery(envelope(validHeaders(), "ok"));

            verify(acknowledger).nackMessage(eq(TAG), anyMap());
            verifyNoMoreInteractions(acknowledger);
            assertThat(dispositions("nack")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should nack on an unrecognised failure")
        void shouldNackUnexpected() {
            processor.failWith = new IllegalStateException("boom");

            policy.onDelivery(envelope(validHeaders(), "ok"));

            verify(acknowledger).nackMessage(eq(TAG), anyMap());
            verify(acknowledger, never()).rejectMessage(anyLong(), anyBoolean(), anyMap());
            verify(acknowledger, never()).acknowledgeMessage(anyLong(), anyMap());
        }

        @Test
        @DisplayName("should nack when the processor throws an Error")
        void shouldNackOnError() {
            MessageProcessor failing = (body, txId) -> {
                throw new AssertionError("processor bug");
            };
            DispositionPolicy withError =
                    new DispositionPolicy(acknowledger, quarantine, failing, true, "orders", meterRegistry);

            withError.onDelivery(envelope(validHeaders(), "ok"));

            verify(acknowledger).nackMessage(eq(TAG), anyMap());
            verifyNoMoreInteractions(acknowledger);
            assertThat(dispositions("nack")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should nack on stack overflow without rethrowing")
        void shouldNackOnStackOverflow() {
            MessageProcessor failing = (body, txId) -> {
                throw new StackOverflowError();
            };
            DispositionPolicy withError =
                    new DispositionPolicy(acknowledger, quarantine, failing, true, "orders", null);

            withError.onDelivery(envelope(validHeaders(), "ok"));

            verify(acknowledger).nackMessage(eq(TAG), anyMap());
        }

        @Test
        @DisplayName("should nack and then rethrow when the JVM runs out of memory")
        void shouldRethrowOutOfMemory() {
            MessageProcessor failing = (body, txId) -> {
                throw new OutOfMemoryError("Java heap space");
            };
            DispositionPolicy withError =
                    new DispositionPolicy(acknowledger, quarantine, failing, true, "orders", null);

            assertThatThrownBy(() -> withError.onDelivery(envelope(validHeaders(), "ok")))
                    .isInstanceOf(OutOfMemoryError.class);
            verify(acknowledger).nackMessage(eq(TAG), anyMap());
            assertThat(MDC.get("tx_id")).isNull();
        }
    }

    @Test
    @DisplayName("should work without a meter registry")
    void shouldWorkWithoutMeterRegistry() {
        DispositionPolicy noMetrics =
                new DispositionPolicy(acknowledger, quarantine, processor, true, "orders", null);

        noMetrics.onDelivery(envelope(validHeaders(), "ok"));

        verify(acknowledger).acknowledgeMessage(eq(TAG), anyMap());
    }

    private static final class RecordingProcessor implements MessageProcessor {

        private final List<String> calls = new ArrayList<>();
        private RuntimeException failWith;

        @Override
        public void process(String body, String txId) {
            calls.add(body + "|" + txId);
            if (failWith != null) {
                throw failWith;
            }
        }
    }
}
