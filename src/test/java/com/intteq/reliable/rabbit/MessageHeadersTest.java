package com.intteq.reliable.rabbit;

import com.intteq.reliable.rabbit.exception.MessageMetadataException;
import com.rabbitmq.client.LongString;
import com.rabbitmq.client.impl.LongStringHelper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageHeadersTest {

    private static DeliveryEnvelope envelopeWith(String name, Object value) {
        Map<String, Object> headers = new HashMap<>();
        headers.put(name, value);
        return new DeliveryEnvelope(1L, headers, null, null, false, new byte[0]);
    }

    @Nested
    @DisplayName("x-delivery-count")
    class DeliveryCount {

        @Test
        @DisplayName("should add one to a numeric header")
        void shouldIncrementNumber() {
            assertThat(MessageHeaders.deliveryCount(envelopeWith("x-delivery-count", 2))).isEqualTo(3);
            assertThat(MessageHeaders.deliveryCount(envelopeWith("x-delivery-count", 0L))).isEqualTo(1);
        }

        @Test
        @DisplayName("should parse a string header as sent by the broker client")
        void shouldParseLongString() {
            LongString value = LongStringHelper.asLongString("4");

            assertThat(MessageHeaders.deliveryCount(envelopeWith("x-delivery-count", value))).isEqualTo(5);
        }

        @Test
        @DisplayName("should fail when the header is absent")
        void shouldFailWhenAbsent() {
            assertThatThrownBy(() -> MessageHeaders.deliveryCount(envelopeWith("other", 1)))
                    .isInstanceOf(MessageMetadataException.class)
                    .extracting(e -> ((MessageMetadataException) e).getHeader())
                    .isEqualTo("x-delivery-count");
        }

        @Test
        @DisplayName("should fail when the header is not a number")
        void shouldFailWhenNotNumeric() {
            assertThatThrownBy(() -> MessageHeaders.deliveryCount(envelopeWith("x-delivery-count", "two")))
                    .isInstanceOf(MessageMetadataException.class);
        }
    }

    @Nested
    @DisplayName("tx_id")
    class TxId {

        @Test
        @DisplayName("should read a LongString header as text")
        void shouldReadLongString() {
            DeliveryEnvelope envelope = envelopeWith("tx_id", LongStringHelper.asLongString("abc"));

            assertThat(MessageHeaders.txId(envelope)).isEqualTo("abc");
        }

        @Test
        @DisplayName("should fail when absent or blank")
        void shouldFailWhenMissing() {
            assertThatThrownBy(() -> MessageHeaders.txId(envelopeWith("other", "abc")))
                    .isInstanceOf(MessageMetadataException.class);
            assertThatThrownBy(() -> MessageHeaders.txId(envelopeWith("tx_id", "  ")))
                    .isInstanceOf(MessageMetadataException.class);
        }
    }
}
