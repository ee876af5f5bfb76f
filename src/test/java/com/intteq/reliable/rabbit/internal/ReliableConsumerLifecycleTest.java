package com.intteq.reliable.rabbit.internal;

import com.intteq.reliable.rabbit.consumer.ReliableConsumer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReliableConsumerLifecycleTest {

    @Mock
    private ReliableConsumer consumer;

    @Test
    @DisplayName("should run the consumer on its own thread and stop it on destroy")
    void shouldRunAndStop() throws Exception {
        CountDownLatch stopped = new CountDownLatch(1);
        when(consumer.queue()).thenReturn("orders.inbound");
        doAnswer(inv -> {
            stopped.await(5, TimeUnit.SECONDS);
            return null;
        }).when(consumer).run();
        doAnswer(inv -> {
            stopped.countDown();
            return null;
        }).when(consumer).stop();
        ReliableConsumerLifecycle lifecycle = new ReliableConsumerLifecycle(consumer, true);

        lifecycle.afterSingletonsInstantiated();
        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> verify(consumer).run());
        assertThat(lifecycle.isRunning()).isTrue();

        lifecycle.destroy();

        verify(consumer).stop();
        await().atMost(5, TimeUnit.SECONDS).until(() -> !lifecycle.isRunning());
    }

    @Test
    @DisplayName("should not start when auto-startup is disabled")
    void shouldHonourAutoStartup() {
        when(consumer.queue()).thenReturn("orders.inbound");
        ReliableConsumerLifecycle lifecycle = new ReliableConsumerLifecycle(consumer, false);

        lifecycle.afterSingletonsInstantiated();

        assertThat(lifecycle.isRunning()).isFalse();
        verify(consumer, never()).run();
    }
}
