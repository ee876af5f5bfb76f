package com.intteq.reliable.rabbit.internal;

import com.intteq.reliable.rabbit.consumer.ReliableConsumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.SmartInitializingSingleton;

/**
 * Runs a {@link ReliableConsumer} for the lifetime of the application context.
 *
 * <p>The consumer's run loop blocks, so it is started on its own non-daemon
 * thread once all singletons are initialized. Context shutdown stops the
 * consumer, which cancels the broker-side consumer and closes the connection
 * after any in-flight message has been settled.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class ReliableConsumerLifecycle implements SmartInitializingSingleton, DisposableBean {

    private final ReliableConsumer consumer;
    private final boolean autoStartup;

    private Thread worker;

    // =====================================================================
    // INITIALIZATION
    // =====================================================================

    @Override
    public void afterSingletonsInstantiated() {
        if (!autoStartup) {
            log.info("Reliable rabbit consumer auto-startup disabled queue={}", consumer.queue());
            return;
        }
        start();
    }

    public synchronized void start() {
        if (worker != null) {
            return;
        }
        worker = new Thread(this::runConsumer, "reliable-rabbit-" + consumer.queue());
        worker.start();
        log.info("Reliable rabbit consumer started queue={}", consumer.queue());
    }

    public synchronized boolean isRunning() {
        return worker != null && worker.isAlive();
    }

    private void runConsumer() {
        try {
            consumer.run();
        } catch (RuntimeException e) {
            log.error("Reliable rabbit consumer terminated queue={}", consumer.queue(), e);
        }
    }

    // =====================================================================
    // SHUTDOWN
    // =====================================================================

    @Override
    public void destroy() {
        log.info("Stopping reliable rabbit consumer queue={}", consumer.queue());
        consumer.stop();
    }
}
