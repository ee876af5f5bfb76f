package com.intteq.reliable.rabbit.publisher;

import com.intteq.reliable.rabbit.QuarantineSink;

import java.util.Objects;

/**
 * Quarantine side of a {@link FailoverPublisher}.
 *
 * <p>Exposes only the {@link QuarantineSink} contract, so the quarantine
 * publisher is never injected where an application publisher is expected.
 */
public final class QuarantinePublisher implements QuarantineSink {

    private final FailoverPublisher delegate;

    public QuarantinePublisher(FailoverPublisher delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    @Override
    public void publish(byte[] body) {
        delegate.publish(body);
    }

    public PublishTarget target() {
        return delegate.target();
    }
}
