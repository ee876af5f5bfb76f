package com.intteq.reliable.rabbit.connection;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a {@link ConnectionManager}.
 *
 * <pre>
 * NEW -> CONNECTING -> OPEN -> CHANNEL_OPEN -> CONSUMING
 * OPEN | CHANNEL_OPEN | CONSUMING -> CONNECTING   (unexpected closure)
 * OPEN | CHANNEL_OPEN | CONSUMING -> CLOSING -> CLOSED   (stop)
 * CLOSED -> CONNECTING   (explicit reconnect only)
 * </pre>
 */
public enum ConnectionState {
    NEW,
    CONNECTING,
    OPEN,
    CHANNEL_OPEN,
    CONSUMING,
    CLOSING,
    CLOSED;

    public boolean canTransitionTo(ConnectionState next) {
        return allowedTargets().contains(next);
    }

    private Set<ConnectionState> allowedTargets() {
        return switch (this) {
            case NEW -> EnumSet.of(CONNECTING, CLOSED);
            case CONNECTING -> EnumSet.of(OPEN, CLOSED);
            case OPEN -> EnumSet.of(CHANNEL_OPEN, CONNECTING, CLOSING, CLOSED);
            case CHANNEL_OPEN -> EnumSet.of(CONSUMING, CONNECTING, CLOSING, CLOSED);
            case CONSUMING -> EnumSet.of(CONNECTING, CLOSING, CLOSED);
            case CLOSING -> EnumSet.of(CLOSED);
            case CLOSED -> EnumSet.of(CONNECTING);
        };
    }
}
