package in.opsdash.domain.notify;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of the notification channel.
 *
 * Allowed transitions:
 * <pre>
 * IDLE              -> CONNECTING
 * CONNECTING        -> OPEN | RECONNECT_PENDING | IDLE
 * OPEN              -> RECONNECT_PENDING | CLOSING | IDLE
 * CLOSING           -> IDLE
 * RECONNECT_PENDING -> CONNECTING | IDLE
 * </pre>
 * OPEN -> IDLE is only used for a forced teardown on identity change.
 */
public enum ConnectionState {
    IDLE,
    CONNECTING,
    OPEN,
    CLOSING,
    RECONNECT_PENDING;

    public Set<ConnectionState> successors() {
        return switch (this) {
            case IDLE -> EnumSet.of(CONNECTING);
            case CONNECTING -> EnumSet.of(OPEN, RECONNECT_PENDING, IDLE);
            case OPEN -> EnumSet.of(RECONNECT_PENDING, CLOSING, IDLE);
            case CLOSING -> EnumSet.of(IDLE);
            case RECONNECT_PENDING -> EnumSet.of(CONNECTING, IDLE);
        };
    }

    public boolean canTransitionTo(ConnectionState next) {
        return successors().contains(next);
    }
}
