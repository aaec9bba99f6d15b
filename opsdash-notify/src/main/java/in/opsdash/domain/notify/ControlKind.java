package in.opsdash.domain.notify;

import java.util.Locale;
import java.util.Optional;

/**
 * Control frame types. Consumed by triage, never buffered.
 */
public enum ControlKind {
    PING("ping"),
    PONG("pong"),
    ACK("ack"),
    /** Server welcome frame sent right after the channel is accepted. */
    CONNECTION("connection"),
    /** Reply to a client {@code subscribe} request. */
    SUBSCRIBED("subscribed"),
    /** Reply to a client {@code get_online_admins} request. */
    ONLINE_ADMINS("online_admins");

    private final String wireType;

    ControlKind(String wireType) {
        this.wireType = wireType;
    }

    public String wireType() {
        return wireType;
    }

    public static Optional<ControlKind> fromWire(String type) {
        if (type == null) {
            return Optional.empty();
        }
        String normalized = type.trim().toLowerCase(Locale.ROOT);
        for (ControlKind kind : values()) {
            if (kind.wireType.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
