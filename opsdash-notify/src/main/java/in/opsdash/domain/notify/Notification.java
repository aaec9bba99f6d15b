package in.opsdash.domain.notify;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry of the local notification feed, derived from a {@link DomainEvent} at triage time.
 *
 * {@code localId} is assigned locally and is the only id the feed operates on.
 */
public record Notification(
    long localId,
    String type,
    String title,
    String message,
    NotificationPriority priority,
    Instant receivedAt,
    String severity,
    Map<String, Object> data,
    boolean read
) {

    public Notification {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static Notification from(long localId, DomainEvent event, Instant receivedAt) {
        return new Notification(
            localId,
            event.type(),
            event.title(),
            event.message(),
            event.priority(),
            receivedAt,
            event.severity(),
            event.data(),
            false
        );
    }

    public Notification withRead(boolean read) {
        if (this.read == read) {
            return this;
        }
        return new Notification(localId, type, title, message, priority, receivedAt, severity, data, read);
    }

    public boolean isHighPriority() {
        return priority == NotificationPriority.HIGH;
    }
}
