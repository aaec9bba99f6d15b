package in.opsdash.domain.notify;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Server-pushed business event (new_user, new_payment, user_upgraded, system_alert, ...).
 *
 * @param type            Event type as sent by the server
 * @param title           Display title, may be null
 * @param message         Display message, may be null
 * @param priority        Priority, NORMAL when absent on the wire
 * @param serverTimestamp Server epoch millis, null when absent
 * @param severity        Optional severity label (system alerts)
 * @param data            Opaque event payload, empty when absent
 */
public record DomainEvent(
    String type,
    String title,
    String message,
    NotificationPriority priority,
    Long serverTimestamp,
    String severity,
    Map<String, Object> data
) {

    public DomainEvent {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Event type must not be blank");
        }
        priority = priority == null ? NotificationPriority.NORMAL : priority;
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
