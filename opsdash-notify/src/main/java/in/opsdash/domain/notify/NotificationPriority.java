package in.opsdash.domain.notify;

import java.util.Locale;

/**
 * Priority carried by a domain event. Only HIGH changes behaviour (raises an interrupt).
 */
public enum NotificationPriority {
    LOW,
    NORMAL,
    HIGH;

    /**
     * Parse the wire value; absent or unknown values fall back to NORMAL.
     */
    public static NotificationPriority fromWire(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "low" -> LOW;
            case "high" -> HIGH;
            default -> NORMAL;
        };
    }
}
