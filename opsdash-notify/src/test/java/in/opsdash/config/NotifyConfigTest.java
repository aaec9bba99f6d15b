package in.opsdash.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class NotifyConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("NOTIFY_BUFFER_CAPACITY");
        System.clearProperty("POLL_INTERVAL_MS");
        System.clearProperty("NOTIFY_HEARTBEAT_INTERVAL_MS");
    }

    @Test
    void testDefaults() {
        NotifyConfig config = NotifyConfig.fromEnv();

        assertEquals(NotifyConfig.DEFAULT_BUFFER_CAPACITY, config.bufferCapacity());
        assertEquals(Duration.ofSeconds(30), config.heartbeatInterval());
        assertEquals(Duration.ofSeconds(10), config.connectTimeout());
        assertEquals(Duration.ofSeconds(2), config.closeGrace());
        assertEquals(5, config.pollMaxAttempts());
        assertEquals(Duration.ofSeconds(2), config.pollInterval());
    }

    @Test
    void testSystemPropertiesOverrideDefaults() {
        System.setProperty("NOTIFY_BUFFER_CAPACITY", "20");
        System.setProperty("POLL_INTERVAL_MS", "500");
        System.setProperty("NOTIFY_HEARTBEAT_INTERVAL_MS", "not-a-number");

        NotifyConfig config = NotifyConfig.fromEnv();

        assertEquals(20, config.bufferCapacity());
        assertEquals(Duration.ofMillis(500), config.pollInterval());
        assertEquals(Duration.ofSeconds(30), config.heartbeatInterval(), "Unparseable value falls back");
    }

    @Test
    void testInvalidValuesRejected() {
        assertThrows(IllegalArgumentException.class, () -> new NotifyConfig(
            "ws://x", "http://x", null, "support",
            Duration.ofSeconds(30), Duration.ofSeconds(10), Duration.ofSeconds(2),
            Duration.ofSeconds(1), Duration.ofSeconds(60), 0.2,
            0, 5, Duration.ofSeconds(2), 9091));

        assertThrows(IllegalArgumentException.class, () -> new NotifyConfig(
            "ws://x", "http://x", null, "support",
            Duration.ZERO, Duration.ofSeconds(10), Duration.ofSeconds(2),
            Duration.ofSeconds(1), Duration.ofSeconds(60), 0.2,
            50, 5, Duration.ofSeconds(2), 9091));
    }
}
