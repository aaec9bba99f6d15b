package in.opsdash.domain.notify;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NotificationPriorityTest {

    @Test
    void testFromWire() {
        assertEquals(NotificationPriority.HIGH, NotificationPriority.fromWire("high"));
        assertEquals(NotificationPriority.HIGH, NotificationPriority.fromWire(" HIGH "));
        assertEquals(NotificationPriority.LOW, NotificationPriority.fromWire("low"));
        assertEquals(NotificationPriority.NORMAL, NotificationPriority.fromWire("normal"));
    }

    @Test
    void testAbsentOrUnknownIsNormal() {
        assertEquals(NotificationPriority.NORMAL, NotificationPriority.fromWire(null));
        assertEquals(NotificationPriority.NORMAL, NotificationPriority.fromWire(""));
        assertEquals(NotificationPriority.NORMAL, NotificationPriority.fromWire("critical"));
    }
}
