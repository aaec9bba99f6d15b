package in.opsdash.service.notify;

import in.opsdash.domain.notify.Notification;
import in.opsdash.domain.notify.NotificationPriority;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NotificationBufferTest {

    private static Notification notification(long id) {
        return new Notification(id, "event", "t" + id, null, NotificationPriority.NORMAL,
            Instant.EPOCH, null, Map.of(), false);
    }

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new NotificationBuffer(0));
        assertThrows(IllegalArgumentException.class, () -> new NotificationBuffer(-5));
    }

    @Test
    void testAddInsertsAtHeadAndEvictsOldest() {
        NotificationBuffer buffer = new NotificationBuffer(3);

        assertNull(buffer.add(notification(1)));
        assertNull(buffer.add(notification(2)));
        assertNull(buffer.add(notification(3)));
        Notification evicted = buffer.add(notification(4));

        assertNotNull(evicted);
        assertEquals(1L, evicted.localId(), "Oldest entry evicted");
        assertEquals(3, buffer.size());
        assertEquals(4L, buffer.head().orElseThrow().localId());
    }

    @Test
    void testLengthIsMinOfInsertsAndCapacity() {
        for (int n : new int[] {0, 1, 7, 50, 51, 120}) {
            NotificationBuffer buffer = new NotificationBuffer(50);
            for (int i = 1; i <= n; i++) {
                buffer.add(notification(i));
            }
            assertEquals(Math.min(n, 50), buffer.size(), "Length after " + n + " inserts");
        }
    }

    @Test
    void testSnapshotIsImmutableCopy() {
        NotificationBuffer buffer = new NotificationBuffer(5);
        buffer.add(notification(1));

        List<Notification> snapshot = buffer.snapshot();
        buffer.add(notification(2));

        assertEquals(1, snapshot.size(), "Snapshot unaffected by later inserts");
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(notification(9)));
    }

    @Test
    void testReadState() {
        NotificationBuffer buffer = new NotificationBuffer(5);
        buffer.add(notification(1));
        buffer.add(notification(2));
        buffer.add(notification(3));
        assertEquals(3, buffer.unreadCount());

        assertTrue(buffer.markRead(2));
        assertFalse(buffer.markRead(99), "Unknown id");
        assertEquals(2, buffer.unreadCount());
        assertTrue(buffer.snapshot().get(1).read(), "Order preserved after markRead");
        assertEquals(2L, buffer.snapshot().get(1).localId());

        assertEquals(2, buffer.markAllRead(), "Only unread entries counted");
        assertEquals(0, buffer.unreadCount());
        assertEquals(0, buffer.markAllRead());
    }

    @Test
    void testClear() {
        NotificationBuffer buffer = new NotificationBuffer(5);
        buffer.add(notification(1));
        buffer.clear();

        assertEquals(0, buffer.size());
        assertTrue(buffer.head().isEmpty());
    }
}
