package in.opsdash.service.notify;

import in.opsdash.domain.notify.Notification;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Bounded newest-first notification feed.
 *
 * Insert-at-head and evict-at-tail happen under one lock, so readers never observe more
 * than {@code capacity} entries. Reads return immutable snapshots.
 */
public final class NotificationBuffer {

    private final int capacity;
    private final Deque<Notification> entries;

    public NotificationBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity + 1);
    }

    /**
     * Insert at the head, evicting the oldest entry when full.
     *
     * @return the evicted notification, or null
     */
    public synchronized Notification add(Notification notification) {
        entries.addFirst(notification);
        if (entries.size() > capacity) {
            return entries.pollLast();
        }
        return null;
    }

    /**
     * Newest-first copy of the feed.
     */
    public synchronized List<Notification> snapshot() {
        return List.copyOf(entries);
    }

    public synchronized Optional<Notification> head() {
        return Optional.ofNullable(entries.peekFirst());
    }

    public synchronized int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized int unreadCount() {
        int unread = 0;
        for (Notification n : entries) {
            if (!n.read()) {
                unread++;
            }
        }
        return unread;
    }

    /**
     * @return true if a notification with that id is in the feed
     */
    public synchronized boolean markRead(long localId) {
        boolean found = false;
        List<Notification> updated = new ArrayList<>(entries.size());
        for (Notification n : entries) {
            if (n.localId() == localId) {
                found = true;
                updated.add(n.withRead(true));
            } else {
                updated.add(n);
            }
        }
        if (found) {
            entries.clear();
            entries.addAll(updated);
        }
        return found;
    }

    /**
     * @return number of entries that changed from unread to read
     */
    public synchronized int markAllRead() {
        int changed = 0;
        List<Notification> updated = new ArrayList<>(entries.size());
        for (Notification n : entries) {
            if (!n.read()) {
                changed++;
            }
            updated.add(n.withRead(true));
        }
        entries.clear();
        entries.addAll(updated);
        return changed;
    }

    public synchronized void clear() {
        entries.clear();
    }
}
