package in.opsdash.service.notify;

import in.opsdash.domain.notify.DomainEvent;
import in.opsdash.domain.notify.InboundFrame;
import in.opsdash.domain.notify.Notification;
import in.opsdash.infrastructure.metrics.NotifyMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns inbound frames into feed entries.
 *
 * - Control frames are consumed: never buffered, never surfaced
 * - Domain events get a local id and receive time and go to the head of the buffer
 * - High-priority events additionally raise an interrupt
 * - Unparseable payloads only bump the drop counter
 *
 * Placement is always arrival order; priority never reorders the feed.
 */
public final class NotificationTriage {
    private static final Logger log = LoggerFactory.getLogger(NotificationTriage.class);

    /**
     * What triage did with one frame.
     */
    public enum Disposition {
        CONTROL,
        BUFFERED,
        INTERRUPTED,
        DROPPED
    }

    private final NotificationBuffer buffer;
    private final FrameCodec codec;
    private final NotifyMetrics metrics;
    private final Clock clock;

    private final List<InterruptListener> interruptListeners = new CopyOnWriteArrayList<>();
    private final AtomicLong nextLocalId = new AtomicLong(1);
    private final AtomicLong droppedFrames = new AtomicLong(0);

    public NotificationTriage(NotificationBuffer buffer, FrameCodec codec, NotifyMetrics metrics, Clock clock) {
        this.buffer = buffer;
        this.codec = codec;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Disposition onFrame(String raw) {
        Optional<InboundFrame> frame = codec.parse(raw);
        if (frame.isEmpty()) {
            long dropped = droppedFrames.incrementAndGet();
            metrics.recordDroppedFrame();
            log.warn("[TRIAGE] Dropped unparseable frame (total dropped: {}): {}", dropped, abbreviate(raw));
            return Disposition.DROPPED;
        }
        return onFrame(frame.get());
    }

    public Disposition onFrame(InboundFrame frame) {
        switch (frame.kind()) {
            case CONTROL:
                metrics.recordFrame(frame.control().wireType());
                log.trace("[TRIAGE] Control frame consumed: {}", frame.control());
                return Disposition.CONTROL;
            case DOMAIN_EVENT:
                return accept(frame.event());
            default:
                throw new IllegalStateException("Unknown frame kind: " + frame.kind());
        }
    }

    private Disposition accept(DomainEvent event) {
        Notification notification = Notification.from(nextLocalId.getAndIncrement(), event, clock.instant());
        Notification evicted = buffer.add(notification);

        metrics.recordFrame("event");
        metrics.recordBufferSize(buffer.size());
        if (evicted != null) {
            log.debug("[TRIAGE] Feed full, evicted #{} ({})", evicted.localId(), evicted.type());
        }

        if (!notification.isHighPriority()) {
            log.debug("[TRIAGE] Buffered #{} {} '{}'", notification.localId(), notification.type(), notification.title());
            return Disposition.BUFFERED;
        }

        log.info("[TRIAGE] High-priority #{} {} '{}'", notification.localId(), notification.type(), notification.title());
        metrics.recordInterrupt(notification.type());
        for (InterruptListener listener : interruptListeners) {
            try {
                listener.onInterrupt(notification);
            } catch (Exception e) {
                log.error("[TRIAGE] Interrupt listener threw exception", e);
            }
        }
        return Disposition.INTERRUPTED;
    }

    public void addInterruptListener(InterruptListener listener) {
        interruptListeners.add(listener);
    }

    public void removeInterruptListener(InterruptListener listener) {
        interruptListeners.remove(listener);
    }

    public long droppedFrames() {
        return droppedFrames.get();
    }

    public NotificationBuffer buffer() {
        return buffer;
    }

    private static String abbreviate(String raw) {
        if (raw == null) {
            return "null";
        }
        return raw.length() <= 120 ? raw : raw.substring(0, 120) + "...";
    }
}
