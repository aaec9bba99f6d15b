package in.opsdash.service.notify;

import in.opsdash.config.NotifyConfig;
import in.opsdash.domain.notify.ChannelIdentity;
import in.opsdash.domain.notify.ConnectionState;
import in.opsdash.domain.notify.Notification;
import in.opsdash.infrastructure.channel.ChannelTransport;
import in.opsdash.infrastructure.channel.common.ReconnectionPolicy;
import in.opsdash.infrastructure.channel.common.TaskScheduler;
import in.opsdash.infrastructure.metrics.NotifyMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Consumer-facing surface of the admin notification channel.
 *
 * Usage:
 * <pre>
 * NotificationFeed feed = NotificationFeed.create(config, transport, scheduler, metrics);
 * feed.addInterruptListener(n -> toast(n.title(), n.message()));
 * feed.subscribe(new ChannelIdentity("A1", "admin"));
 * List&lt;Notification&gt; latest = feed.notifications();   // newest first
 * feed.unsubscribe();
 * </pre>
 */
public final class NotificationFeed implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NotificationFeed.class);

    private final ConnectionLifecycleManager manager;
    private final NotificationTriage triage;
    private final NotificationBuffer buffer;

    public NotificationFeed(ConnectionLifecycleManager manager, NotificationTriage triage) {
        this.manager = manager;
        this.triage = triage;
        this.buffer = triage.buffer();
    }

    /**
     * Wire a feed from configuration.
     */
    public static NotificationFeed create(NotifyConfig config, ChannelTransport transport,
                                          TaskScheduler scheduler, NotifyMetrics metrics) {
        FrameCodec codec = new FrameCodec();
        NotificationTriage triage = new NotificationTriage(
            new NotificationBuffer(config.bufferCapacity()), codec, metrics, scheduler.clock());

        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .baseDelay(config.backoffBase())
            .maxDelay(config.backoffMax())
            .jitterFraction(config.backoffJitter())
            .clock(scheduler.clock())
            .build();

        ConnectionLifecycleManager manager = ConnectionLifecycleManager.builder()
            .transport(transport)
            .baseUrl(config.wsBaseUrl())
            .policy(policy)
            .scheduler(scheduler)
            .triage(triage)
            .codec(codec)
            .metrics(metrics)
            .heartbeatInterval(config.heartbeatInterval())
            .connectTimeout(config.connectTimeout())
            .closeGrace(config.closeGrace())
            .build();

        return new NotificationFeed(manager, triage);
    }

    /**
     * Start receiving notifications for {@code identity}. Switching to another identity
     * clears the feed of the previous one.
     */
    public void subscribe(ChannelIdentity identity) {
        log.debug("[FEED] Subscribing as {}", identity);
        manager.start(identity);
    }

    public void unsubscribe() {
        manager.stop();
    }

    public ConnectionState currentState() {
        return manager.currentState();
    }

    /**
     * Read-only newest-first snapshot.
     */
    public List<Notification> notifications() {
        return buffer.snapshot();
    }

    public int unreadCount() {
        return buffer.unreadCount();
    }

    public boolean markRead(long localId) {
        return buffer.markRead(localId);
    }

    public int markAllRead() {
        return buffer.markAllRead();
    }

    public long droppedFrames() {
        return triage.droppedFrames();
    }

    public void addInterruptListener(InterruptListener listener) {
        triage.addInterruptListener(listener);
    }

    public void removeInterruptListener(InterruptListener listener) {
        triage.removeInterruptListener(listener);
    }

    public void addStateListener(StateListener listener) {
        manager.addStateListener(listener);
    }

    public void removeStateListener(StateListener listener) {
        manager.removeStateListener(listener);
    }

    /**
     * Ask the server to add this session to a broadcast channel.
     */
    public boolean subscribeChannel(String channel) {
        return manager.sendControl("subscribe", Map.of("channel", channel));
    }

    public ConnectionLifecycleManager manager() {
        return manager;
    }

    @Override
    public void close() {
        unsubscribe();
    }
}
