package in.opsdash.service.notify;

import in.opsdash.domain.notify.BackoffState;
import in.opsdash.domain.notify.ChannelIdentity;
import in.opsdash.domain.notify.ConnectionState;
import in.opsdash.domain.notify.HeartbeatTicket;
import in.opsdash.infrastructure.channel.ChannelConnection;
import in.opsdash.infrastructure.channel.ChannelConnectionException;
import in.opsdash.infrastructure.channel.ChannelTransport;
import in.opsdash.infrastructure.channel.TransportListener;
import in.opsdash.infrastructure.channel.common.HeartbeatManager;
import in.opsdash.infrastructure.channel.common.ReconnectionPolicy;
import in.opsdash.infrastructure.channel.common.ScheduledTask;
import in.opsdash.infrastructure.channel.common.TaskScheduler;
import in.opsdash.infrastructure.metrics.NoopNotifyMetrics;
import in.opsdash.infrastructure.metrics.NotifyMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns the single notification channel of one admin session.
 *
 * Drives it through IDLE, CONNECTING, OPEN, CLOSING and RECONNECT_PENDING; starts the
 * heartbeat on OPEN and schedules reconnects through the {@link ReconnectionPolicy}.
 *
 * Every mutation goes through this object's monitor. Transport callbacks, heartbeat
 * callbacks and retry timers capture the epoch they were issued under; the epoch moves on
 * every connect attempt, every connection loss and every teardown, so a callback from a
 * superseded connection is a no-op.
 */
public final class ConnectionLifecycleManager {
    private static final Logger log = LoggerFactory.getLogger(ConnectionLifecycleManager.class);

    static final String LOSS_TRANSPORT_CLOSE = "TRANSPORT_CLOSE";
    static final String LOSS_TRANSPORT_ERROR = "TRANSPORT_ERROR";
    static final String LOSS_CONNECT_TIMEOUT = "CONNECT_TIMEOUT";
    static final String LOSS_WATCHDOG_TIMEOUT = "WATCHDOG_TIMEOUT";

    private final ChannelTransport transport;
    private final String baseUrl;
    private final ReconnectionPolicy policy;
    private final TaskScheduler scheduler;
    private final NotificationTriage triage;
    private final FrameCodec codec;
    private final NotifyMetrics metrics;
    private final Duration heartbeatInterval;
    private final Duration connectTimeout;
    private final Duration closeGrace;
    private final List<StateListener> stateListeners = new CopyOnWriteArrayList<>();

    // Guarded by this
    private ConnectionState state = ConnectionState.IDLE;
    private ChannelIdentity identity;
    private long epoch = 0;
    private ChannelConnection connection;
    private HeartbeatManager heartbeat;
    private ScheduledTask retryTask;
    private ScheduledTask connectTimeoutTask;
    private CompletableFuture<Void> idleSignal;
    private long connectAttempts = 0;

    private ConnectionLifecycleManager(Builder builder) {
        this.transport = builder.transport;
        this.baseUrl = builder.baseUrl;
        this.policy = builder.policy;
        this.scheduler = builder.scheduler;
        this.triage = builder.triage;
        this.codec = builder.codec;
        this.metrics = builder.metrics;
        this.heartbeatInterval = builder.heartbeatInterval;
        this.connectTimeout = builder.connectTimeout;
        this.closeGrace = builder.closeGrace;
    }

    /**
     * Open the channel for {@code newIdentity}. Returns immediately; completion is observed
     * through state changes.
     *
     * No-op while already active for the same identity. A different identity tears down the
     * current channel first, clears the previous identity's feed and connects to the new
     * address. The clear happens under the same monitor as frame delivery, so no frame of
     * the old channel can land in the new identity's feed.
     */
    public synchronized void start(ChannelIdentity newIdentity) {
        Objects.requireNonNull(newIdentity, "identity");

        if (state != ConnectionState.IDLE && newIdentity.equals(identity)) {
            log.debug("[CHANNEL:{}] start() ignored, already {}", identity, state);
            return;
        }

        if (state != ConnectionState.IDLE) {
            log.info("[CHANNEL:{}] Identity changed to {}, tearing down current channel", identity, newIdentity);
            teardown(true);
        }

        if (identity != null && !identity.equals(newIdentity)) {
            NotificationBuffer buffer = triage.buffer();
            log.info("[CHANNEL:{}] Clearing {} notifications before switching to {}", identity, buffer.size(), newIdentity);
            buffer.clear();
        }

        identity = newIdentity;
        connect();
    }

    /**
     * Stop the channel. Always ends in IDLE: an open connection gets a close request and at
     * most {@code closeGrace} to confirm it, after which local teardown proceeds anyway.
     * Pending heartbeat, connect and retry timers are cancelled before this returns.
     */
    public void stop() {
        CompletableFuture<Void> waitFor;
        long closingEpoch;

        synchronized (this) {
            if (state == ConnectionState.IDLE) {
                return;
            }
            if (state == ConnectionState.CONNECTING || state == ConnectionState.RECONNECT_PENDING) {
                log.info("[CHANNEL:{}] Stopped while {}", identity, state);
                teardown(false);
                return;
            }
            if (state == ConnectionState.OPEN) {
                stopHeartbeat();
                cancelRetry();
                transition(ConnectionState.CLOSING);
                idleSignal = new CompletableFuture<>();
                requestClose();
            }
            if (idleSignal == null) {
                // close request failed synchronously and teardown already ran
                return;
            }
            waitFor = idleSignal;
            closingEpoch = epoch;
        }

        try {
            waitFor.get(closeGrace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[CHANNEL:{}] Close not confirmed within {}ms, forcing teardown", identity, closeGrace.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[CHANNEL:{}] Interrupted while waiting for close, forcing teardown", identity);
        } catch (ExecutionException e) {
            log.warn("[CHANNEL:{}] Close wait failed, forcing teardown", identity, e.getCause());
        }

        synchronized (this) {
            if (state == ConnectionState.CLOSING && epoch == closingEpoch) {
                teardown(false);
            }
        }
    }

    /**
     * Send a client request over the open channel ({@code subscribe}, {@code get_online_admins}).
     *
     * @return false when the channel is not open or the send failed
     */
    public synchronized boolean sendControl(String type, Map<String, ?> fields) {
        if (state != ConnectionState.OPEN || connection == null) {
            log.debug("[CHANNEL:{}] {} not sent, channel is {}", identity, type, state);
            return false;
        }
        try {
            connection.send(codec.request(type, fields));
            return true;
        } catch (RuntimeException e) {
            log.warn("[CHANNEL:{}] Failed to send {}: {}", identity, type, e.getMessage());
            return false;
        }
    }

    public synchronized ConnectionState currentState() {
        return state;
    }

    public synchronized Optional<ChannelIdentity> identity() {
        return Optional.ofNullable(identity);
    }

    public BackoffState backoffState() {
        return policy.state();
    }

    /**
     * @return the heartbeat of the open connection; empty in any other state
     */
    public synchronized Optional<HeartbeatTicket> heartbeatTicket() {
        if (state != ConnectionState.OPEN || heartbeat == null) {
            return Optional.empty();
        }
        return Optional.of(heartbeat.ticket());
    }

    /**
     * @return total transport opens requested since construction
     */
    public synchronized long connectAttempts() {
        return connectAttempts;
    }

    public synchronized boolean hasPendingRetry() {
        return retryTask != null;
    }

    public void addStateListener(StateListener listener) {
        stateListeners.add(listener);
    }

    public void removeStateListener(StateListener listener) {
        stateListeners.remove(listener);
    }

    // ------------------------------------------------------------------ transitions

    private void connect() {
        transition(ConnectionState.CONNECTING);
        long attemptEpoch = ++epoch;
        connectAttempts++;

        URI uri = identity.channelUri(baseUrl);
        log.info("[CHANNEL:{}] Connecting (attempt epoch {})", identity, attemptEpoch);

        connectTimeoutTask = scheduler.schedule(() -> onConnectTimeout(attemptEpoch), connectTimeout);
        try {
            transport.open(uri, new EpochListener(attemptEpoch));
        } catch (RuntimeException e) {
            log.warn("[CHANNEL:{}] Transport refused to open: {}", identity, e.getMessage());
            onTransportError(attemptEpoch, e);
        }
    }

    private synchronized void onTransportOpen(long ep, ChannelConnection conn) {
        if (ep != epoch || state != ConnectionState.CONNECTING) {
            log.debug("[CHANNEL:{}] Late open for epoch {} ignored, aborting connection", identity, ep);
            conn.abort();
            return;
        }

        cancelConnectTimeout();
        connection = conn;
        policy.recordSuccess();
        transition(ConnectionState.OPEN);

        heartbeat = HeartbeatManager.forChannel(
            identity.toString(),
            heartbeatInterval,
            () -> sendPing(ep),
            () -> onWatchdogTimeout(ep),
            scheduler
        );
        heartbeat.start();
    }

    private synchronized void onTransportText(long ep, String text) {
        if (ep != epoch || state != ConnectionState.OPEN) {
            log.trace("[CHANNEL:{}] Frame from stale or non-open connection ignored", identity);
            return;
        }
        if (heartbeat != null) {
            heartbeat.recordFrame();
        }
        triage.onFrame(text);
    }

    private synchronized void onTransportClose(long ep, int statusCode, String reason) {
        if (ep != epoch) {
            return;
        }
        switch (state) {
            case CONNECTING, OPEN -> {
                log.warn("[CHANNEL:{}] Transport closed: {} {}", identity, statusCode, reason);
                connectionLost(LOSS_TRANSPORT_CLOSE);
            }
            case CLOSING -> {
                log.info("[CHANNEL:{}] Close confirmed: {} {}", identity, statusCode, reason);
                teardown(false);
            }
            default -> log.debug("[CHANNEL:{}] Close ignored in {}", identity, state);
        }
    }

    private synchronized void onTransportError(long ep, Throwable error) {
        if (ep != epoch) {
            return;
        }
        switch (state) {
            case CONNECTING, OPEN -> {
                log.warn("[CHANNEL:{}] Transport error: {}", identity, String.valueOf(error));
                connectionLost(LOSS_TRANSPORT_ERROR);
            }
            case CLOSING -> {
                log.info("[CHANNEL:{}] Transport error while closing: {}", identity, String.valueOf(error));
                teardown(false);
            }
            default -> log.debug("[CHANNEL:{}] Error ignored in {}", identity, state);
        }
    }

    private synchronized void onConnectTimeout(long ep) {
        if (ep != epoch || state != ConnectionState.CONNECTING) {
            return;
        }
        log.warn("[CHANNEL:{}] Connect timed out after {}ms", identity, connectTimeout.toMillis());
        connectionLost(LOSS_CONNECT_TIMEOUT);
    }

    private synchronized void onWatchdogTimeout(long ep) {
        if (ep != epoch || state != ConnectionState.OPEN) {
            return;
        }
        connectionLost(LOSS_WATCHDOG_TIMEOUT);
    }

    private synchronized void onRetryDue(long ep) {
        if (ep != epoch || state != ConnectionState.RECONNECT_PENDING) {
            log.debug("[CHANNEL:{}] Stale retry timer ignored (epoch {})", identity, ep);
            return;
        }
        retryTask = null;
        connect();
    }

    private synchronized void sendPing(long ep) {
        if (ep != epoch || state != ConnectionState.OPEN || connection == null) {
            return;
        }
        // exceptions propagate to the heartbeat, which treats them as a dead connection
        connection.send(codec.ping(scheduler.clock().millis()));
    }

    /**
     * CONNECTING/OPEN -> RECONNECT_PENDING. The only path into a reconnect.
     */
    private void connectionLost(String reason) {
        metrics.recordConnectionLoss(reason);
        stopHeartbeat();
        cancelConnectTimeout();
        releaseConnection(false);

        transition(ConnectionState.RECONNECT_PENDING);
        long retryEpoch = ++epoch;

        Duration delay = policy.nextDelay();
        int attempt = policy.getAttemptCount();
        metrics.recordReconnectScheduled(attempt, delay);
        log.warn("[CHANNEL:{}] {} - reconnecting in {}ms (attempt {})", identity, reason, delay.toMillis(), attempt);

        retryTask = scheduler.schedule(() -> onRetryDue(retryEpoch), delay);
    }

    /**
     * Any state -> IDLE. Cancels every timer and invalidates every outstanding callback.
     */
    private void teardown(boolean graceful) {
        epoch++;
        stopHeartbeat();
        cancelRetry();
        cancelConnectTimeout();
        releaseConnection(graceful && state == ConnectionState.OPEN);

        if (state != ConnectionState.IDLE) {
            transition(ConnectionState.IDLE);
        }
        if (idleSignal != null) {
            idleSignal.complete(null);
            idleSignal = null;
        }
    }

    private void requestClose() {
        ChannelConnection conn = connection;
        if (conn == null) {
            teardown(false);
            return;
        }
        try {
            conn.close().whenComplete((v, error) -> {
                if (error != null) {
                    log.warn("[CHANNEL:{}] Close request failed: {}", identity, error.toString());
                }
            });
        } catch (ChannelConnectionException e) {
            log.warn("[CHANNEL:{}] Close request rejected: {}", identity, e.getMessage());
            teardown(false);
        }
    }

    private void releaseConnection(boolean graceful) {
        ChannelConnection conn = connection;
        connection = null;
        if (conn == null) {
            return;
        }
        if (!graceful) {
            conn.abort();
            return;
        }
        try {
            conn.close()
                .orTimeout(closeGrace.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((v, error) -> conn.abort());
        } catch (RuntimeException e) {
            log.debug("[CHANNEL:{}] Graceful release failed, aborting: {}", identity, e.getMessage());
            conn.abort();
        }
    }

    private void transition(ConnectionState next) {
        ConnectionState previous = state;
        if (!previous.canTransitionTo(next)) {
            throw new IllegalStateException("Invalid transition " + previous + " -> " + next);
        }
        state = next;

        log.info("[CHANNEL:{}] {} -> {}", identity, previous, next);
        metrics.recordTransition(previous, next);
        for (StateListener listener : stateListeners) {
            try {
                listener.onStateChange(previous, next);
            } catch (Exception e) {
                log.error("[CHANNEL:{}] State listener threw exception", identity, e);
            }
        }
    }

    private void stopHeartbeat() {
        if (heartbeat != null) {
            heartbeat.stop();
            heartbeat = null;
        }
    }

    private void cancelRetry() {
        if (retryTask != null) {
            retryTask.cancel();
            retryTask = null;
        }
    }

    private void cancelConnectTimeout() {
        if (connectTimeoutTask != null) {
            connectTimeoutTask.cancel();
            connectTimeoutTask = null;
        }
    }

    /**
     * Routes transport callbacks into the manager tagged with the attempt's epoch.
     */
    private final class EpochListener implements TransportListener {
        private final long ep;

        private EpochListener(long ep) {
            this.ep = ep;
        }

        @Override
        public void onOpen(ChannelConnection conn) {
            onTransportOpen(ep, conn);
        }

        @Override
        public void onText(String text) {
            onTransportText(ep, text);
        }

        @Override
        public void onClose(int statusCode, String reason) {
            onTransportClose(ep, statusCode, reason);
        }

        @Override
        public void onError(Throwable error) {
            onTransportError(ep, error);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for ConnectionLifecycleManager.
     */
    public static class Builder {
        private ChannelTransport transport;
        private String baseUrl;
        private ReconnectionPolicy policy = ReconnectionPolicy.forNotificationChannel();
        private TaskScheduler scheduler;
        private NotificationTriage triage;
        private FrameCodec codec = new FrameCodec();
        private NotifyMetrics metrics = NoopNotifyMetrics.INSTANCE;
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration closeGrace = Duration.ofSeconds(2);

        public Builder transport(ChannelTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder policy(ReconnectionPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder scheduler(TaskScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder triage(NotificationTriage triage) {
            this.triage = triage;
            return this;
        }

        public Builder codec(FrameCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder metrics(NotifyMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder closeGrace(Duration closeGrace) {
            this.closeGrace = closeGrace;
            return this;
        }

        public ConnectionLifecycleManager build() {
            Objects.requireNonNull(transport, "transport");
            Objects.requireNonNull(baseUrl, "baseUrl");
            Objects.requireNonNull(policy, "policy");
            Objects.requireNonNull(scheduler, "scheduler");
            Objects.requireNonNull(triage, "triage");
            Objects.requireNonNull(codec, "codec");
            Objects.requireNonNull(metrics, "metrics");
            requirePositive("heartbeatInterval", heartbeatInterval);
            requirePositive("connectTimeout", connectTimeout);
            requirePositive("closeGrace", closeGrace);
            return new ConnectionLifecycleManager(this);
        }

        private static void requirePositive(String name, Duration value) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }
}
