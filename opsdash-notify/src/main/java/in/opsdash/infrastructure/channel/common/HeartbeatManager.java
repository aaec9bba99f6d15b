package in.opsdash.infrastructure.channel.common;

import in.opsdash.domain.notify.HeartbeatTicket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Heartbeat manager for the open notification channel.
 *
 * Features:
 * - Periodic ping while running
 * - Watchdog: no inbound frame of any kind within the timeout means the connection is dead,
 *   even if the transport never reported a close
 * - Dead callback fires at most once per start()
 * - Callbacks run outside the manager's lock
 *
 * Usage:
 * <pre>
 * HeartbeatManager heartbeat = HeartbeatManager.forChannel(
 *     "A1:admin",
 *     Duration.ofSeconds(30),   // ping every 30s, watchdog after 60s of silence
 *     () -> connection.send(pingJson()),
 *     () -> onConnectionDead(),
 *     scheduler
 * );
 *
 * heartbeat.start();
 * // on every inbound frame:
 * heartbeat.recordFrame();
 * heartbeat.stop();
 * </pre>
 */
public class HeartbeatManager {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatManager.class);

    private final String channelTag;
    private final Duration pingInterval;
    private final Duration timeout;
    private final Runnable pingFunction;
    private final Runnable deadCallback;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private ScheduledTask pingTask;
    private ScheduledTask watchdogTask;
    private volatile Instant lastFrameTime;
    private volatile Instant lastPingTime;
    private boolean running = false;
    private boolean dead = false;
    private int generation = 0;

    public HeartbeatManager(String channelTag,
                            Duration pingInterval, Duration timeout,
                            Runnable pingFunction,
                            Runnable deadCallback,
                            TaskScheduler scheduler) {
        if (pingInterval.isNegative() || pingInterval.isZero()) {
            throw new IllegalArgumentException("Ping interval must be positive");
        }
        if (timeout.compareTo(pingInterval) < 0) {
            throw new IllegalArgumentException("Timeout must not be shorter than the ping interval");
        }
        this.channelTag = channelTag;
        this.pingInterval = pingInterval;
        this.timeout = timeout;
        this.pingFunction = pingFunction;
        this.deadCallback = deadCallback;
        this.scheduler = scheduler;
        this.clock = scheduler.clock();
    }

    /**
     * Start pinging and arm the watchdog.
     */
    public synchronized void start() {
        if (running) {
            log.warn("[{}] Heartbeat already running", channelTag);
            return;
        }

        log.debug("[{}] Starting heartbeat (ping interval: {}ms, watchdog: {}ms)",
            channelTag, pingInterval.toMillis(), timeout.toMillis());

        running = true;
        dead = false;
        generation++;
        lastFrameTime = clock.instant();
        lastPingTime = null;

        schedulePing(generation);
        scheduleWatchdog(generation, timeout);
    }

    /**
     * Stop pinging and disarm the watchdog. Safe to call when not running.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        log.debug("[{}] Stopping heartbeat", channelTag);
        running = false;
        generation++;

        if (pingTask != null) {
            pingTask.cancel();
            pingTask = null;
        }
        if (watchdogTask != null) {
            watchdogTask.cancel();
            watchdogTask = null;
        }
    }

    /**
     * Record receipt of any inbound frame (pong, control or domain event).
     */
    public void recordFrame() {
        lastFrameTime = clock.instant();
    }

    /**
     * @return true while running and the last frame is within the watchdog window
     */
    public synchronized boolean isHealthy() {
        return running && !dead && isWithinTimeout();
    }

    public synchronized boolean isRunning() {
        return running;
    }

    /**
     * @return Duration since the last inbound frame, or null before start()
     */
    public Duration getTimeSinceLastFrame() {
        Instant lastFrame = lastFrameTime;
        if (lastFrame == null) {
            return null;
        }
        return Duration.between(lastFrame, clock.instant());
    }

    public HeartbeatTicket ticket() {
        return new HeartbeatTicket(pingInterval, lastPingTime);
    }

    public Duration getTimeout() {
        return timeout;
    }

    private void schedulePing(int gen) {
        pingTask = scheduler.schedule(() -> onPingDue(gen), pingInterval);
    }

    private void scheduleWatchdog(int gen, Duration delay) {
        watchdogTask = scheduler.schedule(() -> onWatchdogDue(gen), delay);
    }

    private void onPingDue(int gen) {
        synchronized (this) {
            if (!running || gen != generation) {
                return;
            }
        }

        log.debug("[{}] Sending ping", channelTag);
        boolean sent;
        try {
            pingFunction.run();
            sent = true;
        } catch (Exception e) {
            log.error("[{}] Ping function threw exception", channelTag, e);
            sent = false;
        }

        synchronized (this) {
            if (!running || gen != generation) {
                return;
            }
            if (sent) {
                lastPingTime = clock.instant();
                schedulePing(gen);
                return;
            }
        }
        declareDead(gen, "ping could not be sent");
    }

    private void onWatchdogDue(int gen) {
        Duration remaining;
        synchronized (this) {
            if (!running || gen != generation) {
                return;
            }
            Duration silence = Duration.between(lastFrameTime, clock.instant());
            remaining = timeout.minus(silence);
            if (remaining.isNegative() || remaining.isZero()) {
                remaining = null;
            } else {
                scheduleWatchdog(gen, remaining);
            }
        }

        if (remaining == null) {
            log.warn("[{}] Heartbeat timeout - no frame received for {}ms", channelTag, timeout.toMillis());
            declareDead(gen, "watchdog timeout");
        }
    }

    private void declareDead(int gen, String reason) {
        synchronized (this) {
            if (!running || gen != generation || dead) {
                return;
            }
            dead = true;
            running = false;
            generation++;
            if (pingTask != null) {
                pingTask.cancel();
                pingTask = null;
            }
            if (watchdogTask != null) {
                watchdogTask.cancel();
                watchdogTask = null;
            }
        }

        log.warn("[{}] Connection considered dead: {}", channelTag, reason);
        if (deadCallback != null) {
            try {
                deadCallback.run();
            } catch (Exception e) {
                log.error("[{}] Dead callback threw exception", channelTag, e);
            }
        }
    }

    private boolean isWithinTimeout() {
        Instant lastFrame = lastFrameTime;
        if (lastFrame == null) {
            return false;
        }
        return Duration.between(lastFrame, clock.instant()).compareTo(timeout) < 0;
    }

    /**
     * Heartbeat with the watchdog set to twice the ping interval.
     */
    public static HeartbeatManager forChannel(String channelTag, Duration pingInterval,
                                              Runnable pingFunction, Runnable deadCallback,
                                              TaskScheduler scheduler) {
        return new HeartbeatManager(
            channelTag,
            pingInterval,
            pingInterval.multipliedBy(2),
            pingFunction,
            deadCallback,
            scheduler
        );
    }
}
