package in.opsdash.infrastructure.metrics;

import in.opsdash.domain.notify.ConnectionState;
import in.opsdash.domain.poll.PollOutcome;

import java.time.Duration;

/**
 * Metrics hooks of the notification channel and the status poller.
 *
 * Implementations can publish to Prometheus or any other backend.
 *
 * Key metrics:
 * - State transitions and the current state
 * - Reconnect attempts and scheduled delays
 * - Frames received by kind, frames dropped as malformed
 * - Interrupts raised for high-priority events
 * - Poll outcomes
 */
public interface NotifyMetrics {

    /**
     * Record a lifecycle transition.
     *
     * @param from Previous state
     * @param to   New state
     */
    void recordTransition(ConnectionState from, ConnectionState to);

    /**
     * Record a scheduled reconnection.
     *
     * @param attempt Attempt number after this failure (1, 2, 3...)
     * @param delay   Delay before the attempt
     */
    void recordReconnectScheduled(int attempt, Duration delay);

    /**
     * Record the reason a live or opening connection was lost.
     *
     * @param reason TRANSPORT_CLOSE, TRANSPORT_ERROR, CONNECT_TIMEOUT or WATCHDOG_TIMEOUT
     */
    void recordConnectionLoss(String reason);

    /**
     * Record an inbound frame that parsed successfully.
     *
     * @param kind Wire type for control frames, "event" for domain events
     */
    void recordFrame(String kind);

    /**
     * Record an inbound frame dropped because it could not be parsed.
     */
    void recordDroppedFrame();

    /**
     * Record an interrupt raised for a high-priority notification.
     *
     * @param type Event type
     */
    void recordInterrupt(String type);

    /**
     * Record the current feed size.
     */
    void recordBufferSize(int size);

    /**
     * Record a finished status poll.
     *
     * @param outcome  Terminal outcome
     * @param attempts Requests issued
     */
    void recordPollOutcome(PollOutcome outcome, int attempts);
}
