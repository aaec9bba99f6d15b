package in.opsdash.infrastructure.metrics;

import in.opsdash.domain.notify.ConnectionState;
import in.opsdash.domain.poll.PollOutcome;

import java.time.Duration;

/**
 * Metrics sink that discards everything.
 */
public final class NoopNotifyMetrics implements NotifyMetrics {

    public static final NoopNotifyMetrics INSTANCE = new NoopNotifyMetrics();

    private NoopNotifyMetrics() {}

    @Override
    public void recordTransition(ConnectionState from, ConnectionState to) {}

    @Override
    public void recordReconnectScheduled(int attempt, Duration delay) {}

    @Override
    public void recordConnectionLoss(String reason) {}

    @Override
    public void recordFrame(String kind) {}

    @Override
    public void recordDroppedFrame() {}

    @Override
    public void recordInterrupt(String type) {}

    @Override
    public void recordBufferSize(int size) {}

    @Override
    public void recordPollOutcome(PollOutcome outcome, int attempts) {}
}
