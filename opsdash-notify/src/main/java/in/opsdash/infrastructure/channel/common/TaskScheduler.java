package in.opsdash.infrastructure.channel.common;

import java.time.Clock;
import java.time.Duration;

/**
 * Timer source shared by the heartbeat, the reconnect backoff and the status poller.
 *
 * Production code uses {@link ExecutorTaskScheduler}; tests drive a manual implementation
 * so every timer firing is deterministic.
 */
public interface TaskScheduler {

    /**
     * Run {@code task} once after {@code delay}.
     */
    ScheduledTask schedule(Runnable task, Duration delay);

    /**
     * Clock that matches the scheduler's notion of time.
     */
    Clock clock();
}
