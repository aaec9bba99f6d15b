package in.opsdash.domain.notify;

import java.time.Duration;

/**
 * Snapshot of the reconnect backoff.
 */
public record BackoffState(int attemptCount, Duration baseDelay, Duration maxDelay, double jitterFraction) {
}
