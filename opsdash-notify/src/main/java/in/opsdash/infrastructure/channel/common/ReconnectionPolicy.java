package in.opsdash.infrastructure.channel.common;

import in.opsdash.domain.notify.BackoffState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Reconnection policy with exponential backoff and jitter for the notification channel.
 *
 * Features:
 * - delay = min(maxDelay, baseDelay * 2^attemptCount), then scaled by a uniform
 *   factor in [1 - jitter, 1 + jitter]
 * - No attempt limit: the channel retries for as long as its owner wants it open
 * - Reset after a successful connection
 *
 * Usage:
 * <pre>
 * ReconnectionPolicy policy = ReconnectionPolicy.builder()
 *     .baseDelay(Duration.ofSeconds(1))
 *     .maxDelay(Duration.ofMinutes(1))
 *     .jitterFraction(0.2)
 *     .build();
 *
 * // on every failed attempt or abnormal close:
 * scheduler.schedule(this::reconnect, policy.nextDelay());
 * // once the channel is open again:
 * policy.recordSuccess();
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterFraction;
    private final DoubleSupplier random;
    private final Clock clock;

    private int attemptCount = 0;
    private Instant lastAttemptTime;

    private ReconnectionPolicy(Duration baseDelay, Duration maxDelay,
                               double jitterFraction, DoubleSupplier random, Clock clock) {
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitterFraction = jitterFraction;
        this.random = random;
        this.clock = clock;
    }

    /**
     * Delay before the next reconnection attempt. Counts as one failure:
     * every call increments the attempt count exactly once.
     *
     * @return jittered delay; may exceed maxDelay by at most the jitter fraction
     */
    public synchronized Duration nextDelay() {
        long capped = baseDelayFor(attemptCount).toMillis();
        attemptCount++;
        lastAttemptTime = clock.instant();

        if (jitterFraction == 0.0) {
            return Duration.ofMillis(capped);
        }
        double factor = 1.0 - jitterFraction + (2.0 * jitterFraction * random.getAsDouble());
        return Duration.ofMillis(Math.max(1L, Math.round(capped * factor)));
    }

    /**
     * Un-jittered delay for the given attempt number, capped at maxDelay.
     */
    public Duration baseDelayFor(int attempt) {
        long maxMillis = maxDelay.toMillis();
        long delay = baseDelay.toMillis();
        for (int i = 0; i < attempt && delay < maxMillis; i++) {
            delay *= 2;
        }
        return Duration.ofMillis(Math.min(delay, maxMillis));
    }

    /**
     * Record a successful connection. Resets the attempt count.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        lastAttemptTime = null;
    }

    /**
     * @return Number of failures since the last success
     */
    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    /**
     * @return Instant of the last failure on the policy's clock, or null if none since the
     *         last success
     */
    public synchronized Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public synchronized BackoffState state() {
        return new BackoffState(attemptCount, baseDelay, maxDelay, jitterFraction);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default policy for the admin notification channel: 1s doubling up to 60s, 20% jitter.
     */
    public static ReconnectionPolicy forNotificationChannel() {
        return builder()
            .baseDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofMinutes(1))
            .jitterFraction(0.2)
            .build();
    }

    /**
     * Fixed delay with no growth and no jitter. Matches the dashboard's legacy 5s retry
     * when called with {@code Duration.ofSeconds(5)}.
     */
    public static ReconnectionPolicy fixed(Duration delay) {
        return builder()
            .baseDelay(delay)
            .maxDelay(delay)
            .jitterFraction(0.0)
            .build();
    }

    /**
     * Builder for ReconnectionPolicy.
     */
    public static class Builder {
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(1);
        private double jitterFraction = 0.2;
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();
        private Clock clock = Clock.systemUTC();

        public Builder baseDelay(Duration baseDelay) {
            if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
                throw new IllegalArgumentException("Base delay must be positive");
            }
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay == null || maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder jitterFraction(double jitterFraction) {
            if (jitterFraction < 0.0 || jitterFraction >= 1.0) {
                throw new IllegalArgumentException("Jitter fraction must be in [0, 1)");
            }
            this.jitterFraction = jitterFraction;
            return this;
        }

        /**
         * Source of uniform values in [0, 1). Tests pin it to make jitter predictable.
         */
        public Builder random(DoubleSupplier random) {
            if (random == null) {
                throw new IllegalArgumentException("Random source must not be null");
            }
            this.random = random;
            return this;
        }

        /**
         * Clock for failure timestamps; pass the scheduler's clock so they line up with timers.
         */
        public Builder clock(Clock clock) {
            if (clock == null) {
                throw new IllegalArgumentException("Clock must not be null");
            }
            this.clock = clock;
            return this;
        }

        public ReconnectionPolicy build() {
            if (baseDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Base delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(baseDelay, maxDelay, jitterFraction, random, clock);
        }
    }
}
