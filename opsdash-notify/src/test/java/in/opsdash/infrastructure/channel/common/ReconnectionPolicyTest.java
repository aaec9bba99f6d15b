package in.opsdash.infrastructure.channel.common;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ReconnectionPolicy.
 *
 * Tests:
 * - Exponential backoff calculations
 * - Cap at max delay
 * - Jitter bounds
 * - Reset on success
 * - Boundary conditions
 */
class ReconnectionPolicyTest {

    private static ReconnectionPolicy noJitter(Duration base, Duration max) {
        return ReconnectionPolicy.builder()
            .baseDelay(base)
            .maxDelay(max)
            .jitterFraction(0.0)
            .build();
    }

    @Test
    void testInitialState() {
        ReconnectionPolicy policy = ReconnectionPolicy.forNotificationChannel();

        assertEquals(0, policy.getAttemptCount(), "Initial attempt count should be 0");
        assertNull(policy.getLastAttemptTime(), "No attempts made yet");
        assertEquals(Duration.ofSeconds(1), policy.state().baseDelay());
        assertEquals(Duration.ofMinutes(1), policy.state().maxDelay());
        assertEquals(0.2, policy.state().jitterFraction());
    }

    @Test
    void testExponentialBackoff() {
        ReconnectionPolicy policy = noJitter(Duration.ofSeconds(1), Duration.ofMinutes(1));

        assertEquals(Duration.ofSeconds(1), policy.nextDelay(), "First delay should be base delay");
        assertEquals(1, policy.getAttemptCount(), "Each call counts one failure");
        assertEquals(Duration.ofSeconds(2), policy.nextDelay(), "Second delay should be 2s");
        assertEquals(Duration.ofSeconds(4), policy.nextDelay(), "Third delay should be 4s");
        assertEquals(Duration.ofSeconds(8), policy.nextDelay(), "Fourth delay should be 8s");
        assertEquals(4, policy.getAttemptCount());
    }

    @Test
    void testMaxDelayRespected() {
        ReconnectionPolicy policy = noJitter(Duration.ofSeconds(10), Duration.ofSeconds(30));

        assertEquals(Duration.ofSeconds(10), policy.nextDelay());
        assertEquals(Duration.ofSeconds(20), policy.nextDelay());
        assertEquals(Duration.ofSeconds(30), policy.nextDelay(), "40s capped at 30s");
        assertEquals(Duration.ofSeconds(30), policy.nextDelay(), "Still capped");
    }

    @Test
    void testBaseCurveIsMonotoneAndNeverOverflows() {
        ReconnectionPolicy policy = noJitter(Duration.ofSeconds(1), Duration.ofMinutes(1));

        Duration previous = Duration.ZERO;
        for (int attempt = 0; attempt < 200; attempt++) {
            Duration d = policy.baseDelayFor(attempt);
            assertTrue(d.compareTo(previous) >= 0, "Non-decreasing at attempt " + attempt);
            assertTrue(d.compareTo(Duration.ofMinutes(1)) <= 0, "Capped at attempt " + attempt);
            previous = d;
        }
        assertEquals(Duration.ofMinutes(1), policy.baseDelayFor(Integer.MAX_VALUE));
    }

    @Test
    void testNoAttemptLimit() {
        ReconnectionPolicy policy = noJitter(Duration.ofMillis(100), Duration.ofSeconds(5));

        for (int i = 0; i < 1000; i++) {
            policy.nextDelay();
        }
        assertEquals(1000, policy.getAttemptCount());
        assertEquals(Duration.ofSeconds(5), policy.nextDelay(), "Keeps retrying at the cap");
    }

    @Test
    void testJitterStaysWithinBounds() {
        ReconnectionPolicy low = ReconnectionPolicy.builder()
            .baseDelay(Duration.ofSeconds(10))
            .maxDelay(Duration.ofMinutes(1))
            .jitterFraction(0.2)
            .random(() -> 0.0)
            .build();
        ReconnectionPolicy high = ReconnectionPolicy.builder()
            .baseDelay(Duration.ofSeconds(10))
            .maxDelay(Duration.ofMinutes(1))
            .jitterFraction(0.2)
            .random(() -> 0.999999)
            .build();

        assertEquals(Duration.ofSeconds(8), low.nextDelay(), "Lower bound is base * (1 - jitter)");
        Duration upper = high.nextDelay();
        assertTrue(upper.compareTo(Duration.ofSeconds(12)) <= 0, "Upper bound is base * (1 + jitter)");
        assertTrue(upper.compareTo(Duration.ofMillis(11_990)) >= 0);
    }

    @Test
    void testRandomJitterWithinRange() {
        ReconnectionPolicy policy = ReconnectionPolicy.forNotificationChannel();

        for (int i = 0; i < 100; i++) {
            policy.recordSuccess();
            Duration d = policy.nextDelay();
            assertTrue(d.toMillis() >= 800 && d.toMillis() <= 1200, "First delay within 1s +/- 20%: " + d);
        }
    }

    @Test
    void testSuccessResetsPolicy() {
        ReconnectionPolicy policy = noJitter(Duration.ofSeconds(1), Duration.ofMinutes(1));

        policy.nextDelay();
        policy.nextDelay();
        assertEquals(2, policy.getAttemptCount());
        assertNotNull(policy.getLastAttemptTime());

        policy.recordSuccess();
        assertEquals(0, policy.getAttemptCount(), "Attempt count should reset");
        assertNull(policy.getLastAttemptTime(), "Last attempt time should be cleared");
        assertEquals(Duration.ofSeconds(1), policy.nextDelay(), "Delay should reset to base");
    }

    @Test
    void testLastAttemptTimeComesFromPolicyClock() {
        Instant failedAt = Instant.parse("2026-01-01T00:00:05Z");
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .jitterFraction(0.0)
            .clock(Clock.fixed(failedAt, ZoneOffset.UTC))
            .build();

        policy.nextDelay();

        assertEquals(failedAt, policy.getLastAttemptTime(), "Timestamp taken from the injected clock");
    }

    @Test
    void testNullClockRejected() {
        assertThrows(IllegalArgumentException.class, () ->
            ReconnectionPolicy.builder().clock(null));
    }

    @Test
    void testFixedPolicy() {
        ReconnectionPolicy policy = ReconnectionPolicy.fixed(Duration.ofSeconds(5));

        for (int i = 0; i < 5; i++) {
            assertEquals(Duration.ofSeconds(5), policy.nextDelay(), "Fixed delay never grows");
        }
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () ->
            ReconnectionPolicy.builder().baseDelay(Duration.ofSeconds(-1)).build());

        assertThrows(IllegalArgumentException.class, () ->
            ReconnectionPolicy.builder().baseDelay(Duration.ZERO).build());

        assertThrows(IllegalArgumentException.class, () ->
            ReconnectionPolicy.builder().jitterFraction(1.0).build());

        assertThrows(IllegalArgumentException.class, () ->
            ReconnectionPolicy.builder().jitterFraction(-0.1).build());

        assertThrows(IllegalArgumentException.class, () ->
            ReconnectionPolicy.builder()
                .baseDelay(Duration.ofMinutes(10))
                .maxDelay(Duration.ofMinutes(5))
                .build());
    }
}
