package in.opsdash.config;

import in.opsdash.util.Env;

import java.time.Duration;

/**
 * Runtime configuration for the notification channel and the status poller.
 *
 * All values come from {@link Env} (environment variable, then system property).
 *
 * @param wsBaseUrl          Base URL of the push endpoint, e.g. ws://localhost:8001
 * @param apiBaseUrl         Base URL of the REST backend used by the status poller
 * @param subjectId          Admin subject id to subscribe with (may be null when embedded)
 * @param role               Admin role to subscribe with
 * @param heartbeatInterval  Ping interval while the channel is open
 * @param connectTimeout     Max time spent in CONNECTING before the attempt counts as failed
 * @param closeGrace         Max time stop() waits for the server to confirm a close
 * @param backoffBase        First reconnect delay
 * @param backoffMax         Reconnect delay cap
 * @param backoffJitter      Jitter fraction applied to each reconnect delay, in [0, 1)
 * @param bufferCapacity     Max notifications kept in the local feed
 * @param pollMaxAttempts    Attempts made by the status poller before giving up
 * @param pollInterval       Fixed spacing between status poll attempts
 * @param metricsPort        Port of the /metrics and /feed HTTP server
 */
public record NotifyConfig(
    String wsBaseUrl,
    String apiBaseUrl,
    String subjectId,
    String role,
    Duration heartbeatInterval,
    Duration connectTimeout,
    Duration closeGrace,
    Duration backoffBase,
    Duration backoffMax,
    double backoffJitter,
    int bufferCapacity,
    int pollMaxAttempts,
    Duration pollInterval,
    int metricsPort
) {

    public static final int DEFAULT_BUFFER_CAPACITY = 50;
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_CLOSE_GRACE = Duration.ofSeconds(2);
    public static final int DEFAULT_POLL_MAX_ATTEMPTS = 5;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);

    public NotifyConfig {
        if (bufferCapacity <= 0) {
            throw new IllegalArgumentException("Buffer capacity must be positive: " + bufferCapacity);
        }
        if (pollMaxAttempts <= 0) {
            throw new IllegalArgumentException("Poll max attempts must be positive: " + pollMaxAttempts);
        }
        requirePositive("heartbeatInterval", heartbeatInterval);
        requirePositive("connectTimeout", connectTimeout);
        requirePositive("closeGrace", closeGrace);
        requirePositive("pollInterval", pollInterval);
    }

    /**
     * Load configuration from environment variables / system properties.
     */
    public static NotifyConfig fromEnv() {
        return new NotifyConfig(
            Env.get("NOTIFY_WS_BASE_URL", "ws://localhost:8001"),
            Env.get("NOTIFY_API_BASE_URL", "http://localhost:8001/api/checkout"),
            Env.get("NOTIFY_SUBJECT_ID", null),
            Env.get("NOTIFY_ROLE", "support"),
            Duration.ofMillis(Env.getLong("NOTIFY_HEARTBEAT_INTERVAL_MS", DEFAULT_HEARTBEAT_INTERVAL.toMillis())),
            Duration.ofMillis(Env.getLong("NOTIFY_CONNECT_TIMEOUT_MS", DEFAULT_CONNECT_TIMEOUT.toMillis())),
            Duration.ofMillis(Env.getLong("NOTIFY_CLOSE_GRACE_MS", DEFAULT_CLOSE_GRACE.toMillis())),
            Duration.ofMillis(Env.getLong("NOTIFY_BACKOFF_BASE_MS", 1_000)),
            Duration.ofMillis(Env.getLong("NOTIFY_BACKOFF_MAX_MS", 60_000)),
            Env.getDouble("NOTIFY_BACKOFF_JITTER", 0.2),
            Env.getInt("NOTIFY_BUFFER_CAPACITY", DEFAULT_BUFFER_CAPACITY),
            Env.getInt("POLL_MAX_ATTEMPTS", DEFAULT_POLL_MAX_ATTEMPTS),
            Duration.ofMillis(Env.getLong("POLL_INTERVAL_MS", DEFAULT_POLL_INTERVAL.toMillis())),
            Env.getInt("METRICS_PORT", 9091)
        );
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }
}
