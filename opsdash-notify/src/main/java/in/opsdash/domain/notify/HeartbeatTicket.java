package in.opsdash.domain.notify;

import java.time.Duration;
import java.time.Instant;

/**
 * Heartbeat of the currently open connection.
 *
 * @param interval   Ping interval
 * @param lastSentAt Time of the last ping, null before the first one
 */
public record HeartbeatTicket(Duration interval, Instant lastSentAt) {
}
