package in.opsdash.domain.poll;

import java.time.Duration;

/**
 * Progress of one status poll. Discarded once a terminal outcome is reached.
 */
public record PollAttempt(String token, int attemptsMade, int maxAttempts, Duration interval) {

    public PollAttempt {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Poll token must not be blank");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        if (attemptsMade < 0 || attemptsMade > maxAttempts) {
            throw new IllegalArgumentException("attemptsMade out of range: " + attemptsMade);
        }
    }

    public static PollAttempt first(String token, int maxAttempts, Duration interval) {
        return new PollAttempt(token, 0, maxAttempts, interval);
    }

    public PollAttempt next() {
        return new PollAttempt(token, attemptsMade + 1, maxAttempts, interval);
    }

    public boolean exhausted() {
        return attemptsMade >= maxAttempts;
    }
}
