package in.opsdash.domain.poll;

/**
 * Result reported to the caller of a status poll.
 *
 * @param token        Token that was polled
 * @param outcome      Terminal outcome
 * @param attemptsMade Requests issued
 * @param lastBody     Body of the last response, null if none was received
 */
public record PollResult(String token, PollOutcome outcome, int attemptsMade, String lastBody) {

    public boolean succeeded() {
        return outcome == PollOutcome.SUCCEEDED;
    }
}
