package in.opsdash.domain.poll;

/**
 * Terminal outcome of a status poll.
 *
 * EXHAUSTED and FAILED are deliberately distinct: the first means "unknown, check later",
 * the second means the server definitively reported a failure (e.g. session expired).
 */
public enum PollOutcome {
    SUCCEEDED,
    FAILED,
    EXHAUSTED
}
