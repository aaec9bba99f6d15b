package in.opsdash.domain.poll;

/**
 * Classification of a single poll response.
 */
public enum PollVerdict {
    /** Terminal: the operation completed. */
    SUCCESS,
    /** Terminal: the operation definitively failed. */
    FAILURE,
    /** Not terminal: consume one attempt, wait, retry. Also used for malformed responses. */
    INCONCLUSIVE
}
