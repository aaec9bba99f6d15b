package in.opsdash.service.poll;

import in.opsdash.domain.poll.PollVerdict;

/**
 * Decides whether one status response is terminal.
 *
 * Implementations must never throw: anything unexpected is {@link PollVerdict#INCONCLUSIVE}.
 */
@FunctionalInterface
public interface PollClassifier {

    PollVerdict classify(StatusResponse response);
}
