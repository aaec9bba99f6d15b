package in.opsdash.service.poll;

import in.opsdash.domain.poll.PollResult;

import java.util.concurrent.CompletableFuture;

/**
 * Running status poll.
 */
public interface PollHandle {

    /**
     * Completes with the terminal result. Cancelled if {@link #cancel()} is called first.
     */
    CompletableFuture<PollResult> result();

    /**
     * Stop issuing further requests. No-op once a result is available.
     */
    void cancel();
}
