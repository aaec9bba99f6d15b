package in.opsdash.service.poll;

import java.util.concurrent.CompletableFuture;

/**
 * Issues one status request for a token. A failed future counts as an inconclusive attempt.
 */
@FunctionalInterface
public interface StatusClient {

    CompletableFuture<StatusResponse> fetch(String token);
}
