package in.opsdash.service.poll;

import in.opsdash.domain.poll.PollOutcome;
import in.opsdash.domain.poll.PollResult;
import in.opsdash.infrastructure.channel.common.ManualTaskScheduler;
import in.opsdash.infrastructure.metrics.NotifyMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StatusPollerTest {

    private static final Duration INTERVAL = Duration.ofSeconds(2);

    @Mock
    private StatusClient client;

    @Mock
    private NotifyMetrics metrics;

    private ManualTaskScheduler scheduler;
    private List<Instant> requestTimes;

    @BeforeEach
    void setUp() {
        scheduler = new ManualTaskScheduler();
        requestTimes = new ArrayList<>();
    }

    private StatusPoller poller(int maxAttempts) {
        return new StatusPoller(client, new PaymentStatusClassifier(), scheduler, metrics, maxAttempts, INTERVAL);
    }

    private static CompletableFuture<StatusResponse> ok(String body) {
        return CompletableFuture.completedFuture(new StatusResponse(200, body));
    }

    @Test
    void testExhaustsAfterMaxAttemptsOfInconclusiveResponses() {
        when(client.fetch("sess_1")).thenAnswer(inv -> {
            requestTimes.add(scheduler.now());
            return ok("{}");
        });
        Instant start = scheduler.now();

        PollHandle handle = poller(3).poll("sess_1");
        scheduler.advance(Duration.ofMinutes(1));

        PollResult result = handle.result().join();
        assertEquals(PollOutcome.EXHAUSTED, result.outcome(), "Exhaustion is not failure");
        assertEquals(3, result.attemptsMade());
        assertEquals("{}", result.lastBody());
        verify(client, times(3)).fetch("sess_1");
        assertEquals(List.of(start, start.plus(INTERVAL), start.plus(INTERVAL.multipliedBy(2))), requestTimes,
            "Requests spaced by exactly the interval");
        verify(metrics).recordPollOutcome(PollOutcome.EXHAUSTED, 3);
    }

    @Test
    void testFirstRequestIsImmediate() {
        when(client.fetch("sess_1")).thenReturn(ok("{}"));

        poller(5).poll("sess_1");

        verify(client, times(1)).fetch("sess_1");
    }

    @Test
    void testPaidSucceedsAndStopsPolling() {
        when(client.fetch("sess_1"))
            .thenReturn(ok("{\"status\":\"open\"}"))
            .thenReturn(ok("{\"payment_status\":\"paid\",\"status\":\"complete\"}"));

        PollHandle handle = poller(5).poll("sess_1");
        scheduler.advance(Duration.ofMinutes(1));

        PollResult result = handle.result().join();
        assertEquals(PollOutcome.SUCCEEDED, result.outcome());
        assertTrue(result.succeeded());
        assertEquals(2, result.attemptsMade());
        verify(client, times(2)).fetch("sess_1");
        assertEquals(0, scheduler.pendingCount(), "Nothing left scheduled after success");
    }

    @Test
    void testExpiredFailsImmediately() {
        when(client.fetch("sess_1")).thenReturn(ok("{\"status\":\"expired\"}"));

        PollHandle handle = poller(5).poll("sess_1");

        PollResult result = handle.result().join();
        assertEquals(PollOutcome.FAILED, result.outcome());
        assertEquals(1, result.attemptsMade());
        verify(metrics).recordPollOutcome(PollOutcome.FAILED, 1);
    }

    @Test
    void testMalformedAndErrorResponsesAreRetried() {
        when(client.fetch("sess_1"))
            .thenReturn(ok("<html>gateway</html>"))
            .thenReturn(CompletableFuture.completedFuture(new StatusResponse(502, "{\"payment_status\":\"paid\"}")))
            .thenReturn(CompletableFuture.failedFuture(new IOException("connection reset")))
            .thenReturn(ok("{\"payment_status\":\"paid\"}"));

        PollHandle handle = poller(5).poll("sess_1");
        scheduler.advance(Duration.ofMinutes(1));

        PollResult result = handle.result().join();
        assertEquals(PollOutcome.SUCCEEDED, result.outcome());
        assertEquals(4, result.attemptsMade());
    }

    @Test
    void testClientThrowingCountsAsInconclusive() {
        when(client.fetch("sess_1")).thenThrow(new IllegalStateException("client closed"));

        PollHandle handle = poller(2).poll("sess_1");
        scheduler.advance(Duration.ofMinutes(1));

        assertEquals(PollOutcome.EXHAUSTED, handle.result().join().outcome());
        verify(client, times(2)).fetch("sess_1");
    }

    @Test
    void testSlowResponseDelaysNextAttempt() {
        CompletableFuture<StatusResponse> slow = new CompletableFuture<>();
        when(client.fetch("sess_1")).thenReturn(slow).thenReturn(ok("{\"payment_status\":\"paid\"}"));

        PollHandle handle = poller(5).poll("sess_1");
        scheduler.advance(Duration.ofSeconds(10));
        verify(client, times(1)).fetch("sess_1");

        slow.complete(new StatusResponse(200, "{}"));
        scheduler.advance(INTERVAL);

        assertEquals(PollOutcome.SUCCEEDED, handle.result().join().outcome());
        verify(client, times(2)).fetch("sess_1");
    }

    @Test
    void testCancelStopsFurtherAttempts() {
        when(client.fetch("sess_1")).thenReturn(ok("{}"));

        PollHandle handle = poller(5).poll("sess_1");
        handle.cancel();
        scheduler.advance(Duration.ofMinutes(1));

        assertTrue(handle.result().isCancelled());
        verify(client, times(1)).fetch("sess_1");
        verifyNoInteractions(metrics);
    }

    @Test
    void testInvalidConfigurationRejected() {
        assertThrows(IllegalArgumentException.class, () -> poller(0));
        assertThrows(IllegalArgumentException.class, () ->
            new StatusPoller(client, new PaymentStatusClassifier(), scheduler, metrics, 3, Duration.ZERO));
    }
}
