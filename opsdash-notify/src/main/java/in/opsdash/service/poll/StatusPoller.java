package in.opsdash.service.poll;

import in.opsdash.config.NotifyConfig;
import in.opsdash.domain.poll.PollAttempt;
import in.opsdash.domain.poll.PollOutcome;
import in.opsdash.domain.poll.PollResult;
import in.opsdash.domain.poll.PollVerdict;
import in.opsdash.infrastructure.channel.common.ScheduledTask;
import in.opsdash.infrastructure.channel.common.TaskScheduler;
import in.opsdash.infrastructure.metrics.NotifyMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Bounded, fixed-interval status poller for one-shot confirmations.
 *
 * Features:
 * - First request issued immediately, each following one {@code interval} after the
 *   previous response, so malformed or failing responses never speed it up
 * - Terminal success or failure stops polling at once
 * - Running out of attempts is reported as EXHAUSTED, never as FAILED
 *
 * Usage:
 * <pre>
 * StatusPoller poller = StatusPoller.forPayments(config, statusClient, scheduler, metrics);
 * poller.poll(sessionId).result().thenAccept(result -> {
 *     switch (result.outcome()) {
 *         case SUCCEEDED -> showUpgraded();
 *         case FAILED -> showExpired();
 *         case EXHAUSTED -> showCheckLater();
 *     }
 * });
 * </pre>
 */
public final class StatusPoller {
    private static final Logger log = LoggerFactory.getLogger(StatusPoller.class);

    private final StatusClient client;
    private final PollClassifier classifier;
    private final TaskScheduler scheduler;
    private final NotifyMetrics metrics;
    private final int maxAttempts;
    private final Duration interval;

    public StatusPoller(StatusClient client, PollClassifier classifier, TaskScheduler scheduler,
                        NotifyMetrics metrics, int maxAttempts, Duration interval) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("Max attempts must be positive");
        }
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Interval must be positive");
        }
        this.client = client;
        this.classifier = classifier;
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.maxAttempts = maxAttempts;
        this.interval = interval;
    }

    /**
     * Poller for checkout payment confirmation using the configured attempts and interval.
     */
    public static StatusPoller forPayments(NotifyConfig config, StatusClient client,
                                           TaskScheduler scheduler, NotifyMetrics metrics) {
        return new StatusPoller(client, new PaymentStatusClassifier(), scheduler, metrics,
            config.pollMaxAttempts(), config.pollInterval());
    }

    /**
     * Start polling {@code token}. The first request is issued before this returns.
     */
    public PollHandle poll(String token) {
        Run run = new Run(PollAttempt.first(token, maxAttempts, interval));
        log.info("[POLL:{}] Polling status (max {} attempts, every {}ms)", token, maxAttempts, interval.toMillis());
        run.issue();
        return run;
    }

    private final class Run implements PollHandle {
        private final CompletableFuture<PollResult> result = new CompletableFuture<>();
        private PollAttempt attempt;
        private ScheduledTask nextTask;
        private String lastBody;

        private Run(PollAttempt attempt) {
            this.attempt = attempt;
        }

        private synchronized void issue() {
            nextTask = null;
            if (result.isDone()) {
                return;
            }

            attempt = attempt.next();
            int number = attempt.attemptsMade();
            log.debug("[POLL:{}] Attempt {}/{}", attempt.token(), number, attempt.maxAttempts());

            CompletableFuture<StatusResponse> response;
            try {
                response = client.fetch(attempt.token());
            } catch (RuntimeException e) {
                response = CompletableFuture.failedFuture(e);
            }
            response.whenComplete((r, error) -> onResponse(number, r, error));
        }

        private synchronized void onResponse(int number, StatusResponse response, Throwable error) {
            if (result.isDone()) {
                return;
            }

            PollVerdict verdict;
            if (error != null) {
                log.warn("[POLL:{}] Attempt {} failed: {}", attempt.token(), number, error.toString());
                verdict = PollVerdict.INCONCLUSIVE;
            } else {
                lastBody = response == null ? null : response.body();
                verdict = classify(response);
            }

            switch (verdict) {
                case SUCCESS -> finish(PollOutcome.SUCCEEDED);
                case FAILURE -> finish(PollOutcome.FAILED);
                case INCONCLUSIVE -> {
                    if (attempt.exhausted()) {
                        finish(PollOutcome.EXHAUSTED);
                    } else {
                        log.debug("[POLL:{}] Inconclusive, retrying in {}ms", attempt.token(), interval.toMillis());
                        nextTask = scheduler.schedule(this::issue, interval);
                    }
                }
            }
        }

        private PollVerdict classify(StatusResponse response) {
            try {
                PollVerdict verdict = classifier.classify(response);
                return verdict == null ? PollVerdict.INCONCLUSIVE : verdict;
            } catch (RuntimeException e) {
                log.warn("[POLL:{}] Classifier failed, treating response as inconclusive", attempt.token(), e);
                return PollVerdict.INCONCLUSIVE;
            }
        }

        private void finish(PollOutcome outcome) {
            PollResult pollResult = new PollResult(attempt.token(), outcome, attempt.attemptsMade(), lastBody);
            if (outcome == PollOutcome.SUCCEEDED) {
                log.info("[POLL:{}] Succeeded after {} attempt(s)", attempt.token(), attempt.attemptsMade());
            } else {
                log.warn("[POLL:{}] {} after {} attempt(s)", attempt.token(), outcome, attempt.attemptsMade());
            }
            metrics.recordPollOutcome(outcome, attempt.attemptsMade());
            result.complete(pollResult);
        }

        @Override
        public CompletableFuture<PollResult> result() {
            return result;
        }

        @Override
        public synchronized void cancel() {
            if (nextTask != null) {
                nextTask.cancel();
                nextTask = null;
            }
            if (result.cancel(false)) {
                log.info("[POLL:{}] Cancelled after {} attempt(s)", attempt.token(), attempt.attemptsMade());
            }
        }
    }
}
