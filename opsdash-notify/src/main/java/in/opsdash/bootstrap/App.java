package in.opsdash.bootstrap;

import in.opsdash.config.NotifyConfig;
import in.opsdash.domain.notify.ChannelIdentity;
import in.opsdash.domain.poll.PollResult;
import in.opsdash.infrastructure.channel.JdkWebSocketTransport;
import in.opsdash.infrastructure.channel.common.ExecutorTaskScheduler;
import in.opsdash.infrastructure.metrics.MetricsScrapeHandler;
import in.opsdash.infrastructure.metrics.PrometheusNotifyMetrics;
import in.opsdash.service.notify.NotificationFeed;
import in.opsdash.service.poll.HttpStatusClient;
import in.opsdash.service.poll.StatusPoller;
import in.opsdash.transport.http.FeedHandler;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;

/**
 * Entry point of the admin notification client.
 *
 * Modes:
 * - no arguments: subscribe to the admin channel (NOTIFY_SUBJECT_ID / NOTIFY_ROLE), log
 *   high-priority interrupts, serve /metrics and /feed
 * - {@code poll <sessionId>}: poll the checkout status once and exit with 0 when paid,
 *   1 when expired, 2 when no answer was reached
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws Exception {
        NotifyConfig config = NotifyConfig.fromEnv();

        if (args.length == 2 && "poll".equals(args[0])) {
            System.exit(runPoll(config, args[1]));
            return;
        }

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== opsdash notify starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusNotifyMetrics metrics = new PrometheusNotifyMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Notification channel
        // ═══════════════════════════════════════════════════════════════
        ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler("notify-timer");
        JdkWebSocketTransport transport = new JdkWebSocketTransport(config.connectTimeout());
        NotificationFeed feed = NotificationFeed.create(config, transport, scheduler, metrics);

        feed.addInterruptListener(n ->
            log.warn("[INTERRUPT] {} - {} ({})", n.title(), n.message(), n.type()));
        feed.addStateListener((from, to) ->
            log.info("[FEED] Channel {}", to));

        if (config.subjectId() != null && !config.subjectId().isBlank()) {
            feed.subscribe(new ChannelIdentity(config.subjectId(), config.role()));
        } else {
            log.warn("[FEED] NOTIFY_SUBJECT_ID not set, channel stays idle");
        }

        // ═══════════════════════════════════════════════════════════════
        // HTTP: /metrics and /feed
        // ═══════════════════════════════════════════════════════════════
        FeedHandler feedHandler = new FeedHandler(feed);
        MetricsScrapeHandler metricsHandler = new MetricsScrapeHandler(metrics.getRegistry());
        log.info("✓ Prometheus /metrics endpoint ready");

        int port = config.metricsPort();
        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/feed", feedHandler::getFeed)
            .post("/feed/read-all", feedHandler::markAllRead)
            .post("/feed/{localId}/read", feedHandler::markRead)
            .setFallbackHandler(exchange -> {
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "opsdash notify\n\n" +
                    "GET  /metrics\n" +
                    "GET  /feed\n" +
                    "POST /feed/{id}/read, /feed/read-all\n"
                );
            });

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(routes)
            .build();
        server.start();
        log.info("✓ HTTP server started on http://localhost:{}/", port);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            feed.close();
            server.stop();
            scheduler.close();
            log.info("Shutdown complete");
        }, "notify-shutdown"));
    }

    private static int runPoll(NotifyConfig config, String sessionId) throws InterruptedException {
        try (ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler("poll-timer")) {
            HttpStatusClient client = new HttpStatusClient(config.apiBaseUrl(), config.connectTimeout());
            StatusPoller poller = StatusPoller.forPayments(
                config, client, scheduler, new PrometheusNotifyMetrics());

            PollResult result = poller.poll(sessionId).result().get();
            log.info("[POLL:{}] {} after {} attempt(s)", sessionId, result.outcome(), result.attemptsMade());
            return switch (result.outcome()) {
                case SUCCEEDED -> 0;
                case FAILED -> 1;
                case EXHAUSTED -> 2;
            };
        } catch (ExecutionException e) {
            log.error("[POLL:{}] Polling failed", sessionId, e.getCause());
            return 2;
        }
    }
}
