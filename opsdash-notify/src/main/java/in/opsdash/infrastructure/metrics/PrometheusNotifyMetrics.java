package in.opsdash.infrastructure.metrics;

import in.opsdash.domain.notify.ConnectionState;
import in.opsdash.domain.poll.PollOutcome;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;
import java.util.Locale;

/**
 * Prometheus implementation of NotifyMetrics.
 *
 * Key Metrics:
 * - notify_state_transitions_total{from, to}
 * - notify_connection_state{state} - 1 for the current state, 0 otherwise
 * - notify_reconnects_total / notify_reconnect_delay_seconds
 * - notify_connection_losses_total{reason}
 * - notify_frames_total{kind}
 * - notify_frames_dropped_total
 * - notify_interrupts_total{type}
 * - notify_buffer_size
 * - notify_poll_outcomes_total{outcome} / notify_poll_attempts
 *
 * Usage:
 * <pre>
 * PrometheusNotifyMetrics metrics = new PrometheusNotifyMetrics();
 * Undertow server = Undertow.builder()
 *     .addHttpListener(9091, "0.0.0.0")
 *     .setHandler(Handlers.path().addPrefixPath("/metrics",
 *         new MetricsScrapeHandler(metrics.getRegistry())))
 *     .build();
 * </pre>
 */
public class PrometheusNotifyMetrics implements NotifyMetrics {

    private final CollectorRegistry registry;

    private final Counter transitionCounter;
    private final Gauge connectionState;
    private final Counter reconnectCounter;
    private final Histogram reconnectDelay;
    private final Counter connectionLossCounter;
    private final Counter frameCounter;
    private final Counter droppedFrameCounter;
    private final Counter interruptCounter;
    private final Gauge bufferSize;
    private final Counter pollOutcomeCounter;
    private final Histogram pollAttempts;

    public PrometheusNotifyMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusNotifyMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.transitionCounter = Counter.build()
            .name("notify_state_transitions_total")
            .help("Notification channel state transitions")
            .labelNames("from", "to")
            .register(registry);

        this.connectionState = Gauge.build()
            .name("notify_connection_state")
            .help("Current notification channel state (1 = current)")
            .labelNames("state")
            .register(registry);

        this.reconnectCounter = Counter.build()
            .name("notify_reconnects_total")
            .help("Total number of scheduled reconnection attempts")
            .register(registry);

        this.reconnectDelay = Histogram.build()
            .name("notify_reconnect_delay_seconds")
            .help("Delay before scheduled reconnection attempts")
            .buckets(0.5, 1, 2, 4, 8, 16, 32, 64)
            .register(registry);

        this.connectionLossCounter = Counter.build()
            .name("notify_connection_losses_total")
            .help("Connections lost or failed, by reason")
            .labelNames("reason")
            .register(registry);

        this.frameCounter = Counter.build()
            .name("notify_frames_total")
            .help("Inbound frames by kind")
            .labelNames("kind")
            .register(registry);

        this.droppedFrameCounter = Counter.build()
            .name("notify_frames_dropped_total")
            .help("Inbound frames dropped because they could not be parsed")
            .register(registry);

        this.interruptCounter = Counter.build()
            .name("notify_interrupts_total")
            .help("Interrupts raised for high-priority notifications")
            .labelNames("type")
            .register(registry);

        this.bufferSize = Gauge.build()
            .name("notify_buffer_size")
            .help("Notifications currently held in the local feed")
            .register(registry);

        this.pollOutcomeCounter = Counter.build()
            .name("notify_poll_outcomes_total")
            .help("Status poll outcomes")
            .labelNames("outcome")
            .register(registry);

        this.pollAttempts = Histogram.build()
            .name("notify_poll_attempts")
            .help("Requests issued per status poll")
            .buckets(1, 2, 3, 5, 8, 13)
            .register(registry);

        for (ConnectionState state : ConnectionState.values()) {
            connectionState.labels(label(state)).set(state == ConnectionState.IDLE ? 1 : 0);
        }
    }

    @Override
    public void recordTransition(ConnectionState from, ConnectionState to) {
        transitionCounter.labels(label(from), label(to)).inc();
        connectionState.labels(label(from)).set(0);
        connectionState.labels(label(to)).set(1);
    }

    @Override
    public void recordReconnectScheduled(int attempt, Duration delay) {
        reconnectCounter.inc();
        reconnectDelay.observe(delay.toMillis() / 1000.0);
    }

    @Override
    public void recordConnectionLoss(String reason) {
        connectionLossCounter.labels(reason).inc();
    }

    @Override
    public void recordFrame(String kind) {
        frameCounter.labels(kind).inc();
    }

    @Override
    public void recordDroppedFrame() {
        droppedFrameCounter.inc();
    }

    @Override
    public void recordInterrupt(String type) {
        interruptCounter.labels(type).inc();
    }

    @Override
    public void recordBufferSize(int size) {
        bufferSize.set(size);
    }

    @Override
    public void recordPollOutcome(PollOutcome outcome, int attempts) {
        pollOutcomeCounter.labels(outcome.name().toLowerCase(Locale.ROOT)).inc();
        pollAttempts.observe(attempts);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    private static String label(ConnectionState state) {
        return state.name().toLowerCase(Locale.ROOT);
    }
}
