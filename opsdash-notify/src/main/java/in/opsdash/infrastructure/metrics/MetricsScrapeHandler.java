package in.opsdash.infrastructure.metrics;

import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.Enumeration;
import java.util.Set;
import java.util.TreeSet;

/**
 * Serves the notify registry to Prometheus scrapers.
 *
 * - {@code name[]} query parameters restrict the output to those sample names
 *   ({@code /metrics?name[]=notify_buffer_size&name[]=notify_reconnects_total})
 * - The Accept header picks the exposition format: text 0.0.4 by default, OpenMetrics
 *   when the scraper asks for {@code application/openmetrics-text}
 */
public class MetricsScrapeHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(MetricsScrapeHandler.class);

    static final String NAME_PARAM = "name[]";

    private final CollectorRegistry registry;

    public MetricsScrapeHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String contentType = TextFormat.chooseContentType(exchange.getRequestHeaders().getFirst(Headers.ACCEPT));
        Set<String> names = requestedNames(exchange);

        Enumeration<Collector.MetricFamilySamples> samples = names.isEmpty()
            ? registry.metricFamilySamples()
            : registry.filteredMetricFamilySamples(names);

        StringWriter writer = new StringWriter();
        try {
            TextFormat.writeFormat(contentType, writer, samples);
        } catch (IOException e) {
            log.error("[METRICS] Scrape failed: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
            return;
        }

        String body = writer.toString();
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        exchange.getResponseSender().send(body);

        if (names.isEmpty()) {
            log.debug("[METRICS] Scraped {} bytes as {}", body.length(), contentType);
        } else {
            log.debug("[METRICS] Scraped {} bytes as {} for {}", body.length(), contentType, names);
        }
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Set<String> names = new TreeSet<>();
        Deque<String> values = exchange.getQueryParameters().get(NAME_PARAM);
        if (values != null) {
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    names.add(value.trim());
                }
            }
        }
        return names;
    }
}
