package in.opsdash.service.poll;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * {@link StatusClient} issuing {@code GET {baseUrl}/status/{token}} with the JDK HttpClient.
 */
public final class HttpStatusClient implements StatusClient {
    private static final Logger log = LoggerFactory.getLogger(HttpStatusClient.class);

    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration requestTimeout;

    public HttpStatusClient(String baseUrl, Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(requestTimeout).build(), baseUrl, requestTimeout);
    }

    public HttpStatusClient(HttpClient httpClient, String baseUrl, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public CompletableFuture<StatusResponse> fetch(String token) {
        URI uri = statusUri(token);
        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(requestTimeout)
            .header("Accept", "application/json")
            .GET()
            .build();

        log.debug("[POLL] GET {}", uri.getPath());
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .thenApply(response -> new StatusResponse(response.statusCode(), response.body()));
    }

    URI statusUri(String token) {
        String encoded = URLEncoder.encode(token, StandardCharsets.UTF_8).replace("+", "%20");
        return URI.create(baseUrl + "/status/" + encoded);
    }
}
