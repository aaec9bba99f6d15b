package in.opsdash.infrastructure.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ChannelTransport} on top of the JDK {@link WebSocket} client.
 *
 * Each open() builds an independent WebSocket; a listener receives at most one terminal
 * callback (onClose or onError).
 */
public final class JdkWebSocketTransport implements ChannelTransport {
    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketTransport.class);

    private final HttpClient httpClient;
    private final Duration connectTimeout;

    public JdkWebSocketTransport(Duration connectTimeout) {
        this(HttpClient.newBuilder().connectTimeout(connectTimeout).build(), connectTimeout);
    }

    public JdkWebSocketTransport(HttpClient httpClient, Duration connectTimeout) {
        this.httpClient = httpClient;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public void open(URI uri, TransportListener listener) {
        log.info("[WS TRANSPORT] Connecting to {}", uri.getPath());

        AtomicBoolean terminated = new AtomicBoolean(false);

        httpClient.newWebSocketBuilder()
            .connectTimeout(connectTimeout)
            .buildAsync(uri, new WebSocket.Listener() {
                private final StringBuilder buf = new StringBuilder();

                @Override
                public void onOpen(WebSocket webSocket) {
                    log.info("[WS TRANSPORT] Connected to {}", uri.getPath());
                    webSocket.request(1);
                    listener.onOpen(new JdkConnection(uri, webSocket));
                }

                @Override
                public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                    buf.append(data);
                    if (last) {
                        String msg = buf.toString();
                        buf.setLength(0);
                        listener.onText(msg);
                    }
                    webSocket.request(1);
                    return CompletableFuture.completedFuture(null);
                }

                @Override
                public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
                    log.info("[WS TRANSPORT] Closed: {} {}", statusCode, reason);
                    if (terminated.compareAndSet(false, true)) {
                        listener.onClose(statusCode, reason);
                    }
                    return CompletableFuture.completedFuture(null);
                }

                @Override
                public void onError(WebSocket webSocket, Throwable error) {
                    log.warn("[WS TRANSPORT] WebSocket error: {}", error.toString());
                    if (terminated.compareAndSet(false, true)) {
                        listener.onError(error);
                    }
                }
            })
            .whenComplete((ws, error) -> {
                if (error != null && terminated.compareAndSet(false, true)) {
                    log.warn("[WS TRANSPORT] Connect failed: {}", error.toString());
                    listener.onError(error);
                }
            });
    }

    private static final class JdkConnection implements ChannelConnection {
        private final URI uri;
        private final WebSocket webSocket;
        // JDK WebSocket allows one outstanding send at a time
        private CompletableFuture<?> lastSend = CompletableFuture.completedFuture(null);

        private JdkConnection(URI uri, WebSocket webSocket) {
            this.uri = uri;
            this.webSocket = webSocket;
        }

        @Override
        public synchronized void send(String text) {
            if (webSocket.isOutputClosed()) {
                throw new ChannelConnectionException(uri.getPath(), "Output already closed");
            }
            lastSend = lastSend
                .handle((r, e) -> null)
                .thenCompose(ignored -> webSocket.sendText(text, true));
        }

        @Override
        public synchronized CompletableFuture<Void> close() {
            if (webSocket.isOutputClosed()) {
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> closed = lastSend
                .handle((r, e) -> null)
                .thenCompose(ignored -> webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "bye"))
                .thenAccept(ws -> { });
            lastSend = closed;
            return closed;
        }

        @Override
        public void abort() {
            webSocket.abort();
        }
    }
}
