package in.opsdash.infrastructure.channel;

import java.util.concurrent.CompletableFuture;

/**
 * Open transport connection handed out by {@link TransportListener#onOpen}.
 */
public interface ChannelConnection {

    /**
     * Send one text frame. Fire-and-forget: failures surface through the listener.
     *
     * @throws ChannelConnectionException if the connection can no longer send
     */
    void send(String text);

    /**
     * Request a graceful close. The future completes when the close frame has been sent;
     * the server's confirmation arrives through {@link TransportListener#onClose}.
     */
    CompletableFuture<Void> close();

    /**
     * Drop the connection immediately without a close handshake.
     */
    void abort();
}
