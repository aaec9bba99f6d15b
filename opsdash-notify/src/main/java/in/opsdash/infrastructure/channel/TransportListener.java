package in.opsdash.infrastructure.channel;

/**
 * Callbacks from a {@link ChannelTransport}. May be invoked on transport threads.
 */
public interface TransportListener {

    void onOpen(ChannelConnection connection);

    /**
     * One complete text frame (partial frames are reassembled by the transport).
     */
    void onText(String text);

    void onClose(int statusCode, String reason);

    /**
     * Connect failure or abrupt termination. No further callbacks follow.
     */
    void onError(Throwable error);
}
