package in.opsdash.infrastructure.channel;

/**
 * Exception thrown when the notification channel cannot be opened or used.
 */
public class ChannelConnectionException extends RuntimeException {

    private final String channel;

    public ChannelConnectionException(String channel, String message) {
        super(String.format("[%s] %s", channel, message));
        this.channel = channel;
    }

    public ChannelConnectionException(String channel, String message, Throwable cause) {
        super(String.format("[%s] %s", channel, message), cause);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
