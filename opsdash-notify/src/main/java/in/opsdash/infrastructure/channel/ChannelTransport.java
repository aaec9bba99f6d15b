package in.opsdash.infrastructure.channel;

import java.net.URI;

/**
 * Opens push connections. Establishment is asynchronous: the outcome is signalled through
 * {@link TransportListener#onOpen} or {@link TransportListener#onError}, never by the return.
 */
public interface ChannelTransport {

    void open(URI uri, TransportListener listener);
}
