package in.opsdash.service.notify;

import in.opsdash.domain.notify.ConnectionState;

/**
 * Observes channel lifecycle transitions. Called on the thread that drove the transition;
 * implementations must not block.
 */
@FunctionalInterface
public interface StateListener {

    void onStateChange(ConnectionState from, ConnectionState to);
}
