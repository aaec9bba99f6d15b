package in.opsdash.service.notify;

import in.opsdash.domain.notify.Notification;

/**
 * Receives high-priority notifications that should interrupt the user (toast, banner).
 * The notification is also in the feed; this is an additional signal, not a replacement.
 */
@FunctionalInterface
public interface InterruptListener {

    void onInterrupt(Notification notification);
}
