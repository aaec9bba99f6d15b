package in.opsdash.domain.notify;

/**
 * Tag of an {@link InboundFrame}.
 */
public enum FrameKind {
    CONTROL,
    DOMAIN_EVENT
}
