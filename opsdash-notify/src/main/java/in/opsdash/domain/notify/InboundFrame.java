package in.opsdash.domain.notify;

import java.util.Objects;

/**
 * Parsed inbound frame: either a control frame or a domain event.
 *
 * Built once at the channel boundary; downstream code switches on {@link #kind()}.
 */
public record InboundFrame(FrameKind kind, ControlKind control, DomainEvent event) {

    public InboundFrame {
        Objects.requireNonNull(kind, "kind");
        if (kind == FrameKind.CONTROL && (control == null || event != null)) {
            throw new IllegalArgumentException("Control frame must carry only a control kind");
        }
        if (kind == FrameKind.DOMAIN_EVENT && (event == null || control != null)) {
            throw new IllegalArgumentException("Domain event frame must carry only an event");
        }
    }

    public static InboundFrame control(ControlKind control) {
        return new InboundFrame(FrameKind.CONTROL, control, null);
    }

    public static InboundFrame event(DomainEvent event) {
        return new InboundFrame(FrameKind.DOMAIN_EVENT, null, event);
    }

    public boolean isControl() {
        return kind == FrameKind.CONTROL;
    }
}
