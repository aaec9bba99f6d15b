package in.opsdash.domain.notify;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static in.opsdash.domain.notify.ConnectionState.*;
import static org.junit.jupiter.api.Assertions.*;

class ConnectionStateTest {

    private static final Map<ConnectionState, Set<ConnectionState>> ALLOWED = Map.of(
        IDLE, EnumSet.of(CONNECTING),
        CONNECTING, EnumSet.of(OPEN, RECONNECT_PENDING, IDLE),
        OPEN, EnumSet.of(RECONNECT_PENDING, CLOSING, IDLE),
        CLOSING, EnumSet.of(IDLE),
        RECONNECT_PENDING, EnumSet.of(CONNECTING, IDLE)
    );

    @Test
    void testTransitionTable() {
        for (ConnectionState from : values()) {
            for (ConnectionState to : values()) {
                assertEquals(ALLOWED.get(from).contains(to), from.canTransitionTo(to),
                    "Transition " + from + " -> " + to);
            }
        }
    }

    @Test
    void testNoSelfTransitions() {
        for (ConnectionState state : values()) {
            assertFalse(state.canTransitionTo(state), state + " must not loop to itself");
        }
    }

    @Test
    void testEveryStateCanReachIdle() {
        for (ConnectionState state : EnumSet.complementOf(EnumSet.of(IDLE))) {
            assertTrue(state.canTransitionTo(IDLE), state + " -> IDLE needed by stop()");
        }
    }
}
