package in.opsdash.domain.notify;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class ChannelIdentityTest {

    @Test
    void testChannelPath() {
        assertEquals("/notify/A1?role=admin", new ChannelIdentity("A1", "admin").channelPath());
    }

    @Test
    void testChannelPathEncodesComponents() {
        ChannelIdentity identity = new ChannelIdentity("a b/c", "super admin&x");
        assertEquals("/notify/a%20b%2Fc?role=super%20admin%26x", identity.channelPath());
    }

    @Test
    void testChannelUriToleratesTrailingSlash() {
        ChannelIdentity identity = new ChannelIdentity("A1", "admin");
        URI expected = URI.create("ws://host:8001/notify/A1?role=admin");

        assertEquals(expected, identity.channelUri("ws://host:8001"));
        assertEquals(expected, identity.channelUri("ws://host:8001/"));
    }

    @Test
    void testBlankValuesRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ChannelIdentity("", "admin"));
        assertThrows(IllegalArgumentException.class, () -> new ChannelIdentity("A1", " "));
        assertThrows(IllegalArgumentException.class, () -> new ChannelIdentity(null, "admin"));
    }

    @Test
    void testEqualityDrivesChannelChange() {
        assertEquals(new ChannelIdentity("A1", "admin"), new ChannelIdentity("A1", "admin"));
        assertNotEquals(new ChannelIdentity("A1", "admin"), new ChannelIdentity("A1", "support"));
    }
}
