package net.spookly.i2ptunnel.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class HostPortTest {
    @Test
    void parsesHostAndPort() {
        HostPort endpoint = HostPort.parse(" 127.0.0.1:4444 ");

        assertEquals("127.0.0.1", endpoint.host());
        assertEquals(4444, endpoint.port());
        assertEquals("127.0.0.1:4444", endpoint.toString());
    }

    @Test
    void stripsIpv6Brackets() {
        HostPort endpoint = HostPort.parse("[::1]:4447");

        assertEquals("::1", endpoint.host());
        assertEquals(4447, endpoint.port());
        assertEquals("[::1]:4447", endpoint.toString());
    }

    @Test
    void rejectsMalformedEndpoints() {
        assertThrows(IllegalArgumentException.class, () -> HostPort.parse("localhost"));
        assertThrows(IllegalArgumentException.class, () -> HostPort.parse(":4444"));
        assertThrows(IllegalArgumentException.class, () -> HostPort.parse("localhost:"));
        assertThrows(IllegalArgumentException.class, () -> HostPort.parse("localhost:http"));
        assertThrows(IllegalArgumentException.class, () -> HostPort.parse("localhost:70000"));
    }

    @Test
    void socketAddressIsUnresolved() {
        assertTrue(HostPort.of("proxy.example", 8080).toSocketAddress().isUnresolved());
    }
}
