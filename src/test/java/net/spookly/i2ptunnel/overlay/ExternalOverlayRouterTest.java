package net.spookly.i2ptunnel.overlay;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;

import net.spookly.i2ptunnel.util.HostPort;
import net.spookly.i2ptunnel.util.OverlayDomains;
import org.junit.jupiter.api.Test;

class ExternalOverlayRouterTest {
    @Test
    void runningWhenProxyPortAcceptsConnections() throws IOException {
        try (ServerSocket proxy = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            ExternalOverlayRouter router = new ExternalOverlayRouter(endpoints(proxy.getLocalPort()), 1_000);

            assertEquals(0, router.init("ignored"));
            assertEquals(0, router.start());
            assertTrue(router.isRunning());
            assertEquals(0, router.stop());
        }
    }

    @Test
    void startFailsWhenProxyNeverComesUp() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }
        ExternalOverlayRouter router = new ExternalOverlayRouter(endpoints(port), 1);

        assertFalse(router.isRunning());
        assertEquals(1, router.start());
    }

    private static OverlayEndpoints endpoints(int httpPort) {
        return new OverlayEndpoints(
                HostPort.of("127.0.0.1", httpPort),
                HostPort.parse("127.0.0.1:4447"),
                OverlayDomains.DEFAULT
        );
    }
}
