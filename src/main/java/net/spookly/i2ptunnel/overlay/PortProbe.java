package net.spookly.i2ptunnel.overlay;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

import net.spookly.i2ptunnel.util.HostPort;

final class PortProbe {
    private PortProbe() {
    }

    /**
     * True when a TCP connection to the endpoint can be opened within the timeout.
     */
    static boolean isListening(HostPort endpoint, int timeoutMs) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(endpoint.host(), endpoint.port()), Math.max(1, timeoutMs));
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
