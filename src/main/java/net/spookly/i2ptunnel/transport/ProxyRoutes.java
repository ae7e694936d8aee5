package net.spookly.i2ptunnel.transport;

import net.spookly.i2ptunnel.discovery.ProxyRecord;
import net.spookly.i2ptunnel.util.HostPort;

import java.util.List;
import java.util.Objects;

/**
 * Ordered transport routes to try for a proxy record. Later entries are fallbacks used only
 * when the proxy refuses the earlier protocol during setup.
 */
public final class ProxyRoutes {
    private ProxyRoutes() {
    }

    public static List<ProxyRoute> forRecord(ProxyRecord record, boolean encryptedTarget) {
        Objects.requireNonNull(record, "record");
        HostPort endpoint = HostPort.of(record.host(), record.port());
        switch (record.kind()) {
            case SOCKS_LIKE:
                return List.of(ProxyRoute.socks5(endpoint), ProxyRoute.httpConnect(endpoint));
            case ENCRYPTED:
                return List.of(ProxyRoute.httpConnect(endpoint));
            case PLAIN:
            default:
                return List.of(encryptedTarget ? ProxyRoute.httpConnect(endpoint) : ProxyRoute.httpForward(endpoint));
        }
    }

    /**
     * Local overlay ingress: the plain forward proxy for http targets, the CONNECT proxy for https.
     */
    public static ProxyRoute forOverlay(HostPort httpProxy, HostPort httpsProxy, boolean encryptedTarget) {
        return encryptedTarget ? ProxyRoute.httpConnect(httpsProxy) : ProxyRoute.httpForward(httpProxy);
    }
}
