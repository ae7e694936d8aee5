package net.spookly.i2ptunnel.transport;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.i2ptunnel.util.HostPort;

import java.util.Locale;
import java.util.Objects;

/**
 * How a single request attempt reaches the origin server.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ProxyRoute {
    private static final ProxyRoute DIRECT = new ProxyRoute(Mode.DIRECT, null);

    private final Mode mode;
    private final HostPort proxy;

    public static ProxyRoute direct() {
        return DIRECT;
    }

    /**
     * Plain forward proxy: the request line carries the absolute target URI.
     */
    public static ProxyRoute httpForward(HostPort proxy) {
        return new ProxyRoute(Mode.HTTP_FORWARD, Objects.requireNonNull(proxy, "proxy"));
    }

    /**
     * Tunnel through an HTTP proxy with CONNECT.
     */
    public static ProxyRoute httpConnect(HostPort proxy) {
        return new ProxyRoute(Mode.HTTP_CONNECT, Objects.requireNonNull(proxy, "proxy"));
    }

    public static ProxyRoute socks5(HostPort proxy) {
        return new ProxyRoute(Mode.SOCKS5, Objects.requireNonNull(proxy, "proxy"));
    }

    /**
     * True when the proxy, not this process, resolves the target host name.
     */
    public boolean tunnels() {
        return mode == Mode.HTTP_CONNECT || mode == Mode.SOCKS5;
    }

    @Override
    public String toString() {
        String name = mode.name().toLowerCase(Locale.ROOT);
        return proxy == null ? name : name + "://" + proxy;
    }

    public enum Mode {
        DIRECT,
        HTTP_FORWARD,
        HTTP_CONNECT,
        SOCKS5
    }
}
