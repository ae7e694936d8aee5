package net.spookly.i2ptunnel.util;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.net.InetSocketAddress;

/**
 * Parsed host/port tuple for a local proxy endpoint such as {@code 127.0.0.1:4444}.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class HostPort {
    private final String host;
    private final int port;

    /**
     * Parse a {@code host:port} endpoint string.
     */
    public static HostPort parse(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("endpoint is required");
        }
        String value = raw.trim();
        int lastColon = value.lastIndexOf(':');
        if (lastColon <= 0 || lastColon == value.length() - 1) {
            throw new IllegalArgumentException("endpoint must be host:port: " + raw);
        }
        String host = value.substring(0, lastColon).trim();
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        if (host.isEmpty()) {
            throw new IllegalArgumentException("endpoint host is required");
        }
        return of(host, parsePort(value.substring(lastColon + 1).trim()));
    }

    /**
     * Build an endpoint from already separated parts.
     */
    public static HostPort of(String host, int port) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("endpoint host is required");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("endpoint port must be between 1 and 65535: " + port);
        }
        return new HostPort(host, port);
    }

    /**
     * Socket address without resolving the host; resolution happens at connect time.
     */
    public InetSocketAddress toSocketAddress() {
        return InetSocketAddress.createUnresolved(host, port);
    }

    private static int parsePort(String portRaw) {
        try {
            return Integer.parseInt(portRaw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("endpoint port must be numeric: " + portRaw, e);
        }
    }

    @Override
    public String toString() {
        return host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
    }
}
