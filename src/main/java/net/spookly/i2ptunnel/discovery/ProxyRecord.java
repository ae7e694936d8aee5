package net.spookly.i2ptunnel.discovery;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of a discovered outproxy. Identity is (host, port); the kind is not part of it.
 */
@Getter
@Accessors(fluent = true)
public final class ProxyRecord {
    private final String host;
    private final int port;
    private final ProxyKind kind;
    private final String url;

    private ProxyRecord(String host, int port, ProxyKind kind) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("proxy host is required");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("proxy port must be between 1 and 65535: " + port);
        }
        this.host = normalizeHost(host);
        if (this.host.isEmpty()) {
            throw new IllegalArgumentException("proxy host is required");
        }
        this.port = port;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.url = kind.scheme() + "://" + this.host + ":" + port;
    }

    /**
     * Record with an explicit kind, e.g. from a typed directory row.
     */
    public static ProxyRecord of(String host, int port, ProxyKind kind) {
        return new ProxyRecord(host, port, kind);
    }

    /**
     * Record whose kind follows the port convention.
     */
    public static ProxyRecord of(String host, int port) {
        return new ProxyRecord(host, port, ProxyKind.fromPort(port));
    }

    /**
     * Parse a proxy URL such as {@code https://proxy.i2p:443}; the default port follows the scheme.
     */
    public static Optional<ProxyRecord> fromUrl(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        URI uri;
        try {
            uri = URI.create(raw.trim());
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            return Optional.empty();
        }
        String scheme = uri.getScheme();
        int port = uri.getPort() > 0 ? uri.getPort() : defaultPort(scheme);
        if (port < 1 || port > 65535) {
            return Optional.empty();
        }
        return Optional.of(new ProxyRecord(host, port, ProxyKind.infer(scheme, port)));
    }

    /**
     * Deduplication key shared by discovery and selection.
     */
    public String key() {
        return host + ":" + port;
    }

    /**
     * True when both records name the same endpoint, regardless of kind.
     */
    public boolean sameEndpoint(ProxyRecord other) {
        return other != null && host.equals(other.host) && port == other.port;
    }

    /**
     * Lower-case and drop one trailing dot, so {@code Proxy.i2p.} and {@code proxy.i2p} are the same host.
     */
    private static String normalizeHost(String host) {
        String value = host.trim().toLowerCase(Locale.ROOT);
        return value.endsWith(".") ? value.substring(0, value.length() - 1) : value;
    }

    private static int defaultPort(String scheme) {
        if (scheme == null) {
            return 80;
        }
        switch (scheme.toLowerCase(Locale.ROOT)) {
            case "https":
                return 443;
            case "socks":
            case "socks4":
            case "socks5":
            case "socks5h":
                return 1080;
            default:
                return 80;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProxyRecord)) {
            return false;
        }
        return sameEndpoint((ProxyRecord) o);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port);
    }

    @Override
    public String toString() {
        return url;
    }
}
