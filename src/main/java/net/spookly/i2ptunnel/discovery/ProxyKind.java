package net.spookly.i2ptunnel.discovery;

import java.util.Locale;
import java.util.Optional;

/**
 * Outproxy protocol kinds distinguished by directory type label, scheme and port convention.
 */
public enum ProxyKind {
    PLAIN("http"),
    ENCRYPTED("https"),
    SOCKS_LIKE("socks5");

    private final String scheme;

    ProxyKind(String scheme) {
        this.scheme = scheme;
    }

    /**
     * URL scheme used when rendering a record of this kind.
     */
    public String scheme() {
        return scheme;
    }

    /**
     * Map a directory "type" column value to a kind; unknown labels yield empty.
     */
    public static Optional<ProxyKind> fromType(String type) {
        if (type == null) {
            return Optional.empty();
        }
        switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "https":
            case "ssl":
            case "tls":
                return Optional.of(ENCRYPTED);
            case "socks":
            case "socks4":
            case "socks4a":
            case "socks5":
            case "socks5h":
                return Optional.of(SOCKS_LIKE);
            case "http":
                return Optional.of(PLAIN);
            default:
                return Optional.empty();
        }
    }

    /**
     * Derive a kind from an optional scheme and the port.
     */
    public static ProxyKind infer(String scheme, int port) {
        if (scheme != null && !scheme.isBlank()) {
            Optional<ProxyKind> explicit = fromType(scheme);
            if (explicit.isPresent() && explicit.get() != PLAIN) {
                return explicit.get();
            }
        }
        return fromPort(port);
    }

    /**
     * Port convention: 1080 is SOCKS, 443/4447/8443 are encrypted, everything else plain.
     */
    public static ProxyKind fromPort(int port) {
        switch (port) {
            case 1080:
                return SOCKS_LIKE;
            case 443:
            case 4447:
            case 8443:
                return ENCRYPTED;
            default:
                return PLAIN;
        }
    }
}
