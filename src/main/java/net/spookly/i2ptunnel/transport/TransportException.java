package net.spookly.i2ptunnel.transport;

import java.util.Objects;

/**
 * Failure of one request attempt over one route.
 */
public class TransportException extends Exception {
    private final FailureKind kind;
    private final ProxyRoute route;

    public TransportException(FailureKind kind, ProxyRoute route, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.route = route;
    }

    public TransportException(FailureKind kind, ProxyRoute route, String message) {
        this(kind, route, message, null);
    }

    public FailureKind kind() {
        return kind;
    }

    public ProxyRoute route() {
        return route;
    }

    public boolean isConnectivity() {
        return kind.isConnectivity();
    }
}
