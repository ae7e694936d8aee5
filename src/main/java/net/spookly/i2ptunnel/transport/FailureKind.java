package net.spookly.i2ptunnel.transport;

/**
 * Phase in which a request attempt failed.
 */
public enum FailureKind {
    /** TCP connect to the proxy or origin failed (refused, unreachable, unresolved). */
    CONNECT(true),
    /** The proxy rejected or did not complete the SOCKS/CONNECT negotiation. */
    PROXY_HANDSHAKE(true),
    TIMEOUT(true),
    /** Connection reset or closed before a complete response arrived. */
    RESET(true),
    TLS(true),
    /** Malformed or unexpected response; another proxy will not fix it. */
    PROTOCOL(false);

    private final boolean connectivity;

    FailureKind(boolean connectivity) {
        this.connectivity = connectivity;
    }

    public boolean isConnectivity() {
        return connectivity;
    }
}
