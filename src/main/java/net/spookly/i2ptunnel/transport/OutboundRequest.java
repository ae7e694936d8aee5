package net.spookly.i2ptunnel.transport;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * HTTP request to be delivered through a proxy route.
 */
@Getter
@Accessors(fluent = true)
public final class OutboundRequest {
    private final String method;
    private final URI uri;
    private final Map<String, String> headers;
    private final byte[] body;
    /**
     * Deliver the body through a {@link BodyConsumer} instead of buffering it.
     */
    private final boolean stream;

    public OutboundRequest(String method, URI uri, Map<String, String> headers, byte[] body, boolean stream) {
        this.method = Objects.requireNonNull(method, "method").trim().toUpperCase(Locale.ROOT);
        this.uri = Objects.requireNonNull(uri, "uri");
        this.headers = headers == null || headers.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body == null ? new byte[0] : body.clone();
        this.stream = stream;
    }

    public static OutboundRequest get(String url) {
        return new OutboundRequest("GET", URI.create(url), null, null, false);
    }

    public static OutboundRequest head(String url) {
        return new OutboundRequest("HEAD", URI.create(url), null, null, false);
    }

    public OutboundRequest streaming() {
        return new OutboundRequest(method, uri, headers, body, true);
    }

    public String host() {
        return uri.getHost();
    }

    /**
     * True for https targets, which need TLS end to end and a tunnelling route.
     */
    public boolean encrypted() {
        return "https".equalsIgnoreCase(uri.getScheme());
    }

    public int port() {
        if (uri.getPort() > 0) {
            return uri.getPort();
        }
        return encrypted() ? 443 : 80;
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }
}
