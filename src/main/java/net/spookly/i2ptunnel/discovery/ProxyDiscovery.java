package net.spookly.i2ptunnel.discovery;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import net.spookly.i2ptunnel.overlay.OverlayEndpoints;
import net.spookly.i2ptunnel.overlay.OverlayRouterSupervisor;
import net.spookly.i2ptunnel.routing.RouterInitException;
import net.spookly.i2ptunnel.transport.HttpTransport;
import net.spookly.i2ptunnel.transport.OutboundRequest;
import net.spookly.i2ptunnel.transport.ProxyRoute;
import net.spookly.i2ptunnel.transport.ProxyRoutes;
import net.spookly.i2ptunnel.transport.TransportException;
import net.spookly.i2ptunnel.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches the outproxy directory through the overlay router's local HTTP proxy and parses it.
 */
public final class ProxyDiscovery {
    private static final Logger log = LoggerFactory.getLogger(ProxyDiscovery.class);

    private final HttpTransport transport;
    private final String directoryUrl;
    private final OverlayEndpoints endpoints;
    private final Duration timeout;
    private final OverlayRouterSupervisor supervisor;
    private final DirectoryPageParser parser;

    /**
     * @param supervisor started before each fetch; may be null when the router is managed elsewhere
     */
    public ProxyDiscovery(HttpTransport transport,
                          String directoryUrl,
                          OverlayEndpoints endpoints,
                          Duration timeout,
                          OverlayRouterSupervisor supervisor) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.directoryUrl = Objects.requireNonNull(directoryUrl, "directoryUrl");
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.supervisor = supervisor;
        this.parser = new DirectoryPageParser(endpoints.domains());
    }

    public List<ProxyRecord> discover() throws DiscoveryException {
        if (supervisor != null) {
            try {
                supervisor.ensureRunning();
            } catch (RouterInitException e) {
                throw new DiscoveryException("Overlay router unavailable: " + e.getMessage(), e);
            }
        }
        OutboundRequest request;
        try {
            request = OutboundRequest.get(directoryUrl);
        } catch (IllegalArgumentException e) {
            throw new DiscoveryException("Invalid directory URL: " + directoryUrl, e);
        }
        ProxyRoute route = ProxyRoutes.forOverlay(endpoints.httpProxy(), endpoints.httpsProxy(), request.encrypted());
        log.info("Fetching outproxy directory {} via {}", directoryUrl, route);

        TransportResponse response = fetch(route, request);
        if (!response.isSuccess()) {
            throw new DiscoveryException("Directory returned HTTP " + response.status());
        }
        String html = new String(response.body(), charset(response.headers().get("content-type")));
        log.debug("Directory page is {} bytes", response.body().length);

        List<ProxyRecord> records = parser.parse(html);
        log.info("Discovered {} outproxies", records.size());
        return records;
    }

    private TransportResponse fetch(ProxyRoute route, OutboundRequest request) throws DiscoveryException {
        try {
            return transport.send(route, request, timeout);
        } catch (TransportException e) {
            throw new DiscoveryException("Failed to fetch directory (" + e.kind() + "): " + e.getMessage(), e);
        }
    }

    static Charset charset(String contentType) {
        if (contentType == null) {
            return StandardCharsets.UTF_8;
        }
        for (String part : contentType.split(";")) {
            String value = part.trim();
            if (value.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = value.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                    log.debug("Unknown charset {}, using UTF-8", name);
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }
}
