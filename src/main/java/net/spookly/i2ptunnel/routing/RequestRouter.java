package net.spookly.i2ptunnel.routing;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import net.spookly.i2ptunnel.config.ConfigDefaults;
import net.spookly.i2ptunnel.config.TunnelConfig;
import net.spookly.i2ptunnel.discovery.ProxyRecord;
import net.spookly.i2ptunnel.overlay.OverlayEndpoints;
import net.spookly.i2ptunnel.overlay.OverlayRouterSupervisor;
import net.spookly.i2ptunnel.selection.ProxySelector;
import net.spookly.i2ptunnel.selection.RankedCandidate;
import net.spookly.i2ptunnel.transport.BodyConsumer;
import net.spookly.i2ptunnel.transport.FailureKind;
import net.spookly.i2ptunnel.transport.HttpTransport;
import net.spookly.i2ptunnel.transport.OutboundRequest;
import net.spookly.i2ptunnel.transport.ProxyRoute;
import net.spookly.i2ptunnel.transport.ProxyRoutes;
import net.spookly.i2ptunnel.transport.TransportException;
import net.spookly.i2ptunnel.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers requests either through the overlay router's local proxy (overlay hosts) or through
 * ranked outproxies, falling back to the next candidate on connectivity failures.
 */
public final class RequestRouter {
    private static final Logger log = LoggerFactory.getLogger(RequestRouter.class);

    static final Set<String> ALLOWED_METHODS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH", "HEAD", "OPTIONS");

    private final ProxySelector selector;
    private final HttpTransport transport;
    private final OverlayEndpoints endpoints;
    private final OverlayRouterSupervisor supervisor;
    private final int candidateCount;
    private final Duration timeout;

    /**
     * @param supervisor started before overlay requests; may be null when the router is managed elsewhere
     */
    public RequestRouter(TunnelConfig.RoutingConfig config,
                         ProxySelector selector,
                         HttpTransport transport,
                         OverlayEndpoints endpoints,
                         OverlayRouterSupervisor supervisor) {
        this.selector = Objects.requireNonNull(selector, "selector");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
        this.supervisor = supervisor;
        this.candidateCount = config == null || config.candidateCount == null
                ? ConfigDefaults.ROUTING_CANDIDATE_COUNT
                : config.candidateCount;
        this.timeout = Duration.ofMillis(config == null || config.timeoutMs == null
                ? ConfigDefaults.ROUTING_TIMEOUT_MS
                : config.timeoutMs);
    }

    public RoutedResponse route(OutboundRequest request, List<ProxyRecord> discovered) throws RouteException {
        return route(request, discovered, BodyConsumer.NOOP);
    }

    /**
     * Route a request. For streamed requests the response carries status and headers only and
     * the body is pushed to {@code bodyConsumer}.
     */
    public RoutedResponse route(OutboundRequest request,
                                List<ProxyRecord> discovered,
                                BodyConsumer bodyConsumer) throws RouteException {
        validate(request);
        BodyConsumer consumer = bodyConsumer == null ? BodyConsumer.NOOP : bodyConsumer;
        if (endpoints.domains().isOverlayHost(request.host())) {
            return routeOverlay(request, consumer);
        }
        return routeOutproxy(request, discovered, consumer);
    }

    private RoutedResponse routeOverlay(OutboundRequest request, BodyConsumer consumer) throws RouteException {
        if (supervisor != null) {
            supervisor.ensureRunning();
        }
        ProxyRoute route = ProxyRoutes.forOverlay(endpoints.httpProxy(), endpoints.httpsProxy(), request.encrypted());
        log.debug("{} via overlay {}", request, route);
        try {
            TransportResponse response = transport.send(route, request, timeout, consumer);
            return RoutedResponse.from(response, route.proxy().toString());
        } catch (TransportException e) {
            if (!e.isConnectivity()) {
                throw new ProtocolException("Overlay request failed: " + e.getMessage(), e);
            }
            log.warn("Overlay request {} failed ({}): {}", request, e.kind(), e.getMessage());
            throw new CandidatesExhaustedException(1, new ConnectivityException(route + " failed", e));
        }
    }

    private RoutedResponse routeOutproxy(OutboundRequest request,
                                         List<ProxyRecord> discovered,
                                         BodyConsumer consumer) throws RouteException {
        List<RankedCandidate> candidates = selector.ensureFreshN(discovered, candidateCount);
        if (candidates.isEmpty()) {
            throw new NoCandidatesException("No proxy candidates available for " + request.host());
        }
        ConnectivityException lastFailure = null;
        int attempts = 0;
        for (RankedCandidate candidate : candidates) {
            ProxyRecord record = candidate.record();
            attempts++;
            try {
                TransportResponse response = sendVia(record, request, consumer);
                log.debug("{} served by {} with status {}", request, record, response.status());
                return RoutedResponse.from(response, record.url());
            } catch (TransportException e) {
                if (!e.isConnectivity()) {
                    throw new ProtocolException("Request through " + record + " failed: " + e.getMessage(), e);
                }
                log.warn("Proxy {} failed ({}), trying next candidate: {}", record, e.kind(), e.getMessage());
                selector.reportFailure(record);
                lastFailure = new ConnectivityException(record + " failed", e);
            }
        }
        throw new CandidatesExhaustedException(attempts, lastFailure);
    }

    /**
     * Try the record's routes in order, moving on only when the proxy rejects the protocol.
     */
    private TransportResponse sendVia(ProxyRecord record,
                                      OutboundRequest request,
                                      BodyConsumer consumer) throws TransportException {
        List<ProxyRoute> routes = ProxyRoutes.forRecord(record, request.encrypted());
        TransportException last = null;
        for (int i = 0; i < routes.size(); i++) {
            try {
                return transport.send(routes.get(i), request, timeout, consumer);
            } catch (TransportException e) {
                last = e;
                if (e.kind() != FailureKind.PROXY_HANDSHAKE || i + 1 == routes.size()) {
                    throw e;
                }
                log.debug("{} rejected {}, falling back to {}", record, routes.get(i), routes.get(i + 1));
            }
        }
        throw last;
    }

    private static void validate(OutboundRequest request) throws ProtocolException {
        if (request == null) {
            throw new ProtocolException("request is required");
        }
        String scheme = request.uri().getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new ProtocolException("Unsupported URL scheme: " + request.uri());
        }
        String host = request.host();
        if (host == null || host.isBlank()) {
            throw new ProtocolException("URL has no host: " + request.uri());
        }
        if (!ALLOWED_METHODS.contains(request.method())) {
            throw new ProtocolException("Unsupported HTTP method: " + request.method());
        }
    }
}
