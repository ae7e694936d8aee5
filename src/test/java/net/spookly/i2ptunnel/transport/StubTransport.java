package net.spookly.i2ptunnel.transport;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Transport answering from a handler and recording every attempt.
 */
public final class StubTransport implements HttpTransport {
    @FunctionalInterface
    public interface Handler {
        TransportResponse handle(ProxyRoute route, OutboundRequest request) throws TransportException;
    }

    private final Handler handler;
    private final List<ProxyRoute> routes = Collections.synchronizedList(new ArrayList<>());
    private final List<OutboundRequest> requests = Collections.synchronizedList(new ArrayList<>());

    public StubTransport(Handler handler) {
        this.handler = handler;
    }

    @Override
    public CompletableFuture<TransportResponse> execute(ProxyRoute route,
                                                        OutboundRequest request,
                                                        Duration timeout,
                                                        BodyConsumer bodyConsumer) {
        routes.add(route);
        requests.add(request);
        try {
            return CompletableFuture.completedFuture(handler.handle(route, request));
        } catch (TransportException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public List<ProxyRoute> routes() {
        synchronized (routes) {
            return List.copyOf(routes);
        }
    }

    public List<OutboundRequest> requests() {
        synchronized (requests) {
            return List.copyOf(requests);
        }
    }

    public static TransportResponse ok(String body) {
        return response(200, body);
    }

    public static TransportResponse response(int status, String body) {
        return new TransportResponse(status, Map.of("content-type", "text/html"),
                body.getBytes(StandardCharsets.UTF_8), false);
    }

    public static TransportException failure(FailureKind kind, ProxyRoute route, String message) {
        return new TransportException(kind, route, message);
    }
}
