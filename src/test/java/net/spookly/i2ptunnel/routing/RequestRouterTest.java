package net.spookly.i2ptunnel.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import net.spookly.i2ptunnel.benchmark.BenchmarkResult;
import net.spookly.i2ptunnel.benchmark.BenchmarkRunner;
import net.spookly.i2ptunnel.config.TunnelConfig;
import net.spookly.i2ptunnel.discovery.ProxyKind;
import net.spookly.i2ptunnel.discovery.ProxyRecord;
import net.spookly.i2ptunnel.overlay.OverlayEndpoints;
import net.spookly.i2ptunnel.overlay.OverlayRouter;
import net.spookly.i2ptunnel.overlay.OverlayRouterSupervisor;
import net.spookly.i2ptunnel.selection.ProxySelector;
import net.spookly.i2ptunnel.selection.RankedCandidate;
import net.spookly.i2ptunnel.selection.SelectionEvent;
import net.spookly.i2ptunnel.selection.SelectionEventListener;
import net.spookly.i2ptunnel.selection.SelectionEventType;
import net.spookly.i2ptunnel.transport.FailureKind;
import net.spookly.i2ptunnel.transport.OutboundRequest;
import net.spookly.i2ptunnel.transport.ProxyRoute;
import net.spookly.i2ptunnel.transport.StubTransport;
import net.spookly.i2ptunnel.transport.TransportException;
import net.spookly.i2ptunnel.util.HostPort;
import org.junit.jupiter.api.Test;

class RequestRouterTest {
    private static final ProxyRecord FAST = ProxyRecord.of("10.0.0.1", 3128);
    private static final ProxyRecord SLOW = ProxyRecord.of("10.0.0.2", 3128);
    private static final List<ProxyRecord> RECORDS = List.of(FAST, SLOW);

    @Test
    void fallsBackToNextCandidateAndEvictsRefusedOne() throws Exception {
        StubRunner runner = rankedFastThenSlow();
        ProxySelector selector = selector(runner);
        StubTransport transport = new StubTransport((route, request) -> {
            if (route.proxy().host().equals("10.0.0.1")) {
                throw StubTransport.failure(FailureKind.CONNECT, route, "Connection refused");
            }
            return StubTransport.ok("hello");
        });

        RoutedResponse response = router(selector, transport, null)
                .route(OutboundRequest.get("http://example.com/"), RECORDS);

        assertEquals(200, response.status());
        assertEquals("hello", new String(response.body(), StandardCharsets.UTF_8));
        assertEquals("http://10.0.0.2:3128", response.proxyUsed());
        assertEquals(List.of(SLOW), recordsOf(selector));
        assertEquals(List.of(
                ProxyRoute.httpForward(HostPort.of("10.0.0.1", 3128)),
                ProxyRoute.httpForward(HostPort.of("10.0.0.2", 3128))
        ), transport.routes());
    }

    @Test
    void concurrentRequestsEvictRefusedCandidateOnce() throws Exception {
        StubRunner runner = rankedFastThenSlow();
        List<SelectionEvent> events = new CopyOnWriteArrayList<>();
        ProxySelector selector = new ProxySelector(new TunnelConfig.SelectionConfig(), runner, Clock.systemUTC(),
                events::add);
        assertEquals(List.of(FAST, SLOW), selector.ensureFreshN(RECORDS, 2).stream()
                .map(RankedCandidate::record)
                .collect(Collectors.toList()));
        StubTransport transport = new StubTransport((route, request) -> {
            if (route.proxy().host().equals("10.0.0.1")) {
                throw StubTransport.failure(FailureKind.CONNECT, route, "Connection refused");
            }
            return StubTransport.ok("hello");
        });
        RequestRouter router = router(selector, transport, null);
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<RoutedResponse>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return router.route(OutboundRequest.get("http://example.com/"), RECORDS);
                }));
            }
            start.countDown();
            for (Future<RoutedResponse> future : futures) {
                RoutedResponse response = future.get(10, TimeUnit.SECONDS);
                assertEquals(200, response.status());
                assertEquals("http://10.0.0.2:3128", response.proxyUsed());
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, runner.calls);
        assertEquals(List.of(SLOW), recordsOf(selector));
        assertEquals(1, events.stream().filter(event -> event.type() == SelectionEventType.EVICTED).count());
    }

    @Test
    void responseBodyIsCopiedForEachCaller() throws Exception {
        StubTransport transport = new StubTransport((route, request) -> StubTransport.ok("hello"));

        RoutedResponse response = router(selector(rankedFastThenSlow()), transport, null)
                .route(OutboundRequest.get("http://example.com/"), RECORDS);
        response.body()[0] = (byte) 'j';

        assertEquals("hello", new String(response.body(), StandardCharsets.UTF_8));
    }

    @Test
    void httpErrorStatusIsReturnedNotRetried() throws Exception {
        StubTransport transport = new StubTransport((route, request) -> StubTransport.response(404, "missing"));

        RoutedResponse response = router(selector(rankedFastThenSlow()), transport, null)
                .route(OutboundRequest.get("http://example.com/nope"), RECORDS);

        assertEquals(404, response.status());
        assertEquals("http://10.0.0.1:3128", response.proxyUsed());
        assertEquals(1, transport.requests().size());
    }

    @Test
    void protocolFailureAbortsWithoutEviction() {
        ProxySelector selector = selector(rankedFastThenSlow());
        StubTransport transport = new StubTransport((route, request) -> {
            throw StubTransport.failure(FailureKind.PROTOCOL, route, "invalid response line");
        });

        ProtocolException error = assertThrows(ProtocolException.class, () -> router(selector, transport, null)
                .route(OutboundRequest.get("http://example.com/"), RECORDS));

        assertInstanceOf(TransportException.class, error.getCause());
        assertEquals(1, transport.requests().size());
        assertEquals(List.of(FAST, SLOW), recordsOf(selector));
    }

    @Test
    void exhaustedCandidatesReportLastFailureAndCount() {
        StubTransport transport = new StubTransport((route, request) -> {
            throw StubTransport.failure(FailureKind.TIMEOUT, route, "timed out via " + route.proxy().host());
        });

        CandidatesExhaustedException error = assertThrows(CandidatesExhaustedException.class,
                () -> router(selector(rankedFastThenSlow()), transport, null)
                        .route(OutboundRequest.get("http://example.com/"), RECORDS));

        assertEquals(2, error.attempts());
        assertInstanceOf(ConnectivityException.class, error.lastFailure());
        assertTrue(error.lastFailure().getCause().getMessage().contains("10.0.0.2"));
    }

    @Test
    void noCandidatesFailsImmediately() {
        StubTransport transport = new StubTransport((route, request) -> StubTransport.ok("unused"));
        StubRunner runner = new StubRunner(BenchmarkResult.failed(FAST, "Connection refused"));

        assertThrows(NoCandidatesException.class, () -> router(selector(runner), transport, null)
                .route(OutboundRequest.get("http://example.com/"), RECORDS));
        assertThrows(NoCandidatesException.class, () -> router(selector(runner), transport, null)
                .route(OutboundRequest.get("http://example.com/"), List.of()));
        assertTrue(transport.requests().isEmpty());
    }

    @Test
    void socksCandidateFallsBackToConnect() throws Exception {
        ProxyRecord socks = ProxyRecord.of("10.0.0.3", 1080, ProxyKind.SOCKS_LIKE);
        StubRunner runner = new StubRunner(BenchmarkResult.succeeded(socks, 1000.0, 10.0));
        StubTransport transport = new StubTransport((route, request) -> {
            if (route.mode() == ProxyRoute.Mode.SOCKS5) {
                throw StubTransport.failure(FailureKind.PROXY_HANDSHAKE, route, "socks rejected");
            }
            return StubTransport.ok("tunnelled");
        });
        ProxySelector selector = selector(runner);

        RoutedResponse response = router(selector, transport, null)
                .route(OutboundRequest.get("https://example.com/"), List.of(socks));

        assertEquals("socks5://10.0.0.3:1080", response.proxyUsed());
        assertEquals(ProxyRoute.httpConnect(HostPort.of("10.0.0.3", 1080)), transport.routes().get(1));
        assertEquals(List.of(socks), recordsOf(selector));
    }

    @Test
    void overlayTargetsBypassSelector() throws Exception {
        StubRunner runner = rankedFastThenSlow();
        StubTransport transport = new StubTransport((route, request) -> StubTransport.ok("eepsite"));
        StubRouter overlay = new StubRouter(0, 0);
        RequestRouter router = router(selector(runner), transport, new OverlayRouterSupervisor(overlay, "data"));

        RoutedResponse plain = router.route(OutboundRequest.get("http://stats.i2p/"), RECORDS);
        RoutedResponse encrypted = router.route(OutboundRequest.get("https://secure.i2p/"), RECORDS);

        assertEquals("127.0.0.1:4444", plain.proxyUsed());
        assertEquals("127.0.0.1:4447", encrypted.proxyUsed());
        assertEquals(List.of(
                ProxyRoute.httpForward(HostPort.parse("127.0.0.1:4444")),
                ProxyRoute.httpConnect(HostPort.parse("127.0.0.1:4447"))
        ), transport.routes());
        assertEquals(0, runner.calls);
        assertEquals(1, overlay.starts);
    }

    @Test
    void overlayConnectivityFailureCountsOneAttempt() {
        StubTransport transport = new StubTransport((route, request) -> {
            throw StubTransport.failure(FailureKind.RESET, route, "Connection reset");
        });

        CandidatesExhaustedException error = assertThrows(CandidatesExhaustedException.class,
                () -> router(selector(rankedFastThenSlow()), transport, null)
                        .route(OutboundRequest.get("http://stats.i2p/"), RECORDS));

        assertEquals(1, error.attempts());
    }

    @Test
    void routerInitFailureIsSurfacedWithoutSending() {
        StubTransport transport = new StubTransport((route, request) -> StubTransport.ok("unused"));
        OverlayRouterSupervisor supervisor = new OverlayRouterSupervisor(new StubRouter(3, 0), "data");

        RouterInitException error = assertThrows(RouterInitException.class,
                () -> router(selector(rankedFastThenSlow()), transport, supervisor)
                        .route(OutboundRequest.get("http://stats.i2p/"), RECORDS));

        assertEquals(3, error.code());
        assertTrue(transport.requests().isEmpty());
    }

    @Test
    void rejectsUnsupportedMethodsAndSchemes() {
        StubTransport transport = new StubTransport((route, request) -> StubTransport.ok("unused"));
        RequestRouter router = router(selector(rankedFastThenSlow()), transport, null);

        assertThrows(ProtocolException.class, () -> router.route(
                new OutboundRequest("TRACE", URI.create("http://example.com/"), null, null, false), RECORDS));
        assertThrows(ProtocolException.class, () -> router.route(
                new OutboundRequest("GET", URI.create("ftp://example.com/file"), null, null, false), RECORDS));
        assertThrows(ProtocolException.class, () -> router.route(
                new OutboundRequest("GET", URI.create("http:///nohost"), null, null, false), RECORDS));
        assertTrue(transport.requests().isEmpty());
    }

    private static List<ProxyRecord> recordsOf(ProxySelector selector) {
        return selector.rankedCandidates().stream()
                .map(RankedCandidate::record)
                .collect(Collectors.toList());
    }

    private static StubRunner rankedFastThenSlow() {
        return new StubRunner(
                BenchmarkResult.succeeded(SLOW, 1000.0, 10.0),
                BenchmarkResult.succeeded(FAST, 5000.0, 10.0)
        );
    }

    private static ProxySelector selector(StubRunner runner) {
        return new ProxySelector(new TunnelConfig.SelectionConfig(), runner, Clock.systemUTC(),
                SelectionEventListener.NOOP);
    }

    private static RequestRouter router(ProxySelector selector,
                                        StubTransport transport,
                                        OverlayRouterSupervisor supervisor) {
        return new RequestRouter(TunnelConfig.defaults().routing, selector, transport,
                OverlayEndpoints.DEFAULT, supervisor);
    }

    private static final class StubRunner implements BenchmarkRunner {
        private final List<BenchmarkResult> results;
        private int calls;

        private StubRunner(BenchmarkResult... results) {
            this.results = List.of(results);
        }

        @Override
        public List<BenchmarkResult> probeMany(List<ProxyRecord> records) {
            calls++;
            return results;
        }
    }

    private static final class StubRouter implements OverlayRouter {
        private final int initCode;
        private final int startCode;
        private boolean running;
        private int starts;

        private StubRouter(int initCode, int startCode) {
            this.initCode = initCode;
            this.startCode = startCode;
        }

        @Override
        public int init(String configDir) {
            return initCode;
        }

        @Override
        public int start() {
            starts++;
            running = startCode == 0;
            return startCode;
        }

        @Override
        public int stop() {
            running = false;
            return 0;
        }

        @Override
        public void cleanup() {
        }

        @Override
        public boolean isRunning() {
            return running;
        }
    }
}
