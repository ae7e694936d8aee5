package net.spookly.i2ptunnel;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import net.spookly.i2ptunnel.benchmark.BenchmarkResult;
import net.spookly.i2ptunnel.benchmark.ProxyBenchmark;
import net.spookly.i2ptunnel.config.ConfigDefaults;
import net.spookly.i2ptunnel.config.ConfigLoader;
import net.spookly.i2ptunnel.config.ConfigValidator;
import net.spookly.i2ptunnel.config.TunnelConfig;
import net.spookly.i2ptunnel.discovery.DiscoveryException;
import net.spookly.i2ptunnel.discovery.ProxyDiscovery;
import net.spookly.i2ptunnel.discovery.ProxyRecord;
import net.spookly.i2ptunnel.overlay.OverlayEndpoints;
import net.spookly.i2ptunnel.overlay.OverlayRouterSupervisor;
import net.spookly.i2ptunnel.routing.RequestRouter;
import net.spookly.i2ptunnel.routing.RouteException;
import net.spookly.i2ptunnel.routing.RoutedResponse;
import net.spookly.i2ptunnel.selection.ProxySelector;
import net.spookly.i2ptunnel.selection.RankedCandidate;
import net.spookly.i2ptunnel.selection.SelectionAuditLogger;
import net.spookly.i2ptunnel.selection.SelectionEventListener;
import net.spookly.i2ptunnel.transport.BodyConsumer;
import net.spookly.i2ptunnel.transport.HttpTransport;
import net.spookly.i2ptunnel.transport.NettyHttpTransport;
import net.spookly.i2ptunnel.transport.OutboundRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point wiring discovery, benchmarking, selection and routing from one configuration.
 */
public final class TunnelService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TunnelService.class);

    private final HttpTransport transport;
    private final boolean ownsTransport;
    private final OverlayEndpoints endpoints;
    private final OverlayRouterSupervisor supervisor;
    private final ProxyDiscovery discovery;
    private final ProxyBenchmark benchmark;
    private final ProxySelector selector;
    private final RequestRouter router;
    private final Clock clock;
    private final Duration rediscoverInterval;
    private final Object discoveryLock = new Object();
    private volatile List<ProxyRecord> discovered;
    private volatile Instant discoveryCheckedAt;

    /**
     * Build a service from a config file, generating a default file when it does not exist.
     */
    public static TunnelService load(Path configPath) {
        return create(ConfigLoader.load(configPath));
    }

    /**
     * Build a service with its own Netty transport and an overlay router chosen from config.
     */
    public static TunnelService create(TunnelConfig config) {
        ConfigValidator.validate(config);
        return new TunnelService(
                config,
                new NettyHttpTransport(),
                true,
                OverlayRouterSupervisor.fromConfig(config.overlay),
                SelectionAuditLogger.INSTANCE,
                Clock.systemUTC()
        );
    }

    TunnelService(TunnelConfig config,
                  HttpTransport transport,
                  boolean ownsTransport,
                  OverlayRouterSupervisor supervisor,
                  SelectionEventListener listener,
                  Clock clock) {
        Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.ownsTransport = ownsTransport;
        this.supervisor = supervisor;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.rediscoverInterval = Duration.ofSeconds(config.selection == null
                || config.selection.retestIntervalSeconds == null
                ? ConfigDefaults.RETEST_INTERVAL_SECONDS
                : config.selection.retestIntervalSeconds);
        this.endpoints = OverlayEndpoints.fromConfig(config.overlay);
        this.discovery = new ProxyDiscovery(
                transport,
                config.discovery.directoryUrl,
                endpoints,
                Duration.ofMillis(config.discovery.timeoutMs),
                supervisor
        );
        this.benchmark = new ProxyBenchmark(config.benchmark, endpoints.domains(), transport);
        this.selector = new ProxySelector(config.selection, benchmark, clock, listener);
        this.router = new RequestRouter(config.routing, selector, transport, endpoints, supervisor);
    }

    /**
     * Fetch the directory again. Failures are logged and yield an empty list.
     */
    public List<ProxyRecord> fetchProxies() {
        try {
            List<ProxyRecord> records = discovery.discover();
            if (!records.isEmpty()) {
                discovered = records;
            }
            return records;
        } catch (DiscoveryException e) {
            log.error("Proxy discovery failed: {}", e.getMessage());
            return List.of();
        }
    }

    public List<BenchmarkResult> testProxies(List<ProxyRecord> records) {
        return benchmark.probeMany(records);
    }

    /**
     * Fastest proxy from the last selection, if any.
     */
    public Optional<RankedCandidate> fastestProxy() {
        return selector.getCached();
    }

    public RoutedResponse request(OutboundRequest request) throws RouteException {
        return request(request, BodyConsumer.NOOP);
    }

    /**
     * Route a request. Non-overlay targets use the discovered outproxy list, fetched again once it
     * is older than the retest interval.
     */
    public RoutedResponse request(OutboundRequest request, BodyConsumer bodyConsumer) throws RouteException {
        Objects.requireNonNull(request, "request");
        List<ProxyRecord> records = endpoints.domains().isOverlayHost(request.host())
                ? List.of()
                : discoveredProxies();
        return router.route(request, records, bodyConsumer);
    }

    public ProxySelector selector() {
        return selector;
    }

    @Override
    public void close() {
        if (supervisor != null) {
            supervisor.shutdown();
        }
        if (ownsTransport) {
            transport.close();
        }
    }

    private List<ProxyRecord> discoveredProxies() {
        List<ProxyRecord> current = discovered;
        if (current != null && discoveryCurrent()) {
            return current;
        }
        synchronized (discoveryLock) {
            if (discovered == null || !discoveryCurrent()) {
                fetchProxies();
                discoveryCheckedAt = clock.instant();
            }
            return discovered == null ? List.of() : discovered;
        }
    }

    private boolean discoveryCurrent() {
        Instant checkedAt = discoveryCheckedAt;
        return checkedAt != null
                && Duration.between(checkedAt, clock.instant()).compareTo(rediscoverInterval) < 0;
    }
}
