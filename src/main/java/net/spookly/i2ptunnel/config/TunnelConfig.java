package net.spookly.i2ptunnel.config;

import java.util.ArrayList;
import java.util.List;

public class TunnelConfig {
    public OverlayConfig overlay;
    public DiscoveryConfig discovery;
    public BenchmarkConfig benchmark;
    public SelectionConfig selection;
    public RoutingConfig routing;

    public static class OverlayConfig {
        /**
         * Data directory handed to the overlay router on init.
         */
        public String configDir;
        /**
         * Router executable; when unset the router is assumed to be managed externally.
         */
        public String binary;
        public String httpProxy;
        public String httpsProxy;
        public List<String> domainSuffixes;
        public Integer startupTimeoutMs;
    }

    public static class DiscoveryConfig {
        public String directoryUrl;
        public Integer timeoutMs;
    }

    public static class BenchmarkConfig {
        public String testUrl;
        public Integer payloadBytes;
        public Integer timeoutMs;
        public Integer maxConcurrency;
        /**
         * Bytes per second reported for overlay-only proxies that cannot be probed directly.
         */
        public Double placeholderThroughput;
        public Double placeholderLatencyMs;
    }

    public static class SelectionConfig {
        public Integer retestIntervalSeconds;
    }

    public static class RoutingConfig {
        public Integer candidateCount;
        public Integer timeoutMs;
    }

    /**
     * Fully populated configuration with the built-in defaults.
     */
    public static TunnelConfig defaults() {
        TunnelConfig config = new TunnelConfig();
        config.overlay = new OverlayConfig();
        config.overlay.configDir = ConfigDefaults.OVERLAY_CONFIG_DIR;
        config.overlay.httpProxy = ConfigDefaults.OVERLAY_HTTP_PROXY;
        config.overlay.httpsProxy = ConfigDefaults.OVERLAY_HTTPS_PROXY;
        config.overlay.domainSuffixes = new ArrayList<>(List.of(ConfigDefaults.OVERLAY_DOMAIN_SUFFIX));
        config.overlay.startupTimeoutMs = ConfigDefaults.OVERLAY_STARTUP_TIMEOUT_MS;

        config.discovery = new DiscoveryConfig();
        config.discovery.directoryUrl = ConfigDefaults.DIRECTORY_URL;
        config.discovery.timeoutMs = ConfigDefaults.DISCOVERY_TIMEOUT_MS;

        config.benchmark = new BenchmarkConfig();
        config.benchmark.testUrl = ConfigDefaults.BENCHMARK_TEST_URL;
        config.benchmark.payloadBytes = ConfigDefaults.BENCHMARK_PAYLOAD_BYTES;
        config.benchmark.timeoutMs = ConfigDefaults.BENCHMARK_TIMEOUT_MS;
        config.benchmark.maxConcurrency = ConfigDefaults.BENCHMARK_MAX_CONCURRENCY;
        config.benchmark.placeholderThroughput = ConfigDefaults.PLACEHOLDER_THROUGHPUT;
        config.benchmark.placeholderLatencyMs = ConfigDefaults.PLACEHOLDER_LATENCY_MS;

        config.selection = new SelectionConfig();
        config.selection.retestIntervalSeconds = ConfigDefaults.RETEST_INTERVAL_SECONDS;

        config.routing = new RoutingConfig();
        config.routing.candidateCount = ConfigDefaults.ROUTING_CANDIDATE_COUNT;
        config.routing.timeoutMs = ConfigDefaults.ROUTING_TIMEOUT_MS;
        return config;
    }
}
