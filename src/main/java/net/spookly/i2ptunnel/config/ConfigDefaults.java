package net.spookly.i2ptunnel.config;

import java.util.Locale;

/**
 * Built-in defaults and the template written when no config file exists.
 */
public final class ConfigDefaults {
    public static final String OVERLAY_CONFIG_DIR = ".i2pd";
    public static final String OVERLAY_HTTP_PROXY = "127.0.0.1:4444";
    public static final String OVERLAY_HTTPS_PROXY = "127.0.0.1:4447";
    public static final String OVERLAY_DOMAIN_SUFFIX = ".i2p";
    public static final int OVERLAY_STARTUP_TIMEOUT_MS = 120_000;

    public static final String DIRECTORY_URL = "http://outproxys.i2p/";
    public static final int DISCOVERY_TIMEOUT_MS = 30_000;

    public static final String BENCHMARK_TEST_URL = "http://httpbin.org/bytes/10240";
    public static final int BENCHMARK_PAYLOAD_BYTES = 10_240;
    public static final int BENCHMARK_TIMEOUT_MS = 10_000;
    public static final int BENCHMARK_MAX_CONCURRENCY = 10;
    public static final double PLACEHOLDER_THROUGHPUT = 50 * 1024.0;
    public static final double PLACEHOLDER_LATENCY_MS = 200.0;

    public static final int RETEST_INTERVAL_SECONDS = 300;

    public static final int ROUTING_CANDIDATE_COUNT = 5;
    public static final int ROUTING_TIMEOUT_MS = 60_000;

    private static final String DEFAULT_YAML_TEMPLATE = """
            # Generated default i2ptunnel config.
            overlay:
              configDir: %s
              # binary: /usr/bin/i2pd
              httpProxy: %s
              httpsProxy: %s
              domainSuffixes: ["%s"]
              startupTimeoutMs: %d

            discovery:
              directoryUrl: %s
              timeoutMs: %d

            benchmark:
              testUrl: %s
              payloadBytes: %d
              timeoutMs: %d
              maxConcurrency: %d
              placeholderThroughput: %.1f
              placeholderLatencyMs: %.1f

            selection:
              retestIntervalSeconds: %d

            routing:
              candidateCount: %d
              timeoutMs: %d
            """;

    private ConfigDefaults() {
    }

    /**
     * Render the default configuration template.
     */
    public static String defaultYaml() {
        return String.format(
                Locale.ROOT,
                DEFAULT_YAML_TEMPLATE,
                OVERLAY_CONFIG_DIR,
                OVERLAY_HTTP_PROXY,
                OVERLAY_HTTPS_PROXY,
                OVERLAY_DOMAIN_SUFFIX,
                OVERLAY_STARTUP_TIMEOUT_MS,
                DIRECTORY_URL,
                DISCOVERY_TIMEOUT_MS,
                BENCHMARK_TEST_URL,
                BENCHMARK_PAYLOAD_BYTES,
                BENCHMARK_TIMEOUT_MS,
                BENCHMARK_MAX_CONCURRENCY,
                PLACEHOLDER_THROUGHPUT,
                PLACEHOLDER_LATENCY_MS,
                RETEST_INTERVAL_SECONDS,
                ROUTING_CANDIDATE_COUNT,
                ROUTING_TIMEOUT_MS
        );
    }
}
