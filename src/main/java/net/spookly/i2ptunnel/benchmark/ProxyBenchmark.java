package net.spookly.i2ptunnel.benchmark;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

import net.spookly.i2ptunnel.config.ConfigDefaults;
import net.spookly.i2ptunnel.config.TunnelConfig;
import net.spookly.i2ptunnel.discovery.ProxyRecord;
import net.spookly.i2ptunnel.transport.FailureKind;
import net.spookly.i2ptunnel.transport.HttpTransport;
import net.spookly.i2ptunnel.transport.OutboundRequest;
import net.spookly.i2ptunnel.transport.ProxyRoute;
import net.spookly.i2ptunnel.transport.ProxyRoutes;
import net.spookly.i2ptunnel.transport.TransportException;
import net.spookly.i2ptunnel.transport.TransportResponse;
import net.spookly.i2ptunnel.util.OverlayDomains;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Measures latency and throughput of outproxies against a fixed reference payload.
 *
 * <p>Proxies on overlay domains cannot be dialed from outside the overlay, so they are scored
 * with configured placeholder values instead of being probed.
 */
public final class ProxyBenchmark implements BenchmarkRunner {
    private static final Logger log = LoggerFactory.getLogger(ProxyBenchmark.class);
    /**
     * Worst case per probe: HEAD and GET on the primary route and again on the fallback.
     */
    private static final int REQUESTS_PER_PROBE = 4;

    private final HttpTransport transport;
    private final OverlayDomains domains;
    private final String testUrl;
    private final Duration timeout;
    private final int maxConcurrency;
    private final double placeholderThroughput;
    private final double placeholderLatencyMs;
    private final LongSupplier nanoTime;

    public ProxyBenchmark(TunnelConfig.BenchmarkConfig config, OverlayDomains domains, HttpTransport transport) {
        this(config, domains, transport, System::nanoTime);
    }

    ProxyBenchmark(TunnelConfig.BenchmarkConfig config,
                   OverlayDomains domains,
                   HttpTransport transport,
                   LongSupplier nanoTime) {
        Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.domains = Objects.requireNonNull(domains, "domains");
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime");
        this.testUrl = config.testUrl == null ? ConfigDefaults.BENCHMARK_TEST_URL : config.testUrl;
        this.timeout = Duration.ofMillis(config.timeoutMs == null
                ? ConfigDefaults.BENCHMARK_TIMEOUT_MS
                : config.timeoutMs);
        this.maxConcurrency = config.maxConcurrency == null
                ? ConfigDefaults.BENCHMARK_MAX_CONCURRENCY
                : config.maxConcurrency;
        this.placeholderThroughput = config.placeholderThroughput == null
                ? ConfigDefaults.PLACEHOLDER_THROUGHPUT
                : config.placeholderThroughput;
        this.placeholderLatencyMs = config.placeholderLatencyMs == null
                ? ConfigDefaults.PLACEHOLDER_LATENCY_MS
                : config.placeholderLatencyMs;
    }

    /**
     * Probe a single proxy. Never throws for probe failures; the reason is carried in the result.
     */
    public BenchmarkResult probe(ProxyRecord record) {
        Objects.requireNonNull(record, "record");
        if (domains.isOverlayHost(record.host())) {
            log.debug("{} is overlay-only, using placeholder score", record);
            return BenchmarkResult.succeeded(record, placeholderThroughput, placeholderLatencyMs);
        }
        OutboundRequest head = OutboundRequest.head(testUrl);
        OutboundRequest get = OutboundRequest.get(testUrl);
        List<ProxyRoute> routes = ProxyRoutes.forRecord(record, get.encrypted());
        String lastReason = "no route for " + record.kind();
        for (int i = 0; i < routes.size(); i++) {
            ProxyRoute route = routes.get(i);
            try {
                return probeRoute(record, route, head, get);
            } catch (TransportException e) {
                lastReason = e.getMessage();
                boolean hasFallback = i + 1 < routes.size();
                if (e.kind() == FailureKind.PROXY_HANDSHAKE && hasFallback) {
                    log.debug("{} refused {}, trying {}", record, route, routes.get(i + 1));
                    continue;
                }
                break;
            }
        }
        log.debug("Probe of {} failed: {}", record, lastReason);
        return BenchmarkResult.failed(record, lastReason);
    }

    @Override
    public List<BenchmarkResult> probeMany(List<ProxyRecord> records) {
        int count = records == null ? 0 : records.size();
        return probeMany(records, Math.max(1, Math.min(count, maxConcurrency)));
    }

    /**
     * Probe all records with at most {@code maxConcurrency} probes in flight. Results come back
     * in completion order; probes still running at the overall deadline are reported as failed.
     */
    public List<BenchmarkResult> probeMany(List<ProxyRecord> records, int maxConcurrency) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        int workers = Math.min(Math.max(1, maxConcurrency), records.size());
        log.info("Benchmarking {} proxies with concurrency {}", records.size(), workers);

        ExecutorService pool = Executors.newFixedThreadPool(workers, threadFactory());
        List<BenchmarkResult> results = new ArrayList<>(records.size());
        try {
            CompletionService<BenchmarkResult> completion = new ExecutorCompletionService<>(pool);
            Map<Future<BenchmarkResult>, ProxyRecord> pending = new LinkedHashMap<>();
            for (ProxyRecord record : records) {
                pending.put(completion.submit(() -> probe(record)), record);
            }
            long waves = (records.size() + workers - 1) / workers;
            long allowanceMs = waves * (REQUESTS_PER_PROBE * (timeout.toMillis() + HttpTransport.RESULT_GRACE_MS));
            long deadline = nanoTime.getAsLong() + TimeUnit.MILLISECONDS.toNanos(allowanceMs);
            collect(completion, pending, results, deadline);
            for (Map.Entry<Future<BenchmarkResult>, ProxyRecord> entry : pending.entrySet()) {
                entry.getKey().cancel(true);
                results.add(BenchmarkResult.failed(entry.getValue(), "Probe timed out"));
            }
        } finally {
            pool.shutdownNow();
        }
        logSummary(results);
        return results;
    }

    private void collect(CompletionService<BenchmarkResult> completion,
                         Map<Future<BenchmarkResult>, ProxyRecord> pending,
                         List<BenchmarkResult> results,
                         long deadline) {
        while (!pending.isEmpty()) {
            long remaining = deadline - nanoTime.getAsLong();
            Future<BenchmarkResult> done;
            try {
                done = completion.poll(Math.max(0, remaining), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (done == null) {
                return;
            }
            ProxyRecord record = pending.remove(done);
            try {
                results.add(done.get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("Probe of {} threw unexpectedly: {}", record, cause.toString());
                results.add(BenchmarkResult.failed(record, "Probe error: " + cause.getMessage()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                results.add(BenchmarkResult.failed(record, "Probe interrupted"));
                return;
            }
        }
    }

    private BenchmarkResult probeRoute(ProxyRecord record,
                                       ProxyRoute route,
                                       OutboundRequest head,
                                       OutboundRequest get) throws TransportException {
        long headStart = nanoTime.getAsLong();
        try {
            transport.send(route, head, timeout);
        } catch (TransportException e) {
            if (e.kind() == FailureKind.PROXY_HANDSHAKE) {
                throw e;
            }
            log.debug("Latency request to {} failed: {}", record, e.getMessage());
        }
        double latencyMs = (nanoTime.getAsLong() - headStart) / 1_000_000.0;

        long downloadStart = nanoTime.getAsLong();
        TransportResponse response = transport.send(route, get, timeout);
        long elapsedNanos = nanoTime.getAsLong() - downloadStart;
        if (!response.isSuccess()) {
            return BenchmarkResult.failed(record, "HTTP error: " + response.status());
        }
        if (elapsedNanos <= 0) {
            return BenchmarkResult.failed(record, "Download time was zero");
        }
        double seconds = elapsedNanos / 1_000_000_000.0;
        double throughput = response.body().length / seconds;
        log.debug("{} via {}: {} bytes in {} s", record, route, response.body().length, seconds);
        return BenchmarkResult.succeeded(record, throughput, latencyMs);
    }

    private static void logSummary(List<BenchmarkResult> results) {
        long successes = results.stream().filter(BenchmarkResult::success).count();
        log.info("Benchmark finished: {} succeeded, {} failed", successes, results.size() - successes);
        Optional<BenchmarkResult> fastest = results.stream()
                .filter(BenchmarkResult::success)
                .max(Comparator.comparingDouble(BenchmarkResult::throughput));
        fastest.ifPresent(result -> log.info("Fastest proxy: {}", result));
    }

    private static ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "i2ptunnel-probe-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
