package net.spookly.i2ptunnel.selection;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import net.spookly.i2ptunnel.benchmark.BenchmarkResult;
import net.spookly.i2ptunnel.benchmark.BenchmarkRunner;
import net.spookly.i2ptunnel.config.ConfigDefaults;
import net.spookly.i2ptunnel.config.TunnelConfig;
import net.spookly.i2ptunnel.discovery.ProxyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ranks benchmark results and keeps a time-bounded cache of the fastest proxies.
 *
 * <p>Readers take the read lock; selection, eviction and refresh results are published under
 * the write lock. Benchmarks run outside the cache lock, serialized by a separate refresh lock.
 */
public final class ProxySelector {
    private static final Logger log = LoggerFactory.getLogger(ProxySelector.class);

    private final BenchmarkRunner benchmark;
    private final Duration retestInterval;
    private final Clock clock;
    private final SelectionEventListener listener;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ReentrantLock refreshLock = new ReentrantLock();
    private final SelectionCache cache = new SelectionCache();

    public ProxySelector(TunnelConfig.SelectionConfig config, BenchmarkRunner benchmark) {
        this(config, benchmark, Clock.systemUTC(), SelectionAuditLogger.INSTANCE);
    }

    public ProxySelector(TunnelConfig.SelectionConfig config,
                         BenchmarkRunner benchmark,
                         Clock clock,
                         SelectionEventListener listener) {
        this.benchmark = Objects.requireNonNull(benchmark, "benchmark");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.listener = listener == null ? SelectionEventListener.NOOP : listener;
        int seconds = config == null || config.retestIntervalSeconds == null
                ? ConfigDefaults.RETEST_INTERVAL_SECONDS
                : config.retestIntervalSeconds;
        this.retestInterval = Duration.ofSeconds(seconds);
    }

    /**
     * Successful result with the highest throughput; earlier results win ties.
     */
    public Optional<RankedCandidate> selectBest(List<BenchmarkResult> results) {
        List<RankedCandidate> ranking = rank(results);
        if (ranking.isEmpty()) {
            log.warn("No successful proxy benchmarks to select from");
            return Optional.empty();
        }
        publishSelection(ranking);
        return Optional.of(ranking.get(0));
    }

    /**
     * Up to {@code n} successful results, fastest first.
     */
    public List<RankedCandidate> selectTopN(List<BenchmarkResult> results, int n) {
        if (n <= 0) {
            return List.of();
        }
        List<RankedCandidate> ranking = rank(results);
        if (ranking.isEmpty()) {
            log.warn("No successful proxy benchmarks to select from");
            return List.of();
        }
        List<RankedCandidate> top = List.copyOf(ranking.subList(0, Math.min(n, ranking.size())));
        publishSelection(top);
        return top;
    }

    public Optional<RankedCandidate> getCached() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(cache.best);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Current ranked list, fastest first, without evicted entries.
     */
    public List<RankedCandidate> rankedCandidates() {
        lock.readLock().lock();
        try {
            return cache.ranked;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Cached best candidate, benchmarking {@code records} first when the cache is stale or empty.
     */
    public Optional<RankedCandidate> ensureFresh(List<ProxyRecord> records) {
        Optional<RankedCandidate> cached = freshBest();
        if (cached.isPresent()) {
            log.debug("Using cached proxy {}", cached.get().record());
            return cached;
        }
        if (records == null || records.isEmpty()) {
            return Optional.empty();
        }
        refreshLock.lock();
        try {
            cached = freshBest();
            if (cached.isPresent()) {
                return cached;
            }
            return Optional.ofNullable(refresh(records).best);
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Up to {@code n} cached candidates, benchmarking {@code records} first when the cache is stale or empty.
     */
    public List<RankedCandidate> ensureFreshN(List<ProxyRecord> records, int n) {
        if (n <= 0) {
            return List.of();
        }
        List<RankedCandidate> cached = freshRanked(n);
        if (!cached.isEmpty()) {
            log.debug("Using {} cached proxy candidate(s)", cached.size());
            return cached;
        }
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        refreshLock.lock();
        try {
            cached = freshRanked(n);
            if (!cached.isEmpty()) {
                return cached;
            }
            List<RankedCandidate> ranking = refresh(records).ranked;
            return List.copyOf(ranking.subList(0, Math.min(n, ranking.size())));
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Evict a failing proxy. The best entry is cleared only when it names the same endpoint.
     * Reporting a proxy that is not cached is a no-op.
     */
    public void reportFailure(ProxyRecord record) {
        if (record == null) {
            return;
        }
        boolean evicted = false;
        int remaining;
        lock.writeLock().lock();
        try {
            List<RankedCandidate> kept = new ArrayList<>(cache.ranked.size());
            for (RankedCandidate candidate : cache.ranked) {
                if (candidate.record().sameEndpoint(record)) {
                    evicted = true;
                } else {
                    kept.add(candidate);
                }
            }
            if (evicted) {
                cache.ranked = List.copyOf(kept);
            }
            if (cache.best != null && cache.best.record().sameEndpoint(record)) {
                cache.best = null;
                evicted = true;
            }
            remaining = cache.ranked.size();
        } finally {
            lock.writeLock().unlock();
        }
        if (evicted) {
            log.warn("Evicted failing proxy {}, {} candidate(s) left", record, remaining);
            listener.onEvent(SelectionEvent.evicted(record, remaining, clock.instant()));
        }
    }

    /**
     * Drop all cached state so the next ensureFresh call benchmarks again.
     */
    public void invalidate() {
        lock.writeLock().lock();
        try {
            cache.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private SelectionCache refresh(List<ProxyRecord> records) {
        log.info("Benchmarking {} proxies to refresh selection", records.size());
        List<RankedCandidate> ranking = rank(benchmark.probeMany(records));
        Instant now = clock.instant();
        SelectionCache snapshot = new SelectionCache();
        lock.writeLock().lock();
        try {
            cache.ranked = ranking;
            cache.best = ranking.isEmpty() ? null : ranking.get(0);
            cache.lastBenchmark = now;
            snapshot.ranked = cache.ranked;
            snapshot.best = cache.best;
            snapshot.lastBenchmark = now;
        } finally {
            lock.writeLock().unlock();
        }
        if (snapshot.best == null) {
            log.warn("No proxy passed the benchmark");
        } else {
            log.info("Selected {} ({} candidates)", snapshot.best.record(), ranking.size());
        }
        listener.onEvent(SelectionEvent.refreshed(snapshot.best, ranking.size(), now));
        return snapshot;
    }

    private Optional<RankedCandidate> freshBest() {
        lock.readLock().lock();
        try {
            return isFresh() ? Optional.ofNullable(cache.best) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<RankedCandidate> freshRanked(int n) {
        lock.readLock().lock();
        try {
            if (!isFresh()) {
                return List.of();
            }
            List<RankedCandidate> ranked = cache.ranked;
            return ranked.subList(0, Math.min(n, ranked.size()));
        } finally {
            lock.readLock().unlock();
        }
    }

    // caller holds a cache lock
    private boolean isFresh() {
        if (cache.lastBenchmark == null) {
            return false;
        }
        return Duration.between(cache.lastBenchmark, clock.instant()).compareTo(retestInterval) < 0;
    }

    private void publishSelection(List<RankedCandidate> ranking) {
        RankedCandidate best = ranking.get(0);
        lock.writeLock().lock();
        try {
            cache.best = best;
            cache.ranked = ranking;
            cache.lastBenchmark = best.selectedAt();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Selected fastest proxy {} ({} KB/s)", best.record(), Math.round(best.throughput() / 1024.0));
        listener.onEvent(SelectionEvent.selected(best, ranking.size(), best.selectedAt()));
    }

    private List<RankedCandidate> rank(List<BenchmarkResult> results) {
        if (results == null || results.isEmpty()) {
            return List.of();
        }
        Instant now = clock.instant();
        List<RankedCandidate> ranking = new ArrayList<>();
        for (BenchmarkResult result : results) {
            if (result.success()) {
                ranking.add(new RankedCandidate(result.record(), result.throughput(), now));
            }
        }
        // List.sort is stable, so equal throughputs keep input order
        ranking.sort(Comparator.comparingDouble(RankedCandidate::throughput).reversed());
        return List.copyOf(ranking);
    }
}
