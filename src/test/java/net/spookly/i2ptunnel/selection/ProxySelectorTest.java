package net.spookly.i2ptunnel.selection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import net.spookly.i2ptunnel.benchmark.BenchmarkResult;
import net.spookly.i2ptunnel.benchmark.BenchmarkRunner;
import net.spookly.i2ptunnel.config.TunnelConfig;
import net.spookly.i2ptunnel.discovery.ProxyRecord;
import org.junit.jupiter.api.Test;

class ProxySelectorTest {
    private static final ProxyRecord P1 = ProxyRecord.of("proxy1.i2p", 443);
    private static final ProxyRecord P2 = ProxyRecord.of("proxy2.i2p", 443);
    private static final ProxyRecord P3 = ProxyRecord.of("proxy3.i2p", 443);
    private static final ProxyRecord P4 = ProxyRecord.of("proxy4.i2p", 443);

    @Test
    void selectBestPicksMaximumThroughputAmongSuccesses() {
        ProxySelector selector = selector(new StubRunner(), new MutableClock());

        Optional<RankedCandidate> best = selector.selectBest(List.of(
                BenchmarkResult.succeeded(P1, 1000.0, 100.0),
                BenchmarkResult.succeeded(P2, 5000.0, 50.0),
                BenchmarkResult.failed(P4, "Connection refused"),
                BenchmarkResult.succeeded(P3, 2000.0, 150.0)
        ));

        assertEquals(P2, best.orElseThrow().record());
        assertEquals(5000.0, best.get().throughput());
        assertEquals(best, selector.getCached());
    }

    @Test
    void selectBestWithoutSuccessesIsEmpty() {
        ProxySelector selector = selector(new StubRunner(), new MutableClock());

        assertTrue(selector.selectBest(List.of(BenchmarkResult.failed(P1, "Connection failed"))).isEmpty());
        assertTrue(selector.selectBest(List.of()).isEmpty());
        assertTrue(selector.getCached().isEmpty());
    }

    @Test
    void selectTopNRanksDescendingAndCapsAtSuccesses() {
        ProxySelector selector = selector(new StubRunner(), new MutableClock());
        List<BenchmarkResult> results = List.of(
                BenchmarkResult.succeeded(P1, 1000.0, 100.0),
                BenchmarkResult.succeeded(P2, 5000.0, 50.0),
                BenchmarkResult.succeeded(P3, 2000.0, 150.0),
                BenchmarkResult.succeeded(P4, 3000.0, 120.0)
        );

        List<RankedCandidate> top = selector.selectTopN(results, 3);

        assertEquals(List.of(P2, P4, P3), records(top));
        assertEquals(4, selector.selectTopN(results, 10).size());
        assertTrue(selector.selectTopN(results, 0).isEmpty());
        assertTrue(selector.selectTopN(List.of(), 5).isEmpty());
    }

    @Test
    void equalThroughputKeepsInputOrder() {
        ProxySelector selector = selector(new StubRunner(), new MutableClock());

        List<RankedCandidate> top = selector.selectTopN(List.of(
                BenchmarkResult.succeeded(P3, 1000.0, 10.0),
                BenchmarkResult.succeeded(P1, 1000.0, 10.0),
                BenchmarkResult.succeeded(P2, 1000.0, 10.0)
        ), 3);

        assertEquals(List.of(P3, P1, P2), records(top));
    }

    @Test
    void reportFailureClearsOnlyMatchingBest() {
        ProxySelector selector = selector(new StubRunner(), new MutableClock());
        selector.selectBest(List.of(BenchmarkResult.succeeded(P1, 1000.0, 100.0)));

        selector.reportFailure(ProxyRecord.of("proxy1.i2p", 443));
        assertTrue(selector.getCached().isEmpty());

        selector.selectBest(List.of(BenchmarkResult.succeeded(P2, 2000.0, 100.0)));
        selector.reportFailure(P1);
        assertEquals(P2, selector.getCached().orElseThrow().record());

        selector.reportFailure(P1);
        assertEquals(P2, selector.getCached().orElseThrow().record());
    }

    @Test
    void reportFailureEvictsFromRankedList() {
        List<SelectionEvent> events = new ArrayList<>();
        ProxySelector selector = new ProxySelector(selectionConfig(), new StubRunner(), new MutableClock(), events::add);
        selector.selectTopN(List.of(
                BenchmarkResult.succeeded(P1, 3000.0, 10.0),
                BenchmarkResult.succeeded(P2, 2000.0, 10.0)
        ), 2);

        selector.reportFailure(P2);

        assertEquals(List.of(P1), records(selector.rankedCandidates()));
        assertEquals(P1, selector.getCached().orElseThrow().record());
        assertEquals(SelectionEventType.EVICTED, events.get(events.size() - 1).type());
        assertEquals(1, events.get(events.size() - 1).candidates());
    }

    @Test
    void ensureFreshBenchmarksOnceWithinInterval() {
        StubRunner runner = new StubRunner(
                BenchmarkResult.succeeded(P1, 1000.0, 100.0),
                BenchmarkResult.succeeded(P2, 4000.0, 100.0)
        );
        MutableClock clock = new MutableClock();
        ProxySelector selector = selector(runner, clock);

        assertEquals(P2, selector.ensureFresh(List.of(P1, P2)).orElseThrow().record());
        clock.advance(Duration.ofSeconds(299));
        assertEquals(P2, selector.ensureFresh(List.of(P1, P2)).orElseThrow().record());

        assertEquals(1, runner.calls);
    }

    @Test
    void explicitSelectionIsServedFromCacheUntilStale() {
        StubRunner runner = new StubRunner(BenchmarkResult.failed(P1, "Connection refused"));
        MutableClock clock = new MutableClock();
        ProxySelector selector = selector(runner, clock);

        selector.selectBest(List.of(BenchmarkResult.succeeded(P1, 1000.0, 100.0)));
        assertEquals(P1, selector.ensureFresh(List.of(P1)).orElseThrow().record());
        selector.selectTopN(List.of(
                BenchmarkResult.succeeded(P2, 3000.0, 100.0),
                BenchmarkResult.succeeded(P3, 2000.0, 100.0)
        ), 2);
        assertEquals(List.of(P2, P3), records(selector.ensureFreshN(List.of(P2, P3), 2)));
        assertEquals(0, runner.calls);

        clock.advance(Duration.ofSeconds(300));
        assertTrue(selector.ensureFresh(List.of(P1)).isEmpty());
        assertEquals(1, runner.calls);
    }

    @Test
    void ensureFreshBenchmarksAgainAfterInterval() {
        StubRunner runner = new StubRunner(BenchmarkResult.succeeded(P1, 1000.0, 100.0));
        MutableClock clock = new MutableClock();
        ProxySelector selector = selector(runner, clock);

        selector.ensureFresh(List.of(P1));
        clock.advance(Duration.ofSeconds(300));
        selector.ensureFresh(List.of(P1));

        assertEquals(2, runner.calls);
    }

    @Test
    void ensureFreshBenchmarksWhenBestWasEvicted() {
        StubRunner runner = new StubRunner(BenchmarkResult.succeeded(P1, 1000.0, 100.0));
        ProxySelector selector = selector(runner, new MutableClock());

        selector.ensureFresh(List.of(P1));
        selector.reportFailure(P1);
        selector.ensureFresh(List.of(P1));

        assertEquals(2, runner.calls);
    }

    @Test
    void ensureFreshNServesCachedRankingUntilDrained() {
        StubRunner runner = new StubRunner(
                BenchmarkResult.succeeded(P1, 1000.0, 100.0),
                BenchmarkResult.succeeded(P2, 3000.0, 100.0),
                BenchmarkResult.succeeded(P3, 2000.0, 100.0)
        );
        ProxySelector selector = selector(runner, new MutableClock());
        List<ProxyRecord> records = List.of(P1, P2, P3);

        assertEquals(List.of(P2, P3), records(selector.ensureFreshN(records, 2)));
        assertEquals(List.of(P2, P3, P1), records(selector.ensureFreshN(records, 5)));
        assertEquals(1, runner.calls);

        selector.reportFailure(P2);
        selector.reportFailure(P3);
        selector.reportFailure(P1);
        assertEquals(List.of(P2, P3), records(selector.ensureFreshN(records, 2)));
        assertEquals(2, runner.calls);
    }

    @Test
    void emptyInputsYieldEmptySelections() {
        StubRunner runner = new StubRunner();
        ProxySelector selector = selector(runner, new MutableClock());

        assertTrue(selector.ensureFresh(List.of()).isEmpty());
        assertTrue(selector.ensureFreshN(List.of(), 5).isEmpty());
        assertTrue(selector.ensureFreshN(List.of(P1), 0).isEmpty());
        assertEquals(0, runner.calls);
    }

    @Test
    void failedBenchmarkLeavesCacheEmpty() {
        StubRunner runner = new StubRunner(BenchmarkResult.failed(P1, "HTTP error: 500"));
        List<SelectionEvent> events = new ArrayList<>();
        ProxySelector selector = new ProxySelector(selectionConfig(), runner, new MutableClock(), events::add);

        assertTrue(selector.ensureFreshN(List.of(P1), 3).isEmpty());
        assertFalse(selector.getCached().isPresent());
        assertEquals(SelectionEventType.REFRESHED, events.get(0).type());
        assertEquals(0, events.get(0).candidates());
    }

    @Test
    void invalidateForcesNextBenchmark() {
        StubRunner runner = new StubRunner(BenchmarkResult.succeeded(P1, 1000.0, 100.0));
        ProxySelector selector = selector(runner, new MutableClock());

        selector.ensureFresh(List.of(P1));
        selector.invalidate();
        assertTrue(selector.getCached().isEmpty());
        selector.ensureFresh(List.of(P1));

        assertEquals(2, runner.calls);
    }

    private static List<ProxyRecord> records(List<RankedCandidate> candidates) {
        List<ProxyRecord> records = new ArrayList<>();
        for (RankedCandidate candidate : candidates) {
            records.add(candidate.record());
        }
        return records;
    }

    private static ProxySelector selector(StubRunner runner, Clock clock) {
        return new ProxySelector(selectionConfig(), runner, clock, SelectionEventListener.NOOP);
    }

    private static TunnelConfig.SelectionConfig selectionConfig() {
        TunnelConfig.SelectionConfig config = new TunnelConfig.SelectionConfig();
        config.retestIntervalSeconds = 300;
        return config;
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

    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
