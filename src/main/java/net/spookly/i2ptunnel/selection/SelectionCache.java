package net.spookly.i2ptunnel.selection;

import java.time.Instant;
import java.util.List;

/**
 * Mutable selection state. Only {@link ProxySelector} touches it, and only under its lock.
 */
final class SelectionCache {
    RankedCandidate best;
    /**
     * Immutable snapshot, replaced on every change.
     */
    List<RankedCandidate> ranked = List.of();
    Instant lastBenchmark;

    void clear() {
        best = null;
        ranked = List.of();
        lastBenchmark = null;
    }
}
