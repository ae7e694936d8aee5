package net.spookly.i2ptunnel.selection;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;
import net.spookly.i2ptunnel.discovery.ProxyRecord;

/**
 * Snapshot of a selection cache change for audit logging.
 */
@Value
@Accessors(fluent = true)
public class SelectionEvent {
    SelectionEventType type;
    Instant timestamp;
    /**
     * Proxy the event is about; for REFRESHED the new best, or null when nothing succeeded.
     */
    String proxy;
    Double throughput;
    Integer candidates;

    static SelectionEvent selected(RankedCandidate best, int candidates, Instant timestamp) {
        return new SelectionEvent(SelectionEventType.SELECTED, timestamp,
                best.record().url(), best.throughput(), candidates);
    }

    static SelectionEvent evicted(ProxyRecord record, int remaining, Instant timestamp) {
        return new SelectionEvent(SelectionEventType.EVICTED, timestamp, record.url(), null, remaining);
    }

    static SelectionEvent refreshed(RankedCandidate best, int candidates, Instant timestamp) {
        return new SelectionEvent(SelectionEventType.REFRESHED, timestamp,
                best == null ? null : best.record().url(),
                best == null ? null : best.throughput(),
                candidates);
    }
}
