package net.spookly.i2ptunnel.selection;

/**
 * Audit event types emitted by the proxy selector.
 */
public enum SelectionEventType {
    SELECTED,
    EVICTED,
    REFRESHED
}
