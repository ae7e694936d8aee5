package net.spookly.i2ptunnel.selection;

/**
 * Listener for selection audit events.
 */
@FunctionalInterface
public interface SelectionEventListener {
    SelectionEventListener NOOP = event -> {
    };

    void onEvent(SelectionEvent event);
}
