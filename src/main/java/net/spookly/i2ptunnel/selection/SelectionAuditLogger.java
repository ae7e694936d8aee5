package net.spookly.i2ptunnel.selection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default selection audit logger that emits one key=value line per event.
 */
public final class SelectionAuditLogger implements SelectionEventListener {
    public static final SelectionAuditLogger INSTANCE = new SelectionAuditLogger();

    private static final Logger log = LoggerFactory.getLogger(SelectionAuditLogger.class);

    private SelectionAuditLogger() {
    }

    @Override
    public void onEvent(SelectionEvent event) {
        log.info(format(event));
    }

    static String format(SelectionEvent event) {
        StringBuilder builder = new StringBuilder("selection_event");
        append(builder, "type", event.type());
        append(builder, "proxy", event.proxy());
        append(builder, "throughput", event.throughput());
        append(builder, "candidates", event.candidates());
        append(builder, "timestamp", event.timestamp());
        return builder.toString();
    }

    private static void append(StringBuilder builder, String key, Object value) {
        if (value == null) {
            return;
        }
        builder.append(' ').append(key).append('=').append(value);
    }
}
