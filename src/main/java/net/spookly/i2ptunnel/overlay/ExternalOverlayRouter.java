package net.spookly.i2ptunnel.overlay;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Router managed outside this process; start only waits for its HTTP proxy to accept connections.
 */
public final class ExternalOverlayRouter implements OverlayRouter {
    private static final Logger log = LoggerFactory.getLogger(ExternalOverlayRouter.class);
    private static final long POLL_INTERVAL_MS = 250;
    private static final int PROBE_TIMEOUT_MS = 500;

    private final OverlayEndpoints endpoints;
    private final long startupTimeoutMs;

    public ExternalOverlayRouter(OverlayEndpoints endpoints, long startupTimeoutMs) {
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
        this.startupTimeoutMs = startupTimeoutMs;
    }

    @Override
    public int init(String configDir) {
        return 0;
    }

    @Override
    public int start() {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(startupTimeoutMs);
        do {
            if (isRunning()) {
                return 0;
            }
            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return 1;
            }
        } while (System.nanoTime() < deadline);
        log.error("External overlay router proxy {} is not reachable", endpoints.httpProxy());
        return 1;
    }

    @Override
    public int stop() {
        return 0;
    }

    @Override
    public void cleanup() {
    }

    @Override
    public boolean isRunning() {
        return PortProbe.isListening(endpoints.httpProxy(), PROBE_TIMEOUT_MS);
    }
}
