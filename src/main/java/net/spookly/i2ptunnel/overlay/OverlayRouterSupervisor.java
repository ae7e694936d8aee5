package net.spookly.i2ptunnel.overlay;

import java.util.Objects;

import net.spookly.i2ptunnel.config.TunnelConfig;
import net.spookly.i2ptunnel.routing.RouterInitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the overlay router lifecycle and starts it lazily before the first overlay request.
 */
public final class OverlayRouterSupervisor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OverlayRouterSupervisor.class);

    private final OverlayRouter router;
    private final String configDir;
    private boolean initialized;

    public OverlayRouterSupervisor(OverlayRouter router, String configDir) {
        this.router = Objects.requireNonNull(router, "router");
        this.configDir = configDir;
    }

    /**
     * Pick the process-backed router when a binary is configured, otherwise expect an external one.
     */
    public static OverlayRouterSupervisor fromConfig(TunnelConfig.OverlayConfig overlay) {
        OverlayEndpoints endpoints = OverlayEndpoints.fromConfig(overlay);
        long startupTimeoutMs = overlay.startupTimeoutMs == null ? 0 : overlay.startupTimeoutMs;
        OverlayRouter router = overlay.binary == null
                ? new ExternalOverlayRouter(endpoints, startupTimeoutMs)
                : new I2pdProcessRouter(overlay.binary, endpoints, startupTimeoutMs);
        return new OverlayRouterSupervisor(router, overlay.configDir);
    }

    /**
     * Initialise and start the router if needed. Failures are not retried here.
     */
    public synchronized void ensureRunning() throws RouterInitException {
        if (!initialized) {
            int code = router.init(configDir);
            if (code != 0) {
                log.error("Overlay router init failed with code {}", code);
                throw new RouterInitException("init", code);
            }
            initialized = true;
        }
        if (router.isRunning()) {
            return;
        }
        int code = router.start();
        if (code != 0) {
            log.error("Overlay router start failed with code {}", code);
            throw new RouterInitException("start", code);
        }
        log.info("Overlay router running");
    }

    public synchronized boolean isRunning() {
        return initialized && router.isRunning();
    }

    /**
     * Stop the router and release its resources; a later ensureRunning initialises again.
     */
    public synchronized void shutdown() {
        if (!initialized) {
            return;
        }
        int code = router.stop();
        if (code != 0) {
            log.warn("Overlay router stop returned code {}", code);
        }
        router.cleanup();
        initialized = false;
    }

    @Override
    public void close() {
        shutdown();
    }
}
