package net.spookly.i2ptunnel.overlay;

/**
 * Lifecycle adapter around the external overlay router. Every operation returns 0 on success
 * and a non-zero code on failure.
 */
public interface OverlayRouter {
    int init(String configDir);

    int start();

    int stop();

    /**
     * Release everything acquired by {@link #init(String)}. Safe to call more than once.
     */
    void cleanup();

    boolean isRunning();
}
