package net.spookly.i2ptunnel.overlay;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@code i2pd} as a child process with the plain HTTP proxy and a second HTTP proxy
 * tunnel (used for CONNECT) bound to the configured endpoints.
 */
public final class I2pdProcessRouter implements OverlayRouter {
    private static final Logger log = LoggerFactory.getLogger(I2pdProcessRouter.class);

    static final int OK = 0;
    static final int FAILED = 1;
    static final int START_TIMEOUT = 2;
    static final int INTERRUPTED = 3;

    private static final String TUNNELS_FILE = "tunnels.conf";
    private static final String LOG_FILE = "i2pd.log";
    private static final long POLL_INTERVAL_MS = 250;
    private static final int PROBE_TIMEOUT_MS = 500;
    private static final long STOP_GRACE_SECONDS = 10;

    private final String binary;
    private final OverlayEndpoints endpoints;
    private final long startupTimeoutMs;
    private Path dataDir;
    private Process process;

    public I2pdProcessRouter(String binary, OverlayEndpoints endpoints, long startupTimeoutMs) {
        this.binary = Objects.requireNonNull(binary, "binary");
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
        this.startupTimeoutMs = startupTimeoutMs;
    }

    @Override
    public synchronized int init(String configDir) {
        Path dir = Path.of(configDir == null || configDir.isBlank() ? "." : configDir);
        try {
            Files.createDirectories(dir);
            Files.writeString(dir.resolve(TUNNELS_FILE), tunnelsConf(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to prepare i2pd data directory {}: {}", dir, e.getMessage());
            return FAILED;
        }
        dataDir = dir;
        log.info("i2pd data directory ready at {}", dir.toAbsolutePath());
        return OK;
    }

    @Override
    public synchronized int start() {
        if (process != null && process.isAlive()) {
            return OK;
        }
        if (dataDir == null) {
            int code = init(".");
            if (code != OK) {
                return code;
            }
        }
        ProcessBuilder builder = new ProcessBuilder(command());
        builder.redirectErrorStream(true);
        builder.redirectOutput(ProcessBuilder.Redirect.appendTo(dataDir.resolve(LOG_FILE).toFile()));
        try {
            process = builder.start();
        } catch (IOException e) {
            log.error("Failed to launch {}: {}", binary, e.getMessage());
            return FAILED;
        }
        log.info("Started i2pd (pid {}), waiting for proxies on {} and {}",
                process.pid(), endpoints.httpProxy(), endpoints.httpsProxy());
        return awaitProxies();
    }

    @Override
    public synchronized int stop() {
        if (process == null) {
            return OK;
        }
        Process running = process;
        process = null;
        if (!running.isAlive()) {
            return OK;
        }
        running.destroy();
        try {
            if (!running.waitFor(STOP_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("i2pd did not exit within {}s, killing it", STOP_GRACE_SECONDS);
                running.destroyForcibly().waitFor(STOP_GRACE_SECONDS, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.destroyForcibly();
            return INTERRUPTED;
        }
        log.info("i2pd stopped");
        return OK;
    }

    @Override
    public synchronized void cleanup() {
        stop();
        dataDir = null;
    }

    @Override
    public synchronized boolean isRunning() {
        return process != null
                && process.isAlive()
                && PortProbe.isListening(endpoints.httpProxy(), PROBE_TIMEOUT_MS);
    }

    List<String> command() {
        List<String> command = new ArrayList<>();
        command.add(binary);
        command.add("--datadir=" + dataDir.toAbsolutePath());
        command.add("--tunconf=" + dataDir.resolve(TUNNELS_FILE).toAbsolutePath());
        command.add("--httpproxy.enabled=true");
        command.add("--httpproxy.address=" + endpoints.httpProxy().host());
        command.add("--httpproxy.port=" + endpoints.httpProxy().port());
        // the default SOCKS proxy also binds 4447
        command.add("--socksproxy.enabled=false");
        return command;
    }

    String tunnelsConf() {
        return "[https-proxy]\n"
                + "type = httpproxy\n"
                + "address = " + endpoints.httpsProxy().host() + "\n"
                + "port = " + endpoints.httpsProxy().port() + "\n"
                + "keys = https-proxy-keys.dat\n";
    }

    private int awaitProxies() {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(startupTimeoutMs);
        while (System.nanoTime() < deadline) {
            if (!process.isAlive()) {
                int exit = process.exitValue();
                log.error("i2pd exited during startup with code {}", exit);
                process = null;
                return exit == OK ? FAILED : exit;
            }
            if (PortProbe.isListening(endpoints.httpProxy(), PROBE_TIMEOUT_MS)
                    && PortProbe.isListening(endpoints.httpsProxy(), PROBE_TIMEOUT_MS)) {
                log.info("i2pd proxies are accepting connections");
                return OK;
            }
            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stop();
                return INTERRUPTED;
            }
        }
        log.error("i2pd proxies not reachable after {} ms", startupTimeoutMs);
        stop();
        return START_TIMEOUT;
    }
}
