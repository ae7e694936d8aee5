package net.spookly.i2ptunnel.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.Yaml;

public final class ConfigLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private ConfigLoader() {
    }

    /**
     * Load and validate the tunnel YAML configuration.
     */
    public static TunnelConfig load(Path path) {
        if (path == null) {
            throw new ConfigException("Config path is required");
        }
        if (!Files.exists(path)) {
            writeDefaultConfig(path);
            throw new ConfigException("Config file did not exist, generated default at: " + path);
        }
        Object raw;
        Yaml yaml = new Yaml();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            raw = yaml.load(reader);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config: " + path, e);
        }
        if (raw == null) {
            throw new ConfigException("Config file is empty: " + path);
        }
        TunnelConfig config;
        try {
            config = MAPPER.convertValue(EnvExpander.expand(raw), TunnelConfig.class);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Failed to parse config: " + path, e);
        }
        applyDefaults(config);
        resolveConfigDir(config, path.toAbsolutePath().getParent());
        ConfigValidator.validate(config);
        return config;
    }

    /**
     * Fill sections and values left out of the file with the built-in defaults.
     */
    static void applyDefaults(TunnelConfig config) {
        TunnelConfig defaults = TunnelConfig.defaults();
        if (config.overlay == null) {
            config.overlay = defaults.overlay;
        } else {
            TunnelConfig.OverlayConfig overlay = config.overlay;
            overlay.configDir = orDefault(overlay.configDir, defaults.overlay.configDir);
            overlay.httpProxy = orDefault(overlay.httpProxy, defaults.overlay.httpProxy);
            overlay.httpsProxy = orDefault(overlay.httpsProxy, defaults.overlay.httpsProxy);
            if (overlay.domainSuffixes == null || overlay.domainSuffixes.isEmpty()) {
                overlay.domainSuffixes = defaults.overlay.domainSuffixes;
            }
            overlay.startupTimeoutMs = orDefault(overlay.startupTimeoutMs, defaults.overlay.startupTimeoutMs);
        }
        if (config.discovery == null) {
            config.discovery = defaults.discovery;
        } else {
            config.discovery.directoryUrl = orDefault(config.discovery.directoryUrl, defaults.discovery.directoryUrl);
            config.discovery.timeoutMs = orDefault(config.discovery.timeoutMs, defaults.discovery.timeoutMs);
        }
        if (config.benchmark == null) {
            config.benchmark = defaults.benchmark;
        } else {
            TunnelConfig.BenchmarkConfig benchmark = config.benchmark;
            benchmark.testUrl = orDefault(benchmark.testUrl, defaults.benchmark.testUrl);
            benchmark.payloadBytes = orDefault(benchmark.payloadBytes, defaults.benchmark.payloadBytes);
            benchmark.timeoutMs = orDefault(benchmark.timeoutMs, defaults.benchmark.timeoutMs);
            benchmark.maxConcurrency = orDefault(benchmark.maxConcurrency, defaults.benchmark.maxConcurrency);
            benchmark.placeholderThroughput = orDefault(benchmark.placeholderThroughput,
                    defaults.benchmark.placeholderThroughput);
            benchmark.placeholderLatencyMs = orDefault(benchmark.placeholderLatencyMs,
                    defaults.benchmark.placeholderLatencyMs);
        }
        if (config.selection == null) {
            config.selection = defaults.selection;
        } else {
            config.selection.retestIntervalSeconds = orDefault(config.selection.retestIntervalSeconds,
                    defaults.selection.retestIntervalSeconds);
        }
        if (config.routing == null) {
            config.routing = defaults.routing;
        } else {
            config.routing.candidateCount = orDefault(config.routing.candidateCount, defaults.routing.candidateCount);
            config.routing.timeoutMs = orDefault(config.routing.timeoutMs, defaults.routing.timeoutMs);
        }
    }

    private static void writeDefaultConfig(Path path) {
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(
                    path,
                    ConfigDefaults.defaultYaml(),
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW
            );
        } catch (IOException e) {
            throw new ConfigException("Failed to write default config: " + path, e);
        }
    }

    private static void resolveConfigDir(TunnelConfig config, Path baseDir) {
        String configDir = config.overlay.configDir;
        if (baseDir == null || configDir == null || configDir.isBlank()) {
            return;
        }
        Path dir = Path.of(configDir);
        if (!dir.isAbsolute()) {
            config.overlay.configDir = baseDir.resolve(dir).normalize().toString();
        }
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
