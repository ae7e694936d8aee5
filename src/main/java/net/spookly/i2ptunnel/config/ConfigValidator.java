package net.spookly.i2ptunnel.config;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import net.spookly.i2ptunnel.util.HostPort;

public final class ConfigValidator {
    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException listing every violation.
     */
    public static void validate(TunnelConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateOverlay(config, errors);
        validateDiscovery(config, errors);
        validateBenchmark(config, errors);
        validateSelection(config, errors);
        validateRouting(config, errors);
        validateTimeoutOrdering(config, errors);

        throwIfErrors(errors);
    }

    private static void validateOverlay(TunnelConfig config, List<String> errors) {
        TunnelConfig.OverlayConfig overlay = config.overlay;
        if (overlay == null) {
            errors.add("overlay section is required");
            return;
        }
        requireEndpoint(errors, overlay.httpProxy, "overlay.httpProxy");
        requireEndpoint(errors, overlay.httpsProxy, "overlay.httpsProxy");
        if (overlay.domainSuffixes == null || overlay.domainSuffixes.isEmpty()) {
            errors.add("overlay.domainSuffixes must include at least one suffix");
        } else {
            for (String suffix : overlay.domainSuffixes) {
                if (isBlank(suffix)) {
                    errors.add("overlay.domainSuffixes must not include blank entries");
                }
            }
        }
        if (overlay.binary != null && overlay.binary.isBlank()) {
            errors.add("overlay.binary must not be blank when set");
        }
        requirePositive(errors, overlay.startupTimeoutMs, "overlay.startupTimeoutMs");
    }

    private static void validateDiscovery(TunnelConfig config, List<String> errors) {
        TunnelConfig.DiscoveryConfig discovery = config.discovery;
        if (discovery == null) {
            errors.add("discovery section is required");
            return;
        }
        requireHttpUrl(errors, discovery.directoryUrl, "discovery.directoryUrl");
        requirePositive(errors, discovery.timeoutMs, "discovery.timeoutMs");
    }

    private static void validateBenchmark(TunnelConfig config, List<String> errors) {
        TunnelConfig.BenchmarkConfig benchmark = config.benchmark;
        if (benchmark == null) {
            errors.add("benchmark section is required");
            return;
        }
        requireHttpUrl(errors, benchmark.testUrl, "benchmark.testUrl");
        requirePositive(errors, benchmark.payloadBytes, "benchmark.payloadBytes");
        requirePositive(errors, benchmark.timeoutMs, "benchmark.timeoutMs");
        requirePositive(errors, benchmark.maxConcurrency, "benchmark.maxConcurrency");
        if (benchmark.placeholderThroughput != null && !(benchmark.placeholderThroughput > 0)) {
            errors.add("benchmark.placeholderThroughput must be greater than 0");
        }
        if (benchmark.placeholderLatencyMs != null && benchmark.placeholderLatencyMs < 0) {
            errors.add("benchmark.placeholderLatencyMs must not be negative");
        }
    }

    private static void validateSelection(TunnelConfig config, List<String> errors) {
        TunnelConfig.SelectionConfig selection = config.selection;
        if (selection == null) {
            errors.add("selection section is required");
            return;
        }
        if (selection.retestIntervalSeconds != null && selection.retestIntervalSeconds < 0) {
            errors.add("selection.retestIntervalSeconds must not be negative");
        }
    }

    private static void validateRouting(TunnelConfig config, List<String> errors) {
        TunnelConfig.RoutingConfig routing = config.routing;
        if (routing == null) {
            errors.add("routing section is required");
            return;
        }
        requirePositive(errors, routing.candidateCount, "routing.candidateCount");
        requirePositive(errors, routing.timeoutMs, "routing.timeoutMs");
    }

    private static void validateTimeoutOrdering(TunnelConfig config, List<String> errors) {
        if (config.benchmark == null || config.routing == null) {
            return;
        }
        Integer probeTimeout = config.benchmark.timeoutMs;
        Integer routeTimeout = config.routing.timeoutMs;
        if (probeTimeout != null && routeTimeout != null && probeTimeout > 0 && probeTimeout >= routeTimeout) {
            errors.add("benchmark.timeoutMs must be shorter than routing.timeoutMs");
        }
    }

    private static void requireEndpoint(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
            return;
        }
        try {
            HostPort.parse(value);
        } catch (IllegalArgumentException e) {
            errors.add(field + " is invalid: " + e.getMessage());
        }
    }

    private static void requireHttpUrl(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
            return;
        }
        try {
            URI uri = URI.create(value.trim());
            String scheme = uri.getScheme();
            if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                errors.add(field + " must be an absolute http(s) URL");
            }
        } catch (IllegalArgumentException e) {
            errors.add(field + " is not a valid URL: " + value);
        }
    }

    private static void requirePositive(List<String> errors, Integer value, String field) {
        if (value != null && value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            throw new ConfigException("Invalid config:\n - " + String.join("\n - ", errors));
        }
    }
}
