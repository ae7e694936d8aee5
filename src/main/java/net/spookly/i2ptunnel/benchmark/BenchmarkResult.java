package net.spookly.i2ptunnel.benchmark;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.i2ptunnel.discovery.ProxyRecord;

/**
 * Outcome of probing one proxy. Throughput is bytes per second and zero for failures.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class BenchmarkResult {
    private final ProxyRecord record;
    private final boolean success;
    private final double throughput;
    private final double latencyMs;
    @Getter(AccessLevel.NONE)
    private final String failureReason;

    public static BenchmarkResult succeeded(ProxyRecord record, double throughput, double latencyMs) {
        return new BenchmarkResult(Objects.requireNonNull(record, "record"), true, throughput, latencyMs, null);
    }

    public static BenchmarkResult failed(ProxyRecord record, String reason) {
        return new BenchmarkResult(Objects.requireNonNull(record, "record"), false, 0.0, 0.0,
                reason == null ? "unknown failure" : reason);
    }

    public Optional<String> failureReason() {
        return Optional.ofNullable(failureReason);
    }

    @Override
    public String toString() {
        if (success) {
            return String.format(Locale.ROOT, "%s %.1f B/s %.0f ms", record, throughput, latencyMs);
        }
        return record + " failed: " + failureReason;
    }
}
