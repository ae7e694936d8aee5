package net.spookly.i2ptunnel.benchmark;

import java.util.List;

import net.spookly.i2ptunnel.discovery.ProxyRecord;

/**
 * Scores a batch of proxies; one result per record, in no particular order.
 */
public interface BenchmarkRunner {
    List<BenchmarkResult> probeMany(List<ProxyRecord> records);
}
