package net.spookly.i2ptunnel.selection;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;
import net.spookly.i2ptunnel.discovery.ProxyRecord;

/**
 * A proxy chosen by selection, with the throughput it was ranked by.
 */
@Value
@Accessors(fluent = true)
public class RankedCandidate {
    ProxyRecord record;
    double throughput;
    Instant selectedAt;
}
