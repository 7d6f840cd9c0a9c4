package com.vmturbo.cpu.metrics.api;

/**
 * Thrown when an input stream violates its ordering or referential guarantees: timestamps
 * going backwards, items outside the trace bounds, decreasing cumulative counters, or
 * references to entities the trace does not know. The whole stream is rejected.
 */
public class MalformedStreamException extends CpuMetricsException {

    public MalformedStreamException(String message) {
        super(message);
    }
}
