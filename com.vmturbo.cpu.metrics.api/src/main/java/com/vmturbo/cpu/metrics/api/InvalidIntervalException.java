package com.vmturbo.cpu.metrics.api;

/**
 * Thrown when a query interval or period is not positive or does not lie within the trace.
 * Intervals are never clamped.
 */
public class InvalidIntervalException extends CpuMetricsException {

    public InvalidIntervalException(String message) {
        super(message);
    }
}
