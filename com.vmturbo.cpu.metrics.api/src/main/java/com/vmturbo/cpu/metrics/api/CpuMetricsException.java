package com.vmturbo.cpu.metrics.api;

/**
 * Checked exception indicating that CPU metrics could not be derived from a trace.
 */
public class CpuMetricsException extends Exception {

    public CpuMetricsException(String message) {
        super(message);
    }

    public CpuMetricsException(String message, Throwable cause) {
        super(message, cause);
    }
}
