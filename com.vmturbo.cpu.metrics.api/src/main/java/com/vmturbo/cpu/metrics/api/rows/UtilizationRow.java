package com.vmturbo.cpu.metrics.api.rows;

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * CPU utilization over one report window.
 */
public class UtilizationRow {

    private final long ts;
    private final long runtime;
    private final double utilization;
    private final double unnormalizedUtilization;

    /**
     * Create a new row.
     *
     * @param ts                      start of the report window, in ns
     * @param runtime                 running time inside the window, in ns
     * @param utilization             running time per window length per CPU
     * @param unnormalizedUtilization running time per window length, summed over CPUs
     */
    public UtilizationRow(final long ts, final long runtime, final double utilization,
                          final double unnormalizedUtilization) {
        this.ts = ts;
        this.runtime = runtime;
        this.utilization = utilization;
        this.unnormalizedUtilization = unnormalizedUtilization;
    }

    public long getTs() {
        return ts;
    }

    public long getRuntime() {
        return runtime;
    }

    public double getUtilization() {
        return utilization;
    }

    public double getUnnormalizedUtilization() {
        return unnormalizedUtilization;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UtilizationRow)) {
            return false;
        }
        final UtilizationRow that = (UtilizationRow)o;
        return ts == that.ts && runtime == that.runtime
                && Double.compare(utilization, that.utilization) == 0
                && Double.compare(unnormalizedUtilization, that.unnormalizedUtilization) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(ts, runtime, utilization, unnormalizedUtilization);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("ts", ts)
                .add("runtime", runtime)
                .add("utilization", utilization)
                .add("unnormalizedUtilization", unnormalizedUtilization)
                .toString();
    }
}
