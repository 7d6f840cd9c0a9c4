package com.vmturbo.cpu.metrics.idle;

import java.util.Objects;

import javax.annotation.Nonnull;

import com.google.common.base.MoreObjects;

/**
 * The residency one CPU accrued in one state between two consecutive counter samples.
 */
public class ResidencyDelta {

    private final long ts;
    private final int cpu;
    private final String stateName;
    private final long delta;
    private final long timeSlice;

    /**
     * Create a new delta.
     *
     * @param ts        timestamp of the later sample, in ns
     * @param cpu       the CPU
     * @param stateName raw state name, e.g. "C8"
     * @param delta     counter increase between the samples
     * @param timeSlice time between the samples, in the counter unit
     */
    public ResidencyDelta(final long ts, final int cpu, @Nonnull final String stateName,
                          final long delta, final long timeSlice) {
        this.ts = ts;
        this.cpu = cpu;
        this.stateName = Objects.requireNonNull(stateName);
        this.delta = delta;
        this.timeSlice = timeSlice;
    }

    public long getTs() {
        return ts;
    }

    public int getCpu() {
        return cpu;
    }

    @Nonnull
    public String getStateName() {
        return stateName;
    }

    public long getDelta() {
        return delta;
    }

    public long getTimeSlice() {
        return timeSlice;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResidencyDelta)) {
            return false;
        }
        final ResidencyDelta that = (ResidencyDelta)o;
        return ts == that.ts && cpu == that.cpu && delta == that.delta
                && timeSlice == that.timeSlice && stateName.equals(that.stateName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ts, cpu, stateName, delta, timeSlice);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("ts", ts)
                .add("cpu", cpu)
                .add("stateName", stateName)
                .add("delta", delta)
                .add("timeSlice", timeSlice)
                .toString();
    }
}
