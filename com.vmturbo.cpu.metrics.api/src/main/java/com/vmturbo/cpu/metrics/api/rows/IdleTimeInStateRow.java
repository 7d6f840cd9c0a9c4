package com.vmturbo.cpu.metrics.api.rows;

import java.util.Objects;
import java.util.Optional;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

/**
 * Idle residency of one state between two consecutive counter samples.
 */
public class IdleTimeInStateRow {

    private final long ts;
    private final Integer cpu;
    private final String stateName;
    private final double idlePercentage;
    private final double totalResidency;
    private final long timeSlice;

    /**
     * Create a new row.
     *
     * @param ts             timestamp of the later sample, in ns
     * @param cpu            CPU for per-CPU rows, null for rows aggregated over all CPUs
     * @param stateName      state name, e.g. "cpuidle.C8"
     * @param idlePercentage share of the time slice spent in the state, 0-100
     * @param totalResidency residency accrued during the slice, in counter units
     * @param timeSlice      length of the slice, in the unit of the residency counter
     */
    public IdleTimeInStateRow(final long ts, @Nullable final Integer cpu,
                              @Nonnull final String stateName, final double idlePercentage,
                              final double totalResidency, final long timeSlice) {
        this.ts = ts;
        this.cpu = cpu;
        this.stateName = Objects.requireNonNull(stateName);
        this.idlePercentage = idlePercentage;
        this.totalResidency = totalResidency;
        this.timeSlice = timeSlice;
    }

    public long getTs() {
        return ts;
    }

    @Nonnull
    public Optional<Integer> getCpu() {
        return Optional.ofNullable(cpu);
    }

    @Nonnull
    public String getStateName() {
        return stateName;
    }

    public double getIdlePercentage() {
        return idlePercentage;
    }

    public double getTotalResidency() {
        return totalResidency;
    }

    public long getTimeSlice() {
        return timeSlice;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IdleTimeInStateRow)) {
            return false;
        }
        final IdleTimeInStateRow that = (IdleTimeInStateRow)o;
        return ts == that.ts && timeSlice == that.timeSlice
                && Double.compare(idlePercentage, that.idlePercentage) == 0
                && Double.compare(totalResidency, that.totalResidency) == 0
                && Objects.equals(cpu, that.cpu) && stateName.equals(that.stateName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ts, cpu, stateName, idlePercentage, totalResidency, timeSlice);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("ts", ts)
                .add("cpu", cpu)
                .add("stateName", stateName)
                .add("idlePercentage", idlePercentage)
                .add("totalResidency", totalResidency)
                .add("timeSlice", timeSlice)
                .toString();
    }
}
