package com.vmturbo.cpu.metrics.api.rows;

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * Total time a CPU spent at one counter value (a frequency or an idle state).
 */
public class CounterDurationRow {

    private final int cpu;
    private final long value;
    private final long dur;

    /**
     * Create a new row.
     *
     * @param cpu   CPU id
     * @param value frequency in kHz, or normalized idle index (-1 for active)
     * @param dur   total time at that value, in ns
     */
    public CounterDurationRow(final int cpu, final long value, final long dur) {
        this.cpu = cpu;
        this.value = value;
        this.dur = dur;
    }

    public int getCpu() {
        return cpu;
    }

    public long getValue() {
        return value;
    }

    public long getDur() {
        return dur;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CounterDurationRow)) {
            return false;
        }
        final CounterDurationRow that = (CounterDurationRow)o;
        return cpu == that.cpu && value == that.value && dur == that.dur;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cpu, value, dur);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("cpu", cpu)
                .add("value", value)
                .add("dur", dur)
                .toString();
    }
}
