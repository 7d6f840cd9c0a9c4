package com.vmturbo.cpu.metrics.api.rows;

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * Idle episode statistics for one CPU and idle state, derived from idle edge events.
 */
public class IdleStatsRow {

    private final int cpu;
    private final long state;
    private final long count;
    private final long dur;
    private final long avgDur;
    private final double idlePercent;

    /**
     * Create a new row.
     *
     * @param cpu         CPU id
     * @param state       idle state, numbered from 1 (kernel idle index + 1)
     * @param count       number of completed episodes
     * @param dur         total time spent in the state, in ns
     * @param avgDur      mean episode length, in ns
     * @param idlePercent share of the observed time spent in the state, 0-100
     */
    public IdleStatsRow(final int cpu, final long state, final long count, final long dur,
                        final long avgDur, final double idlePercent) {
        this.cpu = cpu;
        this.state = state;
        this.count = count;
        this.dur = dur;
        this.avgDur = avgDur;
        this.idlePercent = idlePercent;
    }

    public int getCpu() {
        return cpu;
    }

    public long getState() {
        return state;
    }

    public long getCount() {
        return count;
    }

    public long getDur() {
        return dur;
    }

    public long getAvgDur() {
        return avgDur;
    }

    public double getIdlePercent() {
        return idlePercent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IdleStatsRow)) {
            return false;
        }
        final IdleStatsRow that = (IdleStatsRow)o;
        return cpu == that.cpu && state == that.state && count == that.count && dur == that.dur
                && avgDur == that.avgDur && Double.compare(idlePercent, that.idlePercent) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cpu, state, count, dur, avgDur, idlePercent);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("cpu", cpu)
                .add("state", state)
                .add("count", count)
                .add("dur", dur)
                .add("avgDur", avgDur)
                .add("idlePercent", idlePercent)
                .toString();
    }
}
