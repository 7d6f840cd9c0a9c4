package com.vmturbo.cpu.metrics.api;

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * A scheduling slice: a thread running on a CPU from {@code start} until {@code end}.
 */
public class RunningSlice {

    /**
     * End marker for a slice that was still running when the trace ended.
     */
    public static final long OPEN_END = -1L;

    private final long utid;
    private final int cpu;
    private final long start;
    private final long end;

    /**
     * Create a new slice.
     *
     * @param utid  unique thread id
     * @param cpu   CPU the thread ran on
     * @param start start timestamp in ns
     * @param end   end timestamp in ns, or {@link #OPEN_END}
     */
    public RunningSlice(final long utid, final int cpu, final long start, final long end) {
        this.utid = utid;
        this.cpu = cpu;
        this.start = start;
        this.end = end;
    }

    public long getUtid() {
        return utid;
    }

    public int getCpu() {
        return cpu;
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    public boolean isOpen() {
        return end == OPEN_END;
    }

    /**
     * The end of this slice, with an open end resolved against the trace end.
     *
     * @param traceEnd end of the trace
     * @return the effective end timestamp
     */
    public long resolveEnd(final long traceEnd) {
        return isOpen() ? traceEnd : end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RunningSlice)) {
            return false;
        }
        final RunningSlice that = (RunningSlice)o;
        return utid == that.utid && cpu == that.cpu && start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(utid, cpu, start, end);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("utid", utid)
                .add("cpu", cpu)
                .add("start", start)
                .add("end", isOpen() ? "open" : end)
                .toString();
    }
}
