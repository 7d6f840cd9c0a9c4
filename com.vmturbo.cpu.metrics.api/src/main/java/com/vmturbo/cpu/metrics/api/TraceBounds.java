package com.vmturbo.cpu.metrics.api;

import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * The {@code [start, end)} time range, in nanoseconds, covered by a decoded trace.
 *
 * <p>These are the two scalars the decoding collaborator reports as trace start and trace
 * end. They are passed explicitly to every computation rather than read from ambient
 * state.</p>
 */
public class TraceBounds {

    private final long start;
    private final long end;

    /**
     * Create new trace bounds.
     *
     * @param start first timestamp of the trace, in ns
     * @param end   end of the trace, in ns; must not precede {@code start}
     */
    public TraceBounds(final long start, final long end) {
        Preconditions.checkArgument(end >= start,
                "Trace end %s precedes trace start %s", end, start);
        this.start = start;
        this.end = end;
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    public long getDuration() {
        return end - start;
    }

    /**
     * Check whether a timestamp falls within the trace, end inclusive.
     *
     * @param timestamp timestamp in ns
     * @return true if {@code start <= timestamp <= end}
     */
    public boolean contains(final long timestamp) {
        return timestamp >= start && timestamp <= end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TraceBounds)) {
            return false;
        }
        final TraceBounds that = (TraceBounds)o;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("start", start)
                .add("end", end)
                .toString();
    }
}
