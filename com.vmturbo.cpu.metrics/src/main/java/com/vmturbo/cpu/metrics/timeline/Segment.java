package com.vmturbo.cpu.metrics.timeline;

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * A maximal {@code [start, end)} range over which a monitored CPU value is constant.
 */
public class Segment {

    private final long start;
    private final long end;
    private final long value;
    private final boolean closed;

    /**
     * Create a new segment.
     *
     * @param start  start timestamp in ns, inclusive
     * @param end    end timestamp in ns, exclusive
     * @param value  the value in effect
     * @param closed true if a following event ended the segment, false if it runs to the end of
     *               the trace
     */
    public Segment(final long start, final long end, final long value, final boolean closed) {
        this.start = start;
        this.end = end;
        this.value = value;
        this.closed = closed;
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    public long getValue() {
        return value;
    }

    public boolean isClosed() {
        return closed;
    }

    public long getDuration() {
        return end - start;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Segment)) {
            return false;
        }
        final Segment that = (Segment)o;
        return start == that.start && end == that.end && value == that.value
                && closed == that.closed;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, value, closed);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("start", start)
                .add("end", end)
                .add("value", value)
                .add("closed", closed)
                .toString();
    }
}
