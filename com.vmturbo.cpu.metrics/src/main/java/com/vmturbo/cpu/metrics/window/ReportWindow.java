package com.vmturbo.cpu.metrics.window;

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * A {@code [start, end)} range that one output row aggregates over.
 */
public class ReportWindow {

    private final long start;
    private final long end;

    /**
     * Create a new window.
     *
     * @param start inclusive start, in ns
     * @param end   exclusive end, in ns
     */
    public ReportWindow(final long start, final long end) {
        this.start = start;
        this.end = end;
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    public long getWidth() {
        return end - start;
    }

    /**
     * Length of the intersection of {@code [from, to)} with this window.
     *
     * @param from range start
     * @param to   range end
     * @return overlap in ns, 0 if the ranges do not intersect
     */
    public long overlap(final long from, final long to) {
        return Math.max(0, Math.min(to, end) - Math.max(from, start));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReportWindow)) {
            return false;
        }
        final ReportWindow that = (ReportWindow)o;
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
