package com.vmturbo.cpu.metrics.window;

import javax.annotation.Nonnull;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import com.vmturbo.cpu.metrics.api.InvalidIntervalException;
import com.vmturbo.cpu.metrics.api.TraceBounds;

/**
 * An ordered run of contiguous, equally wide report windows.
 *
 * <p>A tiling covers a whole trace with buckets aligned to multiples of the period. A single
 * caller interval is a run of one window. Windows are addressed by index, so locating the
 * windows touched by a segment is arithmetic rather than a search.</p>
 */
public class ReportWindows {

    private final long origin;
    private final long width;
    private final int count;

    private ReportWindows(final long origin, final long width, final int count) {
        this.origin = origin;
        this.width = width;
        this.count = count;
    }

    /**
     * Tile a trace into buckets of {@code period} ns. The first bucket starts at the trace start
     * rounded down to a multiple of the period; the last one contains the trace end. Every
     * bucket has the full period width.
     *
     * @param bounds trace bounds
     * @param period bucket width in ns
     * @return the tiling
     * @throws InvalidIntervalException if the period is not positive
     */
    @Nonnull
    public static ReportWindows tiling(@Nonnull final TraceBounds bounds, final long period)
            throws InvalidIntervalException {
        if (period <= 0) {
            throw new InvalidIntervalException("Report period must be positive, got " + period);
        }
        final long origin = Math.floorDiv(bounds.getStart(), period) * period;
        final long span = bounds.getEnd() - origin;
        final long buckets = span / period + (span % period == 0 ? 0 : 1);
        if (buckets > Integer.MAX_VALUE) {
            throw new InvalidIntervalException(String.format(
                    "Period %d splits trace %s into too many windows", period, bounds));
        }
        return new ReportWindows(origin, period, (int)buckets);
    }

    /**
     * A single caller-supplied window {@code [start, start + duration)}. The window must be
     * non-empty and lie inside the trace.
     *
     * @param bounds   trace bounds
     * @param start    window start in ns
     * @param duration window length in ns
     * @return the window
     * @throws InvalidIntervalException if the duration is not positive or the window is not
     *                                  contained in the trace
     */
    @Nonnull
    public static ReportWindows interval(@Nonnull final TraceBounds bounds, final long start,
                                         final long duration) throws InvalidIntervalException {
        if (duration <= 0) {
            throw new InvalidIntervalException("Interval duration must be positive, got " + duration);
        }
        if (start < bounds.getStart() || start > bounds.getEnd() - duration) {
            throw new InvalidIntervalException(String.format(
                    "Interval [%d, +%d) is not within trace bounds %s", start, duration, bounds));
        }
        return new ReportWindows(start, duration, 1);
    }

    /**
     * One window spanning the whole trace. Empty if the trace has zero duration.
     *
     * @param bounds trace bounds
     * @return the window run
     */
    @Nonnull
    public static ReportWindows wholeTrace(@Nonnull final TraceBounds bounds) {
        return new ReportWindows(bounds.getStart(), bounds.getDuration(),
                bounds.getDuration() > 0 ? 1 : 0);
    }

    public int size() {
        return count;
    }

    public long getWidth() {
        return width;
    }

    public long getStart() {
        return origin;
    }

    public long getEnd() {
        return origin + width * count;
    }

    /**
     * Get a window by index.
     *
     * @param index window index, {@code 0 <= index < size()}
     * @return the window
     */
    @Nonnull
    public ReportWindow get(final int index) {
        Preconditions.checkElementIndex(index, count);
        final long start = origin + width * index;
        return new ReportWindow(start, start + width);
    }

    /**
     * Index of the window containing a timestamp, clamped into {@code [0, size())}.
     *
     * @param ts timestamp in ns
     * @return window index
     */
    int indexOf(final long ts) {
        final long index = Math.floorDiv(ts - origin, width);
        return (int)Math.max(0, Math.min(count - 1, index));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("origin", origin)
                .add("width", width)
                .add("count", count)
                .toString();
    }
}
