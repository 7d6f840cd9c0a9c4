package com.vmturbo.cpu.metrics.window;

import javax.annotation.Nonnull;

/**
 * Splits time ranges across report windows. Every statistic of the engine is built from the
 * contributions produced here, in integer nanoseconds.
 */
public class IntervalSplitter {

    /**
     * Receives the non-empty overlap of a range with one window.
     */
    @FunctionalInterface
    public interface OverlapConsumer {

        /**
         * Accept one overlap.
         *
         * @param windowIndex index of the window
         * @param start       overlap start, inclusive
         * @param end         overlap end, exclusive; always greater than {@code start}
         */
        void accept(int windowIndex, long start, long end);
    }

    /**
     * Report the overlap of {@code [start, end)} with every window it intersects, in window
     * order. Empty overlaps are not reported.
     *
     * @param start    range start
     * @param end      range end
     * @param windows  the windows
     * @param consumer receiver of overlaps
     */
    public void split(final long start, final long end, @Nonnull final ReportWindows windows,
                      @Nonnull final OverlapConsumer consumer) {
        if (end <= start || windows.size() == 0
                || end <= windows.getStart() || start >= windows.getEnd()) {
            return;
        }
        final int first = windows.indexOf(start);
        final int last = windows.indexOf(end - 1);
        for (int i = first; i <= last; i++) {
            final long windowStart = windows.getStart() + windows.getWidth() * i;
            final long from = Math.max(start, windowStart);
            final long to = Math.min(end, windowStart + windows.getWidth());
            if (to > from) {
                consumer.accept(i, from, to);
            }
        }
    }
}
