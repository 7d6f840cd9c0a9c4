package com.vmturbo.cpu.metrics.utilization;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

import javax.annotation.Nonnull;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmturbo.cpu.metrics.api.RunningSlice;
import com.vmturbo.cpu.metrics.api.rows.UtilizationRow;
import com.vmturbo.cpu.metrics.window.IntervalSplitter;
import com.vmturbo.cpu.metrics.window.ReportWindows;

/**
 * Accumulates running time per report window and turns it into utilization rows.
 *
 * <p>Accumulation happens per CPU into a {@code long[]} indexed by window; the arrays of all
 * CPUs are summed afterwards, which is order independent.</p>
 */
public class UtilizationAggregator {

    private static final Logger logger = LogManager.getLogger();

    private final IntervalSplitter splitter;

    /**
     * Create a new aggregator.
     *
     * @param splitter splits slices across windows
     */
    public UtilizationAggregator(@Nonnull final IntervalSplitter splitter) {
        this.splitter = Objects.requireNonNull(splitter);
    }

    /**
     * Sum the running time of the accepted slices of one CPU per window.
     *
     * @param slices   slices of one CPU
     * @param running  decides which slices count as running time
     * @param windows  report windows
     * @param traceEnd end of the trace, for slices still open
     * @return runtime in ns per window index
     */
    @Nonnull
    public long[] runtimePerWindow(@Nonnull final List<RunningSlice> slices,
                                   @Nonnull final Predicate<RunningSlice> running,
                                   @Nonnull final ReportWindows windows,
                                   final long traceEnd) {
        final long[] runtime = new long[windows.size()];
        for (RunningSlice slice : slices) {
            if (running.test(slice)) {
                splitter.split(slice.getStart(), slice.resolveEnd(traceEnd), windows,
                        (index, from, to) -> runtime[index] += to - from);
            }
        }
        return runtime;
    }

    /**
     * Add per-window runtimes of one partition into a running total.
     *
     * @param total   accumulated runtimes, updated in place
     * @param partial runtimes of one partition
     */
    public void merge(@Nonnull final long[] total, @Nonnull final long[] partial) {
        for (int i = 0; i < total.length; i++) {
            total[i] += partial[i];
        }
    }

    /**
     * Convert per-window runtime into utilization rows. Windows whose runtime is zero or below
     * {@code minRuntime} produce no row.
     *
     * @param runtime    runtime in ns per window index
     * @param windows    the report windows
     * @param cpuCount   number of CPUs to normalize by
     * @param minRuntime smallest runtime, in ns, a window needs to be reported
     * @return rows in window order
     */
    @Nonnull
    public List<UtilizationRow> toRows(@Nonnull final long[] runtime,
                                       @Nonnull final ReportWindows windows,
                                       final int cpuCount, final long minRuntime) {
        final List<UtilizationRow> rows = new ArrayList<>();
        final long width = windows.getWidth();
        if (width <= 0 || cpuCount <= 0) {
            logger.debug("No utilization rows for window width {} and {} cpus", width, cpuCount);
            return rows;
        }
        for (int i = 0; i < runtime.length; i++) {
            if (runtime[i] == 0 || runtime[i] < minRuntime) {
                continue;
            }
            final double unnormalized = (double)runtime[i] / width;
            rows.add(new UtilizationRow(windows.get(i).getStart(), runtime[i],
                    unnormalized / cpuCount, unnormalized));
        }
        return rows;
    }
}
