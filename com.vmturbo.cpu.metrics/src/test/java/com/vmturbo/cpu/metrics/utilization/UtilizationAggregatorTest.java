package com.vmturbo.cpu.metrics.utilization;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertThat;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import com.vmturbo.cpu.metrics.api.InvalidIntervalException;
import com.vmturbo.cpu.metrics.api.RunningSlice;
import com.vmturbo.cpu.metrics.api.TraceBounds;
import com.vmturbo.cpu.metrics.api.rows.UtilizationRow;
import com.vmturbo.cpu.metrics.window.IntervalSplitter;
import com.vmturbo.cpu.metrics.window.ReportWindows;

/**
 * Unit tests for {@link UtilizationAggregator}.
 */
public class UtilizationAggregatorTest {

    private final UtilizationAggregator aggregator = new UtilizationAggregator(new IntervalSplitter());

    private final TraceBounds bounds = new TraceBounds(0, 1000);

    private final List<RunningSlice> slices = Arrays.asList(
            new RunningSlice(1, 0, 50, 250),
            new RunningSlice(0, 0, 250, 300),
            new RunningSlice(2, 0, 300, 310),
            new RunningSlice(1, 0, 900, RunningSlice.OPEN_END));

    /**
     * Runtime per bucket adds up to the total running time of the accepted slices.
     *
     * @throws InvalidIntervalException should not happen
     */
    @Test
    public void testRuntimeConservation() throws InvalidIntervalException {
        final ReportWindows windows = ReportWindows.tiling(bounds, 100);
        final long[] runtime = aggregator.runtimePerWindow(slices, slice -> slice.getUtid() != 0,
                windows, bounds.getEnd());
        assertArrayEquals(new long[]{50, 100, 50, 10, 0, 0, 0, 0, 0, 100}, runtime);
        assertThat(Arrays.stream(runtime).sum(), is(200L + 10L + 100L));
    }

    /**
     * Partial results are summed window by window.
     */
    @Test
    public void testMerge() {
        final long[] total = {1, 2, 3};
        aggregator.merge(total, new long[]{10, 0, 5});
        assertArrayEquals(new long[]{11, 2, 8}, total);
    }

    /**
     * Utilization is runtime over window width, normalized by the number of CPUs. Empty windows
     * and windows below the threshold have no row.
     *
     * @throws InvalidIntervalException should not happen
     */
    @Test
    public void testRows() throws InvalidIntervalException {
        final ReportWindows windows = ReportWindows.tiling(bounds, 100);
        final long[] runtime = {50, 100, 0, 10, 0, 0, 0, 0, 0, 0};
        final List<UtilizationRow> rows = aggregator.toRows(runtime, windows, 4, 0);
        assertThat(rows.size(), is(3));
        assertThat(rows.get(0).getTs(), is(0L));
        assertThat(rows.get(0).getRuntime(), is(50L));
        assertThat(rows.get(0).getUnnormalizedUtilization(), closeTo(0.5, 1e-9));
        assertThat(rows.get(0).getUtilization(), closeTo(0.125, 1e-9));
        assertThat(rows.get(2).getTs(), is(300L));

        final List<UtilizationRow> filtered = aggregator.toRows(runtime, windows, 4, 50);
        assertThat(filtered.size(), is(2));
        assertThat(filtered.get(1).getTs(), is(100L));
    }

    /**
     * Without CPUs nothing can be normalized.
     */
    @Test
    public void testNoCpus() {
        final ReportWindows windows = ReportWindows.wholeTrace(bounds);
        assertThat(aggregator.toRows(new long[]{10}, windows, 0, 0), is(empty()));
    }
}
