package com.vmturbo.cpu.metrics.window;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

import org.junit.Test;

import com.vmturbo.cpu.metrics.api.InvalidIntervalException;
import com.vmturbo.cpu.metrics.api.TraceBounds;

/**
 * Unit tests for {@link ReportWindows}.
 */
public class ReportWindowsTest {

    private final TraceBounds bounds = new TraceBounds(1250, 3500);

    /**
     * Buckets are aligned to multiples of the period and cover the trace end.
     *
     * @throws InvalidIntervalException should not happen
     */
    @Test
    public void testTilingAlignment() throws InvalidIntervalException {
        final ReportWindows windows = ReportWindows.tiling(bounds, 1000);
        assertThat(windows.size(), is(3));
        assertThat(windows.getStart(), is(1000L));
        assertThat(windows.getEnd(), is(4000L));
        assertThat(windows.get(0), is(new ReportWindow(1000, 2000)));
        assertThat(windows.get(2), is(new ReportWindow(3000, 4000)));
    }

    /**
     * A trace ending exactly on a bucket boundary gets no extra bucket.
     *
     * @throws InvalidIntervalException should not happen
     */
    @Test
    public void testTilingExactEnd() throws InvalidIntervalException {
        final ReportWindows windows = ReportWindows.tiling(new TraceBounds(0, 3000), 1000);
        assertThat(windows.size(), is(3));
        assertThat(windows.indexOf(2999), is(2));
        assertThat(windows.indexOf(3000), is(2));
        assertThat(windows.indexOf(-5), is(0));
    }

    /**
     * The period has to be positive.
     *
     * @throws InvalidIntervalException expected
     */
    @Test(expected = InvalidIntervalException.class)
    public void testZeroPeriod() throws InvalidIntervalException {
        ReportWindows.tiling(bounds, 0);
    }

    /**
     * An interval touching both trace ends is valid.
     *
     * @throws InvalidIntervalException should not happen
     */
    @Test
    public void testIntervalCoveringTrace() throws InvalidIntervalException {
        final ReportWindows windows = ReportWindows.interval(bounds, 1250, 2250);
        assertThat(windows.size(), is(1));
        assertThat(windows.get(0), is(new ReportWindow(1250, 3500)));
    }

    /**
     * Empty intervals are rejected.
     *
     * @throws InvalidIntervalException expected
     */
    @Test(expected = InvalidIntervalException.class)
    public void testEmptyInterval() throws InvalidIntervalException {
        ReportWindows.interval(bounds, 2000, 0);
    }

    /**
     * Intervals starting before the trace are rejected, not clamped.
     *
     * @throws InvalidIntervalException expected
     */
    @Test(expected = InvalidIntervalException.class)
    public void testIntervalBeforeTrace() throws InvalidIntervalException {
        ReportWindows.interval(bounds, 1249, 10);
    }

    /**
     * Intervals ending after the trace are rejected, not clamped.
     *
     * @throws InvalidIntervalException expected
     */
    @Test(expected = InvalidIntervalException.class)
    public void testIntervalAfterTrace() throws InvalidIntervalException {
        ReportWindows.interval(bounds, 3000, 501);
    }

    /**
     * A zero-length trace has no whole-trace window.
     */
    @Test
    public void testWholeTrace() {
        assertThat(ReportWindows.wholeTrace(bounds).get(0), is(new ReportWindow(1250, 3500)));
        assertThat(ReportWindows.wholeTrace(new TraceBounds(5, 5)).size(), is(0));
    }
}
