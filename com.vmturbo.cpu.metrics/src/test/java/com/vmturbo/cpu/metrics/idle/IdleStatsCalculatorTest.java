package com.vmturbo.cpu.metrics.idle;

import static com.vmturbo.cpu.metrics.CpuMetricsTestUtils.MS;
import static com.vmturbo.cpu.metrics.CpuMetricsTestUtils.SEC;
import static com.vmturbo.cpu.metrics.api.StateChangeEvent.IDLE_SENTINEL;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import com.vmturbo.cpu.metrics.api.MalformedStreamException;
import com.vmturbo.cpu.metrics.api.StateChangeEvent;
import com.vmturbo.cpu.metrics.api.TraceBounds;
import com.vmturbo.cpu.metrics.api.rows.IdleStatsRow;
import com.vmturbo.cpu.metrics.timeline.Segment;
import com.vmturbo.cpu.metrics.timeline.TimelineBuilder;
import com.vmturbo.cpu.metrics.window.ReportWindow;

/**
 * Unit tests for {@link IdleStatsCalculator}.
 */
public class IdleStatsCalculatorTest {

    private static final long T0 = 200 * SEC;

    private final IdleStatsCalculator calculator = new IdleStatsCalculator();

    private final TraceBounds bounds = new TraceBounds(T0, T0 + 5 * MS);

    /**
     * Two 1ms episodes in state 1 over 5ms of observed time.
     *
     * @throws MalformedStreamException should not happen
     */
    @Test
    public void testTwoEpisodes() throws MalformedStreamException {
        final List<IdleStatsRow> rows = calculator.calculate(0, alternatingSegments(),
                new ReportWindow(bounds.getStart(), bounds.getEnd()));
        assertThat(rows, contains(new IdleStatsRow(0, 2, 2, 2 * MS, MS, 40.0)));
    }

    /**
     * An interval only counts the episode time and observed time inside it.
     *
     * @throws MalformedStreamException should not happen
     */
    @Test
    public void testClippedToInterval() throws MalformedStreamException {
        // [T0 + 0.5ms, T0 + 1.5ms): half of the first episode
        final List<IdleStatsRow> rows = calculator.calculate(3, alternatingSegments(),
                new ReportWindow(T0 + MS / 2, T0 + MS + MS / 2));
        assertThat(rows, contains(new IdleStatsRow(3, 2, 1, MS / 2, MS / 2, 50.0)));
    }

    /**
     * An episode still running when the stream ends is not counted, but observed time still
     * runs to the trace end.
     *
     * @throws MalformedStreamException should not happen
     */
    @Test
    public void testOpenEpisodeExcluded() throws MalformedStreamException {
        final List<Segment> segments = new TimelineBuilder().buildIdleTimeline(0, Arrays.asList(
                StateChangeEvent.idle(T0 + MS, 0, 0),
                StateChangeEvent.idle(T0 + 2 * MS, 0, IDLE_SENTINEL),
                StateChangeEvent.idle(T0 + 4 * MS, 0, 2)), bounds);
        final List<IdleStatsRow> rows = calculator.calculate(0, segments,
                new ReportWindow(bounds.getStart(), bounds.getEnd()));
        assertThat(rows, contains(new IdleStatsRow(0, 1, 1, MS, MS, 25.0)));
    }

    /**
     * States are reported in ascending order.
     *
     * @throws MalformedStreamException should not happen
     */
    @Test
    public void testStatesOrdered() throws MalformedStreamException {
        final List<Segment> segments = new TimelineBuilder().buildIdleTimeline(0, Arrays.asList(
                StateChangeEvent.idle(T0, 0, 3),
                StateChangeEvent.idle(T0 + MS, 0, 0),
                StateChangeEvent.idle(T0 + 2 * MS, 0, IDLE_SENTINEL)), bounds);
        final List<IdleStatsRow> rows = calculator.calculate(0, segments,
                new ReportWindow(bounds.getStart(), bounds.getEnd()));
        assertThat(rows, contains(
                new IdleStatsRow(0, 1, 1, MS, MS, 20.0),
                new IdleStatsRow(0, 4, 1, MS, MS, 20.0)));
    }

    /**
     * A CPU without idle events has no rows.
     */
    @Test
    public void testNoEvents() {
        assertThat(calculator.calculate(0, Arrays.asList(),
                new ReportWindow(bounds.getStart(), bounds.getEnd())), is(empty()));
    }

    private List<Segment> alternatingSegments() throws MalformedStreamException {
        return new TimelineBuilder().buildIdleTimeline(0, Arrays.asList(
                StateChangeEvent.idle(T0, 0, IDLE_SENTINEL),
                StateChangeEvent.idle(T0 + MS, 0, 1),
                StateChangeEvent.idle(T0 + 2 * MS, 0, IDLE_SENTINEL),
                StateChangeEvent.idle(T0 + 3 * MS, 0, 1),
                StateChangeEvent.idle(T0 + 4 * MS, 0, IDLE_SENTINEL)), bounds);
    }
}
