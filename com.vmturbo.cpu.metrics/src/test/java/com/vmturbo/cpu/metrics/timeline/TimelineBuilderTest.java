package com.vmturbo.cpu.metrics.timeline;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.vmturbo.cpu.metrics.api.MalformedStreamException;
import com.vmturbo.cpu.metrics.api.StateChangeEvent;
import com.vmturbo.cpu.metrics.api.TraceBounds;

/**
 * Unit tests for {@link TimelineBuilder}.
 */
public class TimelineBuilderTest {

    private final TimelineBuilder builder = new TimelineBuilder();

    private final TraceBounds bounds = new TraceBounds(100, 200);

    /**
     * Every event closes the previous segment; the last one runs open to the trace end.
     *
     * @throws MalformedStreamException should not happen
     */
    @Test
    public void testFrequencySegments() throws MalformedStreamException {
        final List<Segment> segments = builder.buildFrequencyTimeline(0, Arrays.asList(
                StateChangeEvent.frequency(110, 0, 1000),
                StateChangeEvent.frequency(150, 0, 2000)), bounds);
        assertThat(segments, contains(
                new Segment(110, 150, 1000, true),
                new Segment(150, 200, 2000, false)));
    }

    /**
     * Nothing is known before the first event and nothing is produced without events.
     *
     * @throws MalformedStreamException should not happen
     */
    @Test
    public void testNoSegmentBeforeFirstEvent() throws MalformedStreamException {
        assertThat(builder.buildFrequencyTimeline(0, Collections.emptyList(), bounds), is(empty()));
        final List<Segment> segments = builder.buildFrequencyTimeline(0,
                Collections.singletonList(StateChangeEvent.frequency(180, 0, 1000)), bounds);
        assertThat(segments, contains(new Segment(180, 200, 1000, false)));
    }

    /**
     * Equal timestamps produce a zero-length segment.
     *
     * @throws MalformedStreamException should not happen
     */
    @Test
    public void testEqualTimestamps() throws MalformedStreamException {
        final List<Segment> segments = builder.buildFrequencyTimeline(0, Arrays.asList(
                StateChangeEvent.frequency(120, 0, 1000),
                StateChangeEvent.frequency(120, 0, 3000)), bounds);
        assertThat(segments.get(0).getDuration(), is(0L));
        assertThat(segments.get(1), is(new Segment(120, 200, 3000, false)));
    }

    /**
     * The kernel idle sentinel becomes the active value; idle indices are kept.
     *
     * @throws MalformedStreamException should not happen
     */
    @Test
    public void testIdleSentinelNormalized() throws MalformedStreamException {
        final List<Segment> segments = builder.buildIdleTimeline(0, Arrays.asList(
                StateChangeEvent.idle(100, 0, StateChangeEvent.IDLE_SENTINEL),
                StateChangeEvent.idle(130, 0, 1),
                StateChangeEvent.idle(140, 0, StateChangeEvent.ACTIVE)), bounds);
        assertThat(segments, contains(
                new Segment(100, 130, StateChangeEvent.ACTIVE, true),
                new Segment(130, 140, 1, true),
                new Segment(140, 200, StateChangeEvent.ACTIVE, false)));
        assertThat(TimelineBuilder.normalizeIdle(StateChangeEvent.IDLE_SENTINEL),
                is(StateChangeEvent.ACTIVE));
        assertThat(TimelineBuilder.normalizeIdle(3), is(3L));
    }

    /**
     * Decreasing timestamps are rejected.
     *
     * @throws MalformedStreamException expected
     */
    @Test(expected = MalformedStreamException.class)
    public void testDecreasingTimestamps() throws MalformedStreamException {
        builder.buildFrequencyTimeline(0, Arrays.asList(
                StateChangeEvent.frequency(150, 0, 1000),
                StateChangeEvent.frequency(140, 0, 2000)), bounds);
    }

    /**
     * Events outside the trace are rejected.
     *
     * @throws MalformedStreamException expected
     */
    @Test(expected = MalformedStreamException.class)
    public void testEventOutsideBounds() throws MalformedStreamException {
        builder.buildIdleTimeline(0,
                Collections.singletonList(StateChangeEvent.idle(99, 0, 0)), bounds);
    }
}
