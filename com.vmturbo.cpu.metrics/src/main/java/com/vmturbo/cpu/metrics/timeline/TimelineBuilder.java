package com.vmturbo.cpu.metrics.timeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.LongUnaryOperator;

import javax.annotation.Nonnull;

import com.vmturbo.cpu.metrics.api.MalformedStreamException;
import com.vmturbo.cpu.metrics.api.StateChangeEvent;
import com.vmturbo.cpu.metrics.api.TraceBounds;

/**
 * Turns the ordered edge events of one CPU and one event kind into contiguous segments.
 *
 * <p>Every event closes the segment opened by its predecessor and opens a new one. The last
 * segment runs to the end of the trace and is marked open. Nothing is produced before the
 * first event, because the value in effect at that time is unknown.</p>
 */
public class TimelineBuilder {

    /**
     * Build frequency segments. Values are frequencies in kHz.
     *
     * @param cpu    the CPU the events belong to, for diagnostics
     * @param events frequency events of the CPU, ordered by timestamp
     * @param bounds trace bounds
     * @return the segments, ordered by start
     * @throws MalformedStreamException if timestamps decrease or leave the trace bounds
     */
    @Nonnull
    public List<Segment> buildFrequencyTimeline(final int cpu,
                                                @Nonnull final List<StateChangeEvent> events,
                                                @Nonnull final TraceBounds bounds)
            throws MalformedStreamException {
        return build("frequency stream of cpu " + cpu, events, bounds, LongUnaryOperator.identity());
    }

    /**
     * Build idle segments. The idle sentinel is normalized to {@link StateChangeEvent#ACTIVE}.
     *
     * @param cpu    the CPU the events belong to, for diagnostics
     * @param events idle events of the CPU, ordered by timestamp
     * @param bounds trace bounds
     * @return the segments, ordered by start
     * @throws MalformedStreamException if timestamps decrease or leave the trace bounds
     */
    @Nonnull
    public List<Segment> buildIdleTimeline(final int cpu,
                                           @Nonnull final List<StateChangeEvent> events,
                                           @Nonnull final TraceBounds bounds)
            throws MalformedStreamException {
        return build("idle stream of cpu " + cpu, events, bounds, TimelineBuilder::normalizeIdle);
    }

    /**
     * Map a raw idle value to its normalized form: both the kernel sentinel and -1 mean active.
     *
     * @param rawIdle raw idle state value
     * @return the idle index, or {@link StateChangeEvent#ACTIVE}
     */
    public static long normalizeIdle(final long rawIdle) {
        return rawIdle == StateChangeEvent.IDLE_SENTINEL ? StateChangeEvent.ACTIVE : rawIdle;
    }

    @Nonnull
    private List<Segment> build(@Nonnull final String streamName,
                                @Nonnull final List<StateChangeEvent> events,
                                @Nonnull final TraceBounds bounds,
                                @Nonnull final LongUnaryOperator valueMapper)
            throws MalformedStreamException {
        if (events.isEmpty()) {
            return Collections.emptyList();
        }
        final List<Segment> segments = new ArrayList<>(events.size());
        StateChangeEvent previous = null;
        for (StateChangeEvent event : events) {
            final long ts = event.getTimestamp();
            if (!bounds.contains(ts)) {
                throw new MalformedStreamException(String.format(
                        "Event at %d in %s lies outside trace bounds %s", ts, streamName, bounds));
            }
            if (previous != null) {
                if (ts < previous.getTimestamp()) {
                    throw new MalformedStreamException(String.format(
                            "Timestamp %d in %s precedes previous timestamp %d",
                            ts, streamName, previous.getTimestamp()));
                }
                segments.add(new Segment(previous.getTimestamp(), ts,
                        valueMapper.applyAsLong(previous.getValue()), true));
            }
            previous = event;
        }
        segments.add(new Segment(previous.getTimestamp(), bounds.getEnd(),
                valueMapper.applyAsLong(previous.getValue()), false));
        return segments;
    }
}
