package com.vmturbo.cpu.metrics.idle;

import java.util.ArrayList;
import java.util.List;

import javax.annotation.Nonnull;

import it.unimi.dsi.fastutil.longs.Long2ObjectAVLTreeMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectSortedMap;

import com.vmturbo.cpu.metrics.api.StateChangeEvent;
import com.vmturbo.cpu.metrics.api.rows.IdleStatsRow;
import com.vmturbo.cpu.metrics.timeline.Segment;
import com.vmturbo.cpu.metrics.window.ReportWindow;

/**
 * Computes idle episode statistics of one CPU from its idle segments.
 *
 * <p>An episode is a closed segment in a state other than active. Episodes still running at
 * the end of the idle stream have no known length and are left out, but the time they cover
 * still counts as observed time. Observed time runs from the first idle event of the CPU to
 * the end of the trace.</p>
 */
public class IdleStatsCalculator {

    /**
     * Compute the episode statistics of one CPU, clipped to a window.
     *
     * @param cpu          the CPU
     * @param idleSegments normalized idle segments of the CPU, ordered by start
     * @param window       only time inside the window counts
     * @return one row per idle state, ordered by state
     */
    @Nonnull
    public List<IdleStatsRow> calculate(final int cpu, @Nonnull final List<Segment> idleSegments,
                                        @Nonnull final ReportWindow window) {
        final List<IdleStatsRow> rows = new ArrayList<>();
        if (idleSegments.isEmpty()) {
            return rows;
        }
        final long firstEvent = idleSegments.get(0).getStart();
        final long lastEnd = idleSegments.get(idleSegments.size() - 1).getEnd();
        final long observed = window.overlap(firstEvent, lastEnd);
        if (observed == 0) {
            return rows;
        }
        final Long2ObjectSortedMap<EpisodeStats> byState = new Long2ObjectAVLTreeMap<>();
        for (Segment segment : idleSegments) {
            if (!segment.isClosed() || segment.getValue() == StateChangeEvent.ACTIVE) {
                continue;
            }
            final long dur = window.overlap(segment.getStart(), segment.getEnd());
            if (dur > 0) {
                // Reported states are one-based.
                final long state = segment.getValue() + 1;
                EpisodeStats stats = byState.get(state);
                if (stats == null) {
                    stats = new EpisodeStats();
                    byState.put(state, stats);
                }
                stats.add(dur);
            }
        }
        for (Long2ObjectMap.Entry<EpisodeStats> entry : byState.long2ObjectEntrySet()) {
            final EpisodeStats stats = entry.getValue();
            rows.add(new IdleStatsRow(cpu, entry.getLongKey(), stats.count, stats.dur,
                    stats.dur / stats.count, stats.dur * 100.0 / observed));
        }
        return rows;
    }

    /**
     * Episode count and total duration of one state.
     */
    private static class EpisodeStats {
        private long count = 0;
        private long dur = 0;

        void add(final long episodeDur) {
            count++;
            dur += episodeDur;
        }
    }
}
