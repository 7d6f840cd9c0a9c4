package com.vmturbo.cpu.metrics.cycles;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nonnull;

import it.unimi.dsi.fastutil.longs.Long2ObjectAVLTreeMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectSortedMap;

import com.vmturbo.cpu.metrics.api.RunningSlice;
import com.vmturbo.cpu.metrics.api.rows.CycleRow;
import com.vmturbo.cpu.metrics.cycles.CycleGrouping.KeyFunction;
import com.vmturbo.cpu.metrics.timeline.Segment;
import com.vmturbo.cpu.metrics.window.IntervalSplitter;
import com.vmturbo.cpu.metrics.window.ReportWindows;

/**
 * Integrates CPU frequency over running time.
 *
 * <p>For one CPU, the scheduling slices and the frequency segments are swept together; every
 * piece where a slice and a segment overlap inside the report window adds its duration at the
 * segment's frequency to the accumulator of the slice's group. Running time before the first
 * frequency event of a CPU has no known frequency and is not counted.</p>
 */
public class CycleAggregator {

    private final IntervalSplitter splitter;

    /**
     * Create a new aggregator.
     *
     * @param splitter clips pieces to the report window
     */
    public CycleAggregator(@Nonnull final IntervalSplitter splitter) {
        this.splitter = Objects.requireNonNull(splitter);
    }

    /**
     * Accumulate the cycles of one CPU.
     *
     * @param frequencySegments frequency segments of the CPU, ordered by start
     * @param slices            slices of the CPU, ordered by start
     * @param keyFunction       maps slices to their group
     * @param windows           the report window; only the overlap with it counts
     * @param traceEnd          end of the trace, for slices still open
     * @return accumulators by group key
     */
    @Nonnull
    public Long2ObjectMap<CycleAccumulator> accumulate(@Nonnull final List<Segment> frequencySegments,
                                                       @Nonnull final List<RunningSlice> slices,
                                                       @Nonnull final KeyFunction keyFunction,
                                                       @Nonnull final ReportWindows windows,
                                                       final long traceEnd) {
        final Long2ObjectMap<CycleAccumulator> accumulators = new Long2ObjectOpenHashMap<>();
        int first = 0;
        for (RunningSlice slice : slices) {
            final long key = keyFunction.keyOf(slice);
            if (key == CycleGrouping.NO_KEY) {
                continue;
            }
            final long sliceStart = slice.getStart();
            final long sliceEnd = slice.resolveEnd(traceEnd);
            // Slices are ordered by start, so segments ending before this one are done.
            while (first < frequencySegments.size()
                    && frequencySegments.get(first).getEnd() <= sliceStart) {
                first++;
            }
            for (int i = first; i < frequencySegments.size(); i++) {
                final Segment segment = frequencySegments.get(i);
                if (segment.getStart() >= sliceEnd) {
                    break;
                }
                final long from = Math.max(sliceStart, segment.getStart());
                final long to = Math.min(sliceEnd, segment.getEnd());
                splitter.split(from, to, windows, (index, pieceStart, pieceEnd) ->
                        accumulatorFor(accumulators, key)
                                .record(segment.getValue(), pieceEnd - pieceStart));
            }
        }
        return accumulators;
    }

    /**
     * Merge the accumulators of one partition into a running total.
     *
     * @param total   accumulators by key, updated in place
     * @param partial accumulators of one partition
     */
    public void merge(@Nonnull final Long2ObjectSortedMap<CycleAccumulator> total,
                      @Nonnull final Long2ObjectMap<CycleAccumulator> partial) {
        for (Long2ObjectMap.Entry<CycleAccumulator> entry : partial.long2ObjectEntrySet()) {
            accumulatorFor(total, entry.getLongKey()).merge(entry.getValue());
        }
    }

    /**
     * Create an empty, key-ordered total for {@link #merge}.
     *
     * @return the empty total
     */
    @Nonnull
    public Long2ObjectSortedMap<CycleAccumulator> newTotal() {
        return new Long2ObjectAVLTreeMap<>();
    }

    /**
     * Convert merged accumulators into rows ordered by key. Groups without runtime produce no
     * row.
     *
     * @param total    merged accumulators
     * @param grouping the grouping the keys belong to
     * @return the rows
     */
    @Nonnull
    public List<CycleRow> toRows(@Nonnull final Long2ObjectSortedMap<CycleAccumulator> total,
                                 @Nonnull final CycleGrouping grouping) {
        final List<CycleRow> rows = new ArrayList<>(total.size());
        for (Long2ObjectMap.Entry<CycleAccumulator> entry : total.long2ObjectEntrySet()) {
            final CycleAccumulator accumulator = entry.getValue();
            if (accumulator.isEmpty()) {
                continue;
            }
            rows.add(accumulator.toCycleRow(
                    grouping == CycleGrouping.SYSTEM ? null : entry.getLongKey()));
        }
        return rows;
    }

    @Nonnull
    private static CycleAccumulator accumulatorFor(@Nonnull final Long2ObjectMap<CycleAccumulator> accumulators,
                                                   final long key) {
        CycleAccumulator accumulator = accumulators.get(key);
        if (accumulator == null) {
            accumulator = new CycleAccumulator();
            accumulators.put(key, accumulator);
        }
        return accumulator;
    }
}
