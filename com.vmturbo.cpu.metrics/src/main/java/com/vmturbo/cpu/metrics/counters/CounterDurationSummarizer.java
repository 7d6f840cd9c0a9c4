package com.vmturbo.cpu.metrics.counters;

import java.util.ArrayList;
import java.util.List;

import javax.annotation.Nonnull;

import com.google.common.collect.Table.Cell;
import com.google.common.collect.TreeBasedTable;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2LongAVLTreeMap;
import it.unimi.dsi.fastutil.longs.Long2LongMap;
import it.unimi.dsi.fastutil.longs.Long2LongSortedMap;

import com.vmturbo.cpu.metrics.api.rows.CounterDurationRow;
import com.vmturbo.cpu.metrics.timeline.Segment;

/**
 * Sums how long each CPU spent at each counter value, e.g. at each frequency or in each idle
 * state.
 */
public class CounterDurationSummarizer {

    /**
     * Sum segment durations of one CPU by value. Zero-length segments are ignored.
     *
     * @param segments segments of one CPU
     * @return total duration in ns by value
     */
    @Nonnull
    public Long2LongSortedMap durationByValue(@Nonnull final List<Segment> segments) {
        final Long2LongSortedMap durations = new Long2LongAVLTreeMap();
        for (Segment segment : segments) {
            if (segment.getDuration() > 0) {
                durations.put(segment.getValue(),
                        durations.get(segment.getValue()) + segment.getDuration());
            }
        }
        return durations;
    }

    /**
     * Build rows ordered by value, then CPU.
     *
     * @param durationsByCpu per-CPU results of {@link #durationByValue}
     * @return the rows
     */
    @Nonnull
    public List<CounterDurationRow> toRows(@Nonnull final Int2ObjectMap<Long2LongSortedMap> durationsByCpu) {
        final TreeBasedTable<Long, Integer, Long> table = TreeBasedTable.create();
        for (Int2ObjectMap.Entry<Long2LongSortedMap> cpuEntry : durationsByCpu.int2ObjectEntrySet()) {
            for (Long2LongMap.Entry entry : cpuEntry.getValue().long2LongEntrySet()) {
                table.put(entry.getLongKey(), cpuEntry.getIntKey(), entry.getLongValue());
            }
        }
        final List<CounterDurationRow> rows = new ArrayList<>(table.size());
        for (Cell<Long, Integer, Long> cell : table.cellSet()) {
            rows.add(new CounterDurationRow(cell.getColumnKey(), cell.getRowKey(), cell.getValue()));
        }
        return rows;
    }
}
