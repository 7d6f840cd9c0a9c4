package com.vmturbo.cpu.metrics.idle;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.collect.Table.Cell;
import com.google.common.collect.TreeBasedTable;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmturbo.cpu.metrics.api.MalformedStreamException;
import com.vmturbo.cpu.metrics.api.ResidencyCounterSample;
import com.vmturbo.cpu.metrics.api.rows.IdleTimeInStateRow;

/**
 * Derives time spent in each idle state from cumulative residency counters.
 *
 * <p>Counters are differenced between consecutive samples of the same CPU and state. For every
 * sample timestamp a complementary active state is reported, so that the percentages of all
 * states at a timestamp add up to 100.</p>
 */
public class IdleTimeInStateCalculator {

    private static final Logger logger = LogManager.getLogger();

    private final String statePrefix;

    private final String activeStateName;

    /**
     * Create a new calculator.
     *
     * @param statePrefix     prefix of reported state names, e.g. "cpuidle."
     * @param activeStateName name of the synthetic active state, e.g. "C0"
     */
    public IdleTimeInStateCalculator(@Nonnull final String statePrefix,
                                     @Nonnull final String activeStateName) {
        this.statePrefix = Objects.requireNonNull(statePrefix);
        this.activeStateName = Objects.requireNonNull(activeStateName);
    }

    /**
     * Difference the residency counters of one CPU. The first sample of every state only
     * serves as a baseline. Time slices are expressed in the counter's own unit, so that the
     * delta and the slice are comparable. Samples closer to their baseline than one counter
     * unit are folded into the next delta.
     *
     * @param cpu     the CPU
     * @param samples residency samples of the CPU, in arrival order
     * @return deltas ordered by state name, then timestamp
     * @throws MalformedStreamException if a counter or its timestamps decrease, or the counter
     *                                  unit changes within a stream
     */
    @Nonnull
    public List<ResidencyDelta> computeDeltas(final int cpu,
                                              @Nonnull final List<ResidencyCounterSample> samples)
            throws MalformedStreamException {
        final SortedMap<String, List<ResidencyCounterSample>> byState = new TreeMap<>();
        for (ResidencyCounterSample sample : samples) {
            byState.computeIfAbsent(sample.getStateName(), k -> new ArrayList<>()).add(sample);
        }
        final List<ResidencyDelta> deltas = new ArrayList<>();
        for (Entry<String, List<ResidencyCounterSample>> entry : byState.entrySet()) {
            final List<ResidencyCounterSample> stream = entry.getValue();
            if (stream.size() == 1) {
                logger.warn("Residency counter {} of cpu {} has a single sample, skipping it",
                        entry.getKey(), cpu);
                continue;
            }
            ResidencyCounterSample baseline = stream.get(0);
            ResidencyCounterSample previous = baseline;
            for (ResidencyCounterSample sample : stream.subList(1, stream.size())) {
                checkOrder(previous, sample);
                previous = sample;
                final long timeSlice =
                        (sample.getTimestamp() - baseline.getTimestamp()) / sample.getUnitNs();
                if (timeSlice == 0) {
                    logger.debug("Sample {} is within one time slice of {}", sample, baseline);
                    continue;
                }
                deltas.add(new ResidencyDelta(sample.getTimestamp(), cpu, entry.getKey(),
                        sample.getCumulativeDuration() - baseline.getCumulativeDuration(),
                        timeSlice));
                baseline = sample;
            }
        }
        return deltas;
    }

    /**
     * Aggregate deltas of all CPUs into one row per timestamp and state. Genuine states come
     * first, ordered by name then timestamp, followed by the active state rows.
     *
     * @param deltas deltas of any number of CPUs
     * @return the rows
     */
    @Nonnull
    public List<IdleTimeInStateRow> toSystemRows(@Nonnull final List<ResidencyDelta> deltas) {
        return toRows(deltas, null);
    }

    /**
     * Same as {@link #toSystemRows}, but separately for every CPU, in ascending CPU order.
     *
     * @param deltas deltas of any number of CPUs
     * @return the rows
     */
    @Nonnull
    public List<IdleTimeInStateRow> toPerCpuRows(@Nonnull final List<ResidencyDelta> deltas) {
        final SortedMap<Integer, List<ResidencyDelta>> byCpu = new TreeMap<>();
        for (ResidencyDelta delta : deltas) {
            byCpu.computeIfAbsent(delta.getCpu(), k -> new ArrayList<>()).add(delta);
        }
        final List<IdleTimeInStateRow> rows = new ArrayList<>();
        for (Entry<Integer, List<ResidencyDelta>> entry : byCpu.entrySet()) {
            rows.addAll(toRows(entry.getValue(), entry.getKey()));
        }
        return rows;
    }

    @Nonnull
    private List<IdleTimeInStateRow> toRows(@Nonnull final List<ResidencyDelta> deltas,
                                            @Nullable final Integer cpu) {
        final TreeBasedTable<String, Long, Accrual> byStateAndTs = TreeBasedTable.create();
        // Time slice of every CPU at every timestamp, counted once however many states it has.
        final SortedMap<Long, Map<Integer, Long>> cpuSlices = new TreeMap<>();
        for (ResidencyDelta delta : deltas) {
            Accrual accrual = byStateAndTs.get(delta.getStateName(), delta.getTs());
            if (accrual == null) {
                accrual = new Accrual();
                byStateAndTs.put(delta.getStateName(), delta.getTs(), accrual);
            }
            accrual.add(delta.getDelta(), delta.getTimeSlice());
            cpuSlices.computeIfAbsent(delta.getTs(), k -> new TreeMap<>())
                    .merge(delta.getCpu(), delta.getTimeSlice(), Math::max);
        }

        final List<IdleTimeInStateRow> rows = new ArrayList<>();
        final Map<Long, Accrual> idleTotals = new TreeMap<>();
        for (Cell<String, Long, Accrual> cell : byStateAndTs.cellSet()) {
            final Accrual accrual = cell.getValue();
            final double percentage = accrual.residency * 100.0 / accrual.timeSlice;
            rows.add(new IdleTimeInStateRow(cell.getColumnKey(), cpu,
                    statePrefix + cell.getRowKey(), percentage, accrual.residency,
                    accrual.timeSlice));
            final Accrual total = idleTotals.computeIfAbsent(cell.getColumnKey(), k -> new Accrual());
            total.residency += accrual.residency;
            total.percentage += percentage;
        }
        for (Entry<Long, Map<Integer, Long>> entry : cpuSlices.entrySet()) {
            final long timeSlice = entry.getValue().values().stream()
                    .mapToLong(Long::longValue)
                    .sum();
            final Accrual idle = idleTotals.get(entry.getKey());
            rows.add(new IdleTimeInStateRow(entry.getKey(), cpu, statePrefix + activeStateName,
                    100.0 - idle.percentage, timeSlice - idle.residency, timeSlice));
        }
        return rows;
    }

    private static void checkOrder(@Nonnull final ResidencyCounterSample previous,
                                   @Nonnull final ResidencyCounterSample sample)
            throws MalformedStreamException {
        if (sample.getTimestamp() < previous.getTimestamp()) {
            throw new MalformedStreamException(String.format(
                    "Residency sample %s precedes previous sample %s", sample, previous));
        }
        if (sample.getUnitNs() != previous.getUnitNs()) {
            throw new MalformedStreamException(String.format(
                    "Residency counter unit changes from %s to %s", previous, sample));
        }
        if (sample.getCumulativeDuration() < previous.getCumulativeDuration()) {
            throw new MalformedStreamException(String.format(
                    "Residency counter decreases from %s to %s", previous, sample));
        }
    }

    /**
     * Residency and time slice summed over CPUs.
     */
    private static class Accrual {
        private long residency = 0;
        private long timeSlice = 0;
        private double percentage = 0;

        void add(final long delta, final long slice) {
            residency += delta;
            timeSlice += slice;
        }
    }
}
