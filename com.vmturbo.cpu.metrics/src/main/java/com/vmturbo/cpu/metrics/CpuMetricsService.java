package com.vmturbo.cpu.metrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Predicate;

import javax.annotation.Nonnull;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;

import it.unimi.dsi.fastutil.ints.Int2ObjectAVLTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.longs.Long2LongSortedMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectSortedMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmturbo.cpu.metrics.api.CpuMetricsException;
import com.vmturbo.cpu.metrics.api.InvalidIntervalException;
import com.vmturbo.cpu.metrics.api.RunningSlice;
import com.vmturbo.cpu.metrics.api.ThreadInfo;
import com.vmturbo.cpu.metrics.api.TraceData;
import com.vmturbo.cpu.metrics.api.TraceEntities;
import com.vmturbo.cpu.metrics.api.rows.CounterDurationRow;
import com.vmturbo.cpu.metrics.api.rows.CycleRow;
import com.vmturbo.cpu.metrics.api.rows.IdleStatsRow;
import com.vmturbo.cpu.metrics.api.rows.IdleTimeInStateRow;
import com.vmturbo.cpu.metrics.api.rows.UtilizationRow;
import com.vmturbo.cpu.metrics.counters.CounterDurationSummarizer;
import com.vmturbo.cpu.metrics.cycles.CycleAccumulator;
import com.vmturbo.cpu.metrics.cycles.CycleAggregator;
import com.vmturbo.cpu.metrics.cycles.CycleGrouping;
import com.vmturbo.cpu.metrics.cycles.CycleGrouping.KeyFunction;
import com.vmturbo.cpu.metrics.idle.IdleStatsCalculator;
import com.vmturbo.cpu.metrics.idle.IdleTimeInStateCalculator;
import com.vmturbo.cpu.metrics.idle.ResidencyDelta;
import com.vmturbo.cpu.metrics.timeline.CpuStreams;
import com.vmturbo.cpu.metrics.timeline.Segment;
import com.vmturbo.cpu.metrics.timeline.TimelineBuilder;
import com.vmturbo.cpu.metrics.timeline.TracePartitioner;
import com.vmturbo.cpu.metrics.utilization.UtilizationAggregator;
import com.vmturbo.cpu.metrics.window.ReportWindow;
import com.vmturbo.cpu.metrics.window.ReportWindows;

/**
 * Entry point for deriving CPU metrics from a trace.
 *
 * <p>Every query partitions the trace by CPU, runs one task per CPU on the executor and merges
 * the per-CPU results in ascending CPU order, so the result does not depend on how many tasks
 * run concurrently. Interval and period arguments are validated before any work is done.
 * Queries keep no state between calls.</p>
 */
public class CpuMetricsService {

    private static final Logger logger = LogManager.getLogger();

    private final TracePartitioner partitioner;

    private final TimelineBuilder timelineBuilder;

    private final UtilizationAggregator utilizationAggregator;

    private final CycleAggregator cycleAggregator;

    private final IdleStatsCalculator idleStatsCalculator;

    private final IdleTimeInStateCalculator idleTimeInStateCalculator;

    private final CounterDurationSummarizer counterDurationSummarizer;

    private final ExecutorService executorService;

    private final long utilizationPeriodNs;

    /**
     * Create a new service.
     *
     * @param partitioner               splits traces by CPU
     * @param timelineBuilder           builds frequency and idle segments
     * @param utilizationAggregator     computes utilization
     * @param cycleAggregator           computes cycles
     * @param idleStatsCalculator       computes idle episode statistics
     * @param idleTimeInStateCalculator computes idle residency from counters
     * @param counterDurationSummarizer sums time spent at counter values
     * @param executorService           runs the per-CPU tasks
     * @param utilizationPeriodNs       bucket width of the per-second queries, in ns
     */
    public CpuMetricsService(@Nonnull final TracePartitioner partitioner,
                             @Nonnull final TimelineBuilder timelineBuilder,
                             @Nonnull final UtilizationAggregator utilizationAggregator,
                             @Nonnull final CycleAggregator cycleAggregator,
                             @Nonnull final IdleStatsCalculator idleStatsCalculator,
                             @Nonnull final IdleTimeInStateCalculator idleTimeInStateCalculator,
                             @Nonnull final CounterDurationSummarizer counterDurationSummarizer,
                             @Nonnull final ExecutorService executorService,
                             final long utilizationPeriodNs) {
        Preconditions.checkArgument(utilizationPeriodNs > 0,
                "Utilization period must be positive, got %s", utilizationPeriodNs);
        this.partitioner = Objects.requireNonNull(partitioner);
        this.timelineBuilder = Objects.requireNonNull(timelineBuilder);
        this.utilizationAggregator = Objects.requireNonNull(utilizationAggregator);
        this.cycleAggregator = Objects.requireNonNull(cycleAggregator);
        this.idleStatsCalculator = Objects.requireNonNull(idleStatsCalculator);
        this.idleTimeInStateCalculator = Objects.requireNonNull(idleTimeInStateCalculator);
        this.counterDurationSummarizer = Objects.requireNonNull(counterDurationSummarizer);
        this.executorService = Objects.requireNonNull(executorService);
        this.utilizationPeriodNs = utilizationPeriodNs;
    }

    /**
     * System utilization in buckets of the configured period, one second by default.
     *
     * @param trace the trace
     * @return one row per bucket with running time
     * @throws CpuMetricsException if the trace is malformed
     */
    @Nonnull
    public List<UtilizationRow> cpuUtilizationPerSecond(@Nonnull final TraceData trace)
            throws CpuMetricsException {
        return cpuUtilizationPerPeriod(trace, utilizationPeriodNs);
    }

    /**
     * System utilization in buckets of {@code periodNs}, aligned to multiples of the period.
     *
     * @param trace    the trace
     * @param periodNs bucket width in ns
     * @return one row per bucket with running time
     * @throws InvalidIntervalException if the period is not positive
     * @throws CpuMetricsException      if the trace is malformed
     */
    @Nonnull
    public List<UtilizationRow> cpuUtilizationPerPeriod(@Nonnull final TraceData trace,
                                                        final long periodNs)
            throws CpuMetricsException {
        final ReportWindows windows = ReportWindows.tiling(trace.getBounds(), periodNs);
        return utilization(trace, windows, isRunning(trace.getEntities()), 0);
    }

    /**
     * System utilization over one interval.
     *
     * @param trace the trace
     * @param start interval start in ns
     * @param dur   interval length in ns
     * @return a single row, or none if nothing ran in the interval
     * @throws InvalidIntervalException if the interval is empty or not inside the trace
     * @throws CpuMetricsException      if the trace is malformed
     */
    @Nonnull
    public List<UtilizationRow> cpuUtilizationInInterval(@Nonnull final TraceData trace,
                                                         final long start, final long dur)
            throws CpuMetricsException {
        final ReportWindows windows = ReportWindows.interval(trace.getBounds(), start, dur);
        return utilization(trace, windows, isRunning(trace.getEntities()), 0);
    }

    /**
     * Per-second utilization of one thread.
     *
     * @param trace the trace
     * @param utid  the thread
     * @return one row per bucket in which the thread ran
     * @throws CpuMetricsException if the trace is malformed
     */
    @Nonnull
    public List<UtilizationRow> threadUtilizationPerSecond(@Nonnull final TraceData trace,
                                                           final long utid)
            throws CpuMetricsException {
        return threadUtilizationPerSecond(trace, utid, 0);
    }

    /**
     * Per-second utilization of one thread, leaving out buckets in which it ran for less than
     * {@code minRuntimeNs}.
     *
     * @param trace        the trace
     * @param utid         the thread
     * @param minRuntimeNs smallest reported runtime in ns
     * @return one row per bucket in which the thread ran long enough
     * @throws CpuMetricsException if the trace is malformed
     */
    @Nonnull
    public List<UtilizationRow> threadUtilizationPerSecond(@Nonnull final TraceData trace,
                                                           final long utid,
                                                           final long minRuntimeNs)
            throws CpuMetricsException {
        final ReportWindows windows = ReportWindows.tiling(trace.getBounds(), utilizationPeriodNs);
        if (!trace.getEntities().getThread(utid).isPresent()) {
            logger.debug("Thread {} is not part of the trace", utid);
            return Collections.emptyList();
        }
        final Predicate<RunningSlice> running = isRunning(trace.getEntities());
        return utilization(trace, windows,
                running.and(slice -> slice.getUtid() == utid), minRuntimeNs);
    }

    /**
     * Per-second utilization of all threads of one process.
     *
     * @param trace the trace
     * @param upid  the process
     * @return one row per bucket in which the process ran
     * @throws CpuMetricsException if the trace is malformed
     */
    @Nonnull
    public List<UtilizationRow> processUtilizationPerSecond(@Nonnull final TraceData trace,
                                                            final long upid)
            throws CpuMetricsException {
        return processUtilizationPerSecond(trace, upid, 0);
    }

    /**
     * Per-second utilization of all threads of one process, leaving out buckets in which it
     * ran for less than {@code minRuntimeNs}.
     *
     * @param trace        the trace
     * @param upid         the process
     * @param minRuntimeNs smallest reported runtime in ns
     * @return one row per bucket in which the process ran long enough
     * @throws CpuMetricsException if the trace is malformed
     */
    @Nonnull
    public List<UtilizationRow> processUtilizationPerSecond(@Nonnull final TraceData trace,
                                                            final long upid,
                                                            final long minRuntimeNs)
            throws CpuMetricsException {
        final ReportWindows windows = ReportWindows.tiling(trace.getBounds(), utilizationPeriodNs);
        final TraceEntities entities = trace.getEntities();
        if (!entities.hasProcess(upid)) {
            logger.debug("Process {} is not part of the trace", upid);
            return Collections.emptyList();
        }
        final Predicate<RunningSlice> inProcess = slice -> entities.getThread(slice.getUtid())
                .flatMap(ThreadInfo::getUpid)
                .map(threadUpid -> threadUpid == upid)
                .orElse(false);
        return utilization(trace, windows, isRunning(entities).and(inProcess), minRuntimeNs);
    }

    /**
     * Cycles of the whole system over the whole trace.
     *
     * @param trace the trace
     * @return a single row, or none if no running time had a known frequency
     * @throws CpuMetricsException if the trace is malformed
     */
    @Nonnull
    public List<CycleRow> cpuCycles(@Nonnull final TraceData trace) throws CpuMetricsException {
        return cycles(trace, ReportWindows.wholeTrace(trace.getBounds()), CycleGrouping.SYSTEM);
    }

    /**
     * Cycles of the whole system between {@code start} and {@code start + dur}.
     *
     * @param trace the trace
     * @param start interval start in ns
     * @param dur   interval duration in ns
     * @return a single row, or none if no running time in the interval had a known frequency
     * @throws CpuMetricsException if the interval is outside the trace or the trace is malformed
     */
    @Nonnull
    public List<CycleRow> cpuCyclesInInterval(@Nonnull final TraceData trace, final long start,
                                              final long dur) throws CpuMetricsException {
        return cycles(trace, ReportWindows.interval(trace.getBounds(), start, dur),
                CycleGrouping.SYSTEM);
    }

    /**
     * Cycles per CPU over the whole trace.
     *
     * @param trace the trace
     * @return rows keyed by CPU, in ascending CPU order
     * @throws CpuMetricsException if the trace is malformed
     */
    @Nonnull
    public List<CycleRow> cpuCyclesPerCpu(@Nonnull final TraceData trace) throws CpuMetricsException {
        return cycles(trace, ReportWindows.wholeTrace(trace.getBounds()), CycleGrouping.CPU);
    }

    /**
     * Cycles per CPU between {@code start} and {@code start + dur}.
     *
     * @param trace the trace
     * @param start interval start in ns
     * @param dur   interval duration in ns
     * @return one row per CPU with running time at a known frequency, by CPU
     * @throws CpuMetricsException if the interval is outside the trace or the trace is malformed
     */
    @Nonnull
    public List<CycleRow> cpuCyclesPerCpuInInterval(@Nonnull final TraceData trace,
                                                    final long start, final long dur)
            throws CpuMetricsException {
        return cycles(trace, ReportWindows.interval(trace.getBounds(), start, dur),
                CycleGrouping.CPU);
    }

    /**
     * Cycles per thread over the whole trace.
     *
     * @param trace the trace
     * @return rows keyed by utid, in ascending order
     * @throws CpuMetricsException if the trace is malformed
     */
    @Nonnull
    public List<CycleRow> cpuCyclesPerThread(@Nonnull final TraceData trace)
            throws CpuMetricsException {
        return cycles(trace, ReportWindows.wholeTrace(trace.getBounds()), CycleGrouping.THREAD);
    }

    /**
     * Cycles per thread between {@code start} and {@code start + dur}. The idle thread is
     * left out.
     *
     * @param trace the trace
     * @param start interval start in ns
     * @param dur   interval duration in ns
     * @return one row per thread that ran at a known frequency, by utid
     * @throws CpuMetricsException if the interval is outside the trace or the trace is malformed
     */
    @Nonnull
    public List<CycleRow> cpuCyclesPerThreadInInterval(@Nonnull final TraceData trace,
                                                       final long start, final long dur)
            throws CpuMetricsException {
        return cycles(trace, ReportWindows.interval(trace.getBounds(), start, dur),
                CycleGrouping.THREAD);
    }

    /**
     * Cycles per process over the whole trace. Threads without a process are left out.
     *
     * @param trace the trace
     * @return rows keyed by upid, in ascending order
     * @throws CpuMetricsException if the trace is malformed
     */
    @Nonnull
    public List<CycleRow> cpuCyclesPerProcess(@Nonnull final TraceData trace)
            throws CpuMetricsException {
        return cycles(trace, ReportWindows.wholeTrace(trace.getBounds()), CycleGrouping.PROCESS);
    }

    /**
     * Cycles per process between {@code start} and {@code start + dur}. Threads without a
     * process are left out.
     *
     * @param trace the trace
     * @param start interval start in ns
     * @param dur   interval duration in ns
     * @return one row per process whose threads ran at a known frequency, by upid
     * @throws CpuMetricsException if the interval is outside the trace or the trace is malformed
     */
    @Nonnull
    public List<CycleRow> cpuCyclesPerProcessInInterval(@Nonnull final TraceData trace,
                                                        final long start, final long dur)
            throws CpuMetricsException {
        return cycles(trace, ReportWindows.interval(trace.getBounds(), start, dur),
                CycleGrouping.PROCESS);
    }

    /**
     * Idle episode statistics per CPU and state over the whole trace.
     *
     * @param trace the trace
     * @return rows ordered by CPU, then state
     * @throws CpuMetricsException if the trace is malformed
     */
    @Nonnull
    public List<IdleStatsRow> cpuIdleStats(@Nonnull final TraceData trace)
            throws CpuMetricsException {
        return idleStats(trace, ReportWindows.wholeTrace(trace.getBounds()));
    }

    /**
     * Idle episode statistics per CPU and state, clipped to an interval.
     *
     * @param trace the trace
     * @param start interval start in ns
     * @param dur   interval length in ns
     * @return rows ordered by CPU, then state
     * @throws InvalidIntervalException if the interval is empty or not inside the trace
     * @throws CpuMetricsException      if the trace is malformed
     */
    @Nonnull
    public List<IdleStatsRow> cpuIdleStatsInInterval(@Nonnull final TraceData trace,
                                                     final long start, final long dur)
            throws CpuMetricsException {
        return idleStats(trace, ReportWindows.interval(trace.getBounds(), start, dur));
    }

    /**
     * Time in idle state derived from residency counters, aggregated over all CPUs.
     *
     * @param trace the trace
     * @return rows of genuine states ordered by name and timestamp, then the active state rows
     * @throws CpuMetricsException if a counter stream is malformed
     */
    @Nonnull
    public List<IdleTimeInStateRow> cpuIdleTimeInState(@Nonnull final TraceData trace)
            throws CpuMetricsException {
        return idleTimeInStateCalculator.toSystemRows(residencyDeltas(trace));
    }

    /**
     * Time in idle state derived from residency counters, per CPU.
     *
     * @param trace the trace
     * @return rows ordered by CPU, then as {@link #cpuIdleTimeInState}
     * @throws CpuMetricsException if a counter stream is malformed
     */
    @Nonnull
    public List<IdleTimeInStateRow> cpuIdleTimeInStatePerCpu(@Nonnull final TraceData trace)
            throws CpuMetricsException {
        return idleTimeInStateCalculator.toPerCpuRows(residencyDeltas(trace));
    }

    /**
     * Time every CPU spent at every frequency.
     *
     * @param trace the trace
     * @return rows ordered by frequency, then CPU
     * @throws CpuMetricsException if the trace is malformed
     */
    @Nonnull
    public List<CounterDurationRow> cpuFrequencyCounters(@Nonnull final TraceData trace)
            throws CpuMetricsException {
        final Int2ObjectSortedMap<CpuStreams> partitions = partitioner.partition(trace);
        final List<Long2LongSortedMap> durations = forEachCpu(partitions, streams ->
                counterDurationSummarizer.durationByValue(timelineBuilder.buildFrequencyTimeline(
                        streams.getCpu(), streams.getFrequencyEvents(), trace.getBounds())));
        return counterDurationSummarizer.toRows(byCpu(partitions, durations));
    }

    /**
     * Time every CPU spent in every idle state, active included as -1.
     *
     * @param trace the trace
     * @return rows ordered by idle state, then CPU
     * @throws CpuMetricsException if the trace is malformed
     */
    @Nonnull
    public List<CounterDurationRow> cpuIdleCounters(@Nonnull final TraceData trace)
            throws CpuMetricsException {
        final Int2ObjectSortedMap<CpuStreams> partitions = partitioner.partition(trace);
        final List<Long2LongSortedMap> durations = forEachCpu(partitions, streams ->
                counterDurationSummarizer.durationByValue(timelineBuilder.buildIdleTimeline(
                        streams.getCpu(), streams.getIdleEvents(), trace.getBounds())));
        return counterDurationSummarizer.toRows(byCpu(partitions, durations));
    }

    @Nonnull
    private List<UtilizationRow> utilization(@Nonnull final TraceData trace,
                                             @Nonnull final ReportWindows windows,
                                             @Nonnull final Predicate<RunningSlice> running,
                                             final long minRuntimeNs)
            throws CpuMetricsException {
        final Int2ObjectSortedMap<CpuStreams> partitions = partitioner.partition(trace);
        final long traceEnd = trace.getBounds().getEnd();
        final List<long[]> perCpu = forEachCpu(partitions, streams ->
                utilizationAggregator.runtimePerWindow(streams.getSlices(), running, windows,
                        traceEnd));
        final long[] total = new long[windows.size()];
        for (long[] runtime : perCpu) {
            utilizationAggregator.merge(total, runtime);
        }
        final List<UtilizationRow> rows = utilizationAggregator.toRows(total, windows,
                trace.getEntities().getCpuCount(), minRuntimeNs);
        logger.debug("Computed {} utilization rows over {}", rows.size(), windows);
        return rows;
    }

    @Nonnull
    private List<CycleRow> cycles(@Nonnull final TraceData trace,
                                  @Nonnull final ReportWindows windows,
                                  @Nonnull final CycleGrouping grouping)
            throws CpuMetricsException {
        final Int2ObjectSortedMap<CpuStreams> partitions = partitioner.partition(trace);
        final KeyFunction keyFunction = grouping.keyFunction(trace.getEntities());
        final List<Long2ObjectMap<CycleAccumulator>> perCpu = forEachCpu(partitions, streams -> {
            final List<Segment> frequencies = timelineBuilder.buildFrequencyTimeline(
                    streams.getCpu(), streams.getFrequencyEvents(), trace.getBounds());
            return cycleAggregator.accumulate(frequencies, streams.getSlices(), keyFunction,
                    windows, trace.getBounds().getEnd());
        });
        final Long2ObjectSortedMap<CycleAccumulator> total = cycleAggregator.newTotal();
        for (Long2ObjectMap<CycleAccumulator> accumulators : perCpu) {
            cycleAggregator.merge(total, accumulators);
        }
        final List<CycleRow> rows = cycleAggregator.toRows(total, grouping);
        logger.debug("Computed {} cycle rows grouped by {} over {}", rows.size(), grouping, windows);
        return rows;
    }

    @Nonnull
    private List<IdleStatsRow> idleStats(@Nonnull final TraceData trace,
                                         @Nonnull final ReportWindows windows)
            throws CpuMetricsException {
        final Int2ObjectSortedMap<CpuStreams> partitions = partitioner.partition(trace);
        if (windows.size() == 0) {
            return Collections.emptyList();
        }
        final ReportWindow window = windows.get(0);
        final List<List<IdleStatsRow>> perCpu = forEachCpu(partitions, streams ->
                idleStatsCalculator.calculate(streams.getCpu(),
                        timelineBuilder.buildIdleTimeline(streams.getCpu(),
                                streams.getIdleEvents(), trace.getBounds()),
                        window));
        final List<IdleStatsRow> rows = new ArrayList<>();
        perCpu.forEach(rows::addAll);
        return rows;
    }

    @Nonnull
    private List<ResidencyDelta> residencyDeltas(@Nonnull final TraceData trace)
            throws CpuMetricsException {
        final Int2ObjectSortedMap<CpuStreams> partitions = partitioner.partition(trace);
        final List<List<ResidencyDelta>> perCpu = forEachCpu(partitions, streams ->
                idleTimeInStateCalculator.computeDeltas(streams.getCpu(),
                        streams.getResidencySamples()));
        final List<ResidencyDelta> deltas = new ArrayList<>();
        perCpu.forEach(deltas::addAll);
        return deltas;
    }

    @Nonnull
    private static <T> Int2ObjectSortedMap<T> byCpu(@Nonnull final Int2ObjectSortedMap<CpuStreams> partitions,
                                                   @Nonnull final List<T> results) {
        final Int2ObjectSortedMap<T> byCpu = new Int2ObjectAVLTreeMap<>();
        int i = 0;
        for (int cpu : partitions.keySet()) {
            byCpu.put(cpu, results.get(i++));
        }
        return byCpu;
    }

    @Nonnull
    private static Predicate<RunningSlice> isRunning(@Nonnull final TraceEntities entities) {
        return slice -> entities.getThread(slice.getUtid())
                .map(thread -> !thread.isIdleThread())
                .orElse(false);
    }

    /**
     * Run a task for every CPU and collect the results in ascending CPU order.
     *
     * @param partitions per-CPU streams
     * @param task       the task
     * @param <T>        result type
     * @return one result per CPU
     * @throws CpuMetricsException the first failure of a task, or if interrupted
     */
    @Nonnull
    private <T> List<T> forEachCpu(@Nonnull final Int2ObjectSortedMap<CpuStreams> partitions,
                                   @Nonnull final CpuTask<T> task) throws CpuMetricsException {
        final List<Future<T>> futures = new ArrayList<>(partitions.size());
        for (CpuStreams streams : partitions.values()) {
            futures.add(executorService.submit(() -> task.run(streams)));
        }
        final List<T> results = new ArrayList<>(futures.size());
        try {
            for (Future<T> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            throw new CpuMetricsException("Interrupted while computing cpu metrics", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            final Throwable cause = e.getCause();
            if (cause instanceof CpuMetricsException) {
                throw (CpuMetricsException)cause;
            }
            Throwables.throwIfUnchecked(cause);
            throw new CpuMetricsException("Failed to compute cpu metrics", cause);
        }
        return results;
    }

    private static void cancelAll(@Nonnull final List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }

    /**
     * Work done for a single CPU.
     *
     * @param <T> result type
     */
    @FunctionalInterface
    private interface CpuTask<T> {
        T run(@Nonnull CpuStreams streams) throws CpuMetricsException;
    }
}
