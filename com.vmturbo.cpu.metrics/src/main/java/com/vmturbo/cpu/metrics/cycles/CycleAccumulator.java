package com.vmturbo.cpu.metrics.cycles;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.vmturbo.cpu.metrics.api.rows.CycleRow;

/**
 * Accumulates running time spent at known frequencies and keeps track of cycles, min, max and
 * time-weighted average frequency.
 *
 * <p>Each recorded piece contributes {@code dur * freq / 1000} millicycles (kHz times ns is a
 * millionth of a cycle), truncated per piece. The average frequency divides the millicycles by
 * the runtime in whole microseconds, also truncated per piece.</p>
 */
public class CycleAccumulator {

    /**
     * Millicycles per megacycle.
     */
    public static final long MILLICYCLES_PER_MEGACYCLE = 1_000_000_000L;

    private static final long NANOS_PER_MICRO = 1_000L;

    private long runtime = 0;
    private long millicycles = 0;
    private long runtimeMicros = 0;
    private double weightedFreq = 0;
    private long minFreq = Long.MAX_VALUE;
    private long maxFreq = Long.MIN_VALUE;

    /**
     * Record running time at a frequency.
     *
     * @param freqKhz frequency in kHz
     * @param dur     running time in ns; non-positive durations are ignored
     * @return this accumulator, for chaining
     */
    @Nonnull
    public CycleAccumulator record(final long freqKhz, final long dur) {
        if (dur <= 0) {
            return this;
        }
        runtime += dur;
        // Split at whole microseconds so that hour-long pieces at GHz rates do not overflow.
        millicycles += (dur / NANOS_PER_MICRO) * freqKhz
                + (dur % NANOS_PER_MICRO) * freqKhz / NANOS_PER_MICRO;
        runtimeMicros += dur / NANOS_PER_MICRO;
        weightedFreq += (double)freqKhz * dur;
        minFreq = Math.min(minFreq, freqKhz);
        maxFreq = Math.max(maxFreq, freqKhz);
        return this;
    }

    /**
     * Fold another accumulator into this one. Merging is associative and commutative.
     *
     * @param other the accumulator to add
     * @return this accumulator, for chaining
     */
    @Nonnull
    public CycleAccumulator merge(@Nonnull final CycleAccumulator other) {
        runtime += other.runtime;
        millicycles += other.millicycles;
        runtimeMicros += other.runtimeMicros;
        weightedFreq += other.weightedFreq;
        minFreq = Math.min(minFreq, other.minFreq);
        maxFreq = Math.max(maxFreq, other.maxFreq);
        return this;
    }

    public long getRuntime() {
        return runtime;
    }

    public long getMillicycles() {
        return millicycles;
    }

    public long getMegacycles() {
        return millicycles / MILLICYCLES_PER_MEGACYCLE;
    }

    public long getMinFreq() {
        return runtime == 0 ? 0 : minFreq;
    }

    public long getMaxFreq() {
        return runtime == 0 ? 0 : maxFreq;
    }

    /**
     * Time-weighted average frequency. Falls back to exact nanosecond weighting when the
     * runtime is below one microsecond.
     *
     * @return average frequency in kHz, 0 without runtime
     */
    public long getAvgFreq() {
        if (runtime == 0) {
            return 0;
        }
        if (runtimeMicros == 0) {
            return (long)(weightedFreq / runtime);
        }
        return millicycles / runtimeMicros;
    }

    public boolean isEmpty() {
        return runtime == 0;
    }

    /**
     * Build the output row.
     *
     * @param key grouping key, null for the system-wide row
     * @return the row
     */
    @Nonnull
    public CycleRow toCycleRow(@Nullable final Long key) {
        return new CycleRow(key, getMillicycles(), getMegacycles(), getRuntime(),
                getMinFreq(), getMaxFreq(), getAvgFreq());
    }
}
