package com.vmturbo.cpu.metrics.api.rows;

import java.util.Objects;
import java.util.Optional;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

/**
 * Estimated clock cycles and frequency statistics for the running time of one group: the
 * whole system, a CPU, a thread or a process.
 */
public class CycleRow {

    private final Long key;
    private final long millicycles;
    private final long megacycles;
    private final long runtime;
    private final long minFreq;
    private final long maxFreq;
    private final long avgFreq;

    /**
     * Create a new row.
     *
     * @param key         CPU, utid or upid the row is grouped by; null for the system-wide row
     * @param millicycles cycles in thousandths of a cycle
     * @param megacycles  whole megacycles
     * @param runtime     running time with a known frequency, in ns
     * @param minFreq     lowest frequency seen while running, in kHz
     * @param maxFreq     highest frequency seen while running, in kHz
     * @param avgFreq     time-weighted average frequency while running, in kHz
     */
    public CycleRow(@Nullable final Long key, final long millicycles, final long megacycles,
                    final long runtime, final long minFreq, final long maxFreq,
                    final long avgFreq) {
        this.key = key;
        this.millicycles = millicycles;
        this.megacycles = megacycles;
        this.runtime = runtime;
        this.minFreq = minFreq;
        this.maxFreq = maxFreq;
        this.avgFreq = avgFreq;
    }

    @Nonnull
    public Optional<Long> getKey() {
        return Optional.ofNullable(key);
    }

    public long getMillicycles() {
        return millicycles;
    }

    public long getMegacycles() {
        return megacycles;
    }

    public long getRuntime() {
        return runtime;
    }

    public long getMinFreq() {
        return minFreq;
    }

    public long getMaxFreq() {
        return maxFreq;
    }

    public long getAvgFreq() {
        return avgFreq;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CycleRow)) {
            return false;
        }
        final CycleRow that = (CycleRow)o;
        return millicycles == that.millicycles && megacycles == that.megacycles
                && runtime == that.runtime && minFreq == that.minFreq
                && maxFreq == that.maxFreq && avgFreq == that.avgFreq
                && Objects.equals(key, that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, millicycles, megacycles, runtime, minFreq, maxFreq, avgFreq);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("key", key)
                .add("millicycles", millicycles)
                .add("megacycles", megacycles)
                .add("runtime", runtime)
                .add("minFreq", minFreq)
                .add("maxFreq", maxFreq)
                .add("avgFreq", avgFreq)
                .toString();
    }
}
