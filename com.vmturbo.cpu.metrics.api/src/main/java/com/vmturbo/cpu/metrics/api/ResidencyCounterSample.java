package com.vmturbo.cpu.metrics.api;

import java.util.Objects;

import javax.annotation.Nonnull;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * A periodic snapshot of a cumulative idle residency counter for one CPU and idle state.
 *
 * <p>The counter only ever grows; interval-local residency is obtained by differencing two
 * consecutive samples of the same CPU and state. The counter unit is carried along, since the
 * kernel reports residency in microseconds while timestamps are in nanoseconds.</p>
 */
public class ResidencyCounterSample {

    /**
     * Nanoseconds per counter unit of a microsecond counter.
     */
    public static final long MICROSECOND_UNIT_NS = 1_000L;

    private final long timestamp;
    private final int cpu;
    private final String stateName;
    private final long cumulativeDuration;
    private final long unitNs;

    /**
     * Create a new sample of a microsecond counter.
     *
     * @param timestamp          sampling time in ns
     * @param cpu                CPU id
     * @param stateName          idle state name as reported by the kernel, e.g. "C8"
     * @param cumulativeDuration total time spent in the state so far, in microseconds
     */
    public ResidencyCounterSample(final long timestamp, final int cpu,
                                  @Nonnull final String stateName,
                                  final long cumulativeDuration) {
        this(timestamp, cpu, stateName, cumulativeDuration, MICROSECOND_UNIT_NS);
    }

    /**
     * Create a new sample.
     *
     * @param timestamp          sampling time in ns
     * @param cpu                CPU id
     * @param stateName          idle state name as reported by the kernel, e.g. "C8"
     * @param cumulativeDuration total time spent in the state so far, in counter units
     * @param unitNs             nanoseconds per counter unit
     */
    public ResidencyCounterSample(final long timestamp, final int cpu,
                                  @Nonnull final String stateName,
                                  final long cumulativeDuration, final long unitNs) {
        Preconditions.checkArgument(unitNs > 0, "Counter unit must be positive, got %s", unitNs);
        this.timestamp = timestamp;
        this.cpu = cpu;
        this.stateName = Objects.requireNonNull(stateName);
        this.cumulativeDuration = cumulativeDuration;
        this.unitNs = unitNs;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public int getCpu() {
        return cpu;
    }

    @Nonnull
    public String getStateName() {
        return stateName;
    }

    public long getCumulativeDuration() {
        return cumulativeDuration;
    }

    public long getUnitNs() {
        return unitNs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResidencyCounterSample)) {
            return false;
        }
        final ResidencyCounterSample that = (ResidencyCounterSample)o;
        return timestamp == that.timestamp && cpu == that.cpu
                && cumulativeDuration == that.cumulativeDuration && unitNs == that.unitNs
                && stateName.equals(that.stateName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, cpu, stateName, cumulativeDuration, unitNs);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("timestamp", timestamp)
                .add("cpu", cpu)
                .add("stateName", stateName)
                .add("cumulativeDuration", cumulativeDuration)
                .add("unitNs", unitNs)
                .toString();
    }
}
