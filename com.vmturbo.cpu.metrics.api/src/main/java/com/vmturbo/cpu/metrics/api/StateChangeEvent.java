package com.vmturbo.cpu.metrics.api;

import java.util.Objects;

import javax.annotation.Nonnull;

import com.google.common.base.MoreObjects;

/**
 * A decoded edge event changing one monitored value of a CPU.
 */
public class StateChangeEvent {

    /**
     * Idle value reported by the kernel when a CPU leaves idle: {@code (uint32)-1}.
     */
    public static final long IDLE_SENTINEL = 4294967295L;

    /**
     * Normalized idle value representing an active (not idle) CPU.
     */
    public static final long ACTIVE = -1L;

    private final long timestamp;
    private final int cpu;
    private final CpuEventKind kind;
    private final long value;

    /**
     * Create a new event.
     *
     * @param timestamp event time in ns
     * @param cpu       the CPU the event applies to
     * @param kind      what changed
     * @param value     frequency in kHz or idle state index, depending on {@code kind}
     */
    public StateChangeEvent(final long timestamp, final int cpu,
                            @Nonnull final CpuEventKind kind, final long value) {
        this.timestamp = timestamp;
        this.cpu = cpu;
        this.kind = Objects.requireNonNull(kind);
        this.value = value;
    }

    /**
     * Convenience factory for a frequency change.
     *
     * @param timestamp event time in ns
     * @param cpu       CPU id
     * @param freqKhz   new frequency in kHz
     * @return the event
     */
    @Nonnull
    public static StateChangeEvent frequency(final long timestamp, final int cpu, final long freqKhz) {
        return new StateChangeEvent(timestamp, cpu, CpuEventKind.FREQUENCY_SET, freqKhz);
    }

    /**
     * Convenience factory for an idle state transition.
     *
     * @param timestamp event time in ns
     * @param cpu       CPU id
     * @param idleState idle state index, or {@link #IDLE_SENTINEL} for active
     * @return the event
     */
    @Nonnull
    public static StateChangeEvent idle(final long timestamp, final int cpu, final long idleState) {
        return new StateChangeEvent(timestamp, cpu, CpuEventKind.IDLE_ENTER_EXIT, idleState);
    }

    public long getTimestamp() {
        return timestamp;
    }

    public int getCpu() {
        return cpu;
    }

    @Nonnull
    public CpuEventKind getKind() {
        return kind;
    }

    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StateChangeEvent)) {
            return false;
        }
        final StateChangeEvent that = (StateChangeEvent)o;
        return timestamp == that.timestamp && cpu == that.cpu && kind == that.kind
                && value == that.value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, cpu, kind, value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("timestamp", timestamp)
                .add("cpu", cpu)
                .add("kind", kind)
                .add("value", value)
                .toString();
    }
}
