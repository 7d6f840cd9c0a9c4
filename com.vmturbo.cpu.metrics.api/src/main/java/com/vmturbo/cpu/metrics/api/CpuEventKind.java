package com.vmturbo.cpu.metrics.api;

/**
 * Kinds of per-CPU state change events.
 */
public enum CpuEventKind {
    /**
     * The CPU switched to a new frequency. The event value is the frequency in kHz.
     */
    FREQUENCY_SET,

    /**
     * The CPU entered an idle state or went back to running. The event value is the idle state
     * index, or {@link StateChangeEvent#IDLE_SENTINEL} when the CPU became active.
     */
    IDLE_ENTER_EXIT
}
