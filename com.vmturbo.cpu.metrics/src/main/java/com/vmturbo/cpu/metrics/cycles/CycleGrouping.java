package com.vmturbo.cpu.metrics.cycles;

import javax.annotation.Nonnull;

import com.vmturbo.cpu.metrics.api.RunningSlice;
import com.vmturbo.cpu.metrics.api.ThreadInfo;
import com.vmturbo.cpu.metrics.api.TraceEntities;

/**
 * What cycle statistics are grouped by.
 */
public enum CycleGrouping {
    /**
     * One row for the whole system.
     */
    SYSTEM,

    /**
     * One row per CPU.
     */
    CPU,

    /**
     * One row per thread.
     */
    THREAD,

    /**
     * One row per process, merging its threads.
     */
    PROCESS;

    /**
     * Key returned for slices that do not belong to any group.
     */
    public static final long NO_KEY = Long.MIN_VALUE;

    /**
     * Maps a slice to the key of its group.
     */
    @FunctionalInterface
    public interface KeyFunction {

        /**
         * Get the group of a slice.
         *
         * @param slice the slice
         * @return group key, or {@link #NO_KEY} to leave the slice out
         */
        long keyOf(@Nonnull RunningSlice slice);
    }

    /**
     * Build the key function of this grouping. Slices of the idle thread never belong to a
     * group; slices of threads without a process are left out of the process grouping.
     *
     * @param entities trace entities
     * @return the key function
     */
    @Nonnull
    public KeyFunction keyFunction(@Nonnull final TraceEntities entities) {
        switch (this) {
            case SYSTEM:
                return slice -> isRunning(entities, slice) ? 0L : NO_KEY;
            case CPU:
                return slice -> isRunning(entities, slice) ? slice.getCpu() : NO_KEY;
            case THREAD:
                return slice -> isRunning(entities, slice) ? slice.getUtid() : NO_KEY;
            case PROCESS:
                return slice -> entities.getThread(slice.getUtid())
                        .filter(thread -> !thread.isIdleThread())
                        .flatMap(ThreadInfo::getUpid)
                        .orElse(NO_KEY);
            default:
                throw new IllegalStateException("Unknown grouping " + this);
        }
    }

    private static boolean isRunning(@Nonnull final TraceEntities entities,
                                     @Nonnull final RunningSlice slice) {
        return entities.getThread(slice.getUtid())
                .map(thread -> !thread.isIdleThread())
                .orElse(false);
    }
}
