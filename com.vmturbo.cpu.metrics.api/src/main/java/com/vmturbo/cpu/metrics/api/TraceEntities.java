package com.vmturbo.cpu.metrics.api;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;

import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;

/**
 * Registry of the CPUs, threads and processes known to a trace.
 *
 * <p>Entities are only ever looked up here; the engine never creates them. Any stream item
 * referring to an entity missing from the registry makes the stream malformed.</p>
 */
public class TraceEntities {

    private final ImmutableSortedSet<Integer> cpus;
    private final ImmutableMap<Long, ThreadInfo> threads;

    private TraceEntities(@Nonnull final ImmutableSortedSet<Integer> cpus,
                          @Nonnull final ImmutableMap<Long, ThreadInfo> threads) {
        this.cpus = cpus;
        this.threads = threads;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * All CPUs of the trace, in ascending order.
     *
     * @return CPU ids
     */
    @Nonnull
    public SortedSet<Integer> getCpus() {
        return cpus;
    }

    public int getCpuCount() {
        return cpus.size();
    }

    public boolean hasCpu(final int cpu) {
        return cpus.contains(cpu);
    }

    @Nonnull
    public Optional<ThreadInfo> getThread(final long utid) {
        return Optional.ofNullable(threads.get(utid));
    }

    @Nonnull
    public Collection<ThreadInfo> getThreads() {
        return threads.values();
    }

    /**
     * Check whether any thread of the trace belongs to the given process.
     *
     * @param upid unique process id
     * @return true if the process is known
     */
    public boolean hasProcess(final long upid) {
        return threads.values().stream()
                .anyMatch(thread -> thread.getUpid().map(p -> p == upid).orElse(false));
    }

    /**
     * Builder for {@link TraceEntities}.
     */
    public static class Builder {
        private final ImmutableSortedSet.Builder<Integer> cpus = ImmutableSortedSet.naturalOrder();
        private final Map<Long, ThreadInfo> threads = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Register CPUs.
         *
         * @param cpuIds CPU ids
         * @return this builder
         */
        @Nonnull
        public Builder addCpus(final int... cpuIds) {
            for (int cpu : cpuIds) {
                cpus.add(cpu);
            }
            return this;
        }

        /**
         * Register a thread. A later registration of the same utid replaces the earlier one.
         *
         * @param thread the thread
         * @return this builder
         */
        @Nonnull
        public Builder addThread(@Nonnull final ThreadInfo thread) {
            threads.put(thread.getUtid(), thread);
            return this;
        }

        @Nonnull
        public TraceEntities build() {
            return new TraceEntities(cpus.build(), ImmutableMap.copyOf(threads));
        }
    }
}
