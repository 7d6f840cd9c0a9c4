package com.vmturbo.cpu.metrics.api;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableList;

/**
 * Everything the engine consumes from the trace-decoding collaborator for one trace.
 *
 * <p>Streams are expected to be ordered by timestamp per entity. Validation happens when a
 * query runs, so that a corrupted stream fails the query instead of yielding partial
 * aggregates.</p>
 */
public class TraceData {

    private final TraceBounds bounds;
    private final TraceEntities entities;
    private final List<StateChangeEvent> events;
    private final List<RunningSlice> slices;
    private final List<ResidencyCounterSample> residencySamples;

    private TraceData(@Nonnull final Builder builder) {
        this.bounds = Objects.requireNonNull(builder.bounds, "Trace bounds are required");
        this.entities = Objects.requireNonNull(builder.entities, "Trace entities are required");
        this.events = builder.events.build();
        this.slices = builder.slices.build();
        this.residencySamples = builder.residencySamples.build();
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    public TraceBounds getBounds() {
        return bounds;
    }

    @Nonnull
    public TraceEntities getEntities() {
        return entities;
    }

    @Nonnull
    public List<StateChangeEvent> getEvents() {
        return events;
    }

    @Nonnull
    public List<RunningSlice> getSlices() {
        return slices;
    }

    @Nonnull
    public List<ResidencyCounterSample> getResidencySamples() {
        return residencySamples;
    }

    /**
     * Builder for {@link TraceData}.
     */
    public static class Builder {
        private TraceBounds bounds;
        private TraceEntities entities;
        private final ImmutableList.Builder<StateChangeEvent> events = ImmutableList.builder();
        private final ImmutableList.Builder<RunningSlice> slices = ImmutableList.builder();
        private final ImmutableList.Builder<ResidencyCounterSample> residencySamples =
                ImmutableList.builder();

        private Builder() {
        }

        @Nonnull
        public Builder setBounds(@Nonnull final TraceBounds bounds) {
            this.bounds = bounds;
            return this;
        }

        @Nonnull
        public Builder setEntities(@Nonnull final TraceEntities entities) {
            this.entities = entities;
            return this;
        }

        @Nonnull
        public Builder addEvents(@Nonnull final Collection<StateChangeEvent> newEvents) {
            events.addAll(newEvents);
            return this;
        }

        @Nonnull
        public Builder addEvent(@Nonnull final StateChangeEvent event) {
            events.add(event);
            return this;
        }

        @Nonnull
        public Builder addSlices(@Nonnull final Collection<RunningSlice> newSlices) {
            slices.addAll(newSlices);
            return this;
        }

        @Nonnull
        public Builder addSlice(@Nonnull final RunningSlice slice) {
            slices.add(slice);
            return this;
        }

        @Nonnull
        public Builder addResidencySamples(@Nonnull final Collection<ResidencyCounterSample> samples) {
            residencySamples.addAll(samples);
            return this;
        }

        @Nonnull
        public Builder addResidencySample(@Nonnull final ResidencyCounterSample sample) {
            residencySamples.add(sample);
            return this;
        }

        @Nonnull
        public TraceData build() {
            return new TraceData(this);
        }
    }
}
