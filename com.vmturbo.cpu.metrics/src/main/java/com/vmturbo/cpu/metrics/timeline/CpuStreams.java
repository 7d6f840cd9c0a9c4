package com.vmturbo.cpu.metrics.timeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import javax.annotation.Nonnull;

import com.vmturbo.cpu.metrics.api.ResidencyCounterSample;
import com.vmturbo.cpu.metrics.api.RunningSlice;
import com.vmturbo.cpu.metrics.api.StateChangeEvent;

/**
 * The input streams of a single CPU, in arrival order.
 */
public class CpuStreams {

    private final int cpu;
    private final List<StateChangeEvent> frequencyEvents = new ArrayList<>();
    private final List<StateChangeEvent> idleEvents = new ArrayList<>();
    private final List<RunningSlice> slices = new ArrayList<>();
    private final List<ResidencyCounterSample> residencySamples = new ArrayList<>();

    CpuStreams(final int cpu) {
        this.cpu = cpu;
    }

    public int getCpu() {
        return cpu;
    }

    @Nonnull
    public List<StateChangeEvent> getFrequencyEvents() {
        return Collections.unmodifiableList(frequencyEvents);
    }

    @Nonnull
    public List<StateChangeEvent> getIdleEvents() {
        return Collections.unmodifiableList(idleEvents);
    }

    /**
     * Scheduling slices of the CPU, idle thread included, ordered by start.
     *
     * @return the slices
     */
    @Nonnull
    public List<RunningSlice> getSlices() {
        return Collections.unmodifiableList(slices);
    }

    @Nonnull
    public List<ResidencyCounterSample> getResidencySamples() {
        return Collections.unmodifiableList(residencySamples);
    }

    void addEvent(@Nonnull final StateChangeEvent event) {
        switch (event.getKind()) {
            case FREQUENCY_SET:
                frequencyEvents.add(event);
                break;
            case IDLE_ENTER_EXIT:
                idleEvents.add(event);
                break;
            default:
                throw new IllegalArgumentException("Unsupported event kind " + event.getKind());
        }
    }

    void addSlice(@Nonnull final RunningSlice slice) {
        slices.add(slice);
    }

    void addResidencySample(@Nonnull final ResidencyCounterSample sample) {
        residencySamples.add(sample);
    }
}
