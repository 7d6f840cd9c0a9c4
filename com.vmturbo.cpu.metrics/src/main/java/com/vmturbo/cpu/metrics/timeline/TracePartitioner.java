package com.vmturbo.cpu.metrics.timeline;

import javax.annotation.Nonnull;

import it.unimi.dsi.fastutil.ints.Int2LongMap;
import it.unimi.dsi.fastutil.ints.Int2LongOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectAVLTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;

import com.vmturbo.cpu.metrics.api.MalformedStreamException;
import com.vmturbo.cpu.metrics.api.ResidencyCounterSample;
import com.vmturbo.cpu.metrics.api.RunningSlice;
import com.vmturbo.cpu.metrics.api.StateChangeEvent;
import com.vmturbo.cpu.metrics.api.TraceBounds;
import com.vmturbo.cpu.metrics.api.TraceData;
import com.vmturbo.cpu.metrics.api.TraceEntities;

/**
 * Splits the streams of a trace by CPU so each CPU can be processed independently.
 *
 * <p>Referential checks happen here: every event and slice must name a registered CPU, every
 * slice a registered thread. Slices must be well formed, inside the trace, and ordered by
 * start within their CPU. Event timestamps are checked later, by the {@link TimelineBuilder}.</p>
 */
public class TracePartitioner {

    /**
     * Partition a trace by CPU. Every registered CPU gets an entry, possibly with empty streams.
     *
     * @param trace the trace
     * @return per-CPU streams in ascending CPU order
     * @throws MalformedStreamException if a stream refers to an unknown entity or a slice is
     *                                  malformed
     */
    @Nonnull
    public Int2ObjectSortedMap<CpuStreams> partition(@Nonnull final TraceData trace)
            throws MalformedStreamException {
        final TraceEntities entities = trace.getEntities();
        final TraceBounds bounds = trace.getBounds();
        final Int2ObjectSortedMap<CpuStreams> streams = new Int2ObjectAVLTreeMap<>();
        for (int cpu : entities.getCpus()) {
            streams.put(cpu, new CpuStreams(cpu));
        }
        for (StateChangeEvent event : trace.getEvents()) {
            final CpuStreams cpuStreams = streams.get(event.getCpu());
            if (cpuStreams == null) {
                throw new MalformedStreamException("Event refers to unknown cpu: " + event);
            }
            cpuStreams.addEvent(event);
        }
        final Int2LongMap lastStart = new Int2LongOpenHashMap();
        for (RunningSlice slice : trace.getSlices()) {
            final CpuStreams cpuStreams = streams.get(slice.getCpu());
            if (cpuStreams == null) {
                throw new MalformedStreamException("Slice refers to unknown cpu: " + slice);
            }
            if (!entities.getThread(slice.getUtid()).isPresent()) {
                throw new MalformedStreamException("Slice refers to unknown thread: " + slice);
            }
            checkSlice(slice, bounds);
            if (lastStart.containsKey(slice.getCpu())
                    && slice.getStart() < lastStart.get(slice.getCpu())) {
                throw new MalformedStreamException(String.format(
                        "Slice %s starts before the previous slice of cpu %d at %d",
                        slice, slice.getCpu(), lastStart.get(slice.getCpu())));
            }
            lastStart.put(slice.getCpu(), slice.getStart());
            cpuStreams.addSlice(slice);
        }
        for (ResidencyCounterSample sample : trace.getResidencySamples()) {
            final CpuStreams cpuStreams = streams.get(sample.getCpu());
            if (cpuStreams == null) {
                throw new MalformedStreamException("Residency sample refers to unknown cpu: " + sample);
            }
            cpuStreams.addResidencySample(sample);
        }
        return streams;
    }

    private static void checkSlice(@Nonnull final RunningSlice slice,
                                   @Nonnull final TraceBounds bounds)
            throws MalformedStreamException {
        if (!bounds.contains(slice.getStart())) {
            throw new MalformedStreamException(
                    "Slice " + slice + " starts outside trace bounds " + bounds);
        }
        if (!slice.isOpen()) {
            if (slice.getEnd() < slice.getStart()) {
                throw new MalformedStreamException("Slice " + slice + " ends before it starts");
            }
            if (!bounds.contains(slice.getEnd())) {
                throw new MalformedStreamException(
                        "Slice " + slice + " ends outside trace bounds " + bounds);
            }
        }
    }
}
