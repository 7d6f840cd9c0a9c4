package com.vmturbo.cpu.metrics.idle;

import static com.vmturbo.cpu.metrics.CpuMetricsTestUtils.MS;
import static com.vmturbo.cpu.metrics.CpuMetricsTestUtils.SEC;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.junit.Test;

import com.vmturbo.cpu.metrics.api.MalformedStreamException;
import com.vmturbo.cpu.metrics.api.ResidencyCounterSample;
import com.vmturbo.cpu.metrics.api.rows.IdleTimeInStateRow;

/**
 * Unit tests for {@link IdleTimeInStateCalculator}.
 */
public class IdleTimeInStateCalculatorTest {

    private static final long T0 = 200 * SEC;

    private static final long US = 1_000L;

    private final IdleTimeInStateCalculator calculator =
            new IdleTimeInStateCalculator("cpuidle.", "C0");

    /**
     * A microsecond counter growing by 100 every millisecond gives 10% residency over a time
     * slice of 1000 microseconds, and a 90% active state.
     *
     * @throws MalformedStreamException should not happen
     */
    @Test
    public void testSingleCpu() throws MalformedStreamException {
        final List<ResidencyDelta> deltas = calculator.computeDeltas(0, Arrays.asList(
                new ResidencyCounterSample(T0, 0, "C8", 1_000_000),
                new ResidencyCounterSample(T0 + MS, 0, "C8", 1_000_100),
                new ResidencyCounterSample(T0 + 2 * MS, 0, "C8", 1_000_200)));
        assertThat(deltas, contains(
                new ResidencyDelta(T0 + MS, 0, "C8", 100, 1000),
                new ResidencyDelta(T0 + 2 * MS, 0, "C8", 100, 1000)));

        assertThat(calculator.toSystemRows(deltas), contains(
                new IdleTimeInStateRow(T0 + MS, null, "cpuidle.C8", 10.0, 100.0, 1000),
                new IdleTimeInStateRow(T0 + 2 * MS, null, "cpuidle.C8", 10.0, 100.0, 1000),
                new IdleTimeInStateRow(T0 + MS, null, "cpuidle.C0", 90.0, 900.0, 1000),
                new IdleTimeInStateRow(T0 + 2 * MS, null, "cpuidle.C0", 90.0, 900.0, 1000)));
    }

    /**
     * The same microsecond counter sampled a second apart is a hundredth of a percent idle.
     *
     * @throws MalformedStreamException should not happen
     */
    @Test
    public void testSlowSamplingKeepsCounterUnit() throws MalformedStreamException {
        final List<ResidencyDelta> deltas = calculator.computeDeltas(0, Arrays.asList(
                new ResidencyCounterSample(T0, 0, "C8", 1_000_000),
                new ResidencyCounterSample(T0 + SEC, 0, "C8", 1_000_100)));
        assertThat(deltas, contains(new ResidencyDelta(T0 + SEC, 0, "C8", 100, 1_000_000)));
        final List<IdleTimeInStateRow> rows = calculator.toSystemRows(deltas);
        assertThat(rows.get(0).getIdlePercentage(), closeTo(0.01, 1e-9));
        assertThat(rows.get(1).getIdlePercentage(), closeTo(99.99, 1e-9));
        assertThat(rows.get(1).getTotalResidency(), closeTo(999_900.0, 1e-9));
    }

    /**
     * A counter with its own unit gets time slices in that unit.
     *
     * @throws MalformedStreamException should not happen
     */
    @Test
    public void testNanosecondCounter() throws MalformedStreamException {
        final List<ResidencyDelta> deltas = calculator.computeDeltas(0, Arrays.asList(
                new ResidencyCounterSample(T0, 0, "C8", 0, 1),
                new ResidencyCounterSample(T0 + MS, 0, "C8", 250_000, 1)));
        assertThat(deltas, contains(new ResidencyDelta(T0 + MS, 0, "C8", 250_000, MS)));
        assertThat(calculator.toSystemRows(deltas).get(0).getIdlePercentage(), closeTo(25.0, 1e-9));
    }

    /**
     * System rows divide the residency of all CPUs by their combined time; per-CPU rows keep
     * the CPUs apart.
     *
     * @throws MalformedStreamException should not happen
     */
    @Test
    public void testMultipleCpus() throws MalformedStreamException {
        final List<ResidencyDelta> deltas = new ArrayList<>();
        deltas.addAll(calculator.computeDeltas(0, Arrays.asList(
                new ResidencyCounterSample(T0, 0, "C1", 0),
                new ResidencyCounterSample(T0 + MS, 0, "C1", 200))));
        deltas.addAll(calculator.computeDeltas(1, Arrays.asList(
                new ResidencyCounterSample(T0, 1, "C1", 50),
                new ResidencyCounterSample(T0 + MS, 1, "C1", 450))));

        assertThat(calculator.toSystemRows(deltas), contains(
                new IdleTimeInStateRow(T0 + MS, null, "cpuidle.C1", 30.0, 600.0, 2000),
                new IdleTimeInStateRow(T0 + MS, null, "cpuidle.C0", 70.0, 1400.0, 2000)));
        assertThat(calculator.toPerCpuRows(deltas), contains(
                new IdleTimeInStateRow(T0 + MS, 0, "cpuidle.C1", 20.0, 200.0, 1000),
                new IdleTimeInStateRow(T0 + MS, 0, "cpuidle.C0", 80.0, 800.0, 1000),
                new IdleTimeInStateRow(T0 + MS, 1, "cpuidle.C1", 40.0, 400.0, 1000),
                new IdleTimeInStateRow(T0 + MS, 1, "cpuidle.C0", 60.0, 600.0, 1000)));
    }

    /**
     * The percentages of all states at a timestamp, active state included, add up to 100.
     *
     * @throws MalformedStreamException should not happen
     */
    @Test
    public void testPercentagesAddUpToHundred() throws MalformedStreamException {
        final List<ResidencyDelta> deltas = calculator.computeDeltas(2, Arrays.asList(
                new ResidencyCounterSample(T0, 2, "C1", 0),
                new ResidencyCounterSample(T0, 2, "C2", 0),
                new ResidencyCounterSample(T0, 2, "C3", 0),
                new ResidencyCounterSample(T0 + 3 * MS, 2, "C1", 1),
                new ResidencyCounterSample(T0 + 3 * MS, 2, "C2", 1),
                new ResidencyCounterSample(T0 + 3 * MS, 2, "C3", 0),
                new ResidencyCounterSample(T0 + 10 * MS, 2, "C1", 2),
                new ResidencyCounterSample(T0 + 10 * MS, 2, "C2", 3),
                new ResidencyCounterSample(T0 + 10 * MS, 2, "C3", 4)));
        final Map<Long, Double> totals = new TreeMap<>();
        for (IdleTimeInStateRow row : calculator.toSystemRows(deltas)) {
            totals.merge(row.getTs(), row.getIdlePercentage(), Double::sum);
        }
        assertThat(totals.size(), is(2));
        for (double total : totals.values()) {
            assertThat(total, closeTo(100.0, 1e-9));
        }
    }

    /**
     * A stream with a single sample has no baseline and produces nothing.
     *
     * @throws MalformedStreamException should not happen
     */
    @Test
    public void testSingleSample() throws MalformedStreamException {
        final List<ResidencyDelta> deltas = calculator.computeDeltas(0,
                Collections.singletonList(new ResidencyCounterSample(T0, 0, "C8", 10)));
        assertThat(deltas, is(empty()));
        assertThat(calculator.toSystemRows(deltas), is(empty()));
    }

    /**
     * Samples closer than one counter unit are folded into the next delta.
     *
     * @throws MalformedStreamException should not happen
     */
    @Test
    public void testSubUnitSampleFolded() throws MalformedStreamException {
        final List<ResidencyDelta> deltas = calculator.computeDeltas(0, Arrays.asList(
                new ResidencyCounterSample(T0, 0, "C8", 0),
                new ResidencyCounterSample(T0 + US / 2, 0, "C8", 0),
                new ResidencyCounterSample(T0 + 2 * US, 0, "C8", 1)));
        assertThat(deltas, contains(new ResidencyDelta(T0 + 2 * US, 0, "C8", 1, 2)));
    }

    /**
     * A counter changing its unit mid-stream is malformed.
     *
     * @throws MalformedStreamException expected
     */
    @Test(expected = MalformedStreamException.class)
    public void testChangingCounterUnit() throws MalformedStreamException {
        calculator.computeDeltas(0, Arrays.asList(
                new ResidencyCounterSample(T0, 0, "C8", 100),
                new ResidencyCounterSample(T0 + MS, 0, "C8", 200, 1)));
    }

    /**
     * A counter going backwards is malformed.
     *
     * @throws MalformedStreamException expected
     */
    @Test(expected = MalformedStreamException.class)
    public void testDecreasingCounter() throws MalformedStreamException {
        calculator.computeDeltas(0, Arrays.asList(
                new ResidencyCounterSample(T0, 0, "C8", 100),
                new ResidencyCounterSample(T0 + SEC, 0, "C8", 99)));
    }

    /**
     * Timestamps going backwards are malformed.
     *
     * @throws MalformedStreamException expected
     */
    @Test(expected = MalformedStreamException.class)
    public void testDecreasingTimestamp() throws MalformedStreamException {
        calculator.computeDeltas(0, Arrays.asList(
                new ResidencyCounterSample(T0 + SEC, 0, "C8", 100),
                new ResidencyCounterSample(T0, 0, "C8", 100)));
    }
}
