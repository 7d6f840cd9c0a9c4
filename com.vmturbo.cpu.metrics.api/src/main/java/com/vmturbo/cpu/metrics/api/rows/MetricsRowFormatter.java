package com.vmturbo.cpu.metrics.api.rows;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Renders metric rows as CSV. Column names are quoted, fractions have 6 decimal places, counts
 * and durations are integers, and state names are quoted strings.
 */
public class MetricsRowFormatter {

    private static final Joiner COMMA = Joiner.on(',');

    private static final Joiner NEWLINE = Joiner.on('\n');

    private static final List<String> CYCLE_COLUMNS = ImmutableList.of(
            "millicycles", "megacycles", "runtime", "min_freq", "max_freq", "avg_freq");

    /**
     * Format utilization rows.
     *
     * @param rows the rows
     * @return CSV with a header line
     */
    @Nonnull
    public String formatUtilization(@Nonnull final List<UtilizationRow> rows) {
        return format(ImmutableList.of("ts", "utilization", "unnormalized_utilization"), rows,
                row -> ImmutableList.of(integer(row.getTs()), fraction(row.getUtilization()),
                        fraction(row.getUnnormalizedUtilization())));
    }

    /**
     * Format cycle rows.
     *
     * @param rows      the rows
     * @param keyColumn name of the key column, e.g. "cpu" or "utid"; null for system-wide rows
     * @return CSV with a header line
     */
    @Nonnull
    public String formatCycles(@Nonnull final List<CycleRow> rows,
                               @Nullable final String keyColumn) {
        final List<String> header = new ArrayList<>();
        if (keyColumn != null) {
            header.add(keyColumn);
        }
        header.addAll(CYCLE_COLUMNS);
        return format(header, rows, row -> {
            final List<String> values = new ArrayList<>();
            if (keyColumn != null) {
                values.add(row.getKey().map(MetricsRowFormatter::integer).orElse(""));
            }
            values.add(integer(row.getMillicycles()));
            values.add(integer(row.getMegacycles()));
            values.add(integer(row.getRuntime()));
            values.add(integer(row.getMinFreq()));
            values.add(integer(row.getMaxFreq()));
            values.add(integer(row.getAvgFreq()));
            return values;
        });
    }

    /**
     * Format idle episode statistics.
     *
     * @param rows the rows
     * @return CSV with a header line
     */
    @Nonnull
    public String formatIdleStats(@Nonnull final List<IdleStatsRow> rows) {
        return format(ImmutableList.of("cpu", "state", "count", "dur", "avg_dur", "idle_percent"),
                rows, row -> ImmutableList.of(integer(row.getCpu()), integer(row.getState()),
                        integer(row.getCount()), integer(row.getDur()), integer(row.getAvgDur()),
                        fraction(row.getIdlePercent())));
    }

    /**
     * Format idle time in state rows. A cpu column is added when any row belongs to a CPU.
     *
     * @param rows the rows
     * @return CSV with a header line
     */
    @Nonnull
    public String formatIdleTimeInState(@Nonnull final List<IdleTimeInStateRow> rows) {
        final boolean perCpu = rows.stream().anyMatch(row -> row.getCpu().isPresent());
        final List<String> header = new ArrayList<>();
        header.add("ts");
        if (perCpu) {
            header.add("cpu");
        }
        header.add("state_name");
        header.add("idle_percentage");
        header.add("total_residency");
        header.add("time_slice");
        return format(header, rows, row -> {
            final List<String> values = new ArrayList<>();
            values.add(integer(row.getTs()));
            if (perCpu) {
                values.add(row.getCpu().map(MetricsRowFormatter::integer).orElse(""));
            }
            values.add(quote(row.getStateName()));
            values.add(fraction(row.getIdlePercentage()));
            values.add(fraction(row.getTotalResidency()));
            values.add(integer(row.getTimeSlice()));
            return values;
        });
    }

    /**
     * Format counter duration rows.
     *
     * @param rows        the rows
     * @param valueColumn name of the value column, e.g. "freq" or "idle"
     * @return CSV with a header line
     */
    @Nonnull
    public String formatCounterDurations(@Nonnull final List<CounterDurationRow> rows,
                                         @Nonnull final String valueColumn) {
        return format(ImmutableList.of(Objects.requireNonNull(valueColumn), "cpu", "dur"), rows,
                row -> ImmutableList.of(integer(row.getValue()), integer(row.getCpu()),
                        integer(row.getDur())));
    }

    @Nonnull
    private static <T> String format(@Nonnull final List<String> header,
                                     @Nonnull final List<T> rows,
                                     @Nonnull final Function<T, List<String>> columns) {
        final List<String> lines = new ArrayList<>(rows.size() + 1);
        final List<String> quotedHeader = new ArrayList<>(header.size());
        for (String column : header) {
            quotedHeader.add(quote(column));
        }
        lines.add(COMMA.join(quotedHeader));
        for (T row : rows) {
            lines.add(COMMA.join(columns.apply(row)));
        }
        return NEWLINE.join(lines);
    }

    @Nonnull
    private static String integer(final long value) {
        return Long.toString(value);
    }

    @Nonnull
    private static String fraction(final double value) {
        return String.format(Locale.ROOT, "%.6f", value);
    }

    @Nonnull
    private static String quote(@Nonnull final String value) {
        return '"' + value + '"';
    }
}
