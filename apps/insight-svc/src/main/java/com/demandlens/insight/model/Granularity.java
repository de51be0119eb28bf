package com.demandlens.insight.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Calendar bucketing policy. Weeks follow ISO-8601 (Monday start, week-based year),
 * months follow calendar boundaries.
 */
public enum Granularity {
    DAILY,
    WEEKLY,
    MONTHLY;

    private static final DateTimeFormatter MONTH_FMT = DateTimeFormatter.ofPattern("yyyy-MM");

    public LocalDate periodStart(LocalDate date) {
        return switch (this) {
            case DAILY -> date;
            case WEEKLY -> date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTHLY -> date.withDayOfMonth(1);
        };
    }

    public LocalDate periodEnd(LocalDate date) {
        LocalDate start = periodStart(date);
        return switch (this) {
            case DAILY -> start;
            case WEEKLY -> start.plusDays(6);
            case MONTHLY -> start.with(TemporalAdjusters.lastDayOfMonth());
        };
    }

    public String label(LocalDate date) {
        return switch (this) {
            case DAILY -> date.toString();
            case WEEKLY -> String.format(Locale.ROOT, "%d-W%02d",
                    date.get(IsoFields.WEEK_BASED_YEAR), date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
            case MONTHLY -> MONTH_FMT.format(date);
        };
    }

    /**
     * Moves {@code date} by a signed number of whole periods.
     */
    public LocalDate shift(LocalDate date, int periods) {
        return switch (this) {
            case DAILY -> date.plusDays(periods);
            case WEEKLY -> date.plusWeeks(periods);
            case MONTHLY -> date.plusMonths(periods);
        };
    }
}
