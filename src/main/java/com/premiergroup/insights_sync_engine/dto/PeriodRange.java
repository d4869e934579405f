package com.premiergroup.insights_sync_engine.dto;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;

import static java.time.temporal.ChronoUnit.DAYS;

/**
 * Inclusive calendar date range.
 */
public record PeriodRange(LocalDate start, LocalDate end) {

    public PeriodRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Period start and end are required");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Period start " + start + " is after end " + end);
        }
    }

    /**
     * Monday..Sunday week containing the reference date.
     */
    public static PeriodRange weekOf(LocalDate reference) {
        LocalDate monday = reference.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        return new PeriodRange(monday, monday.plusDays(6));
    }

    public static PeriodRange monthOf(LocalDate reference) {
        return new PeriodRange(
                reference.with(TemporalAdjusters.firstDayOfMonth()),
                reference.with(TemporalAdjusters.lastDayOfMonth()));
    }

    public long days() {
        return DAYS.between(start, end) + 1;
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    /**
     * The period of equal length that ends the day before this one starts.
     */
    public PeriodRange previous() {
        LocalDate prevEnd = start.minusDays(1);
        return new PeriodRange(prevEnd.minusDays(days() - 1), prevEnd);
    }

    public List<PeriodRange> weeks() {
        List<PeriodRange> weeks = new ArrayList<>();
        for (PeriodRange w = weekOf(start); !w.start().isAfter(end); w = weekOf(w.end().plusDays(1))) {
            weeks.add(w);
        }
        return weeks;
    }

    public List<PeriodRange> months() {
        List<PeriodRange> months = new ArrayList<>();
        for (PeriodRange m = monthOf(start); !m.start().isAfter(end); m = monthOf(m.end().plusDays(1))) {
            months.add(m);
        }
        return months;
    }
}
