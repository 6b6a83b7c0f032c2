package com.peopleanalytics.dashboard.model;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Inclusive date range.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Start date must be before or equal to end date");
        }
    }

    /**
     * Fills missing bounds with the first day of the current month and today.
     */
    public static DateRange resolve(LocalDate start, LocalDate end, Clock clock) {
        LocalDate today = LocalDate.now(clock);
        LocalDate resolvedEnd = end != null ? end : today;
        LocalDate resolvedStart = start != null ? start : resolvedEnd.withDayOfMonth(1);
        return new DateRange(resolvedStart, resolvedEnd);
    }
}
