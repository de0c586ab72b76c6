package com.darksite.metering.domain.model;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Date range a billing export covers, start inclusive and end exclusive.
 */
public record ReportingPeriod(LocalDate startDate, LocalDate endDate) {

    public ReportingPeriod {
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(endDate, "endDate");
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("Period ends before it starts: " + startDate + " - " + endDate);
        }
    }

    /**
     * Yesterday 00:00 to today 00:00 in the clock's zone.
     */
    public static ReportingPeriod previousDay(Clock clock) {
        LocalDate today = LocalDate.now(clock);
        return new ReportingPeriod(today.minusDays(1), today);
    }
}
