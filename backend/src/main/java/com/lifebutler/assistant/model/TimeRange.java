package com.lifebutler.assistant.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;

/**
 * Time window used to filter records. Membership is half-open: {@code [start, effectiveEnd)}.
 * A missing bound means unbounded on that side.
 */
@Value
@Builder
@AllArgsConstructor
public class TimeRange {

    LocalDateTime start;
    LocalDateTime end;
    TimePeriod period;

    public static TimeRange forPeriod(TimePeriod period, Clock clock) {
        LocalDate today = LocalDate.now(clock);
        LocalDate start;
        switch (period) {
            case TODAY:
                start = today;
                break;
            case THIS_WEEK:
                start = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
                break;
            case LAST_WEEK:
                start = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).minusWeeks(1);
                break;
            case THIS_MONTH:
                start = today.withDayOfMonth(1);
                break;
            case LAST_MONTH:
                start = today.withDayOfMonth(1).minusMonths(1);
                break;
            case THIS_YEAR:
                start = today.withDayOfYear(1);
                break;
            case LAST_YEAR:
                start = today.withDayOfYear(1).minusYears(1);
                break;
            default:
                throw new IllegalArgumentException("Unsupported period: " + period);
        }
        return new TimeRange(start.atStartOfDay(), null, period);
    }

    public static TimeRange between(LocalDateTime start, LocalDateTime end) {
        return new TimeRange(start, end, null);
    }

    /**
     * Explicit end if set, otherwise the end implied by the period.
     */
    public LocalDateTime getEffectiveEnd() {
        if (end != null) {
            return end;
        }
        if (period == null || start == null) {
            return null;
        }
        switch (period) {
            case TODAY:
                return start.plusDays(1);
            case THIS_WEEK:
            case LAST_WEEK:
                return start.plusDays(7);
            case THIS_MONTH:
            case LAST_MONTH:
                return start.plusMonths(1);
            case THIS_YEAR:
            case LAST_YEAR:
                return start.plusYears(1);
            default:
                return null;
        }
    }

    public boolean contains(LocalDateTime instant) {
        if (instant == null) {
            return false;
        }
        if (start != null && instant.isBefore(start)) {
            return false;
        }
        LocalDateTime effectiveEnd = getEffectiveEnd();
        return effectiveEnd == null || instant.isBefore(effectiveEnd);
    }

    public String getDescription() {
        if (period != null) {
            return period.getLabel();
        }
        if (start != null && end != null) {
            return "from " + start.toLocalDate() + " to " + end.toLocalDate();
        }
        if (start != null) {
            return "since " + start.toLocalDate();
        }
        if (end != null) {
            return "until " + end.toLocalDate();
        }
        return "all time";
    }
}
