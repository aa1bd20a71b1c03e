package com.queryengine.domain.service;

import com.queryengine.domain.exception.QueryValidationException;
import com.queryengine.domain.model.ComparisonType;
import com.queryengine.domain.model.DateRange;
import com.queryengine.domain.model.PeriodComparison;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Derives the comparison half of a period comparison from the current range.
 *
 * Frequencies map to calendar units: Daily, Weekly, Monthly, Quarterly and
 * Yearly (or Annual). Month-based shifts keep month-end alignment so that
 * Feb 1 - Feb 29 compares against Jan 1 - Jan 31.
 */
@Component
public class ComparisonPeriodCalculator {

    public DateRange calculate(DateRange current, String frequency, PeriodComparison comparison) {
        if (comparison.getComparisonRange() != null) {
            return comparison.getComparisonRange();
        }

        PeriodUnit unit = PeriodUnit.of(frequency);
        ComparisonType type = comparison.getComparisonType();
        if (type == null) {
            throw new QueryValidationException("periodComparison", "comparison type is required");
        }

        return switch (type) {
            case SAME_PERIOD_LAST_YEAR -> shiftMonths(current, 12);
            case PREVIOUS_PERIOD -> shift(current, unit, unit.periodsBetween(current.getStart(), current.getEnd()));
            case CUSTOM_PERIOD -> shift(current, unit, requireOffset(comparison));
        };
    }

    /**
     * Human label for the comparison rows, e.g. "Previous Month" or "3 Months Ago".
     */
    public String label(String frequency, PeriodComparison comparison) {
        if (comparison.getComparisonRange() != null && comparison.getComparisonType() == null) {
            return "Comparison Period";
        }
        PeriodUnit unit = PeriodUnit.of(frequency);
        return switch (comparison.getComparisonType()) {
            case SAME_PERIOD_LAST_YEAR -> "Same Period Last Year";
            case PREVIOUS_PERIOD -> "Previous " + unit.singular;
            case CUSTOM_PERIOD -> {
                int offset = requireOffset(comparison);
                yield offset == 1
                        ? "Previous " + unit.singular
                        : offset + " " + unit.singular + "s Ago";
            }
        };
    }

    private DateRange shift(DateRange current, PeriodUnit unit, long periods) {
        if (unit.months > 0) {
            return shiftMonths(current, periods * unit.months);
        }
        long days = periods * unit.days;
        return new DateRange(current.getStart().minusDays(days), current.getEnd().minusDays(days));
    }

    private DateRange shiftMonths(DateRange current, long months) {
        LocalDate start = current.getStart().minusMonths(months);
        LocalDate end = current.getEnd().minusMonths(months);
        if (isMonthEnd(current.getEnd())) {
            end = end.with(TemporalAdjusters.lastDayOfMonth());
        }
        return new DateRange(start, end);
    }

    private static boolean isMonthEnd(LocalDate date) {
        return date.equals(date.with(TemporalAdjusters.lastDayOfMonth()));
    }

    private static int requireOffset(PeriodComparison comparison) {
        Integer offset = comparison.getCustomPeriodOffset();
        if (offset == null || offset < 1) {
            throw new QueryValidationException("periodComparison", "custom period offset must be at least 1");
        }
        return offset;
    }

    private enum PeriodUnit {
        DAY("Day", 1, 0),
        WEEK("Week", 7, 0),
        MONTH("Month", 0, 1),
        QUARTER("Quarter", 0, 3),
        YEAR("Year", 0, 12);

        private final String singular;
        private final int days;
        private final int months;

        PeriodUnit(String singular, int days, int months) {
            this.singular = singular;
            this.days = days;
            this.months = months;
        }

        static PeriodUnit of(String frequency) {
            if (frequency == null) {
                throw new QueryValidationException("frequency", "frequency is required");
            }
            return switch (frequency.toLowerCase(Locale.ROOT)) {
                case "daily" -> DAY;
                case "weekly" -> WEEK;
                case "monthly" -> MONTH;
                case "quarterly" -> QUARTER;
                case "yearly", "annual", "annually" -> YEAR;
                default -> throw new QueryValidationException("frequency", "unsupported frequency for period comparison");
            };
        }

        /**
         * Number of whole units the inclusive range touches, at least one.
         */
        long periodsBetween(LocalDate start, LocalDate end) {
            long count;
            if (months > 0) {
                long spannedMonths = ChronoUnit.MONTHS.between(start.withDayOfMonth(1), end.withDayOfMonth(1)) + 1;
                count = (spannedMonths + months - 1) / months;
            } else {
                long spannedDays = ChronoUnit.DAYS.between(start, end) + 1;
                count = (spannedDays + days - 1) / days;
            }
            return Math.max(1, count);
        }
    }
}
