package com.queryengine.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

/**
 * Declarative analytics request.
 *
 * Never mutated after validation. Sub-queries (series consolidation, the two
 * halves of a period comparison) are derived with {@link #toBuilder()} so no
 * two executions share a params instance.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AnalyticsQueryParams {

    Integer dataSourceId;
    String measure;
    String frequency;
    LocalDate startDate;
    LocalDate endDate;

    @Builder.Default
    List<QueryFilter> filters = List.of();

    List<SeriesSpec> multipleSeries;

    PeriodComparison periodComparison;

    // Run the summary aggregation alongside the row query
    boolean includeTotals;

    // Skip the result cache read; the fresh result is still cached
    boolean noCache;

    public boolean hasMultipleSeries() {
        return multipleSeries != null && !multipleSeries.isEmpty();
    }

    public boolean hasPeriodComparison() {
        return periodComparison != null && periodComparison.isEnabled();
    }

    /**
     * The current half of a period comparison: the explicit range when given,
     * otherwise the request dates. Null when neither is complete.
     */
    public DateRange currentRange() {
        if (periodComparison != null && periodComparison.getCurrentRange() != null) {
            return periodComparison.getCurrentRange();
        }
        if (startDate == null || endDate == null) {
            return null;
        }
        return new DateRange(startDate, endDate);
    }
}
