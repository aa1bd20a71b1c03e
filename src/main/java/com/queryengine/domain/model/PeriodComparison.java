package com.queryengine.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Period comparison request.
 *
 * When {@code comparisonRange} is absent it is derived from
 * {@code comparisonType} and the request frequency.
 */
@Value
@Builder
@Jacksonized
public class PeriodComparison {

    boolean enabled;
    ComparisonType comparisonType;
    Integer customPeriodOffset;
    DateRange currentRange;
    DateRange comparisonRange;
}
