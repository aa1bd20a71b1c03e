package com.queryengine.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A single caller-supplied predicate.
 *
 * {@code operator} is kept as the raw request string; it is checked against
 * {@link FilterOperator} before anything is built from it.
 */
@Value
@Builder
@Jacksonized
@AllArgsConstructor
public class QueryFilter {

    String field;
    String operator;
    Object value;

    /**
     * A filter sent without an operator means equality.
     */
    public String operatorOrDefault() {
        return operator == null ? FilterOperator.EQ.getCode() : operator;
    }

    public static QueryFilter of(String field, FilterOperator operator, Object value) {
        return new QueryFilter(field, operator.getCode(), value);
    }
}
