package com.queryengine.domain.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Fixed whitelist of filter operators.
 *
 * The caller only ever picks one of these by code; the SQL text emitted for a
 * filter always comes from {@link #getSqlOperator()}, never from the request.
 */
public enum FilterOperator {
    EQ("eq", "="),
    NEQ("neq", "!="),
    GT("gt", ">"),
    GTE("gte", ">="),
    LT("lt", "<"),
    LTE("lte", "<="),
    IN("in", "= ANY"),
    NOT_IN("not_in", "<> ALL"),
    LIKE("like", "ILIKE"),
    BETWEEN("between", "BETWEEN");

    private static final Map<String, FilterOperator> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(FilterOperator::getCode, Function.identity()));

    private final String code;
    private final String sqlOperator;

    FilterOperator(String code, String sqlOperator) {
        this.code = code;
        this.sqlOperator = sqlOperator;
    }

    public String getCode() {
        return code;
    }

    public String getSqlOperator() {
        return sqlOperator;
    }

    public boolean isMultiValued() {
        return this == IN || this == NOT_IN;
    }

    public static Optional<FilterOperator> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_CODE.get(code));
    }
}
