package com.queryengine.domain.service;

import com.queryengine.domain.exception.SecurityViolationException;
import com.queryengine.domain.model.AnalyticsQueryParams;
import com.queryengine.domain.model.ComparisonType;
import com.queryengine.domain.model.DataSourceConfig;
import com.queryengine.domain.model.DateRange;
import com.queryengine.domain.model.FilterOperator;
import com.queryengine.domain.model.PeriodComparison;
import com.queryengine.domain.model.QueryFilter;
import com.queryengine.domain.model.SeriesSpec;
import com.queryengine.domain.model.ValidationError;
import com.queryengine.domain.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Whitelists tables, fields and operators against a data source description.
 *
 * Anything not explicitly allowed fails closed: a filter on an unknown field
 * rejects the whole request instead of being dropped. No I/O happens here.
 */
@Slf4j
@Component
public class QueryValidator {

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]{0,62}$");

    public void validateTable(String table, String schema, DataSourceConfig config) {
        if (!isIdentifier(table) || !isIdentifier(schema)) {
            throw violation("table", "malformed table identifier");
        }
        if (config == null || !config.isActive()) {
            throw violation("table", "data source is not configured or inactive");
        }
        if (!table.equals(config.getTableName()) || !schema.equals(config.getSchemaName())) {
            throw violation("table", "table is not registered for this data source");
        }
    }

    public void validateField(String field, String table, String schema, DataSourceConfig config) {
        validateTable(table, schema, config);
        if (!isIdentifier(field) || !config.getAllowedFields().contains(field)) {
            throw violation(field, "field is not allowed for this data source");
        }
    }

    public FilterOperator validateOperator(String operator) {
        return FilterOperator.fromCode(operator)
                .orElseThrow(() -> violation("operator", "operator is not allowed"));
    }

    /**
     * Structural checks that do not need the data source configuration.
     */
    public ValidationResult validateRequest(AnalyticsQueryParams params) {
        List<ValidationError> errors = new ArrayList<>();

        if (params.getDataSourceId() == null || params.getDataSourceId() <= 0) {
            errors.add(new ValidationError("dataSourceId", "data source id is required"));
        }

        if (params.getStartDate() != null && params.getEndDate() != null
                && params.getStartDate().isAfter(params.getEndDate())) {
            errors.add(new ValidationError("startDate", "start date is after end date"));
        }

        if (params.hasMultipleSeries()) {
            validateSeries(params, errors);
        }

        if (params.hasPeriodComparison()) {
            validatePeriodComparison(params, errors);
        }

        return ValidationResult.of(errors);
    }

    /**
     * Structural checks plus whitelist checks of the caller's own filters.
     */
    public ValidationResult validateParams(AnalyticsQueryParams params, DataSourceConfig config) {
        List<ValidationError> errors = new ArrayList<>(validateRequest(params).getErrors());
        errors.addAll(validateFilters(params.getFilters(), config).getErrors());
        return ValidationResult.of(errors);
    }

    /**
     * Whitelist check of a complete filter list, including per-field operator limits.
     */
    public ValidationResult validateFilters(List<QueryFilter> filters, DataSourceConfig config) {
        List<ValidationError> errors = new ArrayList<>();
        if (filters == null) {
            return ValidationResult.ok();
        }
        if (config == null || !config.isActive()) {
            errors.add(new ValidationError("table", "data source is not configured or inactive"));
            return ValidationResult.of(errors);
        }

        for (QueryFilter filter : filters) {
            String field = filter.getField();
            if (!isIdentifier(field) || !config.getAllowedFields().contains(field)) {
                errors.add(new ValidationError(field, "field is not allowed for this data source"));
                continue;
            }

            FilterOperator operator = FilterOperator.fromCode(filter.operatorOrDefault()).orElse(null);
            if (operator == null) {
                errors.add(new ValidationError(field, "operator is not allowed"));
                continue;
            }

            if (!isOperatorAllowedForField(field, operator, config)) {
                errors.add(new ValidationError(field, "operator " + operator.getCode() + " is not allowed for this field"));
            }
        }

        if (!errors.isEmpty()) {
            log.warn("Rejected {} filter(s) for data source {}", errors.size(), config.getDataSourceId());
        }
        return ValidationResult.of(errors);
    }

    public boolean isIdentifier(String value) {
        return value != null && IDENTIFIER.matcher(value).matches();
    }

    private boolean isOperatorAllowedForField(String field, FilterOperator operator, DataSourceConfig config) {
        Map<String, Set<FilterOperator>> perField = config.getAllowedOperatorsPerField();
        if (perField == null || !perField.containsKey(field)) {
            return true;
        }
        return perField.get(field).contains(operator);
    }

    private void validateSeries(AnalyticsQueryParams params, List<ValidationError> errors) {
        for (SeriesSpec series : params.getMultipleSeries()) {
            if (series.getMeasure() == null || series.getMeasure().isBlank()) {
                errors.add(new ValidationError("multipleSeries", "every series needs a measure"));
                return;
            }
            // One consolidated statement can only carry one frequency predicate
            if (series.getFrequency() != null && !series.getFrequency().equals(params.getFrequency())) {
                errors.add(new ValidationError("multipleSeries", "series frequencies must match the request frequency"));
                return;
            }
        }
    }

    private void validatePeriodComparison(AnalyticsQueryParams params, List<ValidationError> errors) {
        PeriodComparison comparison = params.getPeriodComparison();

        DateRange current = params.currentRange();
        if (params.getFrequency() == null || current == null
                || current.getStart() == null || current.getEnd() == null) {
            errors.add(new ValidationError("periodComparison", "frequency, start date and end date are required"));
            return;
        }
        if (current.getStart().isAfter(current.getEnd())) {
            errors.add(new ValidationError("periodComparison", "current range is invalid"));
            return;
        }

        if (comparison.getComparisonRange() != null) {
            if (comparison.getComparisonRange().getStart() == null
                    || comparison.getComparisonRange().getEnd() == null
                    || comparison.getComparisonRange().getStart().isAfter(comparison.getComparisonRange().getEnd())) {
                errors.add(new ValidationError("periodComparison", "comparison range is invalid"));
            }
            return;
        }

        if (comparison.getComparisonType() == null) {
            errors.add(new ValidationError("periodComparison", "comparison type is required"));
            return;
        }

        if (comparison.getComparisonType() == ComparisonType.CUSTOM_PERIOD
                && (comparison.getCustomPeriodOffset() == null || comparison.getCustomPeriodOffset() < 1)) {
            errors.add(new ValidationError("periodComparison", "custom period offset must be at least 1"));
        }
    }

    private SecurityViolationException violation(String field, String reason) {
        log.warn("Security violation on {}: {}", SecurityViolationException.displayField(field), reason);
        return new SecurityViolationException(field, reason);
    }
}
