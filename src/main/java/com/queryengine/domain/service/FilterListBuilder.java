package com.queryengine.domain.service;

import com.queryengine.domain.model.AnalyticsQueryParams;
import com.queryengine.domain.model.ColumnMappings;
import com.queryengine.domain.model.FilterOperator;
import com.queryengine.domain.model.QueryFilter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the named request parameters into filters on the table's own columns.
 */
@Component
public class FilterListBuilder {

    public List<QueryFilter> build(AnalyticsQueryParams params, ColumnMappings mappings) {
        List<QueryFilter> filters = new ArrayList<>();

        if (params.getMeasure() != null) {
            filters.add(QueryFilter.of(ColumnMappings.MEASURE_FIELD, FilterOperator.EQ, params.getMeasure()));
        }

        if (params.getFrequency() != null) {
            filters.add(QueryFilter.of(mappings.getTimePeriodField(), FilterOperator.EQ, params.getFrequency()));
        }

        if (params.getStartDate() != null) {
            filters.add(QueryFilter.of(mappings.getDateField(), FilterOperator.GTE, params.getStartDate()));
        }

        if (params.getEndDate() != null) {
            filters.add(QueryFilter.of(mappings.getDateField(), FilterOperator.LTE, params.getEndDate()));
        }

        if (params.getFilters() != null) {
            for (QueryFilter filter : params.getFilters()) {
                filters.add(new QueryFilter(filter.getField(), filter.operatorOrDefault(), filter.getValue()));
            }
        }

        return filters;
    }
}
