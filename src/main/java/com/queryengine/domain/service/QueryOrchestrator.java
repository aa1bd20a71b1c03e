package com.queryengine.domain.service;

import com.queryengine.domain.exception.QueryEngineException;
import com.queryengine.domain.exception.QueryValidationException;
import com.queryengine.domain.exception.SecurityViolationException;
import com.queryengine.domain.model.AnalyticsQueryParams;
import com.queryengine.domain.model.ColumnMappings;
import com.queryengine.domain.model.DataSourceConfig;
import com.queryengine.domain.model.FilterOperator;
import com.queryengine.domain.model.QueryFilter;
import com.queryengine.domain.model.QueryResult;
import com.queryengine.domain.model.SecurityContext;
import com.queryengine.domain.model.ValidationResult;
import com.queryengine.infrastructure.cache.AnalyticsCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Entry point of the engine.
 *
 * Pipeline: validate, resolve config, build the filter list, sanitize, route.
 * Routing picks exactly one strategy and calls the executor directly:
 * multiple series first, then period comparison, then a single query.
 * No strategy calls {@link #query} again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryOrchestrator {

    private final QueryValidator validator;
    private final QuerySanitizer sanitizer;
    private final DataSourceConfigService configService;
    private final ColumnMappingService columnMappingService;
    private final FilterListBuilder filterListBuilder;
    private final QueryExecutor executor;
    private final AnalyticsCache cache;

    public QueryResult query(AnalyticsQueryParams params, SecurityContext context) {
        if (params == null) {
            throw new QueryValidationException(null, "query parameters are required");
        }
        if (context == null) {
            throw new SecurityViolationException(null, "security context is required");
        }

        try {
            ValidationResult structural = validator.validateRequest(params);
            if (!structural.isValid()) {
                throw QueryValidationException.from(structural);
            }

            DataSourceConfig config = configService.getConfig(params.getDataSourceId());
            validator.validateTable(config.getTableName(), config.getSchemaName(), config);
            ColumnMappings mappings = columnMappingService.getMappings(config);

            List<QueryFilter> allFilters = filterListBuilder.build(params, mappings);
            ValidationResult whitelist = validator.validateFilters(allFilters, config);
            if (!whitelist.isValid()) {
                throw new SecurityViolationException(whitelist.getErrors());
            }
            allFilters.forEach(this::sanitize);

            AnalyticsQueryParams sanitized = params.toBuilder()
                    .filters(sanitizeCallerFilters(params.getFilters()))
                    .build();

            return route(sanitized, context);

        } catch (QueryValidationException e) {
            log.warn("Rejected query on data source {} for user {}: {} ({})", params.getDataSourceId(),
                    context.getUserId(), e.getMessage(), e.getReason());
            throw e;
        } catch (QueryEngineException e) {
            log.error("Query on data source {} failed for user {}: {}", params.getDataSourceId(),
                    context.getUserId(), e.getMessage());
            throw e;
        }
    }

    /**
     * Drops cached results, config and column mappings for a data source.
     * Called after its underlying table is refreshed or its metadata changes.
     *
     * @return number of cached results removed
     */
    public long invalidateDataSource(int dataSourceId) {
        // The cached config names the table whose mapping entry is stale
        Optional<DataSourceConfig> cached = cache.getDataSourceConfig(dataSourceId);
        cached.ifPresent(this::invalidateColumnMappings);

        Optional<DataSourceConfig> fresh = Optional.empty();
        try {
            fresh = configService.findFresh(dataSourceId);
        } catch (DataAccessException e) {
            log.warn("Metadata lookup failed while invalidating data source {}, clearing cached entries only: {}",
                    dataSourceId, e.getMessage());
        }
        fresh.filter(f -> cached.isEmpty() || !sameTable(cached.get(), f))
                .ifPresent(this::invalidateColumnMappings);

        return cache.invalidateDataSource(dataSourceId);
    }

    private void invalidateColumnMappings(DataSourceConfig config) {
        cache.invalidateColumnMappings(config.getTableName(), config.getSchemaName());
    }

    private static boolean sameTable(DataSourceConfig a, DataSourceConfig b) {
        return a.qualifiedTableName().equals(b.qualifiedTableName());
    }

    private QueryResult route(AnalyticsQueryParams params, SecurityContext context) {
        if (params.hasMultipleSeries()) {
            return executor.executeMultipleSeries(params, context);
        }
        if (params.hasPeriodComparison()) {
            return executor.executePeriodComparison(params, context);
        }
        return executor.executeCore(params, context);
    }

    private QueryFilter sanitize(QueryFilter filter) {
        FilterOperator operator = validator.validateOperator(filter.operatorOrDefault());
        return sanitizer.sanitizeFilter(filter, operator);
    }

    private List<QueryFilter> sanitizeCallerFilters(List<QueryFilter> filters) {
        if (filters == null) {
            return List.of();
        }
        List<QueryFilter> sanitized = new ArrayList<>(filters.size());
        for (QueryFilter filter : filters) {
            sanitized.add(sanitize(filter));
        }
        return sanitized;
    }
}
