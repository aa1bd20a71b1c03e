package com.queryengine.infrastructure.cache;

import com.queryengine.config.QueryEngineProperties;
import com.queryengine.domain.model.AnalyticsQueryParams;
import com.queryengine.domain.model.ColumnMappings;
import com.queryengine.domain.model.DataSourceConfig;
import com.queryengine.domain.model.QueryResult;
import com.queryengine.domain.model.SecurityContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Typed cache for the engine's two resources.
 *
 * Caching Strategy:
 * - Query results: short TTL (minutes), the underlying tables refresh periodically.
 *   Keys are bound to the security context, see {@link CacheKeyGenerator}.
 * - Column mappings and data source configs: long TTL (an hour or more),
 *   schema structure rarely changes.
 *
 * Failures degrade through {@link QueryCacheService}: a failed read is a miss,
 * a failed write is logged and dropped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsCache {

    private final QueryCacheService cacheService;
    private final CacheKeyGenerator keyGenerator;
    private final QueryEngineProperties properties;

    public Optional<QueryResult> getQueryResult(AnalyticsQueryParams params, SecurityContext context) {
        return cacheService.get(keyGenerator.resultKey(params, context), QueryResult.class);
    }

    public void setQueryResult(AnalyticsQueryParams params, SecurityContext context, QueryResult result) {
        setQueryResult(params, context, result, properties.getCache().getResultTtlSeconds());
    }

    public void setQueryResult(AnalyticsQueryParams params, SecurityContext context, QueryResult result, long ttlSeconds) {
        cacheService.set(keyGenerator.resultKey(params, context), result, ttlSeconds);
    }

    public Optional<ColumnMappings> getColumnMappings(String table, String schema) {
        return cacheService.get(keyGenerator.columnMappingsKey(table, schema), ColumnMappings.class);
    }

    public void setColumnMappings(String table, String schema, ColumnMappings mappings) {
        cacheService.set(keyGenerator.columnMappingsKey(table, schema), mappings,
                properties.getCache().getColumnMappingTtlSeconds());
    }

    public Optional<DataSourceConfig> getDataSourceConfig(int dataSourceId) {
        return cacheService.get(keyGenerator.dataSourceConfigKey(dataSourceId), DataSourceConfig.class);
    }

    public void setDataSourceConfig(int dataSourceId, DataSourceConfig config) {
        cacheService.set(keyGenerator.dataSourceConfigKey(dataSourceId), config,
                properties.getCache().getConfigTtlSeconds());
    }

    /**
     * Drops every cached result for the data source and its cached config.
     *
     * @return number of result entries removed
     */
    public long invalidateDataSource(int dataSourceId) {
        long removed = cacheService.invalidateMatching(keyGenerator.resultPattern(dataSourceId));
        cacheService.invalidate(keyGenerator.dataSourceConfigKey(dataSourceId));
        log.info("Invalidated data source {} ({} cached results)", dataSourceId, removed);
        return removed;
    }

    public void invalidateColumnMappings(String table, String schema) {
        cacheService.invalidate(keyGenerator.columnMappingsKey(table, schema));
    }
}
