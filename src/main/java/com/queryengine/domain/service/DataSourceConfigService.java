package com.queryengine.domain.service;

import com.queryengine.domain.exception.SecurityViolationException;
import com.queryengine.domain.model.DataSourceConfig;
import com.queryengine.infrastructure.cache.AnalyticsCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Resolves a data source id to its configuration, cached with a long TTL.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DataSourceConfigService {

    private final DataSourceConfigProvider provider;
    private final AnalyticsCache cache;

    /**
     * @throws SecurityViolationException when the id is unknown or the source is inactive
     */
    public DataSourceConfig getConfig(int dataSourceId) {
        Optional<DataSourceConfig> cached = cache.getDataSourceConfig(dataSourceId);
        if (cached.isPresent()) {
            return requireActive(cached.get());
        }

        DataSourceConfig config = provider.findById(dataSourceId)
                .orElseThrow(() -> new SecurityViolationException("dataSourceId", "unknown data source"));

        cache.setDataSourceConfig(dataSourceId, config);
        return requireActive(config);
    }

    /**
     * Uncached lookup, used when invalidating so stale cached metadata is not trusted.
     */
    public Optional<DataSourceConfig> findFresh(int dataSourceId) {
        return provider.findById(dataSourceId);
    }

    private DataSourceConfig requireActive(DataSourceConfig config) {
        if (!config.isActive()) {
            log.warn("Query against inactive data source {}", config.getDataSourceId());
            throw new SecurityViolationException("dataSourceId", "data source is inactive");
        }
        return config;
    }
}
