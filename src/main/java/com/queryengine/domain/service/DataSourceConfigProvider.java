package com.queryengine.domain.service;

import com.queryengine.domain.model.DataSourceConfig;

import java.util.Optional;

/**
 * Source of truth for data source descriptions. Read-only from the engine's side.
 */
public interface DataSourceConfigProvider {

    Optional<DataSourceConfig> findById(int dataSourceId);
}
