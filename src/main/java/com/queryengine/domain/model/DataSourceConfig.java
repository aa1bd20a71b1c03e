package com.queryengine.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Authoritative description of a queryable analytics table.
 *
 * Loaded from the metadata store and cached with a long TTL.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataSourceConfig {

    private Integer dataSourceId;
    private String schemaName;
    private String tableName;

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private Set<String> allowedFields = Set.of();

    // Optional per-field restriction on top of the global whitelist
    private Map<String, Set<FilterOperator>> allowedOperatorsPerField;

    @Builder.Default
    private List<ColumnDefinition> columns = List.of();

    public String qualifiedTableName() {
        return schemaName + "." + tableName;
    }
}
