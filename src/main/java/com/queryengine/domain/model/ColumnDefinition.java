package com.queryengine.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Column metadata of a data source table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnDefinition {

    private String columnName;
    private String dataType;
    private boolean filterable;
    private boolean dateField;
    private boolean timePeriod;
    private boolean measure;
    private boolean measureType;

    // null means any whitelisted operator
    private Set<FilterOperator> allowedOperators;
}
