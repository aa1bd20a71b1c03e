package com.queryengine.infrastructure.persistence;

import com.queryengine.domain.model.ColumnDefinition;
import com.queryengine.domain.model.ColumnMappings;
import com.queryengine.domain.model.DataSourceConfig;
import com.queryengine.domain.model.FilterOperator;
import com.queryengine.domain.service.DataSourceConfigProvider;
import com.queryengine.infrastructure.persistence.entity.DataSourceColumnEntity;
import com.queryengine.infrastructure.persistence.entity.DataSourceEntity;
import com.queryengine.infrastructure.persistence.repository.DataSourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reads data source descriptions from the chart metadata tables.
 *
 * A column is filterable when it is flagged filterable or plays the date,
 * time-period or measure-name role; those are the columns the engine itself
 * filters on.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaDataSourceConfigProvider implements DataSourceConfigProvider {

    private final DataSourceRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<DataSourceConfig> findById(int dataSourceId) {
        return repository.findById(dataSourceId).map(JpaDataSourceConfigProvider::toConfig);
    }

    static DataSourceConfig toConfig(DataSourceEntity entity) {
        List<ColumnDefinition> columns = entity.getColumns().stream()
                .map(JpaDataSourceConfigProvider::toColumn)
                .toList();

        Set<String> allowedFields = new HashSet<>();
        Map<String, Set<FilterOperator>> operatorsPerField = new HashMap<>();
        for (ColumnDefinition column : columns) {
            if (column.isFilterable() || column.isDateField() || column.isTimePeriod()
                    || ColumnMappings.MEASURE_FIELD.equals(column.getColumnName())) {
                allowedFields.add(column.getColumnName());
            }
            if (column.getAllowedOperators() != null) {
                operatorsPerField.put(column.getColumnName(), column.getAllowedOperators());
            }
        }

        return DataSourceConfig.builder()
                .dataSourceId(entity.getDataSourceId())
                .schemaName(entity.getSchemaName())
                .tableName(entity.getTableName())
                .active(entity.isActive())
                .allowedFields(Set.copyOf(allowedFields))
                .allowedOperatorsPerField(operatorsPerField.isEmpty() ? null : Map.copyOf(operatorsPerField))
                .columns(columns)
                .build();
    }

    private static ColumnDefinition toColumn(DataSourceColumnEntity entity) {
        return ColumnDefinition.builder()
                .columnName(entity.getColumnName())
                .dataType(entity.getDataType())
                .filterable(entity.isFilterable())
                .dateField(entity.isDateField())
                .timePeriod(entity.isTimePeriod())
                .measure(entity.isMeasure())
                .measureType(entity.isMeasureType())
                .allowedOperators(parseOperators(entity.getColumnName(), entity.getAllowedOperators()))
                .build();
    }

    private static Set<FilterOperator> parseOperators(String columnName, String codes) {
        if (codes == null || codes.isBlank()) {
            return null;
        }
        Set<FilterOperator> operators = EnumSet.noneOf(FilterOperator.class);
        for (String code : codes.split(",")) {
            Optional<FilterOperator> operator = FilterOperator.fromCode(code.trim());
            if (operator.isPresent()) {
                operators.add(operator.get());
            } else {
                // Unknown codes narrow the whitelist, they never widen it
                log.warn("Ignoring unknown operator '{}' configured on column {}", code.trim(), columnName);
            }
        }
        return operators;
    }
}
