package com.queryengine.domain.service;

import com.queryengine.domain.exception.QueryValidationException;
import com.queryengine.domain.model.ColumnDefinition;
import com.queryengine.domain.model.ColumnMappings;
import com.queryengine.domain.model.DataSourceConfig;
import com.queryengine.infrastructure.cache.AnalyticsCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Resolves which physical columns play the date, time-period, value and type
 * roles for a table, so query building stays table-agnostic.
 *
 * Mappings are derived once per (schema, table) and kept in the long-TTL cache.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ColumnMappingService {

    static final String DEFAULT_DATE_FIELD = "date_index";
    static final String DEFAULT_TIME_PERIOD_FIELD = "frequency";
    static final String DEFAULT_MEASURE_VALUE_FIELD = "measure_value";
    static final String DEFAULT_MEASURE_TYPE_FIELD = "measure_type";

    private final AnalyticsCache cache;

    public ColumnMappings getMappings(DataSourceConfig config) {
        Optional<ColumnMappings> cached = cache.getColumnMappings(config.getTableName(), config.getSchemaName());
        if (cached.isPresent()) {
            return cached.get();
        }

        ColumnMappings mappings = resolve(config);
        cache.setColumnMappings(config.getTableName(), config.getSchemaName(), mappings);
        log.debug("Resolved column mappings for {}", config.qualifiedTableName());
        return mappings;
    }

    public ColumnMappings resolve(DataSourceConfig config) {
        List<ColumnDefinition> columns = config.getColumns();
        if (columns == null || columns.isEmpty()) {
            throw new QueryValidationException("table", "data source has no column metadata");
        }

        String timePeriodField = find(columns, ColumnDefinition::isTimePeriod)
                .orElse(DEFAULT_TIME_PERIOD_FIELD);

        // Prefer the conventional date columns over any other date-flagged column
        Predicate<ColumnDefinition> dateCandidate =
                col -> col.isDateField() && !col.getColumnName().equals(timePeriodField);
        String dateField = find(columns, dateCandidate.and(ColumnMappingService::isPreferredDateColumn))
                .or(() -> find(columns, dateCandidate))
                .orElse(DEFAULT_DATE_FIELD);

        String measureValueField = find(columns, ColumnDefinition::isMeasure)
                .orElse(DEFAULT_MEASURE_VALUE_FIELD);
        String measureTypeField = find(columns, ColumnDefinition::isMeasureType)
                .orElse(DEFAULT_MEASURE_TYPE_FIELD);

        return ColumnMappings.builder()
                .dateField(dateField)
                .timePeriodField(timePeriodField)
                .measureValueField(measureValueField)
                .measureTypeField(measureTypeField)
                .allColumns(columns.stream().map(ColumnDefinition::getColumnName).toList())
                .build();
    }

    private static boolean isPreferredDateColumn(ColumnDefinition column) {
        return "date_value".equals(column.getColumnName())
                || "date_index".equals(column.getColumnName())
                || "date".equalsIgnoreCase(column.getDataType());
    }

    private static Optional<String> find(List<ColumnDefinition> columns, Predicate<ColumnDefinition> predicate) {
        return columns.stream()
                .filter(predicate)
                .map(ColumnDefinition::getColumnName)
                .findFirst();
    }
}
